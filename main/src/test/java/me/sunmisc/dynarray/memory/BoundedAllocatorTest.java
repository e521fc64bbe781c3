package me.sunmisc.dynarray.memory;

import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public final class BoundedAllocatorTest {

    @Test
    public void accountsAllocateReallocateFree() {
        final BoundedAllocator allocator = new BoundedAllocator(10);
        final ModifiableMemory<String> memory = allocator.allocate(4);
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(4L));
        final ModifiableMemory<String> grown = allocator.reallocate(memory, 8);
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(8L));
        final ModifiableMemory<String> shrunk = allocator.reallocate(grown, 2);
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(2L));
        allocator.free(shrunk);
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(0L));
    }

    @Test
    public void refusalKeepsAccounting() {
        final BoundedAllocator allocator = new BoundedAllocator(6);
        final ModifiableMemory<Integer> memory = allocator.allocate(4);
        memory.store(0, 42);
        Assertions.assertThrows(OutOfMemoryError.class, () -> allocator.allocate(3));
        Assertions.assertThrows(OutOfMemoryError.class, () -> allocator.reallocate(memory, 8));
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(4L));
        MatcherAssert.assertThat(memory.fetch(0), CoreMatchers.equalTo(42));
        MatcherAssert.assertThat(allocator.allocate(2).length(), CoreMatchers.equalTo(2));
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(allocator.limit()));
    }

    @Test
    public void originRefusalRollsBack() {
        final BoundedAllocator allocator = new BoundedAllocator(
                new Allocator() {
                    @Override
                    public <E> ModifiableMemory<E> allocate(final int length) {
                        throw new OutOfMemoryError("origin");
                    }
                },
                100
        );
        Assertions.assertThrows(OutOfMemoryError.class, () -> allocator.allocate(10));
        MatcherAssert.assertThat(allocator.used(), CoreMatchers.equalTo(0L));
    }

    @Test
    public void rejectsNegativeLimit() {
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> new BoundedAllocator(-1)
        );
    }
}

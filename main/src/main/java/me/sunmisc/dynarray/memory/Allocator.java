package me.sunmisc.dynarray.memory;

/**
 * Source of the memory a dynamic array lives in.
 * Every method may refuse with {@link OutOfMemoryError}, in which case
 * memory passed in stays valid and untouched.
 */
public interface Allocator {

    <E> ModifiableMemory<E> allocate(int length) throws OutOfMemoryError;

    default <E> ModifiableMemory<E> reallocate(final ModifiableMemory<E> memory,
                                               final int length
    ) throws OutOfMemoryError {
        return memory.realloc(length);
    }

    /**
     * Hands memory back once its owner no longer uses it.
     * The heap allocator leaves it to the garbage collector.
     */
    default void free(final ReadableMemory<?> memory) {
    }

    static Allocator heap() {
        return Heap.INSTANCE;
    }

    final class Heap implements Allocator {
        private static final Heap INSTANCE = new Heap();

        private Heap() {}

        @Override
        public <E> ModifiableMemory<E> allocate(final int length) throws OutOfMemoryError {
            return new ArrayMemory<>(length);
        }

        @Override
        public String toString() {
            return "heap";
        }
    }
}

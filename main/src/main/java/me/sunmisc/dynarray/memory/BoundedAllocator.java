package me.sunmisc.dynarray.memory;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Allocator that keeps the total number of live slots handed out
 * through it under a fixed limit. One instance can be shared by several
 * arrays to cap them as a group.
 * <p>
 * A request that would go over the limit is refused with
 * {@link OutOfMemoryError} and leaves the accounting as it was.
 * Shrinking and freeing give slots back. Not thread-safe.
 */
public final class BoundedAllocator implements Allocator {
    private static final Logger LOG = LogManager.getLogger(BoundedAllocator.class);
    private final Allocator origin;
    private final long limit;
    private long used;

    public BoundedAllocator(final long limit) {
        this(Allocator.heap(), limit);
    }

    public BoundedAllocator(@NotNull final Allocator origin, final long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException(String.format(
                    "Slot limit must not be negative: %s", limit
            ));
        }
        this.origin = Objects.requireNonNull(origin);
        this.limit = limit;
    }

    @Override
    public <E> ModifiableMemory<E> allocate(final int length) throws OutOfMemoryError {
        reserve(length);
        try {
            return this.origin.allocate(length);
        } catch (final OutOfMemoryError e) {
            this.used -= length;
            throw e;
        }
    }

    @Override
    public <E> ModifiableMemory<E> reallocate(final ModifiableMemory<E> memory,
                                              final int length
    ) throws OutOfMemoryError {
        final long delta = (long) length - memory.length();
        if (delta > 0) {
            reserve(delta);
        }
        final ModifiableMemory<E> next;
        try {
            next = this.origin.reallocate(memory, length);
        } catch (final OutOfMemoryError e) {
            if (delta > 0) {
                this.used -= delta;
            }
            throw e;
        }
        if (delta < 0) {
            this.used += delta;
        }
        return next;
    }

    @Override
    public void free(final ReadableMemory<?> memory) {
        this.used -= memory.length();
        this.origin.free(memory);
    }

    public long used() {
        return this.used;
    }

    public long limit() {
        return this.limit;
    }

    private void reserve(final long slots) {
        final long next = this.used + slots;
        if (next > this.limit) {
            LOG.debug("Refused {} slots, {} of {} in use", slots, this.used, this.limit);
            throw new OutOfMemoryError(String.format(
                    "Slot limit exceeded: requested %s, in use %s, limit %s",
                    slots, this.used, this.limit
            ));
        }
        this.used = next;
    }

    @Override
    public String toString() {
        return String.format("bounded(%s/%s over %s)", this.used, this.limit, this.origin);
    }
}

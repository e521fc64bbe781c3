package me.sunmisc.dynarray;

import me.sunmisc.dynarray.cursor.Cursor;
import me.sunmisc.dynarray.memory.Allocator;
import me.sunmisc.dynarray.memory.ModifiableMemory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * A growable and shrinkable contiguous sequence with a capacity floor.
 * <p>
 * The capacity starts at the initial capacity, which is also the floor
 * below which it never shrinks. When an insertion finds the array full
 * the capacity doubles, and when a removal leaves exactly half of it in
 * use it halves again, unless it is already at the floor. So the
 * capacity is always {@code minCapacity * 2^k}.
 * <p>
 * Failures do not throw. An index outside the valid range, a removal
 * from an empty array or a refused allocation sets the error latch
 * ({@link #error()}) instead. The latch is sticky: while it is not
 * {@link ArrayError#OK} every mutating operation and {@link #getAt}
 * does nothing, so the caller may check it after a batch of calls
 * rather than after each one. The array never resets it, only
 * {@link #clearError()} does. {@link #size()}, {@link #capacity()} and
 * {@link #error()} are always available.
 * <p>
 * An operation that sets the latch leaves the contents, size and
 * capacity as they were. The exception is a refused shrink in
 * {@link #removeLast()} and {@link #removeAt(int)}: the element is
 * removed anyway and the capacity stays at twice the new size.
 * <p>
 * Elements are stored by reference, {@code null} is allowed.
 * This class is not thread-safe.
 *
 * @author Sunmisc Unsafe
 * @param <E> the type of elements in this array
 */
public class DynamicArray<E> implements Iterable<E>, AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(DynamicArray.class);
    // same soft limit as java.util.ArrayList, some VMs reserve header words
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
    private final Allocator allocator;
    private final int minCapacity;
    private ModifiableMemory<E> memory;
    private int capacity;
    private int size;
    private ArrayError error = ArrayError.OK;
    private boolean released;

    public DynamicArray(final int initCapacity) {
        this(initCapacity, Allocator.heap());
    }

    /**
     * @param initCapacity initial and minimum capacity, at least 1
     * @param allocator where the backing memory comes from
     * @throws IllegalArgumentException if {@code initCapacity < 1}
     */
    public DynamicArray(final int initCapacity, @NotNull final Allocator allocator) {
        if (initCapacity < 1 || initCapacity > MAX_CAPACITY) {
            throw new IllegalArgumentException(String.format(
                    "Initial capacity must be in [1, %s]: %s",
                    MAX_CAPACITY, initCapacity
            ));
        }
        this.allocator = Objects.requireNonNull(allocator);
        this.minCapacity = initCapacity;
        try {
            this.memory = allocator.allocate(initCapacity);
            this.capacity = initCapacity;
        } catch (final OutOfMemoryError e) {
            // nothing to fall back on, the instance stays unusable
            latch(ArrayError.OUT_OF_MEMORY, "init", initCapacity);
        }
    }

    public void append(final E value) {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return;
        }
        if (this.size == this.capacity && !grow("append")) {
            return;
        }
        this.memory.store(this.size++, value);
    }

    /**
     * Inserts at {@code index} in {@code [0, size]}, shifting the
     * elements from {@code index} on one slot to the right.
     */
    public void insertAt(final int index, final E value) {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return;
        }
        final int n = this.size;
        if (index < 0 || index > n) {
            latch(ArrayError.OUT_OF_BOUNDS, "insertAt", index);
            return;
        }
        if (n == this.capacity && !grow("insertAt")) {
            return;
        }
        final ModifiableMemory<E> es = this.memory;
        es.move(index, index + 1, n - index);
        es.store(index, value);
        this.size = n + 1;
    }

    public void setAt(final int index, final E value) {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return;
        }
        if (index < 0 || index >= this.size) {
            latch(ArrayError.OUT_OF_BOUNDS, "setAt", index);
            return;
        }
        this.memory.store(index, value);
    }

    /**
     * @return the element at {@code index}, or {@code null} if the latch
     * is set or becomes set because the index is out of range
     */
    @Nullable
    public E getAt(final int index) {
        return getAt(index, null);
    }

    /**
     * Same as {@link #getAt(int)}, but produces {@code fallback} where no
     * element can be read. Useful when {@code null} is a legal element.
     */
    public E getAt(final int index, final E fallback) {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return fallback;
        }
        if (index < 0 || index >= this.size) {
            latch(ArrayError.OUT_OF_BOUNDS, "getAt", index);
            return fallback;
        }
        return this.memory.fetch(index);
    }

    public void removeLast() {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return;
        }
        final int n = this.size;
        if (n == 0) {
            latch(ArrayError.OUT_OF_BOUNDS, "removeLast", n);
            return;
        }
        final int last = n - 1;
        // help gc
        this.memory.store(last, null);
        this.size = last;
        shrinkIfHalfEmpty("removeLast");
    }

    /**
     * Removes the element at {@code index} in {@code [0, size)}, shifting
     * the elements after it one slot to the left.
     */
    public void removeAt(final int index) {
        ensureLive();
        if (this.error != ArrayError.OK) {
            return;
        }
        final int n = this.size;
        if (index < 0 || index >= n) {
            latch(ArrayError.OUT_OF_BOUNDS, "removeAt", index);
            return;
        }
        final int last = n - 1;
        final ModifiableMemory<E> es = this.memory;
        es.move(index + 1, index, last - index);
        es.store(last, null);
        this.size = last;
        shrinkIfHalfEmpty("removeAt");
    }

    public int size() {
        return this.size;
    }

    public boolean isEmpty() {
        return this.size == 0;
    }

    public int capacity() {
        return this.capacity;
    }

    public int minCapacity() {
        return this.minCapacity;
    }

    public ArrayError error() {
        return this.error;
    }

    /**
     * Resets the latch to {@link ArrayError#OK}. Has no effect when the
     * array has no memory to work with, that is when the initial
     * allocation failed or after {@link #release()}.
     *
     * @return whether the latch reads {@code OK} now
     */
    public boolean clearError() {
        if (this.memory != null) {
            this.error = ArrayError.OK;
        }
        return this.error == ArrayError.OK;
    }

    /**
     * Gives the backing memory back to the allocator. Size, capacity and
     * the latch keep their values, but any further access other than
     * the read-only accessors fails with {@link IllegalStateException}.
     * Releasing twice is harmless.
     */
    public void release() {
        final ModifiableMemory<E> es = this.memory;
        this.released = true;
        if (es != null) {
            this.memory = null;
            this.allocator.free(es);
        }
    }

    @Override
    public void close() {
        release();
    }

    /**
     * @return a cursor over the current elements; it does not see
     * changes made to the array after a resize
     */
    public Cursor<E> origin() {
        final ModifiableMemory<E> es = this.memory;
        return es == null ? Cursor.empty() : Cursor.over(es, this.size);
    }

    @Override
    public Iterator<E> iterator() {
        return new Cursor.CursorAsIterator<>(origin());
    }

    @Override
    public void forEach(final Consumer<? super E> action) {
        Objects.requireNonNull(action);
        origin().forEach(action);
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(
                ", ", "[", "]");
        forEach(x -> joiner.add(Objects.toString(x)));
        return joiner.toString();
    }

    private boolean grow(final String operation) {
        final int n = this.capacity;
        if (n > MAX_CAPACITY >> 1) {
            latch(ArrayError.OUT_OF_MEMORY, operation, n);
            return false;
        }
        return resize(n << 1, operation);
    }

    // the element is already gone when the shrink is refused, see class doc
    private void shrinkIfHalfEmpty(final String operation) {
        final int n = this.capacity;
        if (this.size == n >> 1 && n != this.minCapacity) {
            resize(n >> 1, operation);
        }
    }

    private boolean resize(final int newCapacity, final String operation) {
        try {
            this.memory = this.allocator.reallocate(this.memory, newCapacity);
        } catch (final OutOfMemoryError e) {
            latch(ArrayError.OUT_OF_MEMORY, operation, newCapacity);
            return false;
        }
        LOG.trace("{}: capacity {} -> {}, size={}",
                operation, this.capacity, newCapacity, this.size);
        this.capacity = newCapacity;
        return true;
    }

    private void latch(final ArrayError cause,
                       final String operation,
                       final int argument) {
        this.error = cause;
        LOG.debug("{}({}) latched {}, size={}, capacity={}",
                operation, argument, cause, this.size, this.capacity);
    }

    private void ensureLive() {
        if (this.released) {
            throw new IllegalStateException("Array has been released");
        }
    }
}

package me.sunmisc.dynarray.memory;

public interface ModifiableMemory<E> extends ReadableMemory<E> {

    void store(int index, E value) throws IndexOutOfBoundsException;

    /**
     * Copies {@code count} slots starting at {@code from} to the block
     * starting at {@code to}. The two blocks may overlap, the result is
     * as if the source block was first copied to a temporary buffer.
     */
    default void move(final int from,
                      final int to,
                      final int count
    ) throws IndexOutOfBoundsException {
        if (to > from) {
            // tail first, otherwise we would overwrite what is not yet copied
            for (int i = count - 1; i >= 0; --i) {
                store(to + i, fetch(from + i));
            }
        } else {
            for (int i = 0; i < count; ++i) {
                store(to + i, fetch(from + i));
            }
        }
    }

    /**
     * Returns new memory of the given length holding the common prefix
     * of this one. This memory stays valid and unchanged, also when the
     * call fails.
     */
    ModifiableMemory<E> realloc(int size) throws OutOfMemoryError;
}

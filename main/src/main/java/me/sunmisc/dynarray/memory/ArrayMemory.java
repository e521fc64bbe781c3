package me.sunmisc.dynarray.memory;

import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;

@SuppressWarnings("unchecked")
public final class ArrayMemory<E> implements ModifiableMemory<E> {
    private final E[] array;

    public ArrayMemory(final int size) {
        this((E[]) new Object[size]);
    }
    private ArrayMemory(final E[] array) {
        this.array = array;
    }

    @Override
    public int length() {
        return this.array.length;
    }

    @Override
    public E fetch(final int index) {
        return this.array[index];
    }

    @Override
    public void store(final int index, final E value) {
        this.array[index] = value;
    }

    @Override
    public void move(final int from, final int to, final int count) {
        System.arraycopy(this.array, from, this.array, to, count);
    }

    @Override
    public ModifiableMemory<E> realloc(final int size) throws OutOfMemoryError {
        return new ArrayMemory<>(Arrays.copyOf(this.array, size));
    }

    @Override
    public String toString() {
        final StringJoiner joiner = new StringJoiner(
                ", ", "[", "]");
        for (final E e : this.array) {
            joiner.add(Objects.toString(e));
        }
        return joiner.toString();
    }
}

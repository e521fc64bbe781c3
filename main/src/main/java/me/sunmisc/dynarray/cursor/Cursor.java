package me.sunmisc.dynarray.cursor;

import me.sunmisc.dynarray.memory.ReadableMemory;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Consumer;

public interface Cursor<E> {

    Cursor<?> EMPTY = new Cursor<>() {
        @Override
        public boolean exists() {
            return false;
        }

        @Override
        public Cursor<Object> next() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Object element() {
            throw new NoSuchElementException();
        }
    };

    boolean exists();

    E element();

    Cursor<E> next();

    default void forEach(final Consumer<? super E> action) {
        for (Cursor<E> cursor = this; cursor.exists(); cursor = cursor.next()) {
            action.accept(cursor.element());
        }
    }

    @SuppressWarnings("unchecked")
    static <E> Cursor<E> empty() {
        return (Cursor<E>) EMPTY;
    }

    /**
     * Cursor over the first {@code bound} slots of the memory.
     * Reads are lazy, the element is fetched when asked for.
     */
    static <E> Cursor<E> over(final ReadableMemory<E> memory, final int bound) {
        return bound > 0
                ? new MemoryCursor<>(0, bound, memory)
                : empty();
    }

    record MemoryCursor<E>(
            int index,
            int bound,
            ReadableMemory<E> memory
    ) implements Cursor<E> {

        @Override
        public boolean exists() {
            return true;
        }

        @Override
        public E element() {
            return this.memory.fetch(this.index);
        }

        @Override
        public Cursor<E> next() {
            final int nextIndex = this.index + 1;
            return nextIndex < this.bound
                    ? new MemoryCursor<>(nextIndex, this.bound, this.memory)
                    : empty();
        }
    }

    final class CursorAsIterator<E> implements Iterator<E> {
        private Cursor<E> cursor;

        public CursorAsIterator(final Cursor<E> origin) {
            this.cursor = origin;
        }

        @Override
        public boolean hasNext() {
            return this.cursor.exists();
        }

        @Override
        public E next() {
            final Cursor<E> prev = this.cursor;
            if (!prev.exists()) {
                throw new NoSuchElementException();
            }
            this.cursor = prev.next();
            return prev.element();
        }
    }
}

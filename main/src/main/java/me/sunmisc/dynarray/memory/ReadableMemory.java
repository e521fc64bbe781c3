package me.sunmisc.dynarray.memory;

public interface ReadableMemory<E> {

    E fetch(int index) throws IndexOutOfBoundsException;

    int length();
}

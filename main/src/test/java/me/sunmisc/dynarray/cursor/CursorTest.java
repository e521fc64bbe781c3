package me.sunmisc.dynarray.cursor;

import me.sunmisc.dynarray.memory.ArrayMemory;
import me.sunmisc.dynarray.memory.ModifiableMemory;
import org.hamcrest.CoreMatchers;
import org.hamcrest.MatcherAssert;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

public final class CursorTest {

    @Test
    public void stopsAtBound() {
        final ModifiableMemory<String> memory = new ArrayMemory<>(4);
        memory.store(0, "a");
        memory.store(1, "b");
        memory.store(2, "c");
        final List<String> visited = new ArrayList<>();
        Cursor.over(memory, 2).forEach(visited::add);
        MatcherAssert.assertThat(visited, CoreMatchers.equalTo(List.of("a", "b")));
    }

    @Test
    public void emptyBound() {
        final Cursor<String> cursor = Cursor.over(new ArrayMemory<>(4), 0);
        MatcherAssert.assertThat(cursor.exists(), CoreMatchers.is(false));
        Assertions.assertThrows(NoSuchElementException.class, cursor::element);
    }

    @Test
    public void iteratorExhausts() {
        final ModifiableMemory<Integer> memory = new ArrayMemory<>(1);
        memory.store(0, 5);
        final Iterator<Integer> iterator = new Cursor.CursorAsIterator<>(Cursor.over(memory, 1));
        MatcherAssert.assertThat(iterator.next(), CoreMatchers.equalTo(5));
        MatcherAssert.assertThat(iterator.hasNext(), CoreMatchers.is(false));
        Assertions.assertThrows(NoSuchElementException.class, iterator::next);
    }
}

package com.github.rudygunawan.stash.impl;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ArenaListTest {

    private static <T> List<T> toList(ArenaList<T> list) {
        List<T> values = new ArrayList<>();
        list.forEach(values::add);
        return values;
    }

    @Test
    void testPushFrontOrdersMostRecentFirst() {
        ArenaList<String> list = new ArenaList<>(4);
        list.pushFront("a");
        list.pushFront("b");
        list.pushFront("c");

        assertEquals(List.of("c", "b", "a"), toList(list));
        assertEquals(3, list.size());
        assertEquals("a", list.get(list.back()));
        assertEquals("c", list.get(list.front()));
    }

    @Test
    void testEmptyListBackIsOccupiedSentinel() {
        ArenaList<String> list = new ArenaList<>(0);
        assertEquals(0, list.size());
        assertEquals(ArenaList.OCCUPIED, list.back());
        assertEquals(ArenaList.OCCUPIED, list.front());
        assertFalse(list.iterator().hasNext());
    }

    @Test
    void testIndicesSkipSentinels() {
        ArenaList<String> list = new ArenaList<>(2);
        int first = list.pushFront("a");
        int second = list.pushFront("b");

        assertTrue(first > ArenaList.OCCUPIED);
        assertTrue(second > ArenaList.OCCUPIED);
        assertNotEquals(first, second);
    }

    @Test
    void testMoveToFront() {
        ArenaList<Integer> list = new ArenaList<>(4);
        int one = list.pushFront(1);
        list.pushFront(2);
        list.pushFront(3);

        list.moveToFront(one);
        assertEquals(List.of(1, 3, 2), toList(list));
        assertEquals(2, list.get(list.back()));

        // moving the front is a no-op
        list.moveToFront(one);
        assertEquals(List.of(1, 3, 2), toList(list));
    }

    @Test
    void testRemoveRecyclesCell() {
        ArenaList<String> list = new ArenaList<>(2);
        list.pushFront("a");
        int b = list.pushFront("b");

        assertEquals("b", list.remove(b));
        assertEquals(List.of("a"), toList(list));
        assertEquals(1, list.size());

        int c = list.pushFront("c");
        assertEquals(b, c, "freed cell should be reused");
        assertEquals(List.of("c", "a"), toList(list));
    }

    @Test
    void testGrowsWhenFull() {
        ArenaList<Integer> list = new ArenaList<>(1);
        for (int i = 0; i < 100; i++) {
            list.pushFront(i);
        }
        assertEquals(100, list.size());
        assertEquals(0, list.get(list.back()));
        assertEquals(99, list.get(list.front()));
    }

    @Test
    void testWalkFromFrontWithAfter() {
        ArenaList<String> list = new ArenaList<>(3);
        list.pushFront("x");
        list.pushFront("y");

        List<String> walked = new ArrayList<>();
        for (int i = list.front(); i != ArenaList.OCCUPIED; i = list.after(i)) {
            walked.add(list.get(i));
        }
        assertEquals(List.of("y", "x"), walked);
    }

    @Test
    void testSetReplacesInPlace() {
        ArenaList<String> list = new ArenaList<>(2);
        int a = list.pushFront("a");
        list.pushFront("b");

        assertEquals("a", list.set(a, "A"));
        assertEquals(List.of("b", "A"), toList(list));
    }

    @Test
    void testInvalidIndexRejected() {
        ArenaList<String> list = new ArenaList<>(2);
        int a = list.pushFront("a");
        list.remove(a);

        assertThrows(IllegalArgumentException.class, () -> list.get(a));
        assertThrows(IllegalArgumentException.class, () -> list.moveToFront(a));
        assertThrows(IllegalArgumentException.class, () -> list.remove(a));
        assertThrows(IllegalArgumentException.class, () -> list.get(ArenaList.FREE));
        assertThrows(IllegalArgumentException.class, () -> list.get(ArenaList.OCCUPIED));
        assertThrows(IllegalArgumentException.class, () -> list.get(50));
    }

    @Test
    void testClearEmptiesList() {
        ArenaList<String> list = new ArenaList<>(4);
        list.pushFront("a");
        list.pushFront("b");

        list.clear();
        assertEquals(0, list.size());
        assertEquals(ArenaList.OCCUPIED, list.front());
        assertEquals(List.of(), toList(list));

        list.pushFront("c");
        assertEquals(List.of("c"), toList(list));
    }

    @Test
    void testIteratorExhaustion() {
        ArenaList<String> list = new ArenaList<>(1);
        list.pushFront("only");
        Iterator<String> it = list.iterator();
        assertEquals("only", it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void testRemoveAllThenReuseKeepsListsConsistent() {
        ArenaList<Integer> list = new ArenaList<>(3);
        int[] indices = new int[3];
        for (int i = 0; i < 3; i++) {
            indices[i] = list.pushFront(i);
        }
        list.remove(indices[1]);
        list.remove(indices[0]);
        list.remove(indices[2]);
        assertEquals(0, list.size());
        assertEquals(ArenaList.OCCUPIED, list.back());

        // freed cells come back most recently freed first
        assertEquals(indices[2], list.pushFront(10));
        assertEquals(indices[0], list.pushFront(11));
        assertEquals(indices[1], list.pushFront(12));
        assertEquals(List.of(12, 11, 10), toList(list));
    }
}

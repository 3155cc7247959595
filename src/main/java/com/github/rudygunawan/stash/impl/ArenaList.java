package com.github.rudygunawan.stash.impl;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A doubly linked list stored in flat arrays and addressed by stable integer indices.
 *
 * <p>Cells live in three parallel arrays ({@code values}, {@code next}, {@code prev}). Two
 * reserved cells anchor two disjoint circular lists: cell {@value #FREE} heads the list of free
 * cells and cell {@value #OCCUPIED} heads the list of live cells. Every other cell is on exactly
 * one of the two lists, so removing a value recycles its cell instead of releasing it, and a
 * recency update never allocates.
 *
 * <p>The front of the occupied list is the most recently used value and {@link #back()} the least
 * recently used one. All operations except growth are O(1).
 *
 * @param <T> the type of the stored values
 */
final class ArenaList<T> implements Iterable<T> {

    static final int FREE = 0;
    static final int OCCUPIED = 1;

    private static final int SENTINELS = 2;
    private static final int MIN_GROWTH = 4;

    private Object[] values;
    private int[] next;
    private int[] prev;

    // cells in use, sentinels included
    private int length;
    private int size;

    ArenaList(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        int cells = capacity + SENTINELS;
        this.values = new Object[cells];
        this.next = new int[cells];
        this.prev = new int[cells];
        initSentinels();
    }

    private void initSentinels() {
        next[FREE] = FREE;
        prev[FREE] = FREE;
        next[OCCUPIED] = OCCUPIED;
        prev[OCCUPIED] = OCCUPIED;
        length = SENTINELS;
        size = 0;
    }

    private void unlink(int index) {
        int p = prev[index];
        int n = next[index];
        next[p] = n;
        prev[n] = p;
    }

    private void linkAfter(int index, int after) {
        int n = next[after];
        prev[index] = after;
        next[index] = n;
        next[after] = index;
        prev[n] = index;
    }

    private void checkLive(int index) {
        if (index < SENTINELS || index >= length || values[index] == null) {
            throw new IllegalArgumentException("invalid index: " + index);
        }
    }

    private void grow() {
        int cells = Math.max(values.length * 2, values.length + MIN_GROWTH);
        values = Arrays.copyOf(values, cells);
        next = Arrays.copyOf(next, cells);
        prev = Arrays.copyOf(prev, cells);
    }

    /**
     * Stores {@code value} in a free cell, growing the arrays when none is left, and links it at
     * the front.
     *
     * @return the stable index of the new cell
     */
    int pushFront(T value) {
        Objects.requireNonNull(value, "value cannot be null");
        int index;
        if (next[FREE] == FREE) {
            if (length == values.length) {
                grow();
            }
            index = length++;
        } else {
            index = next[FREE];
            unlink(index);
        }
        values[index] = value;
        linkAfter(index, OCCUPIED);
        size++;
        return index;
    }

    /**
     * Marks the cell at {@code index} as the most recently used.
     */
    void moveToFront(int index) {
        checkLive(index);
        unlink(index);
        linkAfter(index, OCCUPIED);
    }

    /**
     * Unlinks the cell at {@code index}, returns it to the free list and hands back its value.
     */
    @SuppressWarnings("unchecked")
    T remove(int index) {
        checkLive(index);
        unlink(index);
        linkAfter(index, FREE);
        T value = (T) values[index];
        values[index] = null;
        size--;
        return value;
    }

    /**
     * Returns the index of the least recently used cell, or {@link #OCCUPIED} when the list is
     * empty.
     */
    int back() {
        return prev[OCCUPIED];
    }

    /**
     * Returns the index of the most recently used cell, or {@link #OCCUPIED} when the list is
     * empty.
     */
    int front() {
        return next[OCCUPIED];
    }

    /**
     * Returns the index that follows {@code index} towards the back, or {@link #OCCUPIED} past
     * the last cell.
     */
    int after(int index) {
        return next[index];
    }

    @SuppressWarnings("unchecked")
    T get(int index) {
        checkLive(index);
        return (T) values[index];
    }

    /**
     * Replaces the value of a live cell without touching its position.
     *
     * @return the previous value
     */
    @SuppressWarnings("unchecked")
    T set(int index, T value) {
        Objects.requireNonNull(value, "value cannot be null");
        checkLive(index);
        T old = (T) values[index];
        values[index] = value;
        return old;
    }

    /**
     * Drops every value. The arrays keep their size for reuse.
     */
    void clear() {
        Arrays.fill(values, SENTINELS, length, null);
        initSentinels();
    }

    int size() {
        return size;
    }

    /**
     * Iterates the values from the most to the least recently used.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private int cursor = next[OCCUPIED];

            @Override
            public boolean hasNext() {
                return cursor != OCCUPIED;
            }

            @Override
            @SuppressWarnings("unchecked")
            public T next() {
                if (cursor == OCCUPIED) {
                    throw new NoSuchElementException();
                }
                T value = (T) values[cursor];
                cursor = next[cursor];
                return value;
            }
        };
    }
}

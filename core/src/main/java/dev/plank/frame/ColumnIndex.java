/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An open-addressed hash map with linear probing for column name -> position mappings.
 * <p>
 * Grows on demand and supports removal through backward-shift deletion, so no tombstones
 * are left behind when columns are dropped.
 * </p>
 */
final class ColumnIndex {

    static final int ABSENT = -1;

    private String[] keys;
    private int[] values;
    private int mask;
    private int size;

    ColumnIndex(int expectedSize) {
        allocate(tableSizeFor(expectedSize + (expectedSize >> 1) + 1));
    }

    private void allocate(int capacity) {
        this.keys = new String[capacity];
        this.values = new int[capacity];
        this.mask = capacity - 1;
        Arrays.fill(values, ABSENT);
    }

    int size() {
        return size;
    }

    /**
     * Put a key-value pair into the map, replacing any previous value.
     */
    void put(String key, int value) {
        if ((size + 1) * 4 > keys.length * 3) {
            resize(keys.length * 2);
        }
        int index = key.hashCode() & mask;

        while (keys[index] != null) {
            if (keys[index].equals(key)) {
                values[index] = value;
                return;
            }
            index = (index + 1) & mask;
        }

        keys[index] = key;
        values[index] = value;
        size++;
    }

    /**
     * Get the value for a key, or ABSENT (-1) if not found.
     */
    int get(String key) {
        int index = slotOf(key);
        return index < 0 ? ABSENT : values[index];
    }

    boolean containsKey(String key) {
        return slotOf(key) >= 0;
    }

    /**
     * Remove a key, returning its value or ABSENT (-1) if not found.
     */
    int remove(String key) {
        int hole = slotOf(key);
        if (hole < 0) {
            return ABSENT;
        }
        int removed = values[hole];
        keys[hole] = null;
        values[hole] = ABSENT;
        size--;

        // Move later entries of the probe chain into the hole unless their home slot lies
        // cyclically within (hole, next]
        int next = (hole + 1) & mask;
        while (keys[next] != null) {
            int home = keys[next].hashCode() & mask;
            boolean stays = hole <= next
                    ? hole < home && home <= next
                    : hole < home || home <= next;
            if (!stays) {
                keys[hole] = keys[next];
                values[hole] = values[next];
                keys[next] = null;
                values[next] = ABSENT;
                hole = next;
            }
            next = (next + 1) & mask;
        }
        return removed;
    }

    /**
     * Decrement every position greater than {@code removedPosition} by one.
     */
    void shiftDownAfter(int removedPosition) {
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != null && values[i] > removedPosition) {
                values[i]--;
            }
        }
    }

    void clear() {
        allocate(16);
        size = 0;
    }

    ColumnIndex copy() {
        ColumnIndex copy = new ColumnIndex(0);
        copy.keys = keys.clone();
        copy.values = values.clone();
        copy.mask = mask;
        copy.size = size;
        return copy;
    }

    /**
     * Returns the mappings ordered by position.
     */
    Map<String, Integer> toMap() {
        String[] byPosition = new String[size];
        for (int i = 0; i < keys.length; i++) {
            if (keys[i] != null && values[i] >= 0 && values[i] < size) {
                byPosition[values[i]] = keys[i];
            }
        }
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int position = 0; position < byPosition.length; position++) {
            if (byPosition[position] != null) {
                map.put(byPosition[position], position);
            }
        }
        return map;
    }

    private int slotOf(String key) {
        int index = key.hashCode() & mask;

        while (keys[index] != null) {
            if (keys[index].equals(key)) {
                return index;
            }
            index = (index + 1) & mask;
        }

        return ABSENT;
    }

    private void resize(int capacity) {
        String[] oldKeys = keys;
        int[] oldValues = values;
        allocate(capacity);
        size = 0;
        for (int i = 0; i < oldKeys.length; i++) {
            if (oldKeys[i] != null) {
                put(oldKeys[i], oldValues[i]);
            }
        }
    }

    /**
     * Round up to the next power of 2.
     */
    private static int tableSizeFor(int cap) {
        int n = cap - 1;
        n |= n >>> 1;
        n |= n >>> 2;
        n |= n >>> 4;
        n |= n >>> 8;
        n |= n >>> 16;
        return (n < 16) ? 16 : (n >= 1 << 30) ? 1 << 30 : n + 1;
    }
}

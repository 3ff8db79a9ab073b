/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

import java.util.Objects;

import dev.plank.exception.EmptyArrayException;
import dev.plank.exception.IndexOutOfRangeException;
import dev.plank.exception.InvalidTypeException;

/**
 * A named column: a mutable name paired with typed storage.
 * <p>
 * The storage can be mutated in place (rows appended, erased or reordered) but keeps
 * its {@link Kind}; arithmetic returns a new series. A series has no reference to the
 * table holding it.
 * </p>
 *
 * <pre>{@code
 * Series a = Series.ofDoubles("a", 1.5, 2.0, 3.5);
 * Series b = Series.ofLongs("b", 4, 5, 6);
 * Series sum = a.add(b); // "a", Float[5.5, 7.0, 9.5]
 * }</pre>
 */
public final class Series {

    private String name;
    private SeriesData data;

    public Series(String name, SeriesData data) {
        this.name = Objects.requireNonNull(name, "name");
        this.data = Objects.requireNonNull(data, "data");
    }

    public static Series ofLongs(String name, long... values) {
        return new Series(name, SeriesData.ofLongs(values));
    }

    public static Series ofInts(String name, int... values) {
        return new Series(name, SeriesData.ofInts(values));
    }

    public static Series ofDoubles(String name, double... values) {
        return new Series(name, SeriesData.ofDoubles(values));
    }

    public static Series ofBooleans(String name, boolean... values) {
        return new Series(name, SeriesData.ofBooleans(values));
    }

    public static Series ofStrings(String name, String... values) {
        return new Series(name, SeriesData.ofStrings(values));
    }

    public static Series empty(String name, Kind kind) {
        return new Series(name, SeriesData.empty(kind));
    }

    public String name() {
        return name;
    }

    public void rename(String newName) {
        this.name = Objects.requireNonNull(newName, "newName");
    }

    /**
     * Returns a copy of the storage; changes to it do not affect this series.
     */
    public SeriesData data() {
        return data.copy();
    }

    public Kind kind() {
        return data.kind();
    }

    public int length() {
        return data.length();
    }

    public boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Returns an independent deep copy with the same name.
     */
    public Series copy() {
        return new Series(name, data.copy());
    }

    /**
     * Get the value at index.
     *
     * @throws IndexOutOfRangeException if index is negative or not less than the length
     */
    public DType get(int index) throws IndexOutOfRangeException {
        checkIndex(index);
        return data.get(index);
    }

    /**
     * Textual form of the value at index.
     *
     * @throws IndexOutOfRangeException if index is negative or not less than the length
     */
    public String text(int index) throws IndexOutOfRangeException {
        checkIndex(index);
        return data.text(index);
    }

    private void checkIndex(int index) throws IndexOutOfRangeException {
        if (index < 0 || index >= data.length()) {
            throw new IndexOutOfRangeException("Index " + index + " is out of bounds");
        }
    }

    // ==================== Arithmetic ====================

    /**
     * Adds {@code other} elementwise, or concatenates if both series hold text.
     * The result is named after this series.
     *
     * @see Arithmetic
     */
    public Series add(Series other) {
        return new Series(name, Arithmetic.add(data, other.data));
    }

    public Series sub(Series other) {
        return new Series(name, Arithmetic.sub(data, other.data));
    }

    public Series mul(Series other) {
        return new Series(name, Arithmetic.mul(data, other.data));
    }

    public Series div(Series other) {
        return new Series(name, Arithmetic.div(data, other.data));
    }

    /**
     * Returns a new series holding this series' values followed by those of {@code other}.
     *
     * @throws InvalidTypeException if the kinds differ
     */
    public Series merge(Series other) throws InvalidTypeException {
        return new Series(name, Arithmetic.merge(data, other.data));
    }

    // ==================== Ordering ====================

    /**
     * Returns the permutation that sorts this series, leaving the series unchanged.
     *
     * @see SeriesData#argsort(boolean)
     */
    public int[] argsort(boolean descending) {
        return data.copy().argsort(descending);
    }

    /**
     * Reorders the values in place, see {@link SeriesData#reorder(int[])}.
     */
    public void reorder(int[] permutation) {
        data.reorder(permutation);
    }

    // ==================== Row mutation ====================

    public void push(DType value) throws InvalidTypeException {
        data.push(value);
    }

    public void erase(int index) throws EmptyArrayException {
        data.erase(index);
    }

    // ==================== Row selection ====================

    /** New series with the values of {@code [begin, end)}. */
    public Series slice(int begin, int end) {
        return new Series(name, data.slice(begin, end));
    }

    /** New series with the values at the given positions. */
    public Series take(int[] positions) {
        return new Series(name, data.take(positions));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Series other)) {
            return false;
        }
        return name.equals(other.name) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, data);
    }

    @Override
    public String toString() {
        return "Series(\"" + name + "\", " + data + ")";
    }
}

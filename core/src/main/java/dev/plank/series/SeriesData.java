/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

import java.util.Arrays;
import java.util.Objects;

import dev.plank.exception.EmptyArrayException;
import dev.plank.exception.InvalidTypeException;

/**
 * Sealed interface for typed column storage backed by growable primitive arrays.
 * <p>
 * Exactly one implementation exists per {@link Kind}:
 * <ul>
 *   <li>{@link IntData} - INT, {@code long} values</li>
 *   <li>{@link FloatData} - FLOAT, {@code double} values</li>
 *   <li>{@link BoolData} - BOOL, {@code boolean} values</li>
 *   <li>{@link StrData} - STR, {@code String} values</li>
 * </ul>
 * The kind of an instance never changes. Operations producing a different kind
 * (such as promoting arithmetic) return a new instance.
 * </p>
 * <p>
 * Index arguments are not validated beyond what the backing arrays enforce; bounds
 * checking with descriptive errors is done by {@link Series} and the table layer.
 * </p>
 */
public sealed interface SeriesData {

    int INITIAL_CAPACITY = 8;

    Kind kind();

    int length();

    default boolean isEmpty() {
        return length() == 0;
    }

    /** Get the value at index, tagged with this storage's kind. */
    DType get(int index);

    /** Textual form of the value at index, as used for rendering. */
    String text(int index);

    /**
     * Appends a value.
     *
     * @throws InvalidTypeException if the value is of a different kind
     */
    void push(DType value) throws InvalidTypeException;

    /**
     * Removes the element at index, shifting all subsequent elements down by one.
     *
     * @throws EmptyArrayException if this storage holds no elements
     */
    void erase(int index) throws EmptyArrayException;

    /** Sorts the elements in place in ascending natural order. */
    void sort();

    /**
     * Sorts the elements in place and returns the permutation that was applied.
     * <p>
     * The permutation is the stable ascending order of the elements, reversed as a
     * whole if {@code descending} is set. Element {@code i} of the result held the
     * value now at position {@code i} before the call.
     * </p>
     */
    int[] argsort(boolean descending);

    /**
     * Reorders the elements in place so that position {@code i} receives the element
     * formerly at {@code permutation[i]}.
     *
     * @throws IllegalArgumentException if the array is not a permutation of {@code [0, length)}
     */
    void reorder(int[] permutation);

    /** Deep copy holding the same elements. */
    SeriesData copy();

    /** New storage holding the elements of {@code [begin, end)}. */
    SeriesData slice(int begin, int end);

    /** New storage holding the elements at the given positions, in the given order. */
    SeriesData take(int[] positions);

    /**
     * New storage holding the elements of this storage followed by those of {@code other}.
     *
     * @throws InvalidTypeException if {@code other} is of a different kind
     */
    SeriesData concat(SeriesData other) throws InvalidTypeException;

    static SeriesData empty(Kind kind) {
        switch (kind) {
            case INT:
                return new IntData(new long[INITIAL_CAPACITY], 0);
            case FLOAT:
                return new FloatData(new double[INITIAL_CAPACITY], 0);
            case BOOL:
                return new BoolData(new boolean[INITIAL_CAPACITY], 0);
            case STR:
                return new StrData(new String[INITIAL_CAPACITY], 0);
            default:
                throw new IllegalArgumentException("Unknown kind: " + kind);
        }
    }

    static IntData ofLongs(long... values) {
        return new IntData(values.clone(), values.length);
    }

    static IntData ofInts(int... values) {
        long[] longs = new long[values.length];
        for (int i = 0; i < values.length; i++) {
            longs[i] = values[i];
        }
        return new IntData(longs, longs.length);
    }

    static FloatData ofDoubles(double... values) {
        return new FloatData(values.clone(), values.length);
    }

    static BoolData ofBooleans(boolean... values) {
        return new BoolData(values.clone(), values.length);
    }

    static StrData ofStrings(String... values) {
        for (String value : values) {
            Objects.requireNonNull(value, "Text columns cannot hold null");
        }
        return new StrData(values.clone(), values.length);
    }

    private static InvalidTypeException kindMismatch(String action, Kind expected, Kind actual) {
        return new InvalidTypeException("Cannot " + action + " " + actual.label() + " to " + expected.label() + " column");
    }

    private static EmptyArrayException emptyErase() {
        return new EmptyArrayException("Cannot erase from an empty column");
    }

    private static int grow(int capacity, int required) {
        return Math.max(Math.max(capacity * 2, INITIAL_CAPACITY), required);
    }

    final class IntData implements SeriesData {

        private long[] values;
        private int size;

        IntData(long[] values, int size) {
            this.values = values;
            this.size = size;
        }

        public long getLong(int index) {
            Objects.checkIndex(index, size);
            return values[index];
        }

        /** Returns a copy of the elements. */
        public long[] toArray() {
            return Arrays.copyOf(values, size);
        }

        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public int length() {
            return size;
        }

        @Override
        public DType get(int index) {
            return DType.of(getLong(index));
        }

        @Override
        public String text(int index) {
            return Long.toString(getLong(index));
        }

        @Override
        public void push(DType value) throws InvalidTypeException {
            if (!(value instanceof DType.IntValue v)) {
                throw SeriesData.kindMismatch("append", Kind.INT, value.kind());
            }
            add(v.value());
        }

        void add(long value) {
            if (size == values.length) {
                values = Arrays.copyOf(values, SeriesData.grow(values.length, size + 1));
            }
            values[size++] = value;
        }

        @Override
        public void erase(int index) throws EmptyArrayException {
            if (size == 0) {
                throw SeriesData.emptyErase();
            }
            Objects.checkIndex(index, size);
            System.arraycopy(values, index + 1, values, index, size - index - 1);
            size--;
        }

        @Override
        public void sort() {
            Arrays.sort(values, 0, size);
        }

        @Override
        public int[] argsort(boolean descending) {
            long[] v = values;
            IndexSort.PositionComparator comparator = (left, right) -> Long.compare(v[left], v[right]);
            int[] permutation = IndexSort.argsort(size, comparator, descending);
            apply(permutation);
            return permutation;
        }

        @Override
        public void reorder(int[] permutation) {
            IndexSort.checkPermutation(permutation, size);
            apply(permutation);
        }

        private void apply(int[] permutation) {
            long[] sorted = new long[Math.max(values.length, INITIAL_CAPACITY)];
            for (int i = 0; i < size; i++) {
                sorted[i] = values[permutation[i]];
            }
            values = sorted;
        }

        @Override
        public IntData copy() {
            return new IntData(values.clone(), size);
        }

        @Override
        public IntData slice(int begin, int end) {
            Objects.checkFromToIndex(begin, end, size);
            return new IntData(Arrays.copyOfRange(values, begin, end), end - begin);
        }

        @Override
        public IntData take(int[] positions) {
            long[] taken = new long[positions.length];
            for (int i = 0; i < positions.length; i++) {
                taken[i] = getLong(positions[i]);
            }
            return new IntData(taken, taken.length);
        }

        @Override
        public IntData concat(SeriesData other) throws InvalidTypeException {
            if (!(other instanceof IntData o)) {
                throw SeriesData.kindMismatch("concatenate", Kind.INT, other.kind());
            }
            long[] joined = Arrays.copyOf(values, size + o.size);
            System.arraycopy(o.values, 0, joined, size, o.size);
            return new IntData(joined, joined.length);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof IntData other)) {
                return false;
            }
            return Arrays.equals(values, 0, size, other.values, 0, other.size);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return "Int" + Arrays.toString(toArray());
        }
    }

    final class FloatData implements SeriesData {

        private double[] values;
        private int size;

        FloatData(double[] values, int size) {
            this.values = values;
            this.size = size;
        }

        public double getDouble(int index) {
            Objects.checkIndex(index, size);
            return values[index];
        }

        /** Returns a copy of the elements. */
        public double[] toArray() {
            return Arrays.copyOf(values, size);
        }

        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public int length() {
            return size;
        }

        @Override
        public DType get(int index) {
            return DType.of(getDouble(index));
        }

        @Override
        public String text(int index) {
            return Double.toString(getDouble(index));
        }

        @Override
        public void push(DType value) throws InvalidTypeException {
            if (!(value instanceof DType.FloatValue v)) {
                throw SeriesData.kindMismatch("append", Kind.FLOAT, value.kind());
            }
            add(v.value());
        }

        void add(double value) {
            if (size == values.length) {
                values = Arrays.copyOf(values, SeriesData.grow(values.length, size + 1));
            }
            values[size++] = value;
        }

        @Override
        public void erase(int index) throws EmptyArrayException {
            if (size == 0) {
                throw SeriesData.emptyErase();
            }
            Objects.checkIndex(index, size);
            System.arraycopy(values, index + 1, values, index, size - index - 1);
            size--;
        }

        @Override
        public void sort() {
            Arrays.sort(values, 0, size);
        }

        @Override
        public int[] argsort(boolean descending) {
            double[] v = values;
            IndexSort.PositionComparator comparator = (left, right) -> Double.compare(v[left], v[right]);
            int[] permutation = IndexSort.argsort(size, comparator, descending);
            apply(permutation);
            return permutation;
        }

        @Override
        public void reorder(int[] permutation) {
            IndexSort.checkPermutation(permutation, size);
            apply(permutation);
        }

        private void apply(int[] permutation) {
            double[] sorted = new double[Math.max(values.length, INITIAL_CAPACITY)];
            for (int i = 0; i < size; i++) {
                sorted[i] = values[permutation[i]];
            }
            values = sorted;
        }

        @Override
        public FloatData copy() {
            return new FloatData(values.clone(), size);
        }

        @Override
        public FloatData slice(int begin, int end) {
            Objects.checkFromToIndex(begin, end, size);
            return new FloatData(Arrays.copyOfRange(values, begin, end), end - begin);
        }

        @Override
        public FloatData take(int[] positions) {
            double[] taken = new double[positions.length];
            for (int i = 0; i < positions.length; i++) {
                taken[i] = getDouble(positions[i]);
            }
            return new FloatData(taken, taken.length);
        }

        @Override
        public FloatData concat(SeriesData other) throws InvalidTypeException {
            if (!(other instanceof FloatData o)) {
                throw SeriesData.kindMismatch("concatenate", Kind.FLOAT, other.kind());
            }
            double[] joined = Arrays.copyOf(values, size + o.size);
            System.arraycopy(o.values, 0, joined, size, o.size);
            return new FloatData(joined, joined.length);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FloatData other)) {
                return false;
            }
            return Arrays.equals(values, 0, size, other.values, 0, other.size);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return "Float" + Arrays.toString(toArray());
        }
    }

    final class BoolData implements SeriesData {

        private boolean[] values;
        private int size;

        BoolData(boolean[] values, int size) {
            this.values = values;
            this.size = size;
        }

        public boolean getBoolean(int index) {
            Objects.checkIndex(index, size);
            return values[index];
        }

        /** Returns a copy of the elements. */
        public boolean[] toArray() {
            return Arrays.copyOf(values, size);
        }

        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public int length() {
            return size;
        }

        @Override
        public DType get(int index) {
            return DType.of(getBoolean(index));
        }

        @Override
        public String text(int index) {
            return Boolean.toString(getBoolean(index));
        }

        @Override
        public void push(DType value) throws InvalidTypeException {
            if (!(value instanceof DType.BoolValue v)) {
                throw SeriesData.kindMismatch("append", Kind.BOOL, value.kind());
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, SeriesData.grow(values.length, size + 1));
            }
            values[size++] = v.value();
        }

        @Override
        public void erase(int index) throws EmptyArrayException {
            if (size == 0) {
                throw SeriesData.emptyErase();
            }
            Objects.checkIndex(index, size);
            System.arraycopy(values, index + 1, values, index, size - index - 1);
            size--;
        }

        @Override
        public void sort() {
            int falses = 0;
            for (int i = 0; i < size; i++) {
                if (!values[i]) {
                    falses++;
                }
            }
            Arrays.fill(values, 0, falses, false);
            Arrays.fill(values, falses, size, true);
        }

        @Override
        public int[] argsort(boolean descending) {
            boolean[] v = values;
            IndexSort.PositionComparator comparator = (left, right) -> Boolean.compare(v[left], v[right]);
            int[] permutation = IndexSort.argsort(size, comparator, descending);
            apply(permutation);
            return permutation;
        }

        @Override
        public void reorder(int[] permutation) {
            IndexSort.checkPermutation(permutation, size);
            apply(permutation);
        }

        private void apply(int[] permutation) {
            boolean[] sorted = new boolean[Math.max(values.length, INITIAL_CAPACITY)];
            for (int i = 0; i < size; i++) {
                sorted[i] = values[permutation[i]];
            }
            values = sorted;
        }

        @Override
        public BoolData copy() {
            return new BoolData(values.clone(), size);
        }

        @Override
        public BoolData slice(int begin, int end) {
            Objects.checkFromToIndex(begin, end, size);
            return new BoolData(Arrays.copyOfRange(values, begin, end), end - begin);
        }

        @Override
        public BoolData take(int[] positions) {
            boolean[] taken = new boolean[positions.length];
            for (int i = 0; i < positions.length; i++) {
                taken[i] = getBoolean(positions[i]);
            }
            return new BoolData(taken, taken.length);
        }

        @Override
        public BoolData concat(SeriesData other) throws InvalidTypeException {
            if (!(other instanceof BoolData o)) {
                throw SeriesData.kindMismatch("concatenate", Kind.BOOL, other.kind());
            }
            boolean[] joined = Arrays.copyOf(values, size + o.size);
            System.arraycopy(o.values, 0, joined, size, o.size);
            return new BoolData(joined, joined.length);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BoolData other)) {
                return false;
            }
            return Arrays.equals(values, 0, size, other.values, 0, other.size);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return "Bool" + Arrays.toString(toArray());
        }
    }

    final class StrData implements SeriesData {

        private String[] values;
        private int size;

        StrData(String[] values, int size) {
            this.values = values;
            this.size = size;
        }

        public String getString(int index) {
            Objects.checkIndex(index, size);
            return values[index];
        }

        /** Returns a copy of the elements. */
        public String[] toArray() {
            return Arrays.copyOf(values, size);
        }

        @Override
        public Kind kind() {
            return Kind.STR;
        }

        @Override
        public int length() {
            return size;
        }

        @Override
        public DType get(int index) {
            return DType.of(getString(index));
        }

        @Override
        public String text(int index) {
            return getString(index);
        }

        @Override
        public void push(DType value) throws InvalidTypeException {
            if (!(value instanceof DType.StrValue v)) {
                throw SeriesData.kindMismatch("append", Kind.STR, value.kind());
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, SeriesData.grow(values.length, size + 1));
            }
            values[size++] = v.value();
        }

        @Override
        public void erase(int index) throws EmptyArrayException {
            if (size == 0) {
                throw SeriesData.emptyErase();
            }
            Objects.checkIndex(index, size);
            System.arraycopy(values, index + 1, values, index, size - index - 1);
            values[--size] = null;
        }

        @Override
        public void sort() {
            Arrays.sort(values, 0, size);
        }

        @Override
        public int[] argsort(boolean descending) {
            String[] v = values;
            IndexSort.PositionComparator comparator = (left, right) -> v[left].compareTo(v[right]);
            int[] permutation = IndexSort.argsort(size, comparator, descending);
            apply(permutation);
            return permutation;
        }

        @Override
        public void reorder(int[] permutation) {
            IndexSort.checkPermutation(permutation, size);
            apply(permutation);
        }

        private void apply(int[] permutation) {
            String[] sorted = new String[Math.max(values.length, INITIAL_CAPACITY)];
            for (int i = 0; i < size; i++) {
                sorted[i] = values[permutation[i]];
            }
            values = sorted;
        }

        @Override
        public StrData copy() {
            return new StrData(values.clone(), size);
        }

        @Override
        public StrData slice(int begin, int end) {
            Objects.checkFromToIndex(begin, end, size);
            return new StrData(Arrays.copyOfRange(values, begin, end), end - begin);
        }

        @Override
        public StrData take(int[] positions) {
            String[] taken = new String[positions.length];
            for (int i = 0; i < positions.length; i++) {
                taken[i] = getString(positions[i]);
            }
            return new StrData(taken, taken.length);
        }

        @Override
        public StrData concat(SeriesData other) throws InvalidTypeException {
            if (!(other instanceof StrData o)) {
                throw SeriesData.kindMismatch("concatenate", Kind.STR, other.kind());
            }
            String[] joined = Arrays.copyOf(values, size + o.size);
            System.arraycopy(o.values, 0, joined, size, o.size);
            return new StrData(joined, joined.length);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof StrData other)) {
                return false;
            }
            return Arrays.equals(values, 0, size, other.values, 0, other.size);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(toArray());
        }

        @Override
        public String toString() {
            return "Str" + Arrays.toString(toArray());
        }
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import dev.plank.PlankSettings;
import dev.plank.exception.ColumnNotFoundException;
import dev.plank.exception.DuplicateColumnException;
import dev.plank.exception.EmptyArrayException;
import dev.plank.exception.InconsistentLengthException;
import dev.plank.exception.IndexOutOfRangeException;
import dev.plank.exception.InvalidTypeException;
import dev.plank.series.DType;
import dev.plank.series.Kind;
import dev.plank.series.Series;

/**
 * An in-memory table: an ordered list of equally long, uniquely named columns.
 * <p>
 * A table owns its columns exclusively. Columns passed in are copied, and columns handed
 * out are copies, so a table can only be changed through its own methods. After every
 * operation the following holds:
 * <ul>
 *   <li>every column has {@link #rowCount()} values</li>
 *   <li>{@link #index()} maps each column name to its position, with no other entries</li>
 *   <li>column names are unique</li>
 * </ul>
 * Operations that fail throw before changing anything.
 * </p>
 *
 * <pre>{@code
 * DataFrame df = DataFrame.of(
 *         Series.ofLongs("id", 3, 1, 2),
 *         Series.ofStrings("name", "c", "a", "b"));
 * df.sort("id");
 * DataFrame top = df.filter("id", Predicates.gt(DType.of(1)));
 * }</pre>
 */
public final class DataFrame {

    private static final System.Logger LOG = System.getLogger(DataFrame.class.getName());

    private final List<Series> columns = new ArrayList<>();
    private ColumnIndex index = new ColumnIndex(0);
    private int rows;

    private DataFrame() {
    }

    /**
     * Creates a table from copies of the given columns.
     *
     * @throws InconsistentLengthException if a column's length differs from the first column's
     * @throws DuplicateColumnException if two columns share a name
     */
    public DataFrame(List<Series> columns) throws InconsistentLengthException, DuplicateColumnException {
        List<Series> copies = new ArrayList<>(columns.size());
        for (Series column : columns) {
            copies.add(column.copy());
        }
        checkLengths(copies);
        for (Series column : copies) {
            if (this.index.containsKey(column.name())) {
                throw new DuplicateColumnException("Duplicate column '" + column.name() + "'");
            }
            this.index.put(column.name(), this.columns.size());
            this.columns.add(column);
        }
        this.rows = copies.isEmpty() ? 0 : copies.get(0).length();
    }

    public static DataFrame of(Series... columns) throws InconsistentLengthException, DuplicateColumnException {
        return new DataFrame(Arrays.asList(columns));
    }

    /**
     * Returns a new table with no columns and no rows.
     */
    public static DataFrame empty() {
        return new DataFrame();
    }

    /**
     * Wraps columns that are already owned by no other table and known to have unique names.
     */
    private static DataFrame owning(List<Series> columns) {
        DataFrame frame = new DataFrame();
        frame.index = new ColumnIndex(columns.size());
        for (Series column : columns) {
            frame.index.put(column.name(), frame.columns.size());
            frame.columns.add(column);
        }
        frame.rows = columns.isEmpty() ? 0 : columns.get(0).length();
        return frame;
    }

    private static void checkLengths(List<Series> columns) throws InconsistentLengthException {
        if (columns.isEmpty()) {
            return;
        }
        int expected = columns.get(0).length();
        for (Series column : columns) {
            if (column.length() != expected) {
                throw new InconsistentLengthException("Column '" + column.name() + "' has " + column.length()
                        + " rows, expected " + expected);
            }
        }
    }

    // ==================== Shape and Schema ====================

    public Shape shape() {
        return new Shape(rows, columns.size());
    }

    public int rowCount() {
        return rows;
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * Returns copies of all columns, in order.
     */
    public List<Series> data() {
        List<Series> copies = new ArrayList<>(columns.size());
        for (Series column : columns) {
            copies.add(column.copy());
        }
        return Collections.unmodifiableList(copies);
    }

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Series column : columns) {
            names.add(column.name());
        }
        return Collections.unmodifiableList(names);
    }

    public List<Kind> kinds() {
        List<Kind> kinds = new ArrayList<>(columns.size());
        for (Series column : columns) {
            kinds.add(column.kind());
        }
        return Collections.unmodifiableList(kinds);
    }

    /**
     * Returns a snapshot of the column name to position mapping, ordered by position.
     */
    public Map<String, Integer> index() {
        return Collections.unmodifiableMap(index.toMap());
    }

    /**
     * Returns the position of the named column.
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public int indexOf(String name) throws ColumnNotFoundException {
        int position = index.get(name);
        if (position == ColumnIndex.ABSENT) {
            throw new ColumnNotFoundException("Column not found: " + name);
        }
        return position;
    }

    // ==================== Column Operations ====================

    /**
     * Appends a copy of the given column. A table without columns takes the row count
     * of its first column.
     *
     * @throws InconsistentLengthException if the column's length differs from the row count
     * @throws DuplicateColumnException if a column of the same name exists
     */
    public void addColumn(Series column) throws InconsistentLengthException, DuplicateColumnException {
        if (!columns.isEmpty() && column.length() != rows) {
            throw new InconsistentLengthException("Column '" + column.name() + "' has " + column.length()
                    + " rows, expected " + rows);
        }
        if (index.containsKey(column.name())) {
            throw new DuplicateColumnException("Duplicate column '" + column.name() + "'");
        }
        if (columns.isEmpty()) {
            rows = column.length();
        }
        index.put(column.name(), columns.size());
        columns.add(column.copy());
    }

    /**
     * Removes the named column; columns after it move one position to the left.
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public void dropColumn(String name) throws ColumnNotFoundException {
        int position = indexOf(name);
        index.remove(name);
        columns.remove(position);
        index.shiftDownAfter(position);
        LOG.log(System.Logger.Level.DEBUG, "Dropped column ''{0}'' at position {1}", name, position);
    }

    /**
     * Renames a column, keeping its position.
     *
     * @throws ColumnNotFoundException if there is no column named {@code oldName}
     * @throws DuplicateColumnException if another column is already named {@code newName}
     */
    public void rename(String oldName, String newName) throws ColumnNotFoundException, DuplicateColumnException {
        int position = indexOf(oldName);
        if (oldName.equals(newName)) {
            return;
        }
        if (index.containsKey(newName)) {
            throw new DuplicateColumnException("Duplicate column '" + newName + "'");
        }
        index.remove(oldName);
        index.put(newName, position);
        columns.get(position).rename(newName);
    }

    /**
     * Returns a copy of the named column.
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public Series column(String name) throws ColumnNotFoundException {
        return columns.get(indexOf(name)).copy();
    }

    /**
     * Returns a new table with copies of the named columns, in the requested order.
     *
     * @throws ColumnNotFoundException if any name does not resolve
     * @throws IllegalArgumentException if a name is requested twice
     */
    public DataFrame selectColumns(String... names) throws ColumnNotFoundException {
        return selectColumns(Arrays.asList(names));
    }

    public DataFrame selectColumns(List<String> names) throws ColumnNotFoundException {
        List<Series> selected = new ArrayList<>(names.size());
        ColumnIndex seen = new ColumnIndex(names.size());
        for (String name : names) {
            if (seen.containsKey(name)) {
                throw new IllegalArgumentException("Column requested twice: " + name);
            }
            seen.put(name, selected.size());
            selected.add(columns.get(indexOf(name)).copy());
        }
        DataFrame frame = owning(selected);
        frame.rows = rows;
        return frame;
    }

    // ==================== Row Operations ====================

    /**
     * Removes a row from every column.
     *
     * @throws IndexOutOfRangeException if {@code row} is not within {@code [0, rowCount())}
     */
    public void dropRow(int row) throws IndexOutOfRangeException {
        checkRow(row);
        for (Series column : columns) {
            try {
                column.erase(row);
            }
            catch (EmptyArrayException e) {
                throw new IllegalStateException("Column '" + column.name() + "' is shorter than the table", e);
            }
        }
        rows--;
    }

    public void addRow(DType... values) throws InconsistentLengthException, InvalidTypeException {
        addRow(Arrays.asList(values));
    }

    /**
     * Appends one value to each column, positionally. All values are checked before any
     * column is changed.
     *
     * @throws InconsistentLengthException if the number of values differs from the column count
     * @throws InvalidTypeException if a value's kind differs from its column's kind
     */
    public void addRow(List<DType> values) throws InconsistentLengthException, InvalidTypeException {
        if (values.size() != columns.size()) {
            throw new InconsistentLengthException("Row has " + values.size() + " values, expected " + columns.size());
        }
        for (int i = 0; i < values.size(); i++) {
            Series column = columns.get(i);
            Kind actual = values.get(i).kind();
            if (actual != column.kind()) {
                throw new InvalidTypeException("Value " + i + " is of kind " + actual.label() + " but column '"
                        + column.name() + "' is of kind " + column.kind().label());
            }
        }
        for (int i = 0; i < values.size(); i++) {
            columns.get(i).push(values.get(i));
        }
        rows++;
    }

    /**
     * Returns a new table with the selected rows of every column.
     * <p>
     * Index selections are sorted first, so rows keep their order from this table.
     * Selecting {@link RowSelection#none()} yields an empty table.
     * </p>
     *
     * @throws IndexOutOfRangeException if the selection reaches outside of {@code [0, rowCount())}
     */
    public DataFrame selectRows(RowSelection selection) throws IndexOutOfRangeException {
        if (selection instanceof RowSelection.Range range) {
            if (range.begin() < 0 || range.end() > rows || range.begin() > range.end()) {
                throw new IndexOutOfRangeException("Row range [" + range.begin() + ", " + range.end()
                        + ") is out of bounds for " + rows + " rows");
            }
            return slice(range.begin(), range.end());
        }
        if (selection instanceof RowSelection.Indices indices) {
            int[] positions = indices.positions();
            Arrays.sort(positions);
            if (positions.length > 0) {
                checkRow(positions[0]);
                checkRow(positions[positions.length - 1]);
            }
            return take(positions);
        }
        return empty();
    }

    public DataFrame selectRange(int begin, int end) throws IndexOutOfRangeException {
        return selectRows(RowSelection.range(begin, end));
    }

    public DataFrame selectIndices(int... positions) throws IndexOutOfRangeException {
        return selectRows(RowSelection.indices(positions));
    }

    /**
     * Returns a new table with the rows whose value in the named column matches the predicate,
     * in their original order.
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public DataFrame filter(String column, Predicate<DType> predicate) throws ColumnNotFoundException {
        Series series = columns.get(indexOf(column));
        int[] matches = new int[rows];
        int count = 0;
        for (int row = 0; row < rows; row++) {
            if (predicate.test(cell(series, row))) {
                matches[count++] = row;
            }
        }
        return take(Arrays.copyOf(matches, count));
    }

    /**
     * Returns the first {@code n} rows, {@code n} clamped to {@code [0, rowCount()]}.
     */
    public DataFrame limit(int n) {
        return slice(0, clamp(n));
    }

    /**
     * Returns the last {@code n} rows, {@code n} clamped to {@code [0, rowCount()]}.
     */
    public DataFrame tail(int n) {
        return slice(rows - clamp(n), rows);
    }

    private int clamp(int n) {
        return Math.max(0, Math.min(n, rows));
    }

    private DataFrame slice(int begin, int end) {
        List<Series> sliced = new ArrayList<>(columns.size());
        for (Series column : columns) {
            sliced.add(column.slice(begin, end));
        }
        DataFrame frame = owning(sliced);
        frame.rows = end - begin;
        return frame;
    }

    private DataFrame take(int[] positions) {
        List<Series> taken = new ArrayList<>(columns.size());
        for (Series column : columns) {
            taken.add(column.take(positions));
        }
        DataFrame frame = owning(taken);
        frame.rows = positions.length;
        return frame;
    }

    // ==================== Sorting ====================

    public void sort(String column) throws ColumnNotFoundException {
        sort(column, false);
    }

    /**
     * Sorts all rows by the named column, in place.
     * <p>
     * The permutation sorting the named column is applied to every column, so rows stay
     * intact. Descending order is the ascending stable order reversed: rows with equal
     * keys end up in reverse of their previous order.
     * </p>
     *
     * @throws ColumnNotFoundException if there is no such column
     */
    public void sort(String column, boolean descending) throws ColumnNotFoundException {
        int[] permutation = columns.get(indexOf(column)).argsort(descending);

        int threshold = PlankSettings.sortParallelThreshold();
        if (threshold > 0 && columns.size() >= threshold) {
            LOG.log(System.Logger.Level.DEBUG, "Reordering {0} columns in parallel by ''{1}''", columns.size(), column);
            columns.parallelStream().forEach(series -> series.reorder(permutation));
        }
        else {
            for (Series series : columns) {
                series.reorder(permutation);
            }
        }
    }

    // ==================== Stacking ====================

    /**
     * Returns a new table with the rows of {@code other} appended below the rows of this table.
     * Columns are matched by name; the result has this table's column order.
     *
     * @throws InconsistentLengthException if the tables have different column counts
     * @throws ColumnNotFoundException if a column of this table is missing in {@code other}
     * @throws InvalidTypeException if matching columns are of different kinds
     */
    public DataFrame vstack(DataFrame other)
            throws InconsistentLengthException, ColumnNotFoundException, InvalidTypeException {
        if (other.columns.size() != columns.size()) {
            throw new InconsistentLengthException("Cannot stack a table of " + other.columns.size()
                    + " columns onto a table of " + columns.size() + " columns");
        }
        List<Series> merged = new ArrayList<>(columns.size());
        for (Series column : columns) {
            Series match = other.columns.get(other.indexOf(column.name()));
            merged.add(column.merge(match));
        }
        checkLengths(merged);
        LOG.log(System.Logger.Level.DEBUG, "Stacked {0} rows onto {1} rows", other.rows, rows);
        return owning(merged);
    }

    /**
     * Returns a new table with all columns of {@code other}, followed by the columns of
     * this table whose names do not occur in {@code other}.
     *
     * @throws InconsistentLengthException if the tables have different row counts
     */
    public DataFrame hstack(DataFrame other) throws InconsistentLengthException {
        List<Series> combined = new ArrayList<>(other.columns.size() + columns.size());
        for (Series column : other.columns) {
            combined.add(column.copy());
        }
        for (Series column : columns) {
            if (other.index.containsKey(column.name())) {
                LOG.log(System.Logger.Level.DEBUG, "Column ''{0}'' replaced by the stacked table", column.name());
            }
            else {
                combined.add(column.copy());
            }
        }
        checkLengths(combined);
        return owning(combined);
    }

    // ==================== Cell Access ====================

    /**
     * Returns the value at the given row of the column at the given position.
     *
     * @throws IndexOutOfRangeException if the column position or the row is out of bounds
     */
    public DType item(int row, int column) throws IndexOutOfRangeException {
        if (column < 0 || column >= columns.size()) {
            throw new IndexOutOfRangeException("Column index " + column + " is out of bounds");
        }
        return columns.get(column).get(row);
    }

    /**
     * Returns the value at the given row of the named column.
     *
     * @throws ColumnNotFoundException if there is no such column
     * @throws IndexOutOfRangeException if the row is out of bounds
     */
    public DType item(int row, String column) throws ColumnNotFoundException, IndexOutOfRangeException {
        return columns.get(indexOf(column)).get(row);
    }

    private void checkRow(int row) throws IndexOutOfRangeException {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfRangeException("Index " + row + " is out of bounds");
        }
    }

    private static DType cell(Series series, int row) {
        try {
            return series.get(row);
        }
        catch (IndexOutOfRangeException e) {
            throw new IllegalStateException("Column '" + series.name() + "' is shorter than the table", e);
        }
    }

    // ==================== Whole Table ====================

    /**
     * Removes all columns and rows.
     */
    public void clear() {
        columns.clear();
        index.clear();
        rows = 0;
    }

    /**
     * Returns a deep copy sharing no state with this table.
     */
    public DataFrame copy() {
        DataFrame copy = new DataFrame();
        for (Series column : columns) {
            copy.columns.add(column.copy());
        }
        copy.index = index.copy();
        copy.rows = rows;
        return copy;
    }

    /**
     * Columns in order, for rendering. Not to be modified.
     */
    List<Series> columns() {
        return Collections.unmodifiableList(columns);
    }

    // ==================== Rendering ====================

    /**
     * Prints the first {@value PlankSettings#DEFAULT_HEAD_ROWS} rows to standard out,
     * or as many as configured through {@value PlankSettings#HEAD_ROWS_PROPERTY}.
     */
    public void head() {
        head(PlankSettings.headRows());
    }

    public void head(int n) {
        head(n, System.out);
    }

    public void head(int n, PrintStream out) {
        FrameFormatter.head(this, n, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataFrame other)) {
            return false;
        }
        return rows == other.rows && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return 31 * rows + columns.hashCode();
    }

    @Override
    public String toString() {
        return FrameFormatter.render(this);
    }
}

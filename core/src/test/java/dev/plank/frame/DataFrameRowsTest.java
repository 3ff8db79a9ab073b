/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.plank.exception.ColumnNotFoundException;
import dev.plank.exception.InconsistentLengthException;
import dev.plank.exception.IndexOutOfRangeException;
import dev.plank.exception.InvalidTypeException;
import dev.plank.series.DType;
import dev.plank.series.Series;

import static dev.plank.frame.FrameAssertions.assertConsistent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for row mutation, row selection and filtering.
 */
public class DataFrameRowsTest {

    private DataFrame df;

    @BeforeEach
    void setUp() throws Exception {
        df = DataFrame.of(
                Series.ofLongs("id", 0, 1, 2, 3, 4),
                Series.ofStrings("name", "zero", "one", "two", "three", "four"),
                Series.ofBooleans("even", true, false, true, false, true));
    }

    // ==================== Drop Row ====================

    @Test
    void testDropRow() throws Exception {
        df.dropRow(1);

        assertThat(df.shape()).isEqualTo(new Shape(4, 3));
        assertThat(df.column("id")).isEqualTo(Series.ofLongs("id", 0, 2, 3, 4));
        assertThat(df.column("name")).isEqualTo(Series.ofStrings("name", "zero", "two", "three", "four"));
        assertConsistent(df);
    }

    @Test
    void testDropRowOutOfBounds() {
        assertThatThrownBy(() -> df.dropRow(5))
                .isInstanceOf(IndexOutOfRangeException.class)
                .hasMessage("Index 5 is out of bounds");
        assertThatThrownBy(() -> df.dropRow(-1))
                .isInstanceOf(IndexOutOfRangeException.class);
        assertThat(df.rowCount()).isEqualTo(5);
    }

    @Test
    void testDropAllRows() throws Exception {
        for (int i = 0; i < 5; i++) {
            df.dropRow(0);
        }

        assertThat(df.shape()).isEqualTo(new Shape(0, 3));
        assertThatThrownBy(() -> df.dropRow(0))
                .isInstanceOf(IndexOutOfRangeException.class);
        assertConsistent(df);
    }

    // ==================== Add Row ====================

    @Test
    void testAddRow() throws Exception {
        df.addRow(DType.of(5), DType.of("five"), DType.of(false));

        assertThat(df.shape()).isEqualTo(new Shape(6, 3));
        assertThat(df.item(5, "name")).isEqualTo(DType.of("five"));
        assertConsistent(df);
    }

    @Test
    void testAddRowWrongValueCount() {
        assertThatThrownBy(() -> df.addRow(DType.of(5), DType.of("five")))
                .isInstanceOf(InconsistentLengthException.class)
                .hasMessageContaining("2 values, expected 3");
    }

    @Test
    void testAddRowKindMismatchChangesNothing() {
        assertThatThrownBy(() -> df.addRow(List.of(DType.of(5), DType.of("five"), DType.of(1))))
                .isInstanceOf(InvalidTypeException.class)
                .hasMessageContaining("'even'");

        assertThat(df.shape()).isEqualTo(new Shape(5, 3));
        assertConsistent(df);
    }

    @Test
    void testAddRowIntoFloatColumnNeedsFloat() throws Exception {
        DataFrame frame = DataFrame.of(Series.ofDoubles("x", 1.0));

        assertThatThrownBy(() -> frame.addRow(DType.of(2)))
                .isInstanceOf(InvalidTypeException.class);
        frame.addRow(DType.of(2.0));
        assertThat(frame.column("x")).isEqualTo(Series.ofDoubles("x", 1.0, 2.0));
    }

    // ==================== Select Rows ====================

    @Test
    void testSelectRange() throws Exception {
        DataFrame selected = df.selectRange(1, 4);

        assertThat(selected.shape()).isEqualTo(new Shape(3, 3));
        assertThat(selected.column("id")).isEqualTo(Series.ofLongs("id", 1, 2, 3));
        assertThat(selected.columnNames()).containsExactly("id", "name", "even");
        assertConsistent(selected);
    }

    @Test
    void testSelectEmptyRange() throws Exception {
        DataFrame selected = df.selectRange(2, 2);

        assertThat(selected.shape()).isEqualTo(new Shape(0, 3));
    }

    @Test
    void testSelectRangeOutOfBounds() {
        assertThatThrownBy(() -> df.selectRange(3, 6))
                .isInstanceOf(IndexOutOfRangeException.class);
        assertThatThrownBy(() -> df.selectRange(-1, 2))
                .isInstanceOf(IndexOutOfRangeException.class);
        assertThatThrownBy(() -> df.selectRange(3, 2))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testSelectIndicesKeepsTableOrder() throws Exception {
        DataFrame selected = df.selectRows(RowSelection.indices(3, 1));

        assertThat(selected.column("id")).isEqualTo(Series.ofLongs("id", 1, 3));
        assertThat(selected.column("name")).isEqualTo(Series.ofStrings("name", "one", "three"));
        assertConsistent(selected);
    }

    @Test
    void testSelectIndicesOutOfBounds() {
        assertThatThrownBy(() -> df.selectIndices(0, 5))
                .isInstanceOf(IndexOutOfRangeException.class)
                .hasMessage("Index 5 is out of bounds");
        assertThatThrownBy(() -> df.selectIndices(-2, 1))
                .isInstanceOf(IndexOutOfRangeException.class);
    }

    @Test
    void testSelectNothingYieldsEmptyTable() throws Exception {
        DataFrame selected = df.selectRows(RowSelection.none());

        assertThat(selected.shape()).isEqualTo(new Shape(0, 0));
        assertThat(selected).isEqualTo(DataFrame.empty());
    }

    @Test
    void testRangeTakesPrecedenceOverIndices() throws Exception {
        RowSelection selection = RowSelection.of(new RowSelection.Range(0, 2), new int[]{ 4 });
        DataFrame selected = df.selectRows(selection);

        assertThat(selected.column("id")).isEqualTo(Series.ofLongs("id", 0, 1));
        assertThat(RowSelection.of(null, new int[]{ 4 })).isEqualTo(RowSelection.indices(4));
        assertThat(RowSelection.of(null, null)).isEqualTo(RowSelection.none());
    }

    @Test
    void testSelectRowsDoesNotAlias() throws Exception {
        DataFrame selected = df.selectRange(0, 5);
        selected.dropRow(0);
        selected.rename("id", "key");

        assertThat(df.rowCount()).isEqualTo(5);
        assertThat(df.columnNames()).containsExactly("id", "name", "even");
    }

    // ==================== Filter ====================

    @Test
    void testFilter() throws Exception {
        DataFrame evens = df.filter("even", Predicates.eq(DType.of(true)));

        assertThat(evens.shape()).isEqualTo(new Shape(3, 3));
        assertThat(evens.column("id")).isEqualTo(Series.ofLongs("id", 0, 2, 4));
        assertConsistent(evens);
    }

    @Test
    void testFilterWithCustomPredicate() throws Exception {
        DataFrame longNames = df.filter("name", cell -> cell.text().length() > 3);

        assertThat(longNames.column("name")).isEqualTo(Series.ofStrings("name", "zero", "three", "four"));
    }

    @Test
    void testFilterComparisons() throws Exception {
        assertThat(df.filter("id", Predicates.gt(DType.of(2))).rowCount()).isEqualTo(2);
        assertThat(df.filter("id", Predicates.ge(DType.of(2))).rowCount()).isEqualTo(3);
        assertThat(df.filter("id", Predicates.lt(DType.of(2))).rowCount()).isEqualTo(2);
        assertThat(df.filter("id", Predicates.le(DType.of(2))).rowCount()).isEqualTo(3);
        assertThat(df.filter("id", Predicates.ne(DType.of(2))).rowCount()).isEqualTo(4);
        // Different kinds never compare
        assertThat(df.filter("id", Predicates.gt(DType.of(-1.0))).rowCount()).isZero();
    }

    @Test
    void testFilterMatchingNothing() throws Exception {
        DataFrame none = df.filter("name", Predicates.eq(DType.of("ten")));

        assertThat(none.shape()).isEqualTo(new Shape(0, 3));
    }

    @Test
    void testFilterMissingColumn() {
        assertThatThrownBy(() -> df.filter("missing", cell -> true))
                .isInstanceOf(ColumnNotFoundException.class);
    }

    // ==================== Limit and Tail ====================

    @Test
    void testLimit() {
        assertThat(df.limit(2).shape()).isEqualTo(new Shape(2, 3));
        assertThat(df.limit(100).shape()).isEqualTo(new Shape(5, 3));
        assertThat(df.limit(-3).shape()).isEqualTo(new Shape(0, 3));
    }

    @Test
    void testTail() throws Exception {
        DataFrame tail = df.tail(2);

        assertThat(tail.column("id")).isEqualTo(Series.ofLongs("id", 3, 4));
        assertThat(df.tail(9)).isEqualTo(df);
        assertThat(df.tail(0).shape()).isEqualTo(new Shape(0, 3));
        assertConsistent(tail);
    }
}

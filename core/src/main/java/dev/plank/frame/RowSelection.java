/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.util.Arrays;

/**
 * Specifies which rows {@link DataFrame#selectRows(RowSelection)} keeps.
 *
 * <pre>{@code
 * RowSelection.range(2, 5)     // rows 2, 3 and 4
 * RowSelection.indices(3, 1)   // rows 1 and 3, in that order
 * RowSelection.none()          // selects nothing, yields an empty table
 * }</pre>
 */
public sealed interface RowSelection {

    /**
     * Half-open row range {@code [begin, end)}.
     */
    record Range(int begin, int end) implements RowSelection {
    }

    /**
     * Arbitrary row positions. They are sorted before use, so the selected rows
     * always keep their order in the source table.
     */
    record Indices(int[] positions) implements RowSelection {

        public Indices {
            positions = positions.clone();
        }

        @Override
        public int[] positions() {
            return positions.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Indices other && Arrays.equals(positions, other.positions);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(positions);
        }

        @Override
        public String toString() {
            return "Indices" + Arrays.toString(positions);
        }
    }

    /**
     * No selector given.
     */
    record None() implements RowSelection {
    }

    static RowSelection range(int begin, int end) {
        return new Range(begin, end);
    }

    static RowSelection indices(int... positions) {
        return new Indices(positions);
    }

    static RowSelection none() {
        return new None();
    }

    /**
     * Builds a selection from two optional selectors. The range wins if both are given.
     *
     * @param range the row range, may be null
     * @param positions the row positions, may be null
     */
    static RowSelection of(Range range, int[] positions) {
        if (range != null) {
            return range;
        }
        if (positions != null) {
            return new Indices(positions);
        }
        return none();
    }
}

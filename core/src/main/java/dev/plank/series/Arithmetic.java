/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

import dev.plank.exception.InvalidTypeException;
import dev.plank.exception.UnsupportedKindException;

/**
 * Binary operations between two column storages.
 * <p>
 * Supported operand kinds:
 * <ul>
 *   <li>INT with INT: elementwise in 64-bit integer arithmetic, division truncates</li>
 *   <li>FLOAT with FLOAT: elementwise in double arithmetic</li>
 *   <li>INT with FLOAT (either side): the INT operand is promoted to FLOAT, result is FLOAT</li>
 *   <li>STR with STR, {@link Op#ADD} only: concatenation of the two sequences</li>
 * </ul>
 * Every other combination throws {@link UnsupportedKindException}. Elementwise operations
 * require operands of equal length; there is no broadcasting.
 * </p>
 */
public final class Arithmetic {

    /**
     * The four arithmetic operators.
     */
    public enum Op {
        ADD("+", (a, b) -> a + b, (a, b) -> a + b),
        SUB("-", (a, b) -> a - b, (a, b) -> a - b),
        MUL("*", (a, b) -> a * b, (a, b) -> a * b),
        DIV("/", (a, b) -> a / b, (a, b) -> a / b);

        private final String symbol;
        private final LongBinaryOperator longOp;
        private final DoubleBinaryOperator doubleOp;

        Op(String symbol, LongBinaryOperator longOp, DoubleBinaryOperator doubleOp) {
            this.symbol = symbol;
            this.longOp = longOp;
            this.doubleOp = doubleOp;
        }

        public String symbol() {
            return symbol;
        }
    }

    private Arithmetic() {
    }

    public static SeriesData add(SeriesData left, SeriesData right) {
        return apply(Op.ADD, left, right);
    }

    public static SeriesData sub(SeriesData left, SeriesData right) {
        return apply(Op.SUB, left, right);
    }

    public static SeriesData mul(SeriesData left, SeriesData right) {
        return apply(Op.MUL, left, right);
    }

    public static SeriesData div(SeriesData left, SeriesData right) {
        return apply(Op.DIV, left, right);
    }

    /**
     * Concatenates two storages of the same kind, for all four kinds.
     *
     * @throws InvalidTypeException if the kinds differ
     */
    public static SeriesData merge(SeriesData left, SeriesData right) throws InvalidTypeException {
        return left.concat(right);
    }

    /**
     * Applies an operator to two storages, returning a new storage.
     *
     * @throws UnsupportedKindException if the operator is not defined for the operand kinds
     * @throws IllegalArgumentException if an elementwise operation gets operands of different lengths
     * @throws ArithmeticException on integer division by zero
     */
    public static SeriesData apply(Op op, SeriesData left, SeriesData right) {
        if (left instanceof SeriesData.StrData l && right instanceof SeriesData.StrData r) {
            if (op != Op.ADD) {
                throw new UnsupportedKindException(op.symbol(), left.kind(), right.kind());
            }
            return concatenate(l, r);
        }
        if (!left.kind().isNumeric() || !right.kind().isNumeric()) {
            throw new UnsupportedKindException(op.symbol(), left.kind(), right.kind());
        }
        if (left.length() != right.length()) {
            throw new IllegalArgumentException("Operand lengths differ for " + op.symbol() + ": "
                    + left.length() + " and " + right.length());
        }
        if (left instanceof SeriesData.IntData l && right instanceof SeriesData.IntData r) {
            long[] a = l.toArray();
            long[] b = r.toArray();
            long[] result = new long[a.length];
            for (int i = 0; i < result.length; i++) {
                result[i] = op.longOp.applyAsLong(a[i], b[i]);
            }
            return SeriesData.ofLongs(result);
        }
        double[] a = promote(left);
        double[] b = promote(right);
        double[] result = new double[a.length];
        for (int i = 0; i < result.length; i++) {
            result[i] = op.doubleOp.applyAsDouble(a[i], b[i]);
        }
        return SeriesData.ofDoubles(result);
    }

    private static double[] promote(SeriesData data) {
        if (data instanceof SeriesData.FloatData f) {
            return f.toArray();
        }
        long[] longs = ((SeriesData.IntData) data).toArray();
        double[] doubles = new double[longs.length];
        for (int i = 0; i < longs.length; i++) {
            doubles[i] = longs[i];
        }
        return doubles;
    }

    private static SeriesData concatenate(SeriesData.StrData left, SeriesData.StrData right) {
        String[] a = left.toArray();
        String[] b = right.toArray();
        String[] joined = new String[a.length + b.length];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return SeriesData.ofStrings(joined);
    }
}

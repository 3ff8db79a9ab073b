/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

import java.util.function.Predicate;

import dev.plank.series.DType;

/**
 * Cell predicates for {@link DataFrame#filter(String, Predicate)}, comparing each cell
 * against a fixed value using {@link DType} ordering.
 * <p>
 * Cells of a different kind than the value only ever match {@link #ne(DType)}.
 * </p>
 */
public final class Predicates {

    private Predicates() {
    }

    public static Predicate<DType> eq(DType value) {
        return cell -> cell.equals(value);
    }

    public static Predicate<DType> ne(DType value) {
        return cell -> !cell.equals(value);
    }

    public static Predicate<DType> gt(DType value) {
        return cell -> sameKind(cell, value) && cell.compareTo(value) > 0;
    }

    public static Predicate<DType> ge(DType value) {
        return cell -> sameKind(cell, value) && cell.compareTo(value) >= 0;
    }

    public static Predicate<DType> lt(DType value) {
        return cell -> sameKind(cell, value) && cell.compareTo(value) < 0;
    }

    public static Predicate<DType> le(DType value) {
        return cell -> sameKind(cell, value) && cell.compareTo(value) <= 0;
    }

    private static boolean sameKind(DType cell, DType value) {
        return cell.kind() == value.kind();
    }
}

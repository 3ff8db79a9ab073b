/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

import java.util.Objects;

/**
 * A single cell value tagged with its {@link Kind}.
 * <p>
 * Used for single-cell reads and writes and as the argument of row predicates.
 * Values of the same kind are ordered by their natural order (numeric, {@code false < true},
 * lexicographic); values of different kinds are ordered by kind only.
 * </p>
 */
public sealed interface DType extends Comparable<DType> {

    Kind kind();

    /** Textual form used when rendering a table. */
    String text();

    static DType of(long value) {
        return new IntValue(value);
    }

    static DType of(double value) {
        return new FloatValue(value);
    }

    static DType of(boolean value) {
        return new BoolValue(value);
    }

    static DType of(String value) {
        return new StrValue(value);
    }

    @Override
    default int compareTo(DType other) {
        if (kind() != other.kind()) {
            return kind().compareTo(other.kind());
        }
        switch (kind()) {
            case INT:
                return Long.compare(((IntValue) this).value(), ((IntValue) other).value());
            case FLOAT:
                return Double.compare(((FloatValue) this).value(), ((FloatValue) other).value());
            case BOOL:
                return Boolean.compare(((BoolValue) this).value(), ((BoolValue) other).value());
            case STR:
                return ((StrValue) this).value().compareTo(((StrValue) other).value());
            default:
                throw new IllegalStateException("Unexpected kind: " + kind());
        }
    }

    record IntValue(long value) implements DType {
        @Override
        public Kind kind() {
            return Kind.INT;
        }

        @Override
        public String text() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements DType {
        @Override
        public Kind kind() {
            return Kind.FLOAT;
        }

        @Override
        public String text() {
            return Double.toString(value);
        }
    }

    record BoolValue(boolean value) implements DType {
        @Override
        public Kind kind() {
            return Kind.BOOL;
        }

        @Override
        public String text() {
            return Boolean.toString(value);
        }
    }

    record StrValue(String value) implements DType {
        public StrValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.STR;
        }

        @Override
        public String text() {
            return value;
        }
    }
}

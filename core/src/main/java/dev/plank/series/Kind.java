/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.series;

/**
 * Element kinds supported by column storage.
 * Each kind is backed by a homogeneous sequence of one Java type.
 */
public enum Kind {
    INT("int64"),
    FLOAT("float64"),
    BOOL("bool"),
    STR("str");

    private final String label;

    Kind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    public static Kind fromLabel(String label) {
        for (Kind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown kind: " + label);
    }
}

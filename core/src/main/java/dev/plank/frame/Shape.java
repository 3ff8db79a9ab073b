/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.frame;

/**
 * Dimensions of a table: row count and column count.
 */
public record Shape(int rows, int columns) {

    @Override
    public String toString() {
        return "[" + rows + ", " + columns + "]";
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

import dev.plank.series.Kind;

/**
 * Thrown by raw arithmetic on a pair of column kinds that has no defined result,
 * e.g. a boolean column added to an integer column.
 * <p>
 * Unlike {@link FrameException}, this is not part of any method signature and is
 * not meant to be handled: it signals a programming error in the caller.
 * </p>
 */
public class UnsupportedKindException extends UnsupportedOperationException {

    private final Kind left;
    private final Kind right;

    public UnsupportedKindException(String operation, Kind left, Kind right) {
        super("Unsupported operand kinds for " + operation + ": " + left + " and " + right);
        this.left = left;
        this.right = right;
    }

    public Kind left() {
        return left;
    }

    public Kind right() {
        return right;
    }
}

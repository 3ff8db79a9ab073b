/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Thrown when a column's length does not match the row count of a table, or a row does not match its column count.
 */
public class InconsistentLengthException extends FrameException {

    public InconsistentLengthException(String message) {
        super(message);
    }
}

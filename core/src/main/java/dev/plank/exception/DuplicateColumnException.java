/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Thrown when a column name is already taken within a table.
 */
public class DuplicateColumnException extends FrameException {

    public DuplicateColumnException(String message) {
        super(message);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Thrown when a value or column is of a different kind than the operation requires.
 */
public class InvalidTypeException extends FrameException {

    public InvalidTypeException(String message) {
        super(message);
    }
}

/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Thrown when an element is erased from an empty column.
 */
public class EmptyArrayException extends FrameException {

    public EmptyArrayException(String message) {
        super(message);
    }
}

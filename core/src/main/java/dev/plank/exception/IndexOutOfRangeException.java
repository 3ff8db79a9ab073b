/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Thrown when a row, cell or column position is outside of {@code [0, length)}.
 */
public class IndexOutOfRangeException extends FrameException {

    public IndexOutOfRangeException(String message) {
        super(message);
    }
}

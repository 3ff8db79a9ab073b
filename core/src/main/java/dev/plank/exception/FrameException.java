/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.plank.exception;

/**
 * Base class of the recoverable failures raised by series and table operations.
 * <p>
 * Structural operations either succeed completely or throw one of the subclasses
 * before any state was changed.
 * </p>
 */
public class FrameException extends Exception {

    public FrameException(String message) {
        super(message);
    }
}

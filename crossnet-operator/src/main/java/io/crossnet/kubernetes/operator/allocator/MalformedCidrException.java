/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.allocator;

/**
 * Thrown when an address range cannot be parsed. Retrying will not help until the input changes.
 */
public class MalformedCidrException extends IllegalArgumentException {

    public MalformedCidrException(String message) {
        super(message);
    }

    public MalformedCidrException(String message, Throwable cause) {
        super(message, cause);
    }
}

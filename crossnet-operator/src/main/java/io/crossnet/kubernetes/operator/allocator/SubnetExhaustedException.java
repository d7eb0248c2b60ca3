/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.allocator;

/**
 * Thrown when no free range of the requested size is left in any pool.
 */
public class SubnetExhaustedException extends RuntimeException {

    public SubnetExhaustedException(String message) {
        super(message);
    }
}

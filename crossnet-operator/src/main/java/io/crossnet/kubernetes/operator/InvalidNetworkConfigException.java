/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

/**
 * A {@link io.crossnet.kubernetes.api.v1alpha1.NetworkConfig} lacks a field the reconciler needs.
 */
public class InvalidNetworkConfigException extends RuntimeException {

    public InvalidNetworkConfigException(String message) {
        super(message);
    }
}

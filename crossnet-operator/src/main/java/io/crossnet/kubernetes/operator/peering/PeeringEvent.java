/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

/**
 * Events a caller can wait for on a peering.
 */
public enum PeeringEvent {
    UNPEER("unpeer"),
    AUTHENTICATION("authentication"),
    NETWORK_ESTABLISHED("network established");

    private final String description;

    PeeringEvent(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}

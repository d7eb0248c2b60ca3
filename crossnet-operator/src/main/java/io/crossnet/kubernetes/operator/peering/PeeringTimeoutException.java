/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

import java.time.Duration;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ClusterIdentity;

/**
 * The awaited {@link PeeringEvent} did not happen before the deadline.
 */
public class PeeringTimeoutException extends PeeringEventException {

    public PeeringTimeoutException(PeeringEvent event, ClusterIdentity cluster, Duration timeout) {
        super(event, cluster, "timed out after " + timeout.toMillis() + "ms");
    }
}

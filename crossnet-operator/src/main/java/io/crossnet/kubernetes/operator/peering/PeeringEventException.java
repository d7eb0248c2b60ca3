/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ClusterIdentity;

/**
 * Waiting for a {@link PeeringEvent} failed.
 */
public class PeeringEventException extends RuntimeException {

    private final PeeringEvent event;
    private final ClusterIdentity cluster;

    public PeeringEventException(PeeringEvent event, ClusterIdentity cluster, Throwable cause) {
        super(message(event, cluster) + ": " + cause.getMessage(), cause);
        this.event = event;
        this.cluster = cluster;
    }

    protected PeeringEventException(PeeringEvent event, ClusterIdentity cluster, String detail) {
        super(message(event, cluster) + ": " + detail);
        this.event = event;
        this.cluster = cluster;
    }

    public PeeringEvent event() {
        return event;
    }

    public ClusterIdentity cluster() {
        return cluster;
    }

    static String message(PeeringEvent event, ClusterIdentity cluster) {
        return "failed waiting for event \"" + event + "\" from cluster \"" + cluster.getClusterName() + "\"";
    }
}

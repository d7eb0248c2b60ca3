/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.List;

/**
 * More than one remote {@link io.crossnet.kubernetes.api.v1alpha1.NetworkConfig} exists for a single peer.
 * <p>
 * This points at a fault in replication or peering. Retrying cannot repair it, so reconciliation
 * of the affected record is not retried.
 */
public class DuplicateNetworkConfigException extends RuntimeException {

    private final String clusterId;
    private final List<String> names;

    public DuplicateNetworkConfigException(String clusterId, List<String> names) {
        super("multiple remote NetworkConfigs " + names + " exist for cluster " + clusterId);
        this.clusterId = clusterId;
        this.names = List.copyOf(names);
    }

    public String clusterId() {
        return clusterId;
    }

    public List<String> names() {
        return names;
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

import java.net.HttpURLConnection;
import java.util.List;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ForeignCluster;

/**
 * Lookups of {@link ForeignCluster}s.
 */
public final class ForeignClusters {

    private ForeignClusters() {
    }

    /**
     * Finds the {@link ForeignCluster} labelled with {@code clusterId}.
     *
     * @throws KubernetesClientException with code 404 if there is none
     * @throws IllegalStateException if more than one carries the label
     */
    public static ForeignCluster getByClusterId(KubernetesClient client, String clusterId) {
        List<ForeignCluster> items = client.resources(ForeignCluster.class)
                .withLabel(ForeignCluster.CLUSTER_ID_LABEL, clusterId)
                .list()
                .getItems();
        if (items.isEmpty()) {
            throw new KubernetesClientException("no ForeignCluster with " + ForeignCluster.CLUSTER_ID_LABEL + "=" + clusterId,
                    HttpURLConnection.HTTP_NOT_FOUND, null);
        }
        if (items.size() > 1) {
            throw new IllegalStateException("found " + items.size() + " ForeignClusters with " + ForeignCluster.CLUSTER_ID_LABEL + "=" + clusterId);
        }
        return items.get(0);
    }
}

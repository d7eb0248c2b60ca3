/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.bridge;

import java.net.HttpURLConnection;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigSpec;
import io.crossnet.kubernetes.operator.Labels;
import io.crossnet.kubernetes.operator.NetworkIdentity;

/**
 * Creates the {@code local} {@link NetworkConfig} through which this cluster advertises its
 * network to a peer.
 */
public class LocalNetworkConfigs {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetworkConfigs.class);

    private final KubernetesClient client;

    public LocalNetworkConfigs(KubernetesClient client) {
        this.client = Objects.requireNonNull(client);
    }

    /**
     * Ensures {@code net-config-<clusterId>} exists. A record that already exists is left as it is.
     *
     * @param clusterId the peer's identifier
     * @param identity this cluster's network parameters
     * @return true if this call created the record
     * @throws KubernetesClientException if the create failed for any reason other than the record already existing
     */
    public boolean ensureLocalNetworkConfig(String clusterId, NetworkIdentity identity) {
        NetworkConfig networkConfig = new NetworkConfig();
        networkConfig.setMetadata(new ObjectMetaBuilder()
                .withName(NetworkConfig.nameFor(clusterId))
                .withLabels(Labels.localNetworkConfigLabels(clusterId))
                .build());
        networkConfig.setSpec(new NetworkConfigSpec(clusterId, identity.podCIDR().toString(), identity.gatewayIP()));
        try {
            client.resource(networkConfig).create();
            LOGGER.info("Created local NetworkConfig {} for cluster {}", NetworkConfig.nameFor(clusterId), clusterId);
            return true;
        }
        catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                LOGGER.debug("Local NetworkConfig {} already exists", NetworkConfig.nameFor(clusterId));
                return false;
            }
            throw e;
        }
    }
}

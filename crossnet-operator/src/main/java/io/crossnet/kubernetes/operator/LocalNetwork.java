/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.operator.allocator.MalformedCidrException;
import io.crossnet.kubernetes.operator.allocator.PoolSubnetAllocator;
import io.crossnet.kubernetes.operator.allocator.SubnetAllocator;

import static io.crossnet.kubernetes.operator.ResourcesUtil.name;

/**
 * What the operator knows once its own network is configured: the identity it advertises, and the
 * allocator seeded with that identity's ranges.
 *
 * @param identity this cluster's network parameters
 * @param allocator the allocator shared by every reconciliation
 */
public record LocalNetwork(NetworkIdentity identity, SubnetAllocator allocator) {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalNetwork.class);

    public LocalNetwork {
        Objects.requireNonNull(identity);
        Objects.requireNonNull(allocator);
    }

    public static LocalNetwork of(NetworkIdentity identity) {
        return new LocalNetwork(identity, new PoolSubnetAllocator(identity.reservedRanges()));
    }

    /**
     * Builds the local network and reserves every range already granted to a peer, as recorded in the
     * status of the remote {@link NetworkConfig}s in the store. Must complete before the first new NAT
     * decision is taken.
     *
     * @param identity this cluster's network parameters
     * @param client client for the store
     * @return the local network
     */
    public static LocalNetwork restore(NetworkIdentity identity, KubernetesClient client) {
        LocalNetwork network = of(identity);
        var remotes = client.resources(NetworkConfig.class)
                .withLabel(Labels.ORIGIN, Labels.Origin.REMOTE.labelValue())
                .list()
                .getItems();
        int restored = 0;
        for (NetworkConfig remote : remotes) {
            try {
                var range = ResourcesUtil.decidedRange(remote);
                if (range.isPresent()) {
                    network.allocator().restore(range.get(), ResourcesUtil.peerClusterId(remote));
                    restored++;
                }
            }
            catch (InvalidNetworkConfigException | MalformedCidrException e) {
                // reported again when the record itself is reconciled
                LOGGER.warn("Not restoring the reservation of NetworkConfig {}: {}", name(remote), e.getMessage());
            }
        }
        LOGGER.info("Restored {} reservation(s) from {} remote NetworkConfig(s)", restored, remotes.size());
        return network;
    }
}

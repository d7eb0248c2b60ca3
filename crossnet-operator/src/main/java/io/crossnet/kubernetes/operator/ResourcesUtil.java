/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigSpec;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;
import io.crossnet.kubernetes.operator.allocator.Cidr;

public class ResourcesUtil {

    private ResourcesUtil() {
    }

    public static String name(HasMetadata resource) {
        return resource.getMetadata().getName();
    }

    /**
     * The identifier of the peer a {@link NetworkConfig} belongs to: its {@link Labels#PEER_CLUSTER}
     * label, falling back to {@code spec.clusterID}.
     *
     * @param networkConfig the record
     * @return the peer's identifier
     * @throws InvalidNetworkConfigException if the record names no peer at all
     */
    public static String peerClusterId(NetworkConfig networkConfig) {
        return Labels.peerCluster(networkConfig)
                .or(() -> Optional.ofNullable(networkConfig.getSpec())
                        .map(NetworkConfigSpec::getClusterID)
                        .filter(id -> !id.isEmpty()))
                .orElseThrow(() -> new InvalidNetworkConfigException(
                        "NetworkConfig " + name(networkConfig) + " has neither a " + Labels.PEER_CLUSTER + " label nor a spec.clusterID"));
    }

    /**
     * @return the record's status, or an empty one if it has none yet
     */
    public static NetworkConfigStatus status(NetworkConfig networkConfig) {
        return Optional.ofNullable(networkConfig.getStatus()).orElseGet(NetworkConfigStatus::new);
    }

    /**
     * The range a peer's pods occupy in this cluster once the NAT decision for its remote record has
     * been taken: the replacement if NAT is enabled, otherwise the range the peer advertised.
     *
     * @param remote a remote record
     * @return the range, or empty if no decision has been taken yet
     * @throws InvalidNetworkConfigException if the decision names no range
     */
    public static Optional<Cidr> decidedRange(NetworkConfig remote) {
        NetworkConfigStatus status = status(remote);
        if (!status.isNatDecided()) {
            return Optional.empty();
        }
        String range;
        if (Boolean.parseBoolean(status.getNatEnabled())) {
            range = status.getPodCIDRNAT();
            if (!status.isPodCIDRNATResolved() || NetworkConfigStatus.NO_NAT.equals(range)) {
                throw new InvalidNetworkConfigException("NetworkConfig " + name(remote) + " enables NAT without a status.podCIDRNAT");
            }
        }
        else {
            range = Optional.ofNullable(remote.getSpec())
                    .map(NetworkConfigSpec::getPodCIDR)
                    .orElseThrow(() -> new InvalidNetworkConfigException("NetworkConfig " + name(remote) + " advertises no spec.podCIDR"));
        }
        return Optional.of(Cidr.parse(range));
    }
}

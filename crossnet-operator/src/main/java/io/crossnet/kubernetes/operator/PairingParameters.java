/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Objects;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointSpec;

/**
 * The values a {@link io.crossnet.kubernetes.api.v1alpha1.TunnelEndpoint} is derived from, joined
 * from a local {@link NetworkConfig} and the matching remote one.
 *
 * @param clusterId the peer's identifier
 * @param gatewayIP the peer's public tunnel address
 * @param podCIDR the peer's original pod range
 * @param localNatPodCIDR the range the peer maps this cluster's pods to, or the no-NAT sentinel
 * @param remoteNatPodCIDR the range this cluster maps the peer's pods to, or the no-NAT sentinel
 */
public record PairingParameters(String clusterId,
                                String gatewayIP,
                                String podCIDR,
                                String localNatPodCIDR,
                                String remoteNatPodCIDR) {

    public PairingParameters {
        Objects.requireNonNull(clusterId);
        Objects.requireNonNull(gatewayIP);
        Objects.requireNonNull(podCIDR);
        Objects.requireNonNull(localNatPodCIDR);
        Objects.requireNonNull(remoteNatPodCIDR);
    }

    /**
     * Joins the two halves. Both must have taken their NAT decision.
     */
    static PairingParameters join(String clusterId, NetworkConfig local, NetworkConfig remote) {
        return new PairingParameters(
                clusterId,
                remote.getSpec().getTunnelPublicIP(),
                remote.getSpec().getPodCIDR(),
                local.getStatus().getPodCIDRNAT(),
                remote.getStatus().getPodCIDRNAT());
    }

    TunnelEndpointSpec toSpec() {
        return new TunnelEndpointSpec(clusterId, podCIDR, gatewayIP);
    }
}

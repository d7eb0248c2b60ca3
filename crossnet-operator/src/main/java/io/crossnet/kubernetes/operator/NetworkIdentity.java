/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import io.crossnet.kubernetes.operator.allocator.Cidr;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * This cluster's own network parameters, the ones it advertises to every peer.
 *
 * @param podCIDR this cluster's pod range
 * @param serviceCIDR this cluster's service range, if known
 * @param gatewayIP public address of this cluster's tunnel endpoint
 */
public record NetworkIdentity(Cidr podCIDR, @Nullable Cidr serviceCIDR, String gatewayIP) {

    public NetworkIdentity {
        Objects.requireNonNull(podCIDR);
        Objects.requireNonNull(gatewayIP);
        if (gatewayIP.isBlank()) {
            throw new IllegalArgumentException("gatewayIP must not be blank");
        }
    }

    /**
     * @throws io.crossnet.kubernetes.operator.allocator.MalformedCidrException if either range is malformed
     */
    public static NetworkIdentity parse(String podCIDR, @Nullable String serviceCIDR, String gatewayIP) {
        return new NetworkIdentity(Cidr.parse(podCIDR),
                serviceCIDR == null || serviceCIDR.isBlank() ? null : Cidr.parse(serviceCIDR),
                gatewayIP.trim());
    }

    /**
     * @return the ranges no peer may be given
     */
    public List<Cidr> reservedRanges() {
        List<Cidr> ranges = new ArrayList<>();
        ranges.add(podCIDR);
        if (serviceCIDR != null) {
            ranges.add(serviceCIDR);
        }
        return ranges;
    }
}

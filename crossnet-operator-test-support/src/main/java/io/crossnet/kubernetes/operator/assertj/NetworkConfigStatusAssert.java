/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.assertj;

import java.util.Objects;

import org.assertj.core.api.AbstractObjectAssert;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;

public class NetworkConfigStatusAssert extends AbstractObjectAssert<NetworkConfigStatusAssert, NetworkConfigStatus> {

    protected NetworkConfigStatusAssert(NetworkConfigStatus actual) {
        super(actual, NetworkConfigStatusAssert.class);
    }

    public static NetworkConfigStatusAssert assertThat(NetworkConfigStatus actual) {
        return new NetworkConfigStatusAssert(actual);
    }

    /**
     * The peer keeps its own pod range.
     */
    public NetworkConfigStatusAssert isNatDisabled() {
        isNotNull();
        if (!"false".equals(actual.getNatEnabled()) || !NetworkConfigStatus.NO_NAT.equals(actual.getPodCIDRNAT())) {
            failWithMessage("Expected NAT to be disabled with podCIDRNAT <%s> but was natEnabled <%s>, podCIDRNAT <%s>",
                    NetworkConfigStatus.NO_NAT, actual.getNatEnabled(), actual.getPodCIDRNAT());
        }
        return this;
    }

    /**
     * The peer's pods are remapped to {@code expectedRange}.
     */
    public NetworkConfigStatusAssert isNatEnabledWith(String expectedRange) {
        isNotNull();
        if (!"true".equals(actual.getNatEnabled()) || !Objects.equals(expectedRange, actual.getPodCIDRNAT())) {
            failWithMessage("Expected NAT to be enabled with podCIDRNAT <%s> but was natEnabled <%s>, podCIDRNAT <%s>",
                    expectedRange, actual.getNatEnabled(), actual.getPodCIDRNAT());
        }
        return this;
    }

    public NetworkConfigStatusAssert isNatEnabled() {
        isNotNull();
        if (!"true".equals(actual.getNatEnabled()) || NetworkConfigStatus.NO_NAT.equals(actual.getPodCIDRNAT())) {
            failWithMessage("Expected NAT to be enabled but was natEnabled <%s>, podCIDRNAT <%s>",
                    actual.getNatEnabled(), actual.getPodCIDRNAT());
        }
        return this;
    }
}

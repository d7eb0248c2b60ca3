/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.assertj;

import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.AbstractStringAssert;
import org.assertj.core.api.Assertions;

import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointStatus;

public class TunnelEndpointStatusAssert extends AbstractObjectAssert<TunnelEndpointStatusAssert, TunnelEndpointStatus> {

    protected TunnelEndpointStatusAssert(TunnelEndpointStatus actual) {
        super(actual, TunnelEndpointStatusAssert.class);
    }

    public static TunnelEndpointStatusAssert assertThat(TunnelEndpointStatus actual) {
        return new TunnelEndpointStatusAssert(actual);
    }

    public TunnelEndpointStatusAssert isProcessed() {
        isNotNull();
        phase().isEqualTo(TunnelEndpointStatus.PHASE_PROCESSED);
        return this;
    }

    public AbstractStringAssert<?> phase() {
        return Assertions.assertThat(actual.getPhase()).as("phase");
    }

    public AbstractStringAssert<?> localRemappedPodCIDR() {
        isNotNull();
        return Assertions.assertThat(actual.getLocalRemappedPodCIDR()).as("localRemappedPodCIDR");
    }

    public AbstractStringAssert<?> remoteRemappedPodCIDR() {
        isNotNull();
        return Assertions.assertThat(actual.getRemoteRemappedPodCIDR()).as("remoteRemappedPodCIDR");
    }

    public TunnelEndpointStatusAssert hasRemappedPodCIDRs(String expectedLocal, String expectedRemote) {
        localRemappedPodCIDR().isEqualTo(expectedLocal);
        remoteRemappedPodCIDR().isEqualTo(expectedRemote);
        return this;
    }
}

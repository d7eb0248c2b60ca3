/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.assertj;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointStatus;

class TunnelEndpointStatusAssertTest {

    @Test
    void shouldPassForProcessedStatus() {
        // Given
        var status = new TunnelEndpointStatus();
        status.setPhase(TunnelEndpointStatus.PHASE_PROCESSED);
        status.setLocalRemappedPodCIDR("None");
        status.setRemoteRemappedPodCIDR("10.1.0.0/16");

        // When
        // Then
        TunnelEndpointStatusAssert.assertThat(status)
                .isProcessed()
                .hasRemappedPodCIDRs("None", "10.1.0.0/16");
    }

    @Test
    void shouldFailForUnprocessedStatus() {
        // Given
        var status = new TunnelEndpointStatus();

        // When
        // Then
        Assertions.assertThatThrownBy(() -> TunnelEndpointStatusAssert.assertThat(status).isProcessed())
                .isInstanceOf(AssertionError.class);
    }

    @Test
    void shouldFailForNullStatus() {
        // When
        // Then
        Assertions.assertThatThrownBy(() -> TunnelEndpointStatusAssert.assertThat(null).isProcessed())
                .isInstanceOf(AssertionError.class);
    }
}

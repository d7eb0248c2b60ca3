/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigSpec;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;
import io.crossnet.kubernetes.operator.allocator.Cidr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourcesUtilTest {

    @Test
    void shouldPreferPeerClusterLabel() {
        // Given
        var networkConfig = networkConfig(Map.of(Labels.PEER_CLUSTER, "cluster-b"), new NetworkConfigSpec("cluster-a", "10.0.0.0/16", "192.0.2.1"));

        // When
        // Then
        assertThat(ResourcesUtil.peerClusterId(networkConfig)).isEqualTo("cluster-b");
    }

    @Test
    void shouldFallBackToSpecClusterId() {
        // Given
        var networkConfig = networkConfig(Map.of(), new NetworkConfigSpec("cluster-a", "10.0.0.0/16", "192.0.2.1"));

        // When
        // Then
        assertThat(ResourcesUtil.peerClusterId(networkConfig)).isEqualTo("cluster-a");
    }

    @Test
    void shouldRejectRecordWithoutPeer() {
        // Given
        var networkConfig = networkConfig(Map.of(), null);

        // When
        // Then
        assertThatThrownBy(() -> ResourcesUtil.peerClusterId(networkConfig))
                .isInstanceOf(InvalidNetworkConfigException.class)
                .hasMessageContaining("net-config-x");
    }

    @Test
    void shouldDefaultMissingStatus() {
        // Given
        var networkConfig = networkConfig(Map.of(), null);

        // When
        NetworkConfigStatus status = ResourcesUtil.status(networkConfig);

        // Then
        assertThat(status.isNatDecided()).isFalse();
        assertThat(status.isPodCIDRNATResolved()).isFalse();
    }

    @Test
    void shouldHaveNoDecidedRangeBeforeDecision() {
        // Given
        var networkConfig = networkConfig(Map.of(), new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.2"));

        // When
        // Then
        assertThat(ResourcesUtil.decidedRange(networkConfig)).isEmpty();
    }

    @Test
    void shouldUseAdvertisedRangeWhenNatDisabled() {
        // Given
        var networkConfig = networkConfig(Map.of(), new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.2"));
        networkConfig.setStatus(NetworkConfigStatus.natDisabled());

        // When
        // Then
        assertThat(ResourcesUtil.decidedRange(networkConfig)).contains(Cidr.parse("10.1.0.0/16"));
    }

    @Test
    void shouldUseReplacementWhenNatEnabled() {
        // Given
        var networkConfig = networkConfig(Map.of(), new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.2"));
        networkConfig.setStatus(NetworkConfigStatus.natEnabled("10.0.0.0/16"));

        // When
        // Then
        assertThat(ResourcesUtil.decidedRange(networkConfig)).contains(Cidr.parse("10.0.0.0/16"));
    }

    @Test
    void shouldRejectNatWithoutReplacement() {
        // Given
        var networkConfig = networkConfig(Map.of(), new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.2"));
        networkConfig.setStatus(new NetworkConfigStatus("true", NetworkConfigStatus.NO_NAT));

        // When
        // Then
        assertThatThrownBy(() -> ResourcesUtil.decidedRange(networkConfig))
                .isInstanceOf(InvalidNetworkConfigException.class)
                .hasMessageContaining("net-config-x");
    }

    private static NetworkConfig networkConfig(Map<String, String> labels, NetworkConfigSpec spec) {
        var networkConfig = new NetworkConfig();
        networkConfig.setMetadata(new ObjectMetaBuilder().withName("net-config-x").withLabels(labels).build());
        networkConfig.setSpec(spec);
        return networkConfig;
    }
}

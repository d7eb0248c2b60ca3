/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.v1alpha1;

import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.HasMetadata;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkConfigTest {

    @Test
    void shouldNameLocalRecordAfterPeer() {
        assertThat(NetworkConfig.nameFor("cluster-b")).isEqualTo("net-config-cluster-b");
    }

    @Test
    void shouldNameEndpointAfterPeer() {
        assertThat(TunnelEndpoint.nameFor("cluster-b")).isEqualTo("tun-endpoint-cluster-b");
    }

    @Test
    void shouldBelongToNetworkGroup() {
        assertThat(HasMetadata.getGroup(NetworkConfig.class)).isEqualTo("net.crossnet.io");
        assertThat(HasMetadata.getVersion(NetworkConfig.class)).isEqualTo("v1alpha1");
        assertThat(HasMetadata.getPlural(NetworkConfig.class)).isEqualTo("networkconfigs");
        assertThat(HasMetadata.getPlural(TunnelEndpoint.class)).isEqualTo("tunnelendpoints");
        assertThat(NetworkConfig.CRD_NAME).isEqualTo("networkconfigs.net.crossnet.io");
    }

    @Test
    void shouldCompareSpecsByValue() {
        assertThat(new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.1"))
                .isEqualTo(new NetworkConfigSpec("cluster-b", "10.1.0.0/16", "192.0.2.1"))
                .isNotEqualTo(new NetworkConfigSpec("cluster-b", "10.2.0.0/16", "192.0.2.1"));
    }
}

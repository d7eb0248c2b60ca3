/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.api.model.StatusBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpoint;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointSpec;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointStatus;
import io.crossnet.kubernetes.operator.assertj.OperatorAssertions;
import io.crossnet.kubernetes.operator.retry.Backoff;

import static org.assertj.core.api.Assertions.assertThat;

@EnableKubernetesMockClient(crud = true)
class TunnelEndpointsTest {

    private static final String CLUSTER_ID = "cluster-b";
    private static final String ENDPOINT_NAME = "tun-endpoint-cluster-b";
    private static final PairingParameters PARAMETERS = new PairingParameters(CLUSTER_ID, "198.51.100.7", "10.2.0.0/16",
            NetworkConfigStatus.NO_NAT, "10.3.0.0/16");

    KubernetesClient client;
    KubernetesMockServer server;

    private TunnelEndpoints tunnelEndpoints;

    @BeforeEach
    void setUp() {
        OperatorTestUtils.expectCustomResources(server);
        tunnelEndpoints = new TunnelEndpoints(new Backoff(5, Duration.ofMillis(1), 1.0, 0.0));
    }

    @Test
    void shouldCreateProcessedEndpointWhenAbsent() {
        // When
        tunnelEndpoints.reconcile(client, PARAMETERS);

        // Then
        TunnelEndpoint endpoint = fetch();
        assertThat(endpoint.getSpec()).isEqualTo(new TunnelEndpointSpec(CLUSTER_ID, "10.2.0.0/16", "198.51.100.7"));
        OperatorAssertions.assertThat(endpoint.getStatus())
                .isProcessed()
                .hasRemappedPodCIDRs(NetworkConfigStatus.NO_NAT, "10.3.0.0/16");
        OperatorAssertions.assertThat(endpoint).hasLabel(Labels.PEER_CLUSTER, CLUSTER_ID);
    }

    @Test
    void shouldTolerateRepeatedCreate() {
        // Given
        tunnelEndpoints.create(client, PARAMETERS);

        // When
        tunnelEndpoints.create(client, PARAMETERS);

        // Then
        assertThat(client.resources(TunnelEndpoint.class).list().getItems())
                .singleElement()
                .satisfies(endpoint -> OperatorAssertions.assertThat(endpoint.getStatus()).isProcessed());
    }

    @Test
    void shouldLeaveUpToDateEndpointUntouched() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);
        String resourceVersion = fetch().getMetadata().getResourceVersion();

        // When
        var specUpdated = tunnelEndpoints.updateSpec(client, PARAMETERS);
        var statusUpdated = tunnelEndpoints.updateStatus(client, PARAMETERS);

        // Then
        assertThat(specUpdated).isFalse();
        assertThat(statusUpdated).isFalse();
        assertThat(fetch().getMetadata().getResourceVersion()).isEqualTo(resourceVersion);
    }

    @Test
    void shouldCorrectChangedSpec() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);
        var moved = new PairingParameters(CLUSTER_ID, "198.51.100.99", "10.2.0.0/16", NetworkConfigStatus.NO_NAT, "10.3.0.0/16");

        // When
        tunnelEndpoints.reconcile(client, moved);

        // Then
        assertThat(fetch().getSpec().getTunnelPublicIP()).isEqualTo("198.51.100.99");
        OperatorAssertions.assertThat(fetch().getStatus()).isProcessed();
    }

    @Test
    void shouldNeverRevertProcessedPhase() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);
        var remapped = new PairingParameters(CLUSTER_ID, "198.51.100.7", "10.2.0.0/16", "10.8.0.0/16", NetworkConfigStatus.NO_NAT);

        // When
        tunnelEndpoints.reconcile(client, remapped);
        tunnelEndpoints.reconcile(client, PARAMETERS);

        // Then
        OperatorAssertions.assertThat(fetch().getStatus())
                .isProcessed()
                .hasRemappedPodCIDRs(NetworkConfigStatus.NO_NAT, "10.3.0.0/16");
    }

    @Test
    void shouldFillInStatusOfEndpointCreatedWithoutOne() {
        // Given
        var endpoint = new TunnelEndpoint();
        endpoint.getMetadata().setName(ENDPOINT_NAME);
        endpoint.setSpec(PARAMETERS.toSpec());
        client.resource(endpoint).create();

        // When
        tunnelEndpoints.reconcile(client, PARAMETERS);

        // Then
        OperatorAssertions.assertThat(fetch().getStatus())
                .isProcessed()
                .hasRemappedPodCIDRs(NetworkConfigStatus.NO_NAT, "10.3.0.0/16");
    }

    @Test
    void shouldRetryStatusUpdateAfterConflict() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);
        server.expect().put()
                .withPath("/apis/net.crossnet.io/v1alpha1/tunnelendpoints/" + ENDPOINT_NAME + "/status")
                .andReturn(409, new StatusBuilder().withCode(409).withReason("Conflict").withMessage("the object has been modified").build())
                .once();
        var remapped = new PairingParameters(CLUSTER_ID, "198.51.100.7", "10.2.0.0/16", "10.8.0.0/16", "10.3.0.0/16");

        // When
        var updated = tunnelEndpoints.updateStatus(client, remapped);

        // Then
        assertThat(updated).isTrue();
        TunnelEndpointStatus status = fetch().getStatus();
        OperatorAssertions.assertThat(status)
                .isProcessed()
                .hasRemappedPodCIDRs("10.8.0.0/16", "10.3.0.0/16");
    }

    @Test
    void shouldRetrySpecUpdateAfterConflict() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);
        server.expect().put()
                .withPath("/apis/net.crossnet.io/v1alpha1/tunnelendpoints/" + ENDPOINT_NAME)
                .andReturn(409, new StatusBuilder().withCode(409).withReason("Conflict").withMessage("the object has been modified").build())
                .once();
        var moved = new PairingParameters(CLUSTER_ID, "198.51.100.99", "10.5.0.0/16", PARAMETERS.localNatPodCIDR(), PARAMETERS.remoteNatPodCIDR());

        // When
        var updated = tunnelEndpoints.updateSpec(client, moved);

        // Then
        assertThat(updated).isTrue();
        assertThat(fetch().getSpec()).isEqualTo(new TunnelEndpointSpec(CLUSTER_ID, "10.5.0.0/16", "198.51.100.99"));
    }

    @Test
    void shouldDeleteEndpoint() {
        // Given
        tunnelEndpoints.reconcile(client, PARAMETERS);

        // When
        var deleted = tunnelEndpoints.delete(client, CLUSTER_ID);

        // Then
        assertThat(deleted).isTrue();
        assertThat(client.resources(TunnelEndpoint.class).withName(ENDPOINT_NAME).get()).isNull();
    }

    @Test
    void shouldTolerateDeletingMissingEndpoint() {
        assertThat(tunnelEndpoints.delete(client, CLUSTER_ID)).isFalse();
    }

    private TunnelEndpoint fetch() {
        return client.resources(TunnelEndpoint.class).withName(ENDPOINT_NAME).get();
    }
}

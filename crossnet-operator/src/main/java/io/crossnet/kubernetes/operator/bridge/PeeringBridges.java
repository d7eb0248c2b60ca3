/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.bridge;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ClusterIdentity;
import io.crossnet.kubernetes.api.discovery.v1alpha1.PeeringRequest;
import io.crossnet.kubernetes.api.discovery.v1alpha1.PeeringRequestSpec;
import io.crossnet.kubernetes.api.sharing.v1alpha1.Advertisement;
import io.crossnet.kubernetes.api.sharing.v1alpha1.AdvertisementSpec;
import io.crossnet.kubernetes.operator.LocalNetwork;
import io.crossnet.kubernetes.operator.ReadinessGate;

/**
 * The bridges the operator runs.
 */
public final class PeeringBridges {

    private PeeringBridges() {
    }

    /**
     * Reacts to {@link Advertisement}s, reading the peer from {@code spec.clusterId}.
     */
    public static PeeringBridge<Advertisement> advertisements(KubernetesClient client, ReadinessGate<LocalNetwork> localNetwork) {
        return new PeeringBridge<>("advertisement",
                client,
                ResourceDefinitionContext.fromResourceType(Advertisement.class),
                Advertisement.class,
                advertisement -> Optional.ofNullable(advertisement.getSpec()).map(AdvertisementSpec::getClusterId),
                localNetwork,
                PeeringBridge.DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * Reacts to {@link PeeringRequest}s, reading the peer from {@code spec.clusterIdentity.clusterID}.
     */
    public static PeeringBridge<PeeringRequest> peeringRequests(KubernetesClient client, ReadinessGate<LocalNetwork> localNetwork) {
        return new PeeringBridge<>("peering-request",
                client,
                ResourceDefinitionContext.fromResourceType(PeeringRequest.class),
                PeeringRequest.class,
                request -> Optional.ofNullable(request.getSpec())
                        .map(PeeringRequestSpec::getClusterIdentity)
                        .map(ClusterIdentity::getClusterID),
                localNetwork,
                PeeringBridge.DEFAULT_QUEUE_CAPACITY);
    }

    public static List<PeeringBridge<?>> all(KubernetesClient client, ReadinessGate<LocalNetwork> localNetwork) {
        return List.of(advertisements(client, localNetwork), peeringRequests(client, localNetwork));
    }
}

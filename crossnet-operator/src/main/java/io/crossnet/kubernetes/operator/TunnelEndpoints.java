/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;

import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpoint;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointSpec;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointStatus;
import io.crossnet.kubernetes.operator.retry.Backoff;
import io.crossnet.kubernetes.operator.retry.Retries;


/**
 * Drives the {@link TunnelEndpoint} of one peer towards a set of {@link PairingParameters}.
 * <p>
 * An absent endpoint is created with its spec, then, once the store serves it back, given its
 * status. An existing endpoint has its spec and then its status rewritten field by field, and only
 * when a field differs. Every write re-reads the endpoint and is retried on a version conflict.
 * The phase only ever moves to {@link TunnelEndpointStatus#PHASE_PROCESSED}.
 */
public class TunnelEndpoints {

    private static final Logger LOGGER = LoggerFactory.getLogger(TunnelEndpoints.class);

    private final Backoff backoff;

    public TunnelEndpoints(Backoff backoff) {
        this.backoff = Objects.requireNonNull(backoff);
    }

    /**
     * Creates or updates the endpoint for {@code parameters.clusterId()}.
     *
     * @param client the client
     * @param parameters the values the endpoint must reflect
     */
    public void reconcile(KubernetesClient client, PairingParameters parameters) {
        String name = TunnelEndpoint.nameFor(parameters.clusterId());
        if (get(client, name).isEmpty()) {
            create(client, parameters);
        }
        else {
            updateSpec(client, parameters);
            updateStatus(client, parameters);
        }
    }

    /**
     * Creates the endpoint and writes its status. An endpoint that already exists is not an error:
     * its status is brought up to date instead.
     */
    void create(KubernetesClient client, PairingParameters parameters) {
        String name = TunnelEndpoint.nameFor(parameters.clusterId());
        TunnelEndpoint endpoint = new TunnelEndpoint();
        endpoint.setMetadata(new ObjectMetaBuilder()
                .withName(name)
                .addToLabels(Labels.PEER_CLUSTER, parameters.clusterId())
                .addToLabels(Labels.MANAGED_BY, Labels.OPERATOR_NAME)
                .build());
        endpoint.setSpec(parameters.toSpec());
        try {
            client.resource(endpoint).create();
            LOGGER.info("Created TunnelEndpoint {} for cluster {}", name, parameters.clusterId());
        }
        catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                throw e;
            }
            LOGGER.debug("TunnelEndpoint {} already exists", name);
        }
        // the store may not serve the new endpoint back straight away
        Retries.onError("tunnel-endpoint-read", backoff, Retries::isNotFound, () -> getRequired(client, name));
        updateStatus(client, parameters);
    }

    /**
     * @return true if the spec had to be rewritten
     */
    boolean updateSpec(KubernetesClient client, PairingParameters parameters) {
        String name = TunnelEndpoint.nameFor(parameters.clusterId());
        return Retries.retryOnConflict(backoff, () -> {
            TunnelEndpoint endpoint = getRequired(client, name);
            TunnelEndpointSpec spec = Optional.ofNullable(endpoint.getSpec()).orElseGet(TunnelEndpointSpec::new);
            boolean toBeUpdated = false;
            if (!Objects.equals(spec.getClusterID(), parameters.clusterId())) {
                spec.setClusterID(parameters.clusterId());
                toBeUpdated = true;
            }
            if (!Objects.equals(spec.getTunnelPublicIP(), parameters.gatewayIP())) {
                spec.setTunnelPublicIP(parameters.gatewayIP());
                toBeUpdated = true;
            }
            if (!Objects.equals(spec.getPodCIDR(), parameters.podCIDR())) {
                spec.setPodCIDR(parameters.podCIDR());
                toBeUpdated = true;
            }
            if (toBeUpdated) {
                endpoint.setSpec(spec);
                client.resource(endpoint).update();
                LOGGER.info("Updated spec of TunnelEndpoint {} to {}", name, spec);
            }
            return toBeUpdated;
        });
    }

    /**
     * @return true if the status had to be rewritten
     */
    boolean updateStatus(KubernetesClient client, PairingParameters parameters) {
        String name = TunnelEndpoint.nameFor(parameters.clusterId());
        return Retries.retryOnConflict(backoff, () -> {
            TunnelEndpoint endpoint = getRequired(client, name);
            TunnelEndpointStatus status = Optional.ofNullable(endpoint.getStatus()).orElseGet(TunnelEndpointStatus::new);
            boolean toBeUpdated = false;
            if (!Objects.equals(status.getLocalRemappedPodCIDR(), parameters.localNatPodCIDR())) {
                status.setLocalRemappedPodCIDR(parameters.localNatPodCIDR());
                toBeUpdated = true;
            }
            if (!Objects.equals(status.getRemoteRemappedPodCIDR(), parameters.remoteNatPodCIDR())) {
                status.setRemoteRemappedPodCIDR(parameters.remoteNatPodCIDR());
                toBeUpdated = true;
            }
            if (!status.isProcessed()) {
                status.setPhase(TunnelEndpointStatus.PHASE_PROCESSED);
                toBeUpdated = true;
            }
            if (toBeUpdated) {
                endpoint.setStatus(status);
                client.resource(endpoint).updateStatus();
                LOGGER.info("Updated status of TunnelEndpoint {} to {}", name, status);
            }
            return toBeUpdated;
        });
    }

    /**
     * Deletes the endpoint of a peer. A missing endpoint is not an error.
     *
     * @return true if an endpoint was deleted
     */
    public boolean delete(KubernetesClient client, String clusterId) {
        String name = TunnelEndpoint.nameFor(clusterId);
        boolean deleted = !client.resources(TunnelEndpoint.class).withName(name).delete().isEmpty();
        if (deleted) {
            LOGGER.info("Deleted TunnelEndpoint {} of cluster {}", name, clusterId);
        }
        return deleted;
    }

    private static Optional<TunnelEndpoint> get(KubernetesClient client, String name) {
        return Optional.ofNullable(client.resources(TunnelEndpoint.class).withName(name).get());
    }

    private static TunnelEndpoint getRequired(KubernetesClient client, String name) {
        return get(client, name).orElseThrow(() -> new KubernetesClientException("TunnelEndpoint " + name + " not found",
                HttpURLConnection.HTTP_NOT_FOUND, null));
    }
}

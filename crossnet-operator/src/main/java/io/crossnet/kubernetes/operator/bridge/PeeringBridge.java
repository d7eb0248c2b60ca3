/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.bridge;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.crossnet.kubernetes.operator.LocalNetwork;
import io.crossnet.kubernetes.operator.ReadinessGate;
import io.crossnet.kubernetes.operator.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns the arrival of a peering-related resource into a {@code local} NetworkConfig for the peer
 * it names.
 * <p>
 * The watch is untyped, so no API discovery is needed. Added and modified objects go onto a
 * bounded queue that a single thread drains; deletions are ignored. Neither the watch nor the
 * thread starts doing anything before the local network identity is known. An object that cannot
 * be decoded, or names no cluster, is logged and dropped: it comes back on its next modification.
 *
 * @param <T> the typed form of the watched resource
 */
public final class PeeringBridge<T extends HasMetadata> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeeringBridge.class);

    static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final String name;
    private final KubernetesClient client;
    private final ResourceDefinitionContext resourceType;
    private final Class<T> type;
    private final Function<T, Optional<String>> clusterIdOf;
    private final ReadinessGate<LocalNetwork> localNetwork;
    private final LocalNetworkConfigs localNetworkConfigs;
    private final BlockingQueue<GenericKubernetesResource> events;
    private final Thread worker;

    private volatile boolean closed;
    @Nullable
    private volatile SharedIndexInformer<GenericKubernetesResource> informer;

    PeeringBridge(String name,
                  KubernetesClient client,
                  ResourceDefinitionContext resourceType,
                  Class<T> type,
                  Function<T, Optional<String>> clusterIdOf,
                  ReadinessGate<LocalNetwork> localNetwork,
                  int queueCapacity) {
        this.name = Objects.requireNonNull(name);
        this.client = Objects.requireNonNull(client);
        this.resourceType = Objects.requireNonNull(resourceType);
        this.type = Objects.requireNonNull(type);
        this.clusterIdOf = Objects.requireNonNull(clusterIdOf);
        this.localNetwork = Objects.requireNonNull(localNetwork);
        this.localNetworkConfigs = new LocalNetworkConfigs(client);
        this.events = new LinkedBlockingQueue<>(queueCapacity);
        this.worker = new Thread(this::run, name + "-bridge");
        this.worker.setDaemon(true);
    }

    public String name() {
        return name;
    }

    /**
     * Starts the drain thread. The watch itself is opened by that thread once the gate opens.
     */
    public void start() {
        worker.start();
    }

    private void run() {
        try {
            LocalNetwork network = localNetwork.await();
            LOGGER.info("Starting {} bridge", name);
            var opened = client.genericKubernetesResources(resourceType).inform(new Enqueuer());
            informer = opened;
            if (closed) {
                // close() ran before the informer was published
                opened.close();
            }
            while (!closed) {
                GenericKubernetesResource event = events.take();
                try {
                    handle(event, network);
                }
                catch (RuntimeException e) {
                    LOGGER.error("{} bridge failed to handle {}, dropping it", name, nameOf(event), e);
                }
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        catch (KubernetesClientException e) {
            LOGGER.error("Could not watch {} for the {} bridge", resourceType.getPlural(), name, e);
        }
        LOGGER.info("Stopped {} bridge", name);
    }

    @VisibleForTesting
    void enqueue(GenericKubernetesResource resource) {
        if (!events.offer(resource)) {
            LOGGER.warn("{} bridge queue is full, dropping event for {}", name, resource.getMetadata().getName());
        }
    }

    /**
     * Decodes one event and ensures the peer it names has a local NetworkConfig.
     *
     * @return true if a NetworkConfig was created
     */
    @VisibleForTesting
    boolean handle(GenericKubernetesResource resource, LocalNetwork network) {
        String resourceName = nameOf(resource);
        Optional<String> clusterId;
        try {
            T decoded = client.getKubernetesSerialization().convertValue(resource, type);
            clusterId = clusterIdOf.apply(decoded).filter(id -> !id.isBlank());
        }
        catch (IllegalArgumentException | KubernetesClientException e) {
            LOGGER.warn("{} bridge could not decode {}, dropping it: {}", name, resourceName, e.getMessage());
            return false;
        }
        if (clusterId.isEmpty()) {
            LOGGER.warn("{} bridge found no cluster identifier in {}, dropping it", name, resourceName);
            return false;
        }
        try {
            return localNetworkConfigs.ensureLocalNetworkConfig(clusterId.get(), network.identity());
        }
        catch (KubernetesClientException e) {
            LOGGER.error("{} bridge could not create the local NetworkConfig for cluster {}", name, clusterId.get(), e);
            return false;
        }
    }

    @VisibleForTesting
    @Nullable
    SharedIndexInformer<GenericKubernetesResource> informer() {
        return informer;
    }

    @VisibleForTesting
    boolean isStopped() {
        return !worker.isAlive();
    }

    @Nullable
    private static String nameOf(GenericKubernetesResource resource) {
        return resource.getMetadata() == null ? null : resource.getMetadata().getName();
    }

    @Override
    public void close() {
        closed = true;
        var current = informer;
        if (current != null) {
            current.close();
        }
        worker.interrupt();
    }

    private class Enqueuer implements ResourceEventHandler<GenericKubernetesResource> {

        @Override
        public void onAdd(GenericKubernetesResource obj) {
            enqueue(obj);
        }

        @Override
        public void onUpdate(GenericKubernetesResource oldObj, GenericKubernetesResource newObj) {
            enqueue(newObj);
        }

        @Override
        public void onDelete(GenericKubernetesResource obj, boolean deletedFinalStateUnknown) {
            // the finalizer on the NetworkConfig governs teardown
        }
    }
}

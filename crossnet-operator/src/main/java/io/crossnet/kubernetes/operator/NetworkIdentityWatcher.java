/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;

import io.crossnet.kubernetes.operator.allocator.MalformedCidrException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Opens the local network gate the first time the identity ConfigMap holds a usable identity.
 */
public final class NetworkIdentityWatcher implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkIdentityWatcher.class);

    static final String POD_CIDR_KEY = "podCIDR";
    static final String SERVICE_CIDR_KEY = "serviceCIDR";
    static final String GATEWAY_IP_KEY = "gatewayIP";

    private final KubernetesClient client;
    private final OperatorConfig.ConfigMapRef configMap;
    private final ReadinessGate<LocalNetwork> localNetwork;
    @Nullable
    private SharedIndexInformer<ConfigMap> informer;

    public NetworkIdentityWatcher(KubernetesClient client, OperatorConfig.ConfigMapRef configMap, ReadinessGate<LocalNetwork> localNetwork) {
        this.client = Objects.requireNonNull(client);
        this.configMap = Objects.requireNonNull(configMap);
        this.localNetwork = Objects.requireNonNull(localNetwork);
    }

    public synchronized void start() {
        if (informer != null) {
            return;
        }
        LOGGER.info("Waiting for the network identity in ConfigMap {}/{}", configMap.namespace(), configMap.name());
        informer = client.configMaps()
                .inNamespace(configMap.namespace())
                .withName(configMap.name())
                .inform(new ResourceEventHandler<>() {
                    @Override
                    public void onAdd(ConfigMap obj) {
                        offer(obj);
                    }

                    @Override
                    public void onUpdate(ConfigMap oldObj, ConfigMap newObj) {
                        offer(newObj);
                    }

                    @Override
                    public void onDelete(ConfigMap obj, boolean deletedFinalStateUnknown) {
                        // an identity, once known, is kept
                    }
                });
    }

    /**
     * Opens the gate if {@code configMap} holds a complete, well-formed identity and the gate is still closed.
     *
     * @return true if this call opened the gate
     */
    @VisibleForTesting
    boolean offer(ConfigMap configMap) {
        if (localNetwork.isOpen()) {
            return false;
        }
        Optional<NetworkIdentity> identity = identityFrom(configMap.getData());
        if (identity.isEmpty()) {
            return false;
        }
        boolean opened = localNetwork.open(LocalNetwork.restore(identity.get(), client));
        if (opened) {
            LOGGER.info("Network identity is {}", identity.get());
        }
        return opened;
    }

    static Optional<NetworkIdentity> identityFrom(@Nullable Map<String, String> data) {
        if (data == null) {
            return Optional.empty();
        }
        String podCidr = data.get(POD_CIDR_KEY);
        String gatewayIp = data.get(GATEWAY_IP_KEY);
        if (podCidr == null || podCidr.isBlank() || gatewayIp == null || gatewayIp.isBlank()) {
            LOGGER.debug("Network identity ConfigMap lacks {} or {}", POD_CIDR_KEY, GATEWAY_IP_KEY);
            return Optional.empty();
        }
        try {
            return Optional.of(NetworkIdentity.parse(podCidr.trim(), data.get(SERVICE_CIDR_KEY), gatewayIp));
        }
        catch (MalformedCidrException e) {
            LOGGER.error("Network identity ConfigMap holds a malformed range: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void close() {
        if (informer != null) {
            informer.close();
            informer = null;
        }
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The operator's settings, read once from the process environment.
 *
 * @param staticIdentity this cluster's network identity, when the environment gives it in full
 * @param identityConfigMap where to read the identity from otherwise
 * @param clusterId this cluster's identifier, if known
 * @param bindAddress where the management server listens
 */
public record OperatorConfig(Optional<NetworkIdentity> staticIdentity,
                             ConfigMapRef identityConfigMap,
                             Optional<String> clusterId,
                             InetSocketAddress bindAddress) {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorConfig.class);

    static final String POD_CIDR_VAR_NAME = "POD_CIDR";
    static final String SERVICE_CIDR_VAR_NAME = "SERVICE_CIDR";
    static final String GATEWAY_IP_VAR_NAME = "GATEWAY_IP";
    static final String CLUSTER_ID_VAR_NAME = "CLUSTER_ID";
    static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    static final String NETWORK_CONFIG_MAP_VAR_NAME = "NETWORK_CONFIG_MAP";
    static final String OPERATOR_NAMESPACE_VAR_NAME = "OPERATOR_NAMESPACE";

    static final int DEFAULT_MANAGEMENT_PORT = 8080;
    static final String DEFAULT_NETWORK_CONFIG_MAP = "crossnet-network-config";
    static final String DEFAULT_OPERATOR_NAMESPACE = "crossnet";

    public OperatorConfig {
        Objects.requireNonNull(staticIdentity);
        Objects.requireNonNull(identityConfigMap);
        Objects.requireNonNull(clusterId);
        Objects.requireNonNull(bindAddress);
    }

    /**
     * Names the ConfigMap holding the identity.
     *
     * @param namespace its namespace
     * @param name its name
     */
    public record ConfigMapRef(String namespace, String name) {
        public ConfigMapRef {
            Objects.requireNonNull(namespace);
            Objects.requireNonNull(name);
        }
    }

    public static OperatorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * @param env the environment variables
     * @throws io.crossnet.kubernetes.operator.allocator.MalformedCidrException if a range variable is malformed
     */
    public static OperatorConfig fromEnv(Map<String, String> env) {
        Optional<String> podCidr = nonBlank(env.get(POD_CIDR_VAR_NAME));
        Optional<String> gatewayIp = nonBlank(env.get(GATEWAY_IP_VAR_NAME));
        Optional<NetworkIdentity> staticIdentity = Optional.empty();
        if (podCidr.isPresent() && gatewayIp.isPresent()) {
            staticIdentity = Optional.of(NetworkIdentity.parse(podCidr.get(), env.get(SERVICE_CIDR_VAR_NAME), gatewayIp.get()));
        }
        else if (podCidr.isPresent() || gatewayIp.isPresent()) {
            LOGGER.warn("Only one of {} and {} is set, the network identity will be read from a ConfigMap instead",
                    POD_CIDR_VAR_NAME, GATEWAY_IP_VAR_NAME);
        }
        ConfigMapRef configMap = new ConfigMapRef(
                nonBlank(env.get(OPERATOR_NAMESPACE_VAR_NAME)).orElse(DEFAULT_OPERATOR_NAMESPACE),
                nonBlank(env.get(NETWORK_CONFIG_MAP_VAR_NAME)).orElse(DEFAULT_NETWORK_CONFIG_MAP));
        return new OperatorConfig(staticIdentity,
                configMap,
                nonBlank(env.get(CLUSTER_ID_VAR_NAME)),
                bindAddress(env.getOrDefault(BIND_ADDRESS_VAR_NAME, "")));
    }

    static InetSocketAddress bindAddress(String bindAddress) {
        String bindToInterface;
        int bindToPort;
        int colon = bindAddress.lastIndexOf(':');
        if (colon >= 0) {
            bindToInterface = bindAddress.substring(0, colon);
            try {
                bindToPort = Integer.parseInt(bindAddress.substring(colon + 1));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException(BIND_ADDRESS_VAR_NAME + " has an invalid port: " + bindAddress, e);
            }
        }
        else if (!bindAddress.isEmpty()) {
            LOGGER.warn("{} env var is set but does not contain `:` assuming hostname only and binding to default port ({})",
                    BIND_ADDRESS_VAR_NAME,
                    DEFAULT_MANAGEMENT_PORT);
            bindToInterface = bindAddress;
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        else {
            bindToInterface = "0.0.0.0";
            bindToPort = DEFAULT_MANAGEMENT_PORT;
        }
        return new InetSocketAddress(bindToInterface, bindToPort);
    }

    private static Optional<String> nonBlank(@Nullable String value) {
        return Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty());
    }
}

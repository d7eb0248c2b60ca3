/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;

/**
 * Label conventions that stand in for relational queries over {@link NetworkConfig}s.
 */
public class Labels {

    /**
     * Which side authored a {@link NetworkConfig}: {@code local} or {@code remote}.
     */
    public static final String ORIGIN = NetworkConfig.GROUP + "/origin";

    /**
     * The identifier of the peer a {@link NetworkConfig} pairs with.
     */
    public static final String PEER_CLUSTER = NetworkConfig.GROUP + "/peer-cluster";

    public static final String MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String OPERATOR_NAME = "crossnet-operator";

    private Labels() {
        // singleton
    }

    /**
     * The side that authored a {@link NetworkConfig}.
     */
    public enum Origin {
        LOCAL("local"),
        REMOTE("remote");

        private final String labelValue;

        Origin(String labelValue) {
            this.labelValue = labelValue;
        }

        public String labelValue() {
            return labelValue;
        }

        static Optional<Origin> fromLabelValue(String value) {
            for (Origin origin : values()) {
                if (origin.labelValue.equals(value)) {
                    return Optional.of(origin);
                }
            }
            return Optional.empty();
        }
    }

    public static Optional<Origin> origin(HasMetadata resource) {
        return label(resource, ORIGIN).flatMap(Origin::fromLabelValue);
    }

    public static Optional<String> peerCluster(HasMetadata resource) {
        return label(resource, PEER_CLUSTER).filter(value -> !value.isEmpty());
    }

    // ordered so the output YAML is deterministic
    public static Map<String, String> localNetworkConfigLabels(String clusterId) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ORIGIN, Origin.LOCAL.labelValue());
        labels.put(PEER_CLUSTER, clusterId);
        labels.put(MANAGED_BY, OPERATOR_NAME);
        return labels;
    }

    /**
     * @param clusterId the peer's identifier
     * @return labels matching the {@link NetworkConfig}s the peer authored for this cluster
     */
    public static Map<String, String> remoteSelector(String clusterId) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(ORIGIN, Origin.REMOTE.labelValue());
        labels.put(PEER_CLUSTER, clusterId);
        return labels;
    }

    private static Optional<String> label(HasMetadata resource, String key) {
        return Optional.ofNullable(resource.getMetadata().getLabels()).map(labels -> labels.get(key));
    }
}

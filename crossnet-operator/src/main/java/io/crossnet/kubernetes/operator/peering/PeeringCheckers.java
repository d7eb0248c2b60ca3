/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ForeignCluster;
import io.crossnet.kubernetes.api.discovery.v1alpha1.ForeignClusterStatus;

/**
 * Predicates over the observed state of a {@link ForeignCluster}. A phase that has not been
 * reported yet counts as {@link ForeignClusterStatus#PHASE_NONE}.
 */
public final class PeeringCheckers {

    /**
     * Neither side of the peering is active.
     */
    public static final Predicate<ForeignCluster> UNPEERED = foreignCluster -> ForeignClusterStatus.PHASE_NONE
            .equals(phase(foreignCluster, ForeignClusterStatus::getIncomingPeering))
            && ForeignClusterStatus.PHASE_NONE.equals(phase(foreignCluster, ForeignClusterStatus::getOutgoingPeering));

    public static final Predicate<ForeignCluster> AUTHENTICATED = foreignCluster -> ForeignClusterStatus.PHASE_ESTABLISHED
            .equals(phase(foreignCluster, ForeignClusterStatus::getAuthentication));

    public static final Predicate<ForeignCluster> NETWORK_ESTABLISHED = foreignCluster -> ForeignClusterStatus.PHASE_ESTABLISHED
            .equals(phase(foreignCluster, ForeignClusterStatus::getNetwork));

    private PeeringCheckers() {
    }

    /**
     * @return the checker matching {@code event}
     */
    public static Predicate<ForeignCluster> forEvent(PeeringEvent event) {
        return switch (event) {
            case UNPEER -> UNPEERED;
            case AUTHENTICATION -> AUTHENTICATED;
            case NETWORK_ESTABLISHED -> NETWORK_ESTABLISHED;
        };
    }

    private static String phase(ForeignCluster foreignCluster, Function<ForeignClusterStatus, String> field) {
        return Optional.ofNullable(foreignCluster.getStatus())
                .map(field)
                .filter(value -> !value.isEmpty())
                .orElse(ForeignClusterStatus.PHASE_NONE);
    }
}

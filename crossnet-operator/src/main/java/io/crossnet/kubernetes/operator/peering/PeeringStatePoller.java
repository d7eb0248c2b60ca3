/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.peering;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

import io.crossnet.kubernetes.api.discovery.v1alpha1.ClusterIdentity;
import io.crossnet.kubernetes.api.discovery.v1alpha1.ForeignCluster;

/**
 * Waits, by polling, until the {@link ForeignCluster} of a peer reaches some state.
 */
public class PeeringStatePoller {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeeringStatePoller.class);

    private final KubernetesClient client;
    private final Clock clock;

    public PeeringStatePoller(KubernetesClient client, Clock clock) {
        this.client = Objects.requireNonNull(client);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Polls until {@code checker} accepts the peer's {@link ForeignCluster}. The first check
     * happens straight away.
     *
     * @param cluster the peer
     * @param event what is being waited for, used in error messages
     * @param checker the condition
     * @param interval time between checks
     * @param timeout overall deadline
     * @throws PeeringTimeoutException if the deadline passes first
     * @throws PeeringEventException if fetching the resource fails, or the wait is interrupted
     */
    public void pollForEvent(ClusterIdentity cluster,
                             PeeringEvent event,
                             Predicate<ForeignCluster> checker,
                             Duration interval,
                             Duration timeout) {
        Objects.requireNonNull(cluster);
        Objects.requireNonNull(event);
        Objects.requireNonNull(checker);
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        Instant deadline = clock.instant().plus(timeout);
        while (true) {
            ForeignCluster foreignCluster;
            try {
                foreignCluster = ForeignClusters.getByClusterId(client, cluster.getClusterID());
            }
            catch (RuntimeException e) {
                throw new PeeringEventException(event, cluster, e);
            }
            if (checker.test(foreignCluster)) {
                LOGGER.debug("Event \"{}\" observed for cluster {}", event, cluster.getClusterName());
                return;
            }
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative() || remaining.isZero()) {
                throw new PeeringTimeoutException(event, cluster, timeout);
            }
            Duration sleep = remaining.compareTo(interval) < 0 ? remaining : interval;
            try {
                Thread.sleep(sleep.toMillis());
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PeeringEventException(event, cluster, e);
            }
        }
    }

    /**
     * Polls with the predefined checker for {@code event}.
     */
    public void pollForEvent(ClusterIdentity cluster, PeeringEvent event, Duration interval, Duration timeout) {
        pollForEvent(cluster, event, PeeringCheckers.forEvent(event), interval, timeout);
    }
}

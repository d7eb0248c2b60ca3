/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.crossnet.kubernetes.operator;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.monitoring.micrometer.MicrometerMetrics;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import io.crossnet.kubernetes.operator.bridge.PeeringBridge;
import io.crossnet.kubernetes.operator.bridge.PeeringBridges;
import io.crossnet.kubernetes.operator.management.ManagementServer;
import io.crossnet.kubernetes.operator.retry.Backoff;

/**
 * The {@code main} method entrypoint for the operator
 */
public class OperatorMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(OperatorMain.class);

    private final OperatorConfig config;
    private final KubernetesClient client;
    private final ManagementServer managementServer;
    private final Operator operator;
    private final ReadinessGate<LocalNetwork> localNetwork = new ReadinessGate<>();
    private final List<AutoCloseable> background = new ArrayList<>();

    public OperatorMain(OperatorConfig config) throws IOException {
        this(config, new KubernetesClientBuilder().build(), ManagementServer.bind(config.bindAddress()));
    }

    @VisibleForTesting
    OperatorMain(OperatorConfig config, KubernetesClient client, ManagementServer managementServer) {
        this.config = config;
        this.client = client;
        this.managementServer = managementServer;
        PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
        managementServer.withMetrics(prometheusMeterRegistry);
        // o.withMetrics is invoked multiple times so can cause issues with enabling metrics.
        operator = new Operator(o -> {
            o.withMetrics(enablePrometheusMetrics());
            o.withKubernetesClient(client);
        });
    }

    public static void main(String[] args) {
        try {
            new OperatorMain(OperatorConfig.fromEnv()).start();
        }
        catch (Exception e) {
            LOGGER.error("Operator has thrown exception during startup. Will now exit.", e);
            System.exit(1);
        }
    }

    /**
     * Starts the operator instance and returns once that has completed successfully.
     * Reconciliation and the bridges stay blocked until the local network identity is known.
     */
    void start() {
        operator.installShutdownHook(Duration.ofSeconds(10));
        operator.register(new NetworkConfigReconciler(localNetwork, new TunnelEndpoints(Backoff.DEFAULT)));
        config.staticIdentity().ifPresentOrElse(
                identity -> {
                    localNetwork.open(LocalNetwork.restore(identity, client));
                    LOGGER.info("Network identity is {}", identity);
                },
                () -> {
                    var watcher = new NetworkIdentityWatcher(client, config.identityConfigMap(), localNetwork);
                    background.add(watcher);
                    watcher.start();
                });
        for (PeeringBridge<?> bridge : PeeringBridges.all(client, localNetwork)) {
            background.add(bridge);
            bridge.start();
        }
        managementServer.withLiveness(this::livezStatusCode).start();
        operator.start();
        LOGGER.atInfo().setMessage("Operator started (cluster id: {})")
                .addArgument(() -> config.clusterId().orElse("unknown"))
                .log();
    }

    private int livezStatusCode() {
        int sc;
        try {
            sc = operator.getRuntimeInfo().allEventSourcesAreHealthy() ? 200 : 400;
        }
        catch (Exception e) {
            sc = 400;
            LOGGER.error("Ignoring exception caught while getting operator health info", e);
        }
        (sc != 200 ? LOGGER.atWarn() : LOGGER.atDebug()).log("Responding {} to GET {}", sc, ManagementServer.HTTP_PATH_LIVEZ);
        return sc;
    }

    void stop() {
        operator.stop();
        for (AutoCloseable closeable : background) {
            try {
                closeable.close();
            }
            catch (Exception e) {
                LOGGER.warn("Failed to stop {}", closeable, e);
            }
        }
        managementServer.close();
        LOGGER.info("Operator stopped.");
    }

    private MicrometerMetrics enablePrometheusMetrics() {
        return MicrometerMetrics.newPerResourceCollectingMicrometerMetricsBuilder(Metrics.globalRegistry)
                .withCleanUpDelayInSeconds(35)
                .withCleaningThreadNumber(1)
                .build();
    }
}

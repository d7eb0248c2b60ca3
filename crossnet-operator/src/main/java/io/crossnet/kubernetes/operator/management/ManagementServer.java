/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.management;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

/**
 * The operator's HTTP management endpoints: liveness and Prometheus metrics, {@code GET} only.
 */
public final class ManagementServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagementServer.class);

    public static final String HTTP_PATH_LIVEZ = "/livez";
    public static final String HTTP_PATH_METRICS = "/metrics";

    private static final String MAX_REQ_TIME_PROPERTY = "sun.net.httpserver.maxReqTime";
    private static final String MAX_RSP_TIME_PROPERTY = "sun.net.httpserver.maxRspTime";

    private final HttpServer httpServer;

    public ManagementServer(HttpServer httpServer) {
        this.httpServer = Objects.requireNonNull(httpServer);
        addGetHandler("/", () -> HttpURLConnection.HTTP_NOT_FOUND);
    }

    /**
     * Binds a server to {@code bindAddress}; it serves nothing until {@link #start()}.
     */
    public static ManagementServer bind(InetSocketAddress bindAddress) throws IOException {
        // the JDK server otherwise lets a slow client hold a connection forever
        if (System.getProperty(MAX_REQ_TIME_PROPERTY) == null) {
            System.setProperty(MAX_REQ_TIME_PROPERTY, "60");
        }
        if (System.getProperty(MAX_RSP_TIME_PROPERTY) == null) {
            System.setProperty(MAX_RSP_TIME_PROPERTY, "120");
        }
        LOGGER.info("Starting management server on: {}:{}", bindAddress.getHostString(), bindAddress.getPort());
        return new ManagementServer(HttpServer.create(bindAddress, 0));
    }

    /**
     * Serves {@link #HTTP_PATH_LIVEZ} with the status code {@code liveness} returns.
     */
    public ManagementServer withLiveness(IntSupplier liveness) {
        addGetHandler(HTTP_PATH_LIVEZ, liveness);
        return this;
    }

    /**
     * Serves {@link #HTTP_PATH_METRICS} from {@code registry}.
     */
    public ManagementServer withMetrics(PrometheusMeterRegistry registry) {
        httpServer.createContext(HTTP_PATH_METRICS, new MetricsHandler(registry.getPrometheusRegistry()))
                .getFilters().add(GetOnlyFilter.INSTANCE);
        return this;
    }

    public InetSocketAddress address() {
        return httpServer.getAddress();
    }

    public void start() {
        httpServer.start();
    }

    @Override
    public void close() {
        httpServer.stop(0);
    }

    private void addGetHandler(String path, IntSupplier statusCodeSupplier) {
        httpServer.createContext(path, exchange -> {
            try (exchange) {
                // GETs carry no body, so there is nothing to drain
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(GetOnlyFilter.INSTANCE);
    }
}

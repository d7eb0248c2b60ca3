/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.net.InetSocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import io.crossnet.kubernetes.api.sharing.v1alpha1.Advertisement;
import io.crossnet.kubernetes.api.sharing.v1alpha1.AdvertisementSpec;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.operator.management.ManagementServer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@EnableKubernetesMockClient(crud = true)
@ExtendWith(MockitoExtension.class)
class OperatorMainTest {

    private static final OperatorConfig.ConfigMapRef IDENTITY_CONFIG_MAP = new OperatorConfig.ConfigMapRef("crossnet", "crossnet-network-config");
    private static final InetSocketAddress BIND_ADDRESS = new InetSocketAddress("127.0.0.1", 0);

    KubernetesClient kubeClient;
    KubernetesMockServer mockServer;

    @Mock
    HttpServer httpServer;

    @Mock
    HttpContext httpContext;

    private OperatorMain operatorMain;

    @BeforeEach
    void setUp() {
        OperatorTestUtils.expectCustomResources(mockServer);
        when(httpServer.createContext(anyString(), any(HttpHandler.class))).thenReturn(httpContext);
    }

    @AfterEach
    void tearDown() {
        if (operatorMain != null) {
            operatorMain.stop();
        }
    }

    @Test
    void shouldRegisterPrometheusMeterRegistry() {
        // Given
        operatorMain = operatorMain(staticIdentityConfig());

        // When
        operatorMain.start();

        // Then
        assertThat(Metrics.globalRegistry.getRegistries())
                .hasAtLeastOneElementOfType(PrometheusMeterRegistry.class);
    }

    @Test
    void shouldRegisterMetricsForReconciler() {
        // Given
        operatorMain = operatorMain(staticIdentityConfig());

        // When
        operatorMain.start();

        // Then
        assertThat(Metrics.globalRegistry.get("operator.sdk.reconciliations.executions." + NetworkConfigReconciler.NAME).meter().getId()).isNotNull();
    }

    @Test
    void shouldStartManagementServer() {
        // Given
        operatorMain = operatorMain(staticIdentityConfig());

        // When
        operatorMain.start();

        // Then
        verify(httpServer).start();
        verify(httpServer).createContext(eq(ManagementServer.HTTP_PATH_METRICS), any(HttpHandler.class));
        verify(httpServer).createContext(eq(ManagementServer.HTTP_PATH_LIVEZ), any(HttpHandler.class));
    }

    @Test
    void shouldBridgeAdvertisementsWithStaticIdentity() {
        // Given
        operatorMain = operatorMain(staticIdentityConfig());
        operatorMain.start();

        // When
        kubeClient.resource(advertisement("cluster-b")).create();

        // Then
        Awaitility.await()
                .atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> {
                    NetworkConfig networkConfig = kubeClient.resources(NetworkConfig.class).withName("net-config-cluster-b").get();
                    assertThat(networkConfig).isNotNull();
                    assertThat(networkConfig.getSpec().getPodCIDR()).isEqualTo("10.1.0.0/16");
                });
    }

    @Test
    void shouldWaitForIdentityConfigMapWithoutStaticIdentity() {
        // Given
        operatorMain = operatorMain(new OperatorConfig(Optional.empty(), IDENTITY_CONFIG_MAP, Optional.empty(), BIND_ADDRESS));
        operatorMain.start();
        kubeClient.resource(advertisement("cluster-b")).create();

        // When
        kubeClient.configMaps().inNamespace(IDENTITY_CONFIG_MAP.namespace()).resource(new ConfigMapBuilder()
                .withNewMetadata().withName(IDENTITY_CONFIG_MAP.name()).endMetadata()
                .withData(Map.of(NetworkIdentityWatcher.POD_CIDR_KEY, "10.5.0.0/16",
                        NetworkIdentityWatcher.GATEWAY_IP_KEY, "192.0.2.5"))
                .build()).create();

        // Then
        Awaitility.await()
                .atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> {
                    NetworkConfig networkConfig = kubeClient.resources(NetworkConfig.class).withName("net-config-cluster-b").get();
                    assertThat(networkConfig).isNotNull();
                    assertThat(networkConfig.getSpec().getPodCIDR()).isEqualTo("10.5.0.0/16");
                    assertThat(networkConfig.getSpec().getTunnelPublicIP()).isEqualTo("192.0.2.5");
                });
    }

    private OperatorMain operatorMain(OperatorConfig config) {
        return new OperatorMain(config, kubeClient, new ManagementServer(httpServer));
    }

    private static OperatorConfig staticIdentityConfig() {
        return new OperatorConfig(Optional.of(NetworkIdentity.parse("10.1.0.0/16", "10.96.0.0/12", "192.0.2.1")),
                IDENTITY_CONFIG_MAP,
                Optional.of("cluster-a"),
                BIND_ADDRESS);
    }

    private static Advertisement advertisement(String clusterId) {
        var advertisement = new Advertisement();
        advertisement.setMetadata(new ObjectMetaBuilder().withName("adv-" + clusterId).build());
        var spec = new AdvertisementSpec();
        spec.setClusterId(clusterId);
        advertisement.setSpec(spec);
        return advertisement;
    }
}

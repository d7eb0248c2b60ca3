/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfig;
import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;
import io.crossnet.kubernetes.operator.allocator.Cidr;

import static io.crossnet.kubernetes.operator.ResourcesUtil.name;

/**
 * <p>Reconciles {@link NetworkConfig}s, the two halves of every peering.</p>
 *
 * <p>A {@code remote} record carries what a peer advertises about itself. Its pod range is checked
 * against the address space already in use here, and the outcome (keep the range, or use a
 * replacement) is written to its status exactly once.</p>
 *
 * <p>A {@code local} record carries what this cluster advertises to the peer, and comes back with
 * the peer's own NAT decision in its status. Once both halves are resolved they are joined into
 * the peer's {@link io.crossnet.kubernetes.api.v1alpha1.TunnelEndpoint}.</p>
 *
 * <p>Either half may be reconciled first, any number of times. A half that finds its counterpart
 * not yet ready reschedules itself rather than failing.</p>
 *
 * <p>The finalizer is managed by the framework: it is added on the first event, before
 * {@link #reconcile(NetworkConfig, Context)} runs, and {@link #cleanup(NetworkConfig, Context)}
 * runs before it is removed.</p>
 */
@ControllerConfiguration(name = NetworkConfigReconciler.NAME, finalizerName = NetworkConfigReconciler.FINALIZER, generationAwareEventProcessing = false)
public final class NetworkConfigReconciler implements Reconciler<NetworkConfig>, Cleaner<NetworkConfig> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkConfigReconciler.class);

    public static final String NAME = "networkconfig";
    public static final String FINALIZER = NetworkConfig.GROUP + "/finalizer";

    static final Duration PAIRING_RECHECK_INTERVAL = Duration.ofSeconds(5);

    private final ReadinessGate<LocalNetwork> localNetwork;
    private final TunnelEndpoints tunnelEndpoints;

    public NetworkConfigReconciler(ReadinessGate<LocalNetwork> localNetwork, TunnelEndpoints tunnelEndpoints) {
        this.localNetwork = Objects.requireNonNull(localNetwork);
        this.tunnelEndpoints = Objects.requireNonNull(tunnelEndpoints);
    }

    @Override
    public UpdateControl<NetworkConfig> reconcile(NetworkConfig networkConfig, Context<NetworkConfig> context) {
        LocalNetwork network = awaitLocalNetwork();
        Optional<Labels.Origin> origin = Labels.origin(networkConfig);
        if (origin.isEmpty()) {
            LOGGER.warn("NetworkConfig {} has no recognised {} label, ignoring it", name(networkConfig), Labels.ORIGIN);
            return UpdateControl.noUpdate();
        }
        UpdateControl<NetworkConfig> uc = switch (origin.get()) {
            case REMOTE -> reconcileRemote(networkConfig, network);
            case LOCAL -> reconcileLocal(networkConfig, context.getClient());
        };
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed reconciliation of {} NetworkConfig {}", origin.get().labelValue(), name(networkConfig));
        }
        return uc;
    }

    /**
     * Takes the NAT decision for the peer's pod range. A decision already taken is kept, and its range
     * stays reserved.
     */
    private UpdateControl<NetworkConfig> reconcileRemote(NetworkConfig remote, LocalNetwork network) {
        String clusterId = ResourcesUtil.peerClusterId(remote);
        Optional<Cidr> decided = ResourcesUtil.decidedRange(remote);
        if (decided.isPresent()) {
            LOGGER.debug("NAT decision for NetworkConfig {} already taken", name(remote));
            network.allocator().restore(decided.get(), clusterId);
            return UpdateControl.noUpdate();
        }
        if (remote.getSpec() == null || remote.getSpec().getPodCIDR() == null) {
            throw new InvalidNetworkConfigException("NetworkConfig " + name(remote) + " advertises no spec.podCIDR");
        }
        Cidr candidate = Cidr.parse(remote.getSpec().getPodCIDR());
        NetworkConfigStatus status = network.allocator().resolve(candidate, clusterId)
                .map(replacement -> NetworkConfigStatus.natEnabled(replacement.toString()))
                .orElseGet(NetworkConfigStatus::natDisabled);
        LOGGER.atInfo()
                .addArgument(candidate)
                .addArgument(clusterId)
                .addArgument(status::getPodCIDRNAT)
                .log("Pod range {} of cluster {} resolved to {}");
        return UpdateControl.patchStatus(statusPatch(remote, status));
    }

    /**
     * Joins this cluster's half with the peer's half once both have been resolved.
     */
    private UpdateControl<NetworkConfig> reconcileLocal(NetworkConfig local, KubernetesClient client) {
        if (!ResourcesUtil.status(local).isPodCIDRNATResolved()) {
            LOGGER.debug("NetworkConfig {} awaits the peer's NAT decision", name(local));
            return UpdateControl.<NetworkConfig> noUpdate().rescheduleAfter(PAIRING_RECHECK_INTERVAL);
        }
        String clusterId = ResourcesUtil.peerClusterId(local);
        List<NetworkConfig> remotes = client.resources(NetworkConfig.class)
                .withLabels(Labels.remoteSelector(clusterId))
                .list()
                .getItems();
        if (remotes.isEmpty()) {
            LOGGER.debug("No remote NetworkConfig for cluster {} yet", clusterId);
            return UpdateControl.<NetworkConfig> noUpdate().rescheduleAfter(PAIRING_RECHECK_INTERVAL);
        }
        if (remotes.size() > 1) {
            List<String> names = remotes.stream().map(ResourcesUtil::name).toList();
            LOGGER.error("Found {} remote NetworkConfigs for cluster {}: {}", names.size(), clusterId, names);
            throw new DuplicateNetworkConfigException(clusterId, names);
        }
        NetworkConfig remote = remotes.get(0);
        NetworkConfigStatus remoteStatus = ResourcesUtil.status(remote);
        if (!remoteStatus.isNatDecided() || !remoteStatus.isPodCIDRNATResolved()) {
            LOGGER.debug("Remote NetworkConfig {} has not taken its NAT decision yet", name(remote));
            return UpdateControl.<NetworkConfig> noUpdate().rescheduleAfter(PAIRING_RECHECK_INTERVAL);
        }
        if (remote.getSpec() == null || remote.getSpec().getPodCIDR() == null || remote.getSpec().getTunnelPublicIP() == null) {
            throw new InvalidNetworkConfigException("Remote NetworkConfig " + name(remote) + " lacks spec.podCIDR or spec.tunnelPublicIP");
        }
        tunnelEndpoints.reconcile(client, PairingParameters.join(clusterId, local, remote));
        return UpdateControl.noUpdate();
    }

    @Override
    public DeleteControl cleanup(NetworkConfig networkConfig, Context<NetworkConfig> context) {
        String clusterId = ResourcesUtil.peerClusterId(networkConfig);
        if (Labels.origin(networkConfig).filter(Labels.Origin.LOCAL::equals).isPresent()) {
            tunnelEndpoints.delete(context.getClient(), clusterId);
        }
        // only a remote record can hold a reservation, but release is a no-op for the others
        localNetwork.value()
                .ifPresent(network -> network.allocator().release(clusterId));
        LOGGER.info("Cleaned up NetworkConfig {} of cluster {}", name(networkConfig), clusterId);
        return DeleteControl.defaultDelete();
    }

    @Override
    public ErrorStatusUpdateControl<NetworkConfig> updateErrorStatus(NetworkConfig networkConfig,
                                                                    Context<NetworkConfig> context,
                                                                    Exception e) {
        ErrorStatusUpdateControl<NetworkConfig> uc = ErrorStatusUpdateControl.noStatusUpdate();
        if (e instanceof DuplicateNetworkConfigException || e instanceof InvalidNetworkConfigException) {
            // another attempt sees the same records
            uc.withNoRetry();
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed reconciliation of NetworkConfig {} with error {}", name(networkConfig), e.toString());
        }
        return uc;
    }

    private LocalNetwork awaitLocalNetwork() {
        try {
            return localNetwork.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the local network identity", e);
        }
    }

    private static NetworkConfig statusPatch(NetworkConfig networkConfig, NetworkConfigStatus status) {
        NetworkConfig patch = new NetworkConfig();
        patch.setMetadata(new ObjectMetaBuilder()
                .withName(name(networkConfig))
                .build());
        patch.setStatus(status);
        return patch;
    }
}

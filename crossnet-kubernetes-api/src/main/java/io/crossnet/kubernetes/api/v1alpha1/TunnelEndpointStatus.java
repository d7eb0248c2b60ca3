/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.kubernetes.api.model.KubernetesResource;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "localRemappedPodCIDR", "remoteRemappedPodCIDR", "phase" })
public class TunnelEndpointStatus implements KubernetesResource {

    /**
     * Phase of an endpoint whose remapped ranges have been written. Never reverted.
     */
    public static final String PHASE_PROCESSED = "Processed";

    /**
     * Range the peer uses to reach this cluster's pods, or {@link NetworkConfigStatus#NO_NAT}.
     */
    @JsonProperty("localRemappedPodCIDR")
    @JsonSetter(nulls = Nulls.SKIP)
    private String localRemappedPodCIDR;

    /**
     * Range this cluster uses to reach the peer's pods, or {@link NetworkConfigStatus#NO_NAT}.
     */
    @JsonProperty("remoteRemappedPodCIDR")
    @JsonSetter(nulls = Nulls.SKIP)
    private String remoteRemappedPodCIDR;

    @JsonProperty("phase")
    @JsonSetter(nulls = Nulls.SKIP)
    private String phase;

    public TunnelEndpointStatus() {
    }

    public String getLocalRemappedPodCIDR() {
        return localRemappedPodCIDR;
    }

    public void setLocalRemappedPodCIDR(String localRemappedPodCIDR) {
        this.localRemappedPodCIDR = localRemappedPodCIDR;
    }

    public String getRemoteRemappedPodCIDR() {
        return remoteRemappedPodCIDR;
    }

    public void setRemoteRemappedPodCIDR(String remoteRemappedPodCIDR) {
        this.remoteRemappedPodCIDR = remoteRemappedPodCIDR;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    @JsonIgnore
    public boolean isProcessed() {
        return PHASE_PROCESSED.equals(phase);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TunnelEndpointStatus that = (TunnelEndpointStatus) o;
        return Objects.equals(localRemappedPodCIDR, that.localRemappedPodCIDR)
                && Objects.equals(remoteRemappedPodCIDR, that.remoteRemappedPodCIDR)
                && Objects.equals(phase, that.phase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(localRemappedPodCIDR, remoteRemappedPodCIDR, phase);
    }

    @Override
    public String toString() {
        return "TunnelEndpointStatus(localRemappedPodCIDR=" + localRemappedPodCIDR + ", remoteRemappedPodCIDR=" + remoteRemappedPodCIDR + ", phase=" + phase
                + ")";
    }
}

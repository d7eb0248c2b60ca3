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

/**
 * Outcome of the NAT negotiation for a {@link NetworkConfig}.
 * <p>
 * {@code natEnabled} is kept as a string so that the three states (unset, {@code "true"},
 * {@code "false"}) survive a round trip through the API server.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "natEnabled", "podCIDRNAT" })
public class NetworkConfigStatus implements KubernetesResource {

    /**
     * Value of {@code podCIDRNAT} when no remapping was needed.
     */
    public static final String NO_NAT = "None";

    @JsonProperty("natEnabled")
    @JsonSetter(nulls = Nulls.SKIP)
    private String natEnabled;

    @JsonProperty("podCIDRNAT")
    @JsonSetter(nulls = Nulls.SKIP)
    private String podCIDRNAT;

    public NetworkConfigStatus() {
    }

    public NetworkConfigStatus(String natEnabled, String podCIDRNAT) {
        this.natEnabled = natEnabled;
        this.podCIDRNAT = podCIDRNAT;
    }

    public static NetworkConfigStatus natDisabled() {
        return new NetworkConfigStatus("false", NO_NAT);
    }

    public static NetworkConfigStatus natEnabled(String remappedPodCIDR) {
        return new NetworkConfigStatus("true", remappedPodCIDR);
    }

    public String getNatEnabled() {
        return natEnabled;
    }

    public void setNatEnabled(String natEnabled) {
        this.natEnabled = natEnabled;
    }

    public String getPodCIDRNAT() {
        return podCIDRNAT;
    }

    public void setPodCIDRNAT(String podCIDRNAT) {
        this.podCIDRNAT = podCIDRNAT;
    }

    /**
     * @return true if the NAT decision has been taken, whatever it was.
     */
    @JsonIgnore
    public boolean isNatDecided() {
        return natEnabled != null && !natEnabled.isEmpty();
    }

    /**
     * @return true if {@code podCIDRNAT} holds a value, either a remapped range or {@link #NO_NAT}.
     */
    @JsonIgnore
    public boolean isPodCIDRNATResolved() {
        return podCIDRNAT != null && !podCIDRNAT.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NetworkConfigStatus that = (NetworkConfigStatus) o;
        return Objects.equals(natEnabled, that.natEnabled) && Objects.equals(podCIDRNAT, that.podCIDRNAT);
    }

    @Override
    public int hashCode() {
        return Objects.hash(natEnabled, podCIDRNAT);
    }

    @Override
    public String toString() {
        return "NetworkConfigStatus(natEnabled=" + natEnabled + ", podCIDRNAT=" + podCIDRNAT + ")";
    }
}

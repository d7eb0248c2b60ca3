/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.kubernetes.api.model.KubernetesResource;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "clusterID", "podCIDR", "tunnelPublicIP" })
public class TunnelEndpointSpec implements KubernetesResource {

    @JsonProperty("clusterID")
    @JsonSetter(nulls = Nulls.SKIP)
    private String clusterID;

    /**
     * The peer's original pod range.
     */
    @JsonProperty("podCIDR")
    @JsonSetter(nulls = Nulls.SKIP)
    private String podCIDR;

    /**
     * The peer's gateway address.
     */
    @JsonProperty("tunnelPublicIP")
    @JsonSetter(nulls = Nulls.SKIP)
    private String tunnelPublicIP;

    public TunnelEndpointSpec() {
    }

    public TunnelEndpointSpec(String clusterID, String podCIDR, String tunnelPublicIP) {
        this.clusterID = clusterID;
        this.podCIDR = podCIDR;
        this.tunnelPublicIP = tunnelPublicIP;
    }

    public String getClusterID() {
        return clusterID;
    }

    public void setClusterID(String clusterID) {
        this.clusterID = clusterID;
    }

    public String getPodCIDR() {
        return podCIDR;
    }

    public void setPodCIDR(String podCIDR) {
        this.podCIDR = podCIDR;
    }

    public String getTunnelPublicIP() {
        return tunnelPublicIP;
    }

    public void setTunnelPublicIP(String tunnelPublicIP) {
        this.tunnelPublicIP = tunnelPublicIP;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TunnelEndpointSpec that = (TunnelEndpointSpec) o;
        return Objects.equals(clusterID, that.clusterID)
                && Objects.equals(podCIDR, that.podCIDR)
                && Objects.equals(tunnelPublicIP, that.tunnelPublicIP);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clusterID, podCIDR, tunnelPublicIP);
    }

    @Override
    public String toString() {
        return "TunnelEndpointSpec(clusterID=" + clusterID + ", podCIDR=" + podCIDR + ", tunnelPublicIP=" + tunnelPublicIP + ")";
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.discovery.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.kubernetes.api.model.KubernetesResource;

/**
 * Observed peering state. Each field holds a phase name; an absent field reads as {@link #PHASE_NONE}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForeignClusterStatus implements KubernetesResource {

    public static final String PHASE_NONE = "None";
    public static final String PHASE_PENDING = "Pending";
    public static final String PHASE_ESTABLISHED = "Established";

    @JsonProperty("incomingPeering")
    @JsonSetter(nulls = Nulls.SKIP)
    private String incomingPeering;

    @JsonProperty("outgoingPeering")
    @JsonSetter(nulls = Nulls.SKIP)
    private String outgoingPeering;

    @JsonProperty("authentication")
    @JsonSetter(nulls = Nulls.SKIP)
    private String authentication;

    @JsonProperty("network")
    @JsonSetter(nulls = Nulls.SKIP)
    private String network;

    public String getIncomingPeering() {
        return incomingPeering;
    }

    public void setIncomingPeering(String incomingPeering) {
        this.incomingPeering = incomingPeering;
    }

    public String getOutgoingPeering() {
        return outgoingPeering;
    }

    public void setOutgoingPeering(String outgoingPeering) {
        this.outgoingPeering = outgoingPeering;
    }

    public String getAuthentication() {
        return authentication;
    }

    public void setAuthentication(String authentication) {
        this.authentication = authentication;
    }

    public String getNetwork() {
        return network;
    }

    public void setNetwork(String network) {
        this.network = network;
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.sharing.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.kubernetes.api.model.KubernetesResource;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AdvertisementSpec implements KubernetesResource {

    @JsonProperty("clusterId")
    @JsonSetter(nulls = Nulls.SKIP)
    private String clusterId;

    @JsonProperty("network")
    @JsonSetter(nulls = Nulls.SKIP)
    private AdvertisedNetwork network;

    public String getClusterId() {
        return clusterId;
    }

    public void setClusterId(String clusterId) {
        this.clusterId = clusterId;
    }

    public AdvertisedNetwork getNetwork() {
        return network;
    }

    public void setNetwork(AdvertisedNetwork network) {
        this.network = network;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AdvertisedNetwork implements KubernetesResource {

        @JsonProperty("podCIDR")
        @JsonSetter(nulls = Nulls.SKIP)
        private String podCIDR;

        @JsonProperty("gatewayIP")
        @JsonSetter(nulls = Nulls.SKIP)
        private String gatewayIP;

        public String getPodCIDR() {
            return podCIDR;
        }

        public void setPodCIDR(String podCIDR) {
            this.podCIDR = podCIDR;
        }

        public String getGatewayIP() {
            return gatewayIP;
        }

        public void setGatewayIP(String gatewayIP) {
            this.gatewayIP = gatewayIP;
        }
    }
}

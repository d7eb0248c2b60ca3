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

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ForeignClusterSpec implements KubernetesResource {

    @JsonProperty("clusterIdentity")
    @JsonSetter(nulls = Nulls.SKIP)
    private ClusterIdentity clusterIdentity;

    public ForeignClusterSpec() {
    }

    public ForeignClusterSpec(ClusterIdentity clusterIdentity) {
        this.clusterIdentity = clusterIdentity;
    }

    public ClusterIdentity getClusterIdentity() {
        return clusterIdentity;
    }

    public void setClusterIdentity(ClusterIdentity clusterIdentity) {
        this.clusterIdentity = clusterIdentity;
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.discovery.v1alpha1;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

import io.fabric8.kubernetes.api.model.KubernetesResource;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterIdentity implements KubernetesResource {

    @JsonProperty("clusterID")
    @JsonSetter(nulls = Nulls.SKIP)
    private String clusterID;

    @JsonProperty("clusterName")
    @JsonSetter(nulls = Nulls.SKIP)
    private String clusterName;

    public ClusterIdentity() {
    }

    public ClusterIdentity(String clusterID, String clusterName) {
        this.clusterID = clusterID;
        this.clusterName = clusterName;
    }

    public String getClusterID() {
        return clusterID;
    }

    public void setClusterID(String clusterID) {
        this.clusterID = clusterID;
    }

    public String getClusterName() {
        return clusterName;
    }

    public void setClusterName(String clusterName) {
        this.clusterName = clusterName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClusterIdentity that = (ClusterIdentity) o;
        return Objects.equals(clusterID, that.clusterID) && Objects.equals(clusterName, that.clusterName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clusterID, clusterName);
    }

    @Override
    public String toString() {
        return "ClusterIdentity(clusterID=" + clusterID + ", clusterName=" + clusterName + ")";
    }
}

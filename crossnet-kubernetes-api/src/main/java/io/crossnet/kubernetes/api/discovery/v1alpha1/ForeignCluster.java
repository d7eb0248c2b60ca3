/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.discovery.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * This cluster's view of a peer, including the observed state of the peering in each direction.
 */
@Group(ForeignCluster.GROUP)
@Version(ForeignCluster.VERSION)
@Plural(ForeignCluster.PLURAL)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForeignCluster extends CustomResource<ForeignClusterSpec, ForeignClusterStatus> {

    public static final String GROUP = PeeringRequest.GROUP;
    public static final String VERSION = PeeringRequest.VERSION;
    public static final String PLURAL = "foreignclusters";

    /**
     * Label carrying the identifier of the cluster a {@link ForeignCluster} describes.
     */
    public static final String CLUSTER_ID_LABEL = GROUP + "/cluster-id";
}

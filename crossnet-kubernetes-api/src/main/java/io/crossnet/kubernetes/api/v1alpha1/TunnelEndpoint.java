/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Parameters of the tunnel towards one peer cluster, derived once both halves of the
 * {@link NetworkConfig} pairing have taken their NAT decision. Consumed by the component that
 * establishes the tunnel.
 */
@Group(TunnelEndpoint.GROUP)
@Version(TunnelEndpoint.VERSION)
@Plural(TunnelEndpoint.PLURAL)
@ShortNames("tep")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TunnelEndpoint extends CustomResource<TunnelEndpointSpec, TunnelEndpointStatus> {

    public static final String GROUP = NetworkConfig.GROUP;
    public static final String VERSION = NetworkConfig.VERSION;
    public static final String PLURAL = "tunnelendpoints";
    public static final String CRD_NAME = PLURAL + "." + GROUP;

    public static final String NAME_PREFIX = "tun-endpoint-";

    public static String nameFor(String clusterId) {
        return NAME_PREFIX + clusterId;
    }
}

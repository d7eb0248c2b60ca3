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
 * The pod network one side of a peering advertises to the other.
 * <p>
 * A record labelled {@code origin=local} was authored by this cluster for a peer; one labelled
 * {@code origin=remote} was authored by the peer and replicated here. The status is written only
 * by the cluster that received the record and carries its NAT decision.
 */
@Group(NetworkConfig.GROUP)
@Version(NetworkConfig.VERSION)
@Plural(NetworkConfig.PLURAL)
@ShortNames("nc")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NetworkConfig extends CustomResource<NetworkConfigSpec, NetworkConfigStatus> {

    public static final String GROUP = "net.crossnet.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "networkconfigs";
    public static final String CRD_NAME = PLURAL + "." + GROUP;

    /**
     * Prefix of the name given to every {@link NetworkConfig}; the peer's cluster identifier follows it.
     */
    public static final String NAME_PREFIX = "net-config-";

    public static String nameFor(String clusterId) {
        return NAME_PREFIX + clusterId;
    }
}

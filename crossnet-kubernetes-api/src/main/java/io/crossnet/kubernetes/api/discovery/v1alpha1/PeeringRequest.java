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
 * A peer cluster's request to peer with this one.
 */
@Group(PeeringRequest.GROUP)
@Version(PeeringRequest.VERSION)
@Plural(PeeringRequest.PLURAL)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeeringRequest extends CustomResource<PeeringRequestSpec, Void> {

    public static final String GROUP = "discovery.crossnet.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "peeringrequests";
    public static final String KIND = "PeeringRequest";
}

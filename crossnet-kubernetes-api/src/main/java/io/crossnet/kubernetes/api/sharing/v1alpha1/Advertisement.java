/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.api.sharing.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * A peer cluster's offer of resources. Only its cluster identifier matters to the network operator.
 */
@Group(Advertisement.GROUP)
@Version(Advertisement.VERSION)
@Plural(Advertisement.PLURAL)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Advertisement extends CustomResource<AdvertisementSpec, Void> {

    public static final String GROUP = "sharing.crossnet.io";
    public static final String VERSION = "v1alpha1";
    public static final String PLURAL = "advertisements";
    public static final String KIND = "Advertisement";
}

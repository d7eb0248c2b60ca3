/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.assertj;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.crossnet.kubernetes.api.v1alpha1.NetworkConfigStatus;
import io.crossnet.kubernetes.api.v1alpha1.TunnelEndpointStatus;

public class OperatorAssertions {

    // Static factory should not be instantiated.
    private OperatorAssertions() {
    }

    public static NetworkConfigStatusAssert assertThat(NetworkConfigStatus actual) {
        return NetworkConfigStatusAssert.assertThat(actual);
    }

    public static TunnelEndpointStatusAssert assertThat(TunnelEndpointStatus actual) {
        return TunnelEndpointStatusAssert.assertThat(actual);
    }

    public static <T extends HasMetadata> MetadataAssert<T> assertThat(T actual) {
        return MetadataAssert.assertThat(actual);
    }
}

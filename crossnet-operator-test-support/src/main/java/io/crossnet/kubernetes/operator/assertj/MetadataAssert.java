/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.assertj;

import org.assertj.core.api.AbstractObjectAssert;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.assertj.core.api.MapAssert;
import org.assertj.core.api.ObjectAssert;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;

@SuppressWarnings("UnusedReturnValue")
public class MetadataAssert<T extends HasMetadata> extends AbstractObjectAssert<MetadataAssert<T>, T> {
    private MetadataAssert(T actual) {
        super(actual, MetadataAssert.class);
    }

    public static <T extends HasMetadata> MetadataAssert<T> assertThat(T actual) {
        return new MetadataAssert<>(actual);
    }

    public MetadataAssert<T> hasName(String expected) {
        assertHasObjectMeta()
                .extracting(ObjectMeta::getName)
                .isEqualTo(expected);
        return this;
    }

    public MetadataAssert<T> hasLabel(String key, String expectedValue) {
        assertHasLabels().containsEntry(key, expectedValue);
        return this;
    }

    public MapAssert<String, String> assertHasLabels() {
        return assertHasObjectMeta()
                .extracting(ObjectMeta::getLabels)
                .asInstanceOf(InstanceOfAssertFactories.map(String.class, String.class));
    }

    ObjectAssert<ObjectMeta> assertHasObjectMeta() {
        return org.assertj.core.api.Assertions.assertThat(actual)
                .isNotNull()
                .asInstanceOf(InstanceOfAssertFactories.type(HasMetadata.class))
                .extracting(HasMetadata::getMetadata)
                .isNotNull()
                .asInstanceOf(InstanceOfAssertFactories.type(ObjectMeta.class));
    }
}

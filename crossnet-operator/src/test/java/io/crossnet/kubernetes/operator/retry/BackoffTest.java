/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.retry;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffTest {

    @Test
    void shouldHaveFiveStepDefault() {
        assertThat(Backoff.DEFAULT.steps()).isEqualTo(5);
        assertThat(Backoff.DEFAULT.initialDelay()).isEqualTo(Duration.ofMillis(10));
        assertThat(Backoff.DEFAULT.factor()).isEqualTo(1.0);
        assertThat(Backoff.DEFAULT.jitter()).isEqualTo(0.1);
    }

    @Test
    void shouldGrowDelayByFactor() {
        var intervals = new Backoff(4, Duration.ofMillis(10), 2.0, 0.0).intervalFunction();

        assertThat(intervals.apply(1)).isEqualTo(10L);
        assertThat(intervals.apply(2)).isEqualTo(20L);
        assertThat(intervals.apply(3)).isEqualTo(40L);
    }

    @Test
    void shouldKeepConstantDelayWithoutFactor() {
        var intervals = new Backoff(4, Duration.ofMillis(10), 1.0, 0.0).intervalFunction();

        assertThat(intervals.apply(1)).isEqualTo(10L);
        assertThat(intervals.apply(3)).isEqualTo(10L);
    }

    @Test
    void shouldKeepJitterWithinBounds() {
        var intervals = new Backoff(2, Duration.ofMillis(100), 1.0, 0.5).intervalFunction();

        for (int i = 0; i < 100; i++) {
            assertThat(intervals.apply(1)).isBetween(50L, 150L);
        }
    }

    @Test
    void shouldRejectInvalidParameters() {
        var delay = Duration.ofMillis(1);
        assertThatThrownBy(() -> new Backoff(0, delay, 1.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(1, Duration.ZERO, 1.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(1, delay, 0.5, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(1, delay, 1.0, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Backoff(1, delay, 1.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
    }
}

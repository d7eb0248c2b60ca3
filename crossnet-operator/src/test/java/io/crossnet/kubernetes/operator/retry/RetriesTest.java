/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.retry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.fabric8.kubernetes.client.KubernetesClientException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetriesTest {

    private static final Backoff FAST = new Backoff(3, Duration.ofMillis(1), 1.0, 0.0);

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldReturnFirstSuccess() {
        // Given
        var attempts = new AtomicInteger();

        // When
        var result = Retries.retryOnConflict(FAST, () -> {
            attempts.incrementAndGet();
            return "done";
        });

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldRetryAfterConflict() {
        // Given
        var attempts = new AtomicInteger();

        // When
        var result = Retries.retryOnConflict(FAST, () -> {
            if (attempts.incrementAndGet() == 1) {
                throw conflict();
            }
            return "done";
        });

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(2);
    }

    @Test
    void shouldPropagateLastConflictWhenAttemptsRunOut() {
        // Given
        var attempts = new AtomicInteger();

        // When
        // Then
        assertThatThrownBy(() -> Retries.retryOnConflict(FAST, () -> {
            attempts.incrementAndGet();
            throw conflict();
        }))
                .isInstanceOf(KubernetesClientException.class)
                .satisfies(e -> assertThat(Retries.isConflict(e)).isTrue());
        assertThat(attempts).hasValue(FAST.steps());
    }

    @Test
    void shouldNotRetryOtherFailures() {
        // Given
        var attempts = new AtomicInteger();

        // When
        // Then
        assertThatThrownBy(() -> Retries.retryOnConflict(FAST, () -> {
            attempts.incrementAndGet();
            throw new KubernetesClientException("boom", 500, null);
        }))
                .isInstanceOf(KubernetesClientException.class)
                .hasMessageContaining("boom");
        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldRetryWhileNotFound() {
        // Given
        var attempts = new AtomicInteger();

        // When
        var result = Retries.onError("read", FAST, Retries::isNotFound, () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new KubernetesClientException("missing", 404, null);
            }
            return 42;
        });

        // Then
        assertThat(result).isEqualTo(42);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        // Given
        var attempts = new AtomicInteger();
        Thread.currentThread().interrupt();

        // When
        // Then
        assertThatThrownBy(() -> Retries.retryOnConflict(new Backoff(3, Duration.ofMillis(50), 1.0, 0.0), () -> {
            attempts.incrementAndGet();
            throw conflict();
        }))
                .isInstanceOf(KubernetesClientException.class)
                .satisfies(e -> assertThat(Retries.isConflict(e)).isTrue());
        assertThat(attempts).hasValue(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void shouldBuildConfigFromBackoff() {
        // Given
        var config = Retries.config(FAST, Retries::isNotFound);

        // When
        // Then
        assertThat(config.getMaxAttempts()).isEqualTo(FAST.steps());
        assertThat(config.getExceptionPredicate().test(new KubernetesClientException("missing", 404, null))).isTrue();
        assertThat(config.getExceptionPredicate().test(conflict())).isFalse();
    }

    @Test
    void shouldClassifyByStatusCode() {
        assertThat(Retries.isConflict(conflict())).isTrue();
        assertThat(Retries.isNotFound(conflict())).isFalse();
        assertThat(Retries.isNotFound(new KubernetesClientException("missing", 404, null))).isTrue();
        assertThat(Retries.isConflict(new IllegalStateException())).isFalse();
    }

    private static KubernetesClientException conflict() {
        return new KubernetesClientException("conflict", 409, null);
    }
}

/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.retry;

import java.net.HttpURLConnection;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClientException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Read-modify-write loops against the API server.
 * <p>
 * The action passed in is re-run from scratch on each attempt, so it must re-read whatever it is
 * about to modify. When the attempts run out the last failure propagates unchanged. An interrupted
 * thread is not retried.
 */
public final class Retries {

    private static final Logger LOGGER = LoggerFactory.getLogger(Retries.class);

    private Retries() {
    }

    public static boolean isConflict(Throwable t) {
        return t instanceof KubernetesClientException kce && kce.getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    public static boolean isNotFound(Throwable t) {
        return t instanceof KubernetesClientException kce && kce.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    /**
     * Runs {@code action}, re-running it while it fails because the resource version it wrote against was stale.
     *
     * @param backoff attempt budget and spacing
     * @param action the read-modify-write to perform
     * @return the action's result
     * @param <T> result type
     */
    public static <T> T retryOnConflict(Backoff backoff, Supplier<T> action) {
        return onError("k8s-conflict-retry", backoff, Retries::isConflict, action);
    }

    /**
     * Runs {@code action}, re-running it while it fails with an exception {@code retriable} accepts.
     *
     * @param name name of the retry, used in logging
     * @param backoff attempt budget and spacing
     * @param retriable which failures are worth another attempt
     * @param action the operation to perform
     * @return the action's result
     * @param <T> result type
     */
    public static <T> T onError(String name, Backoff backoff, Predicate<Throwable> retriable, Supplier<T> action) {
        Objects.requireNonNull(action);
        var retry = Retry.of(name, config(backoff, retriable));
        retry.getEventPublisher().onRetry(event -> LOGGER.debug("{}: attempt {} of {} failed with {}, retrying in {}ms",
                name, event.getNumberOfRetryAttempts(), backoff.steps(), messageOf(event.getLastThrowable()), event.getWaitInterval().toMillis()));
        return retry.executeSupplier(action);
    }

    static RetryConfig config(Backoff backoff, Predicate<Throwable> retriable) {
        Objects.requireNonNull(backoff);
        Objects.requireNonNull(retriable);
        return RetryConfig.custom()
                .maxAttempts(backoff.steps())
                .intervalFunction(backoff.intervalFunction())
                .retryOnException(e -> !Thread.currentThread().isInterrupted() && retriable.test(e))
                .build();
    }

    private static String messageOf(@Nullable Throwable t) {
        return t == null ? "<none>" : t.getMessage();
    }
}

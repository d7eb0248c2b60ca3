/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator.retry;

import java.time.Duration;
import java.util.Objects;

import io.github.resilience4j.core.IntervalFunction;

/**
 * How often, and how far apart, an operation is re-attempted.
 *
 * @param steps maximum number of attempts, at least 1
 * @param initialDelay delay before the second attempt, at least one millisecond
 * @param factor multiplier applied to the delay after each attempt, at least 1.0
 * @param jitter fraction by which each delay is randomly shortened or lengthened, in [0.0, 1.0)
 */
public record Backoff(int steps, Duration initialDelay, double factor, double jitter) {

    /**
     * Five attempts, ten milliseconds apart, with ten percent jitter.
     */
    public static final Backoff DEFAULT = new Backoff(5, Duration.ofMillis(10), 1.0, 0.1);

    public Backoff {
        Objects.requireNonNull(initialDelay);
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, was " + steps);
        }
        if (initialDelay.toMillis() < 1) {
            throw new IllegalArgumentException("initialDelay must be at least 1ms, was " + initialDelay);
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("factor must be at least 1.0, was " + factor);
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0.0, 1.0), was " + jitter);
        }
    }

    /**
     * @return the wait before each re-attempt, keyed by the number of attempts made so far
     */
    IntervalFunction intervalFunction() {
        if (factor == 1.0) {
            return jitter == 0.0 ? IntervalFunction.of(initialDelay) : IntervalFunction.ofRandomized(initialDelay, jitter);
        }
        return jitter == 0.0 ? IntervalFunction.ofExponentialBackoff(initialDelay, factor)
                : IntervalFunction.ofExponentialRandomBackoff(initialDelay, factor, jitter);
    }
}

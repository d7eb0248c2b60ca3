/*
 * Copyright Crossnet Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.crossnet.kubernetes.operator;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A one-shot signal carrying a value. Opens at most once; waiters block until it does.
 *
 * @param <T> the type of value released to waiters
 */
public final class ReadinessGate<T> {

    private final CountDownLatch opened = new CountDownLatch(1);
    private final AtomicReference<T> value = new AtomicReference<>();

    /**
     * Opens the gate. Only the first call has any effect.
     *
     * @param value the value released to waiters
     * @return true if this call opened the gate
     */
    public boolean open(T value) {
        if (this.value.compareAndSet(null, Objects.requireNonNull(value))) {
            opened.countDown();
            return true;
        }
        return false;
    }

    public boolean isOpen() {
        return opened.getCount() == 0;
    }

    /**
     * @return the value the gate was opened with, or empty if it is still closed
     */
    public Optional<T> value() {
        return Optional.ofNullable(value.get());
    }

    /**
     * Blocks until the gate is open.
     *
     * @return the value the gate was opened with
     * @throws InterruptedException if interrupted while waiting
     */
    public T await() throws InterruptedException {
        opened.await();
        return value.get();
    }
}

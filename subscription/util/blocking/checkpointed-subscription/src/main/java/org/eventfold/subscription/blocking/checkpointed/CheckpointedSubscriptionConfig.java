/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventfold.subscription.blocking.checkpointed;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Configuration for {@link CheckpointedSubscription}. Instances are immutable, each {@code with} method returns a new configuration.
 */
public class CheckpointedSubscriptionConfig {
    private static final Consumer<Throwable> NO_FAILURE_LISTENER = __ -> {
    };

    /**
     * How long a single read from the global log waits for a new event before checking whether the subscription has been stopped.
     */
    public final Duration pollTimeout;
    /**
     * How long {@link CheckpointedSubscription#stop()} waits for the event being processed before interrupting the subscription thread.
     */
    public final Duration shutdownTimeout;
    /**
     * Invoked, on the subscription thread, when the subscription faults.
     */
    public final Consumer<Throwable> failureListener;

    private CheckpointedSubscriptionConfig(Duration pollTimeout, Duration shutdownTimeout, Consumer<Throwable> failureListener) {
        requireNonNull(pollTimeout, "Poll timeout cannot be null");
        requireNonNull(shutdownTimeout, "Shutdown timeout cannot be null");
        requireNonNull(failureListener, "Failure listener cannot be null");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("Poll timeout must be greater than zero");
        } else if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("Shutdown timeout cannot be negative");
        }
        this.pollTimeout = pollTimeout;
        this.shutdownTimeout = shutdownTimeout;
        this.failureListener = failureListener;
    }

    /**
     * @return The default configuration: 500 ms poll timeout, 5 s shutdown timeout and no failure listener.
     */
    public static CheckpointedSubscriptionConfig checkpointedSubscriptionConfig() {
        return new CheckpointedSubscriptionConfig(Duration.ofMillis(500), Duration.ofSeconds(5), NO_FAILURE_LISTENER);
    }

    public CheckpointedSubscriptionConfig pollTimeout(Duration pollTimeout) {
        return new CheckpointedSubscriptionConfig(pollTimeout, shutdownTimeout, failureListener);
    }

    public CheckpointedSubscriptionConfig shutdownTimeout(Duration shutdownTimeout) {
        return new CheckpointedSubscriptionConfig(pollTimeout, shutdownTimeout, failureListener);
    }

    public CheckpointedSubscriptionConfig failureListener(Consumer<Throwable> failureListener) {
        return new CheckpointedSubscriptionConfig(pollTimeout, shutdownTimeout, failureListener);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckpointedSubscriptionConfig)) return false;
        CheckpointedSubscriptionConfig that = (CheckpointedSubscriptionConfig) o;
        return Objects.equals(pollTimeout, that.pollTimeout) &&
                Objects.equals(shutdownTimeout, that.shutdownTimeout) &&
                Objects.equals(failureListener, that.failureListener);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pollTimeout, shutdownTimeout, failureListener);
    }

    @Override
    public String toString() {
        return "CheckpointedSubscriptionConfig{" +
                "pollTimeout=" + pollTimeout +
                ", shutdownTimeout=" + shutdownTimeout +
                '}';
    }
}

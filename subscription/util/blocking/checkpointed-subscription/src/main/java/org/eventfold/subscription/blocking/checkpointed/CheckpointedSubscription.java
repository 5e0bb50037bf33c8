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

import io.cloudevents.CloudEvent;
import jakarta.annotation.PreDestroy;
import org.eventfold.eventstore.api.blocking.AllStreamSubscription;
import org.eventfold.eventstore.api.blocking.SubscribeToAll;
import org.eventfold.subscription.SubscriptionPosition;
import org.eventfold.subscription.api.blocking.CheckpointStore;
import org.eventfold.subscription.api.blocking.ProjectionException;
import org.eventfold.subscription.api.blocking.ProjectionHandler;
import org.eventfold.subscription.api.blocking.SubscriptionStatus;
import org.eventfold.subscription.api.blocking.TransactionalSink;
import org.eventfold.subscription.internal.ExecutorShutdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;
import static org.eventfold.cloudevents.EventfoldExtensionGetter.getGlobalPosition;
import static org.eventfold.subscription.api.blocking.SubscriptionStatus.CATCHING_UP;
import static org.eventfold.subscription.api.blocking.SubscriptionStatus.FAULTED;
import static org.eventfold.subscription.api.blocking.SubscriptionStatus.IDLE;
import static org.eventfold.subscription.api.blocking.SubscriptionStatus.LIVE;
import static org.eventfold.subscription.api.blocking.SubscriptionStatus.STOPPED;
import static org.eventfold.subscription.blocking.checkpointed.CheckpointedSubscriptionConfig.checkpointedSubscriptionConfig;

/**
 * A named subscription to the global log that feeds every event to a list of {@link ProjectionHandler}s and records its progress
 * in a {@link CheckpointStore}.
 * <p>
 * Each event is processed in its own transaction of the {@link TransactionalSink}: the handlers are invoked in registration order
 * and then the checkpoint is saved, so projection changes and checkpoint are committed, or rolled back, together.
 * Events are processed one at a time, on a single thread, in global position order.
 * </p>
 * <p>
 * When a handler throws, the transaction is rolled back and the subscription becomes {@link SubscriptionStatus#FAULTED FAULTED}:
 * it stops consuming and reports a {@link ProjectionException} to the configured failure listener. It's not restarted automatically,
 * calling {@link #start()} again resumes from the last committed checkpoint, i.e. with the event that failed.
 * </p>
 *
 * @param <TX> The type of the transaction handed out by the sink
 */
public class CheckpointedSubscription<TX> {
    private static final Logger log = LoggerFactory.getLogger(CheckpointedSubscription.class);

    private final String subscriptionName;
    private final SubscribeToAll eventStore;
    private final TransactionalSink<TX> transactionalSink;
    private final CheckpointStore<TX> checkpointStore;
    private final List<ProjectionHandler<TX>> projectionHandlers;
    private final CheckpointedSubscriptionConfig config;

    private final Object lifecycleLock = new Object();
    private volatile SubscriptionStatus status = IDLE;
    private volatile Throwable failure;
    private volatile long lastCommittedPosition = -1;
    private volatile boolean stopRequested;
    private volatile CountDownLatch started = new CountDownLatch(1);
    private ExecutorService executor;

    public CheckpointedSubscription(String subscriptionName, SubscribeToAll eventStore, TransactionalSink<TX> transactionalSink,
                                    CheckpointStore<TX> checkpointStore, List<ProjectionHandler<TX>> projectionHandlers) {
        this(subscriptionName, eventStore, transactionalSink, checkpointStore, projectionHandlers, checkpointedSubscriptionConfig());
    }

    public CheckpointedSubscription(String subscriptionName, SubscribeToAll eventStore, TransactionalSink<TX> transactionalSink,
                                    CheckpointStore<TX> checkpointStore, List<ProjectionHandler<TX>> projectionHandlers, CheckpointedSubscriptionConfig config) {
        requireNonNull(subscriptionName, "Subscription name cannot be null");
        requireNonNull(eventStore, "Event store cannot be null");
        requireNonNull(transactionalSink, TransactionalSink.class.getSimpleName() + " cannot be null");
        requireNonNull(checkpointStore, CheckpointStore.class.getSimpleName() + " cannot be null");
        requireNonNull(projectionHandlers, "Projection handlers cannot be null");
        requireNonNull(config, CheckpointedSubscriptionConfig.class.getSimpleName() + " cannot be null");
        if (subscriptionName.isBlank()) {
            throw new IllegalArgumentException("Subscription name cannot be blank");
        } else if (projectionHandlers.isEmpty()) {
            throw new IllegalArgumentException("At least one projection handler is required");
        }
        this.subscriptionName = subscriptionName;
        this.eventStore = eventStore;
        this.transactionalSink = transactionalSink;
        this.checkpointStore = checkpointStore;
        this.projectionHandlers = List.copyOf(projectionHandlers);
        this.config = config;
    }

    /**
     * Load the checkpoint and start consuming the global log strictly after it. Allowed when the subscription is
     * {@link SubscriptionStatus#IDLE IDLE}, {@link SubscriptionStatus#STOPPED STOPPED} or {@link SubscriptionStatus#FAULTED FAULTED}.
     * Failures to load the checkpoint or to open the log are thrown to the caller.
     *
     * @throws IllegalStateException If the subscription is already running
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (status.isRunning()) {
                throw new IllegalStateException("Subscription " + subscriptionName + " is already running");
            }
            if (executor != null) {
                ExecutorShutdown.shutdownSafely(executor, config.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            SubscriptionPosition position = checkpointStore.load(subscriptionName);
            AllStreamSubscription cursor = eventStore.subscribeToAll(position);

            stopRequested = false;
            failure = null;
            lastCommittedPosition = position.nextGlobalPosition() - 1;
            started = new CountDownLatch(1);
            log.info("Starting subscription {} {}", subscriptionName, position);
            transitionTo(cursor.isCaughtUp() ? LIVE : CATCHING_UP);

            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, "eventfold-subscription-" + subscriptionName);
                thread.setDaemon(true);
                return thread;
            });
            executor.execute(() -> consume(cursor));
        }
    }

    /**
     * Stop consuming. The event being processed, if any, is committed or rolled back before this method returns,
     * unless it takes longer than the configured shutdown timeout in which case the subscription thread is interrupted.
     */
    @PreDestroy
    public void stop() {
        ExecutorService executorToStop;
        synchronized (lifecycleLock) {
            stopRequested = true;
            executorToStop = executor;
            executor = null;
        }
        if (executorToStop != null) {
            ExecutorShutdown.shutdownSafely(executorToStop, config.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        synchronized (lifecycleLock) {
            if (status != FAULTED && status != STOPPED) {
                transitionTo(STOPPED);
            }
        }
    }

    /**
     * Wait until the subscription thread has started to consume the log.
     *
     * @param timeout The maximum time to wait
     * @return <code>true</code> if the subscription started within {@code timeout}, <code>false</code> otherwise.
     */
    public boolean waitUntilStarted(Duration timeout) {
        try {
            return started.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String name() {
        return subscriptionName;
    }

    public SubscriptionStatus status() {
        return status;
    }

    /**
     * @return The cause of the last fault, or {@code null} if the subscription is not {@link SubscriptionStatus#FAULTED FAULTED}.
     */
    public Throwable failure() {
        return failure;
    }

    /**
     * @return The global position of the last event committed by this subscription, {@code -1} if none.
     */
    public long lastCommittedPosition() {
        return lastCommittedPosition;
    }

    private void consume(AllStreamSubscription cursor) {
        started.countDown();
        try (cursor) {
            while (!stopRequested) {
                CloudEvent cloudEvent = cursor.poll(config.pollTimeout);
                if (cloudEvent != null) {
                    process(cloudEvent);
                }
                if (status == CATCHING_UP && cursor.isCaughtUp()) {
                    switchToLiveUnlessStopped();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Subscription {} was interrupted", subscriptionName);
        } catch (RuntimeException e) {
            fault(e);
        }
    }

    private void process(CloudEvent cloudEvent) {
        long globalPosition = getGlobalPosition(cloudEvent);
        log.debug("Subscription {} processing event {} of type {} at global position {}", subscriptionName, cloudEvent.getId(), cloudEvent.getType(), globalPosition);
        transactionalSink.inTransaction(transaction -> {
            for (ProjectionHandler<TX> projectionHandler : projectionHandlers) {
                try {
                    projectionHandler.handle(transaction, cloudEvent);
                } catch (RuntimeException e) {
                    throw new ProjectionException(subscriptionName, globalPosition, cloudEvent.getType(), e);
                }
            }
            checkpointStore.save(transaction, subscriptionName, globalPosition);
        });
        lastCommittedPosition = globalPosition;
    }

    private void switchToLiveUnlessStopped() {
        synchronized (lifecycleLock) {
            if (!stopRequested && status == CATCHING_UP) {
                transitionTo(LIVE);
            }
        }
    }

    private void fault(RuntimeException e) {
        synchronized (lifecycleLock) {
            failure = e;
            transitionTo(FAULTED);
        }
        log.error("Subscription {} faulted, last committed global position is {}", subscriptionName, lastCommittedPosition, e);
        try {
            config.failureListener.accept(e);
        } catch (RuntimeException listenerException) {
            log.warn("Failure listener of subscription {} threw an exception", subscriptionName, listenerException);
        }
    }

    private void transitionTo(SubscriptionStatus newStatus) {
        SubscriptionStatus oldStatus = status;
        status = newStatus;
        log.info("Subscription {} changed status from {} to {}", subscriptionName, oldStatus, newStatus);
    }

    @Override
    public String toString() {
        return "CheckpointedSubscription{" +
                "subscriptionName='" + subscriptionName + '\'' +
                ", status=" + status +
                ", lastCommittedPosition=" + lastCommittedPosition +
                '}';
    }
}

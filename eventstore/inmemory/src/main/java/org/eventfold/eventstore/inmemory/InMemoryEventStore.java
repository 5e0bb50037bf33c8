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

package org.eventfold.eventstore.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.eventfold.cloudevents.EventfoldCloudEventExtension;
import org.eventfold.eventstore.api.ConcurrencyConflictException;
import org.eventfold.eventstore.api.ExpectedRevision;
import org.eventfold.eventstore.api.WriteResult;
import org.eventfold.eventstore.api.blocking.AllStreamSubscription;
import org.eventfold.eventstore.api.blocking.EventStore;
import org.eventfold.eventstore.api.blocking.EventStream;
import org.eventfold.subscription.SubscriptionPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;
import static org.eventfold.eventstore.api.ExpectedRevision.NO_STREAM_REVISION;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. Appends to all streams are serialized by one lock, which also gives the global log its total order.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition eventsAppended = lock.newCondition();
    private final Map<String, List<CloudEvent>> streams = new HashMap<>();
    private final List<CloudEvent> globalLog = new ArrayList<>();

    @Override
    public EventStream<CloudEvent> read(String streamId) {
        requireNonNull(streamId, "Stream id cannot be null");
        lock.lock();
        try {
            List<CloudEvent> events = streams.get(streamId);
            if (events == null) {
                return new EventStreamImpl(streamId, NO_STREAM_REVISION, Collections.emptyList());
            }
            return new EventStreamImpl(streamId, events.size() - 1, List.copyOf(events));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WriteResult write(String streamId, ExpectedRevision expectedRevision, Stream<CloudEvent> events) {
        requireNonNull(streamId, "Stream id cannot be null");
        requireNonNull(expectedRevision, ExpectedRevision.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        // Materialize before taking the lock, the stream may be lazy and call back into user code
        List<CloudEvent> newEvents = events.peek(e -> requireTrue(e.getSpecVersion() == SpecVersion.V1, "Spec version needs to be " + SpecVersion.V1)).collect(Collectors.toList());

        lock.lock();
        try {
            List<CloudEvent> currentEvents = streams.get(streamId);
            long currentRevision = currentEvents == null ? NO_STREAM_REVISION : currentEvents.size() - 1;
            if (!expectedRevision.isSatisfiedBy(currentRevision)) {
                throw new ConcurrencyConflictException(streamId, currentRevision, expectedRevision);
            }

            if (newEvents.isEmpty()) {
                return new WriteResult(streamId, currentRevision, currentRevision);
            }

            List<CloudEvent> stream = currentEvents == null ? new ArrayList<>() : currentEvents;
            long revision = currentRevision;
            for (CloudEvent newEvent : newEvents) {
                revision++;
                CloudEvent stored = CloudEventBuilder.v1(newEvent)
                        .withExtension(new EventfoldCloudEventExtension(streamId, revision, globalLog.size()))
                        .build();
                stream.add(stored);
                globalLog.add(stored);
            }
            streams.put(streamId, stream);
            eventsAppended.signalAll();
            log.debug("Appended {} event(s) to stream {}, revision {} -> {}", newEvents.size(), streamId, currentRevision, revision);
            return new WriteResult(streamId, currentRevision, revision);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String streamId) {
        lock.lock();
        try {
            return streams.containsKey(streamId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public AllStreamSubscription subscribeToAll(SubscriptionPosition position) {
        requireNonNull(position, SubscriptionPosition.class.getSimpleName() + " cannot be null");
        return new InMemoryAllStreamSubscription(position.nextGlobalPosition());
    }

    /**
     * @return The global position of the last appended event, {@code -1} if the store is empty.
     */
    public long globalPosition() {
        lock.lock();
        try {
            return globalLog.size() - 1;
        } finally {
            lock.unlock();
        }
    }

    private class InMemoryAllStreamSubscription implements AllStreamSubscription {
        private long nextPosition;
        private volatile boolean closed;

        private InMemoryAllStreamSubscription(long nextPosition) {
            this.nextPosition = nextPosition;
        }

        @Override
        public CloudEvent poll(Duration timeout) throws InterruptedException {
            long nanos = timeout.toNanos();
            lock.lockInterruptibly();
            try {
                while (!closed && nextPosition >= globalLog.size()) {
                    if (nanos <= 0) {
                        return null;
                    }
                    nanos = eventsAppended.awaitNanos(nanos);
                }
                if (closed) {
                    return null;
                }
                return globalLog.get((int) nextPosition++);
            } finally {
                lock.unlock();
            }
        }

        @Override
        public boolean isCaughtUp() {
            lock.lock();
            try {
                return nextPosition >= globalLog.size();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void close() {
            closed = true;
            if (lock.tryLock()) {
                try {
                    eventsAppended.signalAll();
                } finally {
                    lock.unlock();
                }
            }
        }
    }

    private static class EventStreamImpl implements EventStream<CloudEvent> {
        private final String streamId;
        private final long revision;
        private final List<CloudEvent> events;

        EventStreamImpl(String streamId, long revision, List<CloudEvent> events) {
            this.streamId = streamId;
            this.revision = revision;
            this.events = events;
        }

        @Override
        public String id() {
            return streamId;
        }

        @Override
        public long revision() {
            return revision;
        }

        @Override
        public Stream<CloudEvent> events() {
            return events.stream();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof EventStreamImpl)) return false;
            EventStreamImpl that = (EventStreamImpl) o;
            return revision == that.revision &&
                    Objects.equals(streamId, that.streamId) &&
                    Objects.equals(events, that.events);
        }

        @Override
        public int hashCode() {
            return Objects.hash(streamId, revision, events);
        }

        @Override
        public String toString() {
            return "EventStreamImpl{" +
                    "streamId='" + streamId + '\'' +
                    ", revision=" + revision +
                    ", events=" + events +
                    '}';
        }
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }
}

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

package org.eventfold.subscription.api.blocking;

import org.eventfold.subscription.SubscriptionPosition;

/**
 * A {@code CheckpointStore} provides means to read and write the position of a named subscription in the global log.
 * A subscription continues where it left off by starting from the {@link SubscriptionPosition} returned by {@link #load(String)}
 * when the application is restarted etc.
 * <p>
 * Checkpoints are written in the same transaction as the projection changes they cover, which is why {@link #save(Object, String, long)}
 * takes the transaction of the caller.
 * </p>
 *
 * @param <TX> The type of the transaction, as handed out by the {@link TransactionalSink} the store belongs to
 */
public interface CheckpointStore<TX> {

    /**
     * Read the checkpoint of a subscription.
     *
     * @param subscriptionName The name of the subscription
     * @return {@link SubscriptionPosition#after(long)} the saved position, or {@link SubscriptionPosition#beginning()} if nothing has been saved
     */
    SubscriptionPosition load(String subscriptionName);

    /**
     * Save the global position of the last event processed by a subscription. Checkpoints only ever advance,
     * saving a position that is not greater than the stored one has no effect, so retrying a save is harmless.
     *
     * @param transaction      The transaction to write the checkpoint in
     * @param subscriptionName The name of the subscription
     * @param globalPosition   The global position of the last processed event
     */
    void save(TX transaction, String subscriptionName, long globalPosition);

    /**
     * Delete the checkpoint of a subscription, making it start over from the beginning of the log the next time it's started.
     *
     * @param subscriptionName The name of the subscription
     */
    void delete(String subscriptionName);

    /**
     * @param subscriptionName The name of the subscription
     * @return <code>true</code> if a checkpoint has been saved for the subscription, <code>false</code> otherwise.
     */
    boolean exists(String subscriptionName);
}

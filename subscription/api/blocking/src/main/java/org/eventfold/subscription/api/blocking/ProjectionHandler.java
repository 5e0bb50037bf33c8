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

import io.cloudevents.CloudEvent;

/**
 * Applies an event to a projection. Events may be delivered more than once, so implementations that mutate
 * versioned rows must be idempotent, typically by guarding each change with a compare-and-swap on the stored stream revision.
 * An exception thrown from {@link #handle(Object, CloudEvent)} rolls back the transaction and faults the subscription.
 *
 * @param <TX> The type of the transaction the handler writes in
 */
@FunctionalInterface
public interface ProjectionHandler<TX> {
    void handle(TX transaction, CloudEvent cloudEvent);
}

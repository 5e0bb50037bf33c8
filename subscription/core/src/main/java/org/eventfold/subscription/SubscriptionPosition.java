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

package org.eventfold.subscription;

/**
 * A position in the global log from which a subscription reads. Reading is exclusive: a subscription started
 * {@link #after(long) after} position {@code n} receives the event at {@code n + 1} first.
 */
public sealed interface SubscriptionPosition {

    /**
     * @return A position that makes a subscription read the global log from its very first event.
     */
    static SubscriptionPosition beginning() {
        return Beginning.INSTANCE;
    }

    /**
     * @param globalPosition The global position of the last event that has been processed.
     * @return A position that makes a subscription resume strictly after {@code globalPosition}.
     */
    static SubscriptionPosition after(long globalPosition) {
        return new After(globalPosition);
    }

    /**
     * @return The global position of the first event a subscription starting at this position will receive.
     */
    long nextGlobalPosition();

    default boolean isBeginning() {
        return this instanceof Beginning;
    }

    final class Beginning implements SubscriptionPosition {
        private static final Beginning INSTANCE = new Beginning();

        private Beginning() {
        }

        @Override
        public long nextGlobalPosition() {
            return 0;
        }

        @Override
        public String toString() {
            return "beginning";
        }
    }

    record After(long globalPosition) implements SubscriptionPosition {
        public After {
            if (globalPosition < 0) {
                throw new IllegalArgumentException("Global position cannot be negative, was " + globalPosition);
            }
        }

        @Override
        public long nextGlobalPosition() {
            return globalPosition + 1;
        }

        @Override
        public String toString() {
            return "after " + globalPosition;
        }
    }
}

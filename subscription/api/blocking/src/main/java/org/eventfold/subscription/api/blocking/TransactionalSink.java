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

import java.util.function.Consumer;

/**
 * The store that projections are written to, seen as a source of short-lived transactions.
 *
 * @param <TX> The type of the unit of work handed to the consumer
 */
public interface TransactionalSink<TX> {

    /**
     * Run {@code work} in a new transaction. The transaction is committed when {@code work} returns normally and rolled back
     * when it throws, in which case the exception is propagated to the caller. A transaction that is rolled back for any other
     * reason must also be reported by throwing, returning normally means that the work has been committed.
     *
     * @param work The work to perform in the transaction
     */
    void inTransaction(Consumer<TX> work);
}

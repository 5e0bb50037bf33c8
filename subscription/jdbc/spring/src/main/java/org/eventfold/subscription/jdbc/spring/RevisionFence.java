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

package org.eventfold.subscription.jdbc.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Makes projection handlers idempotent under redelivery. A projection row carries the stream revision of the last event applied to it,
 * and an event with revision {@code n} is only applied if the row can be moved from revision {@code n - 1} to {@code n}:
 * <pre>
 * UPDATE table SET revision = n WHERE key = ? AND revision = n - 1
 * </pre>
 * If no row is updated the event has already been applied (or the row is not at the preceding revision) and the handler should do nothing.
 * The fence must be evaluated in the same transaction as the changes it guards.
 */
public class RevisionFence {
    private static final Logger log = LoggerFactory.getLogger(RevisionFence.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final String tableName;
    private final String advanceRevision;

    public RevisionFence(String tableName, String keyColumn) {
        this(tableName, keyColumn, "revision");
    }

    public RevisionFence(String tableName, String keyColumn, String revisionColumn) {
        requireIdentifier(tableName, "Table name");
        requireIdentifier(keyColumn, "Key column");
        requireIdentifier(revisionColumn, "Revision column");
        this.tableName = tableName;
        this.advanceRevision = "UPDATE " + tableName + " SET " + revisionColumn + " = ? WHERE " + keyColumn + " = ? AND " + revisionColumn + " = ?";
    }

    /**
     * Move the row identified by {@code key} to {@code revision} if it's at {@code revision - 1}.
     *
     * @param transaction The transaction of the event being applied
     * @param key         The key of the projection row
     * @param revision    The stream revision of the event being applied
     * @return {@code true} if the event should be applied, {@code false} if it has already been applied
     */
    public boolean tryAdvance(JdbcProjectionTransaction transaction, Object key, long revision) {
        requireNonNull(transaction, JdbcProjectionTransaction.class.getSimpleName() + " cannot be null");
        requireNonNull(key, "Key cannot be null");
        if (revision < 1) {
            throw new IllegalArgumentException("Only revisions after the first one can be fenced, was " + revision);
        }
        boolean advanced = transaction.update(advanceRevision, revision, key, revision - 1) > 0;
        if (!advanced) {
            log.debug("Skipping revision {} of {} in {}, it's already been applied", revision, key, tableName);
        }
        return advanced;
    }

    private static void requireIdentifier(String identifier, String what) {
        requireNonNull(identifier, what + " cannot be null");
        if (!IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid " + what.toLowerCase() + ": " + identifier);
        }
    }
}

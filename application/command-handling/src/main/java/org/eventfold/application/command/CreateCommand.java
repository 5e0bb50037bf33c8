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

package org.eventfold.application.command;

import org.eventfold.eventstore.api.WriteResult;

/**
 * A create command bound to its decision function, ready to be executed against a stream.
 *
 * @param <C> The type of the command
 */
@FunctionalInterface
public interface CreateCommand<C> {
    WriteResult execute(String streamId, C command);
}

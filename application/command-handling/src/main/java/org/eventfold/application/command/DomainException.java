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

import static java.util.Objects.requireNonNull;

/**
 * Base class for business rule violations raised by decision functions. Command handlers let these propagate
 * untouched and never retry them.
 */
public class DomainException extends RuntimeException {
    private final String errorCode;

    public DomainException(String errorCode, String message) {
        super(message);
        requireNonNull(errorCode, "Error code cannot be null");
        this.errorCode = errorCode;
    }

    public DomainException(String errorCode) {
        this(errorCode, errorCode);
    }

    /**
     * @return A stable, machine-readable code identifying the rule that was violated
     */
    public String getErrorCode() {
        return errorCode;
    }
}

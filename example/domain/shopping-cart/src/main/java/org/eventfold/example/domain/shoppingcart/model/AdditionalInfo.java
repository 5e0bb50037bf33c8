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

package org.eventfold.example.domain.shoppingcart.model;

import org.jspecify.annotations.Nullable;

/**
 * Free-form delivery information supplied when confirming a cart.
 */
public record AdditionalInfo(@Nullable String content, @Nullable String line1, @Nullable String line2) {

    public static AdditionalInfo none() {
        return new AdditionalInfo(null, null, null);
    }
}

/*
 * OptionContract.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.relmap.api.options;

import org.relmap.api.Options;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;

/**
 * A rule that every value stored under an {@link Options.Name} has to satisfy.
 */
public interface OptionContract {

    /**
     * Validate a value.
     *
     * @param name the option being set
     * @param value the value being set
     * @throws RelationalException with {@code INVALID_PARAMETER} if the value violates the contract
     */
    void validate(@Nonnull Options.Name name, Object value) throws RelationalException;
}

/*
 * AttributeNotFoundException.java
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

package org.relmap.api.exceptions;

import org.relmap.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Raised when a schema attribute is looked up by a name the schema does not define.
 */
@API(API.Status.EXPERIMENTAL)
public class AttributeNotFoundException extends RelationalException {
    private static final long serialVersionUID = 1L;

    public AttributeNotFoundException(@Nonnull String message) {
        super(message, ErrorCode.UNDEFINED_ATTRIBUTE);
    }

    public AttributeNotFoundException(@Nonnull String message, @Nullable Throwable cause) {
        super(message, ErrorCode.UNDEFINED_ATTRIBUTE, cause);
    }
}

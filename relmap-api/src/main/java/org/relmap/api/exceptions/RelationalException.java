/*
 * RelationalException.java
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The checked exception raised by relations, gateways and adapters. Every instance carries an {@link ErrorCode}.
 */
@API(API.Status.EXPERIMENTAL)
public class RelationalException extends Exception {
    private static final long serialVersionUID = 1L;

    @Nonnull
    private final ErrorCode errorCode;

    @Nonnull
    private final Map<String, Object> context = new LinkedHashMap<>();

    public RelationalException(@Nonnull String message, @Nonnull ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public RelationalException(@Nonnull String message, @Nonnull ErrorCode errorCode, @Nullable Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public RelationalException(@Nonnull ErrorCode errorCode, @Nonnull Throwable cause) {
        super(cause);
        this.errorCode = errorCode;
    }

    @Nonnull
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Attach a key/value pair that describes the failing call. Context is logged with the exception.
     *
     * @param key the name of the value
     * @param value the value
     * @return this exception
     */
    @Nonnull
    public RelationalException addContext(@Nonnull String key, @Nullable Object value) {
        context.put(key, value);
        return this;
    }

    @Nonnull
    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Wrap this exception so that it can cross an API that does not allow checked exceptions, such as
     * {@link java.util.Iterator} or a lambda. Callers on the other side use {@link UncheckedRelationalException#unwrap()}.
     *
     * @return an unchecked wrapper around this exception
     */
    @Nonnull
    public UncheckedRelationalException toUncheckedWrappedException() {
        return new UncheckedRelationalException(this);
    }

    @Nonnull
    public static RelationalException convert(@Nonnull Throwable t) {
        if (t instanceof RelationalException) {
            return (RelationalException) t;
        } else if (t instanceof UncheckedRelationalException) {
            return ((UncheckedRelationalException) t).unwrap();
        }
        return new RelationalException(ErrorCode.UNKNOWN, t);
    }
}

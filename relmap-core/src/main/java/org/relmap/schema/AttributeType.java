/*
 * AttributeType.java
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

package org.relmap.schema;

import org.relmap.annotation.API;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * A named type of attribute values, together with the function that turns a raw value into a value of that type.
 *
 * <p>
 * Constructors never see {@code null}: a {@code null} value is passed through unchanged. A constructor that cannot
 * handle its input throws; the failure is reported as {@link ErrorCode#CANNOT_CONVERT_TYPE}.
 * </p>
 *
 * @param <T> the Java type of coerced values
 */
@API(API.Status.EXPERIMENTAL)
public final class AttributeType<T> {
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<T> javaType;
    @Nonnull
    private final Function<Object, ? extends T> constructor;

    private AttributeType(@Nonnull String name, @Nonnull Class<T> javaType, @Nonnull Function<Object, ? extends T> constructor) {
        this.name = name;
        this.javaType = javaType;
        this.constructor = constructor;
    }

    @Nonnull
    public static <T> AttributeType<T> of(@Nonnull String name, @Nonnull Class<T> javaType, @Nonnull Function<Object, ? extends T> constructor) {
        return new AttributeType<>(name, javaType, constructor);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public Class<T> getJavaType() {
        return javaType;
    }

    /**
     * Coerce a raw value.
     *
     * @param value the raw value
     * @return the coerced value, {@code null} if {@code value} is {@code null}
     * @throws RelationalException if the value cannot be converted
     */
    @Nullable
    public T coerce(@Nullable Object value) throws RelationalException {
        if (value == null) {
            return null;
        }
        try {
            return constructor.apply(value);
        } catch (RuntimeException e) {
            throw new RelationalException("cannot convert <" + value + "> to " + name, ErrorCode.CANNOT_CONVERT_TYPE, e)
                    .addContext("type", name)
                    .addContext("valueClass", value.getClass().getName());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeType)) {
            return false;
        }
        AttributeType<?> that = (AttributeType<?>) o;
        return name.equals(that.name) && javaType.equals(that.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, javaType);
    }

    @Override
    public String toString() {
        return name;
    }
}

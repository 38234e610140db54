/*
 * Attribute.java
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
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A named, typed attribute of a {@link Schema}.
 *
 * <p>
 * The canonical type is applied on the write path. When a read type is declared, values read from the dataset are
 * decoded with it instead. The source names the relation the attribute was taken from, for schemas of views.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Attribute {
    @Nonnull
    private final String name;
    @Nonnull
    private final AttributeType<?> type;
    @Nullable
    private final AttributeType<?> readType;
    @Nullable
    private final String source;

    private Attribute(@Nonnull String name, @Nonnull AttributeType<?> type, @Nullable AttributeType<?> readType, @Nullable String source) {
        this.name = name;
        this.type = type;
        this.readType = readType;
        this.source = source;
    }

    @Nonnull
    public static Attribute of(@Nonnull String name, @Nonnull AttributeType<?> type) {
        return new Attribute(name, type, null, null);
    }

    @Nonnull
    public static Attribute of(@Nonnull String name, @Nonnull AttributeType<?> type, @Nonnull AttributeType<?> readType) {
        return new Attribute(name, type, readType, null);
    }

    @Nonnull
    public Attribute withSource(@Nullable String newSource) {
        return new Attribute(name, type, readType, newSource);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    @Nonnull
    public AttributeType<?> getType() {
        return type;
    }

    @Nullable
    public AttributeType<?> getReadType() {
        return readType;
    }

    @Nullable
    public String getSource() {
        return source;
    }

    public boolean isRead() {
        return readType != null;
    }

    @Nullable
    public Object coerceForWrite(@Nullable Object value) throws RelationalException {
        return type.coerce(value);
    }

    /**
     * Decode a value read from a dataset. Without a read type the value is returned as stored.
     *
     * @param value the stored value
     * @return the decoded value
     * @throws RelationalException if the read type cannot convert the value
     */
    @Nullable
    public Object coerceForRead(@Nullable Object value) throws RelationalException {
        return readType == null ? value : readType.coerce(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Attribute)) {
            return false;
        }
        Attribute attribute = (Attribute) o;
        return name.equals(attribute.name) && type.equals(attribute.type) &&
                Objects.equals(readType, attribute.readType) && Objects.equals(source, attribute.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, readType, source);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(name).append(':').append(type);
        if (readType != null) {
            sb.append(" read=").append(readType);
        }
        if (source != null) {
            sb.append(" source=").append(source);
        }
        return sb.toString();
    }
}

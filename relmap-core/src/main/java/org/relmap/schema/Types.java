/*
 * Types.java
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

import java.math.BigDecimal;
import java.util.Locale;
import java.util.function.Function;

/**
 * Built-in attribute types.
 *
 * <p>
 * The plain types ({@link #STRING}, {@link #INT}, ...) describe a value without changing it. {@link Coercible} types
 * convert compatible representations, e.g. {@code "1"} to {@code 1}. {@link Strict} types reject any value that is not
 * already of their Java type.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Types {
    public static final AttributeType<Object> ANY = AttributeType.of("Any", Object.class, Function.identity());
    public static final AttributeType<Object> STRING = AttributeType.of("String", Object.class, Function.identity());
    public static final AttributeType<Object> INT = AttributeType.of("Int", Object.class, Function.identity());
    public static final AttributeType<Object> LONG = AttributeType.of("Long", Object.class, Function.identity());
    public static final AttributeType<Object> BOOLEAN = AttributeType.of("Bool", Object.class, Function.identity());
    public static final AttributeType<Object> DECIMAL = AttributeType.of("Decimal", Object.class, Function.identity());

    /**
     * Types that convert their input.
     */
    public static final class Coercible {
        public static final AttributeType<String> STRING = AttributeType.of("Coercible::String", String.class, Object::toString);
        public static final AttributeType<Integer> INT = AttributeType.of("Coercible::Int", Integer.class, Coercible::toInt);
        public static final AttributeType<Long> LONG = AttributeType.of("Coercible::Long", Long.class, Coercible::toLong);
        public static final AttributeType<Boolean> BOOLEAN = AttributeType.of("Coercible::Bool", Boolean.class, Coercible::toBoolean);
        public static final AttributeType<BigDecimal> DECIMAL = AttributeType.of("Coercible::Decimal", BigDecimal.class, Coercible::toDecimal);

        private static Integer toInt(Object value) {
            if (value instanceof Number) {
                return Math.toIntExact(((Number) value).longValue());
            }
            return Integer.valueOf(value.toString().trim());
        }

        private static Long toLong(Object value) {
            if (value instanceof Number) {
                return ((Number) value).longValue();
            }
            return Long.valueOf(value.toString().trim());
        }

        private static Boolean toBoolean(Object value) {
            if (value instanceof Boolean) {
                return (Boolean) value;
            }
            switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "t":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "f":
                case "0":
                    return Boolean.FALSE;
                default:
                    throw new IllegalArgumentException("not a boolean: " + value);
            }
        }

        private static BigDecimal toDecimal(Object value) {
            if (value instanceof BigDecimal) {
                return (BigDecimal) value;
            }
            return new BigDecimal(value.toString().trim());
        }

        private Coercible() {
        }
    }

    /**
     * Types that only accept values of their Java type.
     */
    public static final class Strict {
        public static final AttributeType<String> STRING = strict("Strict::String", String.class);
        public static final AttributeType<Integer> INT = strict("Strict::Int", Integer.class);
        public static final AttributeType<Long> LONG = strict("Strict::Long", Long.class);
        public static final AttributeType<Boolean> BOOLEAN = strict("Strict::Bool", Boolean.class);

        private static <T> AttributeType<T> strict(String name, Class<T> javaType) {
            return AttributeType.of(name, javaType, value -> {
                if (!javaType.isInstance(value)) {
                    throw new ClassCastException(value.getClass().getName() + " is not a " + javaType.getName());
                }
                return javaType.cast(value);
            });
        }

        private Strict() {
        }
    }

    private Types() {
    }
}

/*
 * Options.java
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

package org.relmap.api;

import org.relmap.annotation.API;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.InternalErrorException;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.api.options.OptionContract;
import org.relmap.api.options.OptionContractWithConversion;
import org.relmap.api.options.RangeContract;
import org.relmap.api.options.TypeContract;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable, typed options for relations, gateways and transactions.
 *
 * <p>
 * Values are validated against the contracts registered for their {@link Name} when they are set. Options can be
 * layered: {@link #withChild(Options)} keeps a reference to the parent and lets the child override it, while
 * {@link #merge(Options)} flattens both sets into one.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class Options {

    public enum Name {
        /**
         * Log every materialization of a relation at info level.
         * Scope: Relation
         */
        LOG_MATERIALIZATION,

        /**
         * Log a materialization at info level if it is slower than this many microseconds.
         * Scope: Relation
         */
        LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS,

        /**
         * Transaction timeout in milliseconds, {@code -1} for none. The no-op runner ignores it.
         * Scope: Transaction
         */
        TRANSACTION_TIMEOUT,

        /**
         * An identifier attached to the log messages of a transaction.
         * Scope: Transaction
         */
        TRANSACTION_ID,

        /**
         * Finalize an inferred schema when a relation is created from a gateway.
         * Scope: Gateway
         */
        AUTO_FINALIZE_SCHEMA,

        /**
         * Name of the dataset a relation reads from, when it differs from the relation name.
         * Scope: Relation
         */
        DATASET_NAME,
    }

    private static final Map<Name, List<OptionContract>> CONTRACTS = makeContracts();

    @Nonnull
    private static final Map<Name, Object> OPTIONS_DEFAULT_VALUES;

    static {
        final var builder = ImmutableMap.<Name, Object>builder();
        builder.put(Name.LOG_MATERIALIZATION, false);
        builder.put(Name.LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS, 2_000_000L);
        builder.put(Name.TRANSACTION_TIMEOUT, -1L);
        builder.put(Name.AUTO_FINALIZE_SCHEMA, true);
        OPTIONS_DEFAULT_VALUES = builder.build();
    }

    public static final Options NONE = Options.builder().build();

    @Nullable
    private final Options parentOptions;
    @Nonnull
    private final Map<Name, Object> optionsMap;

    private Options(@Nonnull Map<Name, Object> optionsMap, @Nullable Options parentOptions) {
        this.optionsMap = optionsMap;
        this.parentOptions = parentOptions;
    }

    @Nonnull
    public static Options none() {
        return NONE;
    }

    @Nonnull
    public static Map<Name, Object> defaultOptions() {
        return OPTIONS_DEFAULT_VALUES;
    }

    /**
     * Get the value of an option, falling back to the parent options and then to the default value.
     *
     * @param name the option
     * @param <T> the type of the value
     * @return the value, or {@code null} if the option is not set and has no default
     */
    @SuppressWarnings("unchecked")
    public <T> T getOption(@Nonnull Name name) {
        T option = getOptionInternal(name);
        if (option == null) {
            return (T) OPTIONS_DEFAULT_VALUES.get(name);
        } else {
            return option;
        }
    }

    public boolean hasOption(@Nonnull Name name) {
        return getOptionInternal(name) != null;
    }

    /**
     * Whether no option has been set explicitly, here or in a parent.
     *
     * @return {@code true} if these options only carry defaults
     */
    public boolean isEmpty() {
        return optionsMap.isEmpty() && (parentOptions == null || parentOptions.isEmpty());
    }

    @Nonnull
    public Options withOption(@Nonnull Name name, @Nullable Object value) throws RelationalException {
        return builder().fromOptions(this).withOption(name, value).build();
    }

    @Nonnull
    public Options withChild(@Nonnull Options childOptions) throws RelationalException {
        return Options.combine(this, childOptions);
    }

    /**
     * Flatten these options and {@code other} into a new set. Values in {@code other} win.
     *
     * @param other the options to lay over these ones
     * @return the merged options, or {@code this} if {@code other} is empty
     */
    @Nonnull
    public Options merge(@Nonnull Options other) {
        if (other.isEmpty()) {
            return this;
        }
        final Map<Name, Object> merged = new EnumMap<>(Name.class);
        for (Map.Entry<Name, ?> entry : entries()) {
            merged.put(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<Name, ?> entry : other.entries()) {
            merged.put(entry.getKey(), entry.getValue());
        }
        return new Options(ImmutableMap.copyOf(merged), null);
    }

    @Nonnull
    @SuppressWarnings({"PMD.CompareObjectsWithEquals"})
    private static Options combine(@Nonnull Options parentOptions, @Nonnull Options childOptions) throws RelationalException {
        if (childOptions.parentOptions != null) {
            throw new InternalErrorException("Cannot override parent options");
        }
        if (parentOptions == childOptions) {
            return childOptions;
        }
        return new Options(childOptions.optionsMap, parentOptions);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        @Nonnull
        private final Map<Name, Object> optionsMap;

        @Nullable
        private Options parentOptions;

        private Builder() {
            optionsMap = Maps.newHashMap();
        }

        @Nonnull
        public Builder withOptionFromString(@Nonnull Name name, @Nonnull String valueAsString) throws RelationalException {
            return withOption(name, parseStringOption(name, valueAsString));
        }

        @Nonnull
        public Builder withOption(@Nonnull Name name, @Nullable Object value) throws RelationalException {
            validateOption(name, value);
            if (value == null) {
                optionsMap.remove(name);
            } else {
                optionsMap.put(name, value);
            }
            return this;
        }

        @Nonnull
        public Builder fromOptions(@Nonnull Options options) throws RelationalException {
            if (parentOptions != null) {
                throw new InternalErrorException("parentOptions are NOT null");
            }
            optionsMap.putAll(options.optionsMap);
            parentOptions = options.parentOptions;
            return this;
        }

        @Nonnull
        public Options build() {
            return new Options(ImmutableMap.copyOf(optionsMap), parentOptions);
        }
    }

    @Nullable
    private static Object parseStringOption(@Nonnull final Name name, @Nonnull String valueAsString) throws RelationalException {
        for (OptionContract contract : Objects.requireNonNull(CONTRACTS.get(name))) {
            if (contract instanceof OptionContractWithConversion<?>) {
                return ((OptionContractWithConversion<?>) contract).fromString(valueAsString);
            }
        }
        throw new InternalErrorException("option must have at least one type contract");
    }

    private static void validateOption(@Nonnull final Name name, @Nullable Object value) throws RelationalException {
        for (OptionContract contract : Objects.requireNonNull(CONTRACTS.get(name))) {
            contract.validate(name, value);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> T getOptionInternal(@Nonnull Name name) {
        T option = (T) optionsMap.get(name);
        if (option == null && parentOptions != null) {
            return parentOptions.getOptionInternal(name);
        } else {
            return option;
        }
    }

    @Nonnull
    public Iterable<? extends Map.Entry<Name, ?>> entries() {
        if (parentOptions != null) {
            return Iterables.concat(parentOptions.entries(), optionsMap.entrySet());
        } else {
            return optionsMap.entrySet();
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (!(o instanceof Options)) {
            return false;
        }
        final Options options = (Options) o;
        return Objects.equals(parentOptions, options.parentOptions) && optionsMap.equals(options.optionsMap);
    }

    @Override
    public int hashCode() {
        int result = Objects.hashCode(parentOptions);
        result = 31 * result + optionsMap.hashCode();
        return result;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("Options{");
        boolean first = true;
        for (Map.Entry<Name, ?> entry : entries()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }

    /**
     * Read options from properties whose keys are {@link Name} constants.
     *
     * @param properties the properties, may be {@code null}
     * @return the parsed options
     * @throws RelationalException if a key is not a known option or a value cannot be parsed
     */
    @Nonnull
    public static Options fromProperties(@Nullable Properties properties) throws RelationalException {
        if (properties == null) {
            return none();
        }
        Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            final Name name;
            try {
                name = Name.valueOf(key);
            } catch (IllegalArgumentException e) {
                throw new RelationalException("Unknown option <" + key + ">", ErrorCode.INVALID_PARAMETER, e);
            }
            builder.withOptionFromString(name, properties.getProperty(key));
        }
        return builder.build();
    }

    @Nonnull
    public static Properties toProperties(@Nonnull final Options options) {
        final Properties result = new Properties();
        for (Map.Entry<Name, ?> entry : options.entries()) {
            result.put(entry.getKey().name(), entry.getValue().toString());
        }
        return result;
    }

    private static Map<Name, List<OptionContract>> makeContracts() {
        EnumMap<Name, List<OptionContract>> data = new EnumMap<>(Name.class);
        data.put(Name.LOG_MATERIALIZATION, List.of(TypeContract.booleanType()));
        data.put(Name.LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS, List.of(TypeContract.longType(), RangeContract.of(0L, Long.MAX_VALUE)));
        data.put(Name.TRANSACTION_TIMEOUT, List.of(TypeContract.longType(), RangeContract.of(-1L, Long.MAX_VALUE)));
        data.put(Name.TRANSACTION_ID, List.of(TypeContract.stringType()));
        data.put(Name.AUTO_FINALIZE_SCHEMA, List.of(TypeContract.booleanType()));
        data.put(Name.DATASET_NAME, List.of(TypeContract.stringType()));
        return Collections.unmodifiableMap(data);
    }
}

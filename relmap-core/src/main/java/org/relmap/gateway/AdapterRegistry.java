/*
 * AdapterRegistry.java
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

package org.relmap.gateway;

import org.relmap.annotation.API;
import org.relmap.api.exceptions.AdapterLoadException;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;
import java.util.Collections;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * The process-wide registry of {@link GatewayFactory}s, by adapter identifier.
 *
 * <p>
 * Factories are registered explicitly or found through the service loader. Discovery runs the first time an unknown
 * adapter is asked for, and again on every later miss, so adapters that show up on the class path late are still
 * found. Registering a second factory for the same adapter fails; a duplicate found by discovery is ignored with a
 * warning.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class AdapterRegistry {
    private static final Logger logger = LogManager.getLogger(AdapterRegistry.class);

    public static final Function<Class<?>, Iterable<?>> DEFAULT_LOADER = ServiceLoader::load;

    private static final AdapterRegistry INSTANCE = new AdapterRegistry(DEFAULT_LOADER);

    @Nonnull
    private final Function<Class<?>, Iterable<?>> serviceLoader;
    @Nonnull
    private final ConcurrentMap<String, GatewayFactory> registry = new ConcurrentHashMap<>();

    private AdapterRegistry(@Nonnull Function<Class<?>, Iterable<?>> serviceLoader) {
        this.serviceLoader = serviceLoader;
    }

    @Nonnull
    public static AdapterRegistry instance() {
        return INSTANCE;
    }

    /**
     * A registry of its own, separate from {@link #instance()}, that discovers factories with the given loader.
     *
     * @param serviceLoader returns the services of a class
     * @return a new, empty registry
     */
    @VisibleForTesting
    @Nonnull
    public static AdapterRegistry withLoader(@Nonnull Function<Class<?>, Iterable<?>> serviceLoader) {
        return new AdapterRegistry(serviceLoader);
    }

    /**
     * Register a factory.
     *
     * @param factory the factory
     * @throws RelationalException with {@link ErrorCode#DUPLICATE_ADAPTER} if a factory is already registered for the
     * adapter
     */
    public void register(@Nonnull GatewayFactory factory) throws RelationalException {
        final GatewayFactory existing = registry.putIfAbsent(factory.getAdapter(), factory);
        if (existing != null) {
            throw new RelationalException("adapter <" + factory.getAdapter() + "> is already registered", ErrorCode.DUPLICATE_ADAPTER)
                    .addContext(LogMessageKeys.FACTORY_CLASS.toString(), existing.getClass().getName());
        }
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("registered adapter",
                    LogMessageKeys.ADAPTER, factory.getAdapter(),
                    LogMessageKeys.FACTORY_CLASS, factory.getClass().getName()));
        }
    }

    /**
     * Remove the factory of an adapter.
     *
     * @param adapter the adapter identifier
     * @return the removed factory, {@code null} if none was registered
     */
    @Nullable
    public GatewayFactory deregister(@Nonnull String adapter) {
        return registry.remove(adapter);
    }

    @Nullable
    public GatewayFactory find(@Nonnull String adapter) {
        return registry.get(adapter);
    }

    public boolean isRegistered(@Nonnull String adapter) {
        return registry.containsKey(adapter);
    }

    @Nonnull
    public Set<String> adapters() {
        return ImmutableSet.copyOf(registry.keySet());
    }

    /**
     * Find the factory of an adapter, running discovery if it is not registered yet.
     *
     * @param adapter the adapter identifier
     * @return the factory
     * @throws AdapterLoadException if no factory can be found, or discovery itself fails
     */
    @Nonnull
    public GatewayFactory resolve(@Nonnull String adapter) throws AdapterLoadException {
        GatewayFactory factory = registry.get(adapter);
        if (factory == null) {
            discover();
            factory = registry.get(adapter);
        }
        if (factory == null) {
            throw new AdapterLoadException("Failed to load adapter <" + adapter + ">, known adapters: " + adapters());
        }
        return factory;
    }

    /**
     * Create a gateway of the given adapter. Arguments are only passed to factories that take them.
     *
     * @param adapter the adapter identifier
     * @param args the gateway arguments
     * @return the new gateway
     * @throws RelationalException if the adapter cannot be resolved or the factory fails
     */
    @Nonnull
    public Gateway setup(@Nonnull String adapter, @Nonnull Object... args) throws RelationalException {
        final GatewayFactory factory = resolve(adapter);
        final Gateway gateway = factory.create(factory.takesArguments() ? Arrays.asList(args) : Collections.emptyList());
        if (logger.isDebugEnabled()) {
            logger.debug(KeyValueLogMessage.of("gateway set up",
                    LogMessageKeys.ADAPTER, adapter,
                    LogMessageKeys.GATEWAY_CLASS, gateway.getClass().getName()));
        }
        return gateway;
    }

    /**
     * Register every factory the service loader knows about that is not registered yet.
     *
     * @throws AdapterLoadException if the service loader fails
     */
    @SuppressWarnings("unchecked")
    public void discover() throws AdapterLoadException {
        try {
            for (GatewayFactory factory : (Iterable<GatewayFactory>) serviceLoader.apply(GatewayFactory.class)) {
                final String adapter = factory.getAdapter();
                final GatewayFactory existing = registry.putIfAbsent(adapter, factory);
                if (existing == null) {
                    if (logger.isDebugEnabled()) {
                        logger.debug(KeyValueLogMessage.of("found adapter",
                                LogMessageKeys.ADAPTER, adapter,
                                LogMessageKeys.FACTORY_CLASS, factory.getClass().getName()));
                    }
                } else if (existing.getClass() != factory.getClass() && logger.isWarnEnabled()) {
                    logger.warn(KeyValueLogMessage.of("duplicate adapter",
                            LogMessageKeys.ADAPTER, adapter,
                            LogMessageKeys.FACTORY_CLASS, factory.getClass().getName()));
                }
            }
        } catch (ServiceConfigurationError e) {
            throw new AdapterLoadException("Failed to load adapters: " + e.getMessage(), e);
        }
    }
}

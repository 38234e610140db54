/*
 * Gateway.java
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
import org.relmap.api.Dataset;
import org.relmap.api.Options;
import org.relmap.api.exceptions.ErrorCode;
import org.relmap.api.exceptions.MissingAdapterIdentifierException;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.relation.MapperRegistry;
import org.relmap.relation.Relation;
import org.relmap.relation.RelationDefinition;
import org.relmap.relation.RelationFactory;
import org.relmap.util.Assert;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.URI;
import java.util.List;

/**
 * The owner of a backend connection: hands out datasets and the relations reading them, and runs transactions.
 *
 * <p>
 * Every concrete gateway declares its adapter identifier with {@link Adapter}. Gateways are created through
 * {@link #setup(String, Object...)}, which finds the adapter's {@link GatewayFactory} in the {@link AdapterRegistry}.
 * The extension points of this class all default to doing nothing; in particular the default
 * {@link #transactionRunner(Options)} gives no transactional guarantee at all.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class Gateway implements AutoCloseable {

    /**
     * Create a gateway of the given adapter.
     *
     * @param adapter the adapter identifier
     * @param args the gateway arguments, ignored by factories that take none
     * @return the new gateway
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if the identifier looks like a connection
     * string, with {@link ErrorCode#ADAPTER_LOAD_FAILED} if the adapter cannot be found
     */
    @Nonnull
    public static Gateway setup(@Nonnull String adapter, @Nonnull Object... args) throws RelationalException {
        Assert.that(adapter.indexOf(':') < 0 && adapter.indexOf('/') < 0, ErrorCode.INVALID_PARAMETER,
                () -> "<" + adapter + "> is not an adapter identifier, connection strings must be passed as a URI with an adapter scheme");
        return AdapterRegistry.instance().setup(adapter, args);
    }

    /**
     * Create a gateway from a connection URI. The scheme names the adapter and the URI is passed as first argument.
     *
     * @param uri the connection URI
     * @param args further gateway arguments
     * @return the new gateway
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if the URI has no scheme, with
     * {@link ErrorCode#ADAPTER_LOAD_FAILED} if the adapter cannot be found
     */
    @Nonnull
    public static Gateway setup(@Nonnull URI uri, @Nonnull Object... args) throws RelationalException {
        Assert.that(uri.getScheme() != null, ErrorCode.INVALID_PARAMETER,
                () -> "connection URI <" + uri + "> has no adapter scheme");
        final Object[] forwarded = new Object[args.length + 1];
        forwarded[0] = uri;
        System.arraycopy(args, 0, forwarded, 1, args.length);
        return AdapterRegistry.instance().setup(uri.getScheme(), forwarded);
    }

    /**
     * Accept an already created gateway.
     *
     * @param gateway the gateway
     * @param args must be empty
     * @return {@code gateway} itself
     * @throws RelationalException with {@link ErrorCode#INVALID_PARAMETER} if arguments are given
     */
    @Nonnull
    public static Gateway setup(@Nonnull Gateway gateway, @Nonnull Object... args) throws RelationalException {
        Assert.that(args.length == 0, ErrorCode.INVALID_PARAMETER,
                () -> "gateway of adapter " + gateway.getClass().getSimpleName() + " is already set up and takes no arguments, got " + args.length);
        return gateway;
    }

    /**
     * The adapter identifier declared on this gateway's class.
     *
     * @return the identifier
     * @throws MissingAdapterIdentifierException if the class declares none
     */
    @Nonnull
    public String adapter() throws MissingAdapterIdentifierException {
        final Adapter annotation = getClass().getAnnotation(Adapter.class);
        if (annotation == null) {
            throw new MissingAdapterIdentifierException(getClass().getName() + " is missing the adapter identifier");
        }
        return annotation.value();
    }

    /**
     * The backend connection handle.
     *
     * @return the connection, opaque to the relation layer
     */
    @Nonnull
    public abstract Object getConnection();

    /**
     * The dataset of the given name.
     *
     * @param name the dataset name
     * @return the dataset
     * @throws RelationalException if the gateway cannot provide it
     */
    @Nonnull
    public abstract Dataset dataset(@Nonnull String name) throws RelationalException;

    public abstract boolean hasDataset(@Nonnull String name);

    @Nonnull
    public Relation relation(@Nonnull RelationDefinition definition) throws RelationalException {
        return relation(definition, MapperRegistry.empty(), Options.none());
    }

    /**
     * A relation of the given definition over this gateway's dataset. The schema is finalized first unless
     * {@link Options.Name#AUTO_FINALIZE_SCHEMA} is off, and {@link Options.Name#DATASET_NAME} overrides the dataset
     * the definition names.
     *
     * @param definition the relation definition
     * @param mappers the mappers of the relation
     * @param options the relation options
     * @return the relation
     * @throws RelationalException if the schema cannot be finalized or the dataset is not available
     */
    @Nonnull
    public Relation relation(@Nonnull RelationDefinition definition, @Nonnull MapperRegistry mappers,
                             @Nonnull Options options) throws RelationalException {
        final boolean autoFinalize = options.getOption(Options.Name.AUTO_FINALIZE_SCHEMA);
        final RelationDefinition effective = autoFinalize ? definition.finalizeSchema(this) : definition;
        final String datasetName = options.hasOption(Options.Name.DATASET_NAME)
                ? options.getOption(Options.Name.DATASET_NAME)
                : effective.getDatasetName();
        return effective.create(relationFactory(), dataset(datasetName), mappers, options);
    }

    /**
     * The factory of the relations this gateway hands out.
     */
    @Nonnull
    protected RelationFactory relationFactory() {
        return RelationFactory.DEFAULT;
    }

    public void useLogger(@Nonnull Logger logger) {
    }

    @Nullable
    public Logger getLogger() {
        return null;
    }

    /**
     * Hook for adapters that adjust command classes per dataset.
     *
     * @param commandClass the command class
     * @param dataset the dataset the command works on
     * @param <C> the command type
     * @return the command class to use
     */
    @Nonnull
    public <C> Class<? extends C> extendCommandClass(@Nonnull Class<? extends C> commandClass, @Nonnull Dataset dataset) {
        return commandClass;
    }

    /**
     * The names of the datasets the backend knows about.
     *
     * @return the dataset names, empty if the gateway cannot tell
     */
    @Nonnull
    public List<String> schema() {
        return ImmutableList.of();
    }

    @Nullable
    public <T> T transaction(@Nonnull TransactionBody<T> body) throws RelationalException {
        return transaction(Options.none(), body);
    }

    /**
     * Run the body with this gateway's {@link TransactionRunner}.
     *
     * @param options the transaction options
     * @param body the body
     * @param <T> the type of the body's value
     * @return the body's value, {@code null} if the transaction was rolled back
     * @throws RelationalException whatever the body throws
     */
    @Nullable
    public <T> T transaction(@Nonnull Options options, @Nonnull TransactionBody<T> body) throws RelationalException {
        final TransactionOutcome<T> outcome = transactionRunner(options).run(options, body);
        return outcome.isRolledBack() ? null : outcome.getValue();
    }

    @Nonnull
    protected TransactionRunner transactionRunner(@Nonnull Options options) {
        return NoOpTransactionRunner.INSTANCE;
    }

    public void disconnect() throws RelationalException {
    }

    @Override
    public void close() throws RelationalException {
        disconnect();
    }
}

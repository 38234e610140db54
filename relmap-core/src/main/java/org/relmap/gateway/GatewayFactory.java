/*
 * GatewayFactory.java
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
import org.relmap.api.exceptions.RelationalException;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Creates the gateways of one adapter. Implementations are found with {@link java.util.ServiceLoader}, or registered
 * directly with the {@link AdapterRegistry}.
 */
@API(API.Status.EXPERIMENTAL)
public interface GatewayFactory {

    /**
     * The adapter identifier, the same value as the {@link Adapter} annotation of the gateways created here.
     *
     * @return the adapter identifier
     */
    @Nonnull
    String getAdapter();

    /**
     * Whether {@link #create(List)} uses its arguments. A factory that does not is always called with an empty list.
     *
     * @return {@code true} if arguments are forwarded
     */
    default boolean takesArguments() {
        return true;
    }

    @Nonnull
    Gateway create(@Nonnull List<Object> args) throws RelationalException;
}

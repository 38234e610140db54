/*
 * MemoryGatewayFactory.java
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

package org.relmap.memory;

import org.relmap.gateway.Gateway;
import org.relmap.gateway.GatewayFactory;

import com.google.auto.service.AutoService;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Creates {@link MemoryGateway}s, each with its own empty storage.
 */
@AutoService(GatewayFactory.class)
public class MemoryGatewayFactory implements GatewayFactory {

    @Nonnull
    @Override
    public String getAdapter() {
        return MemoryGateway.ADAPTER;
    }

    @Override
    public boolean takesArguments() {
        return false;
    }

    @Nonnull
    @Override
    public Gateway create(@Nonnull List<Object> args) {
        return new MemoryGateway();
    }
}

/*
 * RelationLoggingUtil.java
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

package org.relmap.util;

import org.relmap.api.Options;
import org.relmap.api.exceptions.RelationalException;
import org.relmap.logging.KeyValueLogMessage;
import org.relmap.logging.LogMessageKeys;

import org.apache.logging.log4j.Logger;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

public final class RelationLoggingUtil {

    public static void publishMaterializationLogs(@Nonnull Logger logger, @Nonnull KeyValueLogMessage message,
                                                  int tupleCount, @Nullable RelationalException e, long totalMicros,
                                                  @Nonnull Options options) {
        final boolean logMaterialization = options.getOption(Options.Name.LOG_MATERIALIZATION);
        final boolean isSlow = totalMicros > (long) options.getOption(Options.Name.LOG_SLOW_MATERIALIZATION_THRESHOLD_MICROS);
        message.addKeyAndValue(LogMessageKeys.TOTAL_MICROS, totalMicros);
        if (e != null) {
            message.addKeyAndValue(LogMessageKeys.CODE, e.getErrorCode().getErrorCode());
            logger.error(message, e);
            return;
        }
        message.addKeyAndValue(LogMessageKeys.TUPLE_COUNT, tupleCount);
        if (logMaterialization || isSlow) {
            logger.info(message);
        } else if (logger.isDebugEnabled()) {
            logger.debug(message);
        }
    }

    private RelationLoggingUtil() {
    }
}

/*
 * LoggableKeysAndValuesImpl.java
 *
 * This source file is part of the TermPrint open source project
 *
 * Copyright 2024-2026 the TermPrint project authors
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

package dev.termprint.util;

import dev.termprint.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default holder for {@link LoggableKeysAndValues}. Insertion order of the keys is kept so exported log info lists the
 * pairs in the order they were attached.
 */
@API(API.Status.UNSTABLE)
public final class LoggableKeysAndValuesImpl implements LoggableKeysAndValues<LoggableKeysAndValuesImpl> {
    private static final Object[] EMPTY_LOG_INFO = new Object[0];
    @Nullable
    private Map<String, Object> logInfo;

    public LoggableKeysAndValuesImpl(@Nullable Object... keyValues) {
        if (keyValues != null) {
            addLogInfo(keyValues);
        }
    }

    @Nonnull
    @Override
    public Map<String, Object> getLogInfo() {
        if (logInfo == null) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(logInfo);
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull String description, Object object) {
        if (logInfo == null) {
            logInfo = new LinkedHashMap<>();
        }
        logInfo.put(description, object);
        return this;
    }

    @Nonnull
    @Override
    public LoggableKeysAndValuesImpl addLogInfo(@Nonnull Object... keyValue) {
        if ((keyValue.length % 2) != 0) {
            throw new IllegalArgumentException("Unbalanced key/value logging info");
        }
        for (int i = 0; i < keyValue.length; i += 2) {
            addLogInfo(String.valueOf(keyValue[i]), keyValue[i + 1]);
        }
        return this;
    }

    @Nonnull
    @Override
    public Object[] exportLogInfo() {
        if (logInfo == null) {
            return EMPTY_LOG_INFO;
        }
        final Object[] exported = new Object[2 * logInfo.size()];
        int i = 0;
        for (Map.Entry<String, Object> entry : logInfo.entrySet()) {
            exported[i] = entry.getKey();
            exported[i + 1] = entry.getValue();
            i += 2;
        }
        return exported;
    }
}

/*
 * LogMessageKeys.java
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

package dev.termprint.logging;

import dev.termprint.annotation.API;

import javax.annotation.Nonnull;
import java.util.Locale;

/**
 * Keys used in {@link KeyValueLogMessage}s logged by the printer, kept in one place to avoid collisions.
 */
@API(API.Status.UNSTABLE)
public enum LogMessageKeys {
    TITLE("ttl"),
    MESSAGE,
    TERM,
    DEPTH,
    MAX_DEPTH,
    STEPS,
    MAX_STEPS,
    QUERY,
    REASON,
    OPTION,
    VALUE,
    NOTATION;

    @Nonnull
    private final String logKey;

    LogMessageKeys() {
        this.logKey = name().toLowerCase(Locale.ROOT);
    }

    LogMessageKeys(@Nonnull String key) {
        this.logKey = key;
    }

    @Override
    public String toString() {
        return logKey;
    }
}

/*
 * KeyValueLogMessage.java
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
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A log message with a fixed title followed by {@code key="value"} pairs, sorted by key.
 */
@API(API.Status.MAINTAINED)
public class KeyValueLogMessage {
    @Nonnull
    private final String staticMessage;
    @Nonnull
    private final Map<String, String> keyValueMap;

    private KeyValueLogMessage(@Nonnull String staticMessage, @Nonnull Map<String, String> keyValueMap) {
        this.staticMessage = staticMessage;
        this.keyValueMap = keyValueMap;
    }

    /**
     * Format a message directly.
     * @param staticMessage the title
     * @param keysAndValues alternating keys and values
     * @return the formatted message
     */
    @Nonnull
    public static String of(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        return build(staticMessage, keysAndValues).toString();
    }

    @Nonnull
    public static KeyValueLogMessage build(@Nonnull String staticMessage, @Nullable Object... keysAndValues) {
        final Map<String, String> keyValueMap = new TreeMap<>();
        if (keysAndValues != null) {
            if (keysAndValues.length % 2 == 1) {
                throw new IllegalArgumentException("keys and values don't match");
            }
            for (int i = 0; i < keysAndValues.length; i += 2) {
                put(keyValueMap, keysAndValues[i], keysAndValues[i + 1]);
            }
        }
        return new KeyValueLogMessage(staticMessage, keyValueMap);
    }

    private static void put(@Nonnull Map<String, String> keyValueMap, @Nullable Object key, @Nullable Object value) {
        if (key == null) {
            throw new IllegalArgumentException("null key passed to KeyValueLogMessage");
        }
        keyValueMap.put(key.toString().replace("=", ""), Objects.toString(value).replace("\"", "'"));
    }

    @Nonnull
    public KeyValueLogMessage addKeyAndValue(@Nonnull Object key, @Nullable Object value) {
        put(keyValueMap, key, value);
        return this;
    }

    @Nonnull
    public String getStaticMessage() {
        return staticMessage;
    }

    @Nonnull
    public Map<String, String> getKeyValueMap() {
        return Collections.unmodifiableMap(keyValueMap);
    }

    @Nonnull
    public String getMessageWithKeys() {
        final StringBuilder sb = new StringBuilder(staticMessage.length() + keyValueMap.size() * 30);
        sb.append(staticMessage);
        for (Map.Entry<String, String> entry : keyValueMap.entrySet()) {
            sb.append(' ').append(entry.getKey()).append("=\"").append(entry.getValue()).append('"');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return getMessageWithKeys();
    }
}

/*
 * LoggableKeysAndValues.java
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

import javax.annotation.Nonnull;
import java.util.Map;

/**
 * Something that carries structured log information: a set of keys and values that describe the context in which it
 * was created. Printer failures attach the offending term, option or notation this way so that a log line can be
 * searched by key later instead of by parsing free text.
 *
 * @param <T> the concrete type, returned by the fluent adders
 */
interface LoggableKeysAndValues<T extends LoggableKeysAndValues<T>> {

    /**
     * Get the attached log information.
     *
     * @return an unmodifiable view of the keys and values
     */
    @Nonnull
    Map<String, Object> getLogInfo();

    /**
     * Attach one key/value pair.
     *
     * @param description the key
     * @param object the value
     * @return this object
     */
    @Nonnull
    T addLogInfo(@Nonnull String description, Object object);

    /**
     * Attach several pairs given as a flat array of alternating keys and values.
     *
     * @param keyValue keys at even positions, values at odd positions
     * @return this object
     * @throws IllegalArgumentException if <code>keyValue</code> has odd length
     */
    @Nonnull
    T addLogInfo(@Nonnull Object... keyValue);

    /**
     * Flatten the attached information into alternating keys and values, the format accepted by
     * {@link #addLogInfo(Object...)}.
     *
     * @return the flattened pairs
     */
    @Nonnull
    Object[] exportLogInfo();
}

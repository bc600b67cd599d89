/*
 * LoggableExceptionTest.java
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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link LoggableException}.
 */
public class LoggableExceptionTest {

    @Test
    public void keysAndValuesFromConstructor() {
        final LoggableException e = new LoggableException("bad option", "option", "pp.indent", "value", -1);
        assertEquals("bad option", e.getMessage());
        assertThat(e.getLogInfo(), hasEntry("option", "pp.indent"));
        assertThat(e.getLogInfo(), hasEntry("value", -1));
    }

    @Test
    public void exportKeepsInsertionOrder() {
        final LoggableException e = new LoggableException("clash")
                .addLogInfo("first", 1)
                .addLogInfo("second", 2);
        assertThat(e.exportLogInfo(), arrayContaining("first", 1, "second", 2));
    }

    @Test
    public void noInfoByDefault() {
        assertThat(new LoggableException("plain").getLogInfo(), anEmptyMap());
    }

    @Test
    public void oddKeyValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LoggableException("odd", "key-only"));
    }
}

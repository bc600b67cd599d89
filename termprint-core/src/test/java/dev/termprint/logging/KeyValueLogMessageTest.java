/*
 * KeyValueLogMessageTest.java
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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link KeyValueLogMessage}.
 */
public class KeyValueLogMessageTest {

    @Test
    public void keysSortedAndQuoted() {
        assertThat(KeyValueLogMessage.of("render limit reached",
                        LogMessageKeys.STEPS, 12,
                        LogMessageKeys.DEPTH, 3),
                equalTo("render limit reached depth=\"3\" steps=\"12\""));
    }

    @Test
    public void quotesAndEqualsEscaped() {
        final KeyValueLogMessage message = KeyValueLogMessage.build("msg", "a=b", "say \"hi\"");
        assertThat(message.getMessageWithKeys(), equalTo("msg ab=\"say 'hi'\""));
        message.addKeyAndValue(LogMessageKeys.TITLE, null);
        assertThat(message.getKeyValueMap().get("ttl"), equalTo("null"));
    }

    @Test
    public void unbalancedArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> KeyValueLogMessage.of("msg", LogMessageKeys.TERM));
    }
}

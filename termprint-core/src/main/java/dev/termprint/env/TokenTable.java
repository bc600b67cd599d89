/*
 * TokenTable.java
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

package dev.termprint.env;

import dev.termprint.annotation.API;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Optional;

/**
 * Declared precedences of notation tokens.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface TokenTable {
    TokenTable EMPTY = token -> Optional.empty();

    /**
     * The precedence (left binding power) declared for a token.
     * @param token the token text
     * @return its precedence, empty if the token has none
     */
    @Nonnull
    Optional<Integer> getPrecedence(@Nonnull String token);

    @Nonnull
    static TokenTable of(@Nonnull Map<String, Integer> precedences) {
        final ImmutableMap<String, Integer> copy = ImmutableMap.copyOf(precedences);
        return token -> Optional.ofNullable(copy.get(token));
    }
}

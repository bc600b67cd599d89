/*
 * RenderRule.java
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

package dev.termprint.printer;

import dev.termprint.term.Expr;

import javax.annotation.Nonnull;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;

/**
 * One entry of the dispatcher's ordered rule list. A rule either renders a term or declines it, in which case the
 * next rule is tried. Rules may assume every earlier rule declined.
 */
interface RenderRule {
    @Nonnull
    String getName();

    @Nonnull
    Optional<RenderResult> apply(@Nonnull TermRenderer renderer, @Nonnull Expr e);

    /**
     * A rule made of a predicate and a handler that always succeeds on the terms the predicate accepts.
     * @param name the rule name, used in logs
     * @param predicate selects the terms the rule handles
     * @param handler renders them
     * @return the rule
     */
    @Nonnull
    static RenderRule of(@Nonnull String name,
                         @Nonnull BiPredicate<TermRenderer, Expr> predicate,
                         @Nonnull BiFunction<TermRenderer, Expr, RenderResult> handler) {
        return new RenderRule() {
            @Nonnull
            @Override
            public String getName() {
                return name;
            }

            @Nonnull
            @Override
            public Optional<RenderResult> apply(@Nonnull TermRenderer renderer, @Nonnull Expr e) {
                return predicate.test(renderer, e) ? Optional.of(handler.apply(renderer, e)) : Optional.empty();
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}

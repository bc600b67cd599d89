/*
 * TypeChecker.java
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
import dev.termprint.term.Binding;
import dev.termprint.term.Expr;

import javax.annotation.Nonnull;

/**
 * The type-checker queries the printer issues to classify implicit arguments and propositions. Terms passed in are
 * closed. Implementations report ordinary failures through {@link TypeCheckResult} rather than by throwing.
 */
@API(API.Status.EXPERIMENTAL)
public interface TypeChecker {
    /**
     * Infer the type of a term.
     * @param e a closed term
     * @return its type
     */
    @Nonnull
    TypeCheckResult<Expr> infer(@Nonnull Expr e);

    /**
     * Reduce a term to weak head normal form.
     * @param e a closed term
     * @return the reduced term
     */
    @Nonnull
    TypeCheckResult<Expr> whnf(@Nonnull Expr e);

    /**
     * Reduce a type until its head is a dependent product.
     * @param type a closed type
     * @return the product
     */
    @Nonnull
    TypeCheckResult<Binding> ensurePi(@Nonnull Expr type);

    /**
     * Whether a type is a proposition, that is whether its own type is {@code Prop}.
     * @param type a closed term
     * @return whether it is a proposition
     */
    @Nonnull
    TypeCheckResult<Boolean> isProp(@Nonnull Expr type);
}

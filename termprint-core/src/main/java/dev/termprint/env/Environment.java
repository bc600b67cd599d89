/*
 * Environment.java
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
import dev.termprint.term.HeadIndex;
import dev.termprint.term.Name;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * The read-only view of the declaration and namespace registry that the printer consults.
 */
@API(API.Status.EXPERIMENTAL)
public interface Environment {
    @Nonnull
    Optional<Declaration> getDeclaration(@Nonnull Name name);

    default boolean contains(@Nonnull Name name) {
        return getDeclaration(name).isPresent();
    }

    /**
     * The short name under which a constant was exported into the root namespace.
     * @param name the full constant name
     * @return the alias, if any
     */
    @Nonnull
    Optional<Name> getAlias(@Nonnull Name name);

    /**
     * The currently open namespaces, innermost first.
     * @return the namespaces
     */
    @Nonnull
    List<Name> getOpenNamespaces();

    /**
     * The user-facing name of a private (hidden) constant.
     * @param name the internal name
     * @return the name the user declared, if {@code name} is private
     */
    @Nonnull
    Optional<Name> getUserName(@Nonnull Name name);

    /**
     * Coercion registration of a constant.
     * @param name a constant name
     * @return how the constant coerces, if it is a coercion
     */
    @Nonnull
    Optional<CoercionInfo> getCoercion(@Nonnull Name name);

    /**
     * The notations whose pattern has the given head, in the order they should be tried.
     * @param head the head index of a term
     * @return the candidate entries
     */
    @Nonnull
    List<NotationEntry> getNotationEntries(@Nonnull HeadIndex head);

    /**
     * Whether the lowest universe is an impredicative {@code Prop}.
     * @return the impredicativity flag
     */
    boolean isImpredicative();

    @Nonnull
    TokenTable getTokenTable();
}

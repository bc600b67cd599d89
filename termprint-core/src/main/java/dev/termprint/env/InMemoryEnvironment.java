/*
 * InMemoryEnvironment.java
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
import dev.termprint.term.Expr;
import dev.termprint.term.HeadIndex;
import dev.termprint.term.Name;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable {@link Environment} assembled with a {@link Builder}. Notation entries for the same head are tried
 * most recently declared first.
 */
@API(API.Status.EXPERIMENTAL)
public final class InMemoryEnvironment implements Environment {
    @Nonnull
    private final ImmutableMap<Name, Declaration> declarations;
    @Nonnull
    private final ImmutableMap<Name, Name> aliases;
    @Nonnull
    private final ImmutableList<Name> openNamespaces;
    @Nonnull
    private final ImmutableMap<Name, Name> userNames;
    @Nonnull
    private final ImmutableMap<Name, CoercionInfo> coercions;
    @Nonnull
    private final ImmutableListMultimap<HeadIndex, NotationEntry> notations;
    private final boolean impredicative;
    @Nonnull
    private final TokenTable tokenTable;

    private InMemoryEnvironment(@Nonnull Builder builder) {
        this.declarations = ImmutableMap.copyOf(builder.declarations);
        this.aliases = ImmutableMap.copyOf(builder.aliases);
        this.openNamespaces = ImmutableList.copyOf(builder.openNamespaces).reverse();
        this.userNames = ImmutableMap.copyOf(builder.userNames);
        this.coercions = ImmutableMap.copyOf(builder.coercions);
        final ImmutableListMultimap.Builder<HeadIndex, NotationEntry> notationsBuilder =
                ImmutableListMultimap.builder();
        for (NotationEntry entry : ImmutableList.copyOf(builder.notations).reverse()) {
            notationsBuilder.put(entry.getHeadIndex(), entry);
        }
        this.notations = notationsBuilder.build();
        this.impredicative = builder.impredicative;
        this.tokenTable = TokenTable.of(builder.precedences);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    @Override
    public Optional<Declaration> getDeclaration(@Nonnull Name name) {
        return Optional.ofNullable(declarations.get(name));
    }

    @Nonnull
    @Override
    public Optional<Name> getAlias(@Nonnull Name name) {
        return Optional.ofNullable(aliases.get(name));
    }

    @Nonnull
    @Override
    public List<Name> getOpenNamespaces() {
        return openNamespaces;
    }

    @Nonnull
    @Override
    public Optional<Name> getUserName(@Nonnull Name name) {
        return Optional.ofNullable(userNames.get(name));
    }

    @Nonnull
    @Override
    public Optional<CoercionInfo> getCoercion(@Nonnull Name name) {
        return Optional.ofNullable(coercions.get(name));
    }

    @Nonnull
    @Override
    public List<NotationEntry> getNotationEntries(@Nonnull HeadIndex head) {
        return notations.get(head);
    }

    @Override
    public boolean isImpredicative() {
        return impredicative;
    }

    @Nonnull
    @Override
    public TokenTable getTokenTable() {
        return tokenTable;
    }

    /**
     * Builder for {@link InMemoryEnvironment}. Environments are impredicative unless configured otherwise.
     */
    public static class Builder {
        private final Map<Name, Declaration> declarations = new LinkedHashMap<>();
        private final Map<Name, Name> aliases = new HashMap<>();
        private final List<Name> openNamespaces = new ArrayList<>();
        private final Map<Name, Name> userNames = new HashMap<>();
        private final Map<Name, CoercionInfo> coercions = new HashMap<>();
        private final List<NotationEntry> notations = new ArrayList<>();
        private final Map<String, Integer> precedences = new HashMap<>();
        private boolean impredicative = true;

        private Builder() {
        }

        @Nonnull
        public Builder addDeclaration(@Nonnull Declaration declaration) {
            declarations.put(declaration.getName(), declaration);
            return this;
        }

        @Nonnull
        public Builder addConstant(@Nonnull String name, @Nonnull Expr type) {
            return addDeclaration(new Declaration(Name.of(name), ImmutableList.of(), type, null));
        }

        @Nonnull
        public Builder addDefinition(@Nonnull String name, @Nonnull Expr type, @Nonnull Expr value) {
            return addDeclaration(new Declaration(Name.of(name), ImmutableList.of(), type, value));
        }

        @Nonnull
        public Builder addAlias(@Nonnull Name name, @Nonnull Name alias) {
            aliases.put(name, alias);
            return this;
        }

        @Nonnull
        public Builder openNamespace(@Nonnull Name namespace) {
            openNamespaces.add(namespace);
            return this;
        }

        @Nonnull
        public Builder addPrivateName(@Nonnull Name hiddenName, @Nonnull Name userName) {
            userNames.put(hiddenName, userName);
            return this;
        }

        @Nonnull
        public Builder addCoercion(@Nonnull Name function, @Nonnull Name targetClass, int numArgs) {
            coercions.put(function, new CoercionInfo(targetClass, numArgs));
            return this;
        }

        @Nonnull
        public Builder addNotation(@Nonnull NotationEntry entry) {
            notations.add(entry);
            return this;
        }

        @Nonnull
        public Builder setPrecedence(@Nonnull String token, int precedence) {
            precedences.put(token, precedence);
            return this;
        }

        @Nonnull
        public Builder setImpredicative(boolean impredicative) {
            this.impredicative = impredicative;
            return this;
        }

        @Nonnull
        public InMemoryEnvironment build() {
            return new InMemoryEnvironment(this);
        }
    }
}

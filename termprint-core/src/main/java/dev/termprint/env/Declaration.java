/*
 * Declaration.java
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
import dev.termprint.term.Name;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * A declared constant: its universe parameters, its type and, for definitions, its value.
 */
@API(API.Status.EXPERIMENTAL)
public final class Declaration {
    @Nonnull
    private final Name name;
    @Nonnull
    private final List<Name> levelParams;
    @Nonnull
    private final Expr type;
    @Nullable
    private final Expr value;

    public Declaration(@Nonnull Name name, @Nonnull List<Name> levelParams, @Nonnull Expr type, @Nullable Expr value) {
        this.name = name;
        this.levelParams = ImmutableList.copyOf(levelParams);
        this.type = type;
        this.value = value;
    }

    @Nonnull
    public Name getName() {
        return name;
    }

    @Nonnull
    public List<Name> getLevelParams() {
        return levelParams;
    }

    @Nonnull
    public Expr getType() {
        return type;
    }

    @Nonnull
    public Optional<Expr> getValue() {
        return Optional.ofNullable(value);
    }

    @Override
    public String toString() {
        return name + " : " + type;
    }
}

/*
 * MetaVar.java
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

package dev.termprint.term;

import dev.termprint.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A metavariable: a hole to be filled by elaboration. It is identified by its id; the display name is only used for
 * printing.
 */
@API(API.Status.EXPERIMENTAL)
public final class MetaVar extends Expr {
    @Nonnull
    private final Name id;
    @Nullable
    private final Name displayName;
    @Nonnull
    private final Expr type;

    public MetaVar(@Nonnull Name id, @Nonnull Expr type) {
        this(id, null, type);
    }

    public MetaVar(@Nonnull Name id, @Nullable Name displayName, @Nonnull Expr type) {
        super(type.getLooseBVarRange(), true, type.hasUnivMetavar(), type.hasLocal(), Objects.hash(id, type) * 41 + 5);
        this.id = id;
        this.displayName = displayName;
        this.type = type;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.META;
    }

    @Nonnull
    public Name getId() {
        return id;
    }

    @Nonnull
    public Name getDisplayName() {
        return displayName != null ? displayName : id;
    }

    @Nonnull
    public Expr getType() {
        return type;
    }

    @Nonnull
    public MetaVar withDisplayName(@Nonnull Name newDisplayName) {
        return newDisplayName.equals(getDisplayName()) ? this : new MetaVar(id, newDisplayName, type);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetaVar)) {
            return false;
        }
        final MetaVar other = (MetaVar)o;
        return id.equals(other.id) && type.equals(other.type);
    }
}

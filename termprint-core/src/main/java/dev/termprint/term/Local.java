/*
 * Local.java
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
 * A local constant: a free variable standing for an opened binder. It is identified by its id; {@code ppName} is the
 * name it prints as.
 */
@API(API.Status.EXPERIMENTAL)
public final class Local extends Expr {
    @Nonnull
    private final Name id;
    @Nonnull
    private final Name ppName;
    @Nonnull
    private final Expr type;
    @Nonnull
    private final BinderInfo binderInfo;

    public Local(@Nonnull Name id, @Nonnull Name ppName, @Nonnull Expr type, @Nonnull BinderInfo binderInfo) {
        super(type.getLooseBVarRange(), type.hasExprMetavar(), type.hasUnivMetavar(), true,
                Objects.hash(id, type) * 43 + 11);
        this.id = id;
        this.ppName = ppName;
        this.type = type;
        this.binderInfo = binderInfo;
    }

    public Local(@Nonnull Name id, @Nonnull Expr type) {
        this(id, id, type, BinderInfo.DEFAULT);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.LOCAL;
    }

    @Nonnull
    public Name getId() {
        return id;
    }

    @Nonnull
    public Name getPpName() {
        return ppName;
    }

    @Nonnull
    public Expr getType() {
        return type;
    }

    @Nonnull
    public BinderInfo getBinderInfo() {
        return binderInfo;
    }

    @Nonnull
    public Local withPpName(@Nonnull Name newPpName) {
        return newPpName.equals(ppName) ? this : new Local(id, newPpName, type, binderInfo);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Local)) {
            return false;
        }
        final Local other = (Local)o;
        return id.equals(other.id) && type.equals(other.type);
    }
}

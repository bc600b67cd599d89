/*
 * HeadIndex.java
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
 * Key of the head of an application spine: its kind, and its name for constants, local constants and macros.
 * Notation tables are indexed by it.
 */
@API(API.Status.EXPERIMENTAL)
public final class HeadIndex {
    @Nonnull
    private final ExprKind kind;
    @Nullable
    private final Name name;

    public HeadIndex(@Nonnull ExprKind kind, @Nullable Name name) {
        this.kind = kind;
        this.name = name;
    }

    @Nonnull
    public static HeadIndex constant(@Nonnull Name name) {
        return new HeadIndex(ExprKind.CONSTANT, name);
    }

    @Nonnull
    public static HeadIndex of(@Nonnull Expr e) {
        final Expr fn = Exprs.getAppFn(e);
        switch (fn.getKind()) {
            case CONSTANT:
                return new HeadIndex(ExprKind.CONSTANT, ((Constant)fn).getName());
            case LOCAL:
                return new HeadIndex(ExprKind.LOCAL, ((Local)fn).getId());
            case MACRO:
                return new HeadIndex(ExprKind.MACRO, ((Macro)fn).getDefinition().getName());
            default:
                return new HeadIndex(fn.getKind(), null);
        }
    }

    @Nonnull
    public ExprKind getKind() {
        return kind;
    }

    @Nullable
    public Name getName() {
        return name;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final HeadIndex other = (HeadIndex)o;
        return kind == other.kind && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name == null ? kind.name() : kind.name() + ":" + name;
    }
}

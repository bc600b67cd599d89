/*
 * NotationAction.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * What a notation transition does after its token: nothing ({@link Kind#SKIP}), read one sub-expression at a right
 * binding power ({@link Kind#EXPR}), or one of the richer forms the printer cannot invert.
 */
@API(API.Status.EXPERIMENTAL)
public final class NotationAction {
    /**
     * Action kinds.
     */
    public enum Kind {
        SKIP,
        EXPR,
        EXPRS,
        BINDER,
        BINDERS,
        SCOPED_EXPR,
        EXTENSION
    }

    private static final NotationAction SKIP = new NotationAction(Kind.SKIP, 0);

    @Nonnull
    private final Kind kind;
    private final int rbp;

    private NotationAction(@Nonnull Kind kind, int rbp) {
        this.kind = kind;
        this.rbp = rbp;
    }

    @Nonnull
    public static NotationAction skip() {
        return SKIP;
    }

    @Nonnull
    public static NotationAction expr(int rbp) {
        return new NotationAction(Kind.EXPR, rbp);
    }

    @Nonnull
    public static NotationAction of(@Nonnull Kind kind) {
        return new NotationAction(kind, 0);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * The right binding power of an {@link Kind#EXPR} action.
     * @return the binding power
     */
    public int getRbp() {
        return rbp;
    }

    /**
     * Whether the action consumes a notation parameter.
     * @return {@code true} for every kind but skip and the binder forms
     */
    public boolean takesParameter() {
        return kind != Kind.SKIP && kind != Kind.BINDER && kind != Kind.BINDERS;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final NotationAction other = (NotationAction)o;
        return kind == other.kind && rbp == other.rbp;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rbp);
    }

    @Override
    public String toString() {
        return kind == Kind.EXPR ? "expr:" + rbp : kind.name().toLowerCase();
    }
}

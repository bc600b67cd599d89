/*
 * BinderInfo.java
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
 * How a binder's argument is supplied, plus the {@code contextual} flag that marks a {@code have} hypothesis as
 * visible to later elaboration.
 */
@API(API.Status.EXPERIMENTAL)
public final class BinderInfo {
    /**
     * Binder kinds. Everything except {@link #DEFAULT} is hidden from display unless implicit arguments are shown.
     */
    public enum Kind {
        DEFAULT,
        IMPLICIT,
        STRICT_IMPLICIT,
        INST_IMPLICIT
    }

    @Nonnull
    public static final BinderInfo DEFAULT = new BinderInfo(Kind.DEFAULT, false);
    @Nonnull
    public static final BinderInfo IMPLICIT = new BinderInfo(Kind.IMPLICIT, false);
    @Nonnull
    public static final BinderInfo STRICT_IMPLICIT = new BinderInfo(Kind.STRICT_IMPLICIT, false);
    @Nonnull
    public static final BinderInfo INST_IMPLICIT = new BinderInfo(Kind.INST_IMPLICIT, false);

    @Nonnull
    private final Kind kind;
    private final boolean contextual;

    private BinderInfo(@Nonnull Kind kind, boolean contextual) {
        this.kind = kind;
        this.contextual = contextual;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    public boolean isExplicit() {
        return kind == Kind.DEFAULT;
    }

    public boolean isImplicit() {
        return kind == Kind.IMPLICIT;
    }

    public boolean isStrictImplicit() {
        return kind == Kind.STRICT_IMPLICIT;
    }

    public boolean isInstImplicit() {
        return kind == Kind.INST_IMPLICIT;
    }

    public boolean isContextual() {
        return contextual;
    }

    @Nonnull
    public BinderInfo withContextual(boolean newContextual) {
        return newContextual == contextual ? this : new BinderInfo(kind, newContextual);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final BinderInfo other = (BinderInfo)o;
        return kind == other.kind && contextual == other.contextual;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, contextual);
    }

    @Override
    public String toString() {
        return contextual ? kind + "[contextual]" : kind.toString();
    }
}

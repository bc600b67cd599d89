/*
 * Level.java
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

import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * A universe level. Levels are immutable and compared structurally, except that metavariable levels compare by
 * identity only, so a display name given during purification does not change equality.
 */
@API(API.Status.EXPERIMENTAL)
public final class Level {
    /**
     * The shapes a level can take.
     */
    public enum Kind {
        ZERO,
        SUCC,
        MAX,
        IMAX,
        PARAM,
        META,
        PLACEHOLDER
    }

    @Nonnull
    public static final Level ZERO = new Level(Kind.ZERO, null, null, null, null);
    @Nonnull
    public static final Level PLACEHOLDER = new Level(Kind.PLACEHOLDER, null, null, null, null);
    @Nonnull
    public static final Level ONE = succ(ZERO);

    @Nonnull
    private final Kind kind;
    @Nullable
    private final Level lhs;
    @Nullable
    private final Level rhs;
    @Nullable
    private final Name name;
    @Nullable
    private final Name displayName;
    private final boolean hasMeta;
    private final int hash;

    private Level(@Nonnull Kind kind, @Nullable Level lhs, @Nullable Level rhs, @Nullable Name name,
                  @Nullable Name displayName) {
        this.kind = kind;
        this.lhs = lhs;
        this.rhs = rhs;
        this.name = name;
        this.displayName = displayName;
        this.hasMeta = kind == Kind.META || (lhs != null && lhs.hasMeta) || (rhs != null && rhs.hasMeta);
        this.hash = Objects.hash(kind, lhs, rhs, name);
    }

    @Nonnull
    public static Level succ(@Nonnull Level l) {
        return new Level(Kind.SUCC, l, null, null, null);
    }

    @Nonnull
    public static Level max(@Nonnull Level l1, @Nonnull Level l2) {
        return new Level(Kind.MAX, l1, l2, null, null);
    }

    @Nonnull
    public static Level imax(@Nonnull Level l1, @Nonnull Level l2) {
        return new Level(Kind.IMAX, l1, l2, null, null);
    }

    @Nonnull
    public static Level param(@Nonnull Name name) {
        return new Level(Kind.PARAM, null, null, name, null);
    }

    @Nonnull
    public static Level param(@Nonnull String name) {
        return param(Name.of(name));
    }

    @Nonnull
    public static Level meta(@Nonnull Name id) {
        return new Level(Kind.META, null, null, id, null);
    }

    @Nonnull
    public static Level meta(@Nonnull Name id, @Nullable Name displayName) {
        return new Level(Kind.META, null, null, id, displayName);
    }

    /**
     * The level {@code l + k}.
     * @param l base level
     * @param k offset
     * @return {@code l} wrapped in {@code k} successors
     */
    @Nonnull
    public static Level offset(@Nonnull Level l, int k) {
        Level result = l;
        for (int i = 0; i < k; i++) {
            result = succ(result);
        }
        return result;
    }

    @Nonnull
    public static Level of(int n) {
        return offset(ZERO, n);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    public boolean isZero() {
        return kind == Kind.ZERO;
    }

    public boolean isSucc() {
        return kind == Kind.SUCC;
    }

    public boolean isMax() {
        return kind == Kind.MAX;
    }

    public boolean isImax() {
        return kind == Kind.IMAX;
    }

    public boolean isMeta() {
        return kind == Kind.META;
    }

    public boolean isPlaceholder() {
        return kind == Kind.PLACEHOLDER;
    }

    public boolean hasMeta() {
        return hasMeta;
    }

    /**
     * The argument of a successor, or the left argument of a max/imax.
     * @return the level
     */
    @Nonnull
    public Level getLhs() {
        return Objects.requireNonNull(lhs, "level has no arguments");
    }

    @Nonnull
    public Level getRhs() {
        return Objects.requireNonNull(rhs, "level has no second argument");
    }

    /**
     * The name of a parameter or the identity of a metavariable.
     * @return the name
     */
    @Nonnull
    public Name getName() {
        return Objects.requireNonNull(name, "level has no name");
    }

    /**
     * The name shown for a metavariable level, its identity unless purification assigned another one.
     * @return the display name
     */
    @Nonnull
    public Name getDisplayName() {
        return displayName != null ? displayName : getName();
    }

    /**
     * A metavariable level with the given display name and the same identity.
     * @param newDisplayName the name to show
     * @return the renamed level
     */
    @Nonnull
    public Level withDisplayName(@Nonnull Name newDisplayName) {
        Preconditions.checkState(kind == Kind.META, "only metavariable levels have display names");
        return newDisplayName.equals(getDisplayName()) ? this : meta(getName(), newDisplayName);
    }

    /**
     * Rebuild this level bottom-up. {@code fn} is applied before descending; a non-{@code null} answer replaces the
     * whole subtree.
     * @param fn the replacement function
     * @return the rewritten level, this same object if nothing changed
     */
    @Nonnull
    public Level replace(@Nonnull Function<Level, Level> fn) {
        final Level replaced = fn.apply(this);
        if (replaced != null) {
            return replaced;
        }
        switch (kind) {
            case SUCC: {
                final Level newLhs = getLhs().replace(fn);
                return newLhs == lhs ? this : succ(newLhs);
            }
            case MAX:
            case IMAX: {
                final Level newLhs = getLhs().replace(fn);
                final Level newRhs = getRhs().replace(fn);
                if (newLhs == lhs && newRhs == rhs) {
                    return this;
                }
                return kind == Kind.MAX ? max(newLhs, newRhs) : imax(newLhs, newRhs);
            }
            default:
                return this;
        }
    }

    /**
     * Replace parameters by levels.
     * @param substitution maps a parameter name to its replacement, or to {@code null} to keep it
     * @return the instantiated level
     */
    @Nonnull
    public Level instantiate(@Nonnull Function<Name, Level> substitution) {
        return replace(l -> l.kind == Kind.PARAM ? substitution.apply(l.getName()) : null);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final Level other = (Level)o;
        return hash == other.hash
                && kind == other.kind
                && Objects.equals(lhs, other.lhs)
                && Objects.equals(rhs, other.rhs)
                && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        switch (kind) {
            case ZERO:
                return "0";
            case SUCC:
                return "succ(" + lhs + ")";
            case MAX:
                return "max(" + lhs + ", " + rhs + ")";
            case IMAX:
                return "imax(" + lhs + ", " + rhs + ")";
            case PARAM:
                return String.valueOf(name);
            case META:
                return "?" + getDisplayName();
            default:
                return "_";
        }
    }
}

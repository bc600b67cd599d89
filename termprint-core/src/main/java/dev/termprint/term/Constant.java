/*
 * Constant.java
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
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A reference to a declared constant, instantiated with universe levels.
 */
@API(API.Status.EXPERIMENTAL)
public final class Constant extends Expr {
    @Nonnull
    private final Name name;
    @Nonnull
    private final ImmutableList<Level> levels;

    public Constant(@Nonnull Name name, @Nonnull List<Level> levels) {
        super(0, false, levels.stream().anyMatch(Level::hasMeta), false, 37 * name.hashCode() + levels.hashCode());
        this.name = name;
        this.levels = ImmutableList.copyOf(levels);
    }

    public Constant(@Nonnull Name name) {
        this(name, ImmutableList.of());
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.CONSTANT;
    }

    @Nonnull
    public Name getName() {
        return name;
    }

    @Nonnull
    public List<Level> getLevels() {
        return levels;
    }

    @Nonnull
    public Constant withLevels(@Nonnull List<Level> newLevels) {
        if (newLevels.size() == levels.size()) {
            boolean same = true;
            for (int i = 0; i < newLevels.size(); i++) {
                if (newLevels.get(i) != levels.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return this;
            }
        }
        return new Constant(name, newLevels);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constant)) {
            return false;
        }
        final Constant other = (Constant)o;
        return hashCode() == other.hashCode() && name.equals(other.name) && levels.equals(other.levels);
    }
}

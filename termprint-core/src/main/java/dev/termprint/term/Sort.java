/*
 * Sort.java
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

/**
 * A universe {@code Sort l}.
 */
@API(API.Status.EXPERIMENTAL)
public final class Sort extends Expr {
    @Nonnull
    public static final Sort PROP = new Sort(Level.ZERO);
    @Nonnull
    public static final Sort TYPE = new Sort(Level.ONE);

    @Nonnull
    private final Level level;

    public Sort(@Nonnull Level level) {
        super(0, false, level.hasMeta(), false, 17 * level.hashCode() + 3);
        this.level = level;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.SORT;
    }

    @Nonnull
    public Level getLevel() {
        return level;
    }

    @Nonnull
    public Sort withLevel(@Nonnull Level newLevel) {
        return newLevel == level ? this : new Sort(newLevel);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Sort && level.equals(((Sort)o).level);
    }
}

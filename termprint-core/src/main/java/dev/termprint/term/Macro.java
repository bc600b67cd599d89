/*
 * Macro.java
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
 * An opaque macro payload: a definition applied to argument terms.
 */
@API(API.Status.EXPERIMENTAL)
public final class Macro extends Expr {
    @Nonnull
    private final MacroDefinition definition;
    @Nonnull
    private final ImmutableList<Expr> args;

    public Macro(@Nonnull MacroDefinition definition, @Nonnull List<? extends Expr> args) {
        super(args.stream().mapToInt(Expr::getLooseBVarRange).max().orElse(0),
                args.stream().anyMatch(Expr::hasExprMetavar),
                args.stream().anyMatch(Expr::hasUnivMetavar),
                args.stream().anyMatch(Expr::hasLocal),
                definition.hashCode() * 47 + args.hashCode());
        this.definition = definition;
        this.args = ImmutableList.copyOf(args);
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.MACRO;
    }

    @Nonnull
    public MacroDefinition getDefinition() {
        return definition;
    }

    @Nonnull
    public List<Expr> getArgs() {
        return args;
    }

    public int getNumArgs() {
        return args.size();
    }

    @Nonnull
    public Expr getArg(int i) {
        return args.get(i);
    }

    @Nonnull
    public Macro withArgs(@Nonnull List<Expr> newArgs) {
        if (newArgs.size() == args.size()) {
            boolean same = true;
            for (int i = 0; i < args.size(); i++) {
                if (newArgs.get(i) != args.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) {
                return this;
            }
        }
        return new Macro(definition, newArgs);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Macro)) {
            return false;
        }
        final Macro other = (Macro)o;
        return hashCode() == other.hashCode() && definition.equals(other.definition) && args.equals(other.args);
    }
}

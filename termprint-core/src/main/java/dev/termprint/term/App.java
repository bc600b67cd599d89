/*
 * App.java
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
 * Application of a function to one argument. Multi-argument applications are left-nested.
 */
@API(API.Status.EXPERIMENTAL)
public final class App extends Expr {
    @Nonnull
    private final Expr fn;
    @Nonnull
    private final Expr arg;

    public App(@Nonnull Expr fn, @Nonnull Expr arg) {
        super(Math.max(fn.getLooseBVarRange(), arg.getLooseBVarRange()),
                fn.hasExprMetavar() || arg.hasExprMetavar(),
                fn.hasUnivMetavar() || arg.hasUnivMetavar(),
                fn.hasLocal() || arg.hasLocal(),
                (fn.hashCode() * 31 + arg.hashCode()) * 31 + 13);
        this.fn = fn;
        this.arg = arg;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.APP;
    }

    @Nonnull
    public Expr getFn() {
        return fn;
    }

    @Nonnull
    public Expr getArg() {
        return arg;
    }

    @Nonnull
    public App update(@Nonnull Expr newFn, @Nonnull Expr newArg) {
        return newFn == fn && newArg == arg ? this : new App(newFn, newArg);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof App)) {
            return false;
        }
        final App other = (App)o;
        return hashCode() == other.hashCode() && fn.equals(other.fn) && arg.equals(other.arg);
    }
}

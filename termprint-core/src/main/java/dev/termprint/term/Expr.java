/*
 * Expr.java
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

/**
 * An immutable term. Terms are shared by reference; operations that change a term build a new one and reuse every
 * subterm that did not change.
 *
 * <p>
 * Each node caches a few facts about its subtree so that traversals can skip subtrees that cannot contain what they
 * look for: the range of loose bound variables (a term is closed when it is {@code 0}), and whether metavariables,
 * level metavariables or local constants occur in it.
 * </p>
 *
 * <p>
 * Equality is structural. Binder names and display names do not take part in it, local constants and metavariables
 * are identified by their identity and type.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class Expr {
    private final int looseBVarRange;
    private final boolean hasExprMetavar;
    private final boolean hasUnivMetavar;
    private final boolean hasLocal;
    private final int hash;

    protected Expr(int looseBVarRange, boolean hasExprMetavar, boolean hasUnivMetavar, boolean hasLocal, int hash) {
        this.looseBVarRange = looseBVarRange;
        this.hasExprMetavar = hasExprMetavar;
        this.hasUnivMetavar = hasUnivMetavar;
        this.hasLocal = hasLocal;
        this.hash = hash;
    }

    @Nonnull
    public abstract ExprKind getKind();

    /**
     * One more than the largest loose bound variable index, {@code 0} if there is none.
     * @return the loose bound variable range
     */
    public int getLooseBVarRange() {
        return looseBVarRange;
    }

    public boolean isClosed() {
        return looseBVarRange == 0;
    }

    public boolean hasExprMetavar() {
        return hasExprMetavar;
    }

    public boolean hasUnivMetavar() {
        return hasUnivMetavar;
    }

    public boolean hasLocal() {
        return hasLocal;
    }

    public boolean isApp() {
        return getKind() == ExprKind.APP;
    }

    public boolean isLambda() {
        return getKind() == ExprKind.LAMBDA;
    }

    public boolean isPi() {
        return getKind() == ExprKind.PI;
    }

    public boolean isBinding() {
        return isLambda() || isPi();
    }

    public boolean isConstant() {
        return getKind() == ExprKind.CONSTANT;
    }

    public boolean isVar() {
        return getKind() == ExprKind.VAR;
    }

    public boolean isSort() {
        return getKind() == ExprKind.SORT;
    }

    public boolean isMetavar() {
        return getKind() == ExprKind.META;
    }

    public boolean isLocal() {
        return getKind() == ExprKind.LOCAL;
    }

    public boolean isMacro() {
        return getKind() == ExprKind.MACRO;
    }

    @Override
    public final int hashCode() {
        return hash;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public String toString() {
        return ExprDebugStrings.toDebugString(this);
    }
}

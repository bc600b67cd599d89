/*
 * NotationMatcher.java
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

package dev.termprint.printer;

import dev.termprint.env.TypeCheckResult;
import dev.termprint.env.TypeChecker;
import dev.termprint.term.Annotations;
import dev.termprint.term.Binding;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Level;
import dev.termprint.term.Sort;
import dev.termprint.term.Var;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Matches the pattern of a notation entry against a term, filling a {@link MatchEnvironment}.
 *
 * <p>
 * Pattern applications are matched against the explicit arguments of the term only: the inferred type of the term's
 * head tells which argument positions are explicit, and only those consume pattern arguments. A pattern whose head is
 * marked explicit ({@code @f}) is instead matched position by position.
 * </p>
 */
final class NotationMatcher {
    @Nonnull
    private final TypeChecker typeChecker;
    private final boolean showUniverses;

    NotationMatcher(@Nonnull TypeChecker typeChecker, boolean showUniverses) {
        this.typeChecker = typeChecker;
        this.showUniverses = showUniverses;
    }

    boolean match(@Nonnull Expr pattern, @Nonnull Expr e, @Nonnull MatchEnvironment args) {
        if (Annotations.isExplicit(pattern)) {
            return match(Annotations.getExplicitArg(pattern), e, args);
        }
        if (pattern instanceof Var) {
            return args.bind(((Var)pattern).getIndex(), e);
        }
        if (Annotations.isPlaceholder(pattern)) {
            return true;
        }
        if (pattern instanceof Constant && e instanceof Constant) {
            return matchConstant((Constant)pattern, (Constant)e);
        }
        if (pattern instanceof Sort) {
            return e instanceof Sort && match(((Sort)pattern).getLevel(), ((Sort)e).getLevel());
        }
        if (e.isApp()) {
            return matchApp(pattern, e, args);
        }
        return false;
    }

    private boolean matchConstant(@Nonnull Constant pattern, @Nonnull Constant e) {
        if (!pattern.getName().equals(e.getName())) {
            return false;
        }
        final List<Level> patternLevels = pattern.getLevels();
        final List<Level> levels = e.getLevels();
        if (levels.size() < patternLevels.size()) {
            return false;
        }
        for (int i = 0; i < patternLevels.size(); i++) {
            if (!match(patternLevels.get(i), levels.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Level equality relaxed when universes are hidden: a placeholder matches any level and successors match
     * structurally.
     * @param pattern the pattern level
     * @param l the actual level
     * @return whether they match
     */
    boolean match(@Nonnull Level pattern, @Nonnull Level l) {
        if (pattern.equals(l)) {
            return true;
        }
        if (showUniverses) {
            return false;
        }
        if (pattern.isPlaceholder()) {
            return true;
        }
        if (pattern.isSucc() && l.isSucc()) {
            return match(pattern.getLhs(), l.getLhs());
        }
        return false;
    }

    private boolean matchApp(@Nonnull Expr pattern, @Nonnull Expr e, @Nonnull MatchEnvironment args) {
        final Expr patternFn = Exprs.getAppFn(pattern);
        final List<Expr> patternArgs = Exprs.getAppArgs(pattern);
        final Expr fn = Exprs.getAppFn(e);
        final List<Expr> actualArgs = Exprs.getAppArgs(e);
        if (!match(patternFn, fn, args)) {
            return false;
        }
        if (Annotations.isExplicit(patternFn)) {
            if (patternArgs.size() != actualArgs.size()) {
                return false;
            }
            for (int i = 0; i < patternArgs.size(); i++) {
                if (!match(patternArgs.get(i), actualArgs.get(i), args)) {
                    return false;
                }
            }
            return true;
        }
        TypeCheckResult<Expr> fnType = typeChecker.infer(fn);
        int j = 0;
        for (Expr arg : actualArgs) {
            final TypeCheckResult<Binding> pi = fnType.flatMap(typeChecker::ensurePi);
            if (!pi.isSuccess()) {
                return false;
            }
            if (pi.getValue().getBinderInfo().isExplicit()) {
                if (j >= patternArgs.size() || !match(patternArgs.get(j), arg, args)) {
                    return false;
                }
                j++;
            }
            fnType = TypeCheckResult.success(Exprs.instantiate(pi.getValue().getBody(), arg));
        }
        return j == patternArgs.size();
    }
}

/*
 * SimpleTypeChecker.java
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
import dev.termprint.term.Annotations;
import dev.termprint.term.App;
import dev.termprint.term.Binding;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.ExprKind;
import dev.termprint.term.Exprs;
import dev.termprint.term.Level;
import dev.termprint.term.Local;
import dev.termprint.term.Macro;
import dev.termprint.term.MetaVar;
import dev.termprint.term.Name;
import dev.termprint.term.Sort;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A small {@link TypeChecker} over an {@link Environment}. It infers types structurally without checking argument
 * types, and reduces by head beta, annotation stripping and unfolding of definitions. It is enough to classify
 * implicit arguments and propositions; it is not a kernel.
 *
 * <p>
 * Not thread safe: fresh local names come from a counter in the instance, so printers used from different threads
 * need their own checker.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class SimpleTypeChecker implements TypeChecker {
    private static final Name LOCAL_PREFIX = Name.of("_tc");
    private static final int MAX_UNFOLDINGS = 1000;

    @Nonnull
    private final Environment environment;
    private int nextLocal;

    public SimpleTypeChecker(@Nonnull Environment environment) {
        this.environment = environment;
    }

    @Nonnull
    public Environment getEnvironment() {
        return environment;
    }

    @Nonnull
    @Override
    public TypeCheckResult<Expr> infer(@Nonnull Expr e) {
        if (!e.isClosed()) {
            return TypeCheckResult.failure(TypeCheckFailure.Reason.OPEN_TERM,
                    "cannot infer the type of open term " + e);
        }
        return inferClosed(e);
    }

    @Nonnull
    private TypeCheckResult<Expr> inferClosed(@Nonnull Expr e) {
        switch (e.getKind()) {
            case SORT:
                return TypeCheckResult.success(new Sort(Level.succ(((Sort)e).getLevel())));
            case CONSTANT:
                return inferConstant((Constant)e);
            case META:
                return TypeCheckResult.success(((MetaVar)e).getType());
            case LOCAL:
                return TypeCheckResult.success(((Local)e).getType());
            case APP: {
                final App app = (App)e;
                return inferClosed(app.getFn())
                        .flatMap(this::ensurePi)
                        .map(pi -> Exprs.instantiate(pi.getBody(), app.getArg()));
            }
            case LAMBDA:
                return inferLambda((Binding)e);
            case PI:
                return inferPi((Binding)e);
            case MACRO:
                return inferMacro((Macro)e);
            default:
                return TypeCheckResult.failure(TypeCheckFailure.Reason.OPEN_TERM, "loose bound variable " + e);
        }
    }

    @Nonnull
    private TypeCheckResult<Expr> inferConstant(@Nonnull Constant constant) {
        final Optional<Declaration> declaration = environment.getDeclaration(constant.getName());
        if (declaration.isEmpty()) {
            return TypeCheckResult.failure(TypeCheckFailure.Reason.UNKNOWN_CONSTANT,
                    "unknown constant " + constant.getName());
        }
        return TypeCheckResult.success(instantiateLevelParams(declaration.get().getType(),
                declaration.get().getLevelParams(), constant.getLevels()));
    }

    @Nonnull
    private TypeCheckResult<Expr> inferLambda(@Nonnull Binding lambda) {
        final Local local = mkLocal(lambda);
        return inferClosed(Exprs.instantiate(lambda.getBody(), local))
                .map(bodyType -> (Expr)new Binding(ExprKind.PI, lambda.getName(), lambda.getDomain(),
                        Exprs.abstractOver(bodyType, local), lambda.getBinderInfo()));
    }

    @Nonnull
    private TypeCheckResult<Expr> inferPi(@Nonnull Binding pi) {
        final Local local = mkLocal(pi);
        return inferSortLevel(pi.getDomain())
                .flatMap(domainLevel -> inferSortLevel(Exprs.instantiate(pi.getBody(), local))
                        .map(bodyLevel -> (Expr)new Sort(imax(domainLevel, bodyLevel))));
    }

    @Nonnull
    private TypeCheckResult<Level> inferSortLevel(@Nonnull Expr type) {
        return inferClosed(type).flatMap(this::whnf).flatMap(t -> {
            if (t instanceof Sort) {
                return TypeCheckResult.success(((Sort)t).getLevel());
            }
            return TypeCheckResult.failure(TypeCheckFailure.Reason.NOT_A_TYPE, "not a type: " + type);
        });
    }

    @Nonnull
    private TypeCheckResult<Expr> inferMacro(@Nonnull Macro macro) {
        @Nullable final Expr unwrapped = unwrapAnnotation(macro);
        if (unwrapped != null) {
            return inferClosed(unwrapped);
        }
        return TypeCheckResult.failure(TypeCheckFailure.Reason.UNSUPPORTED,
                "cannot infer the type of macro " + macro.getDefinition().getName());
    }

    @Nullable
    private static Expr unwrapAnnotation(@Nonnull Expr e) {
        if (Annotations.isTypedExpr(e)) {
            return Annotations.getTypedExprExpr(e);
        }
        if (Annotations.isLet(e)) {
            return Annotations.getLetBody(e);
        }
        if (Annotations.isLetValue(e) || Annotations.isExplicit(e)
                || Annotations.isHaveAnnotation(e) || Annotations.isShowAnnotation(e)) {
            return Annotations.getAnnotationArg(e);
        }
        return null;
    }

    @Nonnull
    @Override
    public TypeCheckResult<Expr> whnf(@Nonnull Expr e) {
        if (!e.isClosed()) {
            return TypeCheckResult.failure(TypeCheckFailure.Reason.OPEN_TERM, "cannot reduce open term " + e);
        }
        Expr current = e;
        for (int i = 0; i < MAX_UNFOLDINGS; i++) {
            final Expr next = whnfStep(current);
            if (next == null) {
                return TypeCheckResult.success(current);
            }
            current = next;
        }
        return TypeCheckResult.failure(TypeCheckFailure.Reason.UNSUPPORTED, "reduction limit reached for " + e);
    }

    @Nullable
    private Expr whnfStep(@Nonnull Expr e) {
        final Expr head = Exprs.getAppFn(e);
        final List<Expr> args = Exprs.getAppArgs(e);
        if (head.isLambda() && !args.isEmpty()) {
            return Exprs.headBeta(e);
        }
        @Nullable final Expr unwrapped = unwrapAnnotation(head);
        if (unwrapped != null) {
            return Exprs.mkApp(unwrapped, args);
        }
        if (head instanceof Constant) {
            final Constant constant = (Constant)head;
            final Optional<Declaration> declaration = environment.getDeclaration(constant.getName());
            if (declaration.isPresent() && declaration.get().getValue().isPresent()) {
                final Expr value = instantiateLevelParams(declaration.get().getValue().get(),
                        declaration.get().getLevelParams(), constant.getLevels());
                return Exprs.mkApp(value, args);
            }
        }
        return null;
    }

    @Nonnull
    @Override
    public TypeCheckResult<Binding> ensurePi(@Nonnull Expr type) {
        return whnf(type).flatMap(t -> {
            if (t.isPi()) {
                return TypeCheckResult.success((Binding)t);
            }
            return TypeCheckResult.failure(TypeCheckFailure.Reason.NOT_A_PRODUCT, "not a product: " + t);
        });
    }

    @Nonnull
    @Override
    public TypeCheckResult<Boolean> isProp(@Nonnull Expr type) {
        return infer(type).flatMap(this::whnf)
                .map(t -> t instanceof Sort && ((Sort)t).getLevel().isZero());
    }

    @Nonnull
    private Local mkLocal(@Nonnull Binding binding) {
        nextLocal++;
        return new Local(LOCAL_PREFIX.appendAfter(nextLocal), binding.getName(), binding.getDomain(),
                binding.getBinderInfo());
    }

    @Nonnull
    private static Level imax(@Nonnull Level l1, @Nonnull Level l2) {
        if (l2.isZero()) {
            return Level.ZERO;
        }
        if (l1.isZero() || l1.equals(l2)) {
            return l2;
        }
        if (l2.isSucc()) {
            return Level.max(l1, l2);
        }
        return Level.imax(l1, l2);
    }

    @Nonnull
    private static Expr instantiateLevelParams(@Nonnull Expr e, @Nonnull List<Name> params,
                                               @Nonnull List<Level> levels) {
        if (params.isEmpty() || levels.isEmpty()) {
            return e;
        }
        final int n = Math.min(params.size(), levels.size());
        return Exprs.replace(e, (sub, offset) -> {
            if (sub instanceof Constant) {
                final Constant constant = (Constant)sub;
                final List<Level> newLevels = new ArrayList<>();
                for (Level level : constant.getLevels()) {
                    newLevels.add(substitute(level, params, levels, n));
                }
                return constant.withLevels(newLevels);
            }
            if (sub instanceof Sort) {
                return ((Sort)sub).withLevel(substitute(((Sort)sub).getLevel(), params, levels, n));
            }
            return null;
        });
    }

    @Nonnull
    private static Level substitute(@Nonnull Level level, @Nonnull List<Name> params, @Nonnull List<Level> levels,
                                    int n) {
        return level.instantiate(name -> {
            final int i = params.indexOf(name);
            return i >= 0 && i < n ? levels.get(i) : null;
        });
    }
}

/*
 * Exprs.java
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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Construction and traversal helpers over {@link Expr}.
 */
@API(API.Status.EXPERIMENTAL)
public final class Exprs {
    private Exprs() {
    }

    /**
     * Rewrite function used by {@link #replace(Expr, ReplaceFunction)}.
     */
    @FunctionalInterface
    public interface ReplaceFunction {
        /**
         * Visit a subterm.
         * @param e the subterm
         * @param offset the number of binders between the root and {@code e}
         * @return the replacement, or {@code null} to descend into {@code e}
         */
        @Nullable
        Expr apply(@Nonnull Expr e, int offset);
    }

    @Nonnull
    public static Expr mkConstant(@Nonnull String name) {
        return new Constant(Name.of(name));
    }

    @Nonnull
    public static Expr mkApp(@Nonnull Expr fn, @Nonnull Expr... args) {
        Expr result = fn;
        for (Expr arg : args) {
            result = new App(result, arg);
        }
        return result;
    }

    @Nonnull
    public static Expr mkApp(@Nonnull Expr fn, @Nonnull List<? extends Expr> args) {
        Expr result = fn;
        for (Expr arg : args) {
            result = new App(result, arg);
        }
        return result;
    }

    @Nonnull
    public static Binding mkLambda(@Nonnull String name, @Nonnull Expr domain, @Nonnull Expr body) {
        return new Binding(ExprKind.LAMBDA, Name.of(name), domain, body, BinderInfo.DEFAULT);
    }

    @Nonnull
    public static Binding mkLambda(@Nonnull String name, @Nonnull Expr domain, @Nonnull Expr body,
                                   @Nonnull BinderInfo binderInfo) {
        return new Binding(ExprKind.LAMBDA, Name.of(name), domain, body, binderInfo);
    }

    @Nonnull
    public static Binding mkPi(@Nonnull String name, @Nonnull Expr domain, @Nonnull Expr body) {
        return new Binding(ExprKind.PI, Name.of(name), domain, body, BinderInfo.DEFAULT);
    }

    @Nonnull
    public static Binding mkPi(@Nonnull String name, @Nonnull Expr domain, @Nonnull Expr body,
                               @Nonnull BinderInfo binderInfo) {
        return new Binding(ExprKind.PI, Name.of(name), domain, body, binderInfo);
    }

    /**
     * The non-dependent product {@code domain -> codomain}; {@code codomain} is read in the enclosing scope.
     * @param domain the domain
     * @param codomain the codomain
     * @return the arrow
     */
    @Nonnull
    public static Binding mkArrow(@Nonnull Expr domain, @Nonnull Expr codomain) {
        return new Binding(ExprKind.PI, Name.of("a"), domain, liftLooseBVars(codomain, 0, 1), BinderInfo.DEFAULT);
    }

    @Nonnull
    public static Expr getAppFn(@Nonnull Expr e) {
        Expr current = e;
        while (current instanceof App) {
            current = ((App)current).getFn();
        }
        return current;
    }

    /**
     * The arguments of an application spine, first argument first.
     * @param e the term
     * @return the arguments, empty if {@code e} is not an application
     */
    @Nonnull
    public static List<Expr> getAppArgs(@Nonnull Expr e) {
        final List<Expr> args = new ArrayList<>();
        Expr current = e;
        while (current instanceof App) {
            args.add(((App)current).getArg());
            current = ((App)current).getFn();
        }
        return ImmutableList.copyOf(args).reverse();
    }

    public static int getAppNumArgs(@Nonnull Expr e) {
        int n = 0;
        Expr current = e;
        while (current instanceof App) {
            n++;
            current = ((App)current).getFn();
        }
        return n;
    }

    /**
     * Rebuild {@code e} top-down. Subterms for which {@code fn} answers {@code null} are descended into; unchanged
     * subterms are shared with the input.
     * @param e the term
     * @param fn the replacement function
     * @return the rewritten term
     */
    @Nonnull
    public static Expr replace(@Nonnull Expr e, @Nonnull ReplaceFunction fn) {
        return new Replacer(fn).visit(e, 0);
    }

    private static final class Replacer {
        @Nonnull
        private final ReplaceFunction fn;
        @Nonnull
        private final Map<Integer, Map<Expr, Expr>> cache = new HashMap<>();

        Replacer(@Nonnull ReplaceFunction fn) {
            this.fn = fn;
        }

        @Nonnull
        private Map<Expr, Expr> visited(int offset) {
            return cache.computeIfAbsent(offset, k -> new IdentityHashMap<>());
        }

        /**
         * Walk with an explicit stack so that deep spines and binder chains do not exhaust the call stack. Nodes are
         * offered to {@code fn} in pre-order and children are rebuilt left to right.
         */
        @Nonnull
        Expr visit(@Nonnull Expr root, int rootOffset) {
            final Deque<Frame> stack = new ArrayDeque<>();
            final Expr immediate = enter(root, rootOffset, stack);
            if (immediate != null) {
                return immediate;
            }
            while (true) {
                final Frame top = stack.peek();
                if (top.isDone()) {
                    stack.pop();
                    final Expr built = top.build();
                    visited(top.offset).put(top.expr, built);
                    if (stack.isEmpty()) {
                        return built;
                    }
                    stack.peek().results.add(built);
                } else {
                    final Expr child = enter(top.nextChild(), top.nextOffset(), stack);
                    if (child != null) {
                        top.results.add(child);
                    }
                }
            }
        }

        /**
         * Resolve {@code e} at once if it is cached, replaced, or a leaf; otherwise push a frame for it.
         * @return the result, or {@code null} when a frame was pushed
         */
        @Nullable
        private Expr enter(@Nonnull Expr e, int offset, @Nonnull Deque<Frame> stack) {
            final Map<Expr, Expr> visited = visited(offset);
            final Expr cached = visited.get(e);
            if (cached != null) {
                return cached;
            }
            final Expr replaced = fn.apply(e, offset);
            if (replaced != null) {
                visited.put(e, replaced);
                return replaced;
            }
            final Frame frame = new Frame(e, offset);
            if (frame.isDone()) {
                visited.put(e, e);
                return e;
            }
            stack.push(frame);
            return null;
        }
    }

    private static final class Frame {
        @Nonnull
        private final Expr expr;
        private final int offset;
        @Nonnull
        private final List<Expr> children;
        @Nonnull
        private final List<Expr> results;

        Frame(@Nonnull Expr expr, int offset) {
            this.expr = expr;
            this.offset = offset;
            this.children = children(expr);
            this.results = new ArrayList<>(children.size());
        }

        @Nonnull
        private static List<Expr> children(@Nonnull Expr e) {
            switch (e.getKind()) {
                case APP:
                    return ImmutableList.of(((App)e).getFn(), ((App)e).getArg());
                case LAMBDA:
                case PI:
                    return ImmutableList.of(((Binding)e).getDomain(), ((Binding)e).getBody());
                case MACRO:
                    return ((Macro)e).getArgs();
                case META:
                    return ImmutableList.of(((MetaVar)e).getType());
                case LOCAL:
                    return ImmutableList.of(((Local)e).getType());
                default:
                    return ImmutableList.of();
            }
        }

        boolean isDone() {
            return results.size() == children.size();
        }

        @Nonnull
        Expr nextChild() {
            return children.get(results.size());
        }

        int nextOffset() {
            // binder bodies sit under one more binder
            return expr instanceof Binding && results.size() == 1 ? offset + 1 : offset;
        }

        @Nonnull
        Expr build() {
            switch (expr.getKind()) {
                case APP:
                    return ((App)expr).update(results.get(0), results.get(1));
                case LAMBDA:
                case PI:
                    return ((Binding)expr).update(results.get(0), results.get(1));
                case MACRO:
                    return ((Macro)expr).withArgs(results);
                case META: {
                    final MetaVar meta = (MetaVar)expr;
                    final Expr newType = results.get(0);
                    return newType == meta.getType() ? meta : new MetaVar(meta.getId(), meta.getDisplayName(), newType);
                }
                case LOCAL: {
                    final Local local = (Local)expr;
                    final Expr newType = results.get(0);
                    return newType == local.getType()
                           ? local
                           : new Local(local.getId(), local.getPpName(), newType, local.getBinderInfo());
                }
                default:
                    return expr;
            }
        }
    }

    /**
     * Add {@code d} to every loose bound variable of {@code e} whose index is at least {@code start}.
     * @param e the term
     * @param start the first index to lift
     * @param d the amount
     * @return the lifted term
     */
    @Nonnull
    public static Expr liftLooseBVars(@Nonnull Expr e, int start, int d) {
        if (d == 0 || e.getLooseBVarRange() <= start) {
            return e;
        }
        return replace(e, (sub, offset) -> {
            if (sub.getLooseBVarRange() <= start + offset) {
                return sub;
            }
            if (sub instanceof Var) {
                return new Var(((Var)sub).getIndex() + d);
            }
            return null;
        });
    }

    /**
     * Subtract {@code d} from every loose bound variable of {@code e}. Indices below {@code d} must not occur.
     * @param e the term
     * @param d the amount
     * @return the lowered term
     */
    @Nonnull
    public static Expr lowerLooseBVars(@Nonnull Expr e, int d) {
        if (d == 0 || e.getLooseBVarRange() <= d) {
            return e;
        }
        return replace(e, (sub, offset) -> {
            if (sub.getLooseBVarRange() <= d + offset) {
                return sub;
            }
            if (sub instanceof Var) {
                return new Var(((Var)sub).getIndex() - d);
            }
            return null;
        });
    }

    /**
     * Replace the loose bound variable {@code #0} by {@code value} and lower the others by one.
     * @param body the body of a binder
     * @param value the value to put in place of the bound variable
     * @return the instantiated body
     */
    @Nonnull
    public static Expr instantiate(@Nonnull Expr body, @Nonnull Expr value) {
        if (body.isClosed()) {
            return body;
        }
        return replace(body, (sub, offset) -> {
            if (sub.getLooseBVarRange() <= offset) {
                return sub;
            }
            if (sub instanceof Var) {
                final int index = ((Var)sub).getIndex();
                if (index == offset) {
                    return liftLooseBVars(value, 0, offset);
                }
                return new Var(index - 1);
            }
            return null;
        });
    }

    /**
     * Replace every occurrence of the closed term {@code target} in {@code e} by a bound variable pointing to a new
     * outermost binder; the other loose bound variables are lifted by one.
     * @param e the term
     * @param target the term to abstract
     * @return the body of a binder for {@code target}
     */
    @Nonnull
    public static Expr abstractOver(@Nonnull Expr e, @Nonnull Expr target) {
        final Expr lifted = liftLooseBVars(e, 0, 1);
        return replace(lifted, (sub, offset) -> {
            if (sub.equals(target)) {
                return new Var(offset);
            }
            return null;
        });
    }

    /**
     * Whether the bound variable {@code #i} occurs loose in {@code e}.
     * @param e the term
     * @param i the index
     * @return whether it occurs
     */
    public static boolean hasLooseBVar(@Nonnull Expr e, int i) {
        if (e.getLooseBVarRange() <= i) {
            return false;
        }
        switch (e.getKind()) {
            case VAR:
                return ((Var)e).getIndex() == i;
            case APP:
                return hasLooseBVar(((App)e).getFn(), i) || hasLooseBVar(((App)e).getArg(), i);
            case LAMBDA:
            case PI:
                return hasLooseBVar(((Binding)e).getDomain(), i) || hasLooseBVar(((Binding)e).getBody(), i + 1);
            case MACRO:
                for (Expr arg : ((Macro)e).getArgs()) {
                    if (hasLooseBVar(arg, i)) {
                        return true;
                    }
                }
                return false;
            case META:
                return hasLooseBVar(((MetaVar)e).getType(), i);
            case LOCAL:
                return hasLooseBVar(((Local)e).getType(), i);
            default:
                return false;
        }
    }

    /**
     * Whether {@code e} is a non-dependent product.
     * @param e the term
     * @return whether the body does not refer to the bound variable
     */
    public static boolean isArrow(@Nonnull Expr e) {
        return e.isPi() && !hasLooseBVar(((Binding)e).getBody(), 0);
    }

    /**
     * Whether {@code target} occurs in {@code e}.
     * @param target the term to look for
     * @param e the term to search
     * @return whether it occurs
     */
    public static boolean occurs(@Nonnull Expr target, @Nonnull Expr e) {
        final boolean[] found = {false};
        replace(e, (sub, offset) -> {
            if (found[0]) {
                return sub;
            }
            if (sub.equals(target)) {
                found[0] = true;
                return sub;
            }
            return null;
        });
        return found[0];
    }

    /**
     * Beta-reduce {@code e} everywhere.
     * @param e the term
     * @return the beta normal form
     */
    @Nonnull
    public static Expr betaReduce(@Nonnull Expr e) {
        switch (e.getKind()) {
            case APP: {
                final App app = (App)e;
                final Expr fn = betaReduce(app.getFn());
                final Expr arg = betaReduce(app.getArg());
                if (fn.isLambda()) {
                    return betaReduce(instantiate(((Binding)fn).getBody(), arg));
                }
                return app.update(fn, arg);
            }
            case LAMBDA:
            case PI: {
                final Binding binding = (Binding)e;
                return binding.update(betaReduce(binding.getDomain()), betaReduce(binding.getBody()));
            }
            case MACRO: {
                final Macro macro = (Macro)e;
                final List<Expr> newArgs = new ArrayList<>(macro.getNumArgs());
                for (Expr arg : macro.getArgs()) {
                    newArgs.add(betaReduce(arg));
                }
                return macro.withArgs(newArgs);
            }
            default:
                return e;
        }
    }

    /**
     * Reduce the head of {@code e} while it is an applied lambda.
     * @param e the term
     * @return the head beta reduct
     */
    @Nonnull
    public static Expr headBeta(@Nonnull Expr e) {
        Expr current = e;
        while (current instanceof App && getAppFn(current).isLambda()) {
            final List<Expr> args = getAppArgs(current);
            Expr fn = getAppFn(current);
            int i = 0;
            while (fn.isLambda() && i < args.size()) {
                fn = instantiate(((Binding)fn).getBody(), args.get(i));
                i++;
            }
            current = mkApp(fn, args.subList(i, args.size()));
        }
        return current;
    }

    /**
     * The names of the constants and the display names of the local constants occurring in {@code e}.
     * @param e the term
     * @return the set of names
     */
    @Nonnull
    public static Set<Name> collectNames(@Nonnull Expr e) {
        final Set<Name> names = new HashSet<>();
        replace(e, (sub, offset) -> {
            if (sub instanceof Constant) {
                names.add(((Constant)sub).getName());
                return sub;
            }
            if (sub instanceof Local) {
                names.add(((Local)sub).getPpName());
            }
            return null;
        });
        return names;
    }

    /**
     * A name based on {@code suggested} that does not clash with a constant or local constant in {@code e}.
     * @param e the term the name will be used in
     * @param suggested the preferred name
     * @return {@code suggested}, or {@code suggested_i} for the smallest free {@code i}
     */
    @Nonnull
    public static Name pickUnusedName(@Nonnull Expr e, @Nonnull Name suggested) {
        final Set<Name> used = collectNames(e);
        if (!used.contains(suggested)) {
            return suggested;
        }
        int i = 1;
        Name candidate = suggested.appendAfter(i);
        while (used.contains(candidate)) {
            i++;
            candidate = suggested.appendAfter(i);
        }
        return candidate;
    }
}

/*
 * Annotations.java
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
import java.util.Objects;

/**
 * Annotation forms layered over the base term variants. Elaboration wraps parts of a term in these markers so that
 * the printer can show the surface construct ({@code have}, {@code show}, {@code let}, {@code @f}) the user wrote.
 *
 * <ul>
 *     <li>{@code have}: {@code (have (fun (h : T), body)) proof}, the annotation wraps the binder.</li>
 *     <li>{@code show}: {@code show ((fun (this : T), #0) proof)}.</li>
 *     <li>{@code let}: a macro carrying the variable name with arguments {@code [value, body]}; the body is closed,
 *     the value appears in it verbatim (usually wrapped in a {@code let_value} marker).</li>
 *     <li>{@code explicit}: {@code @f}.</li>
 *     <li>{@code typed_expr}: arguments {@code [type, value]}.</li>
 *     <li>placeholder: the reserved constant {@code _}.</li>
 * </ul>
 */
@API(API.Status.EXPERIMENTAL)
public final class Annotations {
    @Nonnull
    public static final MacroDefinition HAVE = new MacroDefinition(Name.of("have"));
    @Nonnull
    public static final MacroDefinition SHOW = new MacroDefinition(Name.of("show"));
    @Nonnull
    public static final MacroDefinition EXPLICIT = new MacroDefinition(Name.of("@"));
    @Nonnull
    public static final MacroDefinition TYPED_EXPR = new MacroDefinition(Name.of("typed_expr"));
    @Nonnull
    public static final MacroDefinition LET_VALUE = new MacroDefinition(Name.of("let_value"));
    @Nonnull
    public static final Name LET = Name.of("let");
    @Nonnull
    public static final Name PLACEHOLDER = Name.of("_");

    private Annotations() {
    }

    /**
     * The definition of a {@code let} macro; it records the name of the bound variable.
     */
    public static final class LetDefinition extends MacroDefinition {
        @Nonnull
        private final Name varName;

        public LetDefinition(@Nonnull Name varName) {
            super(LET);
            this.varName = varName;
        }

        @Nonnull
        public Name getVarName() {
            return varName;
        }

        @Override
        public boolean equals(@Nullable Object o) {
            return super.equals(o) && varName.equals(((LetDefinition)o).varName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), varName);
        }
    }

    @Nonnull
    public static Expr mkAnnotation(@Nonnull MacroDefinition definition, @Nonnull Expr e) {
        return new Macro(definition, ImmutableList.of(e));
    }

    public static boolean isAnnotation(@Nonnull Expr e, @Nonnull MacroDefinition definition) {
        return e instanceof Macro && ((Macro)e).getDefinition().equals(definition) && ((Macro)e).getNumArgs() == 1;
    }

    @Nonnull
    public static Expr getAnnotationArg(@Nonnull Expr e) {
        return ((Macro)e).getArg(0);
    }

    @Nonnull
    public static Expr mkPlaceholder() {
        return new Constant(PLACEHOLDER);
    }

    public static boolean isPlaceholder(@Nonnull Expr e) {
        return e instanceof Constant && ((Constant)e).getName().equals(PLACEHOLDER);
    }

    @Nonnull
    public static Expr mkExplicit(@Nonnull Expr e) {
        return mkAnnotation(EXPLICIT, e);
    }

    public static boolean isExplicit(@Nonnull Expr e) {
        return isAnnotation(e, EXPLICIT);
    }

    @Nonnull
    public static Expr getExplicitArg(@Nonnull Expr e) {
        return getAnnotationArg(e);
    }

    /**
     * Build {@code have name : type, from proof, body}.
     * @param name the hypothesis name
     * @param type its type
     * @param body the rest, referring to the hypothesis as {@code #0}
     * @param proof the proof of {@code type}
     * @param visible whether the hypothesis is marked {@code [visible]}
     * @return the annotated term
     */
    @Nonnull
    public static Expr mkHave(@Nonnull Name name, @Nonnull Expr type, @Nonnull Expr body, @Nonnull Expr proof,
                              boolean visible) {
        final Binding binding = new Binding(ExprKind.LAMBDA, name, type, body,
                BinderInfo.DEFAULT.withContextual(visible));
        return new App(mkAnnotation(HAVE, binding), proof);
    }

    public static boolean isHaveAnnotation(@Nonnull Expr e) {
        return isAnnotation(e, HAVE);
    }

    /**
     * Whether {@code e} is a {@code have} application whose annotation wraps a lambda.
     * @param e the term
     * @return whether it prints as a {@code have}
     */
    public static boolean isHave(@Nonnull Expr e) {
        return e instanceof App && isHaveAnnotation(((App)e).getFn())
                && getAnnotationArg(((App)e).getFn()).isLambda();
    }

    @Nonnull
    public static Expr mkShow(@Nonnull Expr type, @Nonnull Expr proof) {
        final Binding identity = new Binding(ExprKind.LAMBDA, Name.of("this"), type, new Var(0), BinderInfo.DEFAULT);
        return mkAnnotation(SHOW, new App(identity, proof));
    }

    public static boolean isShowAnnotation(@Nonnull Expr e) {
        return isAnnotation(e, SHOW);
    }

    /**
     * Whether {@code e} is a {@code show} annotation around an applied lambda.
     * @param e the term
     * @return whether it prints as a {@code show}
     */
    public static boolean isShow(@Nonnull Expr e) {
        if (!isShowAnnotation(e)) {
            return false;
        }
        final Expr arg = getAnnotationArg(e);
        return arg instanceof App && ((App)arg).getFn().isLambda();
    }

    @Nonnull
    public static Expr mkTypedExpr(@Nonnull Expr type, @Nonnull Expr value) {
        return new Macro(TYPED_EXPR, ImmutableList.of(type, value));
    }

    public static boolean isTypedExpr(@Nonnull Expr e) {
        return e instanceof Macro && ((Macro)e).getDefinition().equals(TYPED_EXPR) && ((Macro)e).getNumArgs() == 2;
    }

    @Nonnull
    public static Expr getTypedExprType(@Nonnull Expr e) {
        return ((Macro)e).getArg(0);
    }

    @Nonnull
    public static Expr getTypedExprExpr(@Nonnull Expr e) {
        return ((Macro)e).getArg(1);
    }

    @Nonnull
    public static Expr mkLetValue(@Nonnull Expr value) {
        return mkAnnotation(LET_VALUE, value);
    }

    public static boolean isLetValue(@Nonnull Expr e) {
        return isAnnotation(e, LET_VALUE);
    }

    @Nonnull
    public static Expr getLetValueExpr(@Nonnull Expr e) {
        return getAnnotationArg(e);
    }

    /**
     * Build {@code let name := value in body}.
     * @param name the variable name
     * @param value the bound value
     * @param body the closed body, containing {@code value} wherever the variable was used
     * @return the let term
     */
    @Nonnull
    public static Expr mkLet(@Nonnull Name name, @Nonnull Expr value, @Nonnull Expr body) {
        return new Macro(new LetDefinition(name), ImmutableList.of(value, body));
    }

    public static boolean isLet(@Nonnull Expr e) {
        return e instanceof Macro && ((Macro)e).getDefinition() instanceof LetDefinition
                && ((Macro)e).getNumArgs() == 2;
    }

    @Nonnull
    public static Name getLetVarName(@Nonnull Expr e) {
        return ((LetDefinition)((Macro)e).getDefinition()).getVarName();
    }

    @Nonnull
    public static Expr getLetValue(@Nonnull Expr e) {
        return ((Macro)e).getArg(0);
    }

    @Nonnull
    public static Expr getLetBody(@Nonnull Expr e) {
        return ((Macro)e).getArg(1);
    }
}

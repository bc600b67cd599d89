/*
 * RenderRules.java
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

import dev.termprint.term.Annotations;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Numerals;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * The dispatch order of the printer. Notations win over everything; annotation forms come before numerals, which
 * come before the metavariable collapse and finally the plain term variants.
 */
final class RenderRules {
    @Nonnull
    static final List<RenderRule> DEFAULT = ImmutableList.of(
            new NotationRule(),
            RenderRule.of("placeholder",
                    (r, e) -> Annotations.isPlaceholder(e),
                    (r, e) -> RenderResult.of(r.getGlyphs().placeholder())),
            RenderRule.of("show",
                    (r, e) -> Annotations.isShow(e),
                    (r, e) -> r.getHaveShowRenderer().renderShow(e)),
            RenderRule.of("have",
                    (r, e) -> Annotations.isHave(e),
                    (r, e) -> r.getHaveShowRenderer().renderHave(e)),
            RenderRule.of("let",
                    (r, e) -> Annotations.isLet(e),
                    (r, e) -> r.getLetRenderer().render(e)),
            RenderRule.of("typed_expr",
                    (r, e) -> Annotations.isTypedExpr(e),
                    (r, e) -> r.render(Annotations.getTypedExprExpr(e))),
            RenderRule.of("let_value",
                    (r, e) -> Annotations.isLetValue(e),
                    (r, e) -> r.render(Annotations.getLetValueExpr(e))),
            RenderRule.of("numeral",
                    (r, e) -> Numerals.isNumeral(e),
                    (r, e) -> r.getAtomRenderer().renderNumeral(e)),
            RenderRule.of("metavar_app",
                    (r, e) -> !r.getConfiguration().isMetavarArgs() && Exprs.getAppFn(e).isMetavar(),
                    (r, e) -> r.getAtomRenderer().renderMeta(Exprs.getAppFn(e))),
            RenderRule.of("base", (r, e) -> true, RenderRules::renderBase));

    private RenderRules() {
    }

    @Nonnull
    private static RenderResult renderBase(@Nonnull TermRenderer renderer, @Nonnull Expr e) {
        switch (e.getKind()) {
            case VAR:
                return renderer.getAtomRenderer().renderVar(e);
            case SORT:
                return renderer.getAtomRenderer().renderSort(e);
            case CONSTANT:
                return renderer.getAtomRenderer().renderConstant(e);
            case META:
                return renderer.getAtomRenderer().renderMeta(e);
            case LOCAL:
                return renderer.getAtomRenderer().renderLocal(e);
            case APP:
                return renderer.getApplicationRenderer().renderApp(e);
            case LAMBDA:
                return renderer.getBinderRenderer().renderLambda(e);
            case PI:
                return renderer.getBinderRenderer().renderPi(e);
            default:
                return renderer.getAtomRenderer().renderMacro(e);
        }
    }

    private static final class NotationRule implements RenderRule {
        @Nonnull
        @Override
        public String getName() {
            return "notation";
        }

        @Nonnull
        @Override
        public Optional<RenderResult> apply(@Nonnull TermRenderer renderer, @Nonnull Expr e) {
            return renderer.getNotationRenderer().tryRender(e);
        }
    }
}

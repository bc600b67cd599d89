/*
 * BinderRenderer.java
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

import dev.termprint.format.Format;
import dev.termprint.term.BinderInfo;
import dev.termprint.term.Binding;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Local;
import dev.termprint.term.Name;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders lambdas, dependent products and arrows. Nested binders are collected into one binder list; consecutive
 * binders with the same type and binder info share a bracketed block.
 */
final class BinderRenderer {
    private static final Name DEFAULT_BINDER_NAME = Name.of("a");

    @Nonnull
    private final TermRenderer renderer;

    BinderRenderer(@Nonnull TermRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * A local constant standing for the variable bound by {@code binding}, named so that it clashes neither with a
     * name already chosen in this call nor with a name occurring in the body.
     * @param binding a lambda or product
     * @return the local
     */
    @Nonnull
    Local freshLocal(@Nonnull Binding binding) {
        final Name suggested = binding.getName().isAnonymous() ? DEFAULT_BINDER_NAME : binding.getName();
        final RenderContext context = renderer.getContext();
        final Name name = context.getFreshBinderName(suggested, Exprs.collectNames(binding.getBody()));
        return new Local(context.newLocalId(), name, binding.getDomain(), binding.getBinderInfo());
    }

    @Nonnull
    RenderResult renderLambda(@Nonnull Expr e) {
        final List<Local> locals = new ArrayList<>();
        Expr body = e;
        while (body.isLambda()) {
            final Local local = freshLocal((Binding)body);
            locals.add(local);
            body = Exprs.instantiate(((Binding)body).getBody(), local);
        }
        return RenderResult.of(0, binderForm(renderer.getGlyphs().lambda(), locals, body));
    }

    /**
     * Whether {@code e} prints as a plain arrow: a non-dependent product whose binder info is the default one.
     * @param e a term
     * @return whether it is a default arrow
     */
    static boolean isDefaultArrow(@Nonnull Expr e) {
        return Exprs.isArrow(e) && ((Binding)e).getBinderInfo().equals(BinderInfo.DEFAULT);
    }

    @Nonnull
    RenderResult renderPi(@Nonnull Expr e) {
        if (isDefaultArrow(e)) {
            final Binding pi = (Binding)e;
            final RenderResult lhs = renderer.renderChild(pi.getDomain(), RenderResult.ARROW_PRECEDENCE);
            final RenderResult rhs = renderer.renderChild(Exprs.lowerLooseBVars(pi.getBody(), 1),
                    RenderResult.ARROW_PRECEDENCE - 1);
            final Format format = Format.group(Format.compose(lhs.getFormat(), Format.space(),
                    renderer.getGlyphs().arrow(), Format.line(), rhs.getFormat()));
            return RenderResult.of(RenderResult.ARROW_PRECEDENCE - 1, format);
        }
        final List<Local> locals = new ArrayList<>();
        Expr body = e;
        while (body.isPi() && !isDefaultArrow(body)) {
            final Local local = freshLocal((Binding)body);
            locals.add(local);
            body = Exprs.instantiate(((Binding)body).getBody(), local);
        }
        final Format keyword = renderer.getClassifier().isProp(body)
                               ? renderer.getGlyphs().forall()
                               : renderer.getGlyphs().pi();
        return RenderResult.of(0, binderForm(keyword, locals, body));
    }

    @Nonnull
    private Format binderForm(@Nonnull Format keyword, @Nonnull List<Local> locals, @Nonnull Expr body) {
        return Format.compose(keyword, renderBinders(locals), Format.comma(),
                Format.nest(renderer.getIndent(),
                        Format.compose(Format.line(), renderer.renderChildFormat(body, 0))));
    }

    /**
     * Group consecutive locals with equal type and binder info into blocks, each preceded by a line.
     * @param locals the bound locals, outermost first
     * @return the binder list
     */
    @Nonnull
    Format renderBinders(@Nonnull List<Local> locals) {
        final List<Format> blocks = new ArrayList<>();
        final List<Name> names = new ArrayList<>();
        Local first = locals.get(0);
        names.add(first.getPpName());
        for (int i = 1; i < locals.size(); i++) {
            final Local local = locals.get(i);
            if (local.getType().equals(first.getType()) && local.getBinderInfo().equals(first.getBinderInfo())) {
                names.add(local.getPpName());
            } else {
                blocks.add(Format.group(Format.compose(Format.line(),
                        renderBinderBlock(names, first.getType(), first.getBinderInfo()))));
                names.clear();
                first = local;
                names.add(local.getPpName());
            }
        }
        blocks.add(Format.group(Format.compose(Format.line(),
                renderBinderBlock(names, first.getType(), first.getBinderInfo()))));
        return Format.compose(blocks);
    }

    @Nonnull
    Format renderBinderBlock(@Nonnull List<Name> names, @Nonnull Expr type, @Nonnull BinderInfo binderInfo) {
        final String open;
        final String close;
        if (binderInfo.isImplicit()) {
            open = "{";
            close = "}";
        } else if (binderInfo.isInstImplicit()) {
            open = "[";
            close = "]";
        } else if (binderInfo.isStrictImplicit()) {
            open = renderer.getGlyphs().strictImplicitOpen();
            close = renderer.getGlyphs().strictImplicitClose();
        } else {
            open = "(";
            close = ")";
        }
        final List<Format> parts = new ArrayList<>();
        parts.add(Format.text(open));
        for (Name name : names) {
            parts.add(Format.text(name.toString()));
            parts.add(Format.space());
        }
        parts.add(Format.colon());
        parts.add(Format.nest(renderer.getIndent(),
                Format.compose(Format.line(), renderer.renderChildFormat(type, 0))));
        parts.add(Format.text(close));
        return Format.group(Format.compose(parts));
    }
}

/*
 * LetRenderer.java
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
import dev.termprint.term.Annotations;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Name;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@code let} chains. A let body is stored closed with the value written out wherever the variable was
 * used; the variable is recovered by abstracting the value back out of the body.
 */
final class LetRenderer {
    @Nonnull
    private final TermRenderer renderer;

    LetRenderer(@Nonnull TermRenderer renderer) {
        this.renderer = renderer;
    }

    private static final class Declaration {
        @Nonnull
        private final Name name;
        @Nonnull
        private final Expr value;

        Declaration(@Nonnull Name name, @Nonnull Expr value) {
            this.name = name;
            this.value = value;
        }
    }

    /**
     * Peel lets while their value occurs in the remaining body. The first let whose value does not reoccur ends
     * the chain and its body, which may itself be a let, becomes the final body.
     * @param e a let term
     * @return the rendered chain at binding power {@code 0}
     */
    @Nonnull
    RenderResult render(@Nonnull Expr e) {
        final List<Declaration> declarations = new ArrayList<>();
        Expr current = e;
        while (Annotations.isLet(current)) {
            final Expr value = Annotations.getLetValue(current);
            final Expr body = Annotations.getLetBody(current);
            final Expr abstracted = Exprs.abstractOver(body, value);
            if (abstracted.isClosed()) {
                current = body;
                break;
            }
            final Name name = Exprs.pickUnusedName(abstracted, Annotations.getLetVarName(current));
            declarations.add(new Declaration(name, value));
            current = Exprs.instantiate(abstracted, new Constant(name));
        }
        if (declarations.isEmpty()) {
            return renderer.render(current);
        }
        final Glyphs glyphs = renderer.getGlyphs();
        final int indent = renderer.getIndent();
        final List<Format> parts = new ArrayList<>();
        parts.add(glyphs.let());
        for (int i = 0; i < declarations.size(); i++) {
            final Declaration declaration = declarations.get(i);
            final Format begin = i == 0 ? Format.space() : Format.line();
            final Format separator = i < declarations.size() - 1 ? Format.comma() : Format.nil();
            final Format entry = Format.compose(Format.text(declaration.name.toString()), Format.space(),
                    glyphs.assign(), Format.nest(indent, Format.compose(Format.line(),
                            renderer.renderChildFormat(declaration.value, 0), separator)));
            parts.add(Format.nest(4, Format.compose(begin, Format.group(entry))));
        }
        parts.add(Format.line());
        parts.add(glyphs.in());
        parts.add(Format.space());
        parts.add(Format.nest(3, renderer.renderChildFormat(current, 0)));
        return RenderResult.of(0, Format.compose(parts));
    }
}

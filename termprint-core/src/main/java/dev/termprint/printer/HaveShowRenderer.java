/*
 * HaveShowRenderer.java
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
import dev.termprint.term.App;
import dev.termprint.term.Binding;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Local;
import com.google.common.base.Verify;

import javax.annotation.Nonnull;

/**
 * Renders {@code have name : type, from proof, body} and {@code show type, from proof}.
 */
final class HaveShowRenderer {
    private static final int SHOW_TYPE_INDENT = 5;

    @Nonnull
    private final TermRenderer renderer;

    HaveShowRenderer(@Nonnull TermRenderer renderer) {
        this.renderer = renderer;
    }

    @Nonnull
    RenderResult renderHave(@Nonnull Expr e) {
        Verify.verify(Annotations.isHave(e), "not a have term: %s", e);
        final App app = (App)e;
        final Expr proof = app.getArg();
        final Binding binding = (Binding)Annotations.getAnnotationArg(app.getFn());
        final Local local = renderer.getBinderRenderer().freshLocal(binding);
        final Expr body = Exprs.instantiate(binding.getBody(), local);
        final Format typeFormat = renderer.renderChildFormat(local.getType(), 0);
        final Format proofFormat = renderer.renderChildFormat(proof, 0);
        final Format bodyFormat = renderer.renderChildFormat(body, 0);
        final Glyphs glyphs = renderer.getGlyphs();
        final int indent = renderer.getIndent();

        Format format = Format.compose(glyphs.have(), Format.space(), Format.text(local.getPpName().toString()),
                Format.space());
        if (binding.getBinderInfo().isContextual()) {
            format = Format.compose(format, glyphs.visible(), Format.space());
        }
        format = Format.group(Format.compose(format, Format.colon(), Format.nest(indent,
                Format.compose(Format.line(), typeFormat, Format.comma(), Format.space(), glyphs.from()))));
        format = Format.group(Format.compose(format,
                Format.nest(indent, Format.compose(Format.line(), proofFormat, Format.comma()))));
        return RenderResult.of(0, Format.compose(format, Format.line(), bodyFormat));
    }

    @Nonnull
    RenderResult renderShow(@Nonnull Expr e) {
        Verify.verify(Annotations.isShow(e), "not a show term: %s", e);
        final App shown = (App)Annotations.getAnnotationArg(e);
        final Expr proof = shown.getArg();
        final Expr type = ((Binding)shown.getFn()).getDomain();
        final Format typeFormat = renderer.renderChildFormat(type, 0);
        final Format proofFormat = renderer.renderChildFormat(proof, 0);
        final Glyphs glyphs = renderer.getGlyphs();
        Format format = Format.group(Format.compose(glyphs.show(), Format.space(),
                Format.nest(SHOW_TYPE_INDENT, typeFormat), Format.comma(), Format.space(), glyphs.from()));
        format = Format.compose(format,
                Format.nest(renderer.getIndent(), Format.compose(Format.line(), proofFormat)));
        return RenderResult.of(0, Format.group(format));
    }
}

/*
 * ApplicationRenderer.java
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

import dev.termprint.env.CoercionInfo;
import dev.termprint.format.Format;
import dev.termprint.term.App;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import com.google.common.base.Verify;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * Renders applications {@code f a} and applications of hidden coercions.
 */
final class ApplicationRenderer {
    @Nonnull
    private final TermRenderer renderer;

    ApplicationRenderer(@Nonnull TermRenderer renderer) {
        this.renderer = renderer;
    }

    /**
     * {@code f a} at {@link RenderResult#APP_BP}. When implicit arguments are shown and the head takes some, the head
     * gets an {@code @} so that re-reading the output does not insert them again.
     * @param e the application
     * @return the rendered application
     */
    @Nonnull
    RenderResult renderApp(@Nonnull Expr e) {
        final App app = (App)e;
        final Expr fn = app.getFn();
        Format fnFormat = renderer.renderChildFormat(fn, RenderResult.APP_BP);
        if (renderer.getConfiguration().isShowImplicit() && !fn.isApp()
                && renderer.getClassifier().hasImplicitArgs(fn)) {
            fnFormat = Format.compose(renderer.getGlyphs().explicit(), fnFormat);
        }
        final Format argFormat = renderer.renderChildFormat(app.getArg(), RenderResult.MAX_BP);
        return RenderResult.of(RenderResult.APP_BP, spine(fnFormat, argFormat));
    }

    @Nonnull
    private Format spine(@Nonnull Format fnFormat, @Nonnull Format argFormat) {
        return Format.group(Format.compose(fnFormat,
                Format.nest(renderer.getIndent(), Format.compose(Format.line(), argFormat))));
    }

    /**
     * Render the application of a coercion without the coercion. With exactly one argument past the coercion's own
     * arguments only that argument is printed; with more, the coerced value is printed applied to the rest.
     * @param e an application whose head is a coercion
     * @param bp the binding power the context requires
     * @return the rendered term
     */
    @Nonnull
    RenderResult renderCoercion(@Nonnull Expr e, int bp) {
        final List<Expr> args = Exprs.getAppArgs(e);
        final CoercionInfo coercion = renderer.getClassifier().getCoercion(e).orElseThrow();
        final int cutoff = coercion.getNumArgs();
        if (cutoff >= args.size()) {
            return renderer.renderChildCore(e, bp);
        }
        if (cutoff == args.size() - 1) {
            return renderer.renderChild(args.get(args.size() - 1), bp);
        }
        final int size = args.size() - cutoff;
        Verify.verify(size >= 2, "coercion application must have at least two extra arguments");
        final RenderResult result = renderCoercionFn(e, size);
        return result.getRbp() < bp ? result.parenthesize() : result;
    }

    @Nonnull
    private RenderResult renderCoercionFn(@Nonnull Expr e, int size) {
        final App app = (App)e;
        if (size == 1) {
            return renderer.renderChild(app.getArg(), RenderResult.APP_BP);
        }
        if (renderer.getClassifier().isImplicit(app.getFn())) {
            return renderCoercionFn(app.getFn(), size - 1);
        }
        final Expr fn = app.getFn();
        Format fnFormat = renderCoercionFn(fn, size - 1).getFormat();
        if (renderer.getConfiguration().isShowImplicit() && size == 2
                && renderer.getClassifier().hasImplicitArgs(fn)) {
            fnFormat = Format.compose(renderer.getGlyphs().explicit(), fnFormat);
        }
        final Format argFormat = renderer.renderChildFormat(app.getArg(), RenderResult.MAX_BP);
        return RenderResult.of(RenderResult.APP_BP, spine(fnFormat, argFormat));
    }
}

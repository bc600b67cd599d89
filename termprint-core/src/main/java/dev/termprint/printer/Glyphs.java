/*
 * Glyphs.java
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

import dev.termprint.annotation.API;
import dev.termprint.format.Format;

import javax.annotation.Nonnull;

/**
 * The keyword and symbol fragments the printer emits. There are two immutable tables, one for Unicode output and one
 * restricted to ASCII; they are built once and shared by every printer.
 */
@API(API.Status.INTERNAL)
public final class Glyphs {
    public static final Glyphs UNICODE = new Glyphs("λ", "Π", "∀", "→", "…",
            "⦃", "⦄");
    public static final Glyphs ASCII = new Glyphs("fun", "Pi", "forall", "->", "...", "{{", "}}");

    private static final Format LET = Format.keyword("let");
    private static final Format IN = Format.keyword("in");
    private static final Format ASSIGN = Format.keyword(":=");
    private static final Format HAVE = Format.keyword("have");
    private static final Format FROM = Format.keyword("from");
    private static final Format VISIBLE = Format.keyword("[visible]");
    private static final Format SHOW = Format.keyword("show");
    private static final Format EXPLICIT = Format.keyword("@");
    private static final Format PLACEHOLDER = Format.highlight(Format.text("_"), Format.Style.BUILTIN);

    @Nonnull
    private final Format lambda;
    @Nonnull
    private final Format pi;
    @Nonnull
    private final Format forall;
    @Nonnull
    private final Format arrow;
    @Nonnull
    private final Format ellipsis;
    @Nonnull
    private final String strictImplicitOpen;
    @Nonnull
    private final String strictImplicitClose;

    private Glyphs(@Nonnull String lambda, @Nonnull String pi, @Nonnull String forall, @Nonnull String arrow,
                   @Nonnull String ellipsis, @Nonnull String strictImplicitOpen, @Nonnull String strictImplicitClose) {
        this.lambda = Format.keyword(lambda);
        this.pi = Format.keyword(pi);
        this.forall = Format.keyword(forall);
        this.arrow = Format.keyword(arrow);
        this.ellipsis = Format.highlight(Format.text(ellipsis), Format.Style.BUILTIN);
        this.strictImplicitOpen = strictImplicitOpen;
        this.strictImplicitClose = strictImplicitClose;
    }

    @Nonnull
    public static Glyphs forUnicode(boolean unicode) {
        return unicode ? UNICODE : ASCII;
    }

    @Nonnull
    public Format lambda() {
        return lambda;
    }

    @Nonnull
    public Format pi() {
        return pi;
    }

    @Nonnull
    public Format forall() {
        return forall;
    }

    @Nonnull
    public Format arrow() {
        return arrow;
    }

    @Nonnull
    public Format ellipsis() {
        return ellipsis;
    }

    @Nonnull
    public String strictImplicitOpen() {
        return strictImplicitOpen;
    }

    @Nonnull
    public String strictImplicitClose() {
        return strictImplicitClose;
    }

    @Nonnull
    public Format let() {
        return LET;
    }

    @Nonnull
    public Format in() {
        return IN;
    }

    @Nonnull
    public Format assign() {
        return ASSIGN;
    }

    @Nonnull
    public Format have() {
        return HAVE;
    }

    @Nonnull
    public Format from() {
        return FROM;
    }

    @Nonnull
    public Format visible() {
        return VISIBLE;
    }

    @Nonnull
    public Format show() {
        return SHOW;
    }

    @Nonnull
    public Format explicit() {
        return EXPLICIT;
    }

    @Nonnull
    public Format placeholder() {
        return PLACEHOLDER;
    }
}

/*
 * Format.java
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

package dev.termprint.format;

import dev.termprint.annotation.API;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * An abstract formatting tree. A format says what may be broken and how far continuation lines are indented; it does
 * not decide where lines break. {@link FormatLayout} materializes it for a given page width.
 */
@API(API.Status.EXPERIMENTAL)
public final class Format {
    /**
     * The node kinds of a format tree.
     */
    public enum Kind {
        TEXT,
        /** A space when the enclosing group is flat, a newline plus indentation otherwise. */
        LINE,
        NEST,
        COMPOSE,
        GROUP,
        HIGHLIGHT
    }

    /**
     * Highlighting styles. Plain-text layout ignores them.
     */
    public enum Style {
        KEYWORD,
        BUILTIN,
        PLAIN
    }

    private static final Format NIL = new Format(Kind.COMPOSE, null, 0, ImmutableList.of(), null);
    private static final Format LINE = new Format(Kind.LINE, null, 0, ImmutableList.of(), null);
    private static final Format SPACE = text(" ");
    private static final Format COMMA = text(",");
    private static final Format COLON = text(":");

    @Nonnull
    private final Kind kind;
    @Nullable
    private final String text;
    private final int indent;
    @Nonnull
    private final List<Format> children;
    @Nullable
    private final Style style;

    private Format(@Nonnull Kind kind, @Nullable String text, int indent, @Nonnull List<Format> children,
                   @Nullable Style style) {
        this.kind = kind;
        this.text = text;
        this.indent = indent;
        this.children = children;
        this.style = style;
    }

    @Nonnull
    public static Format nil() {
        return NIL;
    }

    @Nonnull
    public static Format text(@Nonnull String text) {
        return new Format(Kind.TEXT, text, 0, ImmutableList.of(), null);
    }

    @Nonnull
    public static Format line() {
        return LINE;
    }

    @Nonnull
    public static Format space() {
        return SPACE;
    }

    @Nonnull
    public static Format comma() {
        return COMMA;
    }

    @Nonnull
    public static Format colon() {
        return COLON;
    }

    @Nonnull
    public static Format nest(int indent, @Nonnull Format format) {
        return new Format(Kind.NEST, null, indent, ImmutableList.of(format), null);
    }

    @Nonnull
    public static Format compose(@Nonnull Format... formats) {
        return new Format(Kind.COMPOSE, null, 0, ImmutableList.copyOf(formats), null);
    }

    @Nonnull
    public static Format compose(@Nonnull List<Format> formats) {
        return new Format(Kind.COMPOSE, null, 0, ImmutableList.copyOf(formats), null);
    }

    @Nonnull
    public static Format group(@Nonnull Format format) {
        return new Format(Kind.GROUP, null, 0, ImmutableList.of(format), null);
    }

    @Nonnull
    public static Format highlight(@Nonnull Format format, @Nonnull Style style) {
        return new Format(Kind.HIGHLIGHT, null, 0, ImmutableList.of(format), style);
    }

    @Nonnull
    public static Format keyword(@Nonnull String keyword) {
        return highlight(text(keyword), Style.KEYWORD);
    }

    /**
     * {@code group(nest(1, "(" format ")"))}.
     * @param format the content
     * @return the parenthesized content
     */
    @Nonnull
    public static Format paren(@Nonnull Format format) {
        return group(nest(1, compose(text("("), format, text(")"))));
    }

    @Nonnull
    public Format concat(@Nonnull Format other) {
        return compose(this, other);
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public String getText() {
        return Objects.requireNonNull(text);
    }

    public int getIndent() {
        return indent;
    }

    @Nonnull
    public List<Format> getChildren() {
        return children;
    }

    @Nonnull
    public Format getChild() {
        return children.get(0);
    }

    @Nullable
    public Style getStyle() {
        return style;
    }

    /**
     * Render with every line flat.
     * @return the single-line text
     */
    @Nonnull
    public String toFlatString() {
        final StringBuilder sb = new StringBuilder();
        appendFlat(sb);
        return sb.toString();
    }

    private void appendFlat(@Nonnull StringBuilder sb) {
        switch (kind) {
            case TEXT:
                sb.append(text);
                break;
            case LINE:
                sb.append(' ');
                break;
            default:
                for (Format child : children) {
                    child.appendFlat(sb);
                }
                break;
        }
    }

    @Override
    public String toString() {
        return toFlatString();
    }
}

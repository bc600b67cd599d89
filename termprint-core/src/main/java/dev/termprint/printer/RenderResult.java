/*
 * RenderResult.java
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
 * A rendered fragment with the binding powers of its outermost connective. A caller compares them against the
 * binding power its context requires to decide whether the fragment needs parentheses.
 */
@API(API.Status.EXPERIMENTAL)
public final class RenderResult {
    /** The binding power of atoms. */
    public static final int MAX_BP = 1024;
    /** The binding power of applications. */
    public static final int APP_BP = MAX_BP - 1;
    /** The precedence of the arrow; arrows render at one less, which makes them right associative. */
    public static final int ARROW_PRECEDENCE = 25;

    @Nonnull
    private final Format format;
    private final int lbp;
    private final int rbp;

    private RenderResult(@Nonnull Format format, int lbp, int rbp) {
        this.format = format;
        this.lbp = lbp;
        this.rbp = rbp;
    }

    /**
     * An atomic fragment.
     * @param format the fragment
     * @return a result binding at {@link #MAX_BP} on both sides
     */
    @Nonnull
    public static RenderResult of(@Nonnull Format format) {
        return new RenderResult(format, MAX_BP, MAX_BP);
    }

    @Nonnull
    public static RenderResult of(int bp, @Nonnull Format format) {
        return new RenderResult(format, bp, bp);
    }

    @Nonnull
    public static RenderResult of(int lbp, int rbp, @Nonnull Format format) {
        return new RenderResult(format, lbp, rbp);
    }

    @Nonnull
    public Format getFormat() {
        return format;
    }

    public int getLbp() {
        return lbp;
    }

    public int getRbp() {
        return rbp;
    }

    /**
     * This fragment in parentheses, which makes it atomic.
     * @return the parenthesized result
     */
    @Nonnull
    public RenderResult parenthesize() {
        return of(Format.paren(format));
    }

    @Override
    public String toString() {
        return format.toFlatString() + " [" + lbp + ", " + rbp + "]";
    }
}

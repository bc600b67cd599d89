/*
 * PrinterConfiguration.java
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

import javax.annotation.Nonnull;

/**
 * The settings a render call reads, resolved once from a {@link PrinterOptions} snapshot.
 */
@API(API.Status.INTERNAL)
public final class PrinterConfiguration {
    private final int indent;
    private final int maxDepth;
    private final int maxSteps;
    private final boolean showImplicit;
    private final boolean unicode;
    private final boolean showCoercions;
    private final boolean useNotation;
    private final boolean showUniverses;
    private final boolean fullNames;
    private final boolean privateNames;
    private final boolean metavarArgs;
    private final boolean beta;
    @Nonnull
    private final Glyphs glyphs;

    private PrinterConfiguration(@Nonnull PrinterOptions options) {
        this.indent = options.getInt(PrinterOptions.Name.INDENT);
        this.maxDepth = options.getInt(PrinterOptions.Name.MAX_DEPTH);
        this.maxSteps = options.getInt(PrinterOptions.Name.MAX_STEPS);
        this.showImplicit = options.getBoolean(PrinterOptions.Name.IMPLICIT);
        this.unicode = options.getBoolean(PrinterOptions.Name.UNICODE);
        this.showCoercions = options.getBoolean(PrinterOptions.Name.COERCIONS);
        this.useNotation = options.getBoolean(PrinterOptions.Name.NOTATION);
        this.showUniverses = options.getBoolean(PrinterOptions.Name.UNIVERSES);
        this.fullNames = options.getBoolean(PrinterOptions.Name.FULL_NAMES);
        this.privateNames = options.getBoolean(PrinterOptions.Name.PRIVATE_NAMES);
        this.metavarArgs = options.getBoolean(PrinterOptions.Name.METAVAR_ARGS);
        this.beta = options.getBoolean(PrinterOptions.Name.BETA);
        this.glyphs = Glyphs.forUnicode(unicode);
    }

    @Nonnull
    public static PrinterConfiguration of(@Nonnull PrinterOptions options) {
        return new PrinterConfiguration(options);
    }

    public int getIndent() {
        return indent;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getMaxSteps() {
        return maxSteps;
    }

    public boolean isShowImplicit() {
        return showImplicit;
    }

    public boolean isUnicode() {
        return unicode;
    }

    public boolean isShowCoercions() {
        return showCoercions;
    }

    public boolean isUseNotation() {
        return useNotation;
    }

    public boolean isShowUniverses() {
        return showUniverses;
    }

    public boolean isFullNames() {
        return fullNames;
    }

    public boolean isPrivateNames() {
        return privateNames;
    }

    public boolean isMetavarArgs() {
        return metavarArgs;
    }

    public boolean isBeta() {
        return beta;
    }

    @Nonnull
    public Glyphs getGlyphs() {
        return glyphs;
    }
}

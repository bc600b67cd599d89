/*
 * PrettyPrinter.java
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
import dev.termprint.env.Environment;
import dev.termprint.env.SimpleTypeChecker;
import dev.termprint.env.TypeChecker;
import dev.termprint.format.Format;
import dev.termprint.format.FormatLayout;
import dev.termprint.logging.KeyValueLogMessage;
import dev.termprint.logging.LogMessageKeys;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Turns terms back into concrete syntax.
 *
 * <p>
 * Each call to {@link #format(Expr)} runs with a fresh {@link RenderContext}: the term is optionally beta reduced,
 * its metavariables and local constants get unique display names, and it is rendered top-down by an ordered list of
 * rules (user notations first, then the annotation forms, numerals, and finally the plain term variants). Rendering
 * is bounded by the {@code pp.max_depth} and {@code pp.max_steps} options; subterms beyond either limit print as an
 * ellipsis.
 * </p>
 *
 * <p>
 * A printer is not thread safe: concurrent callers should each use their own instance. Instances may share the same
 * environment and options, but not a {@link SimpleTypeChecker}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class PrettyPrinter {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(PrettyPrinter.class);

    /** Default page width used by {@link #toString(Expr)}. */
    public static final int DEFAULT_WIDTH = 120;

    @Nonnull
    private final Environment environment;
    @Nonnull
    private final TypeChecker typeChecker;
    @Nonnull
    private PrinterOptions options;
    @Nonnull
    private PrinterConfiguration configuration;

    public PrettyPrinter(@Nonnull Environment environment, @Nonnull TypeChecker typeChecker,
                         @Nonnull PrinterOptions options) {
        this.environment = environment;
        this.typeChecker = typeChecker;
        this.options = options;
        this.configuration = PrinterConfiguration.of(options);
    }

    public PrettyPrinter(@Nonnull Environment environment, @Nonnull PrinterOptions options) {
        this(environment, new SimpleTypeChecker(environment), options);
    }

    public PrettyPrinter(@Nonnull Environment environment) {
        this(environment, PrinterOptions.defaults());
    }

    @Nonnull
    public PrinterOptions getOptions() {
        return options;
    }

    @Nonnull
    public PrinterConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Switch to a new option set. The resolved configuration is rebuilt only if {@code newOptions} is not the very
     * object applied last.
     * @param newOptions the options
     */
    public void setOptions(@Nonnull PrinterOptions newOptions) {
        if (newOptions == options) {
            return;
        }
        options = newOptions;
        configuration = PrinterConfiguration.of(newOptions);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("printer options changed",
                    LogMessageKeys.OPTION, newOptions));
        }
    }

    /**
     * Render a term.
     * @param e the term
     * @return its format tree
     */
    @Nonnull
    public Format format(@Nonnull Expr e) {
        final RenderContext context = new RenderContext();
        final Expr reduced = configuration.isBeta() ? Exprs.betaReduce(e) : e;
        final Expr purified = new NamePurifier(context, configuration.isShowUniverses()).purify(reduced);
        final TermRenderer renderer = new TermRenderer(environment, typeChecker, configuration, context,
                RenderRules.DEFAULT);
        final Format result = renderer.renderChild(purified, 0).getFormat();
        if (context.getTruncations() > 0 && LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("term rendered with elisions",
                    LogMessageKeys.STEPS, context.getSteps(),
                    LogMessageKeys.DEPTH, context.getMaxDepthSeen(),
                    LogMessageKeys.VALUE, context.getTruncations()));
        }
        return result;
    }

    /**
     * Render a term and lay it out.
     * @param e the term
     * @param width the page width
     * @return the text
     */
    @Nonnull
    public String toString(@Nonnull Expr e, int width) {
        return FormatLayout.render(format(e), width);
    }

    @Nonnull
    public String toString(@Nonnull Expr e) {
        return toString(e, DEFAULT_WIDTH);
    }
}

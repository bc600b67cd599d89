/*
 * TermRenderer.java
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

import dev.termprint.env.Environment;
import dev.termprint.env.TypeChecker;
import dev.termprint.format.Format;
import dev.termprint.logging.KeyValueLogMessage;
import dev.termprint.logging.LogMessageKeys;
import dev.termprint.term.App;
import dev.termprint.term.Expr;
import com.google.common.base.VerifyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Optional;

/**
 * The recursive dispatcher of one print call. It owns the call's {@link RenderContext} and the per-construct
 * renderers, bounds recursion by depth and steps, and decides where children need parentheses.
 */
final class TermRenderer {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(TermRenderer.class);

    @Nonnull
    private final Environment environment;
    @Nonnull
    private final PrinterConfiguration configuration;
    @Nonnull
    private final RenderContext context;
    @Nonnull
    private final List<RenderRule> rules;
    @Nonnull
    private final TermClassifier classifier;
    @Nonnull
    private final AtomRenderer atomRenderer;
    @Nonnull
    private final ApplicationRenderer applicationRenderer;
    @Nonnull
    private final BinderRenderer binderRenderer;
    @Nonnull
    private final LetRenderer letRenderer;
    @Nonnull
    private final HaveShowRenderer haveShowRenderer;
    @Nonnull
    private final NotationRenderer notationRenderer;

    TermRenderer(@Nonnull Environment environment, @Nonnull TypeChecker typeChecker,
                 @Nonnull PrinterConfiguration configuration, @Nonnull RenderContext context,
                 @Nonnull List<RenderRule> rules) {
        this.environment = environment;
        this.configuration = configuration;
        this.context = context;
        this.rules = rules;
        this.classifier = new TermClassifier(environment, typeChecker, configuration, context);
        this.atomRenderer = new AtomRenderer(this);
        this.applicationRenderer = new ApplicationRenderer(this);
        this.binderRenderer = new BinderRenderer(this);
        this.letRenderer = new LetRenderer(this);
        this.haveShowRenderer = new HaveShowRenderer(this);
        this.notationRenderer = new NotationRenderer(this, typeChecker);
    }

    /**
     * Render a term with the first rule that accepts it, or as an ellipsis once the depth or step limit is exceeded.
     * @param e the term
     * @return the rendered term
     */
    @Nonnull
    RenderResult render(@Nonnull Expr e) {
        if (context.isExhausted(configuration)) {
            context.recordTruncation();
            if (context.getTruncations() == 1 && LOGGER.isDebugEnabled()) {
                LOGGER.debug(KeyValueLogMessage.of("render limit reached",
                        LogMessageKeys.DEPTH, context.getDepth(),
                        LogMessageKeys.MAX_DEPTH, configuration.getMaxDepth(),
                        LogMessageKeys.STEPS, context.getSteps(),
                        LogMessageKeys.MAX_STEPS, configuration.getMaxSteps()));
            }
            return RenderResult.of(getGlyphs().ellipsis());
        }
        context.enter();
        try {
            for (RenderRule rule : rules) {
                final Optional<RenderResult> result = rule.apply(this, e);
                if (result.isPresent()) {
                    return result.get();
                }
            }
            throw new VerifyException("no render rule accepted " + e);
        } finally {
            context.exit();
        }
    }

    /**
     * Render a child at binding power {@code bp}. Applications whose function takes an implicit argument print as
     * the function alone, applications of hidden coercions print without the coercion.
     * @param e the child
     * @param bp the binding power the context requires
     * @return the rendered child, parenthesized if needed
     */
    @Nonnull
    RenderResult renderChild(@Nonnull Expr e, int bp) {
        if (e.isApp() && classifier.isImplicit(((App)e).getFn())) {
            return renderChild(((App)e).getFn(), bp);
        }
        if (classifier.isHiddenCoercion(e)) {
            return applicationRenderer.renderCoercion(e, bp);
        }
        return renderChildCore(e, bp);
    }

    @Nonnull
    RenderResult renderChildCore(@Nonnull Expr e, int bp) {
        final RenderResult result = render(e);
        return result.getRbp() < bp ? result.parenthesize() : result;
    }

    /**
     * Render an argument of a notation. It is parenthesized when it does not bind tighter than the token on its
     * left or the action on its right.
     * @param e the argument
     * @param lbp the precedence of the token before it
     * @param rbp the right binding power of its action
     * @return the rendered argument
     */
    @Nonnull
    RenderResult renderNotationChild(@Nonnull Expr e, int lbp, int rbp) {
        if (e.isApp() && classifier.isImplicit(((App)e).getFn())) {
            return renderNotationChild(((App)e).getFn(), lbp, rbp);
        }
        if (classifier.isHiddenCoercion(e)) {
            return applicationRenderer.renderCoercion(e, rbp);
        }
        final RenderResult result = render(e);
        return result.getRbp() < lbp || result.getLbp() <= rbp ? result.parenthesize() : result;
    }

    @Nonnull
    Format renderChildFormat(@Nonnull Expr e, int bp) {
        return renderChild(e, bp).getFormat();
    }

    @Nonnull
    Environment getEnvironment() {
        return environment;
    }

    @Nonnull
    PrinterConfiguration getConfiguration() {
        return configuration;
    }

    @Nonnull
    RenderContext getContext() {
        return context;
    }

    @Nonnull
    Glyphs getGlyphs() {
        return configuration.getGlyphs();
    }

    int getIndent() {
        return configuration.getIndent();
    }

    @Nonnull
    TermClassifier getClassifier() {
        return classifier;
    }

    @Nonnull
    AtomRenderer getAtomRenderer() {
        return atomRenderer;
    }

    @Nonnull
    ApplicationRenderer getApplicationRenderer() {
        return applicationRenderer;
    }

    @Nonnull
    BinderRenderer getBinderRenderer() {
        return binderRenderer;
    }

    @Nonnull
    LetRenderer getLetRenderer() {
        return letRenderer;
    }

    @Nonnull
    HaveShowRenderer getHaveShowRenderer() {
        return haveShowRenderer;
    }

    @Nonnull
    NotationRenderer getNotationRenderer() {
        return notationRenderer;
    }
}

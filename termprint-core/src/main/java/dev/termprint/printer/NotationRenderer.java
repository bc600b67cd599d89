/*
 * NotationRenderer.java
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

import dev.termprint.env.NotationEntry;
import dev.termprint.env.NotationTransition;
import dev.termprint.env.TokenTable;
import dev.termprint.env.TypeChecker;
import dev.termprint.format.Format;
import dev.termprint.logging.KeyValueLogMessage;
import dev.termprint.logging.LogMessageKeys;
import dev.termprint.term.Expr;
import dev.termprint.term.HeadIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * Renders a term with the first user notation that matches it. A notation either renders completely or not at all;
 * an entry that cannot be rendered is skipped in favor of the next one.
 */
final class NotationRenderer {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(NotationRenderer.class);

    @Nonnull
    private final TermRenderer renderer;
    @Nonnull
    private final NotationMatcher matcher;

    NotationRenderer(@Nonnull TermRenderer renderer, @Nonnull TypeChecker typeChecker) {
        this.renderer = renderer;
        this.matcher = new NotationMatcher(typeChecker, renderer.getConfiguration().isShowUniverses());
    }

    @Nonnull
    Optional<RenderResult> tryRender(@Nonnull Expr e) {
        final PrinterConfiguration configuration = renderer.getConfiguration();
        if (!configuration.isUseNotation() || e.isVar()) {
            return Optional.empty();
        }
        for (NotationEntry entry : renderer.getEnvironment().getNotationEntries(HeadIndex.of(e))) {
            if (!configuration.isUnicode() && !entry.isSafeAscii()) {
                continue;
            }
            final MatchEnvironment args = new MatchEnvironment(entry.getNumParameters());
            if (matcher.match(entry.getPattern(), e, args)) {
                final Optional<RenderResult> result = render(entry, args);
                if (result.isPresent()) {
                    return result;
                }
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug(KeyValueLogMessage.of("notation matched but could not be rendered",
                            LogMessageKeys.NOTATION, entry,
                            LogMessageKeys.TERM, e));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Render a matched entry. Transitions are walked from the last one to the first so that each argument is
     * rendered knowing the precedence of the token that follows it.
     * @param entry the notation
     * @param args the matched parameters
     * @return the rendered term, empty if the entry uses an action that cannot be printed, a skip token has no
     * declared precedence, or a parameter is missing
     */
    @Nonnull
    Optional<RenderResult> render(@Nonnull NotationEntry entry, @Nonnull MatchEnvironment args) {
        if (entry.isNumeral()) {
            return Optional.of(RenderResult.of(Format.text(entry.getNumeral().toString())));
        }
        final List<NotationTransition> transitions = entry.getTransitions();
        if (transitions.isEmpty()) {
            return Optional.empty();
        }
        final TokenTable tokenTable = renderer.getEnvironment().getTokenTable();
        Format format = null;
        int lastRbp = RenderResult.APP_BP;
        int tokenLbp = 0;
        for (int i = transitions.size() - 1; i >= 0; i--) {
            final NotationTransition transition = transitions.get(i);
            final String token = transition.getToken();
            final Optional<Integer> precedence = tokenTable.getPrecedence(token);
            final boolean last = format == null;
            final Format current;
            switch (transition.getAction().getKind()) {
                case SKIP:
                    if (precedence.isEmpty()) {
                        return Optional.empty();
                    }
                    current = Format.text(token);
                    if (last) {
                        lastRbp = precedence.get();
                    }
                    break;
                case EXPR: {
                    @Nullable final Expr arg = args.popLast();
                    if (arg == null) {
                        return Optional.empty();
                    }
                    final int rbp = transition.getAction().getRbp();
                    final RenderResult argResult = renderer.renderNotationChild(arg, tokenLbp, rbp);
                    current = Format.compose(Format.text(token), Format.space(), argResult.getFormat());
                    if (last) {
                        lastRbp = rbp;
                    }
                    break;
                }
                default:
                    return Optional.empty();
            }
            tokenLbp = precedence.orElse(0);
            format = last ? current : Format.compose(current, Format.space(), format);
        }
        final int firstLbp = tokenLbp;
        if (!entry.isNud()) {
            if (args.remaining() != 1) {
                return Optional.empty();
            }
            @Nullable final Expr arg = args.popLast();
            if (arg == null) {
                return Optional.empty();
            }
            final Format argFormat = renderer.renderNotationChild(arg, tokenLbp, 0).getFormat();
            format = Format.compose(argFormat, Format.space(), format);
        }
        return Optional.of(RenderResult.of(firstLbp, lastRbp, format));
    }
}

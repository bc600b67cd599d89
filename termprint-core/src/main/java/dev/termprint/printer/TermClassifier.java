/*
 * TermClassifier.java
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
import dev.termprint.env.Environment;
import dev.termprint.env.TypeCheckFailure;
import dev.termprint.env.TypeCheckResult;
import dev.termprint.env.TypeChecker;
import dev.termprint.logging.KeyValueLogMessage;
import dev.termprint.logging.LogMessageKeys;
import dev.termprint.term.Annotations;
import dev.termprint.term.BinderInfo;
import dev.termprint.term.Binding;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.Local;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Questions the renderers ask about a term that need the type checker or the environment. Every type-checker
 * failure is answered with the conservative default (not implicit, no implicit arguments, not a proposition) and
 * logged at debug level; none escapes.
 */
final class TermClassifier {
    @Nonnull
    private static final Logger LOGGER = LoggerFactory.getLogger(TermClassifier.class);

    @Nonnull
    private final Environment environment;
    @Nonnull
    private final TypeChecker typeChecker;
    @Nonnull
    private final PrinterConfiguration configuration;
    @Nonnull
    private final RenderContext context;

    TermClassifier(@Nonnull Environment environment, @Nonnull TypeChecker typeChecker,
                   @Nonnull PrinterConfiguration configuration, @Nonnull RenderContext context) {
        this.environment = environment;
        this.typeChecker = typeChecker;
        this.configuration = configuration;
        this.context = context;
    }

    private static boolean isImplicitBinder(@Nonnull BinderInfo binderInfo) {
        return binderInfo.isImplicit() || binderInfo.isStrictImplicit() || binderInfo.isInstImplicit();
    }

    /**
     * Whether the first argument {@code f} takes is implicit, so that {@code f a} can be printed as {@code f}.
     * @param f a function
     * @return {@code false} when implicit arguments are shown, when {@code f} is open or {@code @}-marked, or when
     *         its type is unknown
     */
    boolean isImplicit(@Nonnull Expr f) {
        if (configuration.isShowImplicit() || !f.isClosed() || Annotations.isExplicit(Exprs.getAppFn(f))) {
            return false;
        }
        final TypeCheckResult<Binding> pi = typeChecker.infer(f).flatMap(typeChecker::ensurePi);
        if (!pi.isSuccess()) {
            logFailure("isImplicit", f, pi.getFailure());
            return false;
        }
        return isImplicitBinder(pi.getValue().getBinderInfo());
    }

    /**
     * Whether some leading binder of the type of {@code f} is implicit.
     * @param f a function
     * @return {@code false} when {@code f} is open or its type is unknown
     */
    boolean hasImplicitArgs(@Nonnull Expr f) {
        if (!f.isClosed()) {
            return false;
        }
        TypeCheckResult<Expr> type = typeChecker.infer(f).flatMap(typeChecker::whnf);
        while (type.isSuccess() && type.getValue().isPi()) {
            final Binding pi = (Binding)type.getValue();
            if (isImplicitBinder(pi.getBinderInfo())) {
                return true;
            }
            final Local local = new Local(context.newLocalId(), pi.getName(), pi.getDomain(), pi.getBinderInfo());
            type = typeChecker.whnf(Exprs.instantiate(pi.getBody(), local));
        }
        if (!type.isSuccess()) {
            logFailure("hasImplicitArgs", f, type.getFailure());
        }
        return false;
    }

    /**
     * Whether {@code type} is a proposition in an impredicative environment.
     * @param type a type
     * @return {@code false} when it is not, or when the question cannot be answered
     */
    boolean isProp(@Nonnull Expr type) {
        if (!environment.isImpredicative()) {
            return false;
        }
        if (!type.isClosed()) {
            return false;
        }
        final TypeCheckResult<Boolean> result = typeChecker.isProp(type);
        if (!result.isSuccess()) {
            logFailure("isProp", type, result.getFailure());
            return false;
        }
        return result.getValue();
    }

    /**
     * The coercion registration of the head of an application.
     * @param e a term
     * @return the coercion info if the head of {@code e} is a coercion constant
     */
    @Nonnull
    Optional<CoercionInfo> getCoercion(@Nonnull Expr e) {
        final Expr head = Exprs.getAppFn(e);
        if (!(head instanceof Constant)) {
            return Optional.empty();
        }
        return environment.getCoercion(((Constant)head).getName());
    }

    /**
     * Whether {@code e} is an application whose coercion head should be hidden.
     * @param e a term
     * @return {@code true} if coercions are hidden and the head of {@code e} is one
     */
    boolean isHiddenCoercion(@Nonnull Expr e) {
        return e.isApp() && !configuration.isShowCoercions() && getCoercion(e).isPresent();
    }

    private static void logFailure(@Nonnull String query, @Nonnull Expr term, @Nonnull TypeCheckFailure failure) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("type checker query failed",
                    LogMessageKeys.QUERY, query,
                    LogMessageKeys.TERM, term,
                    LogMessageKeys.REASON, failure.getReason(),
                    LogMessageKeys.MESSAGE, failure.getMessage()));
        }
    }
}

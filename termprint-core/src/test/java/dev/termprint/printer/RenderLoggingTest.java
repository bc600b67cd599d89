/*
 * RenderLoggingTest.java
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
import dev.termprint.term.Expr;
import dev.termprint.term.Var;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import static dev.termprint.printer.TestEnvironments.ABS;
import static dev.termprint.printer.TestEnvironments.SUCC;
import static dev.termprint.printer.TestEnvironments.X;
import static dev.termprint.printer.TestEnvironments.ZERO;
import static dev.termprint.printer.TestEnvironments.base;
import static dev.termprint.printer.TestEnvironments.options;
import static dev.termprint.printer.TestEnvironments.printer;
import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkConstant;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

/**
 * Tests for the debug events the renderer emits.
 */
public class RenderLoggingTest {
    @RegisterExtension
    final LogAppenderRule rendererLog = new LogAppenderRule("rendererLog", TermRenderer.class, Level.DEBUG);
    @RegisterExtension
    final LogAppenderRule notationLog = new LogAppenderRule("notationLog", NotationRenderer.class, Level.DEBUG);
    @RegisterExtension
    final LogAppenderRule classifierLog = new LogAppenderRule("classifierLog", TermClassifier.class, Level.DEBUG);

    @Test
    public void truncationIsLoggedOnce() {
        Expr e = ZERO;
        for (int i = 0; i < 100; i++) {
            e = mkApp(SUCC, e);
        }
        printer(base(), options(PrinterOptions.Name.MAX_DEPTH, 3)).toString(e);
        assertThat(rendererLog.getLogMessages(), hasSize(1));
        assertThat(rendererLog.getLogMessages().get(0), startsWith("render limit reached"));
        assertThat(rendererLog.getLogMessages().get(0), containsString("max_depth=\"3\""));
    }

    @Test
    public void nothingLoggedWithinLimits() {
        printer(base()).toString(mkApp(SUCC, ZERO));
        assertThat(rendererLog.getLogEvents(), empty());
    }

    @Test
    public void unrenderableNotationIsLogged() {
        final NotationEntry abs = NotationEntry.nud(mkApp(ABS, new Var(0)),
                NotationTransition.expr("|", 0), NotationTransition.skip("|"));
        printer(base().addNotation(abs)).toString(mkApp(ABS, X));
        assertThat(notationLog.getLogMessages(), hasSize(1));
        assertThat(notationLog.getLogMessages().get(0), startsWith("notation matched but could not be rendered"));
    }

    @Test
    public void typeCheckerFailureIsLogged() {
        // unknown has no declaration, so asking whether its first argument is implicit fails
        printer(base()).toString(mkApp(mkConstant("unknown"), ZERO));
        assertThat(classifierLog.getLogMessages().get(0), containsString("reason=\"UNKNOWN_CONSTANT\""));
    }
}

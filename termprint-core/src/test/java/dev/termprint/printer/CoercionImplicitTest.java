/*
 * CoercionImplicitTest.java
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

import dev.termprint.term.Expr;
import org.junit.jupiter.api.Test;

import static dev.termprint.printer.TestEnvironments.ADD;
import static dev.termprint.printer.TestEnvironments.BOOL_TO_NAT;
import static dev.termprint.printer.TestEnvironments.BX;
import static dev.termprint.printer.TestEnvironments.EQ;
import static dev.termprint.printer.TestEnvironments.G;
import static dev.termprint.printer.TestEnvironments.ID;
import static dev.termprint.printer.TestEnvironments.NAT;
import static dev.termprint.printer.TestEnvironments.PF;
import static dev.termprint.printer.TestEnvironments.SUCC;
import static dev.termprint.printer.TestEnvironments.TO_FUN;
import static dev.termprint.printer.TestEnvironments.TO_POLY;
import static dev.termprint.printer.TestEnvironments.TT;
import static dev.termprint.printer.TestEnvironments.UNBOX;
import static dev.termprint.printer.TestEnvironments.X;
import static dev.termprint.printer.TestEnvironments.Y;
import static dev.termprint.printer.TestEnvironments.base;
import static dev.termprint.printer.TestEnvironments.options;
import static dev.termprint.printer.TestEnvironments.printer;
import static dev.termprint.printer.TestEnvironments.withNotations;
import static dev.termprint.term.Exprs.mkApp;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests for hiding and showing coercions and implicit arguments.
 */
public class CoercionImplicitTest {

    @Test
    public void implicitArgumentsHidden() {
        final PrettyPrinter printer = printer(base());
        assertThat(printer.toString(mkApp(EQ, NAT, X, Y)), equalTo("eq x y"));
        assertThat(printer.toString(mkApp(ID, NAT, X)), equalTo("id x"));
        assertThat(printer.toString(mkApp(SUCC, mkApp(ID, NAT, X))), equalTo("succ (id x)"));
    }

    @Test
    public void implicitArgumentsShown() {
        final PrettyPrinter printer = printer(base(), options(PrinterOptions.Name.IMPLICIT, true));
        assertThat(printer.toString(mkApp(EQ, NAT, X, Y)), equalTo("@eq nat x y"));
        assertThat(printer.toString(mkApp(ID, NAT, X)), equalTo("@id nat x"));
        assertThat(printer.toString(mkApp(SUCC, X)), equalTo("succ x"));
    }

    @Test
    public void partialImplicitApplicationIsAtomic() {
        // id nat renders as id and needs no parentheses as an argument
        assertThat(printer(base()).toString(mkApp(SUCC, mkApp(ID, NAT))), equalTo("succ id"));
    }

    @Test
    public void coercionHidden() {
        final Expr coerced = mkApp(BOOL_TO_NAT, TT);
        assertThat(printer(base()).toString(mkApp(SUCC, coerced)), equalTo("succ tt"));
        assertThat(printer(withNotations()).toString(mkApp(ADD, coerced, X)), equalTo("tt + x"));
    }

    @Test
    public void coercionShown() {
        final Expr coerced = mkApp(BOOL_TO_NAT, TT);
        assertThat(printer(base(), options(PrinterOptions.Name.COERCIONS, true)).toString(mkApp(SUCC, coerced)),
                equalTo("succ (bool_to_nat tt)"));
    }

    @Test
    public void unappliedCoercionPrintsItself() {
        assertThat(printer(base()).toString(BOOL_TO_NAT), equalTo("bool_to_nat"));
    }

    @Test
    public void coercionToFunction() {
        final Expr applied = mkApp(TO_FUN, G, X);
        assertThat(printer(base()).toString(applied), equalTo("g x"));
        assertThat(printer(base()).toString(mkApp(SUCC, applied)), equalTo("succ (g x)"));
        assertThat(printer(base(), options(PrinterOptions.Name.COERCIONS, true)).toString(applied),
                equalTo("to_fun g x"));
    }

    @Test
    public void coercionWithOwnArgumentsHidden() {
        final PrettyPrinter printer = printer(base());
        assertThat(printer.toString(mkApp(UNBOX, NAT, BX)), equalTo("bx"));
        assertThat(printer.toString(mkApp(UNBOX, NAT, BX, X)), equalTo("bx x"));
        assertThat(printer.toString(mkApp(SUCC, mkApp(UNBOX, NAT, BX, X))), equalTo("succ (bx x)"));
    }

    @Test
    public void coercionWithOwnArgumentsShown() {
        final Expr applied = mkApp(UNBOX, NAT, BX, X);
        assertThat(printer(base(), options(PrinterOptions.Name.COERCIONS, true)).toString(applied),
                equalTo("unbox bx x"));
        assertThat(printer(base(), options(PrinterOptions.Name.IMPLICIT, true)).toString(applied),
                equalTo("bx x"));
        assertThat(printer(base(), showCoercionsAndImplicits()).toString(applied), equalTo("@unbox nat bx x"));
    }

    @Test
    public void implicitArgumentsOfCoercedFunctionHidden() {
        final Expr applied = mkApp(TO_POLY, PF, NAT, X);
        assertThat(printer(base()).toString(applied), equalTo("pf x"));
        assertThat(printer(base()).toString(mkApp(TO_POLY, PF, NAT)), equalTo("pf"));
        assertThat(printer(base()).toString(mkApp(SUCC, applied)), equalTo("succ (pf x)"));
        assertThat(printer(base(), options(PrinterOptions.Name.COERCIONS, true)).toString(applied),
                equalTo("to_poly pf x"));
    }

    @Test
    public void implicitArgumentsOfCoercedFunctionShown() {
        // the coerced value takes the implicit argument, so it is the one marked explicit
        final Expr applied = mkApp(TO_POLY, PF, NAT, X);
        assertThat(printer(base(), options(PrinterOptions.Name.IMPLICIT, true)).toString(applied),
                equalTo("@pf nat x"));
        assertThat(printer(base(), showCoercionsAndImplicits()).toString(applied), equalTo("@to_poly pf nat x"));
    }

    private static PrinterOptions showCoercionsAndImplicits() {
        return PrinterOptions.builder()
                .withOption(PrinterOptions.Name.COERCIONS, true)
                .withOption(PrinterOptions.Name.IMPLICIT, true)
                .build();
    }
}

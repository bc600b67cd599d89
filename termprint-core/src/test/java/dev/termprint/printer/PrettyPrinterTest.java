/*
 * PrettyPrinterTest.java
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

import dev.termprint.term.BinderInfo;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Level;
import dev.termprint.term.Local;
import dev.termprint.term.Macro;
import dev.termprint.term.MacroDefinition;
import dev.termprint.term.MetaVar;
import dev.termprint.term.Name;
import dev.termprint.term.Numerals;
import dev.termprint.term.Sort;
import dev.termprint.term.Var;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static dev.termprint.printer.TestEnvironments.ADD;
import static dev.termprint.printer.TestEnvironments.NAT;
import static dev.termprint.printer.TestEnvironments.SUCC;
import static dev.termprint.printer.TestEnvironments.X;
import static dev.termprint.printer.TestEnvironments.ZERO;
import static dev.termprint.printer.TestEnvironments.base;
import static dev.termprint.printer.TestEnvironments.options;
import static dev.termprint.printer.TestEnvironments.printer;
import static dev.termprint.printer.TestEnvironments.withNotations;
import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkLambda;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link PrettyPrinter} on atoms, applications and the options that affect them.
 */
public class PrettyPrinterTest {

    @Test
    public void atoms() {
        final PrettyPrinter printer = printer(base());
        assertThat(printer.toString(ZERO), equalTo("zero"));
        assertThat(printer.toString(new Var(3)), equalTo("#3"));
        assertThat(printer.toString(Sort.PROP), equalTo("Prop"));
        assertThat(printer.toString(Sort.TYPE), equalTo("Type"));
        assertThat(printer.toString(Numerals.mkNumeral(42)), equalTo("42"));
    }

    @Test
    public void applications() {
        final PrettyPrinter printer = printer(base());
        assertThat(printer.toString(mkApp(SUCC, ZERO)), equalTo("succ zero"));
        assertThat(printer.toString(mkApp(SUCC, mkApp(SUCC, ZERO))), equalTo("succ (succ zero)"));
        assertThat(printer.toString(mkApp(ADD, mkApp(SUCC, X), X)), equalTo("add (succ x) x"));
    }

    @Test
    public void longApplicationBreaks() {
        final PrettyPrinter printer = printer(base());
        Expr e = ZERO;
        for (int i = 0; i < 6; i++) {
            e = mkApp(ADD, e, X);
        }
        final String narrow = printer.toString(e, 20);
        assertThat(narrow, containsString("\n"));
        assertThat(printer.toString(e, 200), not(containsString("\n")));
    }

    @Test
    public void universes() {
        final PrettyPrinter hidden = printer(base());
        final PrettyPrinter shown = printer(base(), options(PrinterOptions.Name.UNIVERSES, true));
        final Expr sort = new Sort(Level.succ(Level.param("u")));
        assertThat(hidden.toString(sort), equalTo("Type"));
        assertThat(shown.toString(sort), equalTo("Type.{u+1}"));
        assertThat(shown.toString(Sort.TYPE), equalTo("Type.{1}"));
        assertThat(shown.toString(Sort.PROP), equalTo("Prop"));

        final Expr list = new Constant(Name.of("list"), ImmutableList.of(Level.param("u")));
        assertThat(hidden.toString(list), equalTo("list"));
        assertThat(shown.toString(list), equalTo("list.{u}"));
        final Expr pair = new Constant(Name.of("pair"),
                ImmutableList.of(Level.max(Level.param("u"), Level.param("v")), Level.ZERO));
        assertThat(shown.toString(pair), equalTo("pair.{(max u v) 0}"));
    }

    @Test
    public void predicativeZeroSortIsType() {
        final PrettyPrinter printer = printer(base().setImpredicative(false));
        assertThat(printer.toString(Sort.PROP), equalTo("Type"));
    }

    @Test
    public void aliasesAndNamespaces() {
        final PrettyPrinter printer = printer(base()
                .addConstant("nat.add", NAT)
                .addConstant("nat.succ", NAT)
                .addConstant("foo.a", NAT)
                .addConstant("bar.a", NAT)
                .addAlias(Name.of("nat", "add"), Name.of("plus"))
                .addAlias(Name.of("foo", "a"), Name.of("a"))
                .openNamespace(Name.of("nat"))
                .openNamespace(Name.of("bar")));
        assertThat(printer.toString(new Constant(Name.of("nat", "add"))), equalTo("plus"));
        assertThat(printer.toString(new Constant(Name.of("nat", "succ"))), equalTo("succ"));
        // bar.a is visible as a, so the alias would be ambiguous
        assertThat(printer.toString(new Constant(Name.of("foo", "a"))), equalTo("foo.a"));

        printer.setOptions(options(PrinterOptions.Name.FULL_NAMES, true));
        assertThat(printer.toString(new Constant(Name.of("nat", "add"))), equalTo("nat.add"));
        assertThat(printer.toString(new Constant(Name.of("nat", "succ"))), equalTo("nat.succ"));
    }

    @Test
    public void privateNames() {
        final Name hidden = Name.of("_private", "42", "secret");
        final PrettyPrinter printer = printer(base()
                .addConstant("_private.42.secret", NAT)
                .addPrivateName(hidden, Name.of("secret")));
        assertThat(printer.toString(new Constant(hidden)), equalTo("secret"));
        printer.setOptions(options(PrinterOptions.Name.PRIVATE_NAMES, true));
        assertThat(printer.toString(new Constant(hidden)), equalTo("_private.42.secret"));
    }

    @Test
    public void metavariables() {
        final PrettyPrinter printer = printer(withNotations());
        final Expr m1 = new MetaVar(Name.of("_mlocal", "981"), NAT);
        final Expr m2 = new MetaVar(Name.of("_mlocal", "17"), NAT);
        assertThat(printer.toString(mkApp(ADD, m1, m2)), equalTo("?M_1 + ?M_2"));
        assertThat(printer.toString(mkApp(ADD, m1, m1)), equalTo("?M_1 + ?M_1"));
    }

    @Test
    public void metavariableArguments() {
        final Expr meta = new MetaVar(Name.of("_mlocal", "3"), NAT);
        final Expr applied = mkApp(meta, ZERO, X);
        assertThat(printer(base()).toString(applied), equalTo("?M_1"));
        assertThat(printer(base(), options(PrinterOptions.Name.METAVAR_ARGS, true)).toString(applied),
                equalTo("?M_1 zero x"));
    }

    @Test
    public void localsWithClashingNames() {
        final PrettyPrinter printer = printer(withNotations());
        final Expr first = new Local(Name.of("_uniq", "1"), Name.of("n"), NAT, BinderInfo.DEFAULT);
        final Expr second = new Local(Name.of("_uniq", "2"), Name.of("n"), NAT, BinderInfo.DEFAULT);
        assertThat(printer.toString(mkApp(ADD, first, second)), equalTo("n + n_1"));
        assertThat(printer.toString(mkApp(ADD, first, first)), equalTo("n + n"));
    }

    @Test
    public void binderAvoidsPurifiedLocal() {
        final PrettyPrinter printer = printer(withNotations());
        final Expr free = new Local(Name.of("_uniq", "7"), Name.of("x"), NAT, BinderInfo.DEFAULT);
        final Expr lambda = mkLambda("x", NAT, mkApp(ADD, new Var(0), free));
        assertThat(printer.toString(lambda), equalTo("λ (x_1 : nat), x_1 + x"));
    }

    @Test
    public void beta() {
        final Expr redex = mkApp(mkLambda("n", NAT, mkApp(SUCC, new Var(0))), ZERO);
        assertThat(printer(base()).toString(redex), equalTo("(λ (n : nat), succ n) zero"));
        assertThat(printer(base(), options(PrinterOptions.Name.BETA, true)).toString(redex),
                equalTo("succ zero"));
    }

    @Test
    public void depthLimit() {
        Expr e = ZERO;
        for (int i = 0; i < 2000; i++) {
            e = mkApp(SUCC, e);
        }
        final String shallow = printer(base(), options(PrinterOptions.Name.MAX_DEPTH, 5)).toString(e, 200);
        assertThat(shallow, containsString("…"));
        assertThat(shallow, not(containsString("zero")));
        final String ascii = printer(base(), PrinterOptions.builder()
                .withOption(PrinterOptions.Name.MAX_DEPTH, 5)
                .withOption(PrinterOptions.Name.UNICODE, false)
                .build()).toString(e, 200);
        assertThat(ascii, containsString("..."));
    }

    @Test
    public void depthLimitOnOpenTerms() {
        Expr meta = new MetaVar(Name.of("_mlocal", "5"), NAT);
        Expr local = new Local(Name.of("_uniq", "5"), Name.of("n"), NAT, BinderInfo.DEFAULT);
        for (int i = 0; i < 100000; i++) {
            meta = mkApp(SUCC, meta);
            local = mkApp(SUCC, local);
        }
        final PrettyPrinter printer = printer(base());
        final String withMeta = printer.toString(meta, 200);
        assertThat(withMeta, containsString("…"));
        assertThat(withMeta, not(containsString("?M_1")));
        assertThat(printer.toString(local, 200), containsString("…"));
    }

    @Test
    public void stepLimit() {
        Expr e = ZERO;
        for (int i = 0; i < 50; i++) {
            e = mkApp(ADD, e, mkApp(SUCC, X));
        }
        final String limited = printer(base(), options(PrinterOptions.Name.MAX_STEPS, 20)).toString(e, 10000);
        assertThat(limited, containsString("…"));
        final String full = printer(base()).toString(e, 10000);
        assertThat(full, not(containsString("…")));
    }

    @Test
    public void genericMacro() {
        final Expr macro = new Macro(new MacroDefinition(Name.of("sorry_macro")),
                ImmutableList.of(ZERO, mkApp(SUCC, ZERO)));
        assertThat(printer(base()).toString(macro), equalTo("[sorry_macro zero (succ zero)]"));
    }

    @Test
    public void setOptionsKeepsConfigurationForSameOptions() {
        final PrettyPrinter printer = printer(base());
        final PrinterOptions options = printer.getOptions();
        final PrinterConfiguration configuration = printer.getConfiguration();
        printer.setOptions(options);
        assertThat(printer.getConfiguration(), sameInstance(configuration));
        printer.setOptions(options(PrinterOptions.Name.UNICODE, false));
        assertThat(printer.getConfiguration().isUnicode(), equalTo(false));
    }
}

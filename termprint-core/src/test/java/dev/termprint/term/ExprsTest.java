/*
 * ExprsTest.java
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

package dev.termprint.term;

import org.junit.jupiter.api.Test;

import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkArrow;
import static dev.termprint.term.Exprs.mkConstant;
import static dev.termprint.term.Exprs.mkLambda;
import static dev.termprint.term.Exprs.mkPi;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link Exprs}.
 */
public class ExprsTest {
    private static final Expr F = mkConstant("f");
    private static final Expr A = mkConstant("a");
    private static final Expr B = mkConstant("b");
    private static final Expr NAT = mkConstant("nat");

    @Test
    public void applicationSpine() {
        final Expr e = mkApp(F, A, B);
        assertThat(Exprs.getAppFn(e), equalTo(F));
        assertThat(Exprs.getAppArgs(e), contains(A, B));
        assertThat(Exprs.getAppNumArgs(e), equalTo(2));
        assertThat(Exprs.getAppArgs(F).isEmpty(), equalTo(true));
    }

    @Test
    public void instantiateReplacesOuterVariable() {
        final Expr body = mkApp(F, new Var(0), mkLambda("y", NAT, mkApp(F, new Var(0), new Var(1))));
        final Expr result = Exprs.instantiate(body, A);
        assertThat(result, equalTo(mkApp(F, A, mkLambda("y", NAT, mkApp(F, new Var(0), A)))));
    }

    @Test
    public void instantiateLowersHigherVariables() {
        assertThat(Exprs.instantiate(new Var(2), A), equalTo(new Var(1)));
        final Expr closed = mkApp(F, A);
        assertThat(Exprs.instantiate(closed, B), sameInstance(closed));
    }

    @Test
    public void abstractOverThenInstantiate() {
        final Expr e = mkApp(F, A, mkLambda("y", NAT, mkApp(F, A, new Var(0))));
        final Expr abstracted = Exprs.abstractOver(e, A);
        assertThat(abstracted, equalTo(mkApp(F, new Var(0), mkLambda("y", NAT, mkApp(F, new Var(1), new Var(0))))));
        assertThat(Exprs.instantiate(abstracted, A), equalTo(e));
    }

    @Test
    public void arrows() {
        final Binding arrow = mkArrow(NAT, NAT);
        assertThat(Exprs.isArrow(arrow), equalTo(true));
        assertThat(Exprs.isArrow(mkPi("n", NAT, mkApp(F, new Var(0)))), equalTo(false));
        // the codomain is lifted past the new binder
        assertThat(mkArrow(NAT, new Var(0)).getBody(), equalTo(new Var(1)));
        assertThat(Exprs.lowerLooseBVars(mkArrow(NAT, new Var(0)).getBody(), 1), equalTo(new Var(0)));
    }

    @Test
    public void betaReduction() {
        final Expr redex = mkApp(mkLambda("x", NAT, mkApp(F, new Var(0), new Var(0))), A);
        assertThat(Exprs.betaReduce(redex), equalTo(mkApp(F, A, A)));
        final Expr nested = mkApp(F, mkApp(mkLambda("x", NAT, new Var(0)), B));
        assertThat(Exprs.betaReduce(nested), equalTo(mkApp(F, B)));
        final Expr twoArgs = mkApp(mkLambda("x", NAT, mkLambda("y", NAT, new Var(1))), A, B);
        assertThat(Exprs.headBeta(twoArgs), equalTo(A));
    }

    @Test
    public void occurrences() {
        final Expr e = mkApp(F, mkApp(F, A));
        assertThat(Exprs.occurs(mkApp(F, A), e), equalTo(true));
        assertThat(Exprs.occurs(B, e), equalTo(false));
        assertThat(Exprs.hasLooseBVar(mkLambda("x", NAT, new Var(1)), 0), equalTo(true));
        assertThat(Exprs.hasLooseBVar(mkLambda("x", NAT, new Var(0)), 0), equalTo(false));
    }

    @Test
    public void names() {
        final Local local = new Local(Name.of("_uniq", "1"), Name.of("h"), NAT, BinderInfo.DEFAULT);
        final Expr e = mkApp(F, A, local);
        assertThat(Exprs.collectNames(e), containsInAnyOrder(Name.of("f"), Name.of("a"), Name.of("h"), Name.of("nat")));
        assertThat(Exprs.pickUnusedName(e, Name.of("x")), equalTo(Name.of("x")));
        assertThat(Exprs.pickUnusedName(mkApp(F, mkConstant("a_1"), A), Name.of("a")), equalTo(Name.of("a_2")));
    }
}

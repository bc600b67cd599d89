/*
 * SimpleTypeCheckerTest.java
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

package dev.termprint.env;

import dev.termprint.term.BinderInfo;
import dev.termprint.term.Binding;
import dev.termprint.term.Constant;
import dev.termprint.term.Expr;
import dev.termprint.term.Level;
import dev.termprint.term.Name;
import dev.termprint.term.Sort;
import dev.termprint.term.Var;
import com.google.common.collect.ImmutableList;
import org.junit.jupiter.api.Test;

import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkArrow;
import static dev.termprint.term.Exprs.mkConstant;
import static dev.termprint.term.Exprs.mkLambda;
import static dev.termprint.term.Exprs.mkPi;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests for {@link SimpleTypeChecker}.
 */
public class SimpleTypeCheckerTest {
    private static final Expr NAT = mkConstant("nat");
    private static final Expr ZERO = mkConstant("zero");
    private static final Expr SUCC = mkConstant("succ");
    private static final Expr TWO = mkConstant("two");
    private static final Expr EQ = mkConstant("eq");

    private final SimpleTypeChecker typeChecker = new SimpleTypeChecker(InMemoryEnvironment.builder()
            .addConstant("nat", Sort.TYPE)
            .addConstant("zero", NAT)
            .addConstant("succ", mkArrow(NAT, NAT))
            .addDefinition("two", NAT, mkApp(SUCC, mkApp(SUCC, ZERO)))
            .addDefinition("nat_fun", Sort.TYPE, mkArrow(NAT, NAT))
            .addConstant("eq", mkPi("A", Sort.TYPE, mkArrow(new Var(0), mkArrow(new Var(0), Sort.PROP)),
                    BinderInfo.IMPLICIT))
            .addDeclaration(new Declaration(Name.of("list"), ImmutableList.of(Name.of("u")),
                    mkArrow(new Sort(Level.succ(Level.param("u"))), new Sort(Level.succ(Level.param("u")))), null))
            .build());

    @Test
    public void constantsAndApplications() {
        assertThat(typeChecker.infer(ZERO).getValue(), equalTo(NAT));
        assertThat(typeChecker.infer(mkApp(SUCC, ZERO)).getValue(), equalTo(NAT));
        assertThat(typeChecker.infer(mkApp(EQ, NAT, ZERO, ZERO)).getValue(), equalTo(Sort.PROP));
    }

    @Test
    public void universeParametersInstantiated() {
        final Expr list = new Constant(Name.of("list"), ImmutableList.of(Level.ZERO));
        assertThat(typeChecker.infer(list).getValue(), equalTo(mkArrow(Sort.TYPE, Sort.TYPE)));
    }

    @Test
    public void lambdaAndPi() {
        assertThat(typeChecker.infer(mkLambda("n", NAT, mkApp(SUCC, new Var(0)))).getValue(),
                equalTo(mkArrow(NAT, NAT)));
        assertThat(typeChecker.infer(mkArrow(NAT, NAT)).getValue(), equalTo(Sort.TYPE));
        assertThat(typeChecker.infer(mkPi("n", NAT, mkApp(EQ, NAT, new Var(0), new Var(0)))).getValue(),
                equalTo(Sort.PROP));
    }

    @Test
    public void whnfUnfoldsDefinitionsAndBeta() {
        assertThat(typeChecker.whnf(TWO).getValue(), equalTo(mkApp(SUCC, mkApp(SUCC, ZERO))));
        final Expr redex = mkApp(mkLambda("n", NAT, mkApp(SUCC, new Var(0))), ZERO);
        assertThat(typeChecker.whnf(redex).getValue(), equalTo(mkApp(SUCC, ZERO)));
        assertThat(typeChecker.whnf(ZERO).getValue(), equalTo(ZERO));
    }

    @Test
    public void ensurePiUnfolds() {
        final TypeCheckResult<Binding> pi = typeChecker.ensurePi(mkConstant("nat_fun"));
        assertThat(pi.isSuccess(), equalTo(true));
        assertThat(pi.getValue().getDomain(), equalTo(NAT));
        assertThat(typeChecker.ensurePi(NAT).getFailure().getReason(),
                equalTo(TypeCheckFailure.Reason.NOT_A_PRODUCT));
    }

    @Test
    public void propositions() {
        assertThat(typeChecker.isProp(mkApp(EQ, NAT, ZERO, TWO)).getValue(), equalTo(true));
        assertThat(typeChecker.isProp(NAT).getValue(), equalTo(false));
    }

    @Test
    public void failures() {
        assertThat(typeChecker.infer(mkConstant("missing")).getFailure().getReason(),
                equalTo(TypeCheckFailure.Reason.UNKNOWN_CONSTANT));
        assertThat(typeChecker.infer(new Var(0)).getFailure().getReason(),
                equalTo(TypeCheckFailure.Reason.OPEN_TERM));
        assertThat(typeChecker.infer(mkApp(ZERO, ZERO)).getFailure().getReason(),
                equalTo(TypeCheckFailure.Reason.NOT_A_PRODUCT));
    }
}

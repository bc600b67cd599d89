/*
 * InMemoryEnvironmentTest.java
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

import dev.termprint.term.Expr;
import dev.termprint.term.HeadIndex;
import dev.termprint.term.Name;
import dev.termprint.term.Sort;
import dev.termprint.term.Var;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkConstant;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tests for {@link InMemoryEnvironment}.
 */
public class InMemoryEnvironmentTest {
    private static final Expr ADD = mkConstant("add");

    @Test
    public void notationsMostRecentFirst() {
        final NotationEntry plus = NotationEntry.led(mkApp(ADD, new Var(1), new Var(0)),
                NotationTransition.expr("+", 65));
        final NotationEntry oplus = NotationEntry.led(mkApp(ADD, new Var(1), new Var(0)),
                NotationTransition.expr("⊕", 65));
        final InMemoryEnvironment environment = InMemoryEnvironment.builder()
                .addNotation(plus)
                .addNotation(oplus)
                .build();
        assertThat(environment.getNotationEntries(HeadIndex.constant(Name.of("add"))), contains(oplus, plus));
        assertThat(environment.getNotationEntries(HeadIndex.constant(Name.of("mul"))), empty());
        assertThat(plus.isSafeAscii(), equalTo(true));
        assertThat(oplus.isSafeAscii(), equalTo(false));
        assertThat(plus.getNumParameters(), equalTo(2));
    }

    @Test
    public void openNamespacesInnermostFirst() {
        final InMemoryEnvironment environment = InMemoryEnvironment.builder()
                .openNamespace(Name.of("outer"))
                .openNamespace(Name.of("inner"))
                .build();
        assertThat(environment.getOpenNamespaces(), contains(Name.of("inner"), Name.of("outer")));
    }

    @Test
    public void lookups() {
        final InMemoryEnvironment environment = InMemoryEnvironment.builder()
                .addConstant("nat.add", Sort.TYPE)
                .addAlias(Name.of("nat.add"), Name.of("plus"))
                .addCoercion(Name.of("coe"), Name.of("nat"), 1)
                .setPrecedence("+", 65)
                .build();
        assertThat(environment.contains(Name.of("nat", "add")), equalTo(true));
        assertThat(environment.contains(Name.of("plus")), equalTo(false));
        assertThat(environment.getAlias(Name.of("nat.add")), equalTo(Optional.of(Name.of("plus"))));
        assertThat(environment.getCoercion(Name.of("coe")).map(CoercionInfo::getNumArgs), equalTo(Optional.of(1)));
        assertThat(environment.getTokenTable().getPrecedence("+"), equalTo(Optional.of(65)));
        assertThat(environment.getTokenTable().getPrecedence("*"), equalTo(Optional.empty()));
        assertThat(environment.isImpredicative(), equalTo(true));
    }
}

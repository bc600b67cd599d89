/*
 * NamePurifierTest.java
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

import dev.termprint.term.App;
import dev.termprint.term.BinderInfo;
import dev.termprint.term.Expr;
import dev.termprint.term.Level;
import dev.termprint.term.Local;
import dev.termprint.term.MetaVar;
import dev.termprint.term.Name;
import dev.termprint.term.Sort;
import org.junit.jupiter.api.Test;

import static dev.termprint.printer.TestEnvironments.ADD;
import static dev.termprint.printer.TestEnvironments.NAT;
import static dev.termprint.printer.TestEnvironments.SUCC;
import static dev.termprint.printer.TestEnvironments.ZERO;
import static dev.termprint.term.Exprs.mkApp;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;

/**
 * Tests for {@link NamePurifier}.
 */
public class NamePurifierTest {

    @Test
    public void termsWithoutMetavariablesOrLocalsAreUntouched() {
        final Expr e = mkApp(ADD, ZERO, mkApp(SUCC, ZERO));
        assertThat(new NamePurifier(new RenderContext(), true).purify(e), sameInstance(e));
    }

    @Test
    public void metavariablesNumberedInOrder() {
        final NamePurifier purifier = new NamePurifier(new RenderContext(), false);
        final MetaVar first = new MetaVar(Name.of("_mlocal", "77"), NAT);
        final MetaVar second = new MetaVar(Name.of("_mlocal", "12"), NAT);
        final App purified = (App)purifier.purify(mkApp(ADD, first, second));
        assertThat(((MetaVar)((App)purified.getFn()).getArg()).getDisplayName(), equalTo(Name.of("M_1")));
        assertThat(((MetaVar)purified.getArg()).getDisplayName(), equalTo(Name.of("M_2")));
        assertThat(((MetaVar)purifier.purify(first)).getDisplayName(), equalTo(Name.of("M_1")));
    }

    @Test
    public void localsGetDistinctNames() {
        final NamePurifier purifier = new NamePurifier(new RenderContext(), false);
        final Local a = new Local(Name.of("_uniq", "1"), Name.of("h"), NAT, BinderInfo.DEFAULT);
        final Local b = new Local(Name.of("_uniq", "2"), Name.of("h"), NAT, BinderInfo.DEFAULT);
        final App purified = (App)purifier.purify(mkApp(ADD, a, b));
        assertThat(((Local)((App)purified.getFn()).getArg()).getPpName(), equalTo(Name.of("h")));
        assertThat(((Local)purified.getArg()).getPpName(), equalTo(Name.of("h_1")));
        // identity is kept, only the display name changes
        assertThat(purified.getArg(), equalTo((Expr)b));
    }

    @Test
    public void deepTermsPurified() {
        final MetaVar meta = new MetaVar(Name.of("_mlocal", "9"), NAT);
        Expr e = meta;
        for (int i = 0; i < 100000; i++) {
            e = mkApp(SUCC, e);
        }
        Expr bottom = new NamePurifier(new RenderContext(), false).purify(e);
        while (bottom instanceof App) {
            bottom = ((App)bottom).getArg();
        }
        assertThat(((MetaVar)bottom).getDisplayName(), equalTo(Name.of("M_1")));
    }

    @Test
    public void closedSubtermsShared() {
        final Expr closed = mkApp(ADD, ZERO, mkApp(SUCC, ZERO));
        final Local local = new Local(Name.of("_uniq", "3"), Name.of("n"), NAT, BinderInfo.DEFAULT);
        final NamePurifier purifier = new NamePurifier(new RenderContext(), false);
        final App purified = (App)purifier.purify(mkApp(SUCC, mkApp(closed, local)));
        assertThat(((App)purified.getArg()).getFn(), sameInstance(closed));
    }

    @Test
    public void universeMetavariablesOnlyWhenUniversesShown() {
        final Expr sort = new Sort(Level.meta(Name.of("_umeta", "5")));
        assertThat(new NamePurifier(new RenderContext(), false).purify(sort), sameInstance(sort));
        final Sort purified = (Sort)new NamePurifier(new RenderContext(), true).purify(sort);
        assertThat(purified.getLevel().getDisplayName(), equalTo(Name.of("M_1")));
    }

    @Test
    public void purifyingTwiceChangesNothing() {
        final NamePurifier purifier = new NamePurifier(new RenderContext(), false);
        final Local a = new Local(Name.of("_uniq", "1"), Name.of("h"), NAT, BinderInfo.DEFAULT);
        final Local b = new Local(Name.of("_uniq", "2"), Name.of("h"), NAT, BinderInfo.DEFAULT);
        final MetaVar m = new MetaVar(Name.of("_mlocal", "4"), NAT);
        final App once = (App)purifier.purify(mkApp(ADD, mkApp(SUCC, a), mkApp(ADD, b, m)));
        final App twice = (App)purifier.purify(once);
        final App second = (App)twice.getArg();
        assertThat(((Local)((App)second.getFn()).getArg()).getPpName(), equalTo(Name.of("h_1")));
        assertThat(((MetaVar)second.getArg()).getDisplayName(), equalTo(Name.of("M_1")));
        assertThat(twice, equalTo((Expr)once));
    }
}

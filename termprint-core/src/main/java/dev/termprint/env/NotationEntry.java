/*
 * NotationEntry.java
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

import dev.termprint.annotation.API;
import dev.termprint.term.Annotations;
import dev.termprint.term.Expr;
import dev.termprint.term.Exprs;
import dev.termprint.term.HeadIndex;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * A user-declared notation. The pattern expression refers to the notation's parameters with bound variables: with
 * {@code n} parameters, {@code #(n-1)} is the first parameter read and {@code #0} the last. Prefix ({@code nud})
 * notations start with a token; the others ({@code led}) start with a leading operand, which is their first parameter.
 */
@API(API.Status.EXPERIMENTAL)
public final class NotationEntry {
    private static final CharMatcher ASCII = CharMatcher.ascii();

    @Nonnull
    private final List<NotationTransition> transitions;
    @Nonnull
    private final Expr pattern;
    private final boolean nud;
    @Nullable
    private final BigInteger numeral;
    private final boolean safeAscii;

    private NotationEntry(@Nonnull List<NotationTransition> transitions, @Nonnull Expr pattern, boolean nud,
                          @Nullable BigInteger numeral, boolean safeAscii) {
        this.transitions = ImmutableList.copyOf(transitions);
        this.pattern = pattern;
        this.nud = nud;
        this.numeral = numeral;
        this.safeAscii = safeAscii;
    }

    @Nonnull
    public static NotationEntry nud(@Nonnull Expr pattern, @Nonnull NotationTransition... transitions) {
        final List<NotationTransition> list = ImmutableList.copyOf(transitions);
        return new NotationEntry(list, pattern, true, null, allAscii(list));
    }

    @Nonnull
    public static NotationEntry led(@Nonnull Expr pattern, @Nonnull NotationTransition... transitions) {
        final List<NotationTransition> list = ImmutableList.copyOf(transitions);
        return new NotationEntry(list, pattern, false, null, allAscii(list));
    }

    /**
     * A notation printing {@code pattern} as a literal number.
     * @param pattern the term denoted by the number
     * @param value the number
     * @return the entry
     */
    @Nonnull
    public static NotationEntry numeral(@Nonnull Expr pattern, @Nonnull BigInteger value) {
        return new NotationEntry(ImmutableList.of(), pattern, true, value, true);
    }

    private static boolean allAscii(@Nonnull List<NotationTransition> transitions) {
        return transitions.stream().allMatch(t -> ASCII.matchesAllOf(t.getToken()));
    }

    @Nonnull
    public NotationEntry withSafeAscii(boolean newSafeAscii) {
        return new NotationEntry(transitions, pattern, nud, numeral, newSafeAscii);
    }

    @Nonnull
    public List<NotationTransition> getTransitions() {
        return transitions;
    }

    @Nonnull
    public Expr getPattern() {
        return pattern;
    }

    public boolean isNud() {
        return nud;
    }

    public boolean isNumeral() {
        return numeral != null;
    }

    @Nonnull
    public BigInteger getNumeral() {
        return Objects.requireNonNull(numeral, "not a numeral notation");
    }

    public boolean isSafeAscii() {
        return safeAscii;
    }

    /**
     * The number of parameters the pattern refers to.
     * @return {@code 0} for numerals, otherwise one per parameter-taking action plus one for the leading operand of a
     * non-prefix notation
     */
    public int getNumParameters() {
        if (isNumeral()) {
            return 0;
        }
        int n = nud ? 0 : 1;
        for (NotationTransition transition : transitions) {
            if (transition.getAction().takesParameter()) {
                n++;
            }
        }
        return n;
    }

    /**
     * The key under which this entry is looked up.
     * @return the head index of the pattern
     */
    @Nonnull
    public HeadIndex getHeadIndex() {
        Expr head = Exprs.getAppFn(pattern);
        while (Annotations.isExplicit(head)) {
            head = Exprs.getAppFn(Annotations.getExplicitArg(head));
        }
        return HeadIndex.of(head);
    }

    @Override
    public String toString() {
        return (nud ? "nud " : "led ") + transitions + " := " + pattern;
    }
}

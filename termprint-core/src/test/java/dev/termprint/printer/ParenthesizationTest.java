/*
 * ParenthesizationTest.java
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

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static dev.termprint.printer.TestEnvironments.ADD;
import static dev.termprint.printer.TestEnvironments.MUL;
import static dev.termprint.printer.TestEnvironments.SUCC;
import static dev.termprint.printer.TestEnvironments.X;
import static dev.termprint.printer.TestEnvironments.Y;
import static dev.termprint.printer.TestEnvironments.Z;
import static dev.termprint.printer.TestEnvironments.printer;
import static dev.termprint.printer.TestEnvironments.withNotations;
import static dev.termprint.term.Exprs.mkApp;
import static dev.termprint.term.Exprs.mkArrow;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Prints random terms built from application, {@code +}, {@code *} and arrows, and reads them back with a
 * precedence-climbing parser using the same binding powers. Every printed term must read back as itself, and
 * dropping any single pair of parentheses must change the result.
 */
public class ParenthesizationTest {
    private static final int ITERATIONS = 300;

    @Test
    public void printedTermsReadBack() {
        final PrettyPrinter printer = printer(withNotations());
        final Random random = new Random(0x5eed);
        for (int i = 0; i < ITERATIONS; i++) {
            final Expr e = randomTerm(random, 4);
            final String printed = printer.toString(e, 10000);
            assertThat(printed, new ModelParser(printed).parseAll(), equalTo(e));
        }
    }

    @Test
    public void parenthesesAreNecessary() {
        final PrettyPrinter printer = printer(withNotations());
        final Random random = new Random(0xbeef);
        for (int i = 0; i < ITERATIONS; i++) {
            final Expr e = randomTerm(random, 4);
            final String printed = printer.toString(e, 10000);
            for (int open = printed.indexOf('('); open >= 0; open = printed.indexOf('(', open + 1)) {
                final int close = matchingParen(printed, open);
                final String stripped = printed.substring(0, open) + printed.substring(open + 1, close)
                        + printed.substring(close + 1);
                final Expr reparsed;
                try {
                    reparsed = new ModelParser(stripped).parseAll();
                } catch (IllegalStateException ex) {
                    continue;
                }
                if (reparsed.equals(e)) {
                    fail("redundant parentheses at " + open + " in " + printed);
                }
            }
        }
    }

    @Nonnull
    private static Expr randomTerm(@Nonnull Random random, int depth) {
        final int choice = depth == 0 ? 0 : random.nextInt(6);
        switch (choice) {
            case 1:
                return mkApp(SUCC, randomTerm(random, depth - 1));
            case 2:
                return mkApp(ADD, randomTerm(random, depth - 1), randomTerm(random, depth - 1));
            case 3:
                return mkApp(MUL, randomTerm(random, depth - 1), randomTerm(random, depth - 1));
            case 4:
                return mkArrow(randomTerm(random, depth - 1), randomTerm(random, depth - 1));
            case 5:
                return mkApp(SUCC, mkApp(SUCC, randomTerm(random, depth - 1)));
            default:
                final int leaf = random.nextInt(3);
                return leaf == 0 ? X : leaf == 1 ? Y : Z;
        }
    }

    private static int matchingParen(@Nonnull String s, int open) {
        int depth = 0;
        for (int i = open; i < s.length(); i++) {
            if (s.charAt(i) == '(') {
                depth++;
            } else if (s.charAt(i) == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw new IllegalStateException("unbalanced parentheses in " + s);
    }

    /**
     * Pratt parser for the printed fragment. Application binds tightest, then {@code *} and {@code +} (both left
     * associative), then the right associative arrow.
     */
    private static final class ModelParser {
        private static final int APP = 1024;
        @Nonnull
        private final List<String> tokens;
        private int position;

        ModelParser(@Nonnull String text) {
            this.tokens = tokenize(text);
        }

        @Nonnull
        Expr parseAll() {
            final Expr e = parse(0);
            if (position != tokens.size()) {
                throw new IllegalStateException("trailing input at token " + position);
            }
            return e;
        }

        @Nonnull
        private Expr parse(int rbp) {
            Expr left = nud();
            while (position < tokens.size() && lbp(tokens.get(position)) > rbp) {
                final String token = tokens.get(position);
                switch (token) {
                    case "+":
                        position++;
                        left = mkApp(ADD, left, parse(65));
                        break;
                    case "*":
                        position++;
                        left = mkApp(MUL, left, parse(70));
                        break;
                    case "→":
                        position++;
                        left = mkArrow(left, parse(24));
                        break;
                    default:
                        left = mkApp(left, parse(APP));
                        break;
                }
            }
            return left;
        }

        @Nonnull
        private Expr nud() {
            if (position >= tokens.size()) {
                throw new IllegalStateException("unexpected end of input");
            }
            final String token = tokens.get(position++);
            switch (token) {
                case "(": {
                    final Expr inner = parse(0);
                    if (position >= tokens.size() || !tokens.get(position).equals(")")) {
                        throw new IllegalStateException("expected )");
                    }
                    position++;
                    return inner;
                }
                case "succ":
                    return SUCC;
                case "x":
                    return X;
                case "y":
                    return Y;
                case "z":
                    return Z;
                default:
                    throw new IllegalStateException("unexpected token " + token);
            }
        }

        private static int lbp(@Nonnull String token) {
            switch (token) {
                case "+":
                    return 65;
                case "*":
                    return 70;
                case "→":
                    return 25;
                case ")":
                    return 0;
                default:
                    return APP;
            }
        }

        @Nonnull
        private static List<String> tokenize(@Nonnull String text) {
            final List<String> result = new ArrayList<>();
            final StringBuilder current = new StringBuilder();
            for (int i = 0; i < text.length(); i++) {
                final char c = text.charAt(i);
                if (Character.isWhitespace(c) || c == '(' || c == ')') {
                    if (current.length() > 0) {
                        result.add(current.toString());
                        current.setLength(0);
                    }
                    if (!Character.isWhitespace(c)) {
                        result.add(String.valueOf(c));
                    }
                } else {
                    current.append(c);
                }
            }
            if (current.length() > 0) {
                result.add(current.toString());
            }
            return result;
        }
    }
}

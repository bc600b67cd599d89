/*
 * Numerals.java
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

import dev.termprint.annotation.API;

import javax.annotation.Nonnull;
import java.math.BigInteger;
import java.util.Optional;

/**
 * The binary encoding of numerals: {@code num.zero}, {@code num.pos p} where {@code p} is built from
 * {@code pos_num.one}, {@code pos_num.bit0 p} ({@code 2p}) and {@code pos_num.bit1 p} ({@code 2p+1}).
 */
@API(API.Status.EXPERIMENTAL)
public final class Numerals {
    public static final Name NUM_ZERO = Name.of("num", "zero");
    public static final Name NUM_POS = Name.of("num", "pos");
    public static final Name POS_ONE = Name.of("pos_num", "one");
    public static final Name POS_BIT0 = Name.of("pos_num", "bit0");
    public static final Name POS_BIT1 = Name.of("pos_num", "bit1");

    private Numerals() {
    }

    public static boolean isNumeral(@Nonnull Expr e) {
        return toNumber(e).isPresent();
    }

    /**
     * Decode a numeral.
     * @param e the term
     * @return its value, empty if {@code e} is not a numeral
     */
    @Nonnull
    public static Optional<BigInteger> toNumber(@Nonnull Expr e) {
        if (isConstant(e, NUM_ZERO)) {
            return Optional.of(BigInteger.ZERO);
        }
        if (e instanceof App && isConstant(((App)e).getFn(), NUM_POS)) {
            return toPositive(((App)e).getArg());
        }
        return Optional.empty();
    }

    @Nonnull
    private static Optional<BigInteger> toPositive(@Nonnull Expr e) {
        if (isConstant(e, POS_ONE)) {
            return Optional.of(BigInteger.ONE);
        }
        if (e instanceof App) {
            final Expr fn = ((App)e).getFn();
            final boolean bit0 = isConstant(fn, POS_BIT0);
            if (bit0 || isConstant(fn, POS_BIT1)) {
                return toPositive(((App)e).getArg())
                        .map(v -> bit0 ? v.shiftLeft(1) : v.shiftLeft(1).add(BigInteger.ONE));
            }
        }
        return Optional.empty();
    }

    private static boolean isConstant(@Nonnull Expr e, @Nonnull Name name) {
        return e instanceof Constant && ((Constant)e).getName().equals(name);
    }

    /**
     * Encode a non-negative number.
     * @param value the value
     * @return the numeral term
     */
    @Nonnull
    public static Expr mkNumeral(@Nonnull BigInteger value) {
        if (value.signum() < 0) {
            throw new IllegalArgumentException("numerals are non-negative");
        }
        if (value.signum() == 0) {
            return new Constant(NUM_ZERO);
        }
        return new App(new Constant(NUM_POS), mkPositive(value));
    }

    @Nonnull
    public static Expr mkNumeral(long value) {
        return mkNumeral(BigInteger.valueOf(value));
    }

    @Nonnull
    private static Expr mkPositive(@Nonnull BigInteger value) {
        if (value.equals(BigInteger.ONE)) {
            return new Constant(POS_ONE);
        }
        final Expr rest = mkPositive(value.shiftRight(1));
        return new App(new Constant(value.testBit(0) ? POS_BIT1 : POS_BIT0), rest);
    }
}

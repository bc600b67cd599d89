/*
 * MatchEnvironment.java
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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * The parameter slots of a notation being matched. The pattern variable {@code #i} refers to slot
 * {@code size - i - 1}; rendering consumes the slots from the last one backwards.
 */
final class MatchEnvironment {
    @Nonnull
    private final Expr[] slots;
    private int size;

    MatchEnvironment(int numParameters) {
        this.slots = new Expr[numParameters];
        this.size = numParameters;
    }

    /**
     * Bind the pattern variable {@code #index} to {@code e}, or check that it is already bound to an equal term.
     * @param index the de Bruijn index of the pattern variable
     * @param e the matched term
     * @return whether the binding is consistent
     */
    boolean bind(int index, @Nonnull Expr e) {
        if (index >= size) {
            return false;
        }
        final int slot = size - index - 1;
        if (slots[slot] != null) {
            return slots[slot].equals(e);
        }
        slots[slot] = e;
        return true;
    }

    int remaining() {
        return size;
    }

    /**
     * Remove and return the last pending slot.
     * @return its term, or {@code null} if there is no slot left or it was never filled
     */
    @Nullable
    Expr popLast() {
        if (size == 0) {
            return null;
        }
        size--;
        final Expr e = slots[size];
        slots[size] = null;
        return e;
    }

    @Override
    public String toString() {
        return Arrays.toString(Arrays.copyOf(slots, size));
    }
}

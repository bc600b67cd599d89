/*
 * Var.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nullable;

/**
 * A bound variable, referenced by de Bruijn index.
 */
@API(API.Status.EXPERIMENTAL)
public final class Var extends Expr {
    private final int index;

    public Var(int index) {
        super(index + 1, false, false, false, 31 * index + 7);
        Preconditions.checkArgument(index >= 0, "negative de Bruijn index");
        this.index = index;
    }

    @Override
    public ExprKind getKind() {
        return ExprKind.VAR;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        return o instanceof Var && ((Var)o).index == index;
    }
}

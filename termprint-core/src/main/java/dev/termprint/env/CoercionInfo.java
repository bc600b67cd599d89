/*
 * CoercionInfo.java
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
import dev.termprint.term.Name;

import javax.annotation.Nonnull;

/**
 * A registered coercion function: the class it coerces into and the number of arguments that precede the coerced
 * value.
 */
@API(API.Status.EXPERIMENTAL)
public final class CoercionInfo {
    @Nonnull
    private final Name targetClass;
    private final int numArgs;

    public CoercionInfo(@Nonnull Name targetClass, int numArgs) {
        this.targetClass = targetClass;
        this.numArgs = numArgs;
    }

    @Nonnull
    public Name getTargetClass() {
        return targetClass;
    }

    /**
     * The arity cutoff: applications with more arguments than this are coercion applications.
     * @return the number of leading arguments
     */
    public int getNumArgs() {
        return numArgs;
    }

    @Override
    public String toString() {
        return "coercion to " + targetClass + "/" + numArgs;
    }
}

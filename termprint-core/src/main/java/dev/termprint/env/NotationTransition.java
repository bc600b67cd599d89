/*
 * NotationTransition.java
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

import javax.annotation.Nonnull;

/**
 * One step of a notation: a token followed by an action.
 */
@API(API.Status.EXPERIMENTAL)
public final class NotationTransition {
    @Nonnull
    private final String token;
    @Nonnull
    private final NotationAction action;

    public NotationTransition(@Nonnull String token, @Nonnull NotationAction action) {
        this.token = token;
        this.action = action;
    }

    @Nonnull
    public static NotationTransition skip(@Nonnull String token) {
        return new NotationTransition(token, NotationAction.skip());
    }

    @Nonnull
    public static NotationTransition expr(@Nonnull String token, int rbp) {
        return new NotationTransition(token, NotationAction.expr(rbp));
    }

    @Nonnull
    public String getToken() {
        return token;
    }

    @Nonnull
    public NotationAction getAction() {
        return action;
    }

    @Override
    public String toString() {
        return "'" + token + "' " + action;
    }
}

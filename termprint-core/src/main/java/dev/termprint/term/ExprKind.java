/*
 * ExprKind.java
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

/**
 * The base variants of {@link Expr}. Annotations such as {@code have} or {@code show} are layered over these as
 * {@link #MACRO} terms, see {@link Annotations}.
 */
@API(API.Status.EXPERIMENTAL)
public enum ExprKind {
    VAR,
    SORT,
    CONSTANT,
    META,
    LOCAL,
    APP,
    LAMBDA,
    PI,
    MACRO
}

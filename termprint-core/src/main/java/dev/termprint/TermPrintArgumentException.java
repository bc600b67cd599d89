/*
 * TermPrintArgumentException.java
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

package dev.termprint;

import dev.termprint.annotation.API;

import javax.annotation.Nonnull;

/**
 * Functional equivalent of <code>IllegalArgumentException</code>.
 */
@API(API.Status.UNSTABLE)
public class TermPrintArgumentException extends TermPrintException {
    private static final long serialVersionUID = 1;

    public TermPrintArgumentException(@Nonnull String msg, @Nonnull Object... keyValue) {
        super(msg, keyValue);
    }

    public TermPrintArgumentException(@Nonnull String msg, @Nonnull Throwable cause) {
        super(msg, cause);
    }
}

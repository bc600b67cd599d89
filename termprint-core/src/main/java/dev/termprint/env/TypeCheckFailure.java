/*
 * TypeCheckFailure.java
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
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Why a type-checker query could not be answered.
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeCheckFailure {
    /**
     * Failure categories.
     */
    public enum Reason {
        /** The term has loose bound variables. */
        OPEN_TERM,
        /** A constant is not declared in the environment. */
        UNKNOWN_CONSTANT,
        /** A term was expected to be a function or product and is not. */
        NOT_A_PRODUCT,
        /** A term was expected to be a type and is not. */
        NOT_A_TYPE,
        /** The checker does not handle this kind of term. */
        UNSUPPORTED
    }

    @Nonnull
    private final Reason reason;
    @Nonnull
    private final String message;

    public TypeCheckFailure(@Nonnull Reason reason, @Nonnull String message) {
        this.reason = reason;
        this.message = message;
    }

    @Nonnull
    public Reason getReason() {
        return reason;
    }

    @Nonnull
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final TypeCheckFailure other = (TypeCheckFailure)o;
        return reason == other.reason && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(reason, message);
    }

    @Override
    public String toString() {
        return reason + ": " + message;
    }
}

/*
 * TypeCheckResult.java
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
import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;
import java.util.function.Function;

/**
 * The answer to a type-checker query: either a value or a {@link TypeCheckFailure}. Exactly one of
 * {@link #getValue()} and {@link #getFailure()} is available. Ordinary failures (unknown constants, open terms,
 * non-products) are reported this way instead of being thrown.
 *
 * @param <T> the type of a successful answer
 */
@API(API.Status.EXPERIMENTAL)
public final class TypeCheckResult<T> {
    @Nullable
    private final T value;
    @Nullable
    private final TypeCheckFailure failure;

    private TypeCheckResult(@Nullable T value, @Nullable TypeCheckFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    @Nonnull
    public static <T> TypeCheckResult<T> success(@Nonnull T value) {
        return new TypeCheckResult<>(Objects.requireNonNull(value), null);
    }

    @Nonnull
    public static <T> TypeCheckResult<T> failure(@Nonnull TypeCheckFailure failure) {
        return new TypeCheckResult<>(null, Objects.requireNonNull(failure));
    }

    @Nonnull
    public static <T> TypeCheckResult<T> failure(@Nonnull TypeCheckFailure.Reason reason, @Nonnull String message) {
        return failure(new TypeCheckFailure(reason, message));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * The successful answer.
     * @return the value
     * @throws IllegalStateException if this result is a failure
     */
    @Nonnull
    public T getValue() {
        Preconditions.checkState(value != null, "failed result has no value: %s", failure);
        return value;
    }

    /**
     * The failure.
     * @return the failure
     * @throws IllegalStateException if this result is a success
     */
    @Nonnull
    public TypeCheckFailure getFailure() {
        Preconditions.checkState(failure != null, "successful result has no failure");
        return failure;
    }

    /**
     * Transform a successful answer; a failure is passed through.
     * @param fn the transformation
     * @param <U> the new value type
     * @return the transformed result
     */
    @Nonnull
    public <U> TypeCheckResult<U> map(@Nonnull Function<? super T, ? extends U> fn) {
        if (failure != null) {
            return failure(failure);
        }
        return success(fn.apply(Objects.requireNonNull(value)));
    }

    /**
     * Chain a further query on a successful answer; a failure is passed through.
     * @param fn the next query
     * @param <U> the new value type
     * @return the result of the next query, or this failure
     */
    @Nonnull
    public <U> TypeCheckResult<U> flatMap(@Nonnull Function<? super T, TypeCheckResult<U>> fn) {
        if (failure != null) {
            return failure(failure);
        }
        return fn.apply(Objects.requireNonNull(value));
    }

    @Nonnull
    public T orElse(@Nonnull T other) {
        return value != null ? value : other;
    }

    @Override
    public String toString() {
        return failure == null ? "success(" + value + ")" : "failure(" + failure + ")";
    }
}

/*
 * TypeCheckResultTest.java
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

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link TypeCheckResult}.
 */
public class TypeCheckResultTest {

    @Test
    public void successChains() {
        final TypeCheckResult<Integer> result = TypeCheckResult.success(20)
                .map(i -> i + 1)
                .flatMap(i -> TypeCheckResult.success(i * 2));
        assertThat(result.getValue(), equalTo(42));
        assertThat(result.orElse(0), equalTo(42));
    }

    @Test
    public void failureShortCircuits() {
        final TypeCheckFailure failure = new TypeCheckFailure(TypeCheckFailure.Reason.NOT_A_TYPE, "nope");
        final TypeCheckResult<Integer> result = TypeCheckResult.<Integer>failure(failure)
                .map(i -> i + 1)
                .flatMap(i -> TypeCheckResult.success(i * 2));
        assertThat(result.isSuccess(), equalTo(false));
        assertThat(result.getFailure(), sameInstance(failure));
        assertThat(result.orElse(7), equalTo(7));
        assertThrows(IllegalStateException.class, result::getValue);
        assertThrows(IllegalStateException.class, () -> TypeCheckResult.success(1).getFailure());
    }
}

/*
 * API.java
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

package dev.termprint.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks how stable a public type, method, constructor or field of TermPrint is for code outside the project.
 *
 * <p>
 * Members inherit the status of the enclosing type unless they carry an annotation of their own. A status may move
 * towards {@link Status#STABLE} at any time. Moving an element to a less stable status is only allowed at the points
 * that the element's current status documents.
 * </p>
 */
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
@Retention(RetentionPolicy.CLASS)
@Documented
public @interface API {
    /**
     * The stability of the annotated element.
     * @return the stability status
     */
    Status value();

    /**
     * Stability levels, ordered from least to most stable.
     */
    enum Status {
        /**
         * Public only so that other TermPrint packages can reach it. Renderers and helpers of the printer live here.
         * May change in any release.
         */
        INTERNAL,

        /**
         * Scheduled for removal. May be removed with the next minor release.
         */
        DEPRECATED,

        /**
         * New surface that has not settled yet. Callers outside the project should expect changes without notice.
         */
        EXPERIMENTAL,

        /**
         * May change in the next minor release, but not within a patch release.
         */
        UNSTABLE,

        /**
         * Only changed incompatibly with the next major release.
         */
        MAINTAINED,

        /**
         * Public API that stays binary compatible until the next major release.
         */
        STABLE
    }
}

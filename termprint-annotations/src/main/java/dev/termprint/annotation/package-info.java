/*
 * package-info.java
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

/**
 * Annotations shared by all TermPrint modules. See {@link dev.termprint.annotation.API}.
 */
package dev.termprint.annotation;

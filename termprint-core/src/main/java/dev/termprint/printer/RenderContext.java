/*
 * RenderContext.java
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

package dev.termprint.printer;

import dev.termprint.annotation.API;
import dev.termprint.term.Name;

import javax.annotation.Nonnull;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The mutable state of one top-level print call: depth and step counters, the purification tables and the names
 * already handed out. A context is created when the call starts and dropped when it returns; it is never shared
 * between calls.
 */
@API(API.Status.INTERNAL)
public final class RenderContext {
    private static final Name META_PREFIX = Name.of("M");
    private static final Name LOCAL_ID_PREFIX = Name.of("_pp");

    private int depth;
    private int steps;
    private int maxDepthSeen;
    private int truncations;
    private int nextMetaIndex = 1;
    private int nextLocalId;
    @Nonnull
    private final Map<Name, Name> metaNames = new HashMap<>();
    @Nonnull
    private final Map<Name, Name> localNames = new HashMap<>();
    @Nonnull
    private final Set<Name> usedNames = new HashSet<>();

    public int getDepth() {
        return depth;
    }

    public int getSteps() {
        return steps;
    }

    public int getMaxDepthSeen() {
        return maxDepthSeen;
    }

    /**
     * How many times a subterm was replaced by an ellipsis.
     * @return the number of truncations
     */
    public int getTruncations() {
        return truncations;
    }

    /**
     * Whether rendering must stop at this point.
     * @param configuration the limits
     * @return {@code true} if the depth or the step limit was exceeded
     */
    boolean isExhausted(@Nonnull PrinterConfiguration configuration) {
        return depth > configuration.getMaxDepth() || steps > configuration.getMaxSteps();
    }

    void recordTruncation() {
        truncations++;
    }

    void enter() {
        depth++;
        steps++;
        if (depth > maxDepthSeen) {
            maxDepthSeen = depth;
        }
    }

    void exit() {
        depth--;
    }

    /**
     * The display name of a metavariable, assigned {@code M_1}, {@code M_2}, ... in order of first request.
     * @param id the metavariable identity
     * @return its display name
     */
    @Nonnull
    public Name getMetavarName(@Nonnull Name id) {
        final Name existing = metaNames.get(id);
        if (existing != null) {
            return existing;
        }
        final Name name = META_PREFIX.appendAfter(nextMetaIndex);
        nextMetaIndex++;
        metaNames.put(id, name);
        return name;
    }

    /**
     * The display name of a local constant: its suggested name unless another local already took it, in which case
     * the first free {@code suggested_i}.
     * @param id the local identity
     * @param suggested the name the local carries
     * @return its display name
     */
    @Nonnull
    public Name getLocalName(@Nonnull Name id, @Nonnull Name suggested) {
        final Name existing = localNames.get(id);
        if (existing != null) {
            return existing;
        }
        final Name name = pickFree(suggested, Set.of());
        localNames.put(id, name);
        return name;
    }

    /**
     * Choose a binder name not yet handed out in this call and not in {@code avoid}, and reserve it.
     * @param suggested the preferred name
     * @param avoid further names to avoid
     * @return the chosen name
     */
    @Nonnull
    public Name getFreshBinderName(@Nonnull Name suggested, @Nonnull Set<Name> avoid) {
        return pickFree(suggested, avoid);
    }

    @Nonnull
    private Name pickFree(@Nonnull Name suggested, @Nonnull Set<Name> avoid) {
        Name name = suggested;
        int i = 1;
        while (usedNames.contains(name) || avoid.contains(name)) {
            name = suggested.appendAfter(i);
            i++;
        }
        usedNames.add(name);
        return name;
    }

    @Nonnull
    Name newLocalId() {
        nextLocalId++;
        return LOCAL_ID_PREFIX.appendAfter(nextLocalId);
    }
}

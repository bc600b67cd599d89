/*
 * Name.java
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
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A hierarchical identifier such as {@code nat.add}. Names are immutable; the anonymous name has no components.
 * Components are plain strings and never contain a {@code .}.
 */
@API(API.Status.EXPERIMENTAL)
public final class Name implements Comparable<Name> {
    @Nonnull
    public static final Name ANONYMOUS = new Name(ImmutableList.of());

    private static final Joiner DOT_JOINER = Joiner.on('.');
    private static final Splitter DOT_SPLITTER = Splitter.on('.').omitEmptyStrings();

    @Nonnull
    private final ImmutableList<String> components;

    private Name(@Nonnull ImmutableList<String> components) {
        this.components = components;
    }

    /**
     * Build a name from its components. Each component may itself be dotted, {@code of("nat.add")} and
     * {@code of("nat", "add")} denote the same name.
     * @param components the components, outermost first
     * @return the name
     */
    @Nonnull
    public static Name of(@Nonnull String... components) {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (String component : components) {
            builder.addAll(DOT_SPLITTER.split(component));
        }
        final ImmutableList<String> parts = builder.build();
        return parts.isEmpty() ? ANONYMOUS : new Name(parts);
    }

    @Nonnull
    public List<String> getComponents() {
        return components;
    }

    public boolean isAnonymous() {
        return components.isEmpty();
    }

    public boolean isAtomic() {
        return components.size() == 1;
    }

    @Nonnull
    public Name getPrefix() {
        return components.size() <= 1 ? ANONYMOUS : new Name(components.subList(0, components.size() - 1));
    }

    @Nonnull
    public String getLast() {
        Preconditions.checkState(!isAnonymous(), "anonymous name has no components");
        return components.get(components.size() - 1);
    }

    @Nonnull
    public Name append(@Nonnull Name other) {
        if (other.isAnonymous()) {
            return this;
        }
        if (isAnonymous()) {
            return other;
        }
        return new Name(ImmutableList.<String>builder().addAll(components).addAll(other.components).build());
    }

    @Nonnull
    public Name append(@Nonnull String component) {
        return append(Name.of(component));
    }

    /**
     * Append {@code _i} to the last component, {@code x.appendAfter(2)} is {@code x_2}.
     * @param i the suffix
     * @return the suffixed name
     */
    @Nonnull
    public Name appendAfter(int i) {
        return appendAfter("_" + i);
    }

    @Nonnull
    public Name appendAfter(@Nonnull String suffix) {
        if (isAnonymous()) {
            return Name.of(suffix);
        }
        return getPrefix().append(new Name(ImmutableList.of(getLast() + suffix)));
    }

    public boolean isPrefixOf(@Nonnull Name other) {
        return components.size() <= other.components.size()
                && other.components.subList(0, components.size()).equals(components);
    }

    /**
     * Replace {@code prefix} by {@code newPrefix} if this name starts with {@code prefix}.
     * @param prefix the prefix to strip
     * @param newPrefix the prefix to put in its place
     * @return the rewritten name, or this name if {@code prefix} is not a prefix of it
     */
    @Nonnull
    public Name replacePrefix(@Nonnull Name prefix, @Nonnull Name newPrefix) {
        if (prefix.isAnonymous() || !prefix.isPrefixOf(this)) {
            return this;
        }
        final List<String> rest = components.subList(prefix.components.size(), components.size());
        return newPrefix.append(rest.isEmpty() ? ANONYMOUS : new Name(ImmutableList.copyOf(rest)));
    }

    @Override
    public int compareTo(@Nonnull Name other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return components.equals(((Name)o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    @Override
    public String toString() {
        return isAnonymous() ? "[anonymous]" : DOT_JOINER.join(components);
    }
}

/*
 * PrinterOptions.java
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

import dev.termprint.TermPrintArgumentException;
import dev.termprint.annotation.API;
import dev.termprint.logging.LogMessageKeys;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * The named options controlling the printer. An options object is immutable; {@link #withOption(Name, Object)} and
 * the {@link Builder} produce new ones. Values are validated when they are set.
 */
@API(API.Status.EXPERIMENTAL)
public final class PrinterOptions {
    /**
     * Option names, with their property key, value type and default.
     */
    public enum Name {
        /** Indentation of continuation lines. */
        INDENT("pp.indent", Integer.class, 2),
        /** Maximum nesting depth before the rest of a term is elided. */
        MAX_DEPTH("pp.max_depth", Integer.class, 1000),
        /** Maximum number of rendering steps before the rest of a term is elided. */
        MAX_STEPS("pp.max_steps", Integer.class, 10000),
        /** Show implicit arguments. */
        IMPLICIT("pp.implicit", Boolean.class, false),
        UNICODE("pp.unicode", Boolean.class, true),
        /** Show coercion functions. */
        COERCIONS("pp.coercions", Boolean.class, false),
        NOTATION("pp.notation", Boolean.class, true),
        /** Show universe levels of sorts and constants. */
        UNIVERSES("pp.universes", Boolean.class, false),
        /** Print constants with their full names, ignoring aliases and open namespaces. */
        FULL_NAMES("pp.full_names", Boolean.class, false),
        /** Print private constants with their internal names. */
        PRIVATE_NAMES("pp.private_names", Boolean.class, false),
        /** Show the arguments of applied metavariables. */
        METAVAR_ARGS("pp.metavar_args", Boolean.class, false),
        /** Beta reduce terms before printing. */
        BETA("pp.beta", Boolean.class, false);

        @Nonnull
        private final String key;
        @Nonnull
        private final Class<?> type;
        @Nonnull
        private final Object defaultValue;

        Name(@Nonnull String key, @Nonnull Class<?> type, @Nonnull Object defaultValue) {
            this.key = key;
            this.type = type;
            this.defaultValue = defaultValue;
        }

        @Nonnull
        public String getKey() {
            return key;
        }

        @Nonnull
        public Class<?> getType() {
            return type;
        }

        @Nonnull
        public Object getDefaultValue() {
            return defaultValue;
        }

        /**
         * Look up an option by its property key.
         * @param key a key such as {@code pp.indent}
         * @return the option, or {@code null} if there is none with that key
         */
        @Nullable
        public static Name fromKey(@Nonnull String key) {
            for (Name name : values()) {
                if (name.key.equals(key)) {
                    return name;
                }
            }
            return null;
        }
    }

    private static final String KEY_PREFIX = "pp.";

    public static final PrinterOptions DEFAULT = builder().build();

    @Nonnull
    private final Map<Name, Object> optionsMap;

    private PrinterOptions(@Nonnull Map<Name, Object> optionsMap) {
        this.optionsMap = optionsMap;
    }

    @Nonnull
    public static PrinterOptions defaults() {
        return DEFAULT;
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    @Nonnull
    public Object getOption(@Nonnull Name name) {
        final Object value = optionsMap.get(name);
        return value != null ? value : name.getDefaultValue();
    }

    public int getInt(@Nonnull Name name) {
        return (Integer)getOption(name);
    }

    public boolean getBoolean(@Nonnull Name name) {
        return (Boolean)getOption(name);
    }

    /**
     * A copy of these options with one option changed.
     * @param name the option
     * @param value its new value
     * @return the new options
     * @throws TermPrintArgumentException if the value is not valid for the option
     */
    @Nonnull
    public PrinterOptions withOption(@Nonnull Name name, @Nonnull Object value) {
        return builder().fromOptions(this).withOption(name, value).build();
    }

    /**
     * Read options from properties keyed like {@code pp.indent}. Keys outside the {@code pp.} namespace are ignored.
     * @param properties the properties, possibly {@code null}
     * @return the options
     * @throws TermPrintArgumentException on an unknown {@code pp.} key or an invalid value
     */
    @Nonnull
    public static PrinterOptions fromProperties(@Nullable Properties properties) {
        if (properties == null) {
            return DEFAULT;
        }
        final Builder builder = builder();
        for (String key : properties.stringPropertyNames()) {
            if (!key.startsWith(KEY_PREFIX)) {
                continue;
            }
            final Name name = Name.fromKey(key);
            if (name == null) {
                throw new TermPrintArgumentException("unknown printer option", LogMessageKeys.OPTION, key);
            }
            builder.withOptionFromString(name, properties.getProperty(key));
        }
        return builder.build();
    }

    @Nonnull
    public Properties toProperties() {
        final Properties properties = new Properties();
        for (Map.Entry<Name, Object> entry : optionsMap.entrySet()) {
            properties.setProperty(entry.getKey().getKey(), entry.getValue().toString());
        }
        return properties;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrinterOptions)) {
            return false;
        }
        return optionsMap.equals(((PrinterOptions)o).optionsMap);
    }

    @Override
    public int hashCode() {
        return optionsMap.hashCode();
    }

    @Override
    public String toString() {
        return optionsMap.toString();
    }

    /**
     * Builder for {@link PrinterOptions}.
     */
    public static final class Builder {
        @Nonnull
        private final Map<Name, Object> optionsMap = new EnumMap<>(Name.class);

        private Builder() {
        }

        @Nonnull
        public Builder fromOptions(@Nonnull PrinterOptions options) {
            optionsMap.putAll(options.optionsMap);
            return this;
        }

        @Nonnull
        public Builder withOption(@Nonnull Name name, @Nonnull Object value) {
            validateOption(name, value);
            optionsMap.put(name, value);
            return this;
        }

        @Nonnull
        public Builder withOptionFromString(@Nonnull Name name, @Nonnull String valueAsString) {
            return withOption(name, parseStringOption(name, valueAsString));
        }

        @Nonnull
        public PrinterOptions build() {
            return new PrinterOptions(ImmutableMap.copyOf(optionsMap));
        }
    }

    private static void validateOption(@Nonnull Name name, @Nullable Object value) {
        if (!name.getType().isInstance(value)) {
            throw new TermPrintArgumentException("invalid printer option type",
                    LogMessageKeys.OPTION, name.getKey(), LogMessageKeys.VALUE, value);
        }
        if (value instanceof Integer && (Integer)value < 0) {
            throw new TermPrintArgumentException("printer option must not be negative",
                    LogMessageKeys.OPTION, name.getKey(), LogMessageKeys.VALUE, value);
        }
    }

    @Nonnull
    private static Object parseStringOption(@Nonnull Name name, @Nonnull String valueAsString) {
        final String trimmed = valueAsString.trim();
        if (name.getType() == Boolean.class) {
            final String lower = trimmed.toLowerCase(Locale.ROOT);
            if ("true".equals(lower) || "false".equals(lower)) {
                return Boolean.valueOf(lower);
            }
        } else {
            try {
                return Integer.valueOf(trimmed);
            } catch (NumberFormatException e) {
                throw new TermPrintArgumentException("invalid printer option value", e)
                        .addLogInfo(LogMessageKeys.OPTION.toString(), name.getKey());
            }
        }
        throw new TermPrintArgumentException("invalid printer option value",
                LogMessageKeys.OPTION, name.getKey(), LogMessageKeys.VALUE, valueAsString);
    }
}

/*
 * LogAppenderRule.java
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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Captures the events one class logs while a test runs, raising that logger to the requested level for the duration.
 */
public class LogAppenderRule implements BeforeEachCallback, AfterEachCallback {

    private CapturingAppender appender;
    private Logger logger;
    @Nonnull
    private final String name;
    @Nonnull
    private final Class<?> clazz;
    @Nonnull
    private final Level level;
    private Level levelBefore;

    private static class CapturingAppender extends AbstractAppender {
        private final List<LogEvent> events = new ArrayList<>();

        CapturingAppender(String name) {
            super(name, null, null, false, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return events;
        }
    }

    public LogAppenderRule(@Nonnull String name, @Nonnull Class<?> clazz, @Nonnull Level level) {
        this.name = name;
        this.clazz = clazz;
        this.level = level;
    }

    @Override
    public void beforeEach(ExtensionContext context) {
        appender = new CapturingAppender(name);
        logger = (Logger)LogManager.getLogger(clazz);
        levelBefore = logger.getLevel();
        logger.addAppender(appender);
        appender.start();
        // through the configuration, so appenders added by other rules do not reset it
        Configurator.setLevel(clazz.getName(), level);
    }

    @Override
    public void afterEach(ExtensionContext context) {
        if (appender != null) {
            appender.stop();
        }
        if (logger != null) {
            logger.removeAppender(appender);
            Configurator.setLevel(clazz.getName(), levelBefore);
        }
    }

    public List<LogEvent> getLogEvents() {
        return appender.getEvents();
    }

    public List<String> getLogMessages() {
        return getLogEvents().stream()
                .map(event -> event.getMessage().getFormattedMessage())
                .collect(Collectors.toList());
    }
}

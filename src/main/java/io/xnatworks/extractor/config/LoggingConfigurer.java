/*
 * DICOM Metadata Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Applies the log level and optional log file from {@link ExtractorConfig}
 * to the Logback context. Console output comes from logback.xml.
 */
public final class LoggingConfigurer {
    private static final Logger log = LoggerFactory.getLogger(LoggingConfigurer.class);

    static final String FILE_APPENDER_NAME = "EXTRACTOR_FILE";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

    private LoggingConfigurer() {
    }

    /**
     * Set the root log level; unknown names fall back to INFO, null leaves the level alone.
     */
    public static void applyLevel(String level) {
        if (level == null || !(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
    }

    public static void apply(ExtractorConfig config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            log.debug("Logback is not the active SLF4J binding; leaving logging configuration alone");
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        applyLevel(config.getLogLevel());

        if (config.getLogFile() != null && !config.getLogFile().isBlank()
                && root.getAppender(FILE_APPENDER_NAME) == null) {
            Path logFile = Paths.get(config.getLogFile()).toAbsolutePath();
            try {
                Files.createDirectories(logFile.getParent());
            } catch (IOException e) {
                log.warn("Cannot create log directory for {}: {}", logFile, e.getMessage());
                return;
            }

            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(context);
            encoder.setPattern(FILE_PATTERN);
            encoder.start();

            FileAppender<ILoggingEvent> appender = new FileAppender<>();
            appender.setName(FILE_APPENDER_NAME);
            appender.setContext(context);
            appender.setFile(logFile.toString());
            appender.setAppend(true);
            appender.setEncoder(encoder);
            appender.start();

            root.addAppender(appender);
            log.info("Logging to file: {}", logFile);
        }
    }
}

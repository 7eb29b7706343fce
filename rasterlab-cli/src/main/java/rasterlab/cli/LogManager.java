/*-
 * #%L
 * This file is part of RasterLab.
 * %%
 * Copyright (C) 2024 - 2026 RasterLab developers
 * %%
 * RasterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * RasterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with RasterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package rasterlab.cli;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Helper class for setting the log level and log file from the command line.
 * <p>
 * This requires Logback; if another SLF4J binding is used, requests are logged and ignored.
 *
 * @author RasterLab developers
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * No log messages
		 */
		OFF
	}

	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}

	static Level getLevel(LogLevel logLevel) {
		switch (logLevel) {
		case TRACE:
			return Level.TRACE;
		case DEBUG:
			return Level.DEBUG;
		case WARN:
			return Level.WARN;
		case ERROR:
			return Level.ERROR;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case INFO:
		default:
			return Level.INFO;
		}
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		else
			return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

	/**
	 * Set the root log level.
	 * @param logLevel
	 */
	public static void setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(logLevel));
		else
			logger.warn("Cannot set log level to {} without logback!", logLevel);
	}

	/**
	 * Get the current root log level, or null if this cannot be determined.
	 * @return
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		for (var level : LogLevel.values()) {
			if (getLevel(level).equals(root.getLevel()))
				return level;
		}
		return null;
	}

	/**
	 * Send log messages to the specified file, in addition to any existing output.
	 * @param file
	 */
	public static void logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to {} without logback!", file);
			return;
		}
		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n");
		encoder.start();

		FileAppender<ILoggingEvent> appender = new FileAppender<>();
		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(file.getName());
		appender.start();

		getRootLogger().addAppender(appender);
		logger.debug("Logging to file {}", file.getAbsolutePath());
	}

}

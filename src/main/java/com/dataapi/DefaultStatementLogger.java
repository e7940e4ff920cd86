/*
 * Copyright 2026 The Data API Client Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.dataapi;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Basic implementation of {@link StatementLogger} which logs via
 * <a href="https://docs.oracle.com/en/java/javase/17/docs/api/java.logging/java/util/logging/package-summary.html">java.util.logging</a>.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DefaultStatementLogger implements StatementLogger {
	@NonNull
	public static final String DEFAULT_LOGGER_NAME = "com.dataapi.SQL";
	@NonNull
	public static final Level DEFAULT_LOGGER_LEVEL = Level.FINE;

	/**
	 * The point at which we ellipsize output for parameters.
	 */
	private static final int MAXIMUM_PARAMETER_LOGGING_LENGTH = 100;

	@NonNull
	private final Logger logger;
	@NonNull
	private final Level loggerLevel;

	/**
	 * Creates a new statement logger with the default logger name <code>{@value #DEFAULT_LOGGER_NAME}</code> and level.
	 */
	public DefaultStatementLogger() {
		this(DEFAULT_LOGGER_NAME, DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Creates a new statement logger with the given logger name and level.
	 *
	 * @param loggerName  the logger name to use
	 * @param loggerLevel the logger level to use
	 */
	public DefaultStatementLogger(@NonNull String loggerName,
																@NonNull Level loggerLevel) {
		requireNonNull(loggerName);
		requireNonNull(loggerLevel);

		this.logger = Logger.getLogger(loggerName);
		this.loggerLevel = loggerLevel;
	}

	@Override
	public void log(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		if (getLogger().isLoggable(getLoggerLevel()))
			getLogger().log(getLoggerLevel(), formatStatementLog(statementLog));
	}

	@NonNull
	protected String formatStatementLog(@NonNull StatementLog statementLog) {
		requireNonNull(statementLog);

		List<String> timingEntries = new ArrayList<>(2);

		if (statementLog.getExecutionDuration().isPresent())
			timingEntries.add(format("%s executing statement", statementLog.getExecutionDuration().get()));

		if (statementLog.getDecodingDuration().isPresent())
			timingEntries.add(format("%s decoding results", statementLog.getDecodingDuration().get()));

		List<String> lines = new ArrayList<>(6);

		lines.add(statementLog.getSql());

		List<List<SqlParameter>> parameterSets = statementLog.getParameterSets();

		if (parameterSets.size() == 1 && !parameterSets.get(0).isEmpty()) {
			lines.add(format("Parameters: %s", formatParameters(parameterSets.get(0))));
		} else if (parameterSets.size() > 1) {
			// Only the first row, batches can be large
			lines.add(format("Batch of %d parameter sets, first: %s", parameterSets.size(), formatParameters(parameterSets.get(0))));
		}

		if (statementLog.getTransactionId().isPresent())
			lines.add(format("Transaction ID: %s", statementLog.getTransactionId().get()));

		if (timingEntries.size() > 0)
			lines.add(timingEntries.stream().collect(joining(", ")));

		Throwable exception = statementLog.getException().orElse(null);

		if (exception != null)
			lines.add(format("Failed due to %s", exception.toString()));

		return lines.stream().collect(joining("\n"));
	}

	@NonNull
	protected String formatParameters(@NonNull List<SqlParameter> parameters) {
		requireNonNull(parameters);

		return parameters.stream().map(parameter -> {
			Field field = parameter.getValue();
			String value;

			if (field.isNull())
				value = "null";
			else if (field.getType() == FieldType.BLOB_VALUE)
				value = format("[byte array of length %d]", ((byte[]) field.getValue()).length);
			else if (field.getValue() instanceof Number || field.getValue() instanceof Boolean)
				value = format("%s", field.getValue());
			else
				value = format("'%s'", ellipsize(field.getValue().toString(), MAXIMUM_PARAMETER_LOGGING_LENGTH));

			return format(":%s=%s", parameter.getName(), value);
		}).collect(joining(", "));
	}

	/**
	 * Ellipsizes the given {@code string}, capping at {@code maximumLength}.
	 *
	 * @param string        the string to ellipsize
	 * @param maximumLength the maximum length of the ellipsized string, not including ellipsis
	 * @return an ellipsized version of {@code string}
	 */
	@NonNull
	protected String ellipsize(@NonNull String string,
														 int maximumLength) {
		requireNonNull(string);

		string = string.trim();

		if (string.length() <= maximumLength)
			return string;

		return format("%s...", string.substring(0, maximumLength));
	}

	@NonNull
	protected Logger getLogger() {
		return this.logger;
	}

	@NonNull
	protected Level getLoggerLevel() {
		return this.loggerLevel;
	}
}

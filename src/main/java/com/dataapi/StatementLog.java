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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A collection of Data API statement execution diagnostics.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class StatementLog {
	@NonNull
	private final String sql;
	@NonNull
	private final List<List<SqlParameter>> parameterSets;
	@Nullable
	private final String database;
	@Nullable
	private final String transactionId;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration decodingDuration;
	@Nullable
	private final Integer batchSize;
	@Nullable
	private final Throwable exception;

	private StatementLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.database = builder.database;
		this.transactionId = builder.transactionId;
		this.executionDuration = builder.executionDuration;
		this.decodingDuration = builder.decodingDuration;
		this.batchSize = builder.batchSize;
		this.exception = builder.exception;

		List<List<SqlParameter>> parameterSets = new ArrayList<>(builder.parameterSets.size());

		for (List<SqlParameter> parameterSet : builder.parameterSets)
			parameterSets.add(List.copyOf(parameterSet));

		this.parameterSets = Collections.unmodifiableList(parameterSets);

		Duration totalDuration = Duration.ZERO;

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.decodingDuration != null)
			totalDuration = totalDuration.plus(this.decodingDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link StatementLog} builder for the given {@code sql}.
	 *
	 * @param sql the SQL that was sent, after identifier and cast rewriting
	 * @return a {@link StatementLog} builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("sql=%s", getSql()));

		if (!getParameterSets().isEmpty())
			components.add(format("parameterSets=%s", getParameterSets()));

		components.add(format("totalDuration=%s", getTotalDuration()));

		getDatabase().ifPresent(database -> components.add(format("database=%s", database)));
		getTransactionId().ifPresent(transactionId -> components.add(format("transactionId=%s", transactionId)));
		getExecutionDuration().ifPresent(executionDuration -> components.add(format("executionDuration=%s", executionDuration)));
		getDecodingDuration().ifPresent(decodingDuration -> components.add(format("decodingDuration=%s", decodingDuration)));
		getBatchSize().ifPresent(batchSize -> components.add(format("batchSize=%s", batchSize)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementLog))
			return false;

		StatementLog statementLog = (StatementLog) object;

		return Objects.equals(getSql(), statementLog.getSql())
				&& Objects.equals(getParameterSets(), statementLog.getParameterSets())
				&& Objects.equals(getDatabase(), statementLog.getDatabase())
				&& Objects.equals(getTransactionId(), statementLog.getTransactionId())
				&& Objects.equals(getExecutionDuration(), statementLog.getExecutionDuration())
				&& Objects.equals(getDecodingDuration(), statementLog.getDecodingDuration())
				&& Objects.equals(getBatchSize(), statementLog.getBatchSize())
				&& Objects.equals(getException(), statementLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameterSets(), getDatabase(), getTransactionId(), getExecutionDuration(),
				getDecodingDuration(), getBatchSize(), getException());
	}

	/**
	 * The SQL statement that was sent.
	 *
	 * @return the SQL statement that was sent
	 */
	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * The encoded parameters that were sent, one list per row.
	 *
	 * @return the encoded parameters
	 */
	@NonNull
	public List<List<SqlParameter>> getParameterSets() {
		return this.parameterSets;
	}

	@NonNull
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getTransactionId() {
		return Optional.ofNullable(this.transactionId);
	}

	/**
	 * How long did the Data API call take, including any retries?
	 *
	 * @return how long the call took, if available
	 */
	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to decode the response?
	 *
	 * @return how long decoding took, if available
	 */
	@NonNull
	public Optional<Duration> getDecodingDuration() {
		return Optional.ofNullable(this.decodingDuration);
	}

	/**
	 * How long did the statement take in total?
	 * <p>
	 * This is the sum of {@link #getExecutionDuration()} and {@link #getDecodingDuration()}.
	 *
	 * @return how long the statement took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<Integer> getBatchSize() {
		return Optional.ofNullable(this.batchSize);
	}

	/**
	 * The failure that occurred during statement execution.
	 *
	 * @return the failure, if one occurred
	 */
	@NonNull
	public Optional<Throwable> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link StatementLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String sql;
		@NonNull
		private List<List<SqlParameter>> parameterSets;
		@Nullable
		private String database;
		@Nullable
		private String transactionId;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration decodingDuration;
		@Nullable
		private Integer batchSize;
		@Nullable
		private Throwable exception;

		private Builder(@NonNull String sql) {
			this.sql = requireNonNull(sql);
			this.parameterSets = List.of();
		}

		@NonNull
		public Builder parameterSets(@NonNull List<List<SqlParameter>> parameterSets) {
			this.parameterSets = requireNonNull(parameterSets);
			return this;
		}

		@NonNull
		public Builder database(@Nullable String database) {
			this.database = database;
			return this;
		}

		@NonNull
		public Builder transactionId(@Nullable String transactionId) {
			this.transactionId = transactionId;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder decodingDuration(@Nullable Duration decodingDuration) {
			this.decodingDuration = decodingDuration;
			return this;
		}

		@NonNull
		public Builder batchSize(@Nullable Integer batchSize) {
			this.batchSize = batchSize;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable Throwable exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public StatementLog build() {
			return new StatementLog(this);
		}
	}
}

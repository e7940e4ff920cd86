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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A fully-specified query: SQL, parameters and per-call overrides of client settings.
 * <p>
 * Example usage:
 * <pre>{@code
 * client.query(QueryOptions.withSql("SELECT * FROM ::table WHERE id = :id")
 *   .parameters(Map.of("table", "widget", "id", 42))
 *   .database("inventory")
 *   .hydrateColumnNames(false)
 *   .build());
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryOptions {
	@NonNull
	private final String sql;
	@Nullable
	private final Object parameters;
	@Nullable
	private final String database;
	@Nullable
	private final String schema;
	@Nullable
	private final Boolean hydrateColumnNames;
	private final boolean includeResultMetadata;
	@Nullable
	private final Boolean continueAfterTimeout;
	@Nullable
	private final ResultSetOptions resultSetOptions;
	@Nullable
	private final FormatOptions formatOptions;
	@Nullable
	private final String transactionId;
	@Nullable
	private final String resourceArn;
	@Nullable
	private final String secretArn;

	private QueryOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.sql = requireNonNull(builder.sql);
		this.parameters = builder.parameters;
		this.database = builder.database;
		this.schema = builder.schema;
		this.hydrateColumnNames = builder.hydrateColumnNames;
		this.includeResultMetadata = builder.includeResultMetadata;
		this.continueAfterTimeout = builder.continueAfterTimeout;
		this.resultSetOptions = builder.resultSetOptions;
		this.formatOptions = builder.formatOptions;
		this.transactionId = builder.transactionId;
		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
	}

	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	/**
	 * Acquires a builder initialized with these options.
	 *
	 * @return the builder
	 */
	@NonNull
	public Builder copy() {
		return new Builder(getSql())
				.parameters(this.parameters)
				.database(this.database)
				.schema(this.schema)
				.hydrateColumnNames(this.hydrateColumnNames)
				.includeResultMetadata(this.includeResultMetadata)
				.continueAfterTimeout(this.continueAfterTimeout)
				.resultSetOptions(this.resultSetOptions)
				.formatOptions(this.formatOptions)
				.transactionId(this.transactionId)
				.resourceArn(this.resourceArn)
				.secretArn(this.secretArn);
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * Gets the raw parameter argument, in any shape accepted by {@link ParameterNormalizer}.
	 *
	 * @return the parameters, if any
	 */
	@NonNull
	public Optional<Object> getParameters() {
		return Optional.ofNullable(this.parameters);
	}

	@NonNull
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@NonNull
	public Optional<Boolean> getHydrateColumnNames() {
		return Optional.ofNullable(this.hydrateColumnNames);
	}

	/**
	 * Should column metadata be returned to the caller in {@link QueryResult#getColumnMetadata()}?
	 *
	 * @return {@code true} if column metadata is returned
	 */
	public boolean getIncludeResultMetadata() {
		return this.includeResultMetadata;
	}

	@NonNull
	public Optional<Boolean> getContinueAfterTimeout() {
		return Optional.ofNullable(this.continueAfterTimeout);
	}

	@NonNull
	public Optional<ResultSetOptions> getResultSetOptions() {
		return Optional.ofNullable(this.resultSetOptions);
	}

	@NonNull
	public Optional<FormatOptions> getFormatOptions() {
		return Optional.ofNullable(this.formatOptions);
	}

	@NonNull
	public Optional<String> getTransactionId() {
		return Optional.ofNullable(this.transactionId);
	}

	@NonNull
	public Optional<String> getResourceArn() {
		return Optional.ofNullable(this.resourceArn);
	}

	@NonNull
	public Optional<String> getSecretArn() {
		return Optional.ofNullable(this.secretArn);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryOptions))
			return false;

		QueryOptions queryOptions = (QueryOptions) object;

		return Objects.equals(getSql(), queryOptions.getSql())
				&& Objects.equals(getParameters(), queryOptions.getParameters())
				&& Objects.equals(getDatabase(), queryOptions.getDatabase())
				&& Objects.equals(getSchema(), queryOptions.getSchema())
				&& Objects.equals(getHydrateColumnNames(), queryOptions.getHydrateColumnNames())
				&& getIncludeResultMetadata() == queryOptions.getIncludeResultMetadata()
				&& Objects.equals(getContinueAfterTimeout(), queryOptions.getContinueAfterTimeout())
				&& Objects.equals(getResultSetOptions(), queryOptions.getResultSetOptions())
				&& Objects.equals(getFormatOptions(), queryOptions.getFormatOptions())
				&& Objects.equals(getTransactionId(), queryOptions.getTransactionId())
				&& Objects.equals(getResourceArn(), queryOptions.getResourceArn())
				&& Objects.equals(getSecretArn(), queryOptions.getSecretArn());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameters(), getDatabase(), getSchema(), getHydrateColumnNames(),
				getIncludeResultMetadata(), getContinueAfterTimeout(), getResultSetOptions(), getFormatOptions(),
				getTransactionId(), getResourceArn(), getSecretArn());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(12);

		components.add(format("sql=%s", getSql()));

		if (this.parameters != null)
			components.add(format("parameters=%s", this.parameters));

		if (this.database != null)
			components.add(format("database=%s", this.database));

		if (this.schema != null)
			components.add(format("schema=%s", this.schema));

		if (this.hydrateColumnNames != null)
			components.add(format("hydrateColumnNames=%s", this.hydrateColumnNames));

		if (this.includeResultMetadata)
			components.add("includeResultMetadata=true");

		if (this.continueAfterTimeout != null)
			components.add(format("continueAfterTimeout=%s", this.continueAfterTimeout));

		if (this.resultSetOptions != null)
			components.add(format("resultSetOptions=%s", this.resultSetOptions));

		if (this.formatOptions != null)
			components.add(format("formatOptions=%s", this.formatOptions));

		if (this.transactionId != null)
			components.add(format("transactionId=%s", this.transactionId));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link QueryOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String sql;
		@Nullable
		private Object parameters;
		@Nullable
		private String database;
		@Nullable
		private String schema;
		@Nullable
		private Boolean hydrateColumnNames;
		private boolean includeResultMetadata;
		@Nullable
		private Boolean continueAfterTimeout;
		@Nullable
		private ResultSetOptions resultSetOptions;
		@Nullable
		private FormatOptions formatOptions;
		@Nullable
		private String transactionId;
		@Nullable
		private String resourceArn;
		@Nullable
		private String secretArn;

		private Builder(@NonNull String sql) {
			this.sql = requireNonNull(sql);
		}

		@NonNull
		public Builder parameters(@Nullable Object parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder database(@Nullable String database) {
			this.database = database;
			return this;
		}

		@NonNull
		public Builder schema(@Nullable String schema) {
			this.schema = schema;
			return this;
		}

		@NonNull
		public Builder hydrateColumnNames(@Nullable Boolean hydrateColumnNames) {
			this.hydrateColumnNames = hydrateColumnNames;
			return this;
		}

		@NonNull
		public Builder includeResultMetadata(boolean includeResultMetadata) {
			this.includeResultMetadata = includeResultMetadata;
			return this;
		}

		@NonNull
		public Builder continueAfterTimeout(@Nullable Boolean continueAfterTimeout) {
			this.continueAfterTimeout = continueAfterTimeout;
			return this;
		}

		@NonNull
		public Builder resultSetOptions(@Nullable ResultSetOptions resultSetOptions) {
			this.resultSetOptions = resultSetOptions;
			return this;
		}

		@NonNull
		public Builder formatOptions(@Nullable FormatOptions formatOptions) {
			this.formatOptions = formatOptions;
			return this;
		}

		@NonNull
		public Builder transactionId(@Nullable String transactionId) {
			this.transactionId = transactionId;
			return this;
		}

		@NonNull
		public Builder resourceArn(@Nullable String resourceArn) {
			this.resourceArn = resourceArn;
			return this;
		}

		@NonNull
		public Builder secretArn(@Nullable String secretArn) {
			this.secretArn = secretArn;
			return this;
		}

		@NonNull
		public QueryOptions build() {
			return new QueryOptions(this);
		}
	}
}

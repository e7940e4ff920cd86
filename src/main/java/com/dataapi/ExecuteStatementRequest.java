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
 * A single-statement {@code ExecuteStatement} call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecuteStatementRequest {
	@Nullable
	private final String resourceArn;
	@Nullable
	private final String secretArn;
	@NonNull
	private final String sql;
	@Nullable
	private final String database;
	@Nullable
	private final String schema;
	@NonNull
	private final List<SqlParameter> parameters;
	private final boolean includeResultMetadata;
	@Nullable
	private final Boolean continueAfterTimeout;
	@Nullable
	private final ResultSetOptions resultSetOptions;
	@Nullable
	private final String transactionId;

	private ExecuteStatementRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
		this.sql = requireNonNull(builder.sql);
		this.database = builder.database;
		this.schema = builder.schema;
		this.parameters = builder.parameters == null ? List.of() : List.copyOf(builder.parameters);
		this.includeResultMetadata = builder.includeResultMetadata;
		this.continueAfterTimeout = builder.continueAfterTimeout;
		this.resultSetOptions = builder.resultSetOptions;
		this.transactionId = builder.transactionId;
	}

	/**
	 * Acquires a builder for a request which executes the given SQL.
	 *
	 * @param sql the SQL to execute
	 * @return the builder
	 */
	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	/**
	 * Acquires a builder initialized with this request's values.
	 *
	 * @return the builder
	 */
	@NonNull
	public Builder copy() {
		return new Builder(getSql())
				.resourceArn(this.resourceArn)
				.secretArn(this.secretArn)
				.database(this.database)
				.schema(this.schema)
				.parameters(getParameters())
				.includeResultMetadata(getIncludeResultMetadata())
				.continueAfterTimeout(this.continueAfterTimeout)
				.resultSetOptions(this.resultSetOptions)
				.transactionId(this.transactionId);
	}

	@NonNull
	public Optional<String> getResourceArn() {
		return Optional.ofNullable(this.resourceArn);
	}

	@NonNull
	public Optional<String> getSecretArn() {
		return Optional.ofNullable(this.secretArn);
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	/**
	 * Gets the encoded parameters, which are omitted from the call when empty.
	 *
	 * @return the encoded parameters
	 */
	@NonNull
	public List<SqlParameter> getParameters() {
		return this.parameters;
	}

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
	public Optional<String> getTransactionId() {
		return Optional.ofNullable(this.transactionId);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ExecuteStatementRequest))
			return false;

		ExecuteStatementRequest request = (ExecuteStatementRequest) object;

		return Objects.equals(getResourceArn(), request.getResourceArn())
				&& Objects.equals(getSecretArn(), request.getSecretArn())
				&& Objects.equals(getSql(), request.getSql())
				&& Objects.equals(getDatabase(), request.getDatabase())
				&& Objects.equals(getSchema(), request.getSchema())
				&& Objects.equals(getParameters(), request.getParameters())
				&& getIncludeResultMetadata() == request.getIncludeResultMetadata()
				&& Objects.equals(getContinueAfterTimeout(), request.getContinueAfterTimeout())
				&& Objects.equals(getResultSetOptions(), request.getResultSetOptions())
				&& Objects.equals(getTransactionId(), request.getTransactionId());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getResourceArn(), getSecretArn(), getSql(), getDatabase(), getSchema(), getParameters(),
				getIncludeResultMetadata(), getContinueAfterTimeout(), getResultSetOptions(), getTransactionId());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(10);

		components.add(format("sql=%s", getSql()));

		if (this.database != null)
			components.add(format("database=%s", this.database));

		if (this.schema != null)
			components.add(format("schema=%s", this.schema));

		if (!getParameters().isEmpty())
			components.add(format("parameters=%s", getParameters()));

		if (getIncludeResultMetadata())
			components.add("includeResultMetadata=true");

		if (this.continueAfterTimeout != null)
			components.add(format("continueAfterTimeout=%s", this.continueAfterTimeout));

		if (this.resultSetOptions != null)
			components.add(format("resultSetOptions=%s", this.resultSetOptions));

		if (this.transactionId != null)
			components.add(format("transactionId=%s", this.transactionId));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link ExecuteStatementRequest}.
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
		private String resourceArn;
		@Nullable
		private String secretArn;
		@Nullable
		private String database;
		@Nullable
		private String schema;
		@Nullable
		private List<SqlParameter> parameters;
		private boolean includeResultMetadata;
		@Nullable
		private Boolean continueAfterTimeout;
		@Nullable
		private ResultSetOptions resultSetOptions;
		@Nullable
		private String transactionId;

		private Builder(@NonNull String sql) {
			this.sql = requireNonNull(sql);
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
		public Builder parameters(@Nullable List<SqlParameter> parameters) {
			this.parameters = parameters;
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
		public Builder transactionId(@Nullable String transactionId) {
			this.transactionId = transactionId;
			return this;
		}

		@NonNull
		public ExecuteStatementRequest build() {
			return new ExecuteStatementRequest(this);
		}
	}
}

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
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@code BatchExecuteStatement} call, which runs one statement once per parameter set.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BatchExecuteStatementRequest {
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
	private final List<List<SqlParameter>> parameterSets;
	@Nullable
	private final String transactionId;

	private BatchExecuteStatementRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
		this.sql = requireNonNull(builder.sql);
		this.database = builder.database;
		this.schema = builder.schema;
		this.transactionId = builder.transactionId;

		List<List<SqlParameter>> parameterSets = new ArrayList<>(builder.parameterSets.size());

		for (List<SqlParameter> parameterSet : builder.parameterSets)
			parameterSets.add(List.copyOf(parameterSet));

		this.parameterSets = Collections.unmodifiableList(parameterSets);
	}

	@NonNull
	public static Builder withSql(@NonNull String sql) {
		requireNonNull(sql);
		return new Builder(sql);
	}

	@NonNull
	public Builder copy() {
		return new Builder(getSql())
				.resourceArn(this.resourceArn)
				.secretArn(this.secretArn)
				.database(this.database)
				.schema(this.schema)
				.parameterSets(getParameterSets())
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

	@NonNull
	public List<List<SqlParameter>> getParameterSets() {
		return this.parameterSets;
	}

	@NonNull
	public Optional<String> getTransactionId() {
		return Optional.ofNullable(this.transactionId);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BatchExecuteStatementRequest))
			return false;

		BatchExecuteStatementRequest request = (BatchExecuteStatementRequest) object;

		return Objects.equals(getResourceArn(), request.getResourceArn())
				&& Objects.equals(getSecretArn(), request.getSecretArn())
				&& Objects.equals(getSql(), request.getSql())
				&& Objects.equals(getDatabase(), request.getDatabase())
				&& Objects.equals(getSchema(), request.getSchema())
				&& Objects.equals(getParameterSets(), request.getParameterSets())
				&& Objects.equals(getTransactionId(), request.getTransactionId());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getResourceArn(), getSecretArn(), getSql(), getDatabase(), getSchema(), getParameterSets(),
				getTransactionId());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, database=%s, parameterSets=%s, transactionId=%s}", getClass().getSimpleName(),
				getSql(), this.database, getParameterSets(), this.transactionId);
	}

	/**
	 * Builder used to construct instances of {@link BatchExecuteStatementRequest}.
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
		@NonNull
		private List<List<SqlParameter>> parameterSets;
		@Nullable
		private String transactionId;

		private Builder(@NonNull String sql) {
			this.sql = requireNonNull(sql);
			this.parameterSets = List.of();
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
		public Builder parameterSets(@NonNull List<List<SqlParameter>> parameterSets) {
			this.parameterSets = requireNonNull(parameterSets);
			return this;
		}

		@NonNull
		public Builder transactionId(@Nullable String transactionId) {
			this.transactionId = transactionId;
			return this;
		}

		@NonNull
		public BatchExecuteStatementRequest build() {
			return new BatchExecuteStatementRequest(this);
		}
	}
}

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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@code BeginTransaction} call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BeginTransactionRequest {
	@Nullable
	private final String resourceArn;
	@Nullable
	private final String secretArn;
	@Nullable
	private final String database;
	@Nullable
	private final String schema;

	private BeginTransactionRequest(@NonNull Builder builder) {
		requireNonNull(builder);

		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
		this.database = builder.database;
		this.schema = builder.schema;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public Builder copy() {
		return new Builder()
				.resourceArn(this.resourceArn)
				.secretArn(this.secretArn)
				.database(this.database)
				.schema(this.schema);
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
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BeginTransactionRequest))
			return false;

		BeginTransactionRequest request = (BeginTransactionRequest) object;

		return Objects.equals(getResourceArn(), request.getResourceArn())
				&& Objects.equals(getSecretArn(), request.getSecretArn())
				&& Objects.equals(getDatabase(), request.getDatabase())
				&& Objects.equals(getSchema(), request.getSchema());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getResourceArn(), getSecretArn(), getDatabase(), getSchema());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{resourceArn=%s, database=%s, schema=%s}", getClass().getSimpleName(), this.resourceArn,
				this.database, this.schema);
	}

	/**
	 * Builder used to construct instances of {@link BeginTransactionRequest}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String resourceArn;
		@Nullable
		private String secretArn;
		@Nullable
		private String database;
		@Nullable
		private String schema;

		private Builder() {
			// Use BeginTransactionRequest.builder()
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
		public BeginTransactionRequest build() {
			return new BeginTransactionRequest(this);
		}
	}
}

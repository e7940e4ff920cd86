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
 * Per-transaction overrides of client settings. Every query in the transaction runs against the transaction's
 * database.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TransactionOptions {
	@NonNull
	private static final TransactionOptions DEFAULT_INSTANCE = builder().build();

	@Nullable
	private final String database;
	@Nullable
	private final String schema;
	@Nullable
	private final Boolean hydrateColumnNames;
	@Nullable
	private final FormatOptions formatOptions;
	@Nullable
	private final String resourceArn;
	@Nullable
	private final String secretArn;

	private TransactionOptions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.database = builder.database;
		this.schema = builder.schema;
		this.hydrateColumnNames = builder.hydrateColumnNames;
		this.formatOptions = builder.formatOptions;
		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
	}

	@NonNull
	public static TransactionOptions defaults() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
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

	@NonNull
	public Optional<FormatOptions> getFormatOptions() {
		return Optional.ofNullable(this.formatOptions);
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

		if (!(object instanceof TransactionOptions))
			return false;

		TransactionOptions transactionOptions = (TransactionOptions) object;

		return Objects.equals(getDatabase(), transactionOptions.getDatabase())
				&& Objects.equals(getSchema(), transactionOptions.getSchema())
				&& Objects.equals(getHydrateColumnNames(), transactionOptions.getHydrateColumnNames())
				&& Objects.equals(getFormatOptions(), transactionOptions.getFormatOptions())
				&& Objects.equals(getResourceArn(), transactionOptions.getResourceArn())
				&& Objects.equals(getSecretArn(), transactionOptions.getSecretArn());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDatabase(), getSchema(), getHydrateColumnNames(), getFormatOptions(), getResourceArn(),
				getSecretArn());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{database=%s, schema=%s, hydrateColumnNames=%s, formatOptions=%s}",
				getClass().getSimpleName(), this.database, this.schema, this.hydrateColumnNames, this.formatOptions);
	}

	/**
	 * Builder used to construct instances of {@link TransactionOptions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String database;
		@Nullable
		private String schema;
		@Nullable
		private Boolean hydrateColumnNames;
		@Nullable
		private FormatOptions formatOptions;
		@Nullable
		private String resourceArn;
		@Nullable
		private String secretArn;

		private Builder() {
			// Use TransactionOptions.builder()
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
		public Builder formatOptions(@Nullable FormatOptions formatOptions) {
			this.formatOptions = formatOptions;
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
		public TransactionOptions build() {
			return new TransactionOptions(this);
		}
	}
}

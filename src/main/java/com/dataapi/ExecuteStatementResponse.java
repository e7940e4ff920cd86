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
 * The raw result of an {@code ExecuteStatement} call.
 * <p>
 * Which parts are present depends on the statement: queries carry records (and column metadata if it was
 * requested), DML carries an update count and possibly generated fields.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ExecuteStatementResponse {
	@Nullable
	private final List<List<Field>> records;
	@Nullable
	private final List<ColumnMetadata> columnMetadata;
	@Nullable
	private final Long numberOfRecordsUpdated;
	@NonNull
	private final List<Field> generatedFields;

	private ExecuteStatementResponse(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.records == null) {
			this.records = null;
		} else {
			List<List<Field>> records = new ArrayList<>(builder.records.size());

			for (List<Field> record : builder.records)
				records.add(List.copyOf(record));

			this.records = Collections.unmodifiableList(records);
		}

		this.columnMetadata = builder.columnMetadata == null ? null : List.copyOf(builder.columnMetadata);
		this.numberOfRecordsUpdated = builder.numberOfRecordsUpdated;
		this.generatedFields = builder.generatedFields == null ? List.of() : List.copyOf(builder.generatedFields);
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public Optional<List<List<Field>>> getRecords() {
		return Optional.ofNullable(this.records);
	}

	@NonNull
	public Optional<List<ColumnMetadata>> getColumnMetadata() {
		return Optional.ofNullable(this.columnMetadata);
	}

	@NonNull
	public Optional<Long> getNumberOfRecordsUpdated() {
		return Optional.ofNullable(this.numberOfRecordsUpdated);
	}

	@NonNull
	public List<Field> getGeneratedFields() {
		return this.generatedFields;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ExecuteStatementResponse))
			return false;

		ExecuteStatementResponse response = (ExecuteStatementResponse) object;

		return Objects.equals(getRecords(), response.getRecords())
				&& Objects.equals(getColumnMetadata(), response.getColumnMetadata())
				&& Objects.equals(getNumberOfRecordsUpdated(), response.getNumberOfRecordsUpdated())
				&& Objects.equals(getGeneratedFields(), response.getGeneratedFields());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRecords(), getColumnMetadata(), getNumberOfRecordsUpdated(), getGeneratedFields());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{records=%s, columnMetadata=%s, numberOfRecordsUpdated=%s, generatedFields=%s}",
				getClass().getSimpleName(), this.records, this.columnMetadata, this.numberOfRecordsUpdated,
				getGeneratedFields());
	}

	/**
	 * Builder used to construct instances of {@link ExecuteStatementResponse}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private List<List<Field>> records;
		@Nullable
		private List<ColumnMetadata> columnMetadata;
		@Nullable
		private Long numberOfRecordsUpdated;
		@Nullable
		private List<Field> generatedFields;

		private Builder() {
			// Use ExecuteStatementResponse.builder()
		}

		@NonNull
		public Builder records(@Nullable List<List<Field>> records) {
			this.records = records;
			return this;
		}

		@NonNull
		public Builder columnMetadata(@Nullable List<ColumnMetadata> columnMetadata) {
			this.columnMetadata = columnMetadata;
			return this;
		}

		@NonNull
		public Builder numberOfRecordsUpdated(@Nullable Long numberOfRecordsUpdated) {
			this.numberOfRecordsUpdated = numberOfRecordsUpdated;
			return this;
		}

		@NonNull
		public Builder generatedFields(@Nullable List<Field> generatedFields) {
			this.generatedFields = generatedFields;
			return this;
		}

		@NonNull
		public ExecuteStatementResponse build() {
			return new ExecuteStatementResponse(this);
		}
	}
}

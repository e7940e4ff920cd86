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

import com.fasterxml.jackson.databind.ObjectMapper;
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
import static java.util.stream.Collectors.joining;

/**
 * The decoded result of a query.
 * <p>
 * Records are either hydrated, in which case each record is a {@code Map<String, Object>} keyed by column label in
 * column order, or positional, in which case each record is a {@code List<Object>}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class QueryResult {
	@Nullable
	private final List<Object> records;
	@Nullable
	private final List<ColumnMetadata> columnMetadata;
	@Nullable
	private final Long numberOfRecordsUpdated;
	@Nullable
	private final Long insertId;
	@Nullable
	private final List<UpdateResult> updateResults;
	@NonNull
	private final ObjectMapper objectMapper;

	private QueryResult(@NonNull Builder builder) {
		requireNonNull(builder);

		this.records = builder.records == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.records));
		this.columnMetadata = builder.columnMetadata == null ? null : List.copyOf(builder.columnMetadata);
		this.numberOfRecordsUpdated = builder.numberOfRecordsUpdated;
		this.insertId = builder.insertId;
		this.updateResults = builder.updateResults == null ? null : List.copyOf(builder.updateResults);
		this.objectMapper = requireNonNull(builder.objectMapper);
	}

	@NonNull
	static Builder withObjectMapper(@NonNull ObjectMapper objectMapper) {
		requireNonNull(objectMapper);
		return new Builder(objectMapper);
	}

	/**
	 * Gets the decoded records. {@code null} column values are carried as {@code null} elements.
	 *
	 * @return the records, if the statement returned any
	 */
	@NonNull
	public Optional<List<Object>> getRecords() {
		return Optional.ofNullable(this.records);
	}

	/**
	 * Converts hydrated records to instances of {@code recordType}, matching column labels to properties.
	 *
	 * @param recordType the type to convert each record to
	 * @param <T>        the record type
	 * @return the converted records, empty if the statement returned none
	 * @throws DataApiException if a record cannot be converted
	 */
	@NonNull
	public <T> List<T> getRecords(@NonNull Class<T> recordType) {
		requireNonNull(recordType);

		if (this.records == null)
			return List.of();

		List<T> convertedRecords = new ArrayList<>(this.records.size());

		for (Object record : this.records) {
			try {
				convertedRecords.add(this.objectMapper.convertValue(record, recordType));
			} catch (IllegalArgumentException e) {
				throw new DataApiException(format("Unable to convert record to %s", recordType.getName()), e);
			}
		}

		return convertedRecords;
	}

	/**
	 * Gets column metadata, which is only present when the caller asked for it.
	 *
	 * @return column metadata, if requested
	 */
	@NonNull
	public Optional<List<ColumnMetadata>> getColumnMetadata() {
		return Optional.ofNullable(this.columnMetadata);
	}

	/**
	 * Gets the number of rows a DML statement touched. Not present for statements which return records.
	 *
	 * @return the update count, if reported
	 */
	@NonNull
	public Optional<Long> getNumberOfRecordsUpdated() {
		return Optional.ofNullable(this.numberOfRecordsUpdated);
	}

	@NonNull
	public Optional<Long> getInsertId() {
		return Optional.ofNullable(this.insertId);
	}

	/**
	 * Gets per-row results of a batch statement, in submission order.
	 *
	 * @return update results, if this was a batch
	 */
	@NonNull
	public Optional<List<UpdateResult>> getUpdateResults() {
		return Optional.ofNullable(this.updateResults);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof QueryResult))
			return false;

		QueryResult queryResult = (QueryResult) object;

		return Objects.equals(getRecords(), queryResult.getRecords())
				&& Objects.equals(getColumnMetadata(), queryResult.getColumnMetadata())
				&& Objects.equals(getNumberOfRecordsUpdated(), queryResult.getNumberOfRecordsUpdated())
				&& Objects.equals(getInsertId(), queryResult.getInsertId())
				&& Objects.equals(getUpdateResults(), queryResult.getUpdateResults());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getRecords(), getColumnMetadata(), getNumberOfRecordsUpdated(), getInsertId(),
				getUpdateResults());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(5);

		if (this.records != null)
			components.add(format("records=%s", this.records));

		if (this.columnMetadata != null)
			components.add(format("columnMetadata=%s", this.columnMetadata));

		if (this.numberOfRecordsUpdated != null)
			components.add(format("numberOfRecordsUpdated=%s", this.numberOfRecordsUpdated));

		if (this.insertId != null)
			components.add(format("insertId=%s", this.insertId));

		if (this.updateResults != null)
			components.add(format("updateResults=%s", this.updateResults));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link QueryResult}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	static final class Builder {
		@NonNull
		private final ObjectMapper objectMapper;
		@Nullable
		private List<Object> records;
		@Nullable
		private List<ColumnMetadata> columnMetadata;
		@Nullable
		private Long numberOfRecordsUpdated;
		@Nullable
		private Long insertId;
		@Nullable
		private List<UpdateResult> updateResults;

		private Builder(@NonNull ObjectMapper objectMapper) {
			this.objectMapper = requireNonNull(objectMapper);
		}

		@NonNull
		Builder records(@Nullable List<Object> records) {
			this.records = records;
			return this;
		}

		@NonNull
		Builder columnMetadata(@Nullable List<ColumnMetadata> columnMetadata) {
			this.columnMetadata = columnMetadata;
			return this;
		}

		@NonNull
		Builder numberOfRecordsUpdated(@Nullable Long numberOfRecordsUpdated) {
			this.numberOfRecordsUpdated = numberOfRecordsUpdated;
			return this;
		}

		@NonNull
		Builder insertId(@Nullable Long insertId) {
			this.insertId = insertId;
			return this;
		}

		@NonNull
		Builder updateResults(@Nullable List<UpdateResult> updateResults) {
			this.updateResults = updateResults;
			return this;
		}

		@NonNull
		QueryResult build() {
			return new QueryResult(this);
		}
	}
}

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns raw Data API responses into {@link QueryResult}s.
 * <p>
 * Date-typed columns are parsed into {@link java.time.Instant}s when {@link FormatOptions#getDeserializeDate()} is
 * set, and JSON-typed columns are parsed into {@link Map}s, {@link List}s and scalars.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultDecoder {
	@NonNull
	private static final Set<String> DATE_TYPE_NAMES = Set.of("DATE", "DATETIME", "TIMESTAMP", "TIMESTAMPTZ",
			"TIMESTAMP WITH TIME ZONE");
	@NonNull
	private static final Set<String> JSON_TYPE_NAMES = Set.of("JSON", "JSONB");
	// Values of this type are read in the client zone unless they carry an offset
	@NonNull
	private static final String ZONED_TIMESTAMP_TYPE_NAME = "TIMESTAMP WITH TIME ZONE";

	@NonNull
	private final FormatOptions formatOptions;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final ObjectMapper objectMapper;
	private final boolean hydrateColumnNames;
	private final boolean includeResultMetadata;

	/**
	 * Creates a decoder.
	 *
	 * @param formatOptions         date handling options
	 * @param timeZone              the zone which defines "local"
	 * @param objectMapper          parses JSON columns
	 * @param hydrateColumnNames    whether records are keyed by column label
	 * @param includeResultMetadata whether column metadata is handed back to the caller
	 */
	public ResultDecoder(@NonNull FormatOptions formatOptions,
											 @NonNull ZoneId timeZone,
											 @NonNull ObjectMapper objectMapper,
											 boolean hydrateColumnNames,
											 boolean includeResultMetadata) {
		this.formatOptions = requireNonNull(formatOptions);
		this.timeZone = requireNonNull(timeZone);
		this.objectMapper = requireNonNull(objectMapper);
		this.hydrateColumnNames = hydrateColumnNames;
		this.includeResultMetadata = includeResultMetadata;
	}

	/**
	 * Decodes a single-statement response.
	 *
	 * @param response the raw response
	 * @return the decoded result
	 * @throws DataApiException if a value cannot be decoded
	 */
	@NonNull
	public QueryResult decode(@NonNull ExecuteStatementResponse response) {
		requireNonNull(response);

		QueryResult.Builder builder = QueryResult.withObjectMapper(this.objectMapper);
		List<ColumnMetadata> columnMetadata = response.getColumnMetadata().orElse(null);
		List<List<Field>> records = response.getRecords().orElse(null);

		if (this.includeResultMetadata)
			builder.columnMetadata(columnMetadata == null ? List.of() : columnMetadata);

		if (records == null)
			builder.numberOfRecordsUpdated(response.getNumberOfRecordsUpdated().orElse(null));
		else
			builder.records(decodeRecords(records, columnMetadata));

		if (!response.getGeneratedFields().isEmpty())
			builder.insertId(response.getGeneratedFields().get(0).getLongValue().orElse(null));

		return builder.build();
	}

	/**
	 * Decodes a batch response into one {@link UpdateResult} per row.
	 *
	 * @param response the raw response
	 * @return the decoded result
	 */
	@NonNull
	public QueryResult decode(@NonNull BatchExecuteStatementResponse response) {
		requireNonNull(response);

		List<UpdateResult> updateResults = new ArrayList<>(response.getUpdateResults().size());

		for (List<Field> generatedFields : response.getUpdateResults()) {
			Long insertId = generatedFields.isEmpty() ? null : generatedFields.get(0).getLongValue().orElse(null);
			updateResults.add(insertId == null ? UpdateResult.empty() : UpdateResult.withInsertId(insertId));
		}

		return QueryResult.withObjectMapper(this.objectMapper).updateResults(updateResults).build();
	}

	@NonNull
	private List<Object> decodeRecords(@NonNull List<List<Field>> records,
																		 @Nullable List<ColumnMetadata> columnMetadata) {
		requireNonNull(records);

		if (records.isEmpty())
			return List.of();

		List<ColumnDecoding> columnDecodings = planColumns(records.get(0).size(), columnMetadata);
		List<Object> decodedRecords = new ArrayList<>(records.size());

		for (List<Field> record : records) {
			if (record.size() != columnDecodings.size())
				throw new DataApiException(format("Expected %d columns in record but found %d", columnDecodings.size(), record.size()));

			if (this.hydrateColumnNames) {
				Map<String, Object> hydratedRecord = new LinkedHashMap<>(record.size());

				for (int i = 0; i < record.size(); ++i)
					hydratedRecord.put(columnDecodings.get(i).label, decodeValue(record.get(i), columnDecodings.get(i)));

				decodedRecords.add(Collections.unmodifiableMap(hydratedRecord));
			} else {
				List<Object> positionalRecord = new ArrayList<>(record.size());

				for (int i = 0; i < record.size(); ++i)
					positionalRecord.add(decodeValue(record.get(i), columnDecodings.get(i)));

				decodedRecords.add(Collections.unmodifiableList(positionalRecord));
			}
		}

		return decodedRecords;
	}

	@NonNull
	private List<ColumnDecoding> planColumns(int columnCount,
																					 @Nullable List<ColumnMetadata> columnMetadata) {
		if (columnMetadata != null && columnMetadata.size() != columnCount)
			throw new DataApiException(format("Column metadata describes %d columns but records have %d",
					columnMetadata.size(), columnCount));

		if (columnMetadata == null && this.hydrateColumnNames)
			throw new DataApiException("Unable to hydrate records because the response has no column metadata");

		List<ColumnDecoding> columnDecodings = new ArrayList<>(columnCount);

		for (int i = 0; i < columnCount; ++i) {
			if (columnMetadata == null) {
				columnDecodings.add(new ColumnDecoding(null, ValueCoercion.NONE, false));
				continue;
			}

			ColumnMetadata column = columnMetadata.get(i);
			String typeName = column.getTypeName().orElse(null);
			String normalizedTypeName = typeName == null ? null : typeName.toUpperCase(Locale.ENGLISH);
			ValueCoercion valueCoercion = ValueCoercion.NONE;

			if (normalizedTypeName != null && this.formatOptions.getDeserializeDate() && DATE_TYPE_NAMES.contains(normalizedTypeName))
				valueCoercion = ValueCoercion.DATE;
			else if (normalizedTypeName != null && JSON_TYPE_NAMES.contains(normalizedTypeName))
				valueCoercion = ValueCoercion.JSON;

			boolean treatAsLocalDate = this.formatOptions.getTreatAsLocalDate() || ZONED_TIMESTAMP_TYPE_NAME.equals(normalizedTypeName);

			columnDecodings.add(new ColumnDecoding(column.getLabel(), valueCoercion, treatAsLocalDate));
		}

		return columnDecodings;
	}

	@Nullable
	private Object decodeValue(@NonNull Field field,
														 @NonNull ColumnDecoding columnDecoding) {
		requireNonNull(field);
		requireNonNull(columnDecoding);

		if (field.isNull())
			return null;

		Object value = field.getValue();

		if (!(value instanceof String string))
			return value;

		if (columnDecoding.valueCoercion == ValueCoercion.DATE) {
			try {
				return TimestampFormat.parse(string, columnDecoding.treatAsLocalDate, this.timeZone);
			} catch (DateTimeParseException e) {
				throw new DataApiException(format("Unable to parse '%s' in column '%s' as a timestamp", string, columnDecoding.label), e);
			}
		}

		if (columnDecoding.valueCoercion == ValueCoercion.JSON) {
			try {
				return this.objectMapper.readValue(string, Object.class);
			} catch (JsonProcessingException e) {
				throw new DataApiException(format("Unable to parse JSON in column '%s'", columnDecoding.label), e);
			}
		}

		return value;
	}

	private enum ValueCoercion {
		NONE,
		DATE,
		JSON
	}

	private static final class ColumnDecoding {
		@Nullable
		private final String label;
		@NonNull
		private final ValueCoercion valueCoercion;
		private final boolean treatAsLocalDate;

		private ColumnDecoding(@Nullable String label,
													 @NonNull ValueCoercion valueCoercion,
													 boolean treatAsLocalDate) {
			this.label = label;
			this.valueCoercion = requireNonNull(valueCoercion);
			this.treatAsLocalDate = treatAsLocalDate;
		}
	}
}

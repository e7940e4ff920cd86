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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Loads Data API responses captured as JSON under {@code src/test/resources/fixtures}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class Fixtures {
	@NonNull
	private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

	private Fixtures() {
		// Prevents instantiation
	}

	@NonNull
	static ExecuteStatementResponse executeStatementResponse(@NonNull String fixtureName) {
		requireNonNull(fixtureName);

		JsonNode root = readFixture(fixtureName);
		ExecuteStatementResponse.Builder builder = ExecuteStatementResponse.builder();

		if (root.has("records")) {
			List<List<Field>> records = new ArrayList<>();

			for (JsonNode record : root.get("records"))
				records.add(toFields(record));

			builder.records(records);
		}

		if (root.has("columnMetadata")) {
			List<ColumnMetadata> columnMetadata = new ArrayList<>();

			for (JsonNode column : root.get("columnMetadata"))
				columnMetadata.add(toColumnMetadata(column));

			builder.columnMetadata(columnMetadata);
		}

		if (root.has("numberOfRecordsUpdated"))
			builder.numberOfRecordsUpdated(root.get("numberOfRecordsUpdated").longValue());

		if (root.has("generatedFields"))
			builder.generatedFields(toFields(root.get("generatedFields")));

		return builder.build();
	}

	@NonNull
	static BatchExecuteStatementResponse batchExecuteStatementResponse(@NonNull String fixtureName) {
		requireNonNull(fixtureName);

		JsonNode root = readFixture(fixtureName);
		List<List<Field>> updateResults = new ArrayList<>();

		for (JsonNode updateResult : root.get("updateResults"))
			updateResults.add(updateResult.has("generatedFields") ? toFields(updateResult.get("generatedFields")) : List.of());

		return BatchExecuteStatementResponse.withUpdateResults(updateResults);
	}

	@NonNull
	private static JsonNode readFixture(@NonNull String fixtureName) {
		requireNonNull(fixtureName);

		try (InputStream inputStream = Fixtures.class.getResourceAsStream(format("/fixtures/%s", fixtureName))) {
			if (inputStream == null)
				throw new IllegalArgumentException(format("No fixture named '%s'", fixtureName));

			return OBJECT_MAPPER.readTree(inputStream);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Unable to read fixture '%s'", fixtureName), e);
		}
	}

	@NonNull
	private static List<Field> toFields(@NonNull JsonNode fieldsNode) {
		requireNonNull(fieldsNode);

		List<Field> fields = new ArrayList<>();

		for (JsonNode fieldNode : fieldsNode)
			fields.add(toField(fieldNode));

		return fields;
	}

	@NonNull
	private static Field toField(@NonNull JsonNode fieldNode) {
		requireNonNull(fieldNode);

		Iterator<Map.Entry<String, JsonNode>> entries = fieldNode.fields();

		if (!entries.hasNext())
			throw new IllegalArgumentException(format("Empty field in fixture: %s", fieldNode));

		Map.Entry<String, JsonNode> entry = entries.next();
		JsonNode value = entry.getValue();

		switch (entry.getKey()) {
			case "isNull":
				return Field.ofNull();
			case "stringValue":
				return Field.ofString(value.textValue());
			case "longValue":
				return Field.ofLong(value.longValue());
			case "doubleValue":
				return Field.ofDouble(value.doubleValue());
			case "booleanValue":
				return Field.ofBoolean(value.booleanValue());
			case "blobValue":
				return Field.ofBlob(Base64.getDecoder().decode(value.textValue()));
			default:
				throw new IllegalArgumentException(format("Unsupported field type '%s' in fixture", entry.getKey()));
		}
	}

	@NonNull
	private static ColumnMetadata toColumnMetadata(@NonNull JsonNode column) {
		requireNonNull(column);

		return ColumnMetadata.withLabel(column.get("label").textValue())
				.name(textOrNull(column, "name"))
				.typeName(textOrNull(column, "typeName"))
				.type(intOrNull(column, "type"))
				.tableName(textOrNull(column, "tableName"))
				.schemaName(textOrNull(column, "schemaName"))
				.nullable(intOrNull(column, "nullable"))
				.precision(intOrNull(column, "precision"))
				.scale(intOrNull(column, "scale"))
				.build();
	}

	@Nullable
	private static String textOrNull(@NonNull JsonNode node,
																	 @NonNull String fieldName) {
		return node.hasNonNull(fieldName) ? node.get(fieldName).textValue() : null;
	}

	@Nullable
	private static Integer intOrNull(@NonNull JsonNode node,
																	 @NonNull String fieldName) {
		return node.hasNonNull(fieldName) ? node.get(fieldName).intValue() : null;
	}
}

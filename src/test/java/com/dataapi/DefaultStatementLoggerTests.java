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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

/**
 * @since 1.0.0
 */
public class DefaultStatementLoggerTests {
	@Test
	public void testFormatsParametersAndTimings() {
		StatementLog statementLog = StatementLog.withSql("SELECT * FROM category WHERE id = :id AND name = :name")
				.parameterSets(List.of(List.of(
						SqlParameter.of("id", Field.ofLong(1)),
						SqlParameter.of("name", Field.ofString("Category 1")),
						SqlParameter.of("data", Field.ofBlob(new byte[]{1, 2, 3})),
						SqlParameter.of("description", Field.ofNull()))))
				.transactionId("tx-1")
				.executionDuration(Duration.ofMillis(12))
				.decodingDuration(Duration.ofMillis(3))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertEquals(String.join("\n",
				"SELECT * FROM category WHERE id = :id AND name = :name",
				"Parameters: :id=1, :name='Category 1', :data=[byte array of length 3], :description=null",
				"Transaction ID: tx-1",
				"PT0.012S executing statement, PT0.003S decoding results"), formatted);
		Assertions.assertEquals(Duration.ofMillis(15), statementLog.getTotalDuration());
	}

	@Test
	public void testBatchesShowOnlyTheFirstRow() {
		StatementLog statementLog = StatementLog.withSql("INSERT INTO category (name) VALUES (:name)")
				.parameterSets(List.of(
						List.of(SqlParameter.of("name", Field.ofString("A"))),
						List.of(SqlParameter.of("name", Field.ofString("B")))))
				.batchSize(2)
				.exception(new DataApiException("Duplicate entry", "BadRequest"))
				.build();

		String formatted = new DefaultStatementLogger().formatStatementLog(statementLog);

		Assertions.assertTrue(formatted.contains("Batch of 2 parameter sets, first: :name='A'"));
		Assertions.assertTrue(formatted.endsWith("Failed due to DataApiException{message=Duplicate entry, code=BadRequest}"));
	}

	@Test
	public void testLongValuesAreEllipsized() {
		String formatted = new DefaultStatementLogger().formatParameters(List.of(
				SqlParameter.of("body", Field.ofString("x".repeat(150)))));

		Assertions.assertEquals(":body='" + "x".repeat(100) + "...'", formatted);
	}
}

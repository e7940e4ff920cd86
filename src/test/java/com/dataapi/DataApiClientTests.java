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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class DataApiClientTests {
	@NonNull
	static final String RESOURCE_ARN = "arn:aws:rds:us-east-1:123456789012:cluster:inventory";
	@NonNull
	static final String SECRET_ARN = "arn:aws:secretsmanager:us-east-1:123456789012:secret:inventory";

	@Test
	public void testQueryHydratesRecords() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptExecuteStatement(Fixtures.executeStatementResponse("select-categories.json"));

		QueryResult queryResult = createClient(transport).query("SELECT * FROM category WHERE id > :id", Map.of("id", 0)).get();

		ExecuteStatementRequest request = transport.getExecuteStatementRequests().get(0);

		Assertions.assertEquals("SELECT * FROM category WHERE id > :id", request.getSql());
		Assertions.assertEquals(List.of(SqlParameter.of("id", Field.ofLong(0))), request.getParameters());
		Assertions.assertEquals(Optional.of(RESOURCE_ARN), request.getResourceArn());
		Assertions.assertEquals(Optional.of(SECRET_ARN), request.getSecretArn());
		Assertions.assertEquals(Optional.of("inventory"), request.getDatabase());
		Assertions.assertTrue(request.getIncludeResultMetadata(), "Hydration needs column labels");
		Assertions.assertEquals(Optional.empty(), request.getTransactionId());

		Map<?, ?> first = (Map<?, ?>) queryResult.getRecords().orElseThrow().get(0);
		Assertions.assertEquals("Category 1", first.get("name"));
		Assertions.assertEquals(Instant.parse("2019-11-12T22:00:11Z"), first.get("created"));
		Assertions.assertEquals(Optional.empty(), queryResult.getColumnMetadata());
	}

	@Test
	public void testQueryOptionsOverrideClientSettings() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptExecuteStatement(Fixtures.executeStatementResponse("select-categories.json"));

		QueryResult queryResult = createClient(transport).query(QueryOptions.withSql("SELECT * FROM category")
				.database("archive")
				.schema("history")
				.hydrateColumnNames(false)
				.formatOptions(FormatOptions.of(false, false))
				.resultSetOptions(ResultSetOptions.of(ResultSetOptions.DecimalReturnType.STRING, null))
				.build()).get();

		ExecuteStatementRequest request = transport.getExecuteStatementRequests().get(0);

		Assertions.assertEquals(Optional.of("archive"), request.getDatabase());
		Assertions.assertEquals(Optional.of("history"), request.getSchema());
		Assertions.assertFalse(request.getIncludeResultMetadata());
		Assertions.assertEquals(Optional.of(ResultSetOptions.DecimalReturnType.STRING),
				request.getResultSetOptions().orElseThrow().getDecimalReturnType());

		List<?> first = (List<?>) queryResult.getRecords().orElseThrow().get(0);
		Assertions.assertEquals("2019-11-12 22:00:11", first.get(3));
	}

	@Test
	public void testRowListRunsAsBatch() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptBatchExecuteStatement(Fixtures.batchExecuteStatementResponse("batch-insert-categories.json"));

		QueryResult queryResult = createClient(transport).query("INSERT INTO category (name) VALUES (:name)", List.of(
				Map.of("name", "Category 3"),
				Map.of("name", "Category 4"),
				Map.of("name", "Category 5"))).get();

		BatchExecuteStatementRequest request = transport.getBatchExecuteStatementRequests().get(0);

		Assertions.assertEquals(3, request.getParameterSets().size());
		Assertions.assertEquals(Optional.of("inventory"), request.getDatabase());
		Assertions.assertEquals(List.of("batch"), transport.getCalls());
		Assertions.assertEquals(List.of(Optional.of(316L), Optional.of(317L), Optional.empty()),
				queryResult.getUpdateResults().orElseThrow().stream().map(UpdateResult::getInsertId).toList());
	}

	@Test
	public void testInsertReportsInsertId() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptExecuteStatement(Fixtures.executeStatementResponse("insert-category.json"));

		QueryResult queryResult = createClient(transport)
				.query("INSERT INTO category (name, description) VALUES (:name, :description)",
						List.of(Parameters.named("name", "Category 6"), Parameters.named("description", null)))
				.get();

		Assertions.assertEquals(Optional.of(315L), queryResult.getInsertId());
		Assertions.assertEquals(Optional.of(1L), queryResult.getNumberOfRecordsUpdated());
		Assertions.assertEquals(SqlParameter.of("description", Field.ofNull()),
				transport.getExecuteStatementRequests().get(0).getParameters().get(1));
	}

	@Test
	public void testInputProblemsAreThrownImmediately() {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport();
		DataApiClient client = createClient(transport);

		Assertions.assertThrows(IllegalArgumentException.class, () -> client.query(" "));

		IllegalArgumentException shape = Assertions.assertThrows(IllegalArgumentException.class,
				() -> client.query("SELECT :id", "id=1"));
		Assertions.assertEquals("Parameters must be a map or list", shape.getMessage());

		IllegalArgumentException optionsShape = Assertions.assertThrows(IllegalArgumentException.class,
				() -> client.query(QueryOptions.withSql("SELECT :id").parameters(1).build()));
		Assertions.assertEquals("'parameters' must be a map or list", optionsShape.getMessage());

		IllegalArgumentException type = Assertions.assertThrows(IllegalArgumentException.class,
				() -> client.query("SELECT :id", Map.of("id", new Object())));
		Assertions.assertEquals("'id' is an invalid type", type.getMessage());

		Assertions.assertEquals(List.of(), transport.getCalls());
	}

	@Test
	public void testColdStartIsRetried() throws Exception {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport().scriptExecuteStatement(
				new DataApiException("Database is resuming", "DatabaseResumingException"),
				Fixtures.executeStatementResponse("insert-category.json"));

		QueryResult queryResult = createClient(transport, delayScheduler).query("DELETE FROM category").get();

		Assertions.assertEquals(Optional.of(1L), queryResult.getNumberOfRecordsUpdated());
		Assertions.assertEquals(2, transport.getExecuteStatementRequests().size());
		Assertions.assertEquals(List.of(Duration.ofSeconds(2)), delayScheduler.getDelays());
	}

	@Test
	public void testRemoteFailureIsPropagatedUnwrapped() {
		DataApiException failure = new DataApiException("Duplicate entry 'Category 1'", "BadRequest");
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport().scriptExecuteStatement(failure);

		ExecutionException e = Assertions.assertThrows(ExecutionException.class,
				() -> createClient(transport).query("INSERT INTO category (name) VALUES ('Category 1')").get());

		Assertions.assertSame(failure, e.getCause());
		Assertions.assertEquals(1, transport.getExecuteStatementRequests().size());
	}

	@Test
	public void testDecodingFailureIsReportedAsDataApiException() {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport().scriptExecuteStatement(ExecuteStatementResponse.builder()
				.columnMetadata(List.of(ColumnMetadata.withLabel("doc").typeName("JSON").build()))
				.records(List.of(List.of(Field.ofString("[unterminated"))))
				.build());

		ExecutionException e = Assertions.assertThrows(ExecutionException.class,
				() -> createClient(transport).query("SELECT doc FROM documents").get());

		Assertions.assertTrue(e.getCause() instanceof DataApiException);
	}

	@Test
	public void testStatementLoggerSeesEveryStatement() throws Exception {
		List<StatementLog> statementLogs = new ArrayList<>();
		DataApiException failure = new DataApiException("Table 'inventory.missing' doesn't exist", "SqlException");
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptExecuteStatement(Fixtures.executeStatementResponse("select-categories.json"), failure);

		DataApiClient client = DataApiClient.withTransport(transport)
				.resourceArn(RESOURCE_ARN)
				.secretArn(SECRET_ARN)
				.database("inventory")
				.statementLogger(statementLogs::add)
				.delayScheduler(new RecordingDelayScheduler())
				.build();

		client.query("SELECT * FROM category WHERE name = :name", Map.of("name", "Category 1")).get();
		Assertions.assertThrows(ExecutionException.class, () -> client.query("SELECT * FROM missing").get());

		Assertions.assertEquals(2, statementLogs.size());

		StatementLog success = statementLogs.get(0);
		Assertions.assertEquals("SELECT * FROM category WHERE name = :name", success.getSql());
		Assertions.assertEquals(List.of(List.of(SqlParameter.of("name", Field.ofString("Category 1")))), success.getParameterSets());
		Assertions.assertEquals(Optional.of("inventory"), success.getDatabase());
		Assertions.assertTrue(success.getExecutionDuration().isPresent());
		Assertions.assertTrue(success.getDecodingDuration().isPresent());
		Assertions.assertEquals(Optional.empty(), success.getException());

		Assertions.assertEquals(Optional.of(failure), statementLogs.get(1).getException());
	}

	@Test
	public void testStatementLoggerFailureDoesNotMaskOutcome() throws Exception {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		DataApiException failure = new DataApiException("Syntax error", "BadRequest");
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptExecuteStatement(Fixtures.executeStatementResponse("insert-category.json"), failure);

		DataApiClient client = DataApiClient.withTransport(transport)
				.resourceArn(RESOURCE_ARN)
				.secretArn(SECRET_ARN)
				.statementLogger((statementLog) -> {
					throw loggerFailure;
				})
				.build();

		Assertions.assertEquals(Optional.of(315L), client.query("INSERT INTO category (name) VALUES ('x')").get().getInsertId());

		ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> client.query("SELEKT 1").get());

		Assertions.assertSame(failure, e.getCause());
		Assertions.assertSame(loggerFailure, e.getCause().getSuppressed()[0]);
	}

	@Test
	public void testPostgresIdentifiersAndCasts() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport();
		DataApiClient client = DataApiClient.withTransport(transport)
				.resourceArn(RESOURCE_ARN)
				.secretArn(SECRET_ARN)
				.engine(Engine.PG)
				.build();

		client.query("UPDATE ::table SET payload = :payload WHERE id = :id", List.of(
				Parameters.named("table", "widget"),
				Parameters.named("payload", "{\"a\": 1}", "jsonb"),
				Parameters.named("id", "0e2f4f6b-2f6b-4a53-8a5e-3f1f8a6f3a10"))).get();

		ExecuteStatementRequest request = transport.getExecuteStatementRequests().get(0);

		Assertions.assertEquals("UPDATE \"widget\" SET payload = :payload::jsonb WHERE id = :id", request.getSql());
		Assertions.assertEquals(List.of(
				SqlParameter.of("payload", Field.ofString("{\"a\": 1}"), TypeHint.JSON),
				SqlParameter.of("id", Field.ofString("0e2f4f6b-2f6b-4a53-8a5e-3f1f8a6f3a10"), TypeHint.UUID)), request.getParameters());
		Assertions.assertEquals(Optional.empty(), request.getDatabase());
	}

	@Test
	public void testPassThroughsFillInClientSettings() throws Exception {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport()
				.scriptBeginTransaction(new DataApiException("Database is resuming", "DatabaseResumingException"));
		DataApiClient client = createClient(transport);

		client.executeStatement(ExecuteStatementRequest.withSql("SELECT 1").build()).get();
		client.executeStatement(ExecuteStatementRequest.withSql("SELECT 2").database("archive").secretArn("other-secret").build()).get();
		client.batchExecuteStatement(BatchExecuteStatementRequest.withSql("SELECT :id")
				.parameterSets(List.of(List.of(SqlParameter.of("id", Field.ofLong(1)))))
				.build()).get();

		Assertions.assertThrows(ExecutionException.class, () -> client.beginTransaction(BeginTransactionRequest.builder().build()).get());

		Assertions.assertEquals("Transaction Committed",
				client.commitTransaction(TransactionControlRequest.forTransactionId("tx-1")).get());
		Assertions.assertEquals("Rollback Complete",
				client.rollbackTransaction(TransactionControlRequest.forTransactionId("tx-2")).get());

		ExecuteStatementRequest first = transport.getExecuteStatementRequests().get(0);
		ExecuteStatementRequest second = transport.getExecuteStatementRequests().get(1);

		Assertions.assertEquals(Optional.of(RESOURCE_ARN), first.getResourceArn());
		Assertions.assertEquals(Optional.of("inventory"), first.getDatabase());
		Assertions.assertEquals(Optional.of("archive"), second.getDatabase());
		Assertions.assertEquals(Optional.of("other-secret"), second.getSecretArn());
		Assertions.assertEquals(Optional.of(SECRET_ARN), transport.getBatchExecuteStatementRequests().get(0).getSecretArn());
		Assertions.assertEquals(Optional.of("inventory"), transport.getBeginTransactionRequests().get(0).getDatabase());
		Assertions.assertEquals(1, transport.getBeginTransactionRequests().size(), "Pass-throughs are not retried");
		Assertions.assertEquals(TransactionControlRequest.of(RESOURCE_ARN, SECRET_ARN, "tx-1"), transport.getCommitTransactionRequests().get(0));
		Assertions.assertEquals(TransactionControlRequest.of(RESOURCE_ARN, SECRET_ARN, "tx-2"), transport.getRollbackTransactionRequests().get(0));
	}

	@Test
	public void testBuilderRequiresArns() {
		ScriptedDataApiTransport transport = new ScriptedDataApiTransport();

		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DataApiClient.withTransport(transport).secretArn(SECRET_ARN).build());
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> DataApiClient.withTransport(transport).resourceArn(RESOURCE_ARN).secretArn(" ").build());
		Assertions.assertThrows(NullPointerException.class, () -> DataApiClient.withTransport(null));
	}

	@Test
	public void testBuilderDefaults() {
		DataApiClient client = DataApiClient.withTransport(new ScriptedDataApiTransport())
				.resourceArn(RESOURCE_ARN)
				.secretArn(SECRET_ARN)
				.build();

		Assertions.assertEquals(Engine.MYSQL, client.getEngine());
		Assertions.assertTrue(client.getHydrateColumnNames());
		Assertions.assertEquals(FormatOptions.defaults(), client.getFormatOptions());
		Assertions.assertEquals(Optional.empty(), client.getDatabase());
	}

	@NonNull
	static DataApiClient createClient(@NonNull ScriptedDataApiTransport transport) {
		return createClient(transport, new RecordingDelayScheduler());
	}

	@NonNull
	static DataApiClient createClient(@NonNull ScriptedDataApiTransport transport,
																		@NonNull DelayScheduler delayScheduler) {
		requireNonNull(transport);
		requireNonNull(delayScheduler);

		return DataApiClient.withTransport(transport)
				.resourceArn(RESOURCE_ARN)
				.secretArn(SECRET_ARN)
				.database("inventory")
				.timeZone(ZoneOffset.UTC)
				.delayScheduler(delayScheduler)
				.build();
	}
}

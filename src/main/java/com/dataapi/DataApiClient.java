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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main class for performing Data API operations.
 * <p>
 * Example usage:
 * <pre>{@code
 * DataApiClient client = DataApiClient.withTransport(transport)
 *   .resourceArn("arn:aws:rds:us-east-1:123456789012:cluster:example")
 *   .secretArn("arn:aws:secretsmanager:us-east-1:123456789012:secret:example")
 *   .database("inventory")
 *   .engine(Engine.PG)
 *   .build();
 *
 * QueryResult result = client.query("SELECT * FROM widget WHERE id = :id", Map.of("id", 42)).join();
 * }</pre>
 * Parameter and SQL problems are reported synchronously with {@link IllegalArgumentException}. Everything that
 * involves the Data API is reported through the returned {@link CompletableFuture}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DataApiClient {
	@NonNull
	private final DataApiTransport transport;
	@NonNull
	private final String resourceArn;
	@NonNull
	private final String secretArn;
	@Nullable
	private final String database;
	@Nullable
	private final String schema;
	@NonNull
	private final Engine engine;
	private final boolean hydrateColumnNames;
	@NonNull
	private final FormatOptions formatOptions;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final ObjectMapper objectMapper;
	@NonNull
	private final RetryController retryController;
	@NonNull
	private final Logger logger;

	private DataApiClient(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.resourceArn == null || builder.resourceArn.isBlank())
			throw new IllegalArgumentException("'resourceArn' string value required");

		if (builder.secretArn == null || builder.secretArn.isBlank())
			throw new IllegalArgumentException("'secretArn' string value required");

		this.transport = requireNonNull(builder.transport);
		this.resourceArn = builder.resourceArn;
		this.secretArn = builder.secretArn;
		this.database = builder.database;
		this.schema = builder.schema;
		this.engine = builder.engine == null ? Engine.MYSQL : builder.engine;
		this.hydrateColumnNames = builder.hydrateColumnNames == null ? true : builder.hydrateColumnNames;
		this.formatOptions = builder.formatOptions == null ? FormatOptions.defaults() : builder.formatOptions;
		this.timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;
		this.statementLogger = builder.statementLogger == null ? (statementLog) -> {} : builder.statementLogger;
		this.objectMapper = builder.objectMapper == null ? createDefaultObjectMapper() : builder.objectMapper;
		this.retryController = new RetryController(
				builder.retryPolicy == null ? RetryPolicy.defaults() : builder.retryPolicy,
				builder.delayScheduler == null ? DelayScheduler.defaultInstance() : builder.delayScheduler);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Provides a {@link DataApiClient} builder for the given {@link DataApiTransport}.
	 *
	 * @param transport sends requests to the Data API
	 * @return a {@link DataApiClient} builder
	 */
	@NonNull
	public static Builder withTransport(@NonNull DataApiTransport transport) {
		requireNonNull(transport);
		return new Builder(transport);
	}

	@NonNull
	private static ObjectMapper createDefaultObjectMapper() {
		return new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
	}

	/**
	 * Executes SQL which has no parameters.
	 *
	 * @param sql the SQL to execute
	 * @return a future for the decoded result
	 * @throws IllegalArgumentException if {@code sql} is blank
	 */
	@NonNull
	public CompletableFuture<QueryResult> query(@NonNull String sql) {
		return query(sql, null);
	}

	/**
	 * Executes SQL with parameters.
	 * <p>
	 * {@code parameters} may be a map of name to value, a list of {@link NamedParameter}s and maps, or a list of such
	 * rows to execute as a batch. See {@link ParameterNormalizer} for details.
	 *
	 * @param sql        the SQL to execute
	 * @param parameters the parameters, may be {@code null}
	 * @return a future for the decoded result
	 * @throws IllegalArgumentException if {@code sql} is blank or a parameter cannot be encoded
	 */
	@NonNull
	public CompletableFuture<QueryResult> query(@NonNull String sql,
																							@Nullable Object parameters) {
		requireNonNull(sql);

		ParameterSet parameterSet = ParameterNormalizer.normalize(parameters);
		return executeQuery(QueryOptions.withSql(sql).build(), parameterSet, null);
	}

	/**
	 * Executes a fully-specified query.
	 *
	 * @param queryOptions the query
	 * @return a future for the decoded result
	 * @throws IllegalArgumentException if the SQL is blank or a parameter cannot be encoded
	 */
	@NonNull
	public CompletableFuture<QueryResult> query(@NonNull QueryOptions queryOptions) {
		requireNonNull(queryOptions);

		ParameterSet parameterSet = normalizeQueryOptionsParameters(queryOptions);
		return executeQuery(queryOptions, parameterSet, null);
	}

	/**
	 * Starts building a transaction with this client's settings.
	 *
	 * @return a transaction which runs when {@link Transaction#commit()} is called
	 */
	@NonNull
	public Transaction transaction() {
		return transaction(TransactionOptions.defaults());
	}

	/**
	 * Starts building a transaction.
	 *
	 * @param transactionOptions overrides of this client's settings
	 * @return a transaction which runs when {@link Transaction#commit()} is called
	 */
	@NonNull
	public Transaction transaction(@NonNull TransactionOptions transactionOptions) {
		requireNonNull(transactionOptions);
		return new Transaction(this, transactionOptions);
	}

	/**
	 * Sends a raw {@code ExecuteStatement} call, filling in this client's ARNs and database where the request has
	 * none. Not retried.
	 *
	 * @param request the request
	 * @return a future for the raw response
	 */
	@NonNull
	public CompletableFuture<ExecuteStatementResponse> executeStatement(@NonNull ExecuteStatementRequest request) {
		requireNonNull(request);

		return getTransport().executeStatement(request.copy()
				.resourceArn(request.getResourceArn().orElse(getResourceArn()))
				.secretArn(request.getSecretArn().orElse(getSecretArn()))
				.database(request.getDatabase().orElse(this.database))
				.build());
	}

	/**
	 * Sends a raw {@code BatchExecuteStatement} call, filling in this client's ARNs and database where the request has
	 * none. Not retried.
	 *
	 * @param request the request
	 * @return a future for the raw response
	 */
	@NonNull
	public CompletableFuture<BatchExecuteStatementResponse> batchExecuteStatement(@NonNull BatchExecuteStatementRequest request) {
		requireNonNull(request);

		return getTransport().batchExecuteStatement(request.copy()
				.resourceArn(request.getResourceArn().orElse(getResourceArn()))
				.secretArn(request.getSecretArn().orElse(getSecretArn()))
				.database(request.getDatabase().orElse(this.database))
				.build());
	}

	/**
	 * Sends a raw {@code BeginTransaction} call, filling in this client's ARNs and database where the request has
	 * none. Not retried.
	 *
	 * @param request the request
	 * @return a future for the new transaction ID
	 */
	@NonNull
	public CompletableFuture<String> beginTransaction(@NonNull BeginTransactionRequest request) {
		requireNonNull(request);
		return getTransport().beginTransaction(resolveBeginTransactionRequest(request));
	}

	@NonNull
	public CompletableFuture<String> commitTransaction(@NonNull TransactionControlRequest request) {
		requireNonNull(request);
		return getTransport().commitTransaction(resolveTransactionControlRequest(request));
	}

	@NonNull
	public CompletableFuture<String> rollbackTransaction(@NonNull TransactionControlRequest request) {
		requireNonNull(request);
		return getTransport().rollbackTransaction(resolveTransactionControlRequest(request));
	}

	@NonNull
	CompletableFuture<String> beginTransactionWithRetry(@NonNull BeginTransactionRequest request) {
		requireNonNull(request);

		BeginTransactionRequest resolvedRequest = resolveBeginTransactionRequest(request);
		return getRetryController().execute(() -> getTransport().beginTransaction(resolvedRequest));
	}

	@NonNull
	static ParameterSet normalizeQueryOptionsParameters(@NonNull QueryOptions queryOptions) {
		requireNonNull(queryOptions);
		return ParameterNormalizer.normalize(queryOptions.getParameters().orElse(null), "'parameters' must be a map or list");
	}

	/**
	 * Binds, plans, executes and decodes a query. Everything up to the remote call happens on the calling thread so
	 * that input problems surface as exceptions rather than failed futures.
	 */
	@NonNull
	CompletableFuture<QueryResult> executeQuery(@NonNull QueryOptions queryOptions,
																							@NonNull ParameterSet parameterSet,
																							@Nullable TransactionContext transactionContext) {
		requireNonNull(queryOptions);
		requireNonNull(parameterSet);

		SqlTemplate sqlTemplate = SqlTemplate.parse(queryOptions.getSql());

		boolean hydrateColumnNames = queryOptions.getHydrateColumnNames()
				.orElse(transactionContext == null ? this.hydrateColumnNames : transactionContext.getHydrateColumnNames());
		FormatOptions formatOptions = queryOptions.getFormatOptions()
				.orElse(transactionContext == null ? this.formatOptions : transactionContext.getFormatOptions());

		ParameterEncoder parameterEncoder = new ParameterEncoder(getEngine(), formatOptions, getTimeZone(), this.objectMapper);
		BoundStatement boundStatement = sqlTemplate.bind(parameterSet, parameterEncoder, new IdentifierEscaper(getEngine()));

		QueryOptions.Builder resolvedOptionsBuilder = queryOptions.copy();

		if (transactionContext == null) {
			resolvedOptionsBuilder
					.resourceArn(queryOptions.getResourceArn().orElse(getResourceArn()))
					.secretArn(queryOptions.getSecretArn().orElse(getSecretArn()))
					.database(queryOptions.getDatabase().orElse(this.database))
					.schema(queryOptions.getSchema().orElse(this.schema));
		} else {
			// Statements must run where the transaction was started
			resolvedOptionsBuilder
					.resourceArn(transactionContext.getResourceArn())
					.secretArn(transactionContext.getSecretArn())
					.database(transactionContext.getDatabase())
					.schema(queryOptions.getSchema().orElse(transactionContext.getSchema()))
					.transactionId(transactionContext.getTransactionId());
		}

		QueryOptions resolvedOptions = resolvedOptionsBuilder.build();
		ResultDecoder resultDecoder = new ResultDecoder(formatOptions, getTimeZone(), this.objectMapper, hydrateColumnNames,
				queryOptions.getIncludeResultMetadata());

		if (boundStatement.isBatch()) {
			BatchExecuteStatementRequest request = BatchPlanner.planBatchExecuteStatement(boundStatement, resolvedOptions);
			return executeAndDecode(boundStatement, resolvedOptions, () -> getTransport().batchExecuteStatement(request),
					resultDecoder::decode);
		}

		ExecuteStatementRequest request = BatchPlanner.planExecuteStatement(boundStatement, resolvedOptions, hydrateColumnNames);
		return executeAndDecode(boundStatement, resolvedOptions, () -> getTransport().executeStatement(request),
				resultDecoder::decode);
	}

	@NonNull
	private <R> CompletableFuture<QueryResult> executeAndDecode(@NonNull BoundStatement boundStatement,
																														 @NonNull QueryOptions resolvedOptions,
																														 @NonNull Supplier<CompletableFuture<R>> remoteCall,
																														 @NonNull Function<R, QueryResult> decoder) {
		requireNonNull(boundStatement);
		requireNonNull(resolvedOptions);
		requireNonNull(remoteCall);
		requireNonNull(decoder);

		CompletableFuture<QueryResult> result = new CompletableFuture<>();
		long executionStartTime = System.nanoTime();

		getRetryController().execute(remoteCall).whenComplete((response, throwable) -> {
			Duration executionDuration = Duration.ofNanos(System.nanoTime() - executionStartTime);

			StatementLog.Builder statementLogBuilder = StatementLog.withSql(boundStatement.getSql())
					.parameterSets(boundStatement.getParameterSets())
					.database(resolvedOptions.getDatabase().orElse(null))
					.transactionId(resolvedOptions.getTransactionId().orElse(null))
					.batchSize(boundStatement.isBatch() ? boundStatement.getParameterSets().size() : null)
					.executionDuration(executionDuration);

			if (throwable != null) {
				Throwable failure = RetryController.unwrap(throwable);
				logStatement(statementLogBuilder.exception(failure).build(), failure);
				result.completeExceptionally(failure);
				return;
			}

			long decodingStartTime = System.nanoTime();
			QueryResult queryResult;

			try {
				queryResult = decoder.apply(response);
			} catch (RuntimeException e) {
				logStatement(statementLogBuilder
						.decodingDuration(Duration.ofNanos(System.nanoTime() - decodingStartTime))
						.exception(e)
						.build(), e);
				result.completeExceptionally(e);
				return;
			}

			logStatement(statementLogBuilder.decodingDuration(Duration.ofNanos(System.nanoTime() - decodingStartTime)).build(), null);
			result.complete(queryResult);
		});

		return result;
	}

	// A logger failure is attached to the statement's own failure, if any, rather than replacing it
	private void logStatement(@NonNull StatementLog statementLog,
														@Nullable Throwable statementFailure) {
		requireNonNull(statementLog);

		try {
			getStatementLogger().log(statementLog);
		} catch (RuntimeException e) {
			if (statementFailure != null && statementFailure != e)
				statementFailure.addSuppressed(e);
			else
				getLogger().log(WARNING, format("Statement logger failed while logging %s", statementLog.getSql()), e);
		}
	}

	@NonNull
	private BeginTransactionRequest resolveBeginTransactionRequest(@NonNull BeginTransactionRequest request) {
		requireNonNull(request);

		return request.copy()
				.resourceArn(request.getResourceArn().orElse(getResourceArn()))
				.secretArn(request.getSecretArn().orElse(getSecretArn()))
				.database(request.getDatabase().orElse(this.database))
				.build();
	}

	@NonNull
	private TransactionControlRequest resolveTransactionControlRequest(@NonNull TransactionControlRequest request) {
		requireNonNull(request);

		return TransactionControlRequest.of(request.getResourceArn().orElse(getResourceArn()),
				request.getSecretArn().orElse(getSecretArn()), request.getTransactionId());
	}

	@NonNull
	public String getResourceArn() {
		return this.resourceArn;
	}

	@NonNull
	public String getSecretArn() {
		return this.secretArn;
	}

	/**
	 * Gets the database statements run against when they don't name one.
	 *
	 * @return the default database, if configured
	 */
	@NonNull
	public Optional<String> getDatabase() {
		return Optional.ofNullable(this.database);
	}

	@NonNull
	public Optional<String> getSchema() {
		return Optional.ofNullable(this.schema);
	}

	@NonNull
	public Engine getEngine() {
		return this.engine;
	}

	public boolean getHydrateColumnNames() {
		return this.hydrateColumnNames;
	}

	@NonNull
	public FormatOptions getFormatOptions() {
		return this.formatOptions;
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	DataApiTransport getTransport() {
		return this.transport;
	}

	@NonNull
	RetryController getRetryController() {
		return this.retryController;
	}

	@NonNull
	private StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	/**
	 * Settings shared by every statement of a running transaction.
	 */
	@ThreadSafe
	static final class TransactionContext {
		@NonNull
		private final String transactionId;
		@NonNull
		private final String resourceArn;
		@NonNull
		private final String secretArn;
		@Nullable
		private final String database;
		@Nullable
		private final String schema;
		private final boolean hydrateColumnNames;
		@NonNull
		private final FormatOptions formatOptions;

		TransactionContext(@NonNull String transactionId,
											 @NonNull String resourceArn,
											 @NonNull String secretArn,
											 @Nullable String database,
											 @Nullable String schema,
											 boolean hydrateColumnNames,
											 @NonNull FormatOptions formatOptions) {
			this.transactionId = requireNonNull(transactionId);
			this.resourceArn = requireNonNull(resourceArn);
			this.secretArn = requireNonNull(secretArn);
			this.database = database;
			this.schema = schema;
			this.hydrateColumnNames = hydrateColumnNames;
			this.formatOptions = requireNonNull(formatOptions);
		}

		@NonNull
		String getTransactionId() {
			return this.transactionId;
		}

		@NonNull
		String getResourceArn() {
			return this.resourceArn;
		}

		@NonNull
		String getSecretArn() {
			return this.secretArn;
		}

		@Nullable
		String getDatabase() {
			return this.database;
		}

		@Nullable
		String getSchema() {
			return this.schema;
		}

		boolean getHydrateColumnNames() {
			return this.hydrateColumnNames;
		}

		@NonNull
		FormatOptions getFormatOptions() {
			return this.formatOptions;
		}
	}

	/**
	 * Builder used to construct instances of {@link DataApiClient}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataApiTransport transport;
		@Nullable
		private String resourceArn;
		@Nullable
		private String secretArn;
		@Nullable
		private String database;
		@Nullable
		private String schema;
		@Nullable
		private Engine engine;
		@Nullable
		private Boolean hydrateColumnNames;
		@Nullable
		private FormatOptions formatOptions;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private RetryPolicy retryPolicy;
		@Nullable
		private DelayScheduler delayScheduler;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private ObjectMapper objectMapper;

		private Builder(@NonNull DataApiTransport transport) {
			this.transport = requireNonNull(transport);
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

		/**
		 * Specifies the engine, which drives identifier quoting, cast syntax and type hints. Defaults to
		 * {@link Engine#MYSQL}.
		 *
		 * @param engine the engine
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder engine(@Nullable Engine engine) {
			this.engine = engine;
			return this;
		}

		/**
		 * Specifies whether records are keyed by column label. Defaults to {@code true}.
		 *
		 * @param hydrateColumnNames whether to hydrate records
		 * @return this {@code Builder}, for chaining
		 */
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

		/**
		 * Specifies the zone used when {@link FormatOptions#getTreatAsLocalDate()} is set. Defaults to the system zone.
		 *
		 * @param timeZone the zone
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder retryPolicy(@Nullable RetryPolicy retryPolicy) {
			this.retryPolicy = retryPolicy;
			return this;
		}

		@NonNull
		public Builder delayScheduler(@Nullable DelayScheduler delayScheduler) {
			this.delayScheduler = delayScheduler;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		/**
		 * Specifies the Jackson mapper used for JSON columns, JSON type hints and {@link QueryResult#getRecords(Class)}.
		 *
		 * @param objectMapper the mapper
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder objectMapper(@Nullable ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		@NonNull
		public DataApiClient build() {
			return new DataApiClient(this);
		}
	}
}

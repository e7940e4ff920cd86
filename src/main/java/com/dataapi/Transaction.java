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

import com.dataapi.DataApiClient.TransactionContext;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * A queue of queries to run inside a single Data API transaction.
 * <p>
 * Nothing is sent until {@link #commit()} is called, at which point the transaction is begun, queued queries are run
 * one at a time in the order they were added, and the transaction is committed. If any query fails, later queries are
 * skipped, the transaction is rolled back, the {@link RollbackHandler} (if any) is notified and the returned future
 * completes with the query's failure.
 * <pre>{@code
 * TransactionResult result = client.transaction()
 *   .query("INSERT INTO widget (name) VALUES (:name)", Map.of("name", "first"))
 *   .query((lastResult, allResults) -> QueryOptions.withSql("UPDATE widget SET parent_id = :id WHERE id = 1")
 *     .parameters(Map.of("id", lastResult.getInsertId().orElseThrow()))
 *     .build())
 *   .rollback((failure, status) -> logger.warning("Rolled back: " + status))
 *   .commit()
 *   .join();
 * }</pre>
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class Transaction {
	@NonNull
	private final DataApiClient dataApiClient;
	@NonNull
	private final TransactionOptions transactionOptions;
	@NonNull
	private final List<@NonNull QueuedQuery> queuedQueries;
	@NonNull
	private final Logger logger;

	@Nullable
	private RollbackHandler rollbackHandler;
	private boolean committed;

	Transaction(@NonNull DataApiClient dataApiClient,
							@NonNull TransactionOptions transactionOptions) {
		requireNonNull(dataApiClient);
		requireNonNull(transactionOptions);

		this.dataApiClient = dataApiClient;
		this.transactionOptions = transactionOptions;
		this.queuedQueries = new ArrayList<>();
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{queuedQueries=%d, hasRollbackHandler=%s, committed=%s}", getClass().getSimpleName(),
				this.queuedQueries.size(), getRollbackHandler().isPresent(), this.committed);
	}

	/**
	 * Queues SQL which has no parameters.
	 *
	 * @param sql the SQL to run
	 * @return this transaction, for chaining
	 */
	@NonNull
	public Transaction query(@NonNull String sql) {
		return query(sql, null);
	}

	/**
	 * Queues SQL with parameters, which are validated immediately.
	 *
	 * @param sql        the SQL to run
	 * @param parameters the parameters, in any shape accepted by {@link DataApiClient#query(String, Object)}
	 * @return this transaction, for chaining
	 * @throws IllegalArgumentException if the parameters are malformed
	 */
	@NonNull
	public Transaction query(@NonNull String sql,
													 @Nullable Object parameters) {
		requireNonNull(sql);

		QueryOptions queryOptions = QueryOptions.withSql(sql).build();
		ParameterSet parameterSet = ParameterNormalizer.normalize(parameters);

		return enqueue((lastResult, allResults, transactionContext) ->
				getDataApiClient().executeQuery(queryOptions, parameterSet, transactionContext));
	}

	/**
	 * Queues a fully-specified query. Its database and transaction ID are replaced with the transaction's.
	 *
	 * @param queryOptions the query
	 * @return this transaction, for chaining
	 * @throws IllegalArgumentException if the parameters are malformed
	 */
	@NonNull
	public Transaction query(@NonNull QueryOptions queryOptions) {
		requireNonNull(queryOptions);

		ParameterSet parameterSet = DataApiClient.normalizeQueryOptionsParameters(queryOptions);

		return enqueue((lastResult, allResults, transactionContext) ->
				getDataApiClient().executeQuery(queryOptions, parameterSet, transactionContext));
	}

	/**
	 * Queues a query computed from the results of the queries before it.
	 *
	 * @param queryFunction produces the query when its turn comes
	 * @return this transaction, for chaining
	 */
	@NonNull
	public Transaction query(@NonNull QueryFunction queryFunction) {
		requireNonNull(queryFunction);

		return enqueue((lastResult, allResults, transactionContext) -> {
			QueryOptions queryOptions = queryFunction.apply(lastResult, allResults);

			if (queryOptions == null)
				throw new IllegalArgumentException("Query function must return query options");

			ParameterSet parameterSet = DataApiClient.normalizeQueryOptionsParameters(queryOptions);
			return getDataApiClient().executeQuery(queryOptions, parameterSet, transactionContext);
		});
	}

	/**
	 * Registers a handler to be notified after this transaction is rolled back due to a failed query.
	 *
	 * @param rollbackHandler the handler
	 * @return this transaction, for chaining
	 */
	@NonNull
	public Transaction rollback(@NonNull RollbackHandler rollbackHandler) {
		requireNonNull(rollbackHandler);
		this.rollbackHandler = rollbackHandler;
		return this;
	}

	/**
	 * Begins the transaction, runs every queued query and commits.
	 *
	 * @return a future for the query results and the commit status
	 * @throws IllegalStateException if this transaction has already been committed
	 */
	@NonNull
	public CompletableFuture<TransactionResult> commit() {
		if (this.committed)
			throw new IllegalStateException("Transaction has already been committed");

		this.committed = true;

		List<QueuedQuery> queuedQueries = List.copyOf(this.queuedQueries);
		String resourceArn = getTransactionOptions().getResourceArn().orElse(getDataApiClient().getResourceArn());
		String secretArn = getTransactionOptions().getSecretArn().orElse(getDataApiClient().getSecretArn());
		String database = getTransactionOptions().getDatabase().orElse(getDataApiClient().getDatabase().orElse(null));
		String schema = getTransactionOptions().getSchema().orElse(getDataApiClient().getSchema().orElse(null));
		boolean hydrateColumnNames = getTransactionOptions().getHydrateColumnNames().orElse(getDataApiClient().getHydrateColumnNames());
		FormatOptions formatOptions = getTransactionOptions().getFormatOptions().orElse(getDataApiClient().getFormatOptions());

		BeginTransactionRequest beginTransactionRequest = BeginTransactionRequest.builder()
				.resourceArn(resourceArn)
				.secretArn(secretArn)
				.database(database)
				.schema(schema)
				.build();

		CompletableFuture<TransactionResult> result = new CompletableFuture<>();

		getDataApiClient().beginTransactionWithRetry(beginTransactionRequest).whenComplete((transactionId, throwable) -> {
			if (throwable != null) {
				result.completeExceptionally(RetryController.unwrap(throwable));
				return;
			}

			TransactionContext transactionContext = new TransactionContext(transactionId, resourceArn, secretArn, database,
					schema, hydrateColumnNames, formatOptions);

			runQuery(queuedQueries, 0, new ArrayList<>(queuedQueries.size()), transactionContext, result);
		});

		return result;
	}

	private void runQuery(@NonNull List<QueuedQuery> queuedQueries,
												int index,
												@NonNull List<QueryResult> results,
												@NonNull TransactionContext transactionContext,
												@NonNull CompletableFuture<TransactionResult> result) {
		if (index == queuedQueries.size()) {
			commitTransaction(results, transactionContext, result);
			return;
		}

		QueryResult lastResult = results.isEmpty() ? null : results.get(results.size() - 1);
		CompletableFuture<QueryResult> queryFuture;

		try {
			queryFuture = requireNonNull(queuedQueries.get(index)
					.execute(lastResult, Collections.unmodifiableList(new ArrayList<>(results)), transactionContext));
		} catch (RuntimeException e) {
			queryFuture = CompletableFuture.failedFuture(e);
		}

		queryFuture.whenComplete((queryResult, throwable) -> {
			if (throwable != null) {
				rollbackTransaction(RetryController.unwrap(throwable), transactionContext, result);
				return;
			}

			results.add(queryResult);
			runQuery(queuedQueries, index + 1, results, transactionContext, result);
		});
	}

	private void commitTransaction(@NonNull List<QueryResult> results,
																 @NonNull TransactionContext transactionContext,
																 @NonNull CompletableFuture<TransactionResult> result) {
		CompletableFuture<String> commitFuture;

		try {
			commitFuture = getDataApiClient().commitTransaction(TransactionControlRequest.of(transactionContext.getResourceArn(),
					transactionContext.getSecretArn(), transactionContext.getTransactionId()));
		} catch (RuntimeException e) {
			commitFuture = CompletableFuture.failedFuture(e);
		}

		commitFuture.whenComplete((transactionStatus, throwable) -> {
			if (throwable != null)
				result.completeExceptionally(RetryController.unwrap(throwable));
			else
				result.complete(new TransactionResult(results, transactionStatus));
		});
	}

	private void rollbackTransaction(@NonNull Throwable failure,
																	 @NonNull TransactionContext transactionContext,
																	 @NonNull CompletableFuture<TransactionResult> result) {
		CompletableFuture<String> rollbackFuture;

		try {
			rollbackFuture = getDataApiClient().rollbackTransaction(TransactionControlRequest.of(transactionContext.getResourceArn(),
					transactionContext.getSecretArn(), transactionContext.getTransactionId()));
		} catch (RuntimeException e) {
			rollbackFuture = CompletableFuture.failedFuture(e);
		}

		rollbackFuture.whenComplete((rollbackStatus, throwable) -> {
			String status = rollbackStatus;

			if (throwable != null) {
				Throwable rollbackFailure = RetryController.unwrap(throwable);
				status = null;

				if (rollbackFailure != failure)
					failure.addSuppressed(rollbackFailure);

				getLogger().log(WARNING, format("Unable to roll back transaction %s", transactionContext.getTransactionId()), rollbackFailure);
			}

			RollbackHandler rollbackHandler = getRollbackHandler().orElse(null);

			if (rollbackHandler != null) {
				try {
					rollbackHandler.onRollback(failure, status);
				} catch (RuntimeException e) {
					if (e != failure)
						failure.addSuppressed(e);

					getLogger().log(WARNING, "Rollback handler failed", e);
				}
			}

			result.completeExceptionally(failure);
		});
	}

	@NonNull
	private Transaction enqueue(@NonNull QueuedQuery queuedQuery) {
		requireNonNull(queuedQuery);

		if (this.committed)
			throw new IllegalStateException("Unable to add queries to a transaction which has already been committed");

		this.queuedQueries.add(queuedQuery);
		return this;
	}

	@NonNull
	public TransactionOptions getTransactionOptions() {
		return this.transactionOptions;
	}

	@NonNull
	public Optional<RollbackHandler> getRollbackHandler() {
		return Optional.ofNullable(this.rollbackHandler);
	}

	@NonNull
	private DataApiClient getDataApiClient() {
		return this.dataApiClient;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	@FunctionalInterface
	private interface QueuedQuery {
		@NonNull
		CompletableFuture<QueryResult> execute(@Nullable QueryResult lastResult,
																					 @NonNull List<QueryResult> allResults,
																					 @NonNull TransactionContext transactionContext);
	}
}

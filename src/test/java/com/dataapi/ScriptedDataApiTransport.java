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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * In-memory {@link DataApiTransport} which plays back scripted outcomes and records every request it receives.
 * <p>
 * Each scripted outcome is either a response or a {@link Throwable} to fail with. When a script runs out, calls
 * succeed with a default response.
 *
 * @since 1.0.0
 */
@NotThreadSafe
class ScriptedDataApiTransport implements DataApiTransport {
	@NonNull
	static final String TRANSACTION_ID = "AQC5SRDIm...ZHXP/WORU=";
	@NonNull
	static final String COMMIT_STATUS = "Transaction Committed";
	@NonNull
	static final String ROLLBACK_STATUS = "Rollback Complete";

	@NonNull
	private final Deque<Object> executeStatementOutcomes = new ArrayDeque<>();
	@NonNull
	private final Deque<Object> batchExecuteStatementOutcomes = new ArrayDeque<>();
	@NonNull
	private final Deque<Object> beginTransactionOutcomes = new ArrayDeque<>();
	@NonNull
	private final Deque<Object> commitTransactionOutcomes = new ArrayDeque<>();
	@NonNull
	private final Deque<Object> rollbackTransactionOutcomes = new ArrayDeque<>();

	@NonNull
	private final List<ExecuteStatementRequest> executeStatementRequests = new ArrayList<>();
	@NonNull
	private final List<BatchExecuteStatementRequest> batchExecuteStatementRequests = new ArrayList<>();
	@NonNull
	private final List<BeginTransactionRequest> beginTransactionRequests = new ArrayList<>();
	@NonNull
	private final List<TransactionControlRequest> commitTransactionRequests = new ArrayList<>();
	@NonNull
	private final List<TransactionControlRequest> rollbackTransactionRequests = new ArrayList<>();
	// Every call in order, e.g. "begin", "execute", "commit"
	@NonNull
	private final List<String> calls = new ArrayList<>();

	@NonNull
	ScriptedDataApiTransport scriptExecuteStatement(@NonNull Object... outcomes) {
		this.executeStatementOutcomes.addAll(Arrays.asList(outcomes));
		return this;
	}

	@NonNull
	ScriptedDataApiTransport scriptBatchExecuteStatement(@NonNull Object... outcomes) {
		this.batchExecuteStatementOutcomes.addAll(Arrays.asList(outcomes));
		return this;
	}

	@NonNull
	ScriptedDataApiTransport scriptBeginTransaction(@NonNull Object... outcomes) {
		this.beginTransactionOutcomes.addAll(Arrays.asList(outcomes));
		return this;
	}

	@NonNull
	ScriptedDataApiTransport scriptCommitTransaction(@NonNull Object... outcomes) {
		this.commitTransactionOutcomes.addAll(Arrays.asList(outcomes));
		return this;
	}

	@NonNull
	ScriptedDataApiTransport scriptRollbackTransaction(@NonNull Object... outcomes) {
		this.rollbackTransactionOutcomes.addAll(Arrays.asList(outcomes));
		return this;
	}

	@Override
	@NonNull
	public CompletableFuture<ExecuteStatementResponse> executeStatement(@NonNull ExecuteStatementRequest request) {
		requireNonNull(request);

		this.calls.add("execute");
		this.executeStatementRequests.add(request);
		return playBack(this.executeStatementOutcomes, ExecuteStatementResponse.builder().numberOfRecordsUpdated(0L).build(),
				ExecuteStatementResponse.class);
	}

	@Override
	@NonNull
	public CompletableFuture<BatchExecuteStatementResponse> batchExecuteStatement(@NonNull BatchExecuteStatementRequest request) {
		requireNonNull(request);

		this.calls.add("batch");
		this.batchExecuteStatementRequests.add(request);
		return playBack(this.batchExecuteStatementOutcomes, BatchExecuteStatementResponse.withUpdateResults(List.of()),
				BatchExecuteStatementResponse.class);
	}

	@Override
	@NonNull
	public CompletableFuture<String> beginTransaction(@NonNull BeginTransactionRequest request) {
		requireNonNull(request);

		this.calls.add("begin");
		this.beginTransactionRequests.add(request);
		return playBack(this.beginTransactionOutcomes, TRANSACTION_ID, String.class);
	}

	@Override
	@NonNull
	public CompletableFuture<String> commitTransaction(@NonNull TransactionControlRequest request) {
		requireNonNull(request);

		this.calls.add("commit");
		this.commitTransactionRequests.add(request);
		return playBack(this.commitTransactionOutcomes, COMMIT_STATUS, String.class);
	}

	@Override
	@NonNull
	public CompletableFuture<String> rollbackTransaction(@NonNull TransactionControlRequest request) {
		requireNonNull(request);

		this.calls.add("rollback");
		this.rollbackTransactionRequests.add(request);
		return playBack(this.rollbackTransactionOutcomes, ROLLBACK_STATUS, String.class);
	}

	@NonNull
	private <T> CompletableFuture<T> playBack(@NonNull Deque<Object> outcomes,
																						@NonNull T defaultOutcome,
																						@NonNull Class<T> outcomeType) {
		@Nullable Object outcome = outcomes.pollFirst();

		if (outcome == null)
			return CompletableFuture.completedFuture(defaultOutcome);

		if (outcome instanceof Throwable throwable)
			return CompletableFuture.failedFuture(throwable);

		return CompletableFuture.completedFuture(outcomeType.cast(outcome));
	}

	@NonNull
	List<ExecuteStatementRequest> getExecuteStatementRequests() {
		return this.executeStatementRequests;
	}

	@NonNull
	List<BatchExecuteStatementRequest> getBatchExecuteStatementRequests() {
		return this.batchExecuteStatementRequests;
	}

	@NonNull
	List<BeginTransactionRequest> getBeginTransactionRequests() {
		return this.beginTransactionRequests;
	}

	@NonNull
	List<TransactionControlRequest> getCommitTransactionRequests() {
		return this.commitTransactionRequests;
	}

	@NonNull
	List<TransactionControlRequest> getRollbackTransactionRequests() {
		return this.rollbackTransactionRequests;
	}

	@NonNull
	List<String> getCalls() {
		return this.calls;
	}
}

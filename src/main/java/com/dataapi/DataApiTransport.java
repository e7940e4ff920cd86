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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.CompletableFuture;

/**
 * Contract for sending requests to the Data API, for example by adapting an AWS SDK {@code RdsDataAsyncClient}.
 * <p>
 * Implementations must be threadsafe and should fail with {@link DataApiException}, carrying the remote error code
 * in {@link DataApiException#getCode()}, so failures can be classified for retry. Requests handed to a transport by
 * {@link DataApiClient} always carry resolved ARNs.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface DataApiTransport {
	@NonNull
	CompletableFuture<ExecuteStatementResponse> executeStatement(@NonNull ExecuteStatementRequest request);

	@NonNull
	CompletableFuture<BatchExecuteStatementResponse> batchExecuteStatement(@NonNull BatchExecuteStatementRequest request);

	/**
	 * Begins a transaction.
	 *
	 * @param request the request
	 * @return a future for the new transaction's ID
	 */
	@NonNull
	CompletableFuture<String> beginTransaction(@NonNull BeginTransactionRequest request);

	/**
	 * Commits a transaction.
	 *
	 * @param request the request
	 * @return a future for the transaction status, e.g. {@code "Transaction Committed"}
	 */
	@NonNull
	CompletableFuture<String> commitTransaction(@NonNull TransactionControlRequest request);

	/**
	 * Rolls back a transaction.
	 *
	 * @param request the request
	 * @return a future for the transaction status, e.g. {@code "Rollback Complete"}
	 */
	@NonNull
	CompletableFuture<String> rollbackTransaction(@NonNull TransactionControlRequest request);
}

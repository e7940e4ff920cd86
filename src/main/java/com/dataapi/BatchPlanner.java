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

import static java.util.Objects.requireNonNull;

/**
 * Shapes a {@link BoundStatement} into the request the Data API expects: {@code parameters} for a single row,
 * {@code parameterSets} for a batch.
 * <p>
 * {@code options} must already carry the resolved ARNs, database and transaction ID for the call.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class BatchPlanner {
	private BatchPlanner() {
		// Prevents instantiation
	}

	/**
	 * Builds a single-statement request. Column metadata is requested if records will be hydrated or the caller
	 * asked for it.
	 */
	@NonNull
	static ExecuteStatementRequest planExecuteStatement(@NonNull BoundStatement boundStatement,
																											@NonNull QueryOptions options,
																											boolean hydrateColumnNames) {
		requireNonNull(boundStatement);
		requireNonNull(options);

		if (boundStatement.isBatch())
			throw new IllegalArgumentException("Batch statements must be planned as batch requests");

		return ExecuteStatementRequest.withSql(boundStatement.getSql())
				.resourceArn(options.getResourceArn().orElse(null))
				.secretArn(options.getSecretArn().orElse(null))
				.database(options.getDatabase().orElse(null))
				.schema(options.getSchema().orElse(null))
				.parameters(boundStatement.getParameters())
				.includeResultMetadata(hydrateColumnNames || options.getIncludeResultMetadata())
				.continueAfterTimeout(options.getContinueAfterTimeout().orElse(null))
				.resultSetOptions(options.getResultSetOptions().orElse(null))
				.transactionId(options.getTransactionId().orElse(null))
				.build();
	}

	/**
	 * Builds a batch request. Batches report generated fields per row rather than records, so metadata is never
	 * requested.
	 */
	@NonNull
	static BatchExecuteStatementRequest planBatchExecuteStatement(@NonNull BoundStatement boundStatement,
																																@NonNull QueryOptions options) {
		requireNonNull(boundStatement);
		requireNonNull(options);

		if (!boundStatement.isBatch())
			throw new IllegalArgumentException("Single statements must be planned as single requests");

		return BatchExecuteStatementRequest.withSql(boundStatement.getSql())
				.resourceArn(options.getResourceArn().orElse(null))
				.secretArn(options.getSecretArn().orElse(null))
				.database(options.getDatabase().orElse(null))
				.schema(options.getSchema().orElse(null))
				.parameterSets(boundStatement.getParameterSets())
				.transactionId(options.getTransactionId().orElse(null))
				.build();
	}
}

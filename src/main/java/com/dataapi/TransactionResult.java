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
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The outcome of a committed {@link Transaction}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TransactionResult {
	@NonNull
	private final List<QueryResult> results;
	@NonNull
	private final String transactionStatus;

	TransactionResult(@NonNull List<QueryResult> results,
										@NonNull String transactionStatus) {
		this.results = List.copyOf(requireNonNull(results));
		this.transactionStatus = requireNonNull(transactionStatus);
	}

	/**
	 * Gets each query's result, in execution order.
	 *
	 * @return the query results
	 */
	@NonNull
	public List<QueryResult> getResults() {
		return this.results;
	}

	/**
	 * Gets the status reported by the commit call, e.g. {@code "Transaction Committed"}.
	 *
	 * @return the commit status
	 */
	@NonNull
	public String getTransactionStatus() {
		return this.transactionStatus;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TransactionResult))
			return false;

		TransactionResult transactionResult = (TransactionResult) object;

		return Objects.equals(getResults(), transactionResult.getResults())
				&& Objects.equals(getTransactionStatus(), transactionResult.getTransactionStatus());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getResults(), getTransactionStatus());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{results=%s, transactionStatus=%s}", getClass().getSimpleName(), getResults(),
				getTransactionStatus());
	}
}

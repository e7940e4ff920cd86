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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@code CommitTransaction} or {@code RollbackTransaction} call.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TransactionControlRequest {
	@Nullable
	private final String resourceArn;
	@Nullable
	private final String secretArn;
	@NonNull
	private final String transactionId;

	private TransactionControlRequest(@Nullable String resourceArn,
																		@Nullable String secretArn,
																		@NonNull String transactionId) {
		this.resourceArn = resourceArn;
		this.secretArn = secretArn;
		this.transactionId = requireNonNull(transactionId);
	}

	/**
	 * Acquires a request for the given transaction; the client fills in its own ARNs.
	 *
	 * @param transactionId the transaction to commit or roll back
	 * @return the request
	 */
	@NonNull
	public static TransactionControlRequest forTransactionId(@NonNull String transactionId) {
		return new TransactionControlRequest(null, null, transactionId);
	}

	@NonNull
	public static TransactionControlRequest of(@Nullable String resourceArn,
																						 @Nullable String secretArn,
																						 @NonNull String transactionId) {
		return new TransactionControlRequest(resourceArn, secretArn, transactionId);
	}

	@NonNull
	public Optional<String> getResourceArn() {
		return Optional.ofNullable(this.resourceArn);
	}

	@NonNull
	public Optional<String> getSecretArn() {
		return Optional.ofNullable(this.secretArn);
	}

	@NonNull
	public String getTransactionId() {
		return this.transactionId;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TransactionControlRequest))
			return false;

		TransactionControlRequest request = (TransactionControlRequest) object;

		return Objects.equals(getResourceArn(), request.getResourceArn())
				&& Objects.equals(getSecretArn(), request.getSecretArn())
				&& Objects.equals(getTransactionId(), request.getTransactionId());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getResourceArn(), getSecretArn(), getTransactionId());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{resourceArn=%s, transactionId=%s}", getClass().getSimpleName(), this.resourceArn,
				getTransactionId());
	}
}

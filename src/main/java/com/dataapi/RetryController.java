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
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs asynchronous Data API calls, retrying transient failures according to a {@link RetryPolicy}.
 * <p>
 * The first retryable failure of a call picks the {@link RetryCondition} whose schedule is used for the rest of that
 * call, even if later failures are of a different retryable kind. Fatal failures, and failures once the schedule is
 * exhausted, complete the call exceptionally with the unwrapped error.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RetryController {
	@NonNull
	private static final String DATABASE_RESUMING_CODE = "DatabaseResumingException";
	@NonNull
	private static final String DATABASE_RESUMING_MESSAGE = "is resuming after being auto-paused";
	@NonNull
	private static final List<String> CONNECTION_ERROR_CODES = List.of("BadRequestException", "StatementTimeoutException");
	@NonNull
	private static final List<String> CONNECTION_ERROR_MESSAGES = List.of(
			"Communications link failure",
			"Connection is not available",
			"currently unavailable",
			"Database cluster is not available",
			"Can't connect to",
			"Connection timed out");

	@NonNull
	private final RetryPolicy retryPolicy;
	@NonNull
	private final DelayScheduler delayScheduler;
	@NonNull
	private final Logger logger;

	public RetryController(@NonNull RetryPolicy retryPolicy,
												 @NonNull DelayScheduler delayScheduler) {
		this.retryPolicy = requireNonNull(retryPolicy);
		this.delayScheduler = requireNonNull(delayScheduler);
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Runs {@code operation}, retrying it as the policy allows.
	 *
	 * @param operation supplies a fresh attempt each time it is invoked
	 * @param <T>       the result type
	 * @return a future for the first successful result, or the final failure
	 */
	@NonNull
	public <T> CompletableFuture<T> execute(@NonNull Supplier<CompletableFuture<T>> operation) {
		requireNonNull(operation);

		CompletableFuture<T> result = new CompletableFuture<>();
		attempt(operation, result, 0, null);
		return result;
	}

	private <T> void attempt(@NonNull Supplier<CompletableFuture<T>> operation,
													 @NonNull CompletableFuture<T> result,
													 int retryCount,
													 @Nullable RetryCondition heldCondition) {
		CompletableFuture<T> attemptFuture;

		try {
			attemptFuture = requireNonNull(operation.get());
		} catch (RuntimeException e) {
			attemptFuture = CompletableFuture.failedFuture(e);
		}

		attemptFuture.whenComplete((value, throwable) -> {
			if (throwable == null) {
				result.complete(value);
				return;
			}

			Throwable failure = unwrap(throwable);

			if (!getRetryPolicy().isEnabled()) {
				result.completeExceptionally(failure);
				return;
			}

			RetryCondition condition = heldCondition;

			if (condition == null)
				condition = classify(failure, getRetryPolicy()).orElse(null);
			else if (classify(failure, getRetryPolicy()).isEmpty())
				condition = null;

			int retryNumber = retryCount + 1;

			if (condition == null || retryNumber > condition.getMaximumRetries(getRetryPolicy())) {
				result.completeExceptionally(failure);
				return;
			}

			RetryCondition retryCondition = condition;
			Duration delay = retryCondition.getDelayBeforeRetry(retryNumber);

			if (getLogger().isLoggable(Level.FINE))
				getLogger().fine(format("Retrying after %s (%s retry %d of %d) due to %s", delay, retryCondition.name(),
						retryNumber, retryCondition.getMaximumRetries(getRetryPolicy()), failure));

			CompletableFuture<Void> delayFuture;

			try {
				delayFuture = requireNonNull(getDelayScheduler().delay(delay));
			} catch (RuntimeException e) {
				failure.addSuppressed(e);
				result.completeExceptionally(failure);
				return;
			}

			delayFuture.whenComplete((ignored, delayFailure) -> {
				if (delayFailure != null) {
					failure.addSuppressed(unwrap(delayFailure));
					result.completeExceptionally(failure);
				} else {
					attempt(operation, result, retryNumber, retryCondition);
				}
			});
		});
	}

	/**
	 * Determines which retry condition, if any, applies to a failure.
	 *
	 * @param throwable   the failure, possibly wrapped in a {@link CompletionException} or {@link ExecutionException}
	 * @param retryPolicy supplies custom retryable error codes
	 * @return the applicable condition, or {@link Optional#empty()} if the failure is fatal
	 */
	@NonNull
	public static Optional<RetryCondition> classify(@NonNull Throwable throwable,
																									@NonNull RetryPolicy retryPolicy) {
		requireNonNull(throwable);
		requireNonNull(retryPolicy);

		if (isDatabaseResuming(throwable))
			return Optional.of(RetryCondition.DATABASE_RESUMING);

		if (isConnectionError(throwable))
			return Optional.of(RetryCondition.CONNECTION);

		if (isRetryableError(throwable, retryPolicy))
			return Optional.of(RetryCondition.CUSTOM);

		return Optional.empty();
	}

	/**
	 * Is this failure a cold start, i.e. the cluster is waking up from auto-pause?
	 *
	 * @param throwable the failure
	 * @return {@code true} if the cluster is resuming
	 */
	public static boolean isDatabaseResuming(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable failure = unwrap(throwable);

		if (DATABASE_RESUMING_CODE.equals(errorCode(failure)))
			return true;

		String message = failure.getMessage();
		return message != null && message.contains(DATABASE_RESUMING_MESSAGE);
	}

	/**
	 * Is this failure a transient connection problem?
	 *
	 * @param throwable the failure
	 * @return {@code true} if the failure is connection-related
	 */
	public static boolean isConnectionError(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable failure = unwrap(throwable);

		if (CONNECTION_ERROR_CODES.contains(errorCode(failure)))
			return true;

		String message = failure.getMessage();

		if (message == null)
			return false;

		for (String connectionErrorMessage : CONNECTION_ERROR_MESSAGES)
			if (message.contains(connectionErrorMessage))
				return true;

		return false;
	}

	/**
	 * Is this failure's code (or exception class simple name) listed as retryable by the policy?
	 *
	 * @param throwable   the failure
	 * @param retryPolicy the policy in effect
	 * @return {@code true} if the policy names this failure as retryable
	 */
	public static boolean isRetryableError(@NonNull Throwable throwable,
																				 @NonNull RetryPolicy retryPolicy) {
		requireNonNull(throwable);
		requireNonNull(retryPolicy);

		Throwable failure = unwrap(throwable);

		return retryPolicy.getRetryableErrorCodes().contains(errorCode(failure))
				|| retryPolicy.getRetryableErrorCodes().contains(failure.getClass().getSimpleName());
	}

	@NonNull
	private static String errorCode(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		if (throwable instanceof DataApiException dataApiException && dataApiException.getCode().isPresent())
			return dataApiException.getCode().get();

		return throwable.getClass().getSimpleName();
	}

	@NonNull
	static Throwable unwrap(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable unwrapped = throwable;

		while ((unwrapped instanceof CompletionException || unwrapped instanceof ExecutionException) && unwrapped.getCause() != null)
			unwrapped = unwrapped.getCause();

		return unwrapped;
	}

	@NonNull
	public RetryPolicy getRetryPolicy() {
		return this.retryPolicy;
	}

	@NonNull
	private DelayScheduler getDelayScheduler() {
		return this.delayScheduler;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}

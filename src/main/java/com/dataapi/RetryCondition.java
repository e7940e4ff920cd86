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

import java.time.Duration;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Kinds of retryable failures, each with its own backoff schedule.
 * <p>
 * The delay before retry {@code n} (counting from 1) is element {@code n} of the schedule.
 *
 * @since 1.0.0
 */
public enum RetryCondition {
	/**
	 * The cluster was auto-paused and is waking up, which can take close to a minute.
	 */
	DATABASE_RESUMING(Schedules.RESUMING_DELAYS, false),
	/**
	 * A transient connection problem. Retried twice regardless of {@link RetryPolicy#getMaximumRetries()}.
	 */
	CONNECTION(Schedules.CONNECTION_DELAYS, true),
	/**
	 * An error code listed in {@link RetryPolicy#getRetryableErrorCodes()}. Uses the cold start schedule.
	 */
	CUSTOM(Schedules.RESUMING_DELAYS, false);

	@NonNull
	private final List<Duration> delays;
	private final boolean fixedBudget;

	RetryCondition(@NonNull List<Duration> delays,
								 boolean fixedBudget) {
		this.delays = requireNonNull(delays);
		this.fixedBudget = fixedBudget;
	}

	/**
	 * Gets the backoff schedule. Element 0 corresponds to the initial attempt.
	 *
	 * @return the schedule
	 */
	@NonNull
	public List<Duration> getDelays() {
		return this.delays;
	}

	/**
	 * How many retries are permitted for this condition under the given policy?
	 *
	 * @param retryPolicy the policy in effect
	 * @return the maximum number of retries
	 */
	public int getMaximumRetries(@NonNull RetryPolicy retryPolicy) {
		requireNonNull(retryPolicy);

		int scheduledRetries = getDelays().size() - 1;
		return this.fixedBudget ? scheduledRetries : Math.min(retryPolicy.getMaximumRetries(), scheduledRetries);
	}

	/**
	 * Gets the delay before the given retry.
	 *
	 * @param retryNumber the retry, counting from 1
	 * @return the delay
	 */
	@NonNull
	public Duration getDelayBeforeRetry(int retryNumber) {
		if (retryNumber < 1 || retryNumber >= getDelays().size())
			throw new IllegalArgumentException("Retry number is outside of the schedule");

		return getDelays().get(retryNumber);
	}

	private static final class Schedules {
		@NonNull
		private static final List<Duration> RESUMING_DELAYS = List.of(Duration.ZERO, Duration.ofSeconds(2),
				Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(15), Duration.ofSeconds(20),
				Duration.ofSeconds(25), Duration.ofSeconds(30), Duration.ofSeconds(35), Duration.ofSeconds(40));
		@NonNull
		private static final List<Duration> CONNECTION_DELAYS = List.of(Duration.ZERO, Duration.ofSeconds(2),
				Duration.ofSeconds(4));
	}
}

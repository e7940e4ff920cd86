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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Configures how {@link RetryController} retries failed Data API calls.
 * <p>
 * By default retries are enabled, at most {@value #DEFAULT_MAXIMUM_RETRIES} retries are attempted for a cold start
 * and no extra error codes are retryable.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RetryPolicy {
	public static final int DEFAULT_MAXIMUM_RETRIES = 9;

	@NonNull
	private static final RetryPolicy DEFAULT_INSTANCE = builder().build();
	@NonNull
	private static final RetryPolicy DISABLED_INSTANCE = builder().enabled(false).build();

	private final boolean enabled;
	private final int maximumRetries;
	@NonNull
	private final Set<String> retryableErrorCodes;

	private RetryPolicy(@NonNull Builder builder) {
		requireNonNull(builder);

		this.enabled = builder.enabled;
		this.maximumRetries = builder.maximumRetries;
		this.retryableErrorCodes = builder.retryableErrorCodes == null ? Set.of() : Set.copyOf(builder.retryableErrorCodes);
	}

	@NonNull
	public static RetryPolicy defaults() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	public static RetryPolicy disabled() {
		return DISABLED_INSTANCE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	public boolean isEnabled() {
		return this.enabled;
	}

	/**
	 * Gets the retry budget for cold starts and custom retryable errors. Connection errors always use their own
	 * fixed budget.
	 *
	 * @return the maximum number of retries
	 */
	public int getMaximumRetries() {
		return this.maximumRetries;
	}

	/**
	 * Gets additional error codes (or exception class simple names) which should be retried.
	 *
	 * @return the retryable error codes
	 */
	@NonNull
	public Set<String> getRetryableErrorCodes() {
		return this.retryableErrorCodes;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RetryPolicy))
			return false;

		RetryPolicy retryPolicy = (RetryPolicy) object;

		return isEnabled() == retryPolicy.isEnabled()
				&& getMaximumRetries() == retryPolicy.getMaximumRetries()
				&& Objects.equals(getRetryableErrorCodes(), retryPolicy.getRetryableErrorCodes());
	}

	@Override
	public int hashCode() {
		return Objects.hash(isEnabled(), getMaximumRetries(), getRetryableErrorCodes());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{enabled=%s, maximumRetries=%s, retryableErrorCodes=%s}", getClass().getSimpleName(),
				isEnabled(), getMaximumRetries(), getRetryableErrorCodes());
	}

	/**
	 * Builder used to construct instances of {@link RetryPolicy}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		private boolean enabled;
		private int maximumRetries;
		@Nullable
		private Set<String> retryableErrorCodes;

		private Builder() {
			this.enabled = true;
			this.maximumRetries = DEFAULT_MAXIMUM_RETRIES;
		}

		@NonNull
		public Builder enabled(boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		@NonNull
		public Builder maximumRetries(int maximumRetries) {
			if (maximumRetries < 0)
				throw new IllegalArgumentException("Maximum retries must be >= 0");

			this.maximumRetries = maximumRetries;
			return this;
		}

		@NonNull
		public Builder retryableErrorCodes(@Nullable Set<String> retryableErrorCodes) {
			this.retryableErrorCodes = retryableErrorCodes;
			return this;
		}

		@NonNull
		public RetryPolicy build() {
			return new RetryPolicy(this);
		}
	}
}

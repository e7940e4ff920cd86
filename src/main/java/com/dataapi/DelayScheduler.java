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
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Contract for waiting between retries without blocking a thread.
 * <p>
 * Implementations should be threadsafe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface DelayScheduler {
	/**
	 * Acquires a future which completes once {@code delay} has elapsed.
	 *
	 * @param delay how long to wait
	 * @return a future which completes after the delay
	 */
	@NonNull
	CompletableFuture<Void> delay(@NonNull Duration delay);

	/**
	 * Acquires the default scheduler, backed by {@link CompletableFuture#delayedExecutor(long, TimeUnit)}.
	 *
	 * @return the default scheduler
	 */
	@NonNull
	static DelayScheduler defaultInstance() {
		return (delay) -> {
			requireNonNull(delay);

			if (delay.isZero() || delay.isNegative())
				return CompletableFuture.completedFuture(null);

			return CompletableFuture.runAsync(() -> {
				// Nothing to do, completion is the signal
			}, CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS));
		};
	}
}

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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class RetryControllerTests {
	@Test
	public void testSuccessIsNotRetried() throws Exception {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		AtomicInteger attempts = new AtomicInteger();

		String result = new RetryController(RetryPolicy.defaults(), delayScheduler).execute(() -> {
			attempts.incrementAndGet();
			return CompletableFuture.completedFuture("ok");
		}).get();

		Assertions.assertEquals("ok", result);
		Assertions.assertEquals(1, attempts.get());
		Assertions.assertEquals(List.of(), delayScheduler.getDelays());
	}

	@Test
	public void testColdStartIsRetriedOnResumingSchedule() throws Exception {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		ScriptedOperation operation = new ScriptedOperation(resuming(), resuming(), "ok");

		Assertions.assertEquals("ok", new RetryController(RetryPolicy.defaults(), delayScheduler).execute(operation).get());
		Assertions.assertEquals(3, operation.getAttempts());
		Assertions.assertEquals(List.of(Duration.ofMillis(2000), Duration.ofMillis(5000)), delayScheduler.getDelays());
	}

	@Test
	public void testConnectionErrorsStopAfterThreeAttemptsRegardlessOfMaximumRetries() {
		for (RetryPolicy retryPolicy : List.of(RetryPolicy.defaults(), RetryPolicy.builder().maximumRetries(0).build())) {
			RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
			DataApiException failure = new DataApiException("Communications link failure");
			ScriptedOperation operation = new ScriptedOperation(failure, failure, failure, failure, failure);

			ExecutionException e = Assertions.assertThrows(ExecutionException.class,
					() -> new RetryController(retryPolicy, delayScheduler).execute(operation).get());

			Assertions.assertSame(failure, e.getCause());
			Assertions.assertEquals(3, operation.getAttempts());
			Assertions.assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(4)), delayScheduler.getDelays());
		}
	}

	@Test
	public void testResumingRespectsMaximumRetries() {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		ScriptedOperation operation = new ScriptedOperation(resuming(), resuming(), resuming(), resuming(), resuming());

		Assertions.assertThrows(ExecutionException.class, () -> new RetryController(
				RetryPolicy.builder().maximumRetries(3).build(), delayScheduler).execute(operation).get());

		Assertions.assertEquals(4, operation.getAttempts());
		Assertions.assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(5), Duration.ofSeconds(10)), delayScheduler.getDelays());
	}

	@Test
	public void testResumingScheduleIsExhaustedAfterNineRetries() {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		Object[] outcomes = new Object[12];
		Arrays.fill(outcomes, resuming());
		ScriptedOperation operation = new ScriptedOperation(outcomes);

		Assertions.assertThrows(ExecutionException.class,
				() -> new RetryController(RetryPolicy.builder().maximumRetries(50).build(), delayScheduler).execute(operation).get());

		Assertions.assertEquals(10, operation.getAttempts());
		Assertions.assertEquals(Duration.ofSeconds(40), delayScheduler.getDelays().get(8));
	}

	@Test
	public void testScheduleIsHeldOnceChosen() throws Exception {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		ScriptedOperation operation = new ScriptedOperation(resuming(), new DataApiException("Connection timed out"), "ok");

		Assertions.assertEquals("ok", new RetryController(RetryPolicy.defaults(), delayScheduler).execute(operation).get());
		// A connection schedule would have waited 4 seconds before the second retry
		Assertions.assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(5)), delayScheduler.getDelays());
	}

	@Test
	public void testFatalFailureEndsHeldSchedule() {
		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		IllegalStateException fatal = new IllegalStateException("boom");
		ScriptedOperation operation = new ScriptedOperation(resuming(), fatal, "ok");

		ExecutionException e = Assertions.assertThrows(ExecutionException.class,
				() -> new RetryController(RetryPolicy.defaults(), delayScheduler).execute(operation).get());

		Assertions.assertSame(fatal, e.getCause());
		Assertions.assertEquals(2, operation.getAttempts());
	}

	@Test
	public void testDisabledPolicyRunsOnce() {
		ScriptedOperation operation = new ScriptedOperation(resuming(), "ok");

		Assertions.assertThrows(ExecutionException.class,
				() -> new RetryController(RetryPolicy.disabled(), new RecordingDelayScheduler()).execute(operation).get());
		Assertions.assertEquals(1, operation.getAttempts());
	}

	@Test
	public void testCustomRetryableCodes() throws Exception {
		RetryPolicy retryPolicy = RetryPolicy.builder()
				.maximumRetries(2)
				.retryableErrorCodes(Set.of("ThrottlingException", "IllegalStateException"))
				.build();

		RecordingDelayScheduler delayScheduler = new RecordingDelayScheduler();
		ScriptedOperation operation = new ScriptedOperation(new DataApiException("Slow down", "ThrottlingException"),
				new IllegalStateException("flaky"), "ok");

		Assertions.assertEquals("ok", new RetryController(retryPolicy, delayScheduler).execute(operation).get());
		Assertions.assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(5)), delayScheduler.getDelays());

		ScriptedOperation exhausted = new ScriptedOperation(new IllegalStateException("1"), new IllegalStateException("2"),
				new IllegalStateException("3"), "ok");

		Assertions.assertThrows(ExecutionException.class,
				() -> new RetryController(retryPolicy, new RecordingDelayScheduler()).execute(exhausted).get());
		Assertions.assertEquals(3, exhausted.getAttempts());
	}

	@Test
	public void testSynchronousOperationFailureIsTreatedLikeAnyOther() throws Exception {
		AtomicInteger attempts = new AtomicInteger();

		String result = new RetryController(RetryPolicy.defaults(), new RecordingDelayScheduler()).execute(() -> {
			if (attempts.incrementAndGet() == 1)
				throw resuming();

			return CompletableFuture.completedFuture("ok");
		}).get();

		Assertions.assertEquals("ok", result);
		Assertions.assertEquals(2, attempts.get());
	}

	@Test
	public void testDelayFailureIsSuppressed() {
		RuntimeException timerFailure = new RuntimeException("timer");
		DataApiException failure = resuming();

		ExecutionException e = Assertions.assertThrows(ExecutionException.class,
				() -> new RetryController(RetryPolicy.defaults(), (delay) -> CompletableFuture.failedFuture(timerFailure))
						.execute(new ScriptedOperation(failure, "ok")).get());

		Assertions.assertSame(failure, e.getCause());
		Assertions.assertSame(timerFailure, e.getCause().getSuppressed()[0]);
	}

	@Test
	public void testClassification() {
		Assertions.assertEquals(Optional.of(RetryCondition.DATABASE_RESUMING),
				RetryController.classify(new RuntimeException("Database my-cluster is resuming after being auto-paused"), RetryPolicy.defaults()));
		Assertions.assertEquals(Optional.of(RetryCondition.DATABASE_RESUMING),
				RetryController.classify(new CompletionException(resuming()), RetryPolicy.defaults()));
		Assertions.assertEquals(Optional.of(RetryCondition.CONNECTION),
				RetryController.classify(new DataApiException("Timed out", "StatementTimeoutException"), RetryPolicy.defaults()));
		Assertions.assertEquals(Optional.empty(),
				RetryController.classify(new DataApiException("Duplicate entry", "DuplicateKeyException"), RetryPolicy.defaults()));
	}

	@Test
	public void testDefaultDelaySchedulerCompletesImmediatelyForZeroDelay() {
		Assertions.assertTrue(DelayScheduler.defaultInstance().delay(Duration.ZERO).isDone());
		Assertions.assertDoesNotThrow(() -> DelayScheduler.defaultInstance().delay(Duration.ofMillis(5)).get());
	}

	@NonNull
	private static DataApiException resuming() {
		return new DataApiException("Database is resuming", "DatabaseResumingException");
	}

	/**
	 * Plays back outcomes in order: {@link Throwable}s fail the attempt, anything else succeeds with that value.
	 */
	private static class ScriptedOperation implements Supplier<CompletableFuture<String>> {
		@NonNull
		private final Deque<Object> outcomes;
		@NonNull
		private final AtomicInteger attempts;

		ScriptedOperation(@NonNull Object... outcomes) {
			requireNonNull(outcomes);

			this.outcomes = new ArrayDeque<>(Arrays.asList(outcomes));
			this.attempts = new AtomicInteger();
		}

		@Override
		@NonNull
		public CompletableFuture<String> get() {
			this.attempts.incrementAndGet();

			Object outcome = this.outcomes.removeFirst();

			if (outcome instanceof Throwable throwable)
				return CompletableFuture.failedFuture(throwable);

			return CompletableFuture.completedFuture((String) outcome);
		}

		int getAttempts() {
			return this.attempts.get();
		}
	}
}

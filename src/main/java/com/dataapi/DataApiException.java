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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when the Data API reports an error, or when its response cannot be decoded.
 * <p>
 * {@link #getCode()} carries the remote error code (for example {@code DatabaseResumingException} or
 * {@code BadRequestException}) when one was reported. {@link DataApiTransport} implementations should surface remote
 * failures as instances of this class so that {@link RetryController} can classify them.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DataApiException extends RuntimeException {
	@Nullable
	private final String code;

	/**
	 * Creates a {@code DataApiException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public DataApiException(@Nullable String message) {
		this(message, null, null);
	}

	/**
	 * Creates a {@code DataApiException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public DataApiException(@Nullable String message,
													@Nullable Throwable cause) {
		this(message, null, cause);
	}

	/**
	 * Creates a {@code DataApiException} for an error the Data API reported.
	 *
	 * @param message a message describing this exception
	 * @param code    the remote error code, e.g. {@code StatementTimeoutException}
	 */
	public DataApiException(@Nullable String message,
													@Nullable String code) {
		this(message, code, null);
	}

	/**
	 * Creates a {@code DataApiException} for an error the Data API reported.
	 *
	 * @param message a message describing this exception
	 * @param code    the remote error code, e.g. {@code StatementTimeoutException}
	 * @param cause   the cause of this exception
	 */
	public DataApiException(@Nullable String message,
													@Nullable String code,
													@Nullable Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(2);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getCode().isPresent())
			components.add(format("code=%s", getCode().get()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * Gets the remote error code.
	 *
	 * @return the error code, if the Data API reported one
	 */
	@NonNull
	public Optional<String> getCode() {
		return Optional.ofNullable(this.code);
	}
}

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

import static java.util.Objects.requireNonNull;

/**
 * Fluent interface for acquiring instances of specialized parameter types.
 * <p>
 * Example usage:
 * <pre>{@code
 * // Plain map: one named parameter per entry
 * client.query("SELECT * FROM widget WHERE id = :id", Map.of("id", 42));
 *
 * // Explicit named parameters, with a cast
 * client.query("INSERT INTO widget (id, meta) VALUES (:id, :meta)", List.of(
 *   Parameters.named("id", UUID.randomUUID(), "uuid"),
 *   Parameters.named("meta", "{\"color\":\"red\"}", "jsonb")));
 *
 * // Already-typed value, sent verbatim
 * client.query("SELECT * FROM widget WHERE code = :code",
 *   List.of(Parameters.named("code", Parameters.typed(FieldType.STRING_VALUE, "00042"))));
 * }</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Parameters {
	private Parameters() {
		// Prevents instantiation
	}

	/**
	 * Acquires a named parameter.
	 *
	 * @param name  the parameter name (without the leading {@code :})
	 * @param value the value, may be {@code null}
	 * @return a named parameter
	 */
	@NonNull
	public static NamedParameter named(@NonNull String name,
																		 @Nullable Object value) {
		requireNonNull(name);
		return new NamedParameter(name, value, null);
	}

	/**
	 * Acquires a named parameter whose placeholder is rewritten with an explicit cast.
	 *
	 * @param name  the parameter name (without the leading {@code :})
	 * @param value the value, may be {@code null}
	 * @param cast  the SQL type to cast to, e.g. {@code "uuid"} or {@code "jsonb"}
	 * @return a named parameter
	 */
	@NonNull
	public static NamedParameter named(@NonNull String name,
																		 @Nullable Object value,
																		 @NonNull String cast) {
		requireNonNull(name);
		requireNonNull(cast);

		if (cast.isBlank())
			throw new IllegalArgumentException("Cast must not be blank");

		return new NamedParameter(name, value, cast);
	}

	/**
	 * Acquires an already-typed value which is sent to the Data API exactly as given, skipping type inference.
	 *
	 * @param type  the wire type tag
	 * @param value the native value for the tag
	 * @return a typed value
	 */
	@NonNull
	public static Field typed(@NonNull FieldType type,
														@Nullable Object value) {
		requireNonNull(type);
		return Field.of(type, value);
	}
}

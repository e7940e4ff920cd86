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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Quotes identifier values (table and column names) supplied through {@code ::name} tokens.
 * <p>
 * MySQL identifiers are backtick-quoted per dot-separated segment, so {@code schema.table} becomes
 * {@code `schema`.`table`}. PostgreSQL identifiers are always double-quoted as a whole. Embedded quote characters
 * are doubled in both cases.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class IdentifierEscaper {
	@NonNull
	private final Engine engine;

	public IdentifierEscaper(@NonNull Engine engine) {
		this.engine = requireNonNull(engine);
	}

	/**
	 * Quotes the identifier bound to the given parameter name.
	 *
	 * @param name  the parameter name, used for error reporting
	 * @param value the identifier, which must be a {@link CharSequence}
	 * @return the quoted identifier
	 * @throws IllegalArgumentException if {@code value} is not a non-blank string
	 */
	@NonNull
	public String escape(@NonNull String name,
											 @Nullable Object value) {
		requireNonNull(name);

		if (!(value instanceof CharSequence))
			throw new IllegalArgumentException(format("Identifier '%s' must be a string, but was %s", name,
					value == null ? "null" : value.getClass().getName()));

		String identifier = value.toString();

		if (identifier.isBlank())
			throw new IllegalArgumentException(format("Identifier '%s' must not be blank", name));

		if (getEngine() == Engine.PG)
			return format("\"%s\"", identifier.replace("\"", "\"\""));

		StringBuilder escapedIdentifier = new StringBuilder(identifier.length() + 4);
		String[] segments = identifier.split("\\.", -1);

		for (int i = 0; i < segments.length; ++i) {
			if (i > 0)
				escapedIdentifier.append('.');

			escapedIdentifier.append('`').append(segments[i].replace("`", "``")).append('`');
		}

		return escapedIdentifier.toString();
	}

	@NonNull
	public Engine getEngine() {
		return this.engine;
	}
}

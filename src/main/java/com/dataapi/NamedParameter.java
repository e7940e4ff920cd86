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
 * A caller-supplied parameter value bound to a name, before encoding.
 * <p>
 * If a {@code cast} is present, the matching {@code :name} placeholder is rewritten with an explicit cast when the
 * statement is prepared (for example {@code :id::uuid} for PostgreSQL or {@code CAST(:id AS DECIMAL)} for MySQL).
 * <p>
 * Instances are usually acquired via {@link Parameters#named(String, Object)} and
 * {@link Parameters#named(String, Object, String)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class NamedParameter {
	@NonNull
	private final String name;
	@Nullable
	private final Object value;
	@Nullable
	private final String cast;

	NamedParameter(@NonNull String name,
								 @Nullable Object value,
								 @Nullable String cast) {
		requireNonNull(name);

		if (name.isBlank())
			throw new IllegalArgumentException("Parameter name must not be blank");

		this.name = name;
		this.value = value;
		this.cast = cast;
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * Gets the raw value of this parameter.
	 *
	 * @return the value, which may be {@code null}
	 */
	@Nullable
	public Object getValue() {
		return this.value;
	}

	@NonNull
	public Optional<String> getCast() {
		return Optional.ofNullable(this.cast);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof NamedParameter))
			return false;

		NamedParameter namedParameter = (NamedParameter) object;

		return Objects.equals(getName(), namedParameter.getName())
				&& Objects.equals(getValue(), namedParameter.getValue())
				&& Objects.equals(getCast(), namedParameter.getCast());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValue(), getCast());
	}

	@Override
	@NonNull
	public String toString() {
		if (this.cast == null)
			return format("%s{name=%s, value=%s}", getClass().getSimpleName(), getName(), getValue());

		return format("%s{name=%s, value=%s, cast=%s}", getClass().getSimpleName(), getName(), getValue(), this.cast);
	}
}

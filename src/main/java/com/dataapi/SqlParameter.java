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
 * An encoded statement parameter in wire form: a name, a typed {@link Field} and an optional {@link TypeHint}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlParameter {
	@NonNull
	private final String name;
	@NonNull
	private final Field value;
	@Nullable
	private final TypeHint typeHint;

	private SqlParameter(@NonNull String name,
											 @NonNull Field value,
											 @Nullable TypeHint typeHint) {
		this.name = requireNonNull(name);
		this.value = requireNonNull(value);
		this.typeHint = typeHint;
	}

	@NonNull
	public static SqlParameter of(@NonNull String name,
																@NonNull Field value) {
		return new SqlParameter(name, value, null);
	}

	@NonNull
	public static SqlParameter of(@NonNull String name,
																@NonNull Field value,
																@Nullable TypeHint typeHint) {
		return new SqlParameter(name, value, typeHint);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Field getValue() {
		return this.value;
	}

	@NonNull
	public Optional<TypeHint> getTypeHint() {
		return Optional.ofNullable(this.typeHint);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SqlParameter))
			return false;

		SqlParameter sqlParameter = (SqlParameter) object;

		return Objects.equals(getName(), sqlParameter.getName())
				&& Objects.equals(getValue(), sqlParameter.getValue())
				&& Objects.equals(getTypeHint(), sqlParameter.getTypeHint());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getValue(), getTypeHint());
	}

	@Override
	@NonNull
	public String toString() {
		if (this.typeHint == null)
			return format("%s{name=%s, value=%s}", getClass().getSimpleName(), getName(), getValue());

		return format("%s{name=%s, value=%s, typeHint=%s}", getClass().getSimpleName(), getName(), getValue(), this.typeHint);
	}
}

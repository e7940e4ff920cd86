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

/**
 * The outcome of one row of a batch statement.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class UpdateResult {
	@NonNull
	private static final UpdateResult EMPTY = new UpdateResult(null);

	@Nullable
	private final Long insertId;

	private UpdateResult(@Nullable Long insertId) {
		this.insertId = insertId;
	}

	@NonNull
	public static UpdateResult empty() {
		return EMPTY;
	}

	@NonNull
	public static UpdateResult withInsertId(long insertId) {
		return new UpdateResult(insertId);
	}

	/**
	 * Gets the key generated by this row.
	 *
	 * @return the generated key, if the row generated one
	 */
	@NonNull
	public Optional<Long> getInsertId() {
		return Optional.ofNullable(this.insertId);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof UpdateResult))
			return false;

		return Objects.equals(getInsertId(), ((UpdateResult) object).getInsertId());
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.insertId);
	}

	@Override
	@NonNull
	public String toString() {
		return this.insertId == null ? format("%s{}", getClass().getSimpleName())
				: format("%s{insertId=%s}", getClass().getSimpleName(), this.insertId);
	}
}

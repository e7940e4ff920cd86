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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Normalized parameters for one statement execution: either a single row of named parameters or a batch of rows.
 * <p>
 * Whether a set is a batch is structural: it is decided by {@link ParameterNormalizer} from the shape of the
 * caller's input, never declared separately.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterSet {
	@NonNull
	private static final ParameterSet EMPTY = new ParameterSet(List.of(List.of()), false);

	@NonNull
	private final List<List<NamedParameter>> rows;
	private final boolean batch;

	private ParameterSet(@NonNull List<List<NamedParameter>> rows,
											 boolean batch) {
		requireNonNull(rows);

		List<List<NamedParameter>> copiedRows = new ArrayList<>(rows.size());

		for (List<NamedParameter> row : rows)
			copiedRows.add(List.copyOf(row));

		this.rows = Collections.unmodifiableList(copiedRows);
		this.batch = batch;
	}

	@NonNull
	public static ParameterSet empty() {
		return EMPTY;
	}

	@NonNull
	public static ParameterSet singleRow(@NonNull List<NamedParameter> row) {
		requireNonNull(row);
		return new ParameterSet(List.of(row), false);
	}

	@NonNull
	public static ParameterSet batch(@NonNull List<List<NamedParameter>> rows) {
		requireNonNull(rows);

		if (rows.isEmpty())
			throw new IllegalArgumentException("A batch requires at least one row");

		return new ParameterSet(rows, true);
	}

	public boolean isBatch() {
		return this.batch;
	}

	/**
	 * Gets the rows of this set. A single-row set always has exactly one (possibly empty) row.
	 *
	 * @return the rows, in submission order
	 */
	@NonNull
	public List<List<NamedParameter>> getRows() {
		return this.rows;
	}

	@NonNull
	public List<NamedParameter> getFirstRow() {
		return this.rows.get(0);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ParameterSet))
			return false;

		ParameterSet parameterSet = (ParameterSet) object;

		return isBatch() == parameterSet.isBatch() && Objects.equals(getRows(), parameterSet.getRows());
	}

	@Override
	public int hashCode() {
		return Objects.hash(isBatch(), getRows());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{batch=%s, rows=%s}", getClass().getSimpleName(), isBatch(), getRows());
	}
}

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
 * SQL with identifiers and casts rewritten, paired with its encoded parameters.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BoundStatement {
	@NonNull
	private final String sql;
	@NonNull
	private final List<List<SqlParameter>> parameterSets;
	private final boolean batch;

	BoundStatement(@NonNull String sql,
								 @NonNull List<List<SqlParameter>> parameterSets,
								 boolean batch) {
		requireNonNull(sql);
		requireNonNull(parameterSets);

		if (parameterSets.isEmpty())
			throw new IllegalArgumentException("A bound statement requires at least one parameter set");

		List<List<SqlParameter>> copiedParameterSets = new ArrayList<>(parameterSets.size());

		for (List<SqlParameter> parameterSet : parameterSets)
			copiedParameterSets.add(List.copyOf(parameterSet));

		this.sql = sql;
		this.parameterSets = Collections.unmodifiableList(copiedParameterSets);
		this.batch = batch;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * Gets the encoded parameters, one list per row. A non-batch statement has exactly one (possibly empty) list.
	 *
	 * @return the encoded parameter sets
	 */
	@NonNull
	public List<List<SqlParameter>> getParameterSets() {
		return this.parameterSets;
	}

	@NonNull
	public List<SqlParameter> getParameters() {
		return this.parameterSets.get(0);
	}

	public boolean isBatch() {
		return this.batch;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BoundStatement))
			return false;

		BoundStatement boundStatement = (BoundStatement) object;

		return Objects.equals(getSql(), boundStatement.getSql())
				&& Objects.equals(getParameterSets(), boundStatement.getParameterSets())
				&& isBatch() == boundStatement.isBatch();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getParameterSets(), isBatch());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, parameterSets=%s, batch=%s}", getClass().getSimpleName(), getSql(),
				getParameterSets(), isBatch());
	}
}

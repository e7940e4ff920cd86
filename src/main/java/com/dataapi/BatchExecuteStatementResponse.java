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
 * The raw result of a {@code BatchExecuteStatement} call: the generated fields of each parameter set, in
 * submission order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BatchExecuteStatementResponse {
	@NonNull
	private final List<List<Field>> updateResults;

	private BatchExecuteStatementResponse(@NonNull List<List<Field>> updateResults) {
		requireNonNull(updateResults);

		List<List<Field>> copiedUpdateResults = new ArrayList<>(updateResults.size());

		for (List<Field> generatedFields : updateResults)
			copiedUpdateResults.add(List.copyOf(generatedFields));

		this.updateResults = Collections.unmodifiableList(copiedUpdateResults);
	}

	/**
	 * Creates a response.
	 *
	 * @param updateResults one list of generated fields per parameter set; a list is empty if its row generated none
	 * @return the response
	 */
	@NonNull
	public static BatchExecuteStatementResponse withUpdateResults(@NonNull List<List<Field>> updateResults) {
		return new BatchExecuteStatementResponse(updateResults);
	}

	@NonNull
	public List<List<Field>> getUpdateResults() {
		return this.updateResults;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof BatchExecuteStatementResponse))
			return false;

		return Objects.equals(getUpdateResults(), ((BatchExecuteStatementResponse) object).getUpdateResults());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getUpdateResults());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{updateResults=%s}", getClass().getSimpleName(), getUpdateResults());
	}
}

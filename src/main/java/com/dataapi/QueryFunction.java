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

import java.util.List;

/**
 * Builds a transaction query from the results of the queries before it, for example to reuse a generated key.
 * <p>
 * Example usage:
 * <pre>{@code
 * client.transaction()
 *   .query("INSERT INTO widget (name) VALUES (:name)", Map.of("name", "Sprocket"))
 *   .query((lastResult, allResults) -> QueryOptions.withSql("INSERT INTO part (widget_id) VALUES (:widgetId)")
 *     .parameters(Map.of("widgetId", lastResult.getInsertId().orElseThrow()))
 *     .build())
 *   .commit();
 * }</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryFunction {
	/**
	 * Builds the next query.
	 *
	 * @param lastResult the previous query's result, or {@code null} if this is the first query
	 * @param allResults every result so far, in execution order
	 * @return the query to run
	 */
	@NonNull
	QueryOptions apply(@Nullable QueryResult lastResult,
										 @NonNull List<QueryResult> allResults);
}

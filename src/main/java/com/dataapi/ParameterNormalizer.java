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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Converts the heterogeneous parameter shapes callers pass to {@link DataApiClient#query(String, Object)} into a
 * uniform {@link ParameterSet}.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>a {@link Map} of parameter name to value (a "row object"), exploded into one {@link NamedParameter} per
 *   entry in iteration order</li>
 *   <li>a {@link NamedParameter}, or a {@link Map} with exactly the keys {@code name} and {@code value} (and
 *   optionally {@code cast}), which passes through as a single named parameter</li>
 *   <li>a {@link Collection} or array of the above, flattened into one row</li>
 *   <li>a {@link Collection} or array of positional values; these carry no names and contribute no parameters,
 *   alone or mixed with named ones</li>
 *   <li>a {@link Collection} or array whose elements are all rows (nested collections/arrays or row objects),
 *   which is a batch with one row per element</li>
 * </ul>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterNormalizer {
	@NonNull
	private static final Set<String> NAMED_PARAMETER_KEYS = Set.of("name", "value");
	@NonNull
	private static final Set<String> CAST_NAMED_PARAMETER_KEYS = Set.of("name", "value", "cast");

	private ParameterNormalizer() {
		// Prevents instantiation
	}

	/**
	 * Normalizes the given parameter argument.
	 *
	 * @param parameters the caller's parameter argument, may be {@code null}
	 * @return the normalized parameters
	 * @throws IllegalArgumentException if the argument is not a supported shape
	 */
	@NonNull
	public static ParameterSet normalize(@Nullable Object parameters) {
		return normalize(parameters, "Parameters must be a map or list");
	}

	@NonNull
	static ParameterSet normalize(@Nullable Object parameters,
																@NonNull String invalidShapeMessage) {
		requireNonNull(invalidShapeMessage);

		if (parameters == null)
			return ParameterSet.empty();

		if (parameters instanceof NamedParameter namedParameter)
			return ParameterSet.singleRow(List.of(namedParameter));

		if (parameters instanceof Map<?, ?> map)
			return ParameterSet.singleRow(normalizeRowObject(map));

		if (!isListLike(parameters))
			throw new IllegalArgumentException(invalidShapeMessage);

		List<?> elements = asList(parameters);

		if (elements.isEmpty())
			return ParameterSet.empty();

		if (elements.stream().allMatch(ParameterNormalizer::isRow)) {
			List<List<NamedParameter>> rows = new ArrayList<>(elements.size());

			for (Object element : elements)
				rows.add(normalizeRow(element));

			return ParameterSet.batch(rows);
		}

		List<NamedParameter> row = new ArrayList<>(elements.size());

		for (Object element : elements) {
			if (isListLike(element))
				throw new IllegalArgumentException("Batch rows cannot be mixed with single-row parameters");

			appendElement(row, element);
		}

		return ParameterSet.singleRow(row);
	}

	/**
	 * Explodes a row object into one named parameter per entry, preserving the map's iteration order.
	 *
	 * @param rowObject the row object
	 * @return the named parameters
	 */
	@NonNull
	public static List<NamedParameter> splitParameters(@NonNull Map<?, ?> rowObject) {
		requireNonNull(rowObject);

		List<NamedParameter> namedParameters = new ArrayList<>(rowObject.size());

		for (Map.Entry<?, ?> entry : rowObject.entrySet()) {
			if (!(entry.getKey() instanceof String name))
				throw new IllegalArgumentException(format("Parameter names must be strings, but found %s", entry.getKey()));

			namedParameters.add(Parameters.named(name, entry.getValue()));
		}

		return namedParameters;
	}

	@NonNull
	private static List<NamedParameter> normalizeRow(@NonNull Object row) {
		requireNonNull(row);

		if (row instanceof Map<?, ?> map)
			return normalizeRowObject(map);

		List<NamedParameter> namedParameters = new ArrayList<>();

		for (Object element : asList(row)) {
			if (isListLike(element))
				namedParameters.addAll(normalizeRow(element));
			else
				appendElement(namedParameters, element);
		}

		return namedParameters;
	}

	@NonNull
	private static List<NamedParameter> normalizeRowObject(@NonNull Map<?, ?> map) {
		requireNonNull(map);

		if (isNamedParameterShape(map))
			return List.of(toNamedParameter(map));

		return splitParameters(map);
	}

	private static void appendElement(@NonNull List<NamedParameter> row,
																		@Nullable Object element) {
		requireNonNull(row);

		if (element instanceof NamedParameter namedParameter)
			row.add(namedParameter);
		else if (element instanceof Map<?, ?> map)
			row.addAll(normalizeRowObject(map));

		// Positional values carry no names, so there is nothing to bind them to
	}

	private static boolean isRow(@Nullable Object element) {
		if (isListLike(element))
			return true;

		return element instanceof Map<?, ?> map && !isNamedParameterShape(map);
	}

	private static boolean isNamedParameterShape(@NonNull Map<?, ?> map) {
		requireNonNull(map);

		Set<?> keys = map.keySet();

		if (!keys.equals(NAMED_PARAMETER_KEYS) && !keys.equals(CAST_NAMED_PARAMETER_KEYS))
			return false;

		if (!(map.get("name") instanceof String))
			return false;

		Object cast = map.get("cast");
		return cast == null || cast instanceof String;
	}

	@NonNull
	private static NamedParameter toNamedParameter(@NonNull Map<?, ?> map) {
		requireNonNull(map);

		String name = (String) map.get("name");
		Object value = map.get("value");
		String cast = (String) map.get("cast");

		return cast == null ? Parameters.named(name, value) : Parameters.named(name, value, cast);
	}

	private static boolean isListLike(@Nullable Object value) {
		return value instanceof Collection<?> || value instanceof Object[];
	}

	@NonNull
	private static List<?> asList(@NonNull Object listLike) {
		requireNonNull(listLike);

		if (listLike instanceof List<?> list)
			return list;

		if (listLike instanceof Collection<?> collection)
			return new ArrayList<>(collection);

		return Arrays.asList((Object[]) listLike);
	}
}

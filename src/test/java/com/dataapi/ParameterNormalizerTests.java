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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @since 1.0.0
 */
public class ParameterNormalizerTests {
	@Test
	public void testNullAndEmptyListNormalizeToEmpty() {
		Assertions.assertEquals(ParameterSet.empty(), ParameterNormalizer.normalize(null));
		Assertions.assertEquals(ParameterSet.empty(), ParameterNormalizer.normalize(List.of()));
		Assertions.assertEquals(List.of(), ParameterNormalizer.normalize(null).getFirstRow());
	}

	@Test
	public void testRowObjectIsSplitInKeyOrder() {
		Map<String, Object> rowObject = new LinkedHashMap<>();
		rowObject.put("a", 1);
		rowObject.put("b", 2);

		ParameterSet parameterSet = ParameterNormalizer.normalize(rowObject);

		Assertions.assertFalse(parameterSet.isBatch());
		Assertions.assertEquals(List.of(Parameters.named("a", 1), Parameters.named("b", 2)), parameterSet.getFirstRow());
	}

	@Test
	public void testNamedParameterMapsAreNotSplit() {
		ParameterSet parameterSet = ParameterNormalizer.normalize(List.of(
				Map.of("name", "id", "value", 5),
				Map.of("name", "payload", "value", "{}", "cast", "jsonb")));

		Assertions.assertFalse(parameterSet.isBatch());
		Assertions.assertEquals(List.of(
				Parameters.named("id", 5),
				Parameters.named("payload", "{}", "jsonb")), parameterSet.getFirstRow());
	}

	@Test
	public void testMixedListFlattensIntoOneRow() {
		ParameterSet parameterSet = ParameterNormalizer.normalize(List.of(
				Parameters.named("id", 1),
				Map.of("name", "Category 1")));

		Assertions.assertFalse(parameterSet.isBatch());
		Assertions.assertEquals(List.of(
				Parameters.named("id", 1),
				Parameters.named("name", "Category 1")), parameterSet.getFirstRow());
	}

	@Test
	public void testListOfRowObjectsIsBatch() {
		ParameterSet parameterSet = ParameterNormalizer.normalize(List.of(
				Map.of("name", "Category 1"),
				Map.of("name", "Category 2"),
				Map.of("name", "Category 3")));

		Assertions.assertTrue(parameterSet.isBatch());
		Assertions.assertEquals(3, parameterSet.getRows().size());
		Assertions.assertEquals(List.of(Parameters.named("name", "Category 3")), parameterSet.getRows().get(2));
	}

	@Test
	public void testListOfListsIsBatch() {
		ParameterSet parameterSet = ParameterNormalizer.normalize(List.of(
				List.of(Parameters.named("id", 1), Map.of("name", "A")),
				List.of(Parameters.named("id", 2), Map.of("name", "B"))));

		Assertions.assertTrue(parameterSet.isBatch());
		Assertions.assertEquals(List.of(Parameters.named("id", 2), Parameters.named("name", "B")),
				parameterSet.getRows().get(1));
	}

	@Test
	public void testNamedParameterMapMayCarryNullValue() {
		Map<String, Object> namedParameter = new LinkedHashMap<>();
		namedParameter.put("name", "description");
		namedParameter.put("value", null);

		Assertions.assertEquals(List.of(Parameters.named("description", null)),
				ParameterNormalizer.normalize(namedParameter).getFirstRow());
	}

	@Test
	public void testSingleNamedParameterIsAccepted() {
		Assertions.assertEquals(List.of(Parameters.named("id", 9)),
				ParameterNormalizer.normalize(Parameters.named("id", 9)).getFirstRow());
	}

	@Test
	public void testUnsupportedShapesAreRejected() {
		IllegalArgumentException e = Assertions.assertThrows(IllegalArgumentException.class,
				() -> ParameterNormalizer.normalize("id=1"));
		Assertions.assertEquals("Parameters must be a map or list", e.getMessage());

		IllegalArgumentException custom = Assertions.assertThrows(IllegalArgumentException.class,
				() -> ParameterNormalizer.normalize(42, "'parameters' must be a map or list"));
		Assertions.assertEquals("'parameters' must be a map or list", custom.getMessage());
	}

	@Test
	public void testPositionalValuesContributeNoParameters() {
		ParameterSet positional = ParameterNormalizer.normalize(List.of(1, 2));

		Assertions.assertFalse(positional.isBatch());
		Assertions.assertEquals(List.of(), positional.getFirstRow());

		Assertions.assertEquals(List.of(Parameters.named("id", 1)),
				ParameterNormalizer.normalize(new Object[]{Parameters.named("id", 1), 2, "three", null}).getFirstRow());
	}

	@Test
	public void testNonStringKeysAreRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ParameterNormalizer.splitParameters(Map.of(1, "one")));
	}
}

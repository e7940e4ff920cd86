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

import java.util.Optional;

/**
 * @since 1.0.0
 */
public class EngineTests {
	@Test
	public void testEngineNames() {
		Assertions.assertEquals(Engine.PG, Engine.fromName("PostgreSQL"));
		Assertions.assertEquals(Engine.PG, Engine.fromName("postgres"));
		Assertions.assertEquals(Engine.PG, Engine.fromName("pg"));
		Assertions.assertEquals(Engine.MYSQL, Engine.fromName(" mysql "));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Engine.fromName("oracle"));
	}

	@Test
	public void testFieldTypeProtocolNames() {
		Assertions.assertEquals(Optional.of(FieldType.LONG_VALUE), FieldType.fromProtocolName("longValue"));
		Assertions.assertEquals(Optional.empty(), FieldType.fromProtocolName("LongValue"));
		Assertions.assertEquals("isNull", FieldType.IS_NULL.getProtocolName());
	}
}

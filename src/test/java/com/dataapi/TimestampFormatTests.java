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

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * @since 1.0.0
 */
public class TimestampFormatTests {
	@Test
	public void testBareTimestampsAreUtc() {
		Assertions.assertEquals(Instant.parse("2019-11-12T22:00:11Z"),
				TimestampFormat.parse("2019-11-12 22:00:11", false, ZoneId.of("Asia/Tokyo")));
		Assertions.assertEquals(Instant.parse("2019-11-12T00:00:00Z"),
				TimestampFormat.parse("2019-11-12", false, ZoneId.of("Asia/Tokyo")));
	}

	@Test
	public void testLocalTimestampsUseZone() {
		Assertions.assertEquals(Instant.parse("2019-11-12T13:00:11Z"),
				TimestampFormat.parse("2019-11-12 22:00:11", true, ZoneId.of("Asia/Tokyo")));
	}

	@Test
	public void testExplicitOffsetWins() {
		Assertions.assertEquals(Instant.parse("2019-11-12T20:00:11Z"),
				TimestampFormat.parse("2019-11-12 22:00:11+02:00", true, ZoneId.of("Asia/Tokyo")));
		Assertions.assertEquals(Instant.parse("2019-11-12T22:00:11.5Z"),
				TimestampFormat.parse("2019-11-12T22:00:11.5Z", false, ZoneOffset.UTC));
	}

	@Test
	public void testFormattingIncludesMillisecondsOnlyWhenPresent() {
		Assertions.assertEquals("2019-11-12 22:00:11",
				TimestampFormat.format(Instant.parse("2019-11-12T22:00:11Z"), false, ZoneOffset.UTC));
		Assertions.assertEquals("2019-11-12 22:00:11.040",
				TimestampFormat.format(Instant.parse("2019-11-12T22:00:11.040Z"), false, ZoneOffset.UTC));
		Assertions.assertEquals("2019-11-13 07:00:11",
				TimestampFormat.format(Instant.parse("2019-11-12T22:00:11Z"), true, ZoneId.of("Asia/Tokyo")));
	}

	@Test
	public void testGarbageIsRejected() {
		Assertions.assertThrows(DateTimeParseException.class, () -> TimestampFormat.parse("yesterday", false, ZoneOffset.UTC));
	}
}

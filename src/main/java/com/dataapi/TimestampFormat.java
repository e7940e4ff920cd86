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
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Converts between Java date/time values and the {@code YYYY-MM-DD HH:MM:SS[.FFF]} timestamp text the Data API
 * accepts and returns.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class TimestampFormat {
	/**
	 * A timestamp with no zone information, e.g. {@code 2019-11-12 22:00:11} or {@code 2019-11-12}.
	 */
	@NonNull
	static final Pattern BARE_TIMESTAMP_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}(\\s\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?)?$");

	@NonNull
	private static final DateTimeFormatter PARSER = new DateTimeFormatterBuilder()
			.appendPattern("uuuu-MM-dd")
			.optionalStart()
			.optionalStart().appendLiteral(' ').optionalEnd()
			.optionalStart().appendLiteral('T').optionalEnd()
			.appendPattern("HH:mm")
			.optionalStart().appendPattern(":ss").optionalEnd()
			.optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
			.optionalEnd()
			.optionalStart().appendOffset("+HH:mm", "Z").optionalEnd()
			.toFormatter();

	private TimestampFormat() {
		// Prevents instantiation
	}

	/**
	 * Formats an instant as Data API timestamp text.
	 *
	 * @param instant          the instant to format
	 * @param treatAsLocalDate if {@code true}, use wall-clock fields in {@code timeZone}; otherwise UTC fields
	 * @param timeZone         the zone which defines "local"
	 * @return the formatted timestamp; milliseconds are included only when nonzero
	 */
	@NonNull
	static String format(@NonNull Instant instant,
											 boolean treatAsLocalDate,
											 @NonNull ZoneId timeZone) {
		requireNonNull(instant);
		requireNonNull(timeZone);

		return format(LocalDateTime.ofInstant(instant, treatAsLocalDate ? timeZone : ZoneOffset.UTC));
	}

	/**
	 * Formats wall-clock fields as Data API timestamp text.
	 *
	 * @param localDateTime the wall-clock date and time
	 * @return the formatted timestamp; milliseconds are included only when nonzero
	 */
	@NonNull
	static String format(@NonNull LocalDateTime localDateTime) {
		requireNonNull(localDateTime);

		String timestamp = String.format("%04d-%02d-%02d %02d:%02d:%02d",
				localDateTime.getYear(), localDateTime.getMonthValue(), localDateTime.getDayOfMonth(),
				localDateTime.getHour(), localDateTime.getMinute(), localDateTime.getSecond());

		int milliseconds = localDateTime.getNano() / 1_000_000;

		return milliseconds <= 0 ? timestamp : String.format("%s.%03d", timestamp, milliseconds);
	}

	/**
	 * Parses Data API timestamp text into an instant.
	 * <p>
	 * A bare timestamp (no zone information) is read as UTC unless {@code treatAsLocalDate} is set. Otherwise the
	 * text is read as-is: an explicit offset wins, and text without one is read in {@code timeZone}.
	 *
	 * @param value            the timestamp text
	 * @param treatAsLocalDate whether zone-less text is local rather than UTC
	 * @param timeZone         the zone which defines "local"
	 * @return the parsed instant
	 * @throws DateTimeParseException if the text is not a recognizable timestamp
	 */
	@NonNull
	static Instant parse(@NonNull String value,
											 boolean treatAsLocalDate,
											 @NonNull ZoneId timeZone) {
		requireNonNull(value);
		requireNonNull(timeZone);

		String trimmedValue = value.trim();
		TemporalAccessor parsed = PARSER.parse(trimmedValue);

		LocalDate date = parsed.query(TemporalQueries.localDate());
		LocalTime time = parsed.query(TemporalQueries.localTime());
		ZoneOffset offset = parsed.query(TemporalQueries.offset());

		if (date == null)
			throw new DateTimeParseException(String.format("Unable to find a date in '%s'", value), value, 0);

		LocalDateTime localDateTime = LocalDateTime.of(date, time == null ? LocalTime.MIDNIGHT : time);

		if (!treatAsLocalDate && BARE_TIMESTAMP_PATTERN.matcher(trimmedValue).matches())
			return localDateTime.toInstant(ZoneOffset.UTC);

		if (offset != null)
			return localDateTime.toInstant(offset);

		return localDateTime.atZone(timeZone).toInstant();
	}
}

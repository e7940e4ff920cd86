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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encodes caller-supplied parameter values into typed {@link SqlParameter}s.
 * <p>
 * Values are dispatched in this order:
 * <ol>
 *   <li>{@link Field} and single-entry maps keyed by a wire type name (e.g. {@code Map.of("longValue", 1)}) pass
 *   through verbatim</li>
 *   <li>{@link CharSequence} and {@link UUID} become {@code stringValue}</li>
 *   <li>{@link Boolean} becomes {@code booleanValue}</li>
 *   <li>integral numbers, and floating-point numbers with an integral value, become {@code longValue}</li>
 *   <li>other finite floating-point numbers become {@code doubleValue}</li>
 *   <li>{@link BigDecimal} becomes {@code stringValue} in plain notation</li>
 *   <li>{@code null} (and an empty {@link Optional}) becomes {@code isNull}</li>
 *   <li>dates become {@code stringValue} timestamps with a {@link TypeHint#TIMESTAMP} hint</li>
 *   <li>{@code byte[]} and {@link ByteBuffer} become {@code blobValue}</li>
 * </ol>
 * Anything else fails with {@code '<name>' is an invalid type}.
 * <p>
 * For {@link Engine#PG}, string values which look like UUIDs, dates, times, JSON documents or decimals carry the
 * matching {@link TypeHint}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterEncoder {
	@NonNull
	private static final Pattern UUID_PATTERN = Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
	@NonNull
	private static final Pattern DATE_PATTERN = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
	@NonNull
	private static final Pattern TIME_PATTERN = Pattern.compile("^\\d{2}:\\d{2}:\\d{2}(\\.\\d+)?$");
	@NonNull
	private static final Pattern DECIMAL_PATTERN = Pattern.compile("^[-+]?\\d+\\.\\d+$");

	// Largest magnitude at which every double is still exactly representable as a long
	private static final double MAXIMUM_INTEGRAL_DOUBLE = 9.007199254740992E15;

	@NonNull
	private final Engine engine;
	@NonNull
	private final FormatOptions formatOptions;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final ObjectMapper objectMapper;

	/**
	 * Creates an encoder.
	 *
	 * @param engine        the engine, which decides whether string type hints are inferred
	 * @param formatOptions date formatting options
	 * @param timeZone      the zone which defines "local" for {@link FormatOptions#getTreatAsLocalDate()}
	 * @param objectMapper  used to recognize JSON document text
	 */
	public ParameterEncoder(@NonNull Engine engine,
													@NonNull FormatOptions formatOptions,
													@NonNull ZoneId timeZone,
													@NonNull ObjectMapper objectMapper) {
		this.engine = requireNonNull(engine);
		this.formatOptions = requireNonNull(formatOptions);
		this.timeZone = requireNonNull(timeZone);
		this.objectMapper = requireNonNull(objectMapper);
	}

	/**
	 * Encodes a single named value.
	 *
	 * @param name  the parameter name
	 * @param value the caller's value, may be {@code null}
	 * @return the encoded parameter
	 * @throws IllegalArgumentException if the value's type cannot be encoded
	 */
	@NonNull
	public SqlParameter encode(@NonNull String name,
														 @Nullable Object value) {
		requireNonNull(name);

		if (value instanceof Optional<?> optional)
			value = optional.orElse(null);

		if (value instanceof Field field)
			return SqlParameter.of(name, field);

		if (value instanceof Map<?, ?> map)
			return SqlParameter.of(name, encodePassthrough(name, map));

		if (value instanceof CharSequence || value instanceof UUID)
			return encodeString(name, value.toString());

		if (value instanceof Boolean bool)
			return SqlParameter.of(name, Field.ofBoolean(bool));

		if (value instanceof BigDecimal bigDecimal)
			return encodeString(name, bigDecimal.toPlainString());

		if (value instanceof Number number)
			return SqlParameter.of(name, encodeNumber(name, number));

		if (value == null)
			return SqlParameter.of(name, Field.ofNull());

		Instant instant = toInstant(value);

		if (instant != null)
			return SqlParameter.of(name,
					Field.ofString(TimestampFormat.format(instant, getFormatOptions().getTreatAsLocalDate(), getTimeZone())),
					TypeHint.TIMESTAMP);

		if (value instanceof LocalDateTime localDateTime)
			return SqlParameter.of(name, Field.ofString(TimestampFormat.format(localDateTime)), TypeHint.TIMESTAMP);

		if (value instanceof byte[] bytes)
			return SqlParameter.of(name, Field.ofBlob(bytes));

		if (value instanceof ByteBuffer byteBuffer) {
			ByteBuffer readableByteBuffer = byteBuffer.duplicate();
			byte[] bytes = new byte[readableByteBuffer.remaining()];
			readableByteBuffer.get(bytes);
			return SqlParameter.of(name, Field.ofBlob(bytes));
		}

		throw invalidType(name);
	}

	@NonNull
	private SqlParameter encodeString(@NonNull String name,
																		@NonNull String value) {
		requireNonNull(name);
		requireNonNull(value);

		TypeHint typeHint = getEngine() == Engine.PG ? inferTypeHint(value) : null;
		return SqlParameter.of(name, Field.ofString(value), typeHint);
	}

	@Nullable
	private TypeHint inferTypeHint(@NonNull String value) {
		requireNonNull(value);

		if (UUID_PATTERN.matcher(value).matches())
			return TypeHint.UUID;

		if (DATE_PATTERN.matcher(value).matches())
			return TypeHint.DATE;

		if (TIME_PATTERN.matcher(value).matches())
			return TypeHint.TIME;

		if (isJsonDocument(value))
			return TypeHint.JSON;

		if (DECIMAL_PATTERN.matcher(value).matches())
			return TypeHint.DECIMAL;

		return null;
	}

	private boolean isJsonDocument(@NonNull String value) {
		requireNonNull(value);

		String trimmedValue = value.trim();

		if (!(trimmedValue.startsWith("{") && trimmedValue.endsWith("}"))
				&& !(trimmedValue.startsWith("[") && trimmedValue.endsWith("]")))
			return false;

		try {
			getObjectMapper().readTree(trimmedValue);
			return true;
		} catch (JsonProcessingException ignored) {
			// Looks like JSON but isn't, so it's just text
			return false;
		}
	}

	@NonNull
	private Field encodeNumber(@NonNull String name,
														 @NonNull Number number) {
		requireNonNull(name);
		requireNonNull(number);

		if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte
				|| number instanceof AtomicInteger || number instanceof AtomicLong)
			return Field.ofLong(number.longValue());

		if (number instanceof BigInteger bigInteger) {
			if (bigInteger.bitLength() > 63)
				throw invalidType(name);

			return Field.ofLong(bigInteger.longValue());
		}

		if (number instanceof Double || number instanceof Float) {
			double doubleValue = number.doubleValue();

			if (!Double.isFinite(doubleValue))
				throw invalidType(name);

			if (doubleValue == Math.rint(doubleValue) && Math.abs(doubleValue) <= MAXIMUM_INTEGRAL_DOUBLE)
				return Field.ofLong((long) doubleValue);

			return Field.ofDouble(doubleValue);
		}

		throw invalidType(name);
	}

	@NonNull
	private Field encodePassthrough(@NonNull String name,
																	@NonNull Map<?, ?> map) {
		requireNonNull(name);
		requireNonNull(map);

		if (map.size() != 1)
			throw invalidType(name);

		Map.Entry<?, ?> entry = map.entrySet().iterator().next();

		if (!(entry.getKey() instanceof String protocolName))
			throw invalidType(name);

		FieldType fieldType = FieldType.fromProtocolName(protocolName).orElse(null);

		if (fieldType == null)
			throw invalidType(name);

		try {
			return Field.of(fieldType, entry.getValue());
		} catch (IllegalArgumentException | NullPointerException e) {
			throw new IllegalArgumentException(format("'%s' is an invalid type", name), e);
		}
	}

	@Nullable
	private Instant toInstant(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Instant instant)
			return instant;

		// java.sql.Date and java.sql.Time do not support toInstant()
		if (value instanceof Date date)
			return Instant.ofEpochMilli(date.getTime());

		if (value instanceof OffsetDateTime offsetDateTime)
			return offsetDateTime.toInstant();

		if (value instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toInstant();

		return null;
	}

	@NonNull
	private IllegalArgumentException invalidType(@NonNull String name) {
		requireNonNull(name);
		return new IllegalArgumentException(format("'%s' is an invalid type", name));
	}

	@NonNull
	public Engine getEngine() {
		return this.engine;
	}

	@NonNull
	public FormatOptions getFormatOptions() {
		return this.formatOptions;
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	private ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}
}

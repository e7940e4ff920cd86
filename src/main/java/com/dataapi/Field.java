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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single explicitly-typed value as carried by the Data API protocol, both for statement parameters and for
 * result columns.
 * <p>
 * A field holds exactly one {@link FieldType} tag and the native value for that tag:
 * <ul>
 *   <li>{@link FieldType#STRING_VALUE} - {@link String}</li>
 *   <li>{@link FieldType#LONG_VALUE} - {@link Long}</li>
 *   <li>{@link FieldType#DOUBLE_VALUE} - {@link Double}</li>
 *   <li>{@link FieldType#BOOLEAN_VALUE} - {@link Boolean}</li>
 *   <li>{@link FieldType#BLOB_VALUE} - {@code byte[]}</li>
 *   <li>{@link FieldType#IS_NULL} - {@link Boolean#TRUE}</li>
 *   <li>{@link FieldType#ARRAY_VALUE} and {@link FieldType#STRUCT_VALUE} - the protocol's own shape, either a
 *   {@link Map} such as {@code {longValues=[1, 2]}} or a {@link List}, held as an unmodifiable copy</li>
 * </ul>
 * Passing a {@code Field} as a parameter value bypasses type inference entirely.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Field {
	@NonNull
	private static final Field NULL_FIELD = new Field(FieldType.IS_NULL, Boolean.TRUE);

	@NonNull
	private final FieldType type;
	@NonNull
	private final Object value;

	private Field(@NonNull FieldType type,
								@NonNull Object value) {
		this.type = requireNonNull(type);
		this.value = requireNonNull(value);
	}

	@NonNull
	public static Field ofString(@NonNull String value) {
		requireNonNull(value);
		return new Field(FieldType.STRING_VALUE, value);
	}

	@NonNull
	public static Field ofLong(long value) {
		return new Field(FieldType.LONG_VALUE, value);
	}

	@NonNull
	public static Field ofDouble(double value) {
		return new Field(FieldType.DOUBLE_VALUE, value);
	}

	@NonNull
	public static Field ofBoolean(boolean value) {
		return new Field(FieldType.BOOLEAN_VALUE, value);
	}

	@NonNull
	public static Field ofBlob(byte @NonNull [] value) {
		requireNonNull(value);
		return new Field(FieldType.BLOB_VALUE, value.clone());
	}

	@NonNull
	public static Field ofNull() {
		return NULL_FIELD;
	}

	@NonNull
	public static Field ofArray(@NonNull List<?> values) {
		requireNonNull(values);
		return new Field(FieldType.ARRAY_VALUE, copyStructure(values));
	}

	@NonNull
	public static Field ofArray(@NonNull Map<?, ?> arrayValue) {
		requireNonNull(arrayValue);
		return new Field(FieldType.ARRAY_VALUE, copyStructure(arrayValue));
	}

	@NonNull
	public static Field ofStruct(@NonNull List<?> attributes) {
		requireNonNull(attributes);
		return new Field(FieldType.STRUCT_VALUE, copyStructure(attributes));
	}

	@NonNull
	public static Field ofStruct(@NonNull Map<?, ?> structValue) {
		requireNonNull(structValue);
		return new Field(FieldType.STRUCT_VALUE, copyStructure(structValue));
	}

	/**
	 * Creates a field for an explicit type tag, verifying that {@code value} is a legal native value for the tag.
	 * <p>
	 * Numeric values are widened to {@link Long} or {@link Double} as the tag requires.
	 *
	 * @param type  the type tag
	 * @param value the native value
	 * @return a field
	 * @throws IllegalArgumentException if {@code value} cannot be carried by {@code type}
	 */
	@NonNull
	public static Field of(@NonNull FieldType type,
												 @Nullable Object value) {
		requireNonNull(type);

		switch (type) {
			case IS_NULL:
				return ofNull();
			case STRING_VALUE:
				if (value instanceof String string)
					return ofString(string);
				break;
			case LONG_VALUE:
				if (value instanceof Number number && !(value instanceof Double) && !(value instanceof Float))
					return ofLong(number.longValue());
				break;
			case DOUBLE_VALUE:
				if (value instanceof Number number)
					return ofDouble(number.doubleValue());
				break;
			case BOOLEAN_VALUE:
				if (value instanceof Boolean bool)
					return ofBoolean(bool);
				break;
			case BLOB_VALUE:
				if (value instanceof byte[] bytes)
					return ofBlob(bytes);
				break;
			case ARRAY_VALUE:
				if (value instanceof List<?> list)
					return ofArray(list);
				if (value instanceof Map<?, ?> map)
					return ofArray(map);
				break;
			case STRUCT_VALUE:
				if (value instanceof List<?> list)
					return ofStruct(list);
				if (value instanceof Map<?, ?> map)
					return ofStruct(map);
				break;
		}

		throw new IllegalArgumentException(format("Value of type %s cannot be carried as %s",
				value == null ? "null" : value.getClass().getName(), type.getProtocolName()));
	}

	// Nested values may be null
	@Nullable
	private static Object copyStructure(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<Object, Object> copy = new LinkedHashMap<>(map.size());

			for (Map.Entry<?, ?> entry : map.entrySet())
				copy.put(entry.getKey(), copyStructure(entry.getValue()));

			return Collections.unmodifiableMap(copy);
		}

		if (value instanceof List<?> list) {
			List<Object> copy = new ArrayList<>(list.size());

			for (Object element : list)
				copy.add(copyStructure(element));

			return Collections.unmodifiableList(copy);
		}

		if (value instanceof byte[] bytes)
			return bytes.clone();

		return value;
	}

	@NonNull
	public FieldType getType() {
		return this.type;
	}

	/**
	 * Gets the native value of this field; {@code byte[]} values are copied.
	 *
	 * @return the native value
	 */
	@NonNull
	public Object getValue() {
		if (this.value instanceof byte[] bytes)
			return bytes.clone();

		return this.value;
	}

	public boolean isNull() {
		return this.type == FieldType.IS_NULL;
	}

	/**
	 * Gets this field's value if it is a {@link FieldType#LONG_VALUE}.
	 *
	 * @return the long value, or {@link Optional#empty()} for any other tag
	 */
	@NonNull
	public Optional<Long> getLongValue() {
		return this.type == FieldType.LONG_VALUE ? Optional.of((Long) this.value) : Optional.empty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Field))
			return false;

		Field field = (Field) object;

		if (getType() != field.getType())
			return false;

		if (this.value instanceof byte[] bytes && field.value instanceof byte[] otherBytes)
			return Arrays.equals(bytes, otherBytes);

		return Objects.equals(this.value, field.value);
	}

	@Override
	public int hashCode() {
		if (this.value instanceof byte[] bytes)
			return Objects.hash(getType(), Arrays.hashCode(bytes));

		return Objects.hash(getType(), this.value);
	}

	@Override
	@NonNull
	public String toString() {
		Object printableValue = this.value instanceof byte[] bytes ? format("[%d bytes]", bytes.length) : this.value;
		return format("{%s=%s}", getType().getProtocolName(), printableValue);
	}
}

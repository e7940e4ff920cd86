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

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The fixed set of value kinds accepted and produced by the Data API wire protocol.
 * <p>
 * Every {@link Field} carries exactly one of these tags.
 *
 * @since 1.0.0
 */
public enum FieldType {
	ARRAY_VALUE("arrayValue"),
	BLOB_VALUE("blobValue"),
	BOOLEAN_VALUE("booleanValue"),
	DOUBLE_VALUE("doubleValue"),
	IS_NULL("isNull"),
	LONG_VALUE("longValue"),
	STRING_VALUE("stringValue"),
	STRUCT_VALUE("structValue");

	@NonNull
	private final String protocolName;

	FieldType(@NonNull String protocolName) {
		this.protocolName = requireNonNull(protocolName);
	}

	/**
	 * Looks up a field type by its wire name, e.g. {@code "longValue"}.
	 *
	 * @param protocolName the wire name of the type tag
	 * @return the field type, or {@link Optional#empty()} if the name is not a supported tag
	 */
	@NonNull
	public static Optional<FieldType> fromProtocolName(@NonNull String protocolName) {
		requireNonNull(protocolName);

		for (FieldType fieldType : values())
			if (fieldType.protocolName.equals(protocolName))
				return Optional.of(fieldType);

		return Optional.empty();
	}

	/**
	 * The name of this tag on the wire, e.g. {@code "stringValue"}.
	 *
	 * @return the wire name of this tag
	 */
	@NonNull
	public String getProtocolName() {
		return this.protocolName;
	}
}

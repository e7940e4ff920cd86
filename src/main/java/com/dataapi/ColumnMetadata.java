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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Describes one result column as reported by the Data API.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnMetadata {
	@NonNull
	private final String label;
	@Nullable
	private final String name;
	@Nullable
	private final String typeName;
	@Nullable
	private final Integer type;
	@Nullable
	private final String tableName;
	@Nullable
	private final String schemaName;
	@Nullable
	private final Integer nullable;
	@Nullable
	private final Integer precision;
	@Nullable
	private final Integer scale;

	private ColumnMetadata(@NonNull Builder builder) {
		requireNonNull(builder);

		this.label = requireNonNull(builder.label);
		this.name = builder.name;
		this.typeName = builder.typeName;
		this.type = builder.type;
		this.tableName = builder.tableName;
		this.schemaName = builder.schemaName;
		this.nullable = builder.nullable;
		this.precision = builder.precision;
		this.scale = builder.scale;
	}

	/**
	 * Acquires a builder for a column with the given label, the key under which hydrated records carry its values.
	 *
	 * @param label the column label
	 * @return the builder
	 */
	@NonNull
	public static Builder withLabel(@NonNull String label) {
		requireNonNull(label);
		return new Builder(label);
	}

	@NonNull
	public String getLabel() {
		return this.label;
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	/**
	 * Gets the database type name, e.g. {@code VARCHAR}, {@code TIMESTAMP} or {@code jsonb}.
	 *
	 * @return the type name, if reported
	 */
	@NonNull
	public Optional<String> getTypeName() {
		return Optional.ofNullable(this.typeName);
	}

	/**
	 * Gets the JDBC type code.
	 *
	 * @return the {@link java.sql.Types} code, if reported
	 */
	@NonNull
	public Optional<Integer> getType() {
		return Optional.ofNullable(this.type);
	}

	@NonNull
	public Optional<String> getTableName() {
		return Optional.ofNullable(this.tableName);
	}

	@NonNull
	public Optional<String> getSchemaName() {
		return Optional.ofNullable(this.schemaName);
	}

	@NonNull
	public Optional<Integer> getNullable() {
		return Optional.ofNullable(this.nullable);
	}

	@NonNull
	public Optional<Integer> getPrecision() {
		return Optional.ofNullable(this.precision);
	}

	@NonNull
	public Optional<Integer> getScale() {
		return Optional.ofNullable(this.scale);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnMetadata))
			return false;

		ColumnMetadata columnMetadata = (ColumnMetadata) object;

		return Objects.equals(getLabel(), columnMetadata.getLabel())
				&& Objects.equals(getName(), columnMetadata.getName())
				&& Objects.equals(getTypeName(), columnMetadata.getTypeName())
				&& Objects.equals(getType(), columnMetadata.getType())
				&& Objects.equals(getTableName(), columnMetadata.getTableName())
				&& Objects.equals(getSchemaName(), columnMetadata.getSchemaName())
				&& Objects.equals(getNullable(), columnMetadata.getNullable())
				&& Objects.equals(getPrecision(), columnMetadata.getPrecision())
				&& Objects.equals(getScale(), columnMetadata.getScale());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLabel(), getName(), getTypeName(), getType(), getTableName(), getSchemaName(),
				getNullable(), getPrecision(), getScale());
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(9);

		components.add(format("label=%s", getLabel()));

		if (this.name != null)
			components.add(format("name=%s", this.name));

		if (this.typeName != null)
			components.add(format("typeName=%s", this.typeName));

		if (this.type != null)
			components.add(format("type=%s", this.type));

		if (this.tableName != null)
			components.add(format("tableName=%s", this.tableName));

		if (this.schemaName != null)
			components.add(format("schemaName=%s", this.schemaName));

		if (this.nullable != null)
			components.add(format("nullable=%s", this.nullable));

		if (this.precision != null)
			components.add(format("precision=%s", this.precision));

		if (this.scale != null)
			components.add(format("scale=%s", this.scale));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(joining(", ")));
	}

	/**
	 * Builder used to construct instances of {@link ColumnMetadata}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String label;
		@Nullable
		private String name;
		@Nullable
		private String typeName;
		@Nullable
		private Integer type;
		@Nullable
		private String tableName;
		@Nullable
		private String schemaName;
		@Nullable
		private Integer nullable;
		@Nullable
		private Integer precision;
		@Nullable
		private Integer scale;

		private Builder(@NonNull String label) {
			this.label = requireNonNull(label);
		}

		@NonNull
		public Builder name(@Nullable String name) {
			this.name = name;
			return this;
		}

		@NonNull
		public Builder typeName(@Nullable String typeName) {
			this.typeName = typeName;
			return this;
		}

		@NonNull
		public Builder type(@Nullable Integer type) {
			this.type = type;
			return this;
		}

		@NonNull
		public Builder tableName(@Nullable String tableName) {
			this.tableName = tableName;
			return this;
		}

		@NonNull
		public Builder schemaName(@Nullable String schemaName) {
			this.schemaName = schemaName;
			return this;
		}

		@NonNull
		public Builder nullable(@Nullable Integer nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public Builder precision(@Nullable Integer precision) {
			this.precision = precision;
			return this;
		}

		@NonNull
		public Builder scale(@Nullable Integer scale) {
			this.scale = scale;
			return this;
		}

		@NonNull
		public ColumnMetadata build() {
			return new ColumnMetadata(this);
		}
	}
}

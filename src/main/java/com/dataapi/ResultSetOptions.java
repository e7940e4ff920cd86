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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;

/**
 * Controls how the Data API renders certain column types in results.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultSetOptions {
	@Nullable
	private final DecimalReturnType decimalReturnType;
	@Nullable
	private final LongReturnType longReturnType;

	private ResultSetOptions(@Nullable DecimalReturnType decimalReturnType,
													 @Nullable LongReturnType longReturnType) {
		this.decimalReturnType = decimalReturnType;
		this.longReturnType = longReturnType;
	}

	@NonNull
	public static ResultSetOptions of(@Nullable DecimalReturnType decimalReturnType,
																		@Nullable LongReturnType longReturnType) {
		return new ResultSetOptions(decimalReturnType, longReturnType);
	}

	@NonNull
	public Optional<DecimalReturnType> getDecimalReturnType() {
		return Optional.ofNullable(this.decimalReturnType);
	}

	@NonNull
	public Optional<LongReturnType> getLongReturnType() {
		return Optional.ofNullable(this.longReturnType);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResultSetOptions))
			return false;

		ResultSetOptions resultSetOptions = (ResultSetOptions) object;

		return Objects.equals(getDecimalReturnType(), resultSetOptions.getDecimalReturnType())
				&& Objects.equals(getLongReturnType(), resultSetOptions.getLongReturnType());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDecimalReturnType(), getLongReturnType());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{decimalReturnType=%s, longReturnType=%s}", getClass().getSimpleName(),
				this.decimalReturnType, this.longReturnType);
	}

	/**
	 * How {@code DECIMAL} columns are returned.
	 */
	public enum DecimalReturnType {
		DOUBLE_OR_LONG,
		STRING
	}

	/**
	 * How {@code BIGINT} columns are returned.
	 */
	public enum LongReturnType {
		LONG,
		STRING
	}
}

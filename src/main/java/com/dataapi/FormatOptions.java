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
import java.util.Objects;

import static java.lang.String.format;

/**
 * Controls how dates are written to and read from the Data API.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class FormatOptions {
	@NonNull
	private static final FormatOptions DEFAULT_INSTANCE = new FormatOptions(true, false);

	private final boolean deserializeDate;
	private final boolean treatAsLocalDate;

	private FormatOptions(boolean deserializeDate,
												boolean treatAsLocalDate) {
		this.deserializeDate = deserializeDate;
		this.treatAsLocalDate = treatAsLocalDate;
	}

	/**
	 * Acquires the default options: dates are deserialized and zone-less timestamps are UTC.
	 *
	 * @return the default options
	 */
	@NonNull
	public static FormatOptions defaults() {
		return DEFAULT_INSTANCE;
	}

	/**
	 * Acquires options with the given settings.
	 *
	 * @param deserializeDate  whether date-typed result columns are parsed into {@link java.time.Instant}s
	 * @param treatAsLocalDate whether zone-less timestamps are written and read in the client's time zone rather
	 *                         than UTC
	 * @return the options
	 */
	@NonNull
	public static FormatOptions of(boolean deserializeDate,
																 boolean treatAsLocalDate) {
		if (deserializeDate && !treatAsLocalDate)
			return DEFAULT_INSTANCE;

		return new FormatOptions(deserializeDate, treatAsLocalDate);
	}

	@NonNull
	public FormatOptions withDeserializeDate(boolean deserializeDate) {
		return of(deserializeDate, this.treatAsLocalDate);
	}

	@NonNull
	public FormatOptions withTreatAsLocalDate(boolean treatAsLocalDate) {
		return of(this.deserializeDate, treatAsLocalDate);
	}

	public boolean getDeserializeDate() {
		return this.deserializeDate;
	}

	public boolean getTreatAsLocalDate() {
		return this.treatAsLocalDate;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof FormatOptions))
			return false;

		FormatOptions formatOptions = (FormatOptions) object;

		return getDeserializeDate() == formatOptions.getDeserializeDate()
				&& getTreatAsLocalDate() == formatOptions.getTreatAsLocalDate();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDeserializeDate(), getTreatAsLocalDate());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{deserializeDate=%s, treatAsLocalDate=%s}", getClass().getSimpleName(),
				getDeserializeDate(), getTreatAsLocalDate());
	}
}

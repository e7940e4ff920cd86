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

import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Identifies the database engine behind the Data API endpoint, which drives identifier quoting, cast syntax and
 * type hint inference.
 *
 * @since 1.0.0
 */
public enum Engine {
	/**
	 * An Aurora MySQL cluster.
	 */
	MYSQL,
	/**
	 * An Aurora PostgreSQL cluster.
	 */
	PG;

	/**
	 * Resolves an engine from its conventional short name, e.g. {@code "mysql"} or {@code "pg"}.
	 *
	 * @param name the engine name, case-insensitive
	 * @return the matching engine
	 * @throws IllegalArgumentException if the name is not recognized
	 */
	@NonNull
	public static Engine fromName(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = name.trim().toLowerCase(Locale.ENGLISH);

		if (normalizedName.equals("mysql"))
			return MYSQL;

		// Some callers spell out the full product name
		if (normalizedName.equals("pg") || normalizedName.equals("postgres") || normalizedName.equals("postgresql"))
			return PG;

		throw new IllegalArgumentException(format("Unsupported engine '%s'. Supported engines are 'mysql' and 'pg'", name));
	}
}

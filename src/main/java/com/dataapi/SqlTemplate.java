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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text plus the named tokens found in it.
 * <p>
 * {@code :name} is a placeholder for an encoded value and {@code ::name} is an identifier substituted into the SQL
 * text. A {@code ::type} directly following a placeholder (PostgreSQL cast syntax, as in {@code :id::uuid}) is
 * neither.
 * <p>
 * Colons inside string literals and comments are not special-cased, so {@code '10:30'} registers a
 * {@code 30} placeholder.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class SqlTemplate {
	@NonNull
	private static final Pattern TOKEN_PATTERN = Pattern.compile(":{1,2}\\w+");

	@NonNull
	private final String sql;
	@NonNull
	private final Map<String, TokenType> tokens;

	private SqlTemplate(@NonNull String sql,
											@NonNull Map<String, TokenType> tokens) {
		this.sql = requireNonNull(sql);
		this.tokens = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(tokens)));
	}

	/**
	 * Scans SQL for named tokens.
	 *
	 * @param sql the SQL to scan
	 * @return the template
	 * @throws IllegalArgumentException if {@code sql} is null or blank
	 */
	@NonNull
	public static SqlTemplate parse(@Nullable String sql) {
		if (sql == null || sql.isBlank())
			throw new IllegalArgumentException("No 'sql' statement provided.");

		Map<String, TokenType> tokens = new LinkedHashMap<>();
		Matcher matcher = TOKEN_PATTERN.matcher(sql);
		int previousTokenEnd = -1;

		while (matcher.find()) {
			String token = matcher.group();
			boolean adjacentToPreviousToken = matcher.start() == previousTokenEnd;

			previousTokenEnd = matcher.end();

			if (token.startsWith("::")) {
				// Cast suffix of a placeholder
				if (adjacentToPreviousToken)
					continue;

				tokens.putIfAbsent(token.substring(2), TokenType.NAMED_IDENTIFIER);
			} else {
				tokens.putIfAbsent(token.substring(1), TokenType.NAMED_PLACEHOLDER);
			}
		}

		return new SqlTemplate(sql, tokens);
	}

	/**
	 * Rewrites this template's SQL and encodes parameter values.
	 * <p>
	 * Identifier substitution and cast injection are driven by the first row only, since they change the statement
	 * text shared by every row. Parameters without a matching token are dropped and identifier parameters are never
	 * sent as values.
	 *
	 * @param parameterSet      normalized parameters
	 * @param parameterEncoder  encodes placeholder values
	 * @param identifierEscaper quotes identifier values
	 * @return the bound statement
	 * @throws IllegalArgumentException if a value cannot be encoded or an identifier value is not a string
	 */
	@NonNull
	public BoundStatement bind(@NonNull ParameterSet parameterSet,
														 @NonNull ParameterEncoder parameterEncoder,
														 @NonNull IdentifierEscaper identifierEscaper) {
		requireNonNull(parameterSet);
		requireNonNull(parameterEncoder);
		requireNonNull(identifierEscaper);

		String boundSql = rewriteSql(parameterSet.getFirstRow(), identifierEscaper);
		List<List<SqlParameter>> parameterSets = new ArrayList<>(parameterSet.getRows().size());

		for (List<NamedParameter> row : parameterSet.getRows()) {
			List<SqlParameter> sqlParameters = new ArrayList<>(row.size());

			for (NamedParameter namedParameter : row)
				if (getTokens().get(namedParameter.getName()) == TokenType.NAMED_PLACEHOLDER)
					sqlParameters.add(parameterEncoder.encode(namedParameter.getName(), namedParameter.getValue()));

			parameterSets.add(sqlParameters);
		}

		return new BoundStatement(boundSql, parameterSets, parameterSet.isBatch());
	}

	@NonNull
	private String rewriteSql(@NonNull List<NamedParameter> row,
														@NonNull IdentifierEscaper identifierEscaper) {
		requireNonNull(row);
		requireNonNull(identifierEscaper);

		String rewrittenSql = getSql();

		for (NamedParameter namedParameter : row) {
			String name = namedParameter.getName();
			TokenType tokenType = getTokens().get(name);

			if (tokenType == TokenType.NAMED_PLACEHOLDER) {
				String cast = namedParameter.getCast().orElse(null);

				if (cast != null) {
					String replacement = identifierEscaper.getEngine() == Engine.PG
							? format(":%s::%s", name, cast)
							: format("CAST(:%s AS %s)", name, cast);

					rewrittenSql = Pattern.compile(format("(?<!:):%s\\b", Pattern.quote(name)))
							.matcher(rewrittenSql).replaceAll(Matcher.quoteReplacement(replacement));
				}
			} else if (tokenType == TokenType.NAMED_IDENTIFIER) {
				String escapedIdentifier = identifierEscaper.escape(name, namedParameter.getValue());

				rewrittenSql = Pattern.compile(format("::%s\\b", Pattern.quote(name)))
						.matcher(rewrittenSql).replaceAll(Matcher.quoteReplacement(escapedIdentifier));
			}
		}

		return rewrittenSql;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	/**
	 * Gets the distinct tokens in order of first appearance. The first classification of a name wins.
	 *
	 * @return token name to token type
	 */
	@NonNull
	public Map<String, TokenType> getTokens() {
		return this.tokens;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof SqlTemplate))
			return false;

		SqlTemplate sqlTemplate = (SqlTemplate) object;

		return Objects.equals(getSql(), sqlTemplate.getSql()) && Objects.equals(getTokens(), sqlTemplate.getTokens());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getSql(), getTokens());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{sql=%s, tokens=%s}", getClass().getSimpleName(), getSql(), getTokens());
	}

	/**
	 * Kinds of named tokens.
	 *
	 * @since 1.0.0
	 */
	public enum TokenType {
		/**
		 * {@code :name}, bound to an encoded value.
		 */
		NAMED_PLACEHOLDER,
		/**
		 * {@code ::name}, replaced by a quoted identifier.
		 */
		NAMED_IDENTIFIER
	}
}

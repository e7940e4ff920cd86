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

/**
 * A marshaling layer for the Aurora Serverless Data API: named-parameter SQL, typed parameter encoding, result
 * hydration, cold-start aware retries and queued transactions, over any {@link com.dataapi.DataApiTransport}.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * DataApiTransport transport = ...
 * DataApiClient client = DataApiClient.withTransport(transport)
 *   .resourceArn(resourceArn)
 *   .secretArn(secretArn)
 *   .database("inventory")
 *   .build();
 *
 * // Queries
 * QueryResult cars = client.query("SELECT * FROM car WHERE color = :color", Map.of("color", "BLUE")).join();
 * List&lt;Car&gt; blueCars = cars.getRecords(Car.class);
 *
 * // Identifiers and casts
 * client.query("SELECT ::column FROM car WHERE id = :id",
 *   List.of(Parameters.named("column", "color"), Parameters.named("id", "42", "BIGINT"))).join();
 *
 * // Batches
 * QueryResult inserted = client.query("INSERT INTO car (color) VALUES (:color)",
 *   List.of(Map.of("color", "RED"), Map.of("color", "GREEN"))).join();
 *
 * // Transactions
 * TransactionResult result = client.transaction()
 *   .query("UPDATE account SET balance = balance - :amount WHERE id = 1", Map.of("amount", amount))
 *   .query("UPDATE account SET balance = balance + :amount WHERE id = 2", Map.of("amount", amount))
 *   .rollback((failure, status) -&gt; logger.warning("Transfer rolled back: " + status))
 *   .commit()
 *   .join();</pre>
 *
 * @since 1.0.0
 */
package com.dataapi;

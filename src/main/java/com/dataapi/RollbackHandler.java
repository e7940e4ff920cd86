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

/**
 * Notified when a {@link Transaction} is rolled back because one of its queries failed.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RollbackHandler {
	/**
	 * Called after the rollback attempt, before the original failure is propagated.
	 *
	 * @param failure        the failure which caused the rollback
	 * @param rollbackStatus the status reported by the rollback call, or {@code null} if the rollback itself failed
	 */
	void onRollback(@NonNull Throwable failure,
									@Nullable String rollbackStatus);
}

/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.brain.resilience;

import java.time.Duration;

/**
 * Callback invoked before each retry.
 */
@FunctionalInterface
public interface RetryListener {

    RetryListener NO_OP = (retryNumber, error, delay) -> { };

    /**
     * @param retryNumber the one-based number of the retry about to happen
     * @param error       the failure of the previous attempt
     * @param delay       the wait before the retry
     */
    void onRetry(int retryNumber, Throwable error, Duration delay);
}

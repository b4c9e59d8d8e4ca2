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
 * Retry settings for a step or a model call.
 *
 * @param maxRetries   number of retries after the first attempt
 * @param backoff      delay growth between retries
 * @param initialDelay delay before the first retry
 * @param maxDelay     upper bound for any single delay
 */
public record RetryOptions(int maxRetries, Backoff backoff, Duration initialDelay, Duration maxDelay) {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    public RetryOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
        }
        backoff = backoff != null ? backoff : Backoff.EXPONENTIAL;
        initialDelay = initialDelay != null ? initialDelay : DEFAULT_INITIAL_DELAY;
        maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
    }

    /**
     * Options that never retry.
     */
    public static RetryOptions none() {
        return new RetryOptions(0, Backoff.NONE, Duration.ZERO, Duration.ZERO);
    }

    public static RetryOptions of(int maxRetries, Backoff backoff) {
        return new RetryOptions(maxRetries, backoff, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * Delay to wait after the failed attempt with the given zero-based index.
     */
    public Duration delayAfterAttempt(int attempt) {
        double factor = switch (backoff) {
            case NONE -> 1;
            case LINEAR -> attempt + 1;
            case EXPONENTIAL -> Math.pow(2, attempt);
        };
        double millis = Math.min(maxDelay.toMillis(), initialDelay.toMillis() * factor);
        return Duration.ofMillis((long) millis);
    }
}

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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryExecutor} and {@link RetryOptions}.
 */
class RetryExecutorTest {

    private final RetryExecutor executor = new RetryExecutor();

    private static RetryOptions fast(int maxRetries) {
        return new RetryOptions(maxRetries, Backoff.NONE, Duration.ofMillis(1), Duration.ofMillis(5));
    }

    // ========================================================================
    // delayAfterAttempt Tests
    // ========================================================================

    @Nested
    @DisplayName("delayAfterAttempt")
    class DelayAfterAttemptTests {

        @Test
        @DisplayName("should double the delay for exponential backoff")
        void delayAfterAttempt_shouldDoubleForExponential() {
            RetryOptions options = new RetryOptions(5, Backoff.EXPONENTIAL, Duration.ofMillis(100), Duration.ofSeconds(30));

            assertThat(options.delayAfterAttempt(0)).isEqualTo(Duration.ofMillis(100));
            assertThat(options.delayAfterAttempt(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(options.delayAfterAttempt(3)).isEqualTo(Duration.ofMillis(800));
        }

        @Test
        @DisplayName("should grow linearly for linear backoff")
        void delayAfterAttempt_shouldGrowLinearly() {
            RetryOptions options = new RetryOptions(5, Backoff.LINEAR, Duration.ofMillis(100), Duration.ofSeconds(30));

            assertThat(options.delayAfterAttempt(0)).isEqualTo(Duration.ofMillis(100));
            assertThat(options.delayAfterAttempt(2)).isEqualTo(Duration.ofMillis(300));
        }

        @Test
        @DisplayName("should keep the initial delay when backoff is none")
        void delayAfterAttempt_shouldStayConstantForNone() {
            RetryOptions options = new RetryOptions(5, Backoff.NONE, Duration.ofMillis(250), Duration.ofSeconds(30));

            assertThat(options.delayAfterAttempt(4)).isEqualTo(Duration.ofMillis(250));
        }

        @Test
        @DisplayName("should cap the delay at maxDelay")
        void delayAfterAttempt_shouldCapAtMaxDelay() {
            RetryOptions options = new RetryOptions(20, Backoff.EXPONENTIAL, Duration.ofSeconds(1), Duration.ofSeconds(30));

            assertThat(options.delayAfterAttempt(10)).isEqualTo(Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("should reject negative retry counts")
        void constructor_shouldRejectNegativeRetries() {
            assertThatThrownBy(() -> RetryOptions.of(-1, Backoff.NONE))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ========================================================================
    // executeWithRetry Tests
    // ========================================================================

    @Nested
    @DisplayName("executeWithRetry")
    class ExecuteWithRetryTests {

        @Test
        @DisplayName("should succeed after transient failures")
        void executeWithRetry_shouldSucceedAfterFailures() {
            AtomicInteger attempts = new AtomicInteger();
            List<Integer> retries = new ArrayList<>();

            Mono<String> result = executor.executeWithRetry("test", () -> {
                if (attempts.incrementAndGet() < 3) {
                    return Mono.error(new IllegalStateException("boom " + attempts.get()));
                }
                return Mono.just("ok");
            }, fast(3), (retryNumber, error, delay) -> retries.add(retryNumber));

            StepVerifier.create(result)
                    .expectNext("ok")
                    .verifyComplete();

            assertThat(attempts.get()).isEqualTo(3);
            assertThat(retries).containsExactly(1, 2);
        }

        @Test
        @DisplayName("should re-throw the last error unwrapped once retries are exhausted")
        void executeWithRetry_shouldRethrowLastError() {
            AtomicInteger attempts = new AtomicInteger();

            Mono<String> result = executor.executeWithRetry("test",
                    () -> Mono.error(new IllegalStateException("attempt " + attempts.incrementAndGet())),
                    fast(2));

            StepVerifier.create(result)
                    .expectErrorSatisfies(error -> assertThat(error)
                            .isInstanceOf(IllegalStateException.class)
                            .hasMessage("attempt 3"))
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should run exactly once when maxRetries is zero")
        void executeWithRetry_shouldRunOnceWithoutRetries() {
            AtomicInteger attempts = new AtomicInteger();

            StepVerifier.create(executor.executeWithRetry("test",
                            () -> Mono.error(new IllegalStateException("nope " + attempts.incrementAndGet())),
                            RetryOptions.none()))
                    .expectError(IllegalStateException.class)
                    .verify();

            assertThat(attempts.get()).isEqualTo(1);
        }
    }

    // ========================================================================
    // executeBlocking Tests
    // ========================================================================

    @Nested
    @DisplayName("executeBlocking")
    class ExecuteBlockingTests {

        @Test
        @DisplayName("should retry a blocking callable")
        void executeBlocking_shouldRetryCallable() throws Exception {
            AtomicInteger attempts = new AtomicInteger();

            String result = executor.executeBlocking("blocking", () -> {
                if (attempts.incrementAndGet() < 2) {
                    throw new IllegalStateException("first");
                }
                return "done";
            }, fast(1));

            assertThat(result).isEqualTo("done");
            assertThat(attempts.get()).isEqualTo(2);
        }

        @Test
        @DisplayName("should propagate the error after maxRetries + 1 attempts")
        void executeBlocking_shouldPropagateError() {
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> executor.executeBlocking("blocking", () -> {
                attempts.incrementAndGet();
                throw new IllegalArgumentException("always");
            }, fast(2)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("always");

            assertThat(attempts.get()).isEqualTo(3);
        }
    }
}

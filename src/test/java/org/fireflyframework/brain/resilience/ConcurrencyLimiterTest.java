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
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link ConcurrencyLimiter}.
 */
class ConcurrencyLimiterTest {

    @Test
    @DisplayName("should never run more than maxConcurrent calls at once")
    void limit_shouldBoundConcurrency() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("test", 2);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        Flux<Integer> calls = Flux.range(0, 8)
                .flatMap(i -> limiter.limit(Mono.fromCallable(() -> {
                            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                            return i;
                        })
                        .delayElement(Duration.ofMillis(20))
                        .doOnNext(ignored -> running.decrementAndGet())));

        StepVerifier.create(calls)
                .expectNextCount(8)
                .verifyComplete();

        assertThat(peak.get()).isLessThanOrEqualTo(2);
        assertThat(limiter.getAvailableSlots()).isEqualTo(2);
    }

    @Test
    @DisplayName("should release the slot when the limited call fails")
    void limit_shouldReleaseOnError() {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("test", 1);

        StepVerifier.create(limiter.limit(Mono.error(new IllegalStateException("fail"))))
                .expectError(IllegalStateException.class)
                .verify(Duration.ofSeconds(5));

        assertThat(limiter.getAvailableSlots()).isEqualTo(1);
    }

    @Test
    @DisplayName("should keep a waiter blocked until a slot is released, however late")
    void acquire_shouldWaitForLateRelease() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("test", 1);
        limiter.acquire();

        CompletableFuture<String> waiter = CompletableFuture.supplyAsync(() -> {
            limiter.acquire();
            return "acquired";
        });

        await().during(Duration.ofMillis(500)).atMost(Duration.ofSeconds(2)).until(() -> !waiter.isDone());
        limiter.release();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo("acquired");
        assertThat(limiter.getAvailableSlots()).isZero();
        limiter.release();
        assertThat(limiter.getAvailableSlots()).isEqualTo(1);
    }

    @Test
    @DisplayName("should hand freed slots to waiters in arrival order")
    void acquire_shouldServeWaitersInOrder() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter("test", 1);
        limiter.acquire();
        List<String> order = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> first = executor.submit(() -> {
                limiter.acquire();
                order.add("first");
                limiter.release();
            });
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> !first.isDone());
            Future<?> second = executor.submit(() -> {
                limiter.acquire();
                order.add("second");
                limiter.release();
            });
            await().during(Duration.ofMillis(200)).atMost(Duration.ofSeconds(2)).until(() -> !second.isDone());

            limiter.release();

            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
            assertThat(order).containsExactly("first", "second");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("should reject a limit below one")
    void constructor_shouldRejectZeroLimit() {
        assertThatThrownBy(() -> new ConcurrencyLimiter("test", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

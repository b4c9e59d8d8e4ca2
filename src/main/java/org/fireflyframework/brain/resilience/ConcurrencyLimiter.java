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

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Counting semaphore bounding concurrent work, built on a fair Resilience4j semaphore {@link Bulkhead}.
 * <p>
 * Waiters are served in arrival order and wait for as long as it takes; there is no
 * rejection. The scoped helpers {@link #execute(Callable)} and
 * {@link #limit(Mono)} always give the slot back, including when the body fails.
 */
@Slf4j
public class ConcurrencyLimiter {

    // effectively no deadline
    private static final Duration UNBOUNDED_WAIT = Duration.ofMillis(Long.MAX_VALUE);

    private final Bulkhead bulkhead;
    private final int maxConcurrent;

    public ConcurrencyLimiter(String name, int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1: " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
        this.bulkhead = Bulkhead.of(name, BulkheadConfig.custom()
                .maxConcurrentCalls(maxConcurrent)
                .maxWaitDuration(UNBOUNDED_WAIT)
                .fairCallHandlingStrategyEnabled(true)
                .build());

        bulkhead.getEventPublisher()
                .onCallPermitted(event ->
                        log.debug("LIMITER_ACQUIRED: name={}", event.getBulkheadName()))
                .onCallRejected(event ->
                        log.warn("LIMITER_REJECTED: name={}", event.getBulkheadName()))
                .onCallFinished(event ->
                        log.debug("LIMITER_RELEASED: name={}", event.getBulkheadName()));
    }

    /**
     * Blocks until a slot is free. Only an interrupt of the waiting thread ends the wait early,
     * with an exception.
     */
    public void acquire() {
        bulkhead.acquirePermission();
    }

    /**
     * Returns a slot acquired by {@link #acquire()}.
     */
    public void release() {
        bulkhead.onComplete();
    }

    public <T> T execute(Callable<T> callable) throws Exception {
        acquire();
        try {
            return callable.call();
        } finally {
            release();
        }
    }

    /**
     * Subscribes to {@code mono} while holding a slot. Waiting for the slot happens
     * on the bounded elastic scheduler; the slot is returned on completion, error or cancel.
     */
    public <T> Mono<T> limit(Mono<T> mono) {
        return Mono.usingWhen(
                Mono.fromCallable(() -> {
                    acquire();
                    return bulkhead;
                }).subscribeOn(Schedulers.boundedElastic()),
                permit -> mono,
                permit -> Mono.fromRunnable(this::release));
    }

    public int getAvailableSlots() {
        return bulkhead.getMetrics().getAvailableConcurrentCalls();
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }
}

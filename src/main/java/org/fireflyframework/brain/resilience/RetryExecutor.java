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

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs a unit of work up to {@code maxRetries + 1} times on top of Resilience4j {@link Retry}.
 * <p>
 * Before each retry the executor waits {@code min(maxDelay, initialDelay * f(attempt))}
 * as described by {@link RetryOptions#delayAfterAttempt(int)}. Once retries are
 * exhausted the last error is re-thrown as it was raised, never wrapped.
 * Delays are at least one millisecond.
 */
@Slf4j
public class RetryExecutor {

    /**
     * Reactive variant. The supplier is invoked again for every attempt.
     */
    public <T> Mono<T> executeWithRetry(String name, Supplier<Mono<T>> supplier, RetryOptions options) {
        return executeWithRetry(name, supplier, options, RetryListener.NO_OP);
    }

    public <T> Mono<T> executeWithRetry(String name, Supplier<Mono<T>> supplier, RetryOptions options,
                                        RetryListener listener) {
        if (options.maxRetries() == 0) {
            return Mono.defer(supplier);
        }
        Retry retry = createRetry(name, options, listener);
        return Mono.defer(supplier).transformDeferred(RetryOperator.of(retry));
    }

    /**
     * Blocking variant. Sleeps on the calling thread between attempts.
     */
    public <T> T executeBlocking(String name, Callable<T> callable, RetryOptions options) throws Exception {
        return executeBlocking(name, callable, options, RetryListener.NO_OP);
    }

    public <T> T executeBlocking(String name, Callable<T> callable, RetryOptions options,
                                 RetryListener listener) throws Exception {
        if (options.maxRetries() == 0) {
            return callable.call();
        }
        Retry retry = createRetry(name, options, listener);
        return Retry.decorateCallable(retry, callable).call();
    }

    private Retry createRetry(String name, RetryOptions options, RetryListener listener) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(options.maxRetries() + 1)
                .intervalFunction(intervalFunction(options))
                .retryOnException(error -> true)
                .build();

        Retry retry = Retry.of(name, config);
        retry.getEventPublisher()
                .onRetry(event -> {
                    log.warn("RETRY_ATTEMPT: name={}, retry={}/{}, waitMs={}, error={}",
                            event.getName(),
                            event.getNumberOfRetryAttempts(),
                            options.maxRetries(),
                            event.getWaitInterval().toMillis(),
                            event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null);
                    listener.onRetry(event.getNumberOfRetryAttempts(), event.getLastThrowable(),
                            event.getWaitInterval());
                })
                .onError(event ->
                        log.warn("RETRY_EXHAUSTED: name={}, attempts={}", event.getName(),
                                event.getNumberOfRetryAttempts()));
        return retry;
    }

    private static IntervalFunction intervalFunction(RetryOptions options) {
        // resilience4j counts attempts from 1
        return numOfAttempts -> Math.max(1L, options.delayAfterAttempt(numOfAttempts - 1).toMillis());
    }
}

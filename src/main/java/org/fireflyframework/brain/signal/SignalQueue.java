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

package org.fireflyframework.brain.signal;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Per-run FIFO of signals, the only channel through which the outside world
 * influences a running actor.
 * <p>
 * Consumption is atomic with respect to enqueue: a signal queued concurrently with
 * {@link #getAndConsumeSignals} is either returned by that call or left for the next one.
 */
public interface SignalQueue {

    Mono<Void> queueSignal(String brainRunId, BrainSignal signal);

    /**
     * Removes and returns, in queue order, every signal matching the filter.
     */
    Mono<List<BrainSignal>> getAndConsumeSignals(String brainRunId, SignalFilter filter);

    /**
     * Drops every signal of a finished run.
     */
    Mono<Void> clear(String brainRunId);
}

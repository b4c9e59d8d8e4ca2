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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signal queue kept in memory. Each run's queue is only touched inside
 * {@link ConcurrentHashMap#compute}, which serializes access per run.
 */
@Slf4j
public class InMemorySignalQueue implements SignalQueue {

    private final Map<String, Deque<BrainSignal>> queues = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> queueSignal(String brainRunId, BrainSignal signal) {
        return Mono.fromRunnable(() -> {
            queues.compute(brainRunId, (id, queue) -> {
                Deque<BrainSignal> target = queue != null ? queue : new ArrayDeque<>();
                target.addLast(signal);
                return target;
            });
            log.debug("SIGNAL_QUEUED: runId={}, type={}", brainRunId, signal.type());
        });
    }

    @Override
    public Mono<List<BrainSignal>> getAndConsumeSignals(String brainRunId, SignalFilter filter) {
        return Mono.fromSupplier(() -> {
            List<BrainSignal> consumed = new ArrayList<>();
            queues.computeIfPresent(brainRunId, (id, queue) -> {
                Deque<BrainSignal> remaining = new ArrayDeque<>();
                for (BrainSignal signal : queue) {
                    if (filter.matches(signal)) {
                        consumed.add(signal);
                    } else {
                        remaining.addLast(signal);
                    }
                }
                return remaining.isEmpty() ? null : remaining;
            });
            return consumed;
        });
    }

    @Override
    public Mono<Void> clear(String brainRunId) {
        return Mono.fromRunnable(() -> queues.remove(brainRunId));
    }

    /**
     * Number of signals currently queued for a run.
     */
    public int size(String brainRunId) {
        Deque<BrainSignal> queue = queues.get(brainRunId);
        return queue != null ? queue.size() : 0;
    }
}

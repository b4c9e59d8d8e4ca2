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

package org.fireflyframework.brain.monitor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Monitor kept in memory.
 * <p>
 * Registrations of one run are only changed inside {@code compute} on that run's entry,
 * so a claim and a concurrent registration or clear of the same run never interleave.
 */
@Slf4j
public class InMemoryBrainRunMonitor implements BrainRunMonitor {

    private final Map<WaitingKey, WaitingRun> waiting = new ConcurrentHashMap<>();
    private final Map<String, Set<WaitingKey>> keysByRun = new ConcurrentHashMap<>();
    private final Map<String, BrainRunSummary> runs = new ConcurrentHashMap<>();

    @Override
    public Mono<WaitingRun> findWaitingRun(String slug, String identifier) {
        return Mono.fromSupplier(() -> waiting.get(new WaitingKey(slug, identifier)));
    }

    @Override
    public Mono<Void> registerWaiting(String slug, String identifier, String brainRunId, String token) {
        return Mono.fromRunnable(() -> {
            WaitingKey key = new WaitingKey(slug, identifier);
            keysByRun.compute(brainRunId, (id, keys) -> {
                Set<WaitingKey> target = keys != null ? keys : new HashSet<>();
                target.add(key);
                WaitingRun previous = waiting.put(key, new WaitingRun(brainRunId, slug, identifier, token));
                if (previous != null && !previous.brainRunId().equals(brainRunId)) {
                    log.info("WAITING_SUPERSEDED: slug={}, identifier={}, previousRunId={}, runId={}",
                            slug, identifier, previous.brainRunId(), brainRunId);
                }
                return target;
            });
            log.debug("WAITING_REGISTERED: slug={}, identifier={}, runId={}", slug, identifier, brainRunId);
        });
    }

    @Override
    public Mono<Boolean> claimWaiting(WaitingRun expected) {
        return Mono.fromSupplier(() -> {
            boolean[] claimed = {false};
            keysByRun.computeIfPresent(expected.brainRunId(), (id, keys) -> {
                if (!waiting.remove(new WaitingKey(expected.slug(), expected.identifier()), expected)) {
                    return keys;
                }
                claimed[0] = true;
                removeAll(id, keys);
                return null;
            });
            return claimed[0];
        });
    }

    @Override
    public Mono<Void> clearWaiting(String brainRunId) {
        return Mono.fromRunnable(() -> keysByRun.computeIfPresent(brainRunId, (id, keys) -> {
            removeAll(id, keys);
            return null;
        }));
    }

    @Override
    public Mono<Void> updateRun(BrainRunSummary summary) {
        return Mono.fromRunnable(() -> runs.put(summary.brainRunId(), summary));
    }

    @Override
    public Mono<BrainRunSummary> getRun(String brainRunId) {
        return Mono.fromSupplier(() -> runs.get(brainRunId));
    }

    @Override
    public Flux<BrainRunSummary> listRuns() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(runs.values())));
    }

    private void removeAll(String brainRunId, Set<WaitingKey> keys) {
        // a superseded key may belong to another run by now
        keys.forEach(key -> waiting.computeIfPresent(key,
                (k, run) -> run.brainRunId().equals(brainRunId) ? null : run));
    }

    private record WaitingKey(String slug, String identifier) {
    }
}

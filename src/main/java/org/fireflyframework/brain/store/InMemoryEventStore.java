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

package org.fireflyframework.brain.store;

import org.fireflyframework.brain.event.BrainEventType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Event store kept in memory, indexed by run and by event type.
 */
public class InMemoryEventStore implements EventStore {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, EventRecord> rows = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Long, Long>> runIndex = new ConcurrentHashMap<>();
    private final Map<String, NavigableMap<Long, Long>> typeIndex = new ConcurrentHashMap<>();

    @Override
    public Mono<EventRecord> insert(EventRecord record) {
        return Mono.fromSupplier(() -> {
            long id = sequence.incrementAndGet();
            EventRecord stored = record.withEventId(id);
            rows.put(id, stored);
            runIndex.computeIfAbsent(stored.brainRunId(), k -> new ConcurrentSkipListMap<>()).put(id, id);
            typeIndex.computeIfAbsent(typeKey(stored.brainRunId(), stored.eventType()),
                    k -> new ConcurrentSkipListMap<>()).put(id, id);
            return stored;
        });
    }

    @Override
    public Mono<Void> updateBlobKey(long eventId, String blobKey) {
        return Mono.fromRunnable(() -> rows.computeIfPresent(eventId, (id, row) -> row.withBlobKey(blobKey)));
    }

    @Override
    public Flux<EventRecord> findAll(String brainRunId) {
        return Flux.defer(() -> {
            NavigableMap<Long, Long> ids = runIndex.get(brainRunId);
            if (ids == null) {
                return Flux.empty();
            }
            List<EventRecord> snapshot = new ArrayList<>();
            ids.keySet().forEach(id -> snapshot.add(rows.get(id)));
            return Flux.fromIterable(snapshot);
        });
    }

    @Override
    public Mono<EventRecord> findFirstByType(String brainRunId, BrainEventType type, EventOrder order) {
        return Mono.defer(() -> {
            NavigableMap<Long, Long> ids = typeIndex.get(typeKey(brainRunId, type.getWireName()));
            if (ids == null || ids.isEmpty()) {
                return Mono.empty();
            }
            Long id = order == EventOrder.ASC ? ids.firstKey() : ids.lastKey();
            return Mono.justOrEmpty(rows.get(id));
        });
    }

    @Override
    public Flux<String> findRunIds() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(runIndex.keySet())));
    }

    private static String typeKey(String brainRunId, String eventType) {
        return brainRunId + "|" + eventType;
    }
}

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

package org.fireflyframework.brain.loader;

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventCodec;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.exception.EventHydrationException;
import org.fireflyframework.brain.store.BlobStore;
import org.fireflyframework.brain.store.EventOrder;
import org.fireflyframework.brain.store.EventRecord;
import org.fireflyframework.brain.store.EventStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Loads a run's events in log order, hydrating overflowed bodies from blob storage.
 * <p>
 * Blob fetches for overflowed rows run in parallel and are merged back into their
 * original position. A row whose body cannot be found aborts the load with an
 * {@link EventHydrationException}.
 */
@Slf4j
public class EventLoader {

    private static final int DEFAULT_HYDRATION_CONCURRENCY = 32;

    private final EventStore eventStore;
    private final BlobStore blobStore;
    private final BrainEventCodec codec;
    private final int hydrationConcurrency;

    public EventLoader(EventStore eventStore, BlobStore blobStore, BrainEventCodec codec) {
        this(eventStore, blobStore, codec, DEFAULT_HYDRATION_CONCURRENCY);
    }

    public EventLoader(EventStore eventStore, BlobStore blobStore, BrainEventCodec codec, int hydrationConcurrency) {
        this.eventStore = eventStore;
        this.blobStore = blobStore;
        this.codec = codec;
        this.hydrationConcurrency = hydrationConcurrency;
    }

    /**
     * All events of a run in ascending event id order.
     */
    public Flux<BrainEvent> loadAllEvents(String brainRunId) {
        return eventStore.findAll(brainRunId)
                .flatMapSequential(this::hydrate, hydrationConcurrency);
    }

    /**
     * The first or last event of a type, looked up directly rather than by scanning the log.
     */
    public Mono<BrainEvent> loadEventByType(String brainRunId, BrainEventType type, EventOrder order) {
        return eventStore.findFirstByType(brainRunId, type, order)
                .flatMap(this::hydrate);
    }

    private Mono<BrainEvent> hydrate(EventRecord record) {
        if (record.serializedEvent() != null) {
            return decode(record, record.serializedEvent());
        }
        if (record.blobKey() == null) {
            return Mono.error(new EventHydrationException(record.brainRunId(), record.eventId(),
                    "Event " + record.eventId() + " of run " + record.brainRunId()
                            + " has neither an inline body nor a blob key; cannot reconstruct run state"));
        }
        return blobStore.get(record.blobKey())
                .switchIfEmpty(Mono.error(() -> {
                    log.error("EVENT_BLOB_MISSING: runId={}, eventId={}, key={}",
                            record.brainRunId(), record.eventId(), record.blobKey());
                    return new EventHydrationException(record.brainRunId(), record.eventId(),
                            "Blob '" + record.blobKey() + "' for event " + record.eventId()
                                    + " is missing; cannot reconstruct run state");
                }))
                .flatMap(json -> decode(record, json));
    }

    private Mono<BrainEvent> decode(EventRecord record, String json) {
        return Mono.fromCallable(() -> codec.decode(json))
                .onErrorMap(e -> !(e instanceof EventHydrationException),
                        e -> new EventHydrationException(record.brainRunId(), record.eventId(),
                                "Event " + record.eventId() + " cannot be decoded; cannot reconstruct run state", e));
    }
}

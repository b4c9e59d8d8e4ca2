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
import io.r2dbc.spi.Readable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Event store backed by the {@code brain_events} table through R2DBC.
 * <p>
 * The table is created by {@code schema/brain-events.sql}. Lookups by type use the
 * {@code (brain_run_id, event_type, event_id)} index instead of scanning the run.
 */
@Slf4j
@RequiredArgsConstructor
public class R2dbcEventStore implements EventStore {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<EventRecord> insert(EventRecord record) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO brain_events (brain_run_id, event_type, serialized_event, blob_key, created_at)
                    VALUES (:brainRunId, :eventType, :serializedEvent, :blobKey, :createdAt)
                    RETURNING event_id
                    """)
                .bind("brainRunId", record.brainRunId())
                .bind("eventType", record.eventType())
                .bind("createdAt", record.timestamp());
        spec = record.serializedEvent() != null
                ? spec.bind("serializedEvent", record.serializedEvent())
                : spec.bindNull("serializedEvent", String.class);
        spec = record.blobKey() != null
                ? spec.bind("blobKey", record.blobKey())
                : spec.bindNull("blobKey", String.class);

        return spec.map(row -> row.get("event_id", Long.class))
                .one()
                .map(record::withEventId)
                .doOnNext(stored -> log.debug("EVENT_INSERTED: runId={}, eventId={}, type={}",
                        stored.brainRunId(), stored.eventId(), stored.eventType()));
    }

    @Override
    public Mono<Void> updateBlobKey(long eventId, String blobKey) {
        return databaseClient.sql("""
                    UPDATE brain_events SET blob_key = :blobKey, serialized_event = NULL
                    WHERE event_id = :eventId
                    """)
                .bind("blobKey", blobKey)
                .bind("eventId", eventId)
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Flux<EventRecord> findAll(String brainRunId) {
        return databaseClient.sql("""
                    SELECT event_id, brain_run_id, event_type, serialized_event, blob_key, created_at
                    FROM brain_events
                    WHERE brain_run_id = :brainRunId
                    ORDER BY event_id ASC
                    """)
                .bind("brainRunId", brainRunId)
                .map(R2dbcEventStore::toRecord)
                .all();
    }

    @Override
    public Mono<EventRecord> findFirstByType(String brainRunId, BrainEventType type, EventOrder order) {
        String direction = order == EventOrder.ASC ? "ASC" : "DESC";
        return databaseClient.sql("""
                    SELECT event_id, brain_run_id, event_type, serialized_event, blob_key, created_at
                    FROM brain_events
                    WHERE brain_run_id = :brainRunId AND event_type = :eventType
                    ORDER BY event_id %s
                    LIMIT 1
                    """.formatted(direction))
                .bind("brainRunId", brainRunId)
                .bind("eventType", type.getWireName())
                .map(R2dbcEventStore::toRecord)
                .one();
    }

    @Override
    public Flux<String> findRunIds() {
        return databaseClient.sql("""
                    SELECT DISTINCT brain_run_id FROM brain_events
                    """)
                .map(row -> row.get("brain_run_id", String.class))
                .all();
    }

    private static EventRecord toRecord(Readable row) {
        return new EventRecord(
                row.get("event_id", Long.class),
                row.get("brain_run_id", String.class),
                row.get("event_type", String.class),
                row.get("serialized_event", String.class),
                row.get("blob_key", String.class),
                row.get("created_at", Instant.class));
    }
}

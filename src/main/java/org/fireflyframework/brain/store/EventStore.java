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

/**
 * Append-only storage of event rows, ordered by a monotonic event id.
 */
public interface EventStore {

    /**
     * Inserts a row and returns it with its assigned event id.
     */
    Mono<EventRecord> insert(EventRecord record);

    /**
     * Points an existing row at a blob and drops any inline body.
     */
    Mono<Void> updateBlobKey(long eventId, String blobKey);

    /**
     * All rows of a run in ascending event id order.
     */
    Flux<EventRecord> findAll(String brainRunId);

    /**
     * The first ({@link EventOrder#ASC}) or last ({@link EventOrder#DESC}) row of a type.
     */
    Mono<EventRecord> findFirstByType(String brainRunId, BrainEventType type, EventOrder order);

    /**
     * Ids of every run that has at least one row.
     */
    Flux<String> findRunIds();
}

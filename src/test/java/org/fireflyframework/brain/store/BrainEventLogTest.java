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

import org.fireflyframework.brain.event.BrainEventCodec;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepStartEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BrainEventLog}.
 */
class BrainEventLogTest {

    private static final String RUN_ID = "run-1";

    private InMemoryEventStore eventStore;
    private InMemoryBlobStore blobStore;
    private BrainEventLog eventLog;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        blobStore = new InMemoryBlobStore();
        eventLog = new BrainEventLog(eventStore, blobStore, new BrainEventCodec(), 256);
    }

    @Test
    @DisplayName("should store small events inline")
    void append_shouldStoreInline() {
        StepVerifier.create(eventLog.append(StepStartEvent.builder()
                        .brainRunId(RUN_ID)
                        .timestamp(Instant.EPOCH)
                        .stepId("step-1")
                        .stepTitle("Fetch")
                        .build()))
                .assertNext(row -> {
                    assertThat(row.eventId()).isEqualTo(1L);
                    assertThat(row.eventType()).isEqualTo("step:start");
                    assertThat(row.serializedEvent()).contains("\"stepId\":\"step-1\"");
                    assertThat(row.isOverflowed()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should move bodies above the threshold to blob storage")
    void append_shouldOverflowLargeBodies() {
        BrainStartEvent large = BrainStartEvent.builder()
                .brainRunId(RUN_ID)
                .timestamp(Instant.EPOCH)
                .brainTitle("demo")
                .brainDescription("x".repeat(1024))
                .build();

        StepVerifier.create(eventLog.append(large))
                .assertNext(row -> {
                    assertThat(row.blobKey()).isEqualTo("events/run-1/1.json");
                    assertThat(row.serializedEvent()).isNull();
                })
                .verifyComplete();

        assertThat(blobStore.contains("events/run-1/1.json")).isTrue();
        assertThat(blobStore.getMetadata("events/run-1/1.json"))
                .containsEntry("brainRunId", RUN_ID)
                .containsEntry("eventType", "brain:start");
        StepVerifier.create(eventStore.findAll(RUN_ID))
                .expectNextMatches(row -> "events/run-1/1.json".equals(row.blobKey()) && row.serializedEvent() == null)
                .verifyComplete();
    }
}

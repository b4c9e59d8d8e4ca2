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

import org.fireflyframework.brain.event.BrainCompleteEvent;
import org.fireflyframework.brain.event.BrainEventCodec;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepStartEvent;
import org.fireflyframework.brain.exception.EventHydrationException;
import org.fireflyframework.brain.store.BlobStore;
import org.fireflyframework.brain.store.BrainEventLog;
import org.fireflyframework.brain.store.EventOrder;
import org.fireflyframework.brain.store.EventRecord;
import org.fireflyframework.brain.store.InMemoryBlobStore;
import org.fireflyframework.brain.store.InMemoryEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventLoader}.
 */
class EventLoaderTest {

    private static final String RUN_ID = "run-1";

    private InMemoryEventStore eventStore;
    private InMemoryBlobStore blobStore;
    private BrainEventLog eventLog;
    private EventLoader loader;

    @BeforeEach
    void setUp() {
        BrainEventCodec codec = new BrainEventCodec();
        eventStore = new InMemoryEventStore();
        blobStore = new InMemoryBlobStore();
        eventLog = new BrainEventLog(eventStore, blobStore, codec, 200);
        loader = new EventLoader(eventStore, blobStore, codec, 4);
    }

    // ========================================================================
    // loadAllEvents Tests
    // ========================================================================

    @Nested
    @DisplayName("loadAllEvents")
    class LoadAllEventsTests {

        @Test
        @DisplayName("should return inline and overflowed events in log order")
        void loadAllEvents_shouldPreserveOrder() {
            eventLog.append(BrainStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                    .brainTitle("demo").brainDescription("d".repeat(500)).build()).block();
            eventLog.append(StepStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                    .stepId("step-1").stepTitle("A").build()).block();
            eventLog.append(BrainCompleteEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                    .brainTitle("demo").brainDescription("e".repeat(500)).build()).block();

            StepVerifier.create(loader.loadAllEvents(RUN_ID))
                    .expectNextMatches(event -> event.getEventType() == BrainEventType.START)
                    .expectNextMatches(event -> event.getEventType() == BrainEventType.STEP_START)
                    .expectNextMatches(event -> event.getEventType() == BrainEventType.COMPLETE)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should fetch overflowed bodies concurrently and keep log order")
        void loadAllEvents_shouldHydrateInParallel() {
            for (int i = 1; i <= 4; i++) {
                eventLog.append(StepStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                        .stepId("step-" + i).stepTitle("t".repeat(500)).build()).block();
            }
            SlowBlobStore slowBlobs = new SlowBlobStore(blobStore);
            EventLoader parallelLoader = new EventLoader(eventStore, slowBlobs, new BrainEventCodec(), 4);

            StepVerifier.create(parallelLoader.loadAllEvents(RUN_ID)
                            .map(event -> ((StepStartEvent) event).getStepId()))
                    .expectNext("step-1", "step-2", "step-3", "step-4")
                    .verifyComplete();

            assertThat(slowBlobs.calls.get()).isEqualTo(4);
            assertThat(slowBlobs.peakInFlight.get()).isGreaterThan(1);
        }

        @Test
        @DisplayName("should return nothing for an unknown run")
        void loadAllEvents_shouldBeEmptyForUnknownRun() {
            StepVerifier.create(loader.loadAllEvents("missing")).verifyComplete();
        }

        @Test
        @DisplayName("should fail when an overflowed body is missing")
        void loadAllEvents_shouldFailOnMissingBlob() {
            eventStore.insert(EventRecord.overflowed(RUN_ID, "brain:start", "events/run-1/1.json", Instant.EPOCH))
                    .block();

            StepVerifier.create(loader.loadAllEvents(RUN_ID))
                    .expectError(EventHydrationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail when a row has neither body nor blob key")
        void loadAllEvents_shouldFailOnEmptyRow() {
            eventStore.insert(new EventRecord(null, RUN_ID, "brain:start", null, null, Instant.EPOCH)).block();

            StepVerifier.create(loader.loadAllEvents(RUN_ID))
                    .expectError(EventHydrationException.class)
                    .verify();
        }

        @Test
        @DisplayName("should fail when a body cannot be decoded")
        void loadAllEvents_shouldFailOnCorruptBody() {
            eventStore.insert(EventRecord.inline(RUN_ID, "brain:start", "{not json", Instant.EPOCH)).block();

            StepVerifier.create(loader.loadAllEvents(RUN_ID))
                    .expectError(EventHydrationException.class)
                    .verify();
        }
    }

    /**
     * Delays every fetch, the first one longest, and records how many overlap.
     */
    private static final class SlowBlobStore implements BlobStore {

        private final BlobStore delegate;
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger peakInFlight = new AtomicInteger();

        private SlowBlobStore(BlobStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public Mono<Void> put(String key, String content, Map<String, String> metadata) {
            return delegate.put(key, content, metadata);
        }

        @Override
        public Mono<String> get(String key) {
            return Mono.defer(() -> {
                int call = calls.incrementAndGet();
                peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                return delegate.get(key)
                        .delayElement(Duration.ofMillis(250 - 50L * call))
                        .doFinally(signal -> inFlight.decrementAndGet());
            });
        }

        @Override
        public Mono<Void> delete(String key) {
            return delegate.delete(key);
        }
    }

    // ========================================================================
    // loadEventByType Tests
    // ========================================================================

    @Nested
    @DisplayName("loadEventByType")
    class LoadEventByTypeTests {

        @Test
        @DisplayName("should load the first and last event of a type")
        void loadEventByType_shouldHonourOrder() {
            eventLog.append(StepStartEvent.builder().brainRunId(RUN_ID).stepId("step-1").stepTitle("A").build()).block();
            eventLog.append(StepStartEvent.builder().brainRunId(RUN_ID).stepId("step-2").stepTitle("B").build()).block();

            StepVerifier.create(loader.loadEventByType(RUN_ID, BrainEventType.STEP_START, EventOrder.ASC))
                    .expectNextMatches(event -> ((StepStartEvent) event).getStepId().equals("step-1"))
                    .verifyComplete();
            StepVerifier.create(loader.loadEventByType(RUN_ID, BrainEventType.STEP_START, EventOrder.DESC))
                    .expectNextMatches(event -> ((StepStartEvent) event).getStepId().equals("step-2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should be empty when no event of the type exists")
        void loadEventByType_shouldBeEmptyWhenAbsent() {
            StepVerifier.create(loader.loadEventByType(RUN_ID, BrainEventType.COMPLETE, EventOrder.ASC))
                    .verifyComplete();
        }
    }
}

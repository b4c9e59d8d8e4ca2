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

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link InMemorySignalQueue}.
 */
class InMemorySignalQueueTest {

    private static final String RUN_ID = "run-1";

    private final InMemorySignalQueue queue = new InMemorySignalQueue();

    @Test
    @DisplayName("should consume matching signals in FIFO order and keep the rest")
    void getAndConsumeSignals_shouldFilterAndKeepOrder() {
        queue.queueSignal(RUN_ID, BrainSignal.pause(Instant.EPOCH)).block();
        queue.queueSignal(RUN_ID, BrainSignal.webhookResponse(JsonNodeFactory.instance.objectNode(), Instant.EPOCH)).block();
        queue.queueSignal(RUN_ID, BrainSignal.kill(Instant.EPOCH)).block();

        StepVerifier.create(queue.getAndConsumeSignals(RUN_ID, SignalFilter.CONTROL))
                .assertNext(signals -> assertThat(signals).extracting(BrainSignal::type)
                        .containsExactly(SignalType.PAUSE, SignalType.KILL))
                .verifyComplete();

        assertThat(queue.size(RUN_ID)).isEqualTo(1);

        StepVerifier.create(queue.getAndConsumeSignals(RUN_ID, SignalFilter.ALL))
                .assertNext(signals -> assertThat(signals).extracting(BrainSignal::type)
                        .containsExactly(SignalType.WEBHOOK_RESPONSE))
                .verifyComplete();
        assertThat(queue.size(RUN_ID)).isZero();
    }

    @Test
    @DisplayName("should return an empty list for a run without signals")
    void getAndConsumeSignals_shouldBeEmptyForUnknownRun() {
        StepVerifier.create(queue.getAndConsumeSignals("other", SignalFilter.ALL))
                .assertNext(signals -> assertThat(signals).isEmpty())
                .verifyComplete();
    }

    @Test
    @DisplayName("should drop all signals of a run on clear")
    void clear_shouldDropSignals() {
        queue.queueSignal(RUN_ID, BrainSignal.kill(Instant.EPOCH)).block();

        queue.clear(RUN_ID).block();

        assertThat(queue.size(RUN_ID)).isZero();
    }
}

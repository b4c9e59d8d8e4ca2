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

import org.fireflyframework.brain.event.BrainCompleteEvent;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.event.WebhookResponseEvent;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainStatus;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

/**
 * Unit tests for {@link MonitorAdapter}.
 */
class MonitorAdapterTest {

    private static final String RUN_ID = "run-1";

    private InMemoryBrainRunMonitor monitor;
    private MonitorAdapter adapter;
    private BrainExecutionState state;

    @BeforeEach
    void setUp() {
        monitor = new InMemoryBrainRunMonitor();
        adapter = new MonitorAdapter(monitor);
        state = new BrainExecutionState(BrainMachineDefinition.standard());
    }

    private void dispatch(BrainEvent event) {
        state.apply(event);
        adapter.dispatch(event, state).block();
    }

    @Test
    @DisplayName("should track status and waiting registrations through a webhook wait")
    void dispatch_shouldTrackWebhookWait() {
        dispatch(BrainStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH).brainTitle("demo").build());
        dispatch(WebhookEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                .waitFor(List.of(new WebhookRegistration("approval", "req-1", "tok"))).build());

        StepVerifier.create(monitor.getRun(RUN_ID))
                .expectNextMatches(summary -> summary.status() == BrainStatus.WAITING
                        && "demo".equals(summary.brainTitle()))
                .verifyComplete();
        StepVerifier.create(monitor.findWaitingRun("approval", "req-1"))
                .expectNext(new WaitingRun(RUN_ID, "approval", "req-1", "tok"))
                .verifyComplete();

        dispatch(WebhookResponseEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH)
                .response(JsonNodeFactory.instance.objectNode()).build());

        StepVerifier.create(monitor.findWaitingRun("approval", "req-1")).verifyComplete();
        StepVerifier.create(monitor.getRun(RUN_ID))
                .expectNextMatches(summary -> summary.status() == BrainStatus.RUNNING)
                .verifyComplete();
    }

    @Test
    @DisplayName("should clear registrations when the run finishes")
    void dispatch_shouldClearOnTerminalEvent() {
        dispatch(BrainStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH).brainTitle("demo").build());
        monitor.registerWaiting("approval", "req-1", RUN_ID, null).block();

        dispatch(BrainCompleteEvent.builder().brainRunId(RUN_ID).timestamp(Instant.EPOCH).brainTitle("demo").build());

        StepVerifier.create(monitor.findWaitingRun("approval", "req-1")).verifyComplete();
        StepVerifier.create(monitor.getRun(RUN_ID))
                .expectNextMatches(summary -> summary.status() == BrainStatus.COMPLETE
                        && "demo".equals(summary.brainTitle()))
                .verifyComplete();
    }
}

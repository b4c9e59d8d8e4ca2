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

package org.fireflyframework.brain.replay;

import org.fireflyframework.brain.event.BrainCancelledEvent;
import org.fireflyframework.brain.event.BrainCompleteEvent;
import org.fireflyframework.brain.event.BrainError;
import org.fireflyframework.brain.event.BrainErrorEvent;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainPausedEvent;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepCompleteEvent;
import org.fireflyframework.brain.event.StepStartEvent;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.event.WebhookResponseEvent;
import org.fireflyframework.brain.patch.JsonPatchOperation;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainStatus;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BrainExecutionState}.
 */
class BrainExecutionStateTest {

    private static final BrainMachineDefinition MACHINE = BrainMachineDefinition.standard();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final String RUN_ID = "run-1";

    private static BrainEvent start(String title) {
        return BrainStartEvent.builder().brainRunId(RUN_ID).timestamp(Instant.ofEpochSecond(1))
                .brainTitle(title).initialState(NODES.objectNode()).build();
    }

    private static BrainEvent complete(String title) {
        return BrainCompleteEvent.builder().brainRunId(RUN_ID).timestamp(Instant.ofEpochSecond(9))
                .brainTitle(title).build();
    }

    // ========================================================================
    // Top-level run Tests
    // ========================================================================

    @Nested
    @DisplayName("top-level run")
    class TopLevelRunTests {

        @Test
        @DisplayName("should track status, current step and state through a run")
        void replay_shouldTrackRun() {
            BrainExecutionState state = BrainExecutionState.replay(MACHINE, List.of(
                    start("demo"),
                    StepStartEvent.builder().brainRunId(RUN_ID).stepId("step-1").stepTitle("A").build(),
                    StepCompleteEvent.builder().brainRunId(RUN_ID).stepId("step-1").stepTitle("A")
                            .patch(List.of(JsonPatchOperation.add("/done", NODES.booleanNode(true)))).build(),
                    complete("demo")));

            assertThat(state.getStatus()).isEqualTo(BrainStatus.COMPLETE);
            assertThat(state.getCurrentStepId()).isEqualTo("step-1");
            assertThat(state.getCurrentState()).isEqualTo(NODES.objectNode().put("done", true));
            assertThat(state.getDepth()).isZero();
            assertThat(state.getStartedAt()).isEqualTo(Instant.ofEpochSecond(1));
            assertThat(state.getCompletedAt()).isEqualTo(Instant.ofEpochSecond(9));
            assertThat(state.getEventCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should record pending webhooks and clear them on response")
        void apply_shouldTrackPendingWebhooks() {
            BrainExecutionState state = new BrainExecutionState(MACHINE);
            state.apply(start("demo"));
            state.apply(WebhookEvent.builder().brainRunId(RUN_ID)
                    .waitFor(List.of(WebhookRegistration.of("approve", "id-1"))).timeout(5000L).build());

            assertThat(state.getStatus()).isEqualTo(BrainStatus.WAITING);
            assertThat(state.getPendingWebhooks()).containsExactly(WebhookRegistration.of("approve", "id-1"));
            assertThat(state.getPendingTimeout()).isEqualTo(5000L);

            state.apply(WebhookResponseEvent.builder().brainRunId(RUN_ID).response(NODES.objectNode()).build());

            assertThat(state.getStatus()).isEqualTo(BrainStatus.RUNNING);
            assertThat(state.getPendingWebhooks()).isEmpty();
            assertThat(state.getPendingTimeout()).isNull();
        }

        @Test
        @DisplayName("should keep the error of a failed or timed out run")
        void apply_shouldKeepTerminalError() {
            BrainExecutionState failed = BrainExecutionState.replay(MACHINE, List.of(
                    start("demo"),
                    BrainErrorEvent.builder().brainRunId(RUN_ID).brainTitle("demo")
                            .error(BrainError.of("IllegalStateException", "boom")).build()));
            BrainExecutionState cancelled = BrainExecutionState.replay(MACHINE, List.of(
                    start("demo"),
                    BrainPausedEvent.builder().brainRunId(RUN_ID).build(),
                    BrainCancelledEvent.builder().brainRunId(RUN_ID).brainTitle("demo").build()));

            assertThat(failed.getStatus()).isEqualTo(BrainStatus.ERROR);
            assertThat(failed.getError().message()).isEqualTo("boom");
            assertThat(cancelled.getStatus()).isEqualTo(BrainStatus.CANCELLED);
            assertThat(cancelled.getError()).isNull();
        }

        @Test
        @DisplayName("should ignore events without a transition from the current status")
        void apply_shouldIgnoreInadmissibleEvents() {
            BrainExecutionState state = new BrainExecutionState(MACHINE);
            state.apply(start("demo"));
            state.apply(complete("demo"));

            boolean applied = state.apply(StepStartEvent.builder().brainRunId(RUN_ID).stepId("step-9").build());

            assertThat(applied).isFalse();
            assertThat(state.getStatus()).isEqualTo(BrainStatus.COMPLETE);
            assertThat(state.getEventCount()).isEqualTo(2);
        }
    }

    // ========================================================================
    // Nested brain Tests
    // ========================================================================

    @Nested
    @DisplayName("nested brains")
    class NestedBrainTests {

        @Test
        @DisplayName("should push and pop frames and stay running until the outer brain completes")
        void apply_shouldTrackBrainStack() {
            BrainExecutionState state = new BrainExecutionState(MACHINE);
            state.apply(start("outer"));
            state.apply(start("inner"));

            assertThat(state.getDepth()).isEqualTo(2);
            assertThat(state.getBrainStack()).extracting(BrainFrame::title).containsExactly("outer", "inner");

            state.apply(complete("inner"));
            assertThat(state.getStatus()).isEqualTo(BrainStatus.RUNNING);
            assertThat(state.getRootBrain()).map(BrainFrame::title).contains("outer");

            state.apply(complete("outer"));
            assertThat(state.getStatus()).isEqualTo(BrainStatus.COMPLETE);
            assertThat(state.getBrainStack()).isEmpty();
            assertThat(state.getBrainTitle()).isEqualTo("outer");
        }

        @Test
        @DisplayName("should keep running when a nested brain fails")
        void apply_shouldAbsorbNestedError() {
            BrainExecutionState state = new BrainExecutionState(MACHINE);
            state.apply(start("outer"));
            state.apply(start("inner"));
            state.apply(BrainErrorEvent.builder().brainRunId(RUN_ID).brainTitle("inner")
                    .error(BrainError.of("Error", "inner failed")).build());

            assertThat(state.getStatus()).isEqualTo(BrainStatus.RUNNING);
            assertThat(state.getError()).isNull();
        }
    }
}

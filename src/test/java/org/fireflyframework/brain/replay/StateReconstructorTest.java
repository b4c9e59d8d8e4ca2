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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainRestartEvent;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepCompleteEvent;
import org.fireflyframework.brain.event.StepStartEvent;
import org.fireflyframework.brain.patch.JsonPatchException;
import org.fireflyframework.brain.patch.JsonPatchOperation;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link StateReconstructor}.
 */
class StateReconstructorTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private static BrainEvent start(ObjectNode initialState) {
        return BrainStartEvent.builder().brainRunId("run-1").brainTitle("demo").initialState(initialState).build();
    }

    private static BrainEvent stepComplete(String stepId, List<JsonPatchOperation> patch) {
        return StepCompleteEvent.builder().brainRunId("run-1").stepId(stepId).stepTitle(stepId).patch(patch).build();
    }

    @Test
    @DisplayName("should apply every step patch to the initial state")
    void reconstructCurrentState_shouldApplyPatches() {
        List<BrainEvent> events = List.of(
                start(NODES.objectNode()),
                stepComplete("step-1", List.of(JsonPatchOperation.add("/count", NODES.numberNode(1)))),
                stepComplete("step-2", List.of(JsonPatchOperation.replace("/count", NODES.numberNode(2)))));

        assertThat(StateReconstructor.reconstructCurrentState(events))
                .isEqualTo(NODES.objectNode().put("count", 2));
    }

    @Test
    @DisplayName("should stop at the target index and clamp out-of-range indexes")
    void reconstructStateAtEvent_shouldHonourTargetIndex() {
        List<BrainEvent> events = List.of(
                start(NODES.objectNode().put("name", "x")),
                stepComplete("step-1", List.of(JsonPatchOperation.add("/count", NODES.numberNode(1)))),
                stepComplete("step-2", List.of(JsonPatchOperation.replace("/count", NODES.numberNode(2)))));

        assertThat(StateReconstructor.reconstructStateAtEvent(events, 0))
                .isEqualTo(NODES.objectNode().put("name", "x"));
        assertThat(StateReconstructor.reconstructStateAtEvent(events, 1))
                .isEqualTo(NODES.objectNode().put("name", "x").put("count", 1));
        assertThat(StateReconstructor.reconstructStateAtEvent(events, 99))
                .isEqualTo(NODES.objectNode().put("name", "x").put("count", 2));
        assertThat(StateReconstructor.reconstructStateAtEvent(events, -5))
                .isEqualTo(NODES.objectNode().put("name", "x"));
    }

    @Test
    @DisplayName("should start from the latest restart preceding the target")
    void reconstructStateAtEvent_shouldUseLatestRestart() {
        List<BrainEvent> events = List.of(
                start(NODES.objectNode()),
                stepComplete("step-1", List.of(JsonPatchOperation.add("/a", NODES.numberNode(1)))),
                BrainRestartEvent.builder().brainRunId("run-1").brainTitle("demo")
                        .initialState(NODES.objectNode().put("a", 1)).build(),
                stepComplete("step-2", List.of(JsonPatchOperation.add("/b", NODES.numberNode(2)))));

        assertThat(StateReconstructor.reconstructCurrentState(events))
                .isEqualTo(NODES.objectNode().put("a", 1).put("b", 2));
    }

    @Test
    @DisplayName("should ignore non-step events and empty patches")
    void reconstructCurrentState_shouldIgnoreOtherEvents() {
        List<BrainEvent> events = List.of(
                start(null),
                StepStartEvent.builder().brainRunId("run-1").stepId("step-1").stepTitle("A").build(),
                stepComplete("step-1", List.of()));

        assertThat(StateReconstructor.reconstructCurrentState(events)).isEqualTo(NODES.objectNode());
    }

    @Test
    @DisplayName("should return an empty object for an empty log")
    void reconstructCurrentState_shouldBeEmptyForEmptyLog() {
        assertThat(StateReconstructor.reconstructCurrentState(List.of())).isEqualTo(NODES.objectNode());
    }

    @Test
    @DisplayName("should fail when a recorded patch cannot be applied")
    void reconstructCurrentState_shouldFailOnBadPatch() {
        List<BrainEvent> events = List.of(
                start(NODES.objectNode()),
                stepComplete("step-1", List.of(JsonPatchOperation.remove("/missing"))));

        assertThatThrownBy(() -> StateReconstructor.reconstructCurrentState(events))
                .isInstanceOf(JsonPatchException.class);
    }
}

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
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepCompleteEvent;
import org.fireflyframework.brain.patch.JsonPatchException;
import org.fireflyframework.brain.patch.JsonPatches;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Derives a run's state from its event log.
 * <p>
 * The state at an event is the {@code initialState} of the nearest preceding
 * {@code START}/{@code RESTART} with every later {@code STEP_COMPLETE} patch applied in
 * log order. The result depends on nothing but the log prefix.
 */
public final class StateReconstructor {

    private StateReconstructor() {
    }

    /**
     * State after the event at {@code targetIndex}, which is clamped into the log's bounds.
     *
     * @throws JsonPatchException if a recorded patch cannot be applied
     */
    public static ObjectNode reconstructStateAtEvent(List<? extends BrainEvent> events, int targetIndex) {
        if (events.isEmpty()) {
            return JsonNodeFactory.instance.objectNode();
        }
        int target = Math.max(0, Math.min(targetIndex, events.size() - 1));

        int startIndex = -1;
        for (int i = target; i >= 0; i--) {
            if (events.get(i) instanceof BrainStartEvent) {
                startIndex = i;
                break;
            }
        }
        if (startIndex < 0) {
            return JsonNodeFactory.instance.objectNode();
        }

        JsonNode initialState = ((BrainStartEvent) events.get(startIndex)).getInitialState();
        JsonNode state = initialState != null && !initialState.isNull()
                ? initialState.deepCopy()
                : JsonNodeFactory.instance.objectNode();

        for (int i = startIndex + 1; i <= target; i++) {
            if (events.get(i) instanceof StepCompleteEvent step
                    && step.getPatch() != null && !step.getPatch().isEmpty()) {
                state = JsonPatches.apply(state, step.getPatch());
            }
        }

        if (!(state instanceof ObjectNode objectState)) {
            throw new JsonPatchException("Reconstructed state is not a JSON object: " + state.getNodeType());
        }
        return objectState;
    }

    /**
     * State after the last event of the log.
     */
    public static ObjectNode reconstructCurrentState(List<? extends BrainEvent> events) {
        return reconstructStateAtEvent(events, events.size() - 1);
    }
}

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

import org.fireflyframework.brain.event.BrainEventType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The run lifecycle as a pure table: for every status, the events it admits and
 * the status each one leads to.
 * <p>
 * A {@code COMPLETE} or {@code ERROR} of a nested brain keeps the run {@code RUNNING};
 * the table lists the outcome for the outermost brain.
 */
public final class BrainMachineDefinition {

    private static final BrainEventType[] STEP_AND_AGENT_EVENTS = {
            BrainEventType.STEP_START,
            BrainEventType.STEP_COMPLETE,
            BrainEventType.STEP_STATUS,
            BrainEventType.STEP_RETRY,
            BrainEventType.AGENT_START,
            BrainEventType.AGENT_ITERATION,
            BrainEventType.AGENT_TOOL_CALL,
            BrainEventType.AGENT_TOOL_RESULT,
            BrainEventType.AGENT_ASSISTANT_MESSAGE,
            BrainEventType.AGENT_WEBHOOK,
            BrainEventType.AGENT_COMPLETE,
            BrainEventType.AGENT_TOKEN_LIMIT
    };

    private static final BrainMachineDefinition STANDARD = createStandard();

    private final Map<BrainStatus, Map<BrainEventType, BrainStatus>> transitions;

    private BrainMachineDefinition(Map<BrainStatus, Map<BrainEventType, BrainStatus>> transitions) {
        this.transitions = transitions;
    }

    /**
     * The lifecycle every run follows.
     */
    public static BrainMachineDefinition standard() {
        return STANDARD;
    }

    public boolean hasTransition(BrainStatus from, BrainEventType event) {
        return transitions.get(from).containsKey(event);
    }

    public Optional<BrainStatus> target(BrainStatus from, BrainEventType event) {
        return Optional.ofNullable(transitions.get(from).get(event));
    }

    public Set<BrainEventType> admissibleEvents(BrainStatus from) {
        return Collections.unmodifiableSet(transitions.get(from).keySet());
    }

    private static BrainMachineDefinition createStandard() {
        Map<BrainStatus, Map<BrainEventType, BrainStatus>> table = new EnumMap<>(BrainStatus.class);
        for (BrainStatus status : BrainStatus.values()) {
            table.put(status, new EnumMap<>(BrainEventType.class));
        }

        Map<BrainEventType, BrainStatus> idle = table.get(BrainStatus.PENDING);
        idle.put(BrainEventType.START, BrainStatus.RUNNING);
        idle.put(BrainEventType.RESTART, BrainStatus.RUNNING);

        Map<BrainEventType, BrainStatus> running = table.get(BrainStatus.RUNNING);
        running.put(BrainEventType.START, BrainStatus.RUNNING);
        running.put(BrainEventType.RESTART, BrainStatus.RUNNING);
        running.put(BrainEventType.COMPLETE, BrainStatus.COMPLETE);
        running.put(BrainEventType.ERROR, BrainStatus.ERROR);
        running.put(BrainEventType.CANCELLED, BrainStatus.CANCELLED);
        running.put(BrainEventType.PAUSED, BrainStatus.PAUSED);
        running.put(BrainEventType.WEBHOOK, BrainStatus.WAITING);
        for (BrainEventType event : STEP_AND_AGENT_EVENTS) {
            running.put(event, BrainStatus.RUNNING);
        }

        Map<BrainEventType, BrainStatus> paused = table.get(BrainStatus.PAUSED);
        paused.put(BrainEventType.RESUMED, BrainStatus.RUNNING);
        paused.put(BrainEventType.CANCELLED, BrainStatus.CANCELLED);

        Map<BrainEventType, BrainStatus> waiting = table.get(BrainStatus.WAITING);
        waiting.put(BrainEventType.WEBHOOK_RESPONSE, BrainStatus.RUNNING);
        waiting.put(BrainEventType.CANCELLED, BrainStatus.CANCELLED);

        // final step statuses are still reported after a failure
        table.get(BrainStatus.ERROR).put(BrainEventType.STEP_STATUS, BrainStatus.ERROR);

        return new BrainMachineDefinition(table);
    }
}

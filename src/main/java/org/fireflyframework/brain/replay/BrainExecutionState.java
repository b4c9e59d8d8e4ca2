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
import org.fireflyframework.brain.event.BrainError;
import org.fireflyframework.brain.event.BrainErrorEvent;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepCompleteEvent;
import org.fireflyframework.brain.event.StepEvent;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.patch.JsonPatches;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Execution state of a run obtained by feeding its events through the machine.
 * <p>
 * Tracks status, nesting depth and the stack of brains, the top-level state, the
 * terminal error and the webhooks the run waits for. An event the machine has no
 * transition for in the current status is ignored.
 */
@Getter
public class BrainExecutionState {

    private final BrainMachineDefinition definition;

    private BrainStatus status = BrainStatus.PENDING;
    private int depth;
    private final List<BrainFrame> brainStack = new ArrayList<>();
    private String brainTitle;
    private JsonNode currentState = JsonNodeFactory.instance.objectNode();
    private String currentStepId;
    private BrainError error;
    private List<WebhookRegistration> pendingWebhooks = List.of();
    private Long pendingTimeout;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant lastEventAt;
    private int eventCount;

    public BrainExecutionState(BrainMachineDefinition definition) {
        this.definition = definition;
    }

    /**
     * Replays a whole log.
     */
    public static BrainExecutionState replay(BrainMachineDefinition definition, List<? extends BrainEvent> events) {
        BrainExecutionState state = new BrainExecutionState(definition);
        events.forEach(state::apply);
        return state;
    }

    /**
     * Feeds one event through the machine.
     *
     * @return whether the event caused a transition
     */
    public boolean apply(BrainEvent event) {
        Optional<BrainStatus> next = definition.target(status, event.getEventType());
        if (next.isEmpty()) {
            return false;
        }
        BrainStatus target = next.get();
        eventCount++;
        lastEventAt = event.getTimestamp();
        if (createdAt == null) {
            createdAt = event.getTimestamp();
        }

        switch (event.getEventType()) {
            case START -> start((BrainStartEvent) event);
            case RESTART -> restart((BrainStartEvent) event);
            case COMPLETE -> target = completeFrame(target);
            case ERROR -> {
                if (depth > 1) {
                    target = BrainStatus.RUNNING;
                } else {
                    error = ((BrainErrorEvent) event).getError();
                }
            }
            case CANCELLED -> error = ((BrainCancelledEvent) event).getError();
            case STEP_START -> currentStepId = ((StepEvent) event).getStepId();
            case STEP_COMPLETE -> completeStep((StepCompleteEvent) event);
            case WEBHOOK -> {
                WebhookEvent webhook = (WebhookEvent) event;
                pendingWebhooks = webhook.getWaitFor() != null ? List.copyOf(webhook.getWaitFor()) : List.of();
                pendingTimeout = webhook.getTimeout();
            }
            case WEBHOOK_RESPONSE -> clearPendingWebhooks();
            case PAUSED, RESUMED, STEP_RETRY, STEP_STATUS,
                    AGENT_START, AGENT_ITERATION, AGENT_TOOL_CALL, AGENT_TOOL_RESULT,
                    AGENT_ASSISTANT_MESSAGE, AGENT_WEBHOOK, AGENT_COMPLETE, AGENT_TOKEN_LIMIT -> {
                // status change only
            }
        }

        status = target;
        if (status.isTerminal()) {
            completedAt = event.getTimestamp();
            clearPendingWebhooks();
        }
        return true;
    }

    public List<BrainFrame> getBrainStack() {
        return Collections.unmodifiableList(brainStack);
    }

    /**
     * The outermost brain, if the run has started.
     */
    public Optional<BrainFrame> getRootBrain() {
        return brainStack.isEmpty() ? Optional.empty() : Optional.of(brainStack.get(0));
    }

    public ObjectNode getCurrentStateAsObject() {
        return currentState instanceof ObjectNode object ? object.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    // ==================== Transitions ====================

    private void start(BrainStartEvent event) {
        brainStack.add(frameOf(event));
        depth++;
        if (depth == 1) {
            brainTitle = event.getBrainTitle();
            startedAt = event.getTimestamp();
            currentState = initialStateOf(event);
        }
    }

    private void restart(BrainStartEvent event) {
        BrainFrame frame = frameOf(event);
        if (brainStack.isEmpty()) {
            brainStack.add(frame);
            depth = 1;
            startedAt = startedAt != null ? startedAt : event.getTimestamp();
        } else if (brainStack.get(brainStack.size() - 1).title().equals(frame.title())) {
            // resuming the brain on top of the stack replaces its frame
            brainStack.set(brainStack.size() - 1, frame);
        } else {
            brainStack.add(frame);
            depth++;
        }
        if (depth == 1) {
            brainTitle = event.getBrainTitle();
            currentState = initialStateOf(event);
        }
    }

    private BrainStatus completeFrame(BrainStatus target) {
        if (!brainStack.isEmpty()) {
            brainStack.remove(brainStack.size() - 1);
        }
        depth = Math.max(0, depth - 1);
        return depth > 0 ? BrainStatus.RUNNING : target;
    }

    private void completeStep(StepCompleteEvent event) {
        if (depth == 1 && event.getPatch() != null && !event.getPatch().isEmpty()) {
            currentState = JsonPatches.apply(currentState, event.getPatch());
        }
    }

    private void clearPendingWebhooks() {
        pendingWebhooks = List.of();
        pendingTimeout = null;
    }

    private static BrainFrame frameOf(BrainStartEvent event) {
        return new BrainFrame(event.getBrainTitle(), event.getBrainDescription());
    }

    private static JsonNode initialStateOf(BrainStartEvent event) {
        JsonNode initial = event.getInitialState();
        return initial != null && !initial.isNull() ? initial.deepCopy() : JsonNodeFactory.instance.objectNode();
    }
}

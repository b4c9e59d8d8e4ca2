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

import org.fireflyframework.brain.event.AgentAssistantMessageEvent;
import org.fireflyframework.brain.event.AgentIterationEvent;
import org.fireflyframework.brain.event.AgentStartEvent;
import org.fireflyframework.brain.event.AgentToolResultEvent;
import org.fireflyframework.brain.event.AgentWebhookEvent;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.exception.InvalidEventSequenceException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds the conversation of an agent loop suspended on a webhook.
 */
public final class AgentContextReconstructor {

    private AgentContextReconstructor() {
    }

    /**
     * Rebuilds the agent context for a webhook response.
     * <p>
     * Uses the last {@code AGENT_WEBHOOK} of the log and the {@code AGENT_START} preceding it.
     * The conversation is the user prompt, then every assistant turn and tool result recorded
     * between the two in log order, then the webhook response as the result of the exact
     * tool call the loop suspended on.
     *
     * @return the context, or {@code null} when the log has no pending agent webhook and the
     *         response belongs to an ordinary wait
     * @throws InvalidEventSequenceException if an {@code AGENT_WEBHOOK} has no preceding {@code AGENT_START}
     */
    public static AgentResumeContext reconstructAgentContext(List<? extends BrainEvent> events,
                                                             JsonNode webhookResponse) {
        int webhookIndex = -1;
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i) instanceof AgentWebhookEvent) {
                webhookIndex = i;
                break;
            }
        }
        if (webhookIndex < 0) {
            return null;
        }
        AgentWebhookEvent pending = (AgentWebhookEvent) events.get(webhookIndex);

        // an answered call means the loop already resumed past this webhook
        for (int i = webhookIndex + 1; i < events.size(); i++) {
            if (events.get(i) instanceof AgentToolResultEvent result
                    && Objects.equals(pending.getToolCallId(), result.getToolCallId())) {
                return null;
            }
        }

        int startIndex = -1;
        for (int i = webhookIndex - 1; i >= 0; i--) {
            if (events.get(i) instanceof AgentStartEvent) {
                startIndex = i;
                break;
            }
        }
        if (startIndex < 0) {
            throw new InvalidEventSequenceException(
                    "AGENT_START event not found but AGENT_WEBHOOK exists for tool call '"
                            + pending.getToolCallId() + "' in run " + pending.getBrainRunId());
        }
        AgentStartEvent start = (AgentStartEvent) events.get(startIndex);

        List<AgentMessage> messages = new ArrayList<>();
        messages.add(AgentMessage.user(start.getPrompt()));
        int iterations = 0;

        for (int i = startIndex + 1; i < webhookIndex; i++) {
            BrainEvent event = events.get(i);
            switch (event.getEventType()) {
                case AGENT_ASSISTANT_MESSAGE -> {
                    AgentAssistantMessageEvent assistant = (AgentAssistantMessageEvent) event;
                    messages.add(AgentMessage.assistant(assistant.getContent(), assistant.getToolCalls(),
                            assistant.getProviderMetadata()));
                }
                case AGENT_TOOL_RESULT -> {
                    AgentToolResultEvent result = (AgentToolResultEvent) event;
                    messages.add(AgentMessage.toolResult(result.getToolCallId(), result.getToolName(),
                            result.getResult()));
                }
                case AGENT_ITERATION -> iterations = Math.max(iterations, ((AgentIterationEvent) event).getIteration());
                default -> {
                    // not part of the conversation
                }
            }
        }

        messages.add(AgentMessage.toolResult(pending.getToolCallId(), pending.getToolName(), webhookResponse));

        return new AgentResumeContext(
                start.getStepId(),
                start.getStepTitle(),
                start.getPrompt(),
                start.getSystem(),
                List.copyOf(messages),
                pending.getToolCallId(),
                pending.getToolName(),
                webhookResponse,
                iterations);
    }
}

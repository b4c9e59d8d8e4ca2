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

import org.fireflyframework.brain.event.ToolCall;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One turn of an agent conversation.
 * <p>
 * Assistant turns keep the provider's native metadata (for example reasoning signatures)
 * so a resumed conversation can be sent back to the provider exactly as it was received.
 *
 * @param role             who produced the turn
 * @param content          text of the turn; for tool results the JSON text of the result
 * @param toolCalls        tool calls requested by an assistant turn
 * @param toolCallId       the call a tool result answers
 * @param toolName         the tool a tool result comes from
 * @param result           the structured tool result
 * @param providerMetadata provider-native data of an assistant turn
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentMessage(
        Role role,
        String content,
        List<ToolCall> toolCalls,
        String toolCallId,
        String toolName,
        JsonNode result,
        JsonNode providerMetadata
) {

    public enum Role {
        USER,
        ASSISTANT,
        TOOL
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(Role.USER, content, null, null, null, null, null);
    }

    public static AgentMessage assistant(String content, List<ToolCall> toolCalls, JsonNode providerMetadata) {
        return new AgentMessage(Role.ASSISTANT, content, toolCalls, null, null, null, providerMetadata);
    }

    public static AgentMessage toolResult(String toolCallId, String toolName, JsonNode result) {
        return new AgentMessage(Role.TOOL, result != null ? result.toString() : "null", null,
                toolCallId, toolName, result, null);
    }
}

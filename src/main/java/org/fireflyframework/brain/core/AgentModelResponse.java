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

package org.fireflyframework.brain.core;

import org.fireflyframework.brain.event.ToolCall;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One assistant turn.
 *
 * @param providerMetadata opaque data the provider needs back on the next call
 * @param tokensUsed       tokens consumed by the call
 */
public record AgentModelResponse(String content, List<ToolCall> toolCalls, JsonNode providerMetadata, long tokensUsed) {

    public AgentModelResponse {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }
}

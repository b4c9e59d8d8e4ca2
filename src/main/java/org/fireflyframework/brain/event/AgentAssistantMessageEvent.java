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

package org.fireflyframework.brain.event;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * An assistant turn returned by the model.
 */
@JsonTypeName("agent:assistant_message")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AgentAssistantMessageEvent extends StepEvent {

    private String content;

    private List<ToolCall> toolCalls;

    /**
     * Provider-native data of the turn, such as reasoning signatures, replayed verbatim on resume.
     */
    private JsonNode providerMetadata;

    @Override
    public BrainEventType getEventType() {
        return BrainEventType.AGENT_ASSISTANT_MESSAGE;
    }
}

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

/**
 * The model invoked the terminal tool.
 */
@JsonTypeName("agent:complete")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AgentCompleteEvent extends StepEvent {

    private String terminalToolName;

    private JsonNode result;

    private int totalIterations;

    @Override
    public BrainEventType getEventType() {
        return BrainEventType.AGENT_COMPLETE;
    }
}

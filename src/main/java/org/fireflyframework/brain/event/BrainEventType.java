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

import java.util.Arrays;
import java.util.Optional;

/**
 * Every kind of event that can appear in a run's log, with its wire name.
 */
public enum BrainEventType {

    START("brain:start"),
    RESTART("brain:restart"),
    STEP_START("step:start"),
    STEP_COMPLETE("step:complete"),
    STEP_RETRY("step:retry"),
    STEP_STATUS("step:status"),
    ERROR("brain:error"),
    COMPLETE("brain:complete"),
    CANCELLED("brain:cancelled"),
    PAUSED("brain:paused"),
    RESUMED("brain:resumed"),
    WEBHOOK("brain:webhook"),
    WEBHOOK_RESPONSE("brain:webhook_response"),
    AGENT_START("agent:start"),
    AGENT_ITERATION("agent:iteration"),
    AGENT_TOOL_CALL("agent:tool_call"),
    AGENT_TOOL_RESULT("agent:tool_result"),
    AGENT_ASSISTANT_MESSAGE("agent:assistant_message"),
    AGENT_WEBHOOK("agent:webhook"),
    AGENT_COMPLETE("agent:complete"),
    AGENT_TOKEN_LIMIT("agent:token_limit");

    private final String wireName;

    BrainEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether events of this type end a run.
     */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }

    public static Optional<BrainEventType> fromWireName(String wireName) {
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(wireName))
                .findFirst();
    }
}

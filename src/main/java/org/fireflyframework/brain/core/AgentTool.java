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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A tool the model may call.
 *
 * @param inputSchema JSON schema of the tool input, handed to the model
 * @param terminal    whether calling the tool ends the loop; its input is then the result
 * @param executor    runs a non-terminal tool
 */
public record AgentTool(
        String name,
        String description,
        JsonNode inputSchema,
        boolean terminal,
        AgentToolExecutor executor
) {

    public AgentTool {
        Objects.requireNonNull(name, "name cannot be null");
        if (!terminal && executor == null) {
            throw new IllegalArgumentException("Tool '" + name + "' needs an executor");
        }
    }

    public static AgentTool of(String name, String description, JsonNode inputSchema, AgentToolExecutor executor) {
        return new AgentTool(name, description, inputSchema, false, executor);
    }

    public static AgentTool terminal(String name, String description, JsonNode inputSchema) {
        return new AgentTool(name, description, inputSchema, true, null);
    }
}

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

import org.fireflyframework.brain.resilience.RetryOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Singular;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Configuration of an agent loop.
 * <p>
 * When no tool is marked terminal a {@value #DEFAULT_TERMINAL_TOOL} tool is added, whose
 * input becomes the agent's result.
 *
 * @param prompt        builds the user prompt from the current state
 * @param system        system prompt, may be {@code null}
 * @param tools         tools offered to the model
 * @param resultKey     state key the result is written under; {@code null} merges an object
 *                      result into the root of the state
 * @param maxIterations model calls allowed before the loop gives up, {@code null} for the engine default
 * @param maxTokens     token budget of the loop, {@code null} for no limit
 * @param retry         retry options for model calls, {@code null} for the engine defaults
 */
@Builder
public record AgentConfig(
        Function<JsonNode, String> prompt,
        String system,
        @Singular List<AgentTool> tools,
        String resultKey,
        Integer maxIterations,
        Long maxTokens,
        RetryOptions retry
) {

    public static final String DEFAULT_TERMINAL_TOOL = "done";

    public AgentConfig {
        Objects.requireNonNull(prompt, "prompt cannot be null");
        List<AgentTool> all = new ArrayList<>(tools == null ? List.of() : tools);
        if (all.stream().noneMatch(AgentTool::terminal)) {
            all.add(AgentTool.terminal(DEFAULT_TERMINAL_TOOL,
                    "Call when the task is finished, passing the final result as input", objectSchema()));
        }
        tools = List.copyOf(all);
        if (maxIterations != null && maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
    }

    public Optional<AgentTool> findTool(String name) {
        return tools.stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    private static ObjectNode objectSchema() {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        return schema;
    }
}

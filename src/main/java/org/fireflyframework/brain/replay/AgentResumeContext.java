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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Everything an agent loop needs to continue after the webhook it was waiting on arrived.
 *
 * @param stepId            the agent step being resumed
 * @param stepTitle         its title
 * @param prompt            the original user prompt
 * @param system            the system prompt, may be {@code null}
 * @param messages          the conversation, ending with the tool result for the pending call
 * @param pendingToolCallId the tool call answered by the webhook
 * @param pendingToolName   the tool of that call
 * @param webhookResponse   the raw webhook response
 * @param iterations        model calls already made before the suspension
 */
public record AgentResumeContext(
        String stepId,
        String stepTitle,
        String prompt,
        String system,
        List<AgentMessage> messages,
        String pendingToolCallId,
        String pendingToolName,
        JsonNode webhookResponse,
        int iterations
) {
}

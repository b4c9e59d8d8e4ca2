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

import org.fireflyframework.brain.page.PageService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * What a step sees when it runs.
 *
 * @param state           a private copy of the current state; a step may change it in place
 * @param webhookResponse the response that resumed the run, for the first step after a wait
 * @param pages           page publishing for the run, or {@code null} when not configured
 */
public record StepContext(
        String brainRunId,
        String stepId,
        String stepTitle,
        ObjectNode state,
        JsonNode webhookResponse,
        PageService pages
) {
}

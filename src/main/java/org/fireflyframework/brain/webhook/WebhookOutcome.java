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

package org.fireflyframework.brain.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body returned to webhook callers. The run id goes on the wire as {@code runId}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookOutcome(
        boolean received,
        WebhookAction action,
        String identifier,
        @JsonProperty("runId") String brainRunId,
        String reason,
        String message
) {

    public static WebhookOutcome resumed(String identifier, String brainRunId) {
        return new WebhookOutcome(true, WebhookAction.RESUMED, identifier, brainRunId, null, null);
    }

    public static WebhookOutcome notFound(String identifier) {
        return new WebhookOutcome(true, WebhookAction.NOT_FOUND, identifier, null, null,
                "No brain is waiting for this webhook");
    }

    public static WebhookOutcome ignored(String identifier, String brainRunId, String reason) {
        return new WebhookOutcome(true, WebhookAction.IGNORED, identifier, brainRunId, reason, null);
    }

    /**
     * Reports a delivery no run waits for as queued.
     */
    public WebhookOutcome asQueued() {
        return new WebhookOutcome(true, WebhookAction.QUEUED, identifier, null, null,
                "Webhook received, no brain is waiting yet");
    }
}

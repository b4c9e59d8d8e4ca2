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

import org.fireflyframework.brain.event.WebhookRegistration;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;

/**
 * What a tool call produced: a result for the model, or webhooks to wait for.
 * The response of the webhook becomes the result of the call when the run resumes.
 */
public record ToolOutcome(JsonNode result, List<WebhookRegistration> waitFor, Duration timeout) {

    public ToolOutcome {
        waitFor = waitFor == null ? List.of() : List.copyOf(waitFor);
    }

    public static ToolOutcome result(JsonNode result) {
        return new ToolOutcome(result, List.of(), null);
    }

    public static ToolOutcome waitFor(Duration timeout, WebhookRegistration... webhooks) {
        return new ToolOutcome(null, List.of(webhooks), timeout);
    }

    public boolean isWaiting() {
        return !waitFor.isEmpty();
    }
}

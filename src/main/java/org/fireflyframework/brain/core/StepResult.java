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
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a step: the new state and, optionally, the webhooks to wait for next.
 *
 * @param state   the state after the step
 * @param waitFor webhooks that must answer before the brain goes on; empty to go on at once
 * @param timeout how long to wait before the run is cancelled, or {@code null} for no limit
 */
public record StepResult(ObjectNode state, List<WebhookRegistration> waitFor, Duration timeout) {

    public StepResult {
        waitFor = waitFor == null ? List.of() : List.copyOf(waitFor);
    }

    public static StepResult of(ObjectNode state) {
        return new StepResult(state, List.of(), null);
    }

    public static StepResult waitFor(ObjectNode state, Duration timeout, WebhookRegistration... webhooks) {
        return new StepResult(state, List.of(webhooks), timeout);
    }

    public boolean isWaiting() {
        return !waitFor.isEmpty();
    }
}

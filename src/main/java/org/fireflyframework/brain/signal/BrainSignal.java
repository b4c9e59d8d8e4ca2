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

package org.fireflyframework.brain.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * An instruction injected into a run from outside. Delivered at most once.
 *
 * @param type     the signal type
 * @param reason   why a kill was requested, e.g. {@link #REASON_TIMEOUT}
 * @param response the payload of a webhook response
 * @param queuedAt when the signal was queued
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainSignal(SignalType type, String reason, JsonNode response, Instant queuedAt) {

    public static final String REASON_TIMEOUT = "timeout";

    public static BrainSignal kill(Instant queuedAt) {
        return new BrainSignal(SignalType.KILL, null, null, queuedAt);
    }

    public static BrainSignal kill(String reason, Instant queuedAt) {
        return new BrainSignal(SignalType.KILL, reason, null, queuedAt);
    }

    public static BrainSignal pause(Instant queuedAt) {
        return new BrainSignal(SignalType.PAUSE, null, null, queuedAt);
    }

    public static BrainSignal resume(Instant queuedAt) {
        return new BrainSignal(SignalType.RESUME, null, null, queuedAt);
    }

    public static BrainSignal webhookResponse(JsonNode response, Instant queuedAt) {
        return new BrainSignal(SignalType.WEBHOOK_RESPONSE, null, response, queuedAt);
    }

    @JsonIgnore
    public SignalKind getKind() {
        return type.getKind();
    }
}

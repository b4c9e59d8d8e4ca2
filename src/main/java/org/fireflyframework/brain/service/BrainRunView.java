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

package org.fireflyframework.brain.service;

import org.fireflyframework.brain.event.BrainError;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.replay.BrainFrame;
import org.fireflyframework.brain.signal.BrainStatus;
import org.fireflyframework.brain.signal.SignalType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * A run as derived from its event log.
 *
 * @param pendingWebhooks the webhooks the run waits for, without their CSRF tokens
 * @param validSignals    the signals the run accepts in its current status
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainRunView(
        String brainRunId,
        String brainTitle,
        BrainStatus status,
        JsonNode state,
        List<BrainFrame> brainStack,
        String currentStepId,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        BrainError error,
        List<WebhookRegistration> pendingWebhooks,
        List<SignalType> validSignals,
        int eventCount
) {
}

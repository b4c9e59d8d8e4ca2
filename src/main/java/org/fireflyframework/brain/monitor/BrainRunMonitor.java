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

package org.fireflyframework.brain.monitor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Shared registry of run statuses and of runs waiting for webhooks.
 * <p>
 * At most one registration exists per {@code (slug, identifier)}: a later wait supersedes
 * an earlier one.
 */
public interface BrainRunMonitor {

    /**
     * @return the waiting run, or empty when nobody waits for the webhook
     */
    Mono<WaitingRun> findWaitingRun(String slug, String identifier);

    Mono<Void> registerWaiting(String slug, String identifier, String brainRunId, String token);

    /**
     * Atomically removes the registration if it is still {@code expected}, together with
     * every other registration of the same run.
     *
     * @return {@code true} for the single caller that won the claim
     */
    Mono<Boolean> claimWaiting(WaitingRun expected);

    /**
     * Removes every registration of a run.
     */
    Mono<Void> clearWaiting(String brainRunId);

    Mono<Void> updateRun(BrainRunSummary summary);

    Mono<BrainRunSummary> getRun(String brainRunId);

    Flux<BrainRunSummary> listRuns();
}

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

import org.fireflyframework.brain.monitor.BrainRunMonitor;
import org.fireflyframework.brain.monitor.BrainRunSummary;
import org.fireflyframework.brain.monitor.WaitingRun;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.BrainStatus;
import org.fireflyframework.brain.signal.RunWaker;
import org.fireflyframework.brain.signal.SignalQueue;
import org.fireflyframework.brain.signal.SignalType;
import org.fireflyframework.brain.signal.SignalValidationResult;
import org.fireflyframework.brain.signal.SignalValidator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Delivers a webhook response to the run waiting for it.
 * <p>
 * The delivery is checked against the CSRF token of the registration and against the
 * run's status, then the registration is claimed atomically. Only the claimant queues a
 * {@code WEBHOOK_RESPONSE} and wakes the run, so of several concurrent deliveries for the
 * same webhook exactly one resumes it. Rejections are reported, never thrown.
 */
@Slf4j
public class WebhookCoordinator {

    private final BrainRunMonitor monitor;
    private final SignalQueue signalQueue;
    private final RunWaker runWaker;
    private final BrainMachineDefinition machineDefinition;
    private final Clock clock;

    public WebhookCoordinator(BrainRunMonitor monitor, SignalQueue signalQueue, RunWaker runWaker,
                              BrainMachineDefinition machineDefinition, Clock clock) {
        this.monitor = monitor;
        this.signalQueue = signalQueue;
        this.runWaker = runWaker;
        this.machineDefinition = machineDefinition;
        this.clock = clock;
    }

    /**
     * @param submittedToken the CSRF token taken from a form submission, or {@code null}
     */
    public Mono<WebhookOutcome> queueWebhookAndWakeUp(String slug, String identifier, JsonNode response,
                                                      String submittedToken) {
        return monitor.findWaitingRun(slug, identifier)
                .flatMap(waiting -> deliver(waiting, response, submittedToken))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("WEBHOOK_NOT_FOUND: slug={}, identifier={}", slug, identifier);
                    return WebhookOutcome.notFound(identifier);
                }));
    }

    private Mono<WebhookOutcome> deliver(WaitingRun waiting, JsonNode response, String submittedToken) {
        String runId = waiting.brainRunId();

        SignalValidationResult token = WebhookTokenValidator.validate(waiting.token(), submittedToken);
        if (!token.valid()) {
            log.warn("WEBHOOK_IGNORED: slug={}, identifier={}, runId={}, reason={}",
                    waiting.slug(), waiting.identifier(), runId, token.reason());
            return Mono.just(WebhookOutcome.ignored(waiting.identifier(), runId, token.reason()));
        }

        return monitor.getRun(runId)
                .map(BrainRunSummary::status)
                .defaultIfEmpty(BrainStatus.PENDING)
                .flatMap(status -> {
                    SignalValidationResult gate = SignalValidator.isSignalValid(
                            machineDefinition, status, SignalType.WEBHOOK_RESPONSE);
                    if (!gate.valid()) {
                        log.warn("WEBHOOK_IGNORED: slug={}, identifier={}, runId={}, reason={}",
                                waiting.slug(), waiting.identifier(), runId, gate.reason());
                        return Mono.just(WebhookOutcome.ignored(waiting.identifier(), runId, gate.reason()));
                    }
                    return claimAndWake(waiting, response);
                });
    }

    private Mono<WebhookOutcome> claimAndWake(WaitingRun waiting, JsonNode response) {
        String runId = waiting.brainRunId();
        return monitor.claimWaiting(waiting)
                .flatMap(claimed -> {
                    if (!claimed) {
                        log.debug("WEBHOOK_CLAIM_LOST: slug={}, identifier={}, runId={}",
                                waiting.slug(), waiting.identifier(), runId);
                        return Mono.just(WebhookOutcome.notFound(waiting.identifier()));
                    }
                    return signalQueue.queueSignal(runId, BrainSignal.webhookResponse(response, clock.instant()))
                            .then(Mono.defer(() -> runWaker.wakeUp(runId)))
                            .doOnSuccess(v -> log.info("WEBHOOK_RESUMED: slug={}, identifier={}, runId={}",
                                    waiting.slug(), waiting.identifier(), runId))
                            .thenReturn(WebhookOutcome.resumed(waiting.identifier(), runId));
                });
    }
}

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

import org.fireflyframework.brain.monitor.BrainRunSummary;
import org.fireflyframework.brain.monitor.InMemoryBrainRunMonitor;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.BrainStatus;
import org.fireflyframework.brain.signal.InMemorySignalQueue;
import org.fireflyframework.brain.signal.SignalFilter;
import org.fireflyframework.brain.signal.SignalType;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WebhookCoordinator}.
 */
class WebhookCoordinatorTest {

    private static final String RUN_ID = "run-1";
    private static final String SLUG = "approval";
    private static final String IDENTIFIER = "req-42";

    private InMemoryBrainRunMonitor monitor;
    private InMemorySignalQueue signalQueue;
    private AtomicInteger wakeUps;
    private WebhookCoordinator coordinator;
    private final ObjectNode response = JsonNodeFactory.instance.objectNode().put("approved", true);

    @BeforeEach
    void setUp() {
        monitor = new InMemoryBrainRunMonitor();
        signalQueue = new InMemorySignalQueue();
        wakeUps = new AtomicInteger();
        coordinator = new WebhookCoordinator(monitor, signalQueue,
                runId -> Mono.fromRunnable(wakeUps::incrementAndGet),
                BrainMachineDefinition.standard(),
                Clock.fixed(Instant.EPOCH, ZoneOffset.UTC));
    }

    private void waiting(BrainStatus status, String token) {
        monitor.updateRun(new BrainRunSummary(RUN_ID, "demo", status, Instant.EPOCH, Instant.EPOCH)).block();
        monitor.registerWaiting(SLUG, IDENTIFIER, RUN_ID, token).block();
    }

    private List<BrainSignal> queuedSignals() {
        return signalQueue.getAndConsumeSignals(RUN_ID, SignalFilter.ALL).block();
    }

    // ========================================================================
    // queueWebhookAndWakeUp Tests
    // ========================================================================

    @Nested
    @DisplayName("queueWebhookAndWakeUp")
    class QueueWebhookAndWakeUpTests {

        @Test
        @DisplayName("should queue the response and wake the waiting run")
        void queueWebhookAndWakeUp_shouldResumeWaitingRun() {
            waiting(BrainStatus.WAITING, null);

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, null))
                    .assertNext(outcome -> {
                        assertThat(outcome.action()).isEqualTo(WebhookAction.RESUMED);
                        assertThat(outcome.brainRunId()).isEqualTo(RUN_ID);
                    })
                    .verifyComplete();

            assertThat(wakeUps.get()).isEqualTo(1);
            assertThat(queuedSignals()).singleElement().satisfies(signal -> {
                assertThat(signal.type()).isEqualTo(SignalType.WEBHOOK_RESPONSE);
                assertThat(signal.response()).isEqualTo(response);
            });
            StepVerifier.create(monitor.findWaitingRun(SLUG, IDENTIFIER)).verifyComplete();
        }

        @Test
        @DisplayName("should report not_found when nobody waits")
        void queueWebhookAndWakeUp_shouldReportNotFound() {
            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, "unknown", response, null))
                    .assertNext(outcome -> assertThat(outcome.action()).isEqualTo(WebhookAction.NOT_FOUND))
                    .verifyComplete();

            assertThat(wakeUps.get()).isZero();
        }

        @Test
        @DisplayName("should ignore a response for a run that is not waiting")
        void queueWebhookAndWakeUp_shouldIgnoreRunNotWaiting() {
            waiting(BrainStatus.PAUSED, null);

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, null))
                    .assertNext(outcome -> {
                        assertThat(outcome.action()).isEqualTo(WebhookAction.IGNORED);
                        assertThat(outcome.reason()).isEqualTo("Cannot WEBHOOK_RESPONSE brain in 'paused' state");
                    })
                    .verifyComplete();

            assertThat(wakeUps.get()).isZero();
            assertThat(queuedSignals()).isEmpty();
        }

        @Test
        @DisplayName("should resume exactly once under concurrent deliveries")
        void queueWebhookAndWakeUp_shouldResumeAtMostOnce() {
            waiting(BrainStatus.WAITING, null);

            Flux<WebhookOutcome> deliveries = Flux.range(0, 16)
                    .flatMap(i -> coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, null)
                            .subscribeOn(Schedulers.parallel()));

            StepVerifier.create(deliveries.collectList())
                    .assertNext(outcomes -> assertThat(outcomes)
                            .filteredOn(outcome -> outcome.action() == WebhookAction.RESUMED)
                            .hasSize(1))
                    .verifyComplete();

            assertThat(wakeUps.get()).isEqualTo(1);
            assertThat(queuedSignals()).hasSize(1);
        }
    }

    // ========================================================================
    // CSRF token Tests
    // ========================================================================

    @Nested
    @DisplayName("token checks")
    class TokenTests {

        @Test
        @DisplayName("should accept a matching form token")
        void queueWebhookAndWakeUp_shouldAcceptMatchingToken() {
            waiting(BrainStatus.WAITING, "secret");

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, "secret"))
                    .assertNext(outcome -> assertThat(outcome.action()).isEqualTo(WebhookAction.RESUMED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should ignore a mismatching token and keep the registration")
        void queueWebhookAndWakeUp_shouldRejectMismatchingToken() {
            waiting(BrainStatus.WAITING, "secret");

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, "forged"))
                    .assertNext(outcome -> {
                        assertThat(outcome.action()).isEqualTo(WebhookAction.IGNORED);
                        assertThat(outcome.reason()).isEqualTo(WebhookTokenValidator.INVALID_TOKEN_REASON);
                    })
                    .verifyComplete();

            StepVerifier.create(monitor.findWaitingRun(SLUG, IDENTIFIER))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should ignore a missing token when one is expected")
        void queueWebhookAndWakeUp_shouldRejectMissingToken() {
            waiting(BrainStatus.WAITING, "secret");

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, null))
                    .assertNext(outcome -> assertThat(outcome.action()).isEqualTo(WebhookAction.IGNORED))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should ignore a token when none is expected")
        void queueWebhookAndWakeUp_shouldRejectUnexpectedToken() {
            waiting(BrainStatus.WAITING, null);

            StepVerifier.create(coordinator.queueWebhookAndWakeUp(SLUG, IDENTIFIER, response, "surprise"))
                    .assertNext(outcome -> assertThat(outcome.action()).isEqualTo(WebhookAction.IGNORED))
                    .verifyComplete();
            assertThat(wakeUps.get()).isZero();
        }
    }
}

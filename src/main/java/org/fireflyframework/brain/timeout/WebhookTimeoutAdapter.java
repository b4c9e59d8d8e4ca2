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

package org.fireflyframework.brain.timeout;

import org.fireflyframework.brain.event.BrainError;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.signal.BrainStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Puts a deadline on webhook waits.
 * <p>
 * A {@code WEBHOOK} event with a timeout stores {@code now + timeout} and arms an
 * alarm. A response clears the deadline, so an alarm that goes off afterwards finds
 * nothing to do. When the alarm fires the actor calls {@link #checkExpired}; a run
 * still waiting past its deadline is then killed with reason
 * {@link org.fireflyframework.brain.signal.BrainSignal#REASON_TIMEOUT}.
 */
@Slf4j
public class WebhookTimeoutAdapter implements BrainEventAdapter {

    public static final String TIMEOUT_ERROR_NAME = "WebhookTimeoutError";

    private final TimeoutStore timeoutStore;
    private final AlarmScheduler alarmScheduler;
    private final Clock clock;

    public WebhookTimeoutAdapter(TimeoutStore timeoutStore, AlarmScheduler alarmScheduler, Clock clock) {
        this.timeoutStore = timeoutStore;
        this.alarmScheduler = alarmScheduler;
        this.clock = clock;
    }

    @Override
    public Mono<Void> dispatch(BrainEvent event, BrainExecutionState state) {
        String runId = event.getBrainRunId();
        BrainEventType type = event.getEventType();

        if (event instanceof WebhookEvent webhook && webhook.getTimeout() != null) {
            Instant deadline = clock.instant().plusMillis(webhook.getTimeout());
            return timeoutStore.setDeadline(runId, deadline)
                    .doOnSuccess(v -> {
                        alarmScheduler.schedule(runId, deadline);
                        log.info("WEBHOOK_TIMEOUT_SET: runId={}, timeoutMs={}, deadline={}",
                                runId, webhook.getTimeout(), deadline);
                    });
        }
        if (type == BrainEventType.WEBHOOK_RESPONSE) {
            return timeoutStore.clear(runId);
        }
        if (type.isTerminal()) {
            return timeoutStore.clear(runId)
                    .doOnSuccess(v -> alarmScheduler.cancel(runId));
        }
        return Mono.empty();
    }

    /**
     * Decides what a fired alarm means for a run.
     * <p>
     * Returns {@code true} and clears the deadline when the run is still waiting and
     * the deadline has passed. A deadline that is not due yet is re-armed.
     */
    public Mono<Boolean> checkExpired(String brainRunId, BrainStatus status) {
        return timeoutStore.getDeadline(brainRunId)
                .flatMap(deadline -> {
                    if (status != BrainStatus.WAITING) {
                        log.debug("WEBHOOK_TIMEOUT_IGNORED: runId={}, status={}", brainRunId, status);
                        return Mono.just(false);
                    }
                    if (deadline.isAfter(clock.instant())) {
                        alarmScheduler.schedule(brainRunId, deadline);
                        return Mono.just(false);
                    }
                    log.warn("WEBHOOK_TIMEOUT_EXPIRED: runId={}, deadline={}", brainRunId, deadline);
                    return timeoutStore.clear(brainRunId).thenReturn(true);
                })
                .defaultIfEmpty(false);
    }

    /**
     * Re-arms the alarm of a run whose deadline is stored, after the process restarted.
     */
    public Mono<Void> rearm(String brainRunId) {
        return timeoutStore.getDeadline(brainRunId)
                .doOnNext(deadline -> alarmScheduler.schedule(brainRunId, deadline))
                .then();
    }

    public static BrainError timeoutError() {
        return BrainError.of(TIMEOUT_ERROR_NAME, "Webhook wait timed out");
    }
}

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

package org.fireflyframework.brain.recovery;

import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.loader.EventLoader;
import org.fireflyframework.brain.monitor.BrainRunMonitor;
import org.fireflyframework.brain.monitor.BrainRunSummary;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainStatus;
import org.fireflyframework.brain.store.EventOrder;
import org.fireflyframework.brain.store.EventStore;
import org.fireflyframework.brain.timeout.AlarmScheduler;
import org.fireflyframework.brain.timeout.TimeoutStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Restores the process-local side of stored runs after application restart.
 *
 * <p>On {@link ApplicationReadyEvent}, every run in the event store is replayed. Its
 * summary is written to the monitor, and a run that is {@code WAITING} gets its webhook
 * registrations back and, when the wait is timed, its alarm. The deadline comes from the
 * {@link TimeoutStore}; when none is stored it is the timestamp of the last {@code WEBHOOK}
 * event plus the timeout it carried, and it is stored again. A deadline that already
 * passed fires at once.</p>
 *
 * <p>Configuration:
 * <pre>
 * firefly.brain.recovery.enabled=true
 * </pre>
 */
@Slf4j
public class BrainRunRecoveryService {

    private final EventStore eventStore;
    private final EventLoader eventLoader;
    private final BrainRunMonitor monitor;
    private final TimeoutStore timeoutStore;
    private final AlarmScheduler alarmScheduler;
    private final BrainMachineDefinition machineDefinition;
    private final boolean enabled;

    public BrainRunRecoveryService(EventStore eventStore,
                                   EventLoader eventLoader,
                                   BrainRunMonitor monitor,
                                   TimeoutStore timeoutStore,
                                   AlarmScheduler alarmScheduler,
                                   BrainMachineDefinition machineDefinition,
                                   boolean enabled) {
        this.eventStore = eventStore;
        this.eventLoader = eventLoader;
        this.monitor = monitor;
        this.timeoutStore = timeoutStore;
        this.alarmScheduler = alarmScheduler;
        this.machineDefinition = machineDefinition;
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!enabled) {
            log.info("Brain run recovery is disabled");
            return;
        }
        recover().subscribe();
    }

    /**
     * Scans every stored run.
     *
     * @return the number of waiting runs that were restored
     */
    public Mono<Long> recover() {
        log.info("Starting brain run recovery scan");
        AtomicLong scanned = new AtomicLong();
        AtomicLong waiting = new AtomicLong();
        AtomicLong failed = new AtomicLong();

        return eventStore.findRunIds()
                .concatMap(runId -> recoverRun(runId)
                        .doOnNext(restored -> {
                            scanned.incrementAndGet();
                            if (restored) {
                                waiting.incrementAndGet();
                            }
                        })
                        .onErrorResume(error -> {
                            failed.incrementAndGet();
                            log.error("RECOVERY_FAILED: runId={}: {}", runId, error.getMessage(), error);
                            return Mono.empty();
                        }))
                .then(Mono.fromSupplier(() -> {
                    log.info("Brain run recovery complete: scanned={}, waiting={}, failed={}",
                            scanned.get(), waiting.get(), failed.get());
                    return waiting.get();
                }));
    }

    private Mono<Boolean> recoverRun(String brainRunId) {
        return eventLoader.loadAllEvents(brainRunId)
                .collectList()
                .map(events -> BrainExecutionState.replay(machineDefinition, events))
                .flatMap(state -> monitor.updateRun(new BrainRunSummary(brainRunId, state.getBrainTitle(),
                                state.getStatus(), state.getCreatedAt(), state.getLastEventAt()))
                        .then(state.getStatus() == BrainStatus.WAITING
                                ? restoreWait(brainRunId, state).thenReturn(true)
                                : Mono.just(false)));
    }

    private Mono<Void> restoreWait(String brainRunId, BrainExecutionState state) {
        Mono<Void> registrations = Flux.fromIterable(state.getPendingWebhooks())
                .concatMap(registration -> monitor.registerWaiting(
                        registration.slug(), registration.identifier(), brainRunId, registration.token()))
                .then();
        return registrations.then(resolveDeadline(brainRunId, state.getPendingTimeout())
                .doOnNext(deadline -> {
                    alarmScheduler.schedule(brainRunId, deadline);
                    log.info("RECOVERY_WAIT_RESTORED: runId={}, webhooks={}, deadline={}",
                            brainRunId, state.getPendingWebhooks().size(), deadline);
                })
                .switchIfEmpty(Mono.fromRunnable(() ->
                        log.info("RECOVERY_WAIT_RESTORED: runId={}, webhooks={}, deadline=none",
                                brainRunId, state.getPendingWebhooks().size())))
                .then());
    }

    private Mono<Instant> resolveDeadline(String brainRunId, Long pendingTimeout) {
        Mono<Instant> fromLastWebhook = Mono.defer(() -> {
            if (pendingTimeout == null) {
                return Mono.empty();
            }
            return eventLoader.loadEventByType(brainRunId, BrainEventType.WEBHOOK, EventOrder.DESC)
                    .map(webhook -> webhook.getTimestamp().plusMillis(pendingTimeout))
                    .flatMap(deadline -> timeoutStore.setDeadline(brainRunId, deadline).thenReturn(deadline));
        });
        return timeoutStore.getDeadline(brainRunId).switchIfEmpty(fromLastWebhook);
    }
}

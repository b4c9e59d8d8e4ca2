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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.BrainStatus;
import org.fireflyframework.brain.signal.SignalFilter;
import org.fireflyframework.brain.signal.SignalType;
import org.fireflyframework.brain.store.EventOrder;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * The single writer of one run's event log.
 * <p>
 * All work happens in ticks, and ticks never overlap. A tick loads the log, replays
 * it, and then either starts the brain, consumes the signals the current status admits,
 * or does nothing. Every event the runner produces is appended to the log, applied to
 * the execution state and handed to the adapters before the next one is processed.
 * <p>
 * {@link #wakeUp()} is idempotent: a wake-up during a tick schedules exactly one more
 * tick after it.
 */
@Slf4j
public class BrainRunActor {

    private final String brainRunId;
    private final BrainRunDependencies dependencies;
    private final Consumer<BrainRunActor> onFinished;

    private final AtomicBoolean ticking = new AtomicBoolean();
    private final AtomicBoolean wakeRequested = new AtomicBoolean();
    private final AtomicBoolean startRequested = new AtomicBoolean();

    private volatile PendingStart pendingStart;
    private volatile Sinks.Empty<Void> startSignal;
    private volatile BrainDefinition brain;
    private volatile BrainExecutionState state;

    public BrainRunActor(String brainRunId, BrainRunDependencies dependencies, Consumer<BrainRunActor> onFinished) {
        this.brainRunId = brainRunId;
        this.dependencies = dependencies;
        this.onFinished = onFinished;
    }

    public String getBrainRunId() {
        return brainRunId;
    }

    /**
     * Starts the run.
     *
     * @return a Mono that completes once the {@code START} event is in the log
     */
    public Mono<Void> start(BrainDefinition definition, ObjectNode initialState) {
        return Mono.defer(() -> {
            if (!startRequested.compareAndSet(false, true)) {
                return Mono.error(new IllegalStateException("Run " + brainRunId + " was already started"));
            }
            PendingStart start = new PendingStart(definition, initialState, Sinks.empty());
            pendingStart = start;
            requestTick();
            return start.started.asMono();
        });
    }

    public Mono<Void> queueSignal(BrainSignal signal) {
        return dependencies.signalQueue().queueSignal(brainRunId, signal)
                .then(wakeUp());
    }

    public Mono<Void> wakeUp() {
        return Mono.fromRunnable(this::requestTick);
    }

    /**
     * Handles the alarm of the run: a webhook wait past its deadline is killed.
     */
    public Mono<Void> alarm() {
        return dependencies.eventLoader().loadAllEvents(brainRunId)
                .collectList()
                .map(events -> BrainExecutionState.replay(dependencies.machineDefinition(), events).getStatus())
                .flatMap(status -> dependencies.timeoutAdapter().checkExpired(brainRunId, status))
                .flatMap(expired -> expired
                        ? queueSignal(BrainSignal.kill(BrainSignal.REASON_TIMEOUT, dependencies.clock().instant()))
                        : Mono.empty());
    }

    /**
     * Execution state as of the last tick, or {@code null} before the first one.
     */
    public BrainExecutionState getState() {
        return state;
    }

    // ==================== Ticks ====================

    /**
     * Whether the actor has nothing left to do: its run ended, or it was woken for a run
     * that does not exist.
     */
    private boolean isFinished() {
        BrainExecutionState current = state;
        if (current == null) {
            return false;
        }
        return current.getStatus().isTerminal() || (current.getEventCount() == 0 && !startRequested.get());
    }

    private void requestTick() {
        wakeRequested.set(true);
        drain();
    }

    private void drain() {
        if (!ticking.compareAndSet(false, true)) {
            return;
        }
        wakeRequested.set(false);
        Mono.defer(this::tick)
                .subscribeOn(dependencies.scheduler())
                .onErrorResume(error -> {
                    log.error("ACTOR_TICK_FAILED: runId={}: {}", brainRunId, error.getMessage(), error);
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    ticking.set(false);
                    if (wakeRequested.get()) {
                        drain();
                    } else if (isFinished()) {
                        onFinished.accept(this);
                    }
                })
                .subscribe();
    }

    private Mono<Void> tick() {
        return dependencies.eventLoader().loadAllEvents(brainRunId)
                .collectList()
                .flatMap(events -> {
                    state = BrainExecutionState.replay(dependencies.machineDefinition(), events);
                    if (events.isEmpty()) {
                        return startPending();
                    }
                    return resolveBrain().flatMap(definition -> react(definition, events));
                });
    }

    private Mono<Void> startPending() {
        PendingStart start = pendingStart;
        if (start == null) {
            log.debug("ACTOR_IDLE: runId={}, no events", brainRunId);
            return Mono.empty();
        }
        pendingStart = null;
        startSignal = start.started;
        brain = start.brain;
        return execute(dependencies.runner().run(start.brain, brainRunId, start.initialState))
                .doOnError(error -> start.started.tryEmitError(error))
                .doFinally(signal -> start.started.tryEmitEmpty());
    }

    private Mono<BrainDefinition> resolveBrain() {
        BrainDefinition known = brain;
        if (known != null) {
            return Mono.just(known);
        }
        return dependencies.eventLoader().loadEventByType(brainRunId, BrainEventType.START, EventOrder.ASC)
                .cast(BrainStartEvent.class)
                .map(start -> dependencies.registry().getBrain(start.getBrainTitle()))
                .flatMap(definition -> {
                    brain = definition;
                    log.info("ACTOR_REBUILT: runId={}, brain={}, status={}",
                            brainRunId, definition.title(), state.getStatus());
                    return dependencies.timeoutAdapter().rearm(brainRunId).thenReturn(definition);
                });
    }

    private Mono<Void> react(BrainDefinition definition, List<BrainEvent> events) {
        BrainStatus status = state.getStatus();
        switch (status) {
            case WAITING:
                return dependencies.signalQueue().getAndConsumeSignals(brainRunId, SignalFilter.ALL)
                        .flatMap(signals -> {
                            Optional<BrainSignal> kill = first(signals, SignalType.KILL);
                            if (kill.isPresent()) {
                                return execute(dependencies.runner().cancel(definition, brainRunId, kill.get()));
                            }
                            return first(signals, SignalType.WEBHOOK_RESPONSE)
                                    .map(response -> execute(
                                            dependencies.runner().resume(definition, brainRunId, events, response)))
                                    .orElseGet(Mono::empty);
                        });
            case PAUSED:
                return dependencies.signalQueue().getAndConsumeSignals(brainRunId, SignalFilter.CONTROL)
                        .flatMap(signals -> {
                            Optional<BrainSignal> kill = first(signals, SignalType.KILL);
                            if (kill.isPresent()) {
                                return execute(dependencies.runner().cancel(definition, brainRunId, kill.get()));
                            }
                            return first(signals, SignalType.RESUME)
                                    .map(resume -> execute(
                                            dependencies.runner().resume(definition, brainRunId, events, resume)))
                                    .orElseGet(Mono::empty);
                        });
            case RUNNING:
                // only an interrupted run is RUNNING between ticks
                return dependencies.signalQueue().getAndConsumeSignals(brainRunId, SignalFilter.CONTROL)
                        .flatMap(signals -> first(signals, SignalType.KILL)
                                .map(kill -> execute(dependencies.runner().cancel(definition, brainRunId, kill)))
                                .orElseGet(() -> {
                                    log.warn("ACTOR_INTERRUPTED_RUN: runId={}, ignoredSignals={}",
                                            brainRunId, signals.size());
                                    return Mono.empty();
                                }));
            case COMPLETE:
            case ERROR:
            case CANCELLED:
                return dependencies.signalQueue().clear(brainRunId);
            default:
                return Mono.empty();
        }
    }

    // ==================== Recording ====================

    private Mono<Void> execute(Flux<BrainEvent> events) {
        return events.concatMapDelayError(this::record).then();
    }

    private Mono<BrainEvent> record(BrainEvent event) {
        return dependencies.eventLog().append(event)
                .then(Mono.defer(() -> {
                    state.apply(event);
                    Sinks.Empty<Void> started = startSignal;
                    if (started != null && event.getEventType() == BrainEventType.START) {
                        startSignal = null;
                        started.tryEmitEmpty();
                    }
                    return Flux.fromIterable(dependencies.adapters())
                            .concatMap(adapter -> adapter.dispatch(event, state))
                            .then();
                }))
                .thenReturn(event);
    }

    private static Optional<BrainSignal> first(List<BrainSignal> signals, SignalType type) {
        return signals.stream().filter(signal -> signal.type() == type).findFirst();
    }

    private record PendingStart(BrainDefinition brain, ObjectNode initialState, Sinks.Empty<Void> started) {
    }
}

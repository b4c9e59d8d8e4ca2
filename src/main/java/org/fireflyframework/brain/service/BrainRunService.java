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

import org.fireflyframework.brain.core.BrainDefinition;
import org.fireflyframework.brain.core.BrainRegistry;
import org.fireflyframework.brain.core.BrainRunActors;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.exception.BrainRunNotFoundException;
import org.fireflyframework.brain.exception.SignalRejectedException;
import org.fireflyframework.brain.loader.EventLoader;
import org.fireflyframework.brain.monitor.BrainRunMonitor;
import org.fireflyframework.brain.monitor.BrainRunSummary;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.replay.StateReconstructor;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.SignalKind;
import org.fireflyframework.brain.signal.SignalType;
import org.fireflyframework.brain.signal.SignalValidationResult;
import org.fireflyframework.brain.signal.SignalValidator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Facade over runs for the HTTP layer and embedding applications.
 * <p>
 * Reads are answered from the event log. Control signals are checked against the
 * state machine before they are queued, so a rejected signal never reaches the actor.
 */
@Slf4j
public class BrainRunService {

    private final BrainRegistry registry;
    private final BrainRunActors actors;
    private final EventLoader eventLoader;
    private final BrainRunMonitor monitor;
    private final BrainMachineDefinition machineDefinition;
    private final Clock clock;

    public BrainRunService(BrainRegistry registry, BrainRunActors actors, EventLoader eventLoader,
                           BrainRunMonitor monitor, BrainMachineDefinition machineDefinition, Clock clock) {
        this.registry = registry;
        this.actors = actors;
        this.eventLoader = eventLoader;
        this.monitor = monitor;
        this.machineDefinition = machineDefinition;
        this.clock = clock;
    }

    /**
     * Starts a run of a registered brain.
     *
     * @param initialState a JSON object, or {@code null} for an empty state
     * @return the id of the new run
     */
    public Mono<String> startRun(String brainTitle, JsonNode initialState) {
        if (initialState != null && !initialState.isNull() && !initialState.isObject()) {
            return Mono.error(new IllegalArgumentException("initialState must be a JSON object"));
        }
        ObjectNode state = initialState instanceof ObjectNode object ? object : JsonNodeFactory.instance.objectNode();
        return actors.startRun(brainTitle, state)
                .doOnNext(runId -> log.info("Started brain run: brain={}, runId={}", brainTitle, runId));
    }

    public Mono<BrainRunView> getRun(String brainRunId) {
        return loadEvents(brainRunId).map(events -> toView(brainRunId, events));
    }

    public Flux<BrainEvent> getEvents(String brainRunId) {
        return loadEvents(brainRunId).flatMapMany(Flux::fromIterable);
    }

    /**
     * State of a run right after the event at {@code eventIndex}; indexes past the end
     * give the current state.
     */
    public Mono<ObjectNode> getStateAt(String brainRunId, int eventIndex) {
        return loadEvents(brainRunId).map(events -> StateReconstructor.reconstructStateAtEvent(events, eventIndex));
    }

    public Flux<BrainRunSummary> listRuns() {
        return monitor.listRuns();
    }

    public List<BrainDefinition> listBrains() {
        return registry.listBrains();
    }

    /**
     * Queues a control signal for a run.
     *
     * @throws SignalRejectedException (as an error signal) when the run's status does not admit it
     */
    public Mono<Void> sendSignal(String brainRunId, SignalType type) {
        if (type.getKind() != SignalKind.CONTROL) {
            return Mono.error(new IllegalArgumentException(
                    "Signal " + type + " can only be delivered through a webhook"));
        }
        return loadEvents(brainRunId).flatMap(events -> {
            BrainExecutionState state = BrainExecutionState.replay(machineDefinition, events);
            SignalValidationResult validation = SignalValidator.isSignalValid(machineDefinition, state.getStatus(), type);
            if (!validation.valid()) {
                log.warn("Rejected signal: runId={}, signal={}, reason={}", brainRunId, type, validation.reason());
                return Mono.error(new SignalRejectedException(validation.reason()));
            }
            log.info("Queueing signal: runId={}, signal={}", brainRunId, type);
            return actors.queueSignal(brainRunId, toSignal(type));
        });
    }

    public Mono<Void> kill(String brainRunId) {
        return sendSignal(brainRunId, SignalType.KILL);
    }

    public Mono<Void> pause(String brainRunId) {
        return sendSignal(brainRunId, SignalType.PAUSE);
    }

    public Mono<Void> resume(String brainRunId) {
        return sendSignal(brainRunId, SignalType.RESUME);
    }

    private Mono<List<BrainEvent>> loadEvents(String brainRunId) {
        return eventLoader.loadAllEvents(brainRunId)
                .collectList()
                .flatMap(events -> events.isEmpty()
                        ? Mono.error(new BrainRunNotFoundException(brainRunId))
                        : Mono.just(events));
    }

    private BrainSignal toSignal(SignalType type) {
        return switch (type) {
            case KILL -> BrainSignal.kill(clock.instant());
            case PAUSE -> BrainSignal.pause(clock.instant());
            case RESUME -> BrainSignal.resume(clock.instant());
            case WEBHOOK_RESPONSE -> throw new IllegalArgumentException("Webhook responses need a payload");
        };
    }

    private BrainRunView toView(String brainRunId, List<BrainEvent> events) {
        BrainExecutionState state = BrainExecutionState.replay(machineDefinition, events);
        List<WebhookRegistration> webhooks = state.getPendingWebhooks().stream()
                .map(webhook -> WebhookRegistration.of(webhook.slug(), webhook.identifier()))
                .toList();
        return new BrainRunView(
                brainRunId,
                state.getBrainTitle(),
                state.getStatus(),
                state.getCurrentState().deepCopy(),
                state.getBrainStack(),
                state.getCurrentStepId(),
                state.getCreatedAt(),
                state.getStartedAt(),
                state.getCompletedAt(),
                state.getError(),
                webhooks,
                SignalValidator.getValidSignals(machineDefinition, state.getStatus()),
                events.size());
    }
}

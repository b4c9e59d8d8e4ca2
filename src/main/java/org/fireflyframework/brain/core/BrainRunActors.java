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

import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.RunWaker;
import org.fireflyframework.brain.timeout.AlarmScheduler;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory of run actors: "the actor for run X".
 * <p>
 * Actors are created on first use and dropped once their run has ended. An actor for a
 * run that was started by an earlier process is rebuilt from the log on its first tick.
 * Alarms fired by the {@link AlarmScheduler} are routed to the actor of their run.
 */
@Slf4j
public class BrainRunActors implements RunWaker, DisposableBean {

    private final BrainRunDependencies dependencies;
    private final AlarmScheduler alarmScheduler;
    private final Map<String, BrainRunActor> actors = new ConcurrentHashMap<>();

    private volatile Disposable alarmSubscription;

    public BrainRunActors(BrainRunDependencies dependencies, AlarmScheduler alarmScheduler) {
        this.dependencies = dependencies;
        this.alarmScheduler = alarmScheduler;
    }

    /**
     * Starts routing alarms to actors.
     */
    public synchronized void start() {
        if (alarmSubscription != null && !alarmSubscription.isDisposed()) {
            log.warn("Brain run actors are already listening for alarms");
            return;
        }
        alarmSubscription = alarmScheduler.alarms()
                .concatMap(runId -> actorFor(runId).alarm()
                        .onErrorResume(error -> {
                            log.error("ALARM_FAILED: runId={}: {}", runId, error.getMessage(), error);
                            return Mono.empty();
                        }))
                .subscribe();
        log.info("Brain run actors listening for alarms");
    }

    public synchronized void stop() {
        if (alarmSubscription != null && !alarmSubscription.isDisposed()) {
            alarmSubscription.dispose();
            alarmSubscription = null;
        }
    }

    public BrainRunActor actorFor(String brainRunId) {
        return actors.computeIfAbsent(brainRunId, id -> new BrainRunActor(id, dependencies, this::evict));
    }

    /**
     * Starts a new run of a registered brain.
     *
     * @return the id of the run, once its {@code START} event is in the log
     */
    public Mono<String> startRun(String brainTitle, ObjectNode initialState) {
        return Mono.defer(() -> {
            BrainDefinition brain = dependencies.registry().getBrain(brainTitle);
            String runId = UUID.randomUUID().toString();
            return actorFor(runId).start(brain, initialState).thenReturn(runId);
        });
    }

    public Mono<Void> queueSignal(String brainRunId, BrainSignal signal) {
        return Mono.defer(() -> actorFor(brainRunId).queueSignal(signal));
    }

    @Override
    public Mono<Void> wakeUp(String brainRunId) {
        return Mono.defer(() -> actorFor(brainRunId).wakeUp());
    }

    public int getActiveActorCount() {
        return actors.size();
    }

    @Override
    public void destroy() {
        stop();
    }

    private void evict(BrainRunActor actor) {
        if (actors.remove(actor.getBrainRunId(), actor)) {
            log.debug("ACTOR_EVICTED: runId={}", actor.getBrainRunId());
        }
    }
}

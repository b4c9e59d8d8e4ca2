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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.replay.BrainExecutionState;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Keeps the monitor in step with the event stream: the run's status after every
 * event, a waiting registration per webhook of a {@code WEBHOOK} event, and removal
 * of those registrations once the run is answered or finished.
 */
@RequiredArgsConstructor
public class MonitorAdapter implements BrainEventAdapter {

    private final BrainRunMonitor monitor;

    @Override
    public Mono<Void> dispatch(BrainEvent event, BrainExecutionState state) {
        String runId = event.getBrainRunId();
        Mono<Void> update = monitor.updateRun(new BrainRunSummary(
                runId,
                state.getBrainTitle(),
                state.getStatus(),
                state.getCreatedAt(),
                state.getLastEventAt()));

        BrainEventType type = event.getEventType();
        if (event instanceof WebhookEvent webhook && webhook.getWaitFor() != null) {
            return update.then(Flux.fromIterable(webhook.getWaitFor())
                    .concatMap(registration -> monitor.registerWaiting(
                            registration.slug(), registration.identifier(), runId, registration.token()))
                    .then());
        }
        if (type == BrainEventType.WEBHOOK_RESPONSE || type.isTerminal()) {
            return update.then(monitor.clearWaiting(runId));
        }
        return update;
    }
}

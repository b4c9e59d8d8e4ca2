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

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link AlarmScheduler} built on a Reactor {@link Scheduler}.
 * <p>
 * Alarms live in memory only. After a restart they are re-armed from the
 * {@link TimeoutStore} when the run's actor is rebuilt.
 */
@Slf4j
public class ReactorAlarmScheduler implements AlarmScheduler, DisposableBean {

    private final Scheduler scheduler;
    private final Clock clock;
    private final Map<String, Alarm> pending = new HashMap<>();
    private final Sinks.Many<String> sink = Sinks.many().multicast().onBackpressureBuffer();

    public ReactorAlarmScheduler(Scheduler scheduler, Clock clock) {
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @Override
    public void schedule(String brainRunId, Instant deadline) {
        Alarm alarm;
        synchronized (this) {
            Alarm current = pending.get(brainRunId);
            if (current != null && !deadline.isBefore(current.deadline)) {
                log.debug("ALARM_KEPT: runId={}, deadline={}, requested={}", brainRunId, current.deadline, deadline);
                return;
            }
            if (current != null) {
                current.dispose();
            }
            alarm = new Alarm(brainRunId, deadline);
            pending.put(brainRunId, alarm);
        }

        long delayMillis = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
        log.debug("ALARM_SCHEDULED: runId={}, deadline={}, delayMs={}", brainRunId, deadline, delayMillis);
        // the task may run before schedule() returns
        alarm.task = scheduler.schedule(() -> fire(alarm), delayMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void cancel(String brainRunId) {
        Alarm removed;
        synchronized (this) {
            removed = pending.remove(brainRunId);
        }
        if (removed != null) {
            removed.dispose();
            log.debug("ALARM_CANCELLED: runId={}", brainRunId);
        }
    }

    @Override
    public Flux<String> alarms() {
        return sink.asFlux();
    }

    /**
     * Deadline of the pending alarm of a run.
     */
    public synchronized Optional<Instant> getScheduledDeadline(String brainRunId) {
        return Optional.ofNullable(pending.get(brainRunId)).map(alarm -> alarm.deadline);
    }

    @Override
    public void destroy() {
        synchronized (this) {
            pending.values().forEach(Alarm::dispose);
            pending.clear();
        }
        sink.tryEmitComplete();
    }

    private void fire(Alarm alarm) {
        synchronized (this) {
            if (!pending.remove(alarm.brainRunId, alarm)) {
                return;
            }
        }
        log.info("ALARM_FIRED: runId={}, deadline={}", alarm.brainRunId, alarm.deadline);
        sink.emitNext(alarm.brainRunId, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
    }

    private static final class Alarm {

        private final String brainRunId;
        private final Instant deadline;
        private volatile Disposable task;

        private Alarm(String brainRunId, Instant deadline) {
            this.brainRunId = brainRunId;
            this.deadline = deadline;
        }

        private void dispose() {
            Disposable scheduled = task;
            if (scheduled != null) {
                scheduled.dispose();
            }
        }
    }
}

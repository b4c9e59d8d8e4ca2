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

package org.fireflyframework.brain.metrics;

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventType;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.webhook.WebhookOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Brain engine metrics. All meters are prefixed with {@code firefly.brain.}.
 * <p>
 * Run and step meters are fed from the event stream, as an adapter of every actor.
 */
@Slf4j
public class BrainMetrics implements BrainEventAdapter {

    private static final String PREFIX = "firefly.brain.";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger activeRuns = new AtomicInteger();

    public BrainMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        meterRegistry.gauge(PREFIX + "runs.active", activeRuns);
        log.info("BrainMetrics initialized");
    }

    @Override
    public Mono<Void> dispatch(BrainEvent event, BrainExecutionState state) {
        return Mono.fromRunnable(() -> record(event, state));
    }

    // ==================== Run Metrics ====================

    private void record(BrainEvent event, BrainExecutionState state) {
        BrainEventType type = event.getEventType();
        String brain = state.getBrainTitle() != null ? state.getBrainTitle() : "unknown";

        counter("events", "type", type.getWireName()).increment();

        switch (type) {
            case START -> {
                counter("runs.started", "brain", brain).increment();
                activeRuns.incrementAndGet();
            }
            case COMPLETE, ERROR, CANCELLED -> {
                if (state.getStatus().isTerminal()) {
                    recordRunFinished(brain, state);
                }
            }
            case STEP_RETRY -> counter("step.retries", "brain", brain).increment();
            case WEBHOOK -> counter("webhook.waits", "brain", brain).increment();
            case AGENT_TOKEN_LIMIT -> counter("agent.token.limits", "brain", brain).increment();
            default -> {
                // counted above
            }
        }
    }

    private void recordRunFinished(String brain, BrainExecutionState state) {
        String status = state.getStatus().getValue();
        counter("runs.finished", "brain", brain, "status", status).increment();
        if (state.getStartedAt() != null && state.getCompletedAt() != null) {
            Timer.builder(PREFIX + "runs.duration")
                    .tag("brain", brain)
                    .tag("status", status)
                    .register(meterRegistry)
                    .record(Duration.between(state.getStartedAt(), state.getCompletedAt()));
        }
        activeRuns.updateAndGet(current -> Math.max(0, current - 1));
        log.debug("METRIC: runs.finished brain={}, status={}", brain, status);
    }

    // ==================== Webhook Metrics ====================

    public void recordWebhook(String slug, WebhookOutcome outcome) {
        counter("webhooks", "slug", slug, "action", outcome.action().getValue()).increment();
    }

    public int getActiveRuns() {
        return activeRuns.get();
    }

    private Counter counter(String name, String... tags) {
        return Counter.builder(PREFIX + name)
                .tags(tags)
                .register(meterRegistry);
    }
}

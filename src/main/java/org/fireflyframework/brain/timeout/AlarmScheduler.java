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

import reactor.core.publisher.Flux;

import java.time.Instant;

/**
 * Keeps at most one pending alarm per run, set to the nearest requested deadline.
 */
public interface AlarmScheduler {

    /**
     * Schedules an alarm for the run unless an earlier one is already pending.
     */
    void schedule(String brainRunId, Instant deadline);

    void cancel(String brainRunId);

    /**
     * Hot stream of the ids of runs whose alarm went off.
     */
    Flux<String> alarms();
}

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

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTimeoutStore implements TimeoutStore {

    private final Map<String, Instant> deadlines = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> setDeadline(String brainRunId, Instant deadline) {
        return Mono.fromRunnable(() -> deadlines.put(brainRunId, deadline));
    }

    @Override
    public Mono<Instant> getDeadline(String brainRunId) {
        return Mono.fromSupplier(() -> deadlines.get(brainRunId));
    }

    @Override
    public Mono<Void> clear(String brainRunId) {
        return Mono.fromRunnable(() -> deadlines.remove(brainRunId));
    }
}

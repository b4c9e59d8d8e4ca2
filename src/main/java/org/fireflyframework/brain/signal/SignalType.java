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

package org.fireflyframework.brain.signal;

import org.fireflyframework.brain.event.BrainEventType;

import java.util.Arrays;
import java.util.Optional;

/**
 * Signals that can be injected into a run, with the event each one would cause.
 * A signal is admissible only where the machine has a transition for that event.
 */
public enum SignalType {

    KILL(SignalKind.CONTROL, BrainEventType.CANCELLED),
    PAUSE(SignalKind.CONTROL, BrainEventType.PAUSED),
    RESUME(SignalKind.CONTROL, BrainEventType.RESUMED),
    WEBHOOK_RESPONSE(SignalKind.WEBHOOK, BrainEventType.WEBHOOK_RESPONSE);

    private final SignalKind kind;
    private final BrainEventType event;

    SignalType(SignalKind kind, BrainEventType event) {
        this.kind = kind;
        this.event = event;
    }

    public SignalKind getKind() {
        return kind;
    }

    public BrainEventType getEvent() {
        return event;
    }

    public static Optional<SignalType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst();
    }
}

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

package org.fireflyframework.brain.exception;

import lombok.Getter;

/**
 * Raised when an event row references a blob that cannot be loaded,
 * or holds neither an inline body nor a blob reference.
 */
@Getter
public class EventHydrationException extends BrainReplayException {

    private final String brainRunId;
    private final long eventId;

    public EventHydrationException(String brainRunId, long eventId, String message) {
        super(message);
        this.brainRunId = brainRunId;
        this.eventId = eventId;
    }

    public EventHydrationException(String brainRunId, long eventId, String message, Throwable cause) {
        super(message, cause);
        this.brainRunId = brainRunId;
        this.eventId = eventId;
    }
}

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

package org.fireflyframework.brain.store;

import java.time.Instant;

/**
 * One row of the event log.
 * <p>
 * A row holds either the serialized event inline or the key of a blob holding it.
 *
 * @param eventId         monotonic id assigned on insert, {@code null} before
 * @param brainRunId      the owning run
 * @param eventType       wire name of the event type
 * @param serializedEvent the inline JSON body, or {@code null} when overflowed
 * @param blobKey         the blob key of an overflowed body, or {@code null}
 * @param timestamp       when the event was produced
 */
public record EventRecord(
        Long eventId,
        String brainRunId,
        String eventType,
        String serializedEvent,
        String blobKey,
        Instant timestamp
) {

    public static EventRecord inline(String brainRunId, String eventType, String serializedEvent, Instant timestamp) {
        return new EventRecord(null, brainRunId, eventType, serializedEvent, null, timestamp);
    }

    public static EventRecord overflowed(String brainRunId, String eventType, String blobKey, Instant timestamp) {
        return new EventRecord(null, brainRunId, eventType, null, blobKey, timestamp);
    }

    public EventRecord withEventId(long id) {
        return new EventRecord(id, brainRunId, eventType, serializedEvent, blobKey, timestamp);
    }

    public EventRecord withBlobKey(String key) {
        return new EventRecord(eventId, brainRunId, eventType, null, key, timestamp);
    }

    public boolean isOverflowed() {
        return blobKey != null;
    }
}

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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainEventCodec;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Appends events to the log, moving bodies larger than the overflow threshold to blob storage.
 * <p>
 * An overflowed event is first inserted with the {@link #PENDING_BLOB_KEY} placeholder so that
 * its position in the log is fixed before the blob exists. A crash between the insert and the
 * blob write leaves a row whose blob cannot be found, which the loader reports as fatal.
 */
@Slf4j
public class BrainEventLog {

    public static final String PENDING_BLOB_KEY = "pending";

    private final EventStore eventStore;
    private final BlobStore blobStore;
    private final BrainEventCodec codec;
    private final int overflowThresholdBytes;

    public BrainEventLog(EventStore eventStore, BlobStore blobStore, BrainEventCodec codec,
                         int overflowThresholdBytes) {
        this.eventStore = eventStore;
        this.blobStore = blobStore;
        this.codec = codec;
        this.overflowThresholdBytes = overflowThresholdBytes;
    }

    /**
     * Persists one event and returns the stored row.
     */
    public Mono<EventRecord> append(BrainEvent event) {
        return Mono.defer(() -> {
            String json = codec.encode(event);
            String eventType = event.getEventType().getWireName();
            int size = json.getBytes(StandardCharsets.UTF_8).length;

            if (size <= overflowThresholdBytes) {
                return eventStore.insert(EventRecord.inline(event.getBrainRunId(), eventType, json,
                        event.getTimestamp()));
            }

            return eventStore.insert(EventRecord.overflowed(event.getBrainRunId(), eventType, PENDING_BLOB_KEY,
                            event.getTimestamp()))
                    .flatMap(record -> {
                        String key = blobKey(record.brainRunId(), record.eventId());
                        log.info("EVENT_OVERFLOW: runId={}, eventId={}, type={}, bytes={}",
                                record.brainRunId(), record.eventId(), eventType, size);
                        return blobStore.put(key, json, Map.of(
                                        "brainRunId", record.brainRunId(),
                                        "eventType", eventType))
                                .then(eventStore.updateBlobKey(record.eventId(), key))
                                .thenReturn(record.withBlobKey(key));
                    });
        });
    }

    public int getOverflowThresholdBytes() {
        return overflowThresholdBytes;
    }

    public static String blobKey(String brainRunId, long eventId) {
        return "events/" + brainRunId + "/" + eventId + ".json";
    }
}

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

import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Blob store kept in memory.
 */
public class InMemoryBlobStore implements BlobStore {

    private final Map<String, StoredBlob> blobs = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> put(String key, String content, Map<String, String> metadata) {
        return Mono.fromRunnable(() -> blobs.put(key, new StoredBlob(content, Map.copyOf(metadata))));
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> blobs.get(key)).map(StoredBlob::content);
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> blobs.remove(key));
    }

    /**
     * Metadata stored with a blob, or an empty map when the key is absent.
     */
    public Map<String, String> getMetadata(String key) {
        StoredBlob blob = blobs.get(key);
        return blob != null ? blob.metadata() : Map.of();
    }

    public boolean contains(String key) {
        return blobs.containsKey(key);
    }

    private record StoredBlob(String content, Map<String, String> metadata) {
    }
}

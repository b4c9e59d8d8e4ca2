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

package org.fireflyframework.brain.page;

import org.fireflyframework.brain.store.BlobStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Publishes HTML pages of a run to blob storage under {@code pages/{slug}.html}.
 */
@Slf4j
public class PageService {

    private final BlobStore blobStore;
    private final PageRegistry pageRegistry;

    public PageService(BlobStore blobStore, PageRegistry pageRegistry) {
        this.blobStore = blobStore;
        this.pageRegistry = pageRegistry;
    }

    public Mono<PageRegistration> publish(String brainRunId, String slug, String html, boolean persist) {
        PageRegistration registration = new PageRegistration(slug, brainRunId, persist);
        return blobStore.put(pageKey(slug), html, Map.of(
                        "brainRunId", brainRunId,
                        "persist", Boolean.toString(persist)))
                .then(pageRegistry.register(registration))
                .doOnSuccess(v -> log.debug("PAGE_PUBLISHED: slug={}, runId={}, persist={}", slug, brainRunId, persist))
                .thenReturn(registration);
    }

    public Mono<String> get(String slug) {
        return blobStore.get(pageKey(slug));
    }

    public static String pageKey(String slug) {
        return "pages/" + slug + ".html";
    }
}

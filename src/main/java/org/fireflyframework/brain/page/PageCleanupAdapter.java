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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.replay.BrainExecutionState;
import org.fireflyframework.brain.store.BlobStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Deletes the non-persistent pages of a run once it completes, fails or is cancelled.
 * A page that cannot be deleted is logged and left behind.
 */
@Slf4j
public class PageCleanupAdapter implements BrainEventAdapter {

    private final BlobStore blobStore;
    private final PageRegistry pageRegistry;

    public PageCleanupAdapter(BlobStore blobStore, PageRegistry pageRegistry) {
        this.blobStore = blobStore;
        this.pageRegistry = pageRegistry;
    }

    @Override
    public Mono<Void> dispatch(BrainEvent event, BrainExecutionState state) {
        if (!event.getEventType().isTerminal()) {
            return Mono.empty();
        }
        String runId = event.getBrainRunId();
        return pageRegistry.findByRun(runId)
                .filter(page -> !page.persist())
                .concatMap(page -> blobStore.delete(PageService.pageKey(page.slug()))
                        .then(pageRegistry.remove(page.slug()))
                        .doOnSuccess(v -> log.debug("PAGE_DELETED: slug={}, runId={}", page.slug(), runId))
                        .onErrorResume(error -> {
                            log.error("PAGE_CLEANUP_FAILED: slug={}, runId={}: {}",
                                    page.slug(), runId, error.getMessage(), error);
                            return Mono.empty();
                        }))
                .then()
                .onErrorResume(error -> {
                    log.error("PAGE_CLEANUP_FAILED: runId={}: {}", runId, error.getMessage(), error);
                    return Mono.empty();
                });
    }
}

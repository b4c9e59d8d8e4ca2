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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPageRegistry implements PageRegistry {

    private final Map<String, PageRegistration> pages = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> register(PageRegistration registration) {
        return Mono.fromRunnable(() -> pages.put(registration.slug(), registration));
    }

    @Override
    public Mono<PageRegistration> find(String slug) {
        return Mono.fromSupplier(() -> pages.get(slug));
    }

    @Override
    public Flux<PageRegistration> findByRun(String brainRunId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(pages.values())))
                .filter(page -> page.brainRunId().equals(brainRunId));
    }

    @Override
    public Mono<Void> remove(String slug) {
        return Mono.fromRunnable(() -> pages.remove(slug));
    }
}

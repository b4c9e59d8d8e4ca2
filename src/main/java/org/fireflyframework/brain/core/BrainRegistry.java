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

package org.fireflyframework.brain.core;

import org.fireflyframework.brain.exception.BrainNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of brain definitions, keyed by title.
 */
@Slf4j
public class BrainRegistry {

    private final Map<String, BrainDefinition> brains = new ConcurrentHashMap<>();

    public BrainRegistry() {
    }

    public BrainRegistry(List<BrainDefinition> definitions) {
        definitions.forEach(this::register);
    }

    public void register(BrainDefinition brain) {
        BrainDefinition previous = brains.put(brain.title(), brain);
        if (previous != null) {
            log.info("Replaced brain definition: title={}", brain.title());
        }
        log.info("Registered brain: title={}, blocks={}", brain.title(), brain.blocks().size());
    }

    public Optional<BrainDefinition> findBrain(String title) {
        return Optional.ofNullable(brains.get(title));
    }

    /**
     * @throws BrainNotFoundException when no brain has the title
     */
    public BrainDefinition getBrain(String title) {
        return findBrain(title).orElseThrow(() -> new BrainNotFoundException(title));
    }

    public List<BrainDefinition> listBrains() {
        return brains.values().stream()
                .sorted(Comparator.comparing(BrainDefinition::title))
                .toList();
    }
}

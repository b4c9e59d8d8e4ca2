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

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable definition of a brain: a title, a description and the ordered blocks it runs.
 * <p>
 * Blocks are identified by position; the block at index {@code i} has the step id
 * {@code step-(i+1)}.
 *
 * @param title       unique title, used to find the brain again when a run is rebuilt
 * @param description free text shown to operators
 * @param blocks      the steps and agent loops, in execution order
 */
@Builder
public record BrainDefinition(
        String title,
        String description,
        @Singular List<BrainBlock> blocks
) {

    public BrainDefinition {
        Objects.requireNonNull(title, "title cannot be null");
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public static String stepId(int index) {
        return "step-" + (index + 1);
    }

    public Optional<BrainBlock> findBlock(String stepId) {
        for (int i = 0; i < blocks.size(); i++) {
            if (stepId(i).equals(stepId)) {
                return Optional.of(blocks.get(i));
            }
        }
        return Optional.empty();
    }
}

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

package org.fireflyframework.brain.event;

import org.fireflyframework.brain.patch.JsonPatchOperation;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.util.List;

/**
 * A step finished; its patch transforms the previous state into the new one.
 */
@JsonTypeName("step:complete")
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class StepCompleteEvent extends StepEvent {

    private List<JsonPatchOperation> patch;

    @Override
    public BrainEventType getEventType() {
        return BrainEventType.STEP_COMPLETE;
    }
}

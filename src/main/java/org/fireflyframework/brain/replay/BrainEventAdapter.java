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

package org.fireflyframework.brain.replay;

import org.fireflyframework.brain.event.BrainEvent;
import reactor.core.publisher.Mono;

/**
 * Side effect attached to the event stream of a run.
 * <p>
 * The actor calls every adapter after an event has been appended to the log and
 * applied to the execution state, in registration order.
 */
@FunctionalInterface
public interface BrainEventAdapter {

    /**
     * @param state the execution state after {@code event} was applied
     */
    Mono<Void> dispatch(BrainEvent event, BrainExecutionState state);
}

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

import org.fireflyframework.brain.loader.EventLoader;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.SignalQueue;
import org.fireflyframework.brain.store.BrainEventLog;
import org.fireflyframework.brain.timeout.WebhookTimeoutAdapter;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;

/**
 * Collaborators shared by every run actor.
 *
 * @param adapters  called after each appended event, in order
 * @param scheduler where actor ticks run
 */
public record BrainRunDependencies(
        BrainRegistry registry,
        BrainRunner runner,
        EventLoader eventLoader,
        BrainEventLog eventLog,
        SignalQueue signalQueue,
        WebhookTimeoutAdapter timeoutAdapter,
        List<BrainEventAdapter> adapters,
        BrainMachineDefinition machineDefinition,
        Scheduler scheduler,
        Clock clock
) {

    public BrainRunDependencies {
        adapters = List.copyOf(adapters);
    }
}

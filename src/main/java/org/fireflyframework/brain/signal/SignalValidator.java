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

package org.fireflyframework.brain.signal;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a signal may be queued for a run in a given status.
 * <p>
 * A signal is admissible exactly when the machine has a transition from the current
 * status for the event the signal would cause. The answer is total over every
 * {@code (status, signal)} pair.
 */
public final class SignalValidator {

    private SignalValidator() {
    }

    public static SignalValidationResult isSignalValid(BrainMachineDefinition definition,
                                                       BrainStatus status,
                                                       SignalType signalType) {
        if (definition.hasTransition(status, signalType.getEvent())) {
            return SignalValidationResult.accepted();
        }
        return SignalValidationResult.rejected(
                "Cannot " + signalType.name() + " brain in '" + status.getValue() + "' state");
    }

    /**
     * Variant for raw wire values.
     */
    public static SignalValidationResult isSignalValid(BrainMachineDefinition definition,
                                                       String status,
                                                       String signalType) {
        Optional<SignalType> type = SignalType.fromValue(signalType);
        if (type.isEmpty()) {
            return SignalValidationResult.rejected("Unknown signal type: " + signalType);
        }
        Optional<BrainStatus> brainStatus = BrainStatus.fromValue(status);
        if (brainStatus.isEmpty()) {
            return SignalValidationResult.rejected("Unknown brain status: " + status);
        }
        return isSignalValid(definition, brainStatus.get(), type.get());
    }

    /**
     * Every signal admissible in the given status, in declaration order.
     */
    public static List<SignalType> getValidSignals(BrainMachineDefinition definition, BrainStatus status) {
        return Arrays.stream(SignalType.values())
                .filter(type -> definition.hasTransition(status, type.getEvent()))
                .toList();
    }
}

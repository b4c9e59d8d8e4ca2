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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Public status of a run, paired with the name of the machine state it maps to.
 */
public enum BrainStatus {

    PENDING("pending", "idle"),
    RUNNING("running", "running"),
    PAUSED("paused", "paused"),
    WAITING("waiting", "waiting"),
    COMPLETE("complete", "complete"),
    ERROR("error", "error"),
    CANCELLED("cancelled", "cancelled");

    private final String value;
    private final String stateName;

    BrainStatus(String value, String stateName) {
        this.value = value;
        this.stateName = stateName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getStateName() {
        return stateName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == CANCELLED;
    }

    public static Optional<BrainStatus> fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equals(value))
                .findFirst();
    }
}

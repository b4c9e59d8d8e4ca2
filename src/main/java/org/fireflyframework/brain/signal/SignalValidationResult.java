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

/**
 * Outcome of checking a signal against the run's status.
 *
 * @param valid  whether the signal may be queued
 * @param reason machine-readable rejection reason, {@code null} when valid
 */
public record SignalValidationResult(boolean valid, String reason) {

    private static final SignalValidationResult VALID = new SignalValidationResult(true, null);

    public static SignalValidationResult accepted() {
        return VALID;
    }

    public static SignalValidationResult rejected(String reason) {
        return new SignalValidationResult(false, reason);
    }
}

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

package org.fireflyframework.brain.exception;

/**
 * Raised when a run's event log cannot be replayed into a consistent state.
 * <p>
 * Replay failures indicate a corrupted or partially written log. They are never
 * retried: guessing past a missing or malformed event would silently corrupt
 * every state derived from it.
 */
public class BrainReplayException extends BrainException {

    public BrainReplayException(String message) {
        super(message);
    }

    public BrainReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}

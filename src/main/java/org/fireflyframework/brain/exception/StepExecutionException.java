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
 * Exception thrown when a step or agent loop fails during a run.
 */
public class StepExecutionException extends BrainException {

    private final String stepId;

    public StepExecutionException(String stepId, String message, Throwable cause) {
        super("Step '" + stepId + "' execution failed: " + message, cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}

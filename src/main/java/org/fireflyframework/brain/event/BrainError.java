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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Serialized form of a failure recorded in the event log.
 *
 * @param name    the error name, usually the exception's simple class name
 * @param message the error message
 * @param stack   the stack trace, when available
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainError(String name, String message, String stack) {

    public static BrainError of(String name, String message) {
        return new BrainError(name, message, null);
    }

    public static BrainError from(Throwable error) {
        StringWriter trace = new StringWriter();
        error.printStackTrace(new PrintWriter(trace));
        return new BrainError(error.getClass().getSimpleName(), error.getMessage(), trace.toString());
    }
}

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

package org.fireflyframework.brain.webhook;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What happened to an inbound webhook delivery.
 */
public enum WebhookAction {

    /** A waiting run was found and woken. */
    RESUMED("resumed"),

    /** No run waits for the webhook. */
    NOT_FOUND("not_found"),

    /** Accepted for a user webhook no run waits for yet. */
    QUEUED("queued"),

    /** A run was found but cannot take the response. */
    IGNORED("ignored");

    private final String value;

    WebhookAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

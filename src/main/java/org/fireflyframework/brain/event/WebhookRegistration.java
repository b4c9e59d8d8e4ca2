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

/**
 * A webhook a suspended run waits for.
 *
 * @param slug       the webhook slug
 * @param identifier the identifier the webhook handler extracts from the request
 * @param token      the CSRF token expected from form submissions, or {@code null}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookRegistration(String slug, String identifier, String token) {

    public static WebhookRegistration of(String slug, String identifier) {
        return new WebhookRegistration(slug, identifier, null);
    }
}

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

/**
 * A registered webhook.
 *
 * @param slug        the path segment the webhook is served under
 * @param description human-readable description, may be {@code null}
 * @param handler     the request parser
 * @param system      whether this is an internal webhook served under {@code /system}
 */
public record WebhookDefinition(String slug, String description, WebhookHandler handler, boolean system) {

    public static WebhookDefinition user(String slug, String description, WebhookHandler handler) {
        return new WebhookDefinition(slug, description, handler, false);
    }

    public static WebhookDefinition system(String slug, String description, WebhookHandler handler) {
        return new WebhookDefinition(slug, description, handler, true);
    }
}

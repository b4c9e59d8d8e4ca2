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

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Inbound webhook as handed to a {@link WebhookHandler}.
 * <p>
 * Form submissions arrive already parsed into {@code body}, with the CSRF token removed.
 *
 * @param slug        the webhook slug
 * @param contentType the request content type, may be {@code null}
 * @param headers     request headers, first value per name
 * @param body        the parsed body; a null node when the request had none
 */
public record WebhookRequest(String slug, String contentType, Map<String, String> headers, JsonNode body) {
}

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

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Webhooks known to the engine, user and system webhooks in separate namespaces.
 */
@Slf4j
public class WebhookRegistry {

    private final Map<String, WebhookDefinition> userWebhooks = new ConcurrentHashMap<>();
    private final Map<String, WebhookDefinition> systemWebhooks = new ConcurrentHashMap<>();

    public WebhookRegistry register(WebhookDefinition definition) {
        Map<String, WebhookDefinition> target = definition.system() ? systemWebhooks : userWebhooks;
        if (target.putIfAbsent(definition.slug(), definition) != null) {
            throw new IllegalArgumentException("Webhook '" + definition.slug() + "' is already registered");
        }
        log.info("WEBHOOK_REGISTERED: slug={}, system={}", definition.slug(), definition.system());
        return this;
    }

    public Optional<WebhookDefinition> findUserWebhook(String slug) {
        return Optional.ofNullable(userWebhooks.get(slug));
    }

    public Optional<WebhookDefinition> findSystemWebhook(String slug) {
        return Optional.ofNullable(systemWebhooks.get(slug));
    }

    /**
     * User webhooks ordered by slug.
     */
    public List<WebhookDefinition> listUserWebhooks() {
        return userWebhooks.values().stream()
                .sorted(Comparator.comparing(WebhookDefinition::slug))
                .toList();
    }
}

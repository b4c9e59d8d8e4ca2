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

package org.fireflyframework.brain.rest;

import org.fireflyframework.brain.metrics.BrainMetrics;
import org.fireflyframework.brain.webhook.FormData;
import org.fireflyframework.brain.webhook.FormDataParser;
import org.fireflyframework.brain.webhook.WebhookAction;
import org.fireflyframework.brain.webhook.WebhookCoordinator;
import org.fireflyframework.brain.webhook.WebhookDefinition;
import org.fireflyframework.brain.webhook.WebhookHandlerResult;
import org.fireflyframework.brain.webhook.WebhookOutcome;
import org.fireflyframework.brain.webhook.WebhookRegistry;
import org.fireflyframework.brain.webhook.WebhookRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Receives webhook deliveries and hands them to the run waiting for them.
 * <p>
 * Callers always get {@code 200} with a {@link WebhookOutcome}, except for an unknown
 * slug ({@code 404}), an unreadable body ({@code 400}) and handler failures ({@code 500}).
 * For user webhooks a delivery nobody waits for is reported as {@code queued}.
 */
@Slf4j
@RestController
@RequestMapping("${firefly.brain.webhooks.base-path:/webhooks}")
public class WebhookController {

    private final WebhookRegistry webhookRegistry;
    private final WebhookCoordinator coordinator;
    private final ObjectMapper objectMapper;
    @Nullable
    private final BrainMetrics metrics;

    public WebhookController(WebhookRegistry webhookRegistry, WebhookCoordinator coordinator,
                             ObjectMapper objectMapper, @Nullable BrainMetrics metrics) {
        this.webhookRegistry = webhookRegistry;
        this.coordinator = coordinator;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * Lists the user webhooks.
     */
    @GetMapping
    public Mono<ResponseEntity<Map<String, Object>>> listWebhooks() {
        return Mono.fromSupplier(() -> {
            List<Map<String, String>> webhooks = webhookRegistry.listUserWebhooks().stream()
                    .map(webhook -> {
                        Map<String, String> entry = new LinkedHashMap<>();
                        entry.put("slug", webhook.slug());
                        entry.put("description", webhook.description());
                        return entry;
                    })
                    .toList();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("webhooks", webhooks);
            body.put("count", webhooks.size());
            return ResponseEntity.ok(body);
        });
    }

    @PostMapping("/{slug}")
    public Mono<ResponseEntity<Object>> receive(@PathVariable String slug, ServerHttpRequest request,
                                                @RequestBody(required = false) String body) {
        return dispatch(webhookRegistry.findUserWebhook(slug), slug, request, body, false);
    }

    @PostMapping("/system/{slug}")
    public Mono<ResponseEntity<Object>> receiveSystem(@PathVariable String slug, ServerHttpRequest request,
                                                      @RequestBody(required = false) String body) {
        return dispatch(webhookRegistry.findSystemWebhook(slug), slug, request, body, true);
    }

    private Mono<ResponseEntity<Object>> dispatch(Optional<WebhookDefinition> definition, String slug,
                                                  ServerHttpRequest request, String body, boolean system) {
        if (definition.isEmpty()) {
            log.warn("Webhook not found: slug={}, system={}", slug, system);
            return Mono.just(error(HttpStatus.NOT_FOUND, "Webhook '" + slug + "' not found"));
        }

        MediaType contentType = request.getHeaders().getContentType();
        JsonNode payload;
        String token = null;
        if (contentType != null && MediaType.APPLICATION_FORM_URLENCODED.includes(contentType)) {
            FormData form = FormDataParser.parse(body != null ? body : "");
            payload = form.data();
            token = form.token();
        } else {
            try {
                payload = body == null || body.isBlank() ? NullNode.getInstance() : objectMapper.readTree(body);
            } catch (JsonProcessingException e) {
                log.warn("Unreadable webhook body: slug={}: {}", slug, e.getOriginalMessage());
                return Mono.just(error(HttpStatus.BAD_REQUEST, "Invalid JSON body"));
            }
        }

        WebhookRequest webhookRequest = new WebhookRequest(slug,
                contentType != null ? contentType.toString() : null,
                request.getHeaders().toSingleValueMap(),
                payload);
        String submittedToken = token;

        return Mono.defer(() -> definition.get().handler().handle(webhookRequest))
                .flatMap(result -> {
                    if (result instanceof WebhookHandlerResult.Verification verification) {
                        log.debug("Webhook verification: slug={}", slug);
                        return Mono.just(ResponseEntity.<Object>ok(Map.of("challenge", verification.challenge())));
                    }
                    WebhookHandlerResult.Response response = (WebhookHandlerResult.Response) result;
                    return coordinator.queueWebhookAndWakeUp(slug, response.identifier(), response.response(),
                                    submittedToken)
                            .map(outcome -> !system && outcome.action() == WebhookAction.NOT_FOUND
                                    ? outcome.asQueued()
                                    : outcome)
                            .doOnNext(outcome -> {
                                if (metrics != null) {
                                    metrics.recordWebhook(slug, outcome);
                                }
                            })
                            .map(outcome -> ResponseEntity.<Object>ok(outcome));
                })
                .switchIfEmpty(Mono.fromSupplier(() -> ResponseEntity.<Object>ok(
                        WebhookOutcome.ignored(null, null, "Webhook handler returned no response"))))
                .onErrorResume(e -> {
                    log.error("Failed to process webhook: slug={}: {}", slug, e.getMessage(), e);
                    return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process webhook"));
                });
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}

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

import org.fireflyframework.brain.exception.BrainException;
import org.fireflyframework.brain.patch.JsonPatchOperation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BrainEventCodec}.
 */
class BrainEventCodecTest {

    private final BrainEventCodec codec = new BrainEventCodec();

    @Test
    @DisplayName("should write the wire name as the type property")
    void encode_shouldWriteWireName() throws Exception {
        BrainEvent event = StepCompleteEvent.builder()
                .brainRunId("run-1")
                .timestamp(Instant.parse("2026-01-01T00:00:00Z"))
                .stepId("step-1")
                .stepTitle("Fetch")
                .patch(List.of(JsonPatchOperation.add("/a", JsonNodeFactory.instance.numberNode(1))))
                .build();

        JsonNode json = codec.getObjectMapper().readTree(codec.encode(event));

        assertThat(json.get("type").asText()).isEqualTo("step:complete");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-01-01T00:00:00Z");
        assertThat(json.get("patch").get(0).get("op").asText()).isEqualTo("add");
    }

    @Test
    @DisplayName("should decode every event type from its wire form")
    void decode_shouldResolveConcreteTypes() {
        ObjectNode initial = JsonNodeFactory.instance.objectNode().put("x", 1);
        BrainEvent start = BrainStartEvent.builder()
                .brainRunId("run-1")
                .brainTitle("demo")
                .initialState(initial)
                .build();
        BrainEvent webhook = WebhookEvent.builder()
                .brainRunId("run-1")
                .waitFor(List.of(new WebhookRegistration("approve", "id-1", "secret")))
                .timeout(30_000L)
                .build();

        BrainEvent decodedStart = codec.decode(codec.encode(start));
        BrainEvent decodedWebhook = codec.decode(codec.encode(webhook));

        assertThat(decodedStart).isInstanceOf(BrainStartEvent.class);
        assertThat(((BrainStartEvent) decodedStart).getInitialState()).isEqualTo(initial);
        assertThat(decodedWebhook).isInstanceOf(WebhookEvent.class);
        assertThat(((WebhookEvent) decodedWebhook).getWaitFor())
                .containsExactly(new WebhookRegistration("approve", "id-1", "secret"));
        assertThat(((WebhookEvent) decodedWebhook).getTimeout()).isEqualTo(30_000L);
    }

    @Test
    @DisplayName("should ignore unknown properties")
    void decode_shouldIgnoreUnknownProperties() {
        BrainEvent event = codec.decode("{\"type\":\"brain:paused\",\"brainRunId\":\"r\",\"extra\":true}");

        assertThat(event.getEventType()).isEqualTo(BrainEventType.PAUSED);
        assertThat(event.getBrainRunId()).isEqualTo("r");
    }

    @Test
    @DisplayName("should fail on an unknown type")
    void decode_shouldFailOnUnknownType() {
        assertThatThrownBy(() -> codec.decode("{\"type\":\"brain:unknown\"}"))
                .isInstanceOf(BrainException.class);
    }

    @Test
    @DisplayName("should map wire names back to event types")
    void fromWireName_shouldResolveTypes() {
        assertThat(BrainEventType.fromWireName("agent:tool_result")).contains(BrainEventType.AGENT_TOOL_RESULT);
        assertThat(BrainEventType.fromWireName("nope")).isEmpty();
        assertThat(BrainEventType.CANCELLED.isTerminal()).isTrue();
        assertThat(BrainEventType.PAUSED.isTerminal()).isFalse();
    }
}

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

/**
 * Base class of every event in a run's log.
 * <p>
 * Events are immutable once built. The concrete class is carried on the wire in the
 * {@code type} property using the names listed in {@link BrainEventType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(BrainStartEvent.class),
        @JsonSubTypes.Type(BrainRestartEvent.class),
        @JsonSubTypes.Type(BrainCompleteEvent.class),
        @JsonSubTypes.Type(BrainErrorEvent.class),
        @JsonSubTypes.Type(BrainCancelledEvent.class),
        @JsonSubTypes.Type(BrainPausedEvent.class),
        @JsonSubTypes.Type(BrainResumedEvent.class),
        @JsonSubTypes.Type(StepStatusEvent.class),
        @JsonSubTypes.Type(StepStartEvent.class),
        @JsonSubTypes.Type(StepCompleteEvent.class),
        @JsonSubTypes.Type(StepRetryEvent.class),
        @JsonSubTypes.Type(WebhookEvent.class),
        @JsonSubTypes.Type(WebhookResponseEvent.class),
        @JsonSubTypes.Type(AgentStartEvent.class),
        @JsonSubTypes.Type(AgentIterationEvent.class),
        @JsonSubTypes.Type(AgentToolCallEvent.class),
        @JsonSubTypes.Type(AgentToolResultEvent.class),
        @JsonSubTypes.Type(AgentAssistantMessageEvent.class),
        @JsonSubTypes.Type(AgentWebhookEvent.class),
        @JsonSubTypes.Type(AgentCompleteEvent.class),
        @JsonSubTypes.Type(AgentTokenLimitEvent.class)
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@SuperBuilder
@Getter
@NoArgsConstructor
@AllArgsConstructor
public abstract class BrainEvent {

    /**
     * The run this event belongs to.
     */
    private String brainRunId;

    /**
     * When the event was produced.
     */
    private Instant timestamp;

    @JsonIgnore
    public abstract BrainEventType getEventType();
}

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

import org.fireflyframework.brain.core.BrainDefinition;
import org.fireflyframework.brain.core.StepBlock;
import org.fireflyframework.brain.core.StepResult;
import org.fireflyframework.brain.exception.BrainNotFoundException;
import org.fireflyframework.brain.exception.BrainRunNotFoundException;
import org.fireflyframework.brain.exception.SignalRejectedException;
import org.fireflyframework.brain.rest.dto.BrainSummaryResponse;
import org.fireflyframework.brain.rest.dto.SendSignalRequest;
import org.fireflyframework.brain.rest.dto.StartRunRequest;
import org.fireflyframework.brain.rest.dto.StartRunResponse;
import org.fireflyframework.brain.service.BrainRunService;
import org.fireflyframework.brain.signal.SignalType;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BrainRunController.
 */
@ExtendWith(MockitoExtension.class)
class BrainRunControllerTest {

    @Mock
    private BrainRunService runService;

    private BrainRunController controller;

    @BeforeEach
    void setUp() {
        controller = new BrainRunController(runService);
    }

    @Test
    void shouldListBrainsWithTheirBlockTitles() {
        BrainDefinition brain = BrainDefinition.builder()
                .title("greeter")
                .description("Says hello")
                .block(StepBlock.of("Greet", context -> Mono.just(StepResult.of(context.state()))))
                .build();
        when(runService.listBrains()).thenReturn(List.of(brain));

        StepVerifier.create(controller.listBrains())
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
                    assertThat(response.getBody())
                            .containsExactly(new BrainSummaryResponse("greeter", "Says hello", List.of("Greet")));
                })
                .verifyComplete();
    }

    @Test
    void shouldStartRun() {
        ObjectNode state = JsonNodeFactory.instance.objectNode().put("name", "ada");
        when(runService.startRun("greeter", state)).thenReturn(Mono.just("run-1"));

        StepVerifier.create(controller.startRun(new StartRunRequest("greeter", state)))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
                    assertThat(response.getBody()).isEqualTo(new StartRunResponse("run-1"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundWhenStartingUnknownBrain() {
        when(runService.startRun(eq("unknown"), any())).thenReturn(Mono.error(new BrainNotFoundException("unknown")));

        StepVerifier.create(controller.startRun(new StartRunRequest("unknown", null)))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(response.getBody()).isEqualTo(Map.of("error", "Brain 'unknown' not found"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnBadRequestForInvalidInitialState() {
        when(runService.startRun(eq("greeter"), any()))
                .thenReturn(Mono.error(new IllegalArgumentException("initialState must be a JSON object")));

        StepVerifier.create(controller.startRun(new StartRunRequest("greeter", JsonNodeFactory.instance.textNode("x"))))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownRun() {
        when(runService.getRun("missing")).thenReturn(Mono.error(new BrainRunNotFoundException("missing")));

        StepVerifier.create(controller.getRun("missing"))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                .verifyComplete();
    }

    @Test
    void shouldReturnCurrentStateWhenNoIndexIsGiven() {
        ObjectNode state = JsonNodeFactory.instance.objectNode().put("done", true);
        when(runService.getStateAt("run-1", Integer.MAX_VALUE)).thenReturn(Mono.just(state));

        StepVerifier.create(controller.getState("run-1", null))
                .assertNext(response -> assertThat(response.getBody()).isEqualTo(state))
                .verifyComplete();
    }

    @Test
    void shouldAcceptSignal() {
        when(runService.sendSignal("run-1", SignalType.PAUSE)).thenReturn(Mono.empty());

        StepVerifier.create(controller.sendSignal("run-1", new SendSignalRequest("PAUSE")))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED))
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownSignalType() {
        StepVerifier.create(controller.sendSignal("run-1", new SendSignalRequest("EXPLODE")))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                .verifyComplete();
        verifyNoInteractions(runService);
    }

    @Test
    void shouldReturnConflictForRejectedSignal() {
        when(runService.kill("run-1"))
                .thenReturn(Mono.error(new SignalRejectedException("Cannot KILL brain in 'complete' state")));

        StepVerifier.create(controller.killRun("run-1"))
                .assertNext(response -> {
                    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(response.getBody()).isEqualTo(Map.of("error", "Cannot KILL brain in 'complete' state"));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNoContentAfterKill() {
        when(runService.kill("run-1")).thenReturn(Mono.empty());

        StepVerifier.create(controller.killRun("run-1"))
                .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT))
                .verifyComplete();
    }
}

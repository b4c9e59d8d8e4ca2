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

import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.exception.BrainNotFoundException;
import org.fireflyframework.brain.exception.BrainRunNotFoundException;
import org.fireflyframework.brain.exception.SignalRejectedException;
import org.fireflyframework.brain.monitor.BrainRunSummary;
import org.fireflyframework.brain.rest.dto.BrainSummaryResponse;
import org.fireflyframework.brain.rest.dto.SendSignalRequest;
import org.fireflyframework.brain.rest.dto.StartRunRequest;
import org.fireflyframework.brain.rest.dto.StartRunResponse;
import org.fireflyframework.brain.service.BrainRunService;
import org.fireflyframework.brain.service.BrainRunView;
import org.fireflyframework.brain.signal.SignalType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for brain runs.
 * <p>
 * A thin layer over {@link BrainRunService}: starting runs, reading their state and
 * event log, and sending control signals.
 */
@Slf4j
@RestController
@RequestMapping("${firefly.brain.api.base-path:/brains}")
public class BrainRunController {

    private final BrainRunService runService;

    public BrainRunController(BrainRunService runService) {
        this.runService = runService;
    }

    /**
     * Lists the registered brains.
     */
    @GetMapping
    public Mono<ResponseEntity<List<BrainSummaryResponse>>> listBrains() {
        return Mono.fromSupplier(() -> ResponseEntity.ok(runService.listBrains().stream()
                .map(BrainSummaryResponse::from)
                .toList()));
    }

    /**
     * Starts a new run.
     */
    @PostMapping("/runs")
    public Mono<ResponseEntity<Object>> startRun(@Valid @RequestBody StartRunRequest request) {
        log.info("Starting brain run via API: brain={}", request.getBrainTitle());

        return runService.startRun(request.getBrainTitle(), request.getInitialState())
                .map(runId -> ResponseEntity.status(HttpStatus.CREATED).<Object>body(new StartRunResponse(runId)))
                .onErrorResume(BrainNotFoundException.class, e ->
                        Mono.just(error(HttpStatus.NOT_FOUND, e.getMessage())))
                .onErrorResume(IllegalArgumentException.class, e ->
                        Mono.just(error(HttpStatus.BAD_REQUEST, e.getMessage())));
    }

    /**
     * Lists runs known to the monitor.
     */
    @GetMapping("/runs")
    public Mono<ResponseEntity<List<BrainRunSummary>>> listRuns() {
        return runService.listRuns()
                .collectList()
                .map(ResponseEntity::ok);
    }

    @GetMapping("/runs/{brainRunId}")
    public Mono<ResponseEntity<BrainRunView>> getRun(@PathVariable String brainRunId) {
        return runService.getRun(brainRunId)
                .map(ResponseEntity::ok)
                .onErrorResume(BrainRunNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * The full event log of a run, oldest first.
     */
    @GetMapping("/runs/{brainRunId}/events")
    public Mono<ResponseEntity<List<BrainEvent>>> getEvents(@PathVariable String brainRunId) {
        return runService.getEvents(brainRunId)
                .collectList()
                .map(ResponseEntity::ok)
                .onErrorResume(BrainRunNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * The state of a run right after the event at {@code at}, or its current state.
     */
    @GetMapping("/runs/{brainRunId}/state")
    public Mono<ResponseEntity<ObjectNode>> getState(@PathVariable String brainRunId,
                                                     @RequestParam(name = "at", required = false) Integer at) {
        return runService.getStateAt(brainRunId, at != null ? at : Integer.MAX_VALUE)
                .map(ResponseEntity::ok)
                .onErrorResume(BrainRunNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()));
    }

    /**
     * Kills a run.
     */
    @DeleteMapping("/runs/{brainRunId}")
    public Mono<ResponseEntity<Object>> killRun(@PathVariable String brainRunId) {
        log.info("Killing brain run via API: runId={}", brainRunId);
        return signalResponse(runService.kill(brainRunId), HttpStatus.NO_CONTENT);
    }

    /**
     * Sends {@code KILL}, {@code PAUSE} or {@code RESUME} to a run.
     */
    @PostMapping("/runs/{brainRunId}/signals")
    public Mono<ResponseEntity<Object>> sendSignal(@PathVariable String brainRunId,
                                                   @Valid @RequestBody SendSignalRequest request) {
        Optional<SignalType> type = SignalType.fromValue(request.getType());
        if (type.isEmpty()) {
            return Mono.just(error(HttpStatus.BAD_REQUEST, "Unknown signal type: " + request.getType()));
        }
        log.info("Sending signal via API: runId={}, signal={}", brainRunId, type.get());
        return signalResponse(runService.sendSignal(brainRunId, type.get()), HttpStatus.ACCEPTED);
    }

    private Mono<ResponseEntity<Object>> signalResponse(Mono<Void> signal, HttpStatus success) {
        return signal
                .then(Mono.fromSupplier(() -> ResponseEntity.status(success).build()))
                .onErrorResume(BrainRunNotFoundException.class, e ->
                        Mono.just(ResponseEntity.notFound().build()))
                .onErrorResume(SignalRejectedException.class, e ->
                        Mono.just(error(HttpStatus.CONFLICT, e.getMessage())))
                .onErrorResume(IllegalArgumentException.class, e ->
                        Mono.just(error(HttpStatus.BAD_REQUEST, e.getMessage())));
    }

    private static ResponseEntity<Object> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}

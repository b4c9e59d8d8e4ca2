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

package org.fireflyframework.brain.core;

import org.fireflyframework.brain.event.AgentAssistantMessageEvent;
import org.fireflyframework.brain.event.AgentCompleteEvent;
import org.fireflyframework.brain.event.AgentIterationEvent;
import org.fireflyframework.brain.event.AgentStartEvent;
import org.fireflyframework.brain.event.AgentTokenLimitEvent;
import org.fireflyframework.brain.event.AgentToolCallEvent;
import org.fireflyframework.brain.event.AgentToolResultEvent;
import org.fireflyframework.brain.event.AgentWebhookEvent;
import org.fireflyframework.brain.event.BrainCancelledEvent;
import org.fireflyframework.brain.event.BrainCompleteEvent;
import org.fireflyframework.brain.event.BrainError;
import org.fireflyframework.brain.event.BrainErrorEvent;
import org.fireflyframework.brain.event.BrainEvent;
import org.fireflyframework.brain.event.BrainPausedEvent;
import org.fireflyframework.brain.event.BrainRestartEvent;
import org.fireflyframework.brain.event.BrainResumedEvent;
import org.fireflyframework.brain.event.BrainStartEvent;
import org.fireflyframework.brain.event.StepCompleteEvent;
import org.fireflyframework.brain.event.StepRetryEvent;
import org.fireflyframework.brain.event.StepStartEvent;
import org.fireflyframework.brain.event.StepStatus;
import org.fireflyframework.brain.event.StepStatusEvent;
import org.fireflyframework.brain.event.ToolCall;
import org.fireflyframework.brain.event.WebhookEvent;
import org.fireflyframework.brain.event.WebhookRegistration;
import org.fireflyframework.brain.event.WebhookResponseEvent;
import org.fireflyframework.brain.exception.BrainException;
import org.fireflyframework.brain.exception.StepExecutionException;
import org.fireflyframework.brain.page.PageService;
import org.fireflyframework.brain.patch.JsonPatches;
import org.fireflyframework.brain.replay.AgentContextReconstructor;
import org.fireflyframework.brain.replay.AgentMessage;
import org.fireflyframework.brain.replay.AgentResumeContext;
import org.fireflyframework.brain.replay.StateReconstructor;
import org.fireflyframework.brain.resilience.ConcurrencyLimiter;
import org.fireflyframework.brain.resilience.RetryExecutor;
import org.fireflyframework.brain.resilience.RetryOptions;
import org.fireflyframework.brain.signal.BrainSignal;
import org.fireflyframework.brain.signal.SignalFilter;
import org.fireflyframework.brain.signal.SignalQueue;
import org.fireflyframework.brain.signal.SignalType;
import org.fireflyframework.brain.timeout.WebhookTimeoutAdapter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Executes brains as streams of events.
 * <p>
 * The runner holds no state between calls: everything it needs to continue a run is
 * passed in, and everything it does is reported as an event. It stops emitting when the
 * brain completes, fails, is paused or cancelled, or starts waiting for a webhook.
 * Control signals are consumed before every block and every agent iteration, so
 * cancellation is cooperative.
 */
@Slf4j
public class BrainRunner {

    private final SignalQueue signalQueue;
    private final RetryExecutor retryExecutor;
    private final ConcurrencyLimiter modelLimiter;
    private final AgentModelClient modelClient;
    private final PageService pageService;
    private final Clock clock;
    private final RetryOptions defaultRetry;
    private final int defaultMaxIterations;

    /**
     * @param modelClient the model behind agent loops, or {@code null} when no brain uses one
     * @param pageService page publishing offered to steps, or {@code null}
     */
    public BrainRunner(SignalQueue signalQueue, RetryExecutor retryExecutor, ConcurrencyLimiter modelLimiter,
                       AgentModelClient modelClient, PageService pageService, Clock clock,
                       RetryOptions defaultRetry, int defaultMaxIterations) {
        this.signalQueue = signalQueue;
        this.retryExecutor = retryExecutor;
        this.modelLimiter = modelLimiter;
        this.modelClient = modelClient;
        this.pageService = pageService;
        this.clock = clock;
        this.defaultRetry = defaultRetry;
        this.defaultMaxIterations = defaultMaxIterations;
    }

    // ==================== Entry Points ====================

    /**
     * Runs a brain from its first block.
     */
    public Flux<BrainEvent> run(BrainDefinition brain, String brainRunId, ObjectNode initialState) {
        return Flux.defer(() -> {
            ObjectNode state = initialState != null ? initialState.deepCopy() : JsonNodeFactory.instance.objectNode();
            Execution execution = new Execution(brain, brainRunId, state);
            log.info("BRAIN_START: runId={}, brain={}", brainRunId, brain.title());

            BrainEvent start = BrainStartEvent.builder()
                    .brainRunId(brainRunId)
                    .timestamp(clock.instant())
                    .brainTitle(brain.title())
                    .brainDescription(brain.description())
                    .initialState(state.deepCopy())
                    .build();
            return Flux.concat(Flux.just(start), runBlocks(execution, 0, null), finish(execution));
        });
    }

    /**
     * Continues a suspended run from its log.
     * <p>
     * Emits {@code WEBHOOK_RESPONSE} (or {@code RESUMED} when {@code trigger} is a resume
     * signal) and {@code RESTART} with the reconstructed state, then goes on with the
     * first block that has not completed. An agent loop that was waiting on a tool call
     * gets the webhook response as the result of that call.
     */
    public Flux<BrainEvent> resume(BrainDefinition brain, String brainRunId, List<BrainEvent> events,
                                   BrainSignal trigger) {
        return Flux.defer(() -> {
            ObjectNode state = StateReconstructor.reconstructCurrentState(events);
            Execution execution = new Execution(brain, brainRunId, state);
            int index = firstIncompleteBlock(brain, events);
            JsonNode response = trigger.type() == SignalType.WEBHOOK_RESPONSE ? trigger.response() : null;
            log.info("BRAIN_RESUME: runId={}, brain={}, trigger={}, block={}",
                    brainRunId, brain.title(), trigger.type(), BrainDefinition.stepId(index));

            BrainEvent resumed = response != null
                    ? WebhookResponseEvent.builder()
                    .brainRunId(brainRunId)
                    .timestamp(clock.instant())
                    .response(response)
                    .build()
                    : BrainResumedEvent.builder()
                    .brainRunId(brainRunId)
                    .timestamp(clock.instant())
                    .brainTitle(brain.title())
                    .brainDescription(brain.description())
                    .build();
            BrainEvent restart = BrainRestartEvent.builder()
                    .brainRunId(brainRunId)
                    .timestamp(clock.instant())
                    .brainTitle(brain.title())
                    .brainDescription(brain.description())
                    .initialState(state.deepCopy())
                    .build();

            Flux<BrainEvent> body = runBlocks(execution, index, response);
            if (response != null && index < brain.blocks().size()
                    && brain.blocks().get(index) instanceof AgentBlock agent) {
                AgentResumeContext context = AgentContextReconstructor.reconstructAgentContext(events, response);
                if (context != null && BrainDefinition.stepId(index).equals(context.stepId())) {
                    body = Flux.concat(
                            runAgent(execution, index, agent, context),
                            Flux.defer(() -> execution.stopped ? Flux.empty() : runBlocks(execution, index + 1, null)));
                }
            }
            return Flux.concat(Flux.just(resumed, restart), body, finish(execution));
        });
    }

    /**
     * Cancels a run that is not executing, such as one waiting for a webhook or paused.
     */
    public Flux<BrainEvent> cancel(BrainDefinition brain, String brainRunId, BrainSignal kill) {
        return Flux.defer(() -> Flux.just(cancelled(new Execution(brain, brainRunId, null), kill)));
    }

    // ==================== Blocks ====================

    private Flux<BrainEvent> runBlocks(Execution execution, int index, JsonNode webhookResponse) {
        if (index >= execution.brain.blocks().size()) {
            return Flux.empty();
        }
        return checkControlSignals(execution).flatMapMany(control -> {
            if (control.isPresent()) {
                execution.stopped = true;
                return Flux.just(control.get());
            }
            BrainBlock block = execution.brain.blocks().get(index);
            Flux<BrainEvent> blockEvents = block instanceof AgentBlock agent
                    ? runAgent(execution, index, agent, null)
                    : runStep(execution, index, (StepBlock) block, webhookResponse);
            return Flux.concat(
                    Flux.just(stepStatus(execution, index)),
                    blockEvents,
                    Flux.defer(() -> execution.stopped ? Flux.empty() : runBlocks(execution, index + 1, null)));
        });
    }

    private Flux<BrainEvent> runStep(Execution execution, int index, StepBlock step, JsonNode webhookResponse) {
        String stepId = BrainDefinition.stepId(index);
        RetryOptions retry = step.retry() != null ? step.retry() : defaultRetry;

        return Flux.<BrainEvent>create(sink -> {
            sink.next(StepStartEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(stepId)
                    .stepTitle(step.title())
                    .build());

            Disposable running = retryExecutor.executeWithRetry(
                            execution.runId + ":" + stepId,
                            () -> {
                                StepContext context = context(execution, stepId, step.title(), webhookResponse);
                                return step.action().execute(context)
                                        .switchIfEmpty(Mono.fromSupplier(() -> StepResult.of(context.state())));
                            },
                            retry,
                            (retryNumber, error, delay) -> sink.next(StepRetryEvent.builder()
                                    .brainRunId(execution.runId)
                                    .timestamp(clock.instant())
                                    .stepId(stepId)
                                    .stepTitle(step.title())
                                    .error(BrainError.from(error))
                                    .attempt(retryNumber)
                                    .build()))
                    .subscribe(result -> {
                        completeStep(execution, stepId, step.title(), result).forEach(sink::next);
                        sink.complete();
                    }, sink::error);
            sink.onDispose(running);
        }).onErrorResume(error -> failStep(execution, stepId, error));
    }

    private List<BrainEvent> completeStep(Execution execution, String stepId, String title, StepResult result) {
        ObjectNode next = result.state() != null ? result.state() : execution.state;
        List<BrainEvent> events = new ArrayList<>();
        events.add(StepCompleteEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .stepId(stepId)
                .stepTitle(title)
                .patch(JsonPatches.diff(execution.state, next))
                .build());
        execution.state = next.deepCopy();
        log.debug("STEP_COMPLETE: runId={}, stepId={}", execution.runId, stepId);

        if (result.isWaiting()) {
            execution.stopped = true;
            events.add(webhook(execution, result.waitFor(), result.timeout()));
        }
        return events;
    }

    private Flux<BrainEvent> failStep(Execution execution, String stepId, Throwable error) {
        if (error instanceof StepExecutionException) {
            return Flux.error(error);
        }
        execution.stopped = true;
        log.error("STEP_FAILED: runId={}, stepId={}: {}", execution.runId, stepId, error.getMessage());
        BrainEvent failed = BrainErrorEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .brainTitle(execution.brain.title())
                .brainDescription(execution.brain.description())
                .error(BrainError.from(error))
                .build();
        return Flux.concat(Flux.just(failed),
                Flux.error(new StepExecutionException(stepId, error.getMessage(), error)));
    }

    // ==================== Agent Loop ====================

    private Flux<BrainEvent> runAgent(Execution execution, int index, AgentBlock block, AgentResumeContext resume) {
        String stepId = BrainDefinition.stepId(index);
        return Flux.defer(() -> {
            if (modelClient == null) {
                return Flux.<BrainEvent>error(new BrainException(
                        "No AgentModelClient configured for agent step '" + block.title() + "'"));
            }
            AgentRun run = new AgentRun(execution, stepId, block.title(), block.config());
            if (resume == null) {
                String prompt = block.config().prompt().apply(execution.state);
                run.messages.add(AgentMessage.user(prompt));
                BrainEvent stepStart = StepStartEvent.builder()
                        .brainRunId(execution.runId)
                        .timestamp(clock.instant())
                        .stepId(stepId)
                        .stepTitle(block.title())
                        .build();
                BrainEvent agentStart = AgentStartEvent.builder()
                        .brainRunId(execution.runId)
                        .timestamp(clock.instant())
                        .stepId(stepId)
                        .stepTitle(block.title())
                        .prompt(prompt)
                        .system(block.config().system())
                        .build();
                return Flux.concat(Flux.just(stepStart, agentStart), iterate(run, 1));
            }

            // the reconstructed conversation already ends with the answer to the pending call
            run.messages.addAll(resume.messages());
            BrainEvent answered = AgentToolResultEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(stepId)
                    .stepTitle(block.title())
                    .toolName(resume.pendingToolName())
                    .toolCallId(resume.pendingToolCallId())
                    .result(resume.webhookResponse())
                    .build();
            return Flux.concat(Flux.just(answered), iterate(run, resume.iterations() + 1));
        }).onErrorResume(error -> failStep(execution, stepId, error));
    }

    private Flux<BrainEvent> iterate(AgentRun run, int iteration) {
        Execution execution = run.execution;
        return checkControlSignals(execution).flatMapMany(control -> {
            if (control.isPresent()) {
                execution.stopped = true;
                return Flux.just(control.get());
            }
            if (iteration > run.maxIterations) {
                log.warn("AGENT_MAX_ITERATIONS: runId={}, stepId={}, maxIterations={}",
                        execution.runId, run.stepId, run.maxIterations);
                return completeAgent(run, null);
            }

            AgentModelRequest request = new AgentModelRequest(
                    run.config.system(), List.copyOf(run.messages), run.config.tools());
            Mono<AgentModelResponse> call = modelLimiter.limit(retryExecutor.executeWithRetry(
                    execution.runId + ":" + run.stepId + ":model",
                    () -> modelClient.generate(request),
                    run.retry));

            BrainEvent iterationEvent = AgentIterationEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(run.stepId)
                    .stepTitle(run.title)
                    .iteration(iteration)
                    .build();
            return Flux.concat(Flux.just(iterationEvent),
                    call.flatMapMany(response -> handleResponse(run, iteration, response)));
        });
    }

    private Flux<BrainEvent> handleResponse(AgentRun run, int iteration, AgentModelResponse response) {
        Execution execution = run.execution;
        run.totalTokens += response.tokensUsed();
        run.messages.add(AgentMessage.assistant(response.content(), response.toolCalls(), response.providerMetadata()));

        BrainEvent assistant = AgentAssistantMessageEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .stepId(run.stepId)
                .stepTitle(run.title)
                .content(response.content())
                .toolCalls(response.toolCalls())
                .providerMetadata(response.providerMetadata())
                .build();

        Long maxTokens = run.config.maxTokens();
        if (maxTokens != null && run.totalTokens > maxTokens) {
            log.warn("AGENT_TOKEN_LIMIT: runId={}, stepId={}, totalTokens={}, maxTokens={}",
                    execution.runId, run.stepId, run.totalTokens, maxTokens);
            BrainEvent limit = AgentTokenLimitEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(run.stepId)
                    .stepTitle(run.title)
                    .totalTokens(run.totalTokens)
                    .maxTokens(maxTokens)
                    .build();
            return Flux.concat(Flux.just(assistant, limit), completeAgent(run, null));
        }
        if (response.toolCalls().isEmpty()) {
            return Flux.concat(Flux.just(assistant), completeAgent(run, null));
        }
        return Flux.concat(Flux.just(assistant), processToolCalls(run, iteration, response.toolCalls(), 0, null));
    }

    /**
     * Runs the tool calls of one assistant turn in order. Calls that wait for a webhook
     * do not stop the others; the loop suspends after the turn, on the first waiting call.
     */
    private Flux<BrainEvent> processToolCalls(AgentRun run, int iteration, List<ToolCall> calls, int index,
                                              PendingCall pending) {
        return Flux.defer(() -> {
            if (index >= calls.size()) {
                return pending != null ? suspendAgent(run, pending) : iterate(run, iteration + 1);
            }
            Execution execution = run.execution;
            ToolCall call = calls.get(index);
            BrainEvent callEvent = AgentToolCallEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(run.stepId)
                    .stepTitle(run.title)
                    .toolName(call.toolName())
                    .toolCallId(call.toolCallId())
                    .input(call.input())
                    .build();

            Optional<AgentTool> found = run.config.findTool(call.toolName());
            if (found.isEmpty()) {
                return Flux.concat(Flux.just(callEvent),
                        Flux.error(new BrainException("Unknown tool: " + call.toolName())));
            }
            AgentTool tool = found.get();
            if (tool.terminal()) {
                BrainEvent complete = AgentCompleteEvent.builder()
                        .brainRunId(execution.runId)
                        .timestamp(clock.instant())
                        .stepId(run.stepId)
                        .stepTitle(run.title)
                        .terminalToolName(tool.name())
                        .result(call.input())
                        .totalIterations(iteration)
                        .build();
                return Flux.concat(Flux.just(callEvent, complete), completeAgent(run, call.input()));
            }

            StepContext context = context(execution, run.stepId, run.title, null);
            Mono<ToolOutcome> outcome = Mono.defer(() -> tool.executor().execute(call.input(), context))
                    .defaultIfEmpty(ToolOutcome.result(NullNode.getInstance()));
            return Flux.concat(Flux.just(callEvent), outcome.flatMapMany(result -> {
                if (result.isWaiting()) {
                    if (pending != null) {
                        log.warn("AGENT_WAIT_IGNORED: runId={}, stepId={}, toolCallId={}, pendingToolCallId={}",
                                execution.runId, run.stepId, call.toolCallId(), pending.call.toolCallId());
                        return processToolCalls(run, iteration, calls, index + 1, pending);
                    }
                    return processToolCalls(run, iteration, calls, index + 1, new PendingCall(call, result));
                }
                run.messages.add(AgentMessage.toolResult(call.toolCallId(), call.toolName(), result.result()));
                BrainEvent resultEvent = AgentToolResultEvent.builder()
                        .brainRunId(execution.runId)
                        .timestamp(clock.instant())
                        .stepId(run.stepId)
                        .stepTitle(run.title)
                        .toolName(call.toolName())
                        .toolCallId(call.toolCallId())
                        .result(result.result())
                        .build();
                return Flux.concat(Flux.just(resultEvent),
                        processToolCalls(run, iteration, calls, index + 1, pending));
            }));
        });
    }

    private Flux<BrainEvent> suspendAgent(AgentRun run, PendingCall pending) {
        Execution execution = run.execution;
        execution.stopped = true;
        log.info("AGENT_WAITING: runId={}, stepId={}, toolCallId={}, tool={}",
                execution.runId, run.stepId, pending.call.toolCallId(), pending.call.toolName());
        BrainEvent agentWebhook = AgentWebhookEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .stepId(run.stepId)
                .stepTitle(run.title)
                .toolCallId(pending.call.toolCallId())
                .toolName(pending.call.toolName())
                .input(pending.call.input())
                .build();
        return Flux.just(agentWebhook, webhook(execution, pending.outcome.waitFor(), pending.outcome.timeout()));
    }

    /**
     * Ends the loop with a {@code STEP_COMPLETE}. A {@code null} result leaves the state as it is.
     */
    private Flux<BrainEvent> completeAgent(AgentRun run, JsonNode result) {
        return Flux.defer(() -> {
            Execution execution = run.execution;
            ObjectNode next = execution.state.deepCopy();
            if (result != null && !result.isNull()) {
                if (run.config.resultKey() != null) {
                    next.set(run.config.resultKey(), result.deepCopy());
                } else if (result.isObject()) {
                    next.setAll((ObjectNode) result.deepCopy());
                }
            }
            BrainEvent complete = StepCompleteEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .stepId(run.stepId)
                    .stepTitle(run.title)
                    .patch(JsonPatches.diff(execution.state, next))
                    .build();
            execution.state = next;
            log.debug("AGENT_COMPLETE: runId={}, stepId={}, totalTokens={}",
                    execution.runId, run.stepId, run.totalTokens);
            return Flux.just(complete);
        });
    }

    // ==================== Helpers ====================

    private Mono<Optional<BrainEvent>> checkControlSignals(Execution execution) {
        return signalQueue.getAndConsumeSignals(execution.runId, SignalFilter.CONTROL)
                .map(signals -> {
                    Optional<BrainSignal> kill = signals.stream()
                            .filter(signal -> signal.type() == SignalType.KILL)
                            .findFirst();
                    if (kill.isPresent()) {
                        return Optional.of(cancelled(execution, kill.get()));
                    }
                    if (signals.stream().anyMatch(signal -> signal.type() == SignalType.PAUSE)) {
                        log.info("BRAIN_PAUSED: runId={}", execution.runId);
                        return Optional.<BrainEvent>of(BrainPausedEvent.builder()
                                .brainRunId(execution.runId)
                                .timestamp(clock.instant())
                                .brainTitle(execution.brain.title())
                                .brainDescription(execution.brain.description())
                                .build());
                    }
                    return Optional.<BrainEvent>empty();
                });
    }

    private BrainEvent cancelled(Execution execution, BrainSignal kill) {
        boolean timedOut = BrainSignal.REASON_TIMEOUT.equals(kill.reason());
        log.info("BRAIN_CANCELLED: runId={}, reason={}", execution.runId, kill.reason());
        return BrainCancelledEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .brainTitle(execution.brain.title())
                .brainDescription(execution.brain.description())
                .error(timedOut ? WebhookTimeoutAdapter.timeoutError() : null)
                .build();
    }

    private Flux<BrainEvent> finish(Execution execution) {
        return Flux.defer(() -> {
            if (execution.stopped) {
                return Flux.empty();
            }
            log.info("BRAIN_COMPLETE: runId={}, brain={}", execution.runId, execution.brain.title());
            return Flux.<BrainEvent>just(BrainCompleteEvent.builder()
                    .brainRunId(execution.runId)
                    .timestamp(clock.instant())
                    .brainTitle(execution.brain.title())
                    .brainDescription(execution.brain.description())
                    .build());
        });
    }

    private BrainEvent stepStatus(Execution execution, int current) {
        List<BrainBlock> blocks = execution.brain.blocks();
        List<StepStatus> steps = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            String status = i < current ? StepStatus.COMPLETE : i == current ? StepStatus.RUNNING : StepStatus.PENDING;
            steps.add(new StepStatus(BrainDefinition.stepId(i), blocks.get(i).title(), status));
        }
        return StepStatusEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .steps(steps)
                .build();
    }

    private BrainEvent webhook(Execution execution, List<WebhookRegistration> waitFor, Duration timeout) {
        log.info("BRAIN_WAITING: runId={}, webhooks={}, timeout={}", execution.runId, waitFor.size(), timeout);
        return WebhookEvent.builder()
                .brainRunId(execution.runId)
                .timestamp(clock.instant())
                .waitFor(waitFor)
                .timeout(timeout != null ? timeout.toMillis() : null)
                .build();
    }

    private StepContext context(Execution execution, String stepId, String title, JsonNode webhookResponse) {
        return new StepContext(execution.runId, stepId, title, execution.state.deepCopy(), webhookResponse, pageService);
    }

    private static int firstIncompleteBlock(BrainDefinition brain, List<BrainEvent> events) {
        Set<String> completed = new HashSet<>();
        for (BrainEvent event : events) {
            if (event instanceof StepCompleteEvent complete) {
                completed.add(complete.getStepId());
            }
        }
        int index = 0;
        while (index < brain.blocks().size() && completed.contains(BrainDefinition.stepId(index))) {
            index++;
        }
        return index;
    }

    private static final class Execution {

        private final BrainDefinition brain;
        private final String runId;
        private volatile ObjectNode state;
        private volatile boolean stopped;

        private Execution(BrainDefinition brain, String runId, ObjectNode state) {
            this.brain = brain;
            this.runId = runId;
            this.state = state;
        }
    }

    private final class AgentRun {

        private final Execution execution;
        private final String stepId;
        private final String title;
        private final AgentConfig config;
        private final RetryOptions retry;
        private final int maxIterations;
        private final List<AgentMessage> messages = new ArrayList<>();
        private long totalTokens;

        private AgentRun(Execution execution, String stepId, String title, AgentConfig config) {
            this.execution = execution;
            this.stepId = stepId;
            this.title = title;
            this.config = config;
            this.retry = config.retry() != null ? config.retry() : defaultRetry;
            this.maxIterations = config.maxIterations() != null ? config.maxIterations() : defaultMaxIterations;
        }
    }

    private record PendingCall(ToolCall call, ToolOutcome outcome) {
    }
}

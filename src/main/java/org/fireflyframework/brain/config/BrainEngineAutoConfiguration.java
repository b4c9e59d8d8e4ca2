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

package org.fireflyframework.brain.config;

import org.fireflyframework.brain.core.AgentModelClient;
import org.fireflyframework.brain.core.BrainDefinition;
import org.fireflyframework.brain.core.BrainRegistry;
import org.fireflyframework.brain.core.BrainRunActors;
import org.fireflyframework.brain.core.BrainRunDependencies;
import org.fireflyframework.brain.core.BrainRunner;
import org.fireflyframework.brain.event.BrainEventCodec;
import org.fireflyframework.brain.loader.EventLoader;
import org.fireflyframework.brain.metrics.BrainMetrics;
import org.fireflyframework.brain.monitor.BrainRunMonitor;
import org.fireflyframework.brain.monitor.InMemoryBrainRunMonitor;
import org.fireflyframework.brain.monitor.MonitorAdapter;
import org.fireflyframework.brain.page.InMemoryPageRegistry;
import org.fireflyframework.brain.page.PageCleanupAdapter;
import org.fireflyframework.brain.page.PageRegistry;
import org.fireflyframework.brain.page.PageService;
import org.fireflyframework.brain.properties.BrainEngineProperties;
import org.fireflyframework.brain.recovery.BrainRunRecoveryService;
import org.fireflyframework.brain.replay.BrainEventAdapter;
import org.fireflyframework.brain.resilience.ConcurrencyLimiter;
import org.fireflyframework.brain.resilience.RetryExecutor;
import org.fireflyframework.brain.rest.BrainRunController;
import org.fireflyframework.brain.rest.WebhookController;
import org.fireflyframework.brain.service.BrainRunService;
import org.fireflyframework.brain.signal.BrainMachineDefinition;
import org.fireflyframework.brain.signal.InMemorySignalQueue;
import org.fireflyframework.brain.signal.SignalQueue;
import org.fireflyframework.brain.store.BlobStore;
import org.fireflyframework.brain.store.BrainEventLog;
import org.fireflyframework.brain.store.EventStore;
import org.fireflyframework.brain.store.InMemoryBlobStore;
import org.fireflyframework.brain.store.InMemoryEventStore;
import org.fireflyframework.brain.store.R2dbcEventStore;
import org.fireflyframework.brain.timeout.AlarmScheduler;
import org.fireflyframework.brain.timeout.InMemoryTimeoutStore;
import org.fireflyframework.brain.timeout.ReactorAlarmScheduler;
import org.fireflyframework.brain.timeout.TimeoutStore;
import org.fireflyframework.brain.timeout.WebhookTimeoutAdapter;
import org.fireflyframework.brain.webhook.WebhookCoordinator;
import org.fireflyframework.brain.webhook.WebhookDefinition;
import org.fireflyframework.brain.webhook.WebhookRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the Firefly Brain Engine.
 * <p>
 * This configuration provides the beans needed to run brains:
 * <ul>
 *   <li>EventStore - R2DBC-backed when a {@link DatabaseClient} is available, in memory otherwise</li>
 *   <li>BlobStore, SignalQueue, BrainRunMonitor, TimeoutStore, PageRegistry - in-memory defaults</li>
 *   <li>BrainRegistry - collects every {@link BrainDefinition} bean</li>
 *   <li>WebhookRegistry - collects every {@link WebhookDefinition} bean</li>
 *   <li>BrainRunner, BrainRunActors - execution and the per-run actors</li>
 *   <li>WebhookCoordinator, BrainRunService - the webhook protocol and the run facade</li>
 *   <li>BrainRunRecoveryService - restores waiting runs at startup</li>
 *   <li>BrainRunController, WebhookController - REST API endpoints</li>
 *   <li>BrainMetrics - Micrometer metrics when a MeterRegistry is present</li>
 * </ul>
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(BrainEngineProperties.class)
@ConditionalOnProperty(prefix = "firefly.brain", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BrainEngineAutoConfiguration {

    // ==================== Infrastructure ====================

    @Bean
    @ConditionalOnMissingBean
    public Clock brainClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainEventCodec brainEventCodec() {
        return new BrainEventCodec();
    }

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    @ConditionalOnClass(DatabaseClient.class)
    @ConditionalOnBean(DatabaseClient.class)
    public EventStore r2dbcEventStore(DatabaseClient databaseClient) {
        log.info("Using R2DBC event store");
        return new R2dbcEventStore(databaseClient);
    }

    @Bean
    @ConditionalOnMissingBean(EventStore.class)
    public EventStore inMemoryEventStore() {
        log.info("Using in-memory event store; runs will not survive a restart");
        return new InMemoryEventStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public BlobStore brainBlobStore() {
        return new InMemoryBlobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainEventLog brainEventLog(EventStore eventStore, BlobStore blobStore, BrainEventCodec codec,
                                      BrainEngineProperties properties) {
        return new BrainEventLog(eventStore, blobStore, codec, properties.getEventLog().getOverflowThresholdBytes());
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLoader brainEventLoader(EventStore eventStore, BlobStore blobStore, BrainEventCodec codec,
                                       BrainEngineProperties properties) {
        return new EventLoader(eventStore, blobStore, codec, properties.getEventLog().getHydrationConcurrency());
    }

    @Bean
    @ConditionalOnMissingBean
    public SignalQueue brainSignalQueue() {
        return new InMemorySignalQueue();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainRunMonitor brainRunMonitor() {
        return new InMemoryBrainRunMonitor();
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeoutStore brainTimeoutStore() {
        return new InMemoryTimeoutStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlarmScheduler brainAlarmScheduler(Clock clock) {
        return new ReactorAlarmScheduler(Schedulers.parallel(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public PageRegistry brainPageRegistry() {
        return new InMemoryPageRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public PageService brainPageService(BlobStore blobStore, PageRegistry pageRegistry) {
        return new PageService(blobStore, pageRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainMachineDefinition brainMachineDefinition() {
        return BrainMachineDefinition.standard();
    }

    // ==================== Execution ====================

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor brainRetryExecutor() {
        return new RetryExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConcurrencyLimiter brainModelLimiter(BrainEngineProperties properties) {
        return new ConcurrencyLimiter("agent-model", properties.getAgent().getMaxConcurrentModelCalls());
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainRegistry brainRegistry(ObjectProvider<BrainDefinition> definitions) {
        return new BrainRegistry(definitions.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookRegistry webhookRegistry(ObjectProvider<WebhookDefinition> definitions) {
        WebhookRegistry registry = new WebhookRegistry();
        definitions.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainRunner brainRunner(SignalQueue signalQueue, RetryExecutor retryExecutor,
                                   ConcurrencyLimiter modelLimiter, ObjectProvider<AgentModelClient> modelClient,
                                   PageService pageService, Clock clock, BrainEngineProperties properties) {
        AgentModelClient client = modelClient.getIfAvailable();
        log.info("Creating BrainRunner: modelClient={}, maxConcurrentModelCalls={}",
                client != null, modelLimiter.getMaxConcurrent());
        return new BrainRunner(signalQueue, retryExecutor, modelLimiter, client, pageService, clock,
                properties.getRetry().toRetryOptions(), properties.getAgent().getDefaultMaxIterations());
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookTimeoutAdapter webhookTimeoutAdapter(TimeoutStore timeoutStore, AlarmScheduler alarmScheduler,
                                                       Clock clock) {
        return new WebhookTimeoutAdapter(timeoutStore, alarmScheduler, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MonitorAdapter brainMonitorAdapter(BrainRunMonitor monitor) {
        return new MonitorAdapter(monitor);
    }

    @Bean
    @ConditionalOnMissingBean
    public PageCleanupAdapter pageCleanupAdapter(BlobStore blobStore, PageRegistry pageRegistry) {
        return new PageCleanupAdapter(blobStore, pageRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "firefly.brain", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public BrainMetrics brainMetrics(MeterRegistry meterRegistry) {
        return new BrainMetrics(meterRegistry);
    }

    @Bean(destroyMethod = "destroy")
    @ConditionalOnMissingBean
    public BrainRunActors brainRunActors(BrainRegistry registry, BrainRunner runner, EventLoader eventLoader,
                                         BrainEventLog eventLog, SignalQueue signalQueue,
                                         WebhookTimeoutAdapter timeoutAdapter, MonitorAdapter monitorAdapter,
                                         PageCleanupAdapter pageCleanupAdapter, @Nullable BrainMetrics metrics,
                                         BrainMachineDefinition machineDefinition, AlarmScheduler alarmScheduler,
                                         Clock clock) {
        List<BrainEventAdapter> adapters = new ArrayList<>(List.of(monitorAdapter, timeoutAdapter, pageCleanupAdapter));
        if (metrics != null) {
            adapters.add(metrics);
        }
        BrainRunDependencies dependencies = new BrainRunDependencies(registry, runner, eventLoader, eventLog,
                signalQueue, timeoutAdapter, adapters, machineDefinition, Schedulers.boundedElastic(), clock);
        BrainRunActors actors = new BrainRunActors(dependencies, alarmScheduler);
        actors.start();
        return actors;
    }

    @Bean
    @ConditionalOnMissingBean
    public WebhookCoordinator webhookCoordinator(BrainRunMonitor monitor, SignalQueue signalQueue,
                                                 BrainRunActors actors, BrainMachineDefinition machineDefinition,
                                                 Clock clock) {
        return new WebhookCoordinator(monitor, signalQueue, actors, machineDefinition, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BrainRunService brainRunService(BrainRegistry registry, BrainRunActors actors, EventLoader eventLoader,
                                           BrainRunMonitor monitor, BrainMachineDefinition machineDefinition,
                                           Clock clock) {
        return new BrainRunService(registry, actors, eventLoader, monitor, machineDefinition, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.brain.recovery", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BrainRunRecoveryService brainRunRecoveryService(EventStore eventStore, EventLoader eventLoader,
                                                           BrainRunMonitor monitor, TimeoutStore timeoutStore,
                                                           AlarmScheduler alarmScheduler,
                                                           BrainMachineDefinition machineDefinition,
                                                           BrainEngineProperties properties) {
        log.info("Creating BrainRunRecoveryService");
        return new BrainRunRecoveryService(eventStore, eventLoader, monitor, timeoutStore, alarmScheduler,
                machineDefinition, properties.getRecovery().isEnabled());
    }

    // ==================== REST ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(prefix = "firefly.brain.api", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BrainRunController brainRunController(BrainRunService runService) {
        return new BrainRunController(runService);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
    @ConditionalOnProperty(prefix = "firefly.brain.webhooks", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WebhookController webhookController(WebhookRegistry webhookRegistry, WebhookCoordinator coordinator,
                                               ObjectMapper objectMapper, @Nullable BrainMetrics metrics) {
        return new WebhookController(webhookRegistry, coordinator, objectMapper, metrics);
    }
}

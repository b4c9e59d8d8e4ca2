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

import org.fireflyframework.brain.core.BrainDefinition;
import org.fireflyframework.brain.core.BrainRegistry;
import org.fireflyframework.brain.core.BrainRunActors;
import org.fireflyframework.brain.core.StepBlock;
import org.fireflyframework.brain.core.StepResult;
import org.fireflyframework.brain.metrics.BrainMetrics;
import org.fireflyframework.brain.recovery.BrainRunRecoveryService;
import org.fireflyframework.brain.resilience.ConcurrencyLimiter;
import org.fireflyframework.brain.rest.BrainRunController;
import org.fireflyframework.brain.service.BrainRunService;
import org.fireflyframework.brain.store.BrainEventLog;
import org.fireflyframework.brain.store.EventStore;
import org.fireflyframework.brain.store.InMemoryEventStore;
import org.fireflyframework.brain.webhook.WebhookDefinition;
import org.fireflyframework.brain.webhook.WebhookRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BrainEngineAutoConfiguration}.
 */
class BrainEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BrainEngineAutoConfiguration.class));

    @Test
    void shouldCreateEngineWithInMemoryDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BrainRunService.class);
            assertThat(context).hasSingleBean(BrainRunActors.class);
            assertThat(context).hasSingleBean(BrainRunRecoveryService.class);
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            assertThat(context).doesNotHaveBean(BrainMetrics.class);
            assertThat(context).doesNotHaveBean(BrainRunController.class);
        });
    }

    @Test
    void shouldCollectBrainAndWebhookDefinitions() {
        contextRunner.withUserConfiguration(DefinitionsConfig.class).run(context -> {
            assertThat(context.getBean(BrainRegistry.class).findBrain("greeter")).isPresent();
            assertThat(context.getBean(WebhookRegistry.class).findUserWebhook("approval")).isPresent();
        });
    }

    @Test
    void shouldCreateMetricsWhenMeterRegistryIsPresent() {
        contextRunner.withUserConfiguration(MetricsConfig.class)
                .run(context -> assertThat(context).hasSingleBean(BrainMetrics.class));
    }

    @Test
    void shouldSkipMetricsWhenDisabled() {
        contextRunner.withUserConfiguration(MetricsConfig.class)
                .withPropertyValues("firefly.brain.metrics-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(BrainMetrics.class));
    }

    @Test
    void shouldBindProperties() {
        contextRunner.withPropertyValues(
                        "firefly.brain.event-log.overflow-threshold-bytes=2048",
                        "firefly.brain.agent.max-concurrent-model-calls=7")
                .run(context -> {
                    assertThat(context.getBean(BrainEventLog.class).getOverflowThresholdBytes()).isEqualTo(2048);
                    assertThat(context.getBean(ConcurrencyLimiter.class).getMaxConcurrent()).isEqualTo(7);
                });
    }

    @Test
    void shouldSkipRecoveryWhenDisabled() {
        contextRunner.withPropertyValues("firefly.brain.recovery.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(BrainRunRecoveryService.class);
                    assertThat(context).hasSingleBean(BrainRunService.class);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("firefly.brain.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(BrainRunService.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class DefinitionsConfig {

        @Bean
        BrainDefinition greeter() {
            return BrainDefinition.builder()
                    .title("greeter")
                    .block(StepBlock.of("Greet", context -> Mono.just(StepResult.of(context.state().put("hi", 1)))))
                    .build();
        }

        @Bean
        WebhookDefinition approvalWebhook() {
            return WebhookDefinition.user("approval", "Approval callbacks", request -> Mono.empty());
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MetricsConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }
}

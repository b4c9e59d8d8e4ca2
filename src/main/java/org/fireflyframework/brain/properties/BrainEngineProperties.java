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

package org.fireflyframework.brain.properties;

import org.fireflyframework.brain.resilience.Backoff;
import org.fireflyframework.brain.resilience.RetryOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the Brain Engine library.
 */
@ConfigurationProperties(prefix = "firefly.brain")
@Validated
@Data
public class BrainEngineProperties {

    /**
     * Whether the brain engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to record Micrometer metrics.
     */
    private boolean metricsEnabled = true;

    @Valid
    @NotNull
    private EventLogConfig eventLog = new EventLogConfig();

    @Valid
    @NotNull
    private AgentConfig agent = new AgentConfig();

    /**
     * Default retry options of steps and model calls.
     */
    @Valid
    @NotNull
    private RetryConfig retry = new RetryConfig();

    @Valid
    @NotNull
    private ApiConfig api = new ApiConfig();

    @Valid
    @NotNull
    private RecoveryConfig recovery = new RecoveryConfig();

    @Valid
    @NotNull
    private WebhooksConfig webhooks = new WebhooksConfig();

    @Data
    public static class EventLogConfig {

        /**
         * Serialized events larger than this are stored as blobs.
         */
        @Min(1)
        private int overflowThresholdBytes = 1024 * 1024;

        /**
         * Blobs fetched in parallel when a log is loaded.
         */
        @Min(1)
        private int hydrationConcurrency = 32;
    }

    @Data
    public static class AgentConfig {

        /**
         * Model calls allowed at once across all runs.
         */
        @Min(1)
        private int maxConcurrentModelCalls = 4;

        /**
         * Iterations of an agent loop unless the agent sets its own limit.
         */
        @Min(1)
        private int defaultMaxIterations = 100;
    }

    @Data
    public static class RetryConfig {

        @Min(0)
        private int maxRetries = 0;

        @NotNull
        private Backoff backoff = Backoff.EXPONENTIAL;

        @NotNull
        private Duration initialDelay = RetryOptions.DEFAULT_INITIAL_DELAY;

        @NotNull
        private Duration maxDelay = RetryOptions.DEFAULT_MAX_DELAY;

        public RetryOptions toRetryOptions() {
            return new RetryOptions(maxRetries, backoff, initialDelay, maxDelay);
        }
    }

    @Data
    public static class ApiConfig {

        private boolean enabled = true;

        @NotBlank
        private String basePath = "/brains";
    }

    @Data
    public static class RecoveryConfig {

        /**
         * Whether waiting runs get their webhook registrations and alarms back at startup.
         */
        private boolean enabled = true;
    }

    @Data
    public static class WebhooksConfig {

        private boolean enabled = true;

        @NotBlank
        private String basePath = "/webhooks";
    }
}

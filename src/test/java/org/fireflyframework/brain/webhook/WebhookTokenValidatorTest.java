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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link WebhookTokenValidator}.
 */
class WebhookTokenValidatorTest {

    @ParameterizedTest(name = "expected={0}, submitted={1} -> {2}")
    @CsvSource(value = {
            "null, null, true",
            "null, abc, false",
            "abc, null, false",
            "abc, abc, true",
            "abc, xyz, false"
    }, nullValues = "null")
    @DisplayName("should accept only matching or jointly absent tokens")
    void validate_shouldFollowTokenMatrix(String expected, String submitted, boolean valid) {
        var result = WebhookTokenValidator.validate(expected, submitted);

        assertThat(result.valid()).isEqualTo(valid);
        if (!valid) {
            assertThat(result.reason()).isEqualTo(WebhookTokenValidator.INVALID_TOKEN_REASON);
        }
    }
}

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

import org.fireflyframework.brain.signal.SignalValidationResult;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the CSRF token of a webhook submission against the token the waiting run expects.
 * <p>
 * Both absent is accepted, since programmatic webhooks never carry a token. Both present
 * and equal is accepted. Any other combination is rejected.
 */
public final class WebhookTokenValidator {

    public static final String INVALID_TOKEN_REASON = "Invalid form token";

    private WebhookTokenValidator() {
    }

    public static SignalValidationResult validate(String expectedToken, String submittedToken) {
        if (expectedToken == null && submittedToken == null) {
            return SignalValidationResult.accepted();
        }
        if (expectedToken != null && submittedToken != null
                && MessageDigest.isEqual(expectedToken.getBytes(StandardCharsets.UTF_8),
                submittedToken.getBytes(StandardCharsets.UTF_8))) {
            return SignalValidationResult.accepted();
        }
        return SignalValidationResult.rejected(INVALID_TOKEN_REASON);
    }
}

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

package org.fireflyframework.brain.patch;

import java.util.Arrays;

/**
 * RFC 6902 operation names.
 */
public enum PatchOp {

    ADD("add"),
    REMOVE("remove"),
    REPLACE("replace"),
    MOVE("move"),
    COPY("copy"),
    TEST("test");

    private final String value;

    PatchOp(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PatchOp fromValue(String value) {
        return Arrays.stream(values())
                .filter(op -> op.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new JsonPatchException("Unknown patch operation: " + value));
    }
}

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A single JSON Patch operation as it appears on the wire.
 * <p>
 * The operation name is kept as a string so that a patch with an unknown
 * operation still decodes and fails when it is applied.
 *
 * @param op    the operation name ({@code add}, {@code remove}, ...)
 * @param path  the target JSON Pointer
 * @param from  the source JSON Pointer for {@code move} and {@code copy}
 * @param value the value for {@code add}, {@code replace} and {@code test}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonPatchOperation(String op, String path, String from, JsonNode value) {

    public static JsonPatchOperation add(String path, JsonNode value) {
        return new JsonPatchOperation(PatchOp.ADD.getValue(), path, null, value);
    }

    public static JsonPatchOperation remove(String path) {
        return new JsonPatchOperation(PatchOp.REMOVE.getValue(), path, null, null);
    }

    public static JsonPatchOperation replace(String path, JsonNode value) {
        return new JsonPatchOperation(PatchOp.REPLACE.getValue(), path, null, value);
    }

    public static JsonPatchOperation move(String from, String path) {
        return new JsonPatchOperation(PatchOp.MOVE.getValue(), path, from, null);
    }

    public static JsonPatchOperation copy(String from, String path) {
        return new JsonPatchOperation(PatchOp.COPY.getValue(), path, from, null);
    }

    public static JsonPatchOperation test(String path, JsonNode value) {
        return new JsonPatchOperation(PatchOp.TEST.getValue(), path, null, value);
    }

    /**
     * Resolves the operation name.
     *
     * @throws JsonPatchException if the name is missing or unknown
     */
    @JsonIgnore
    public PatchOp operation() {
        return PatchOp.fromValue(op);
    }
}

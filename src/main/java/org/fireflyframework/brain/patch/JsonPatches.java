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

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Applies and produces RFC 6902 JSON Patches.
 * <p>
 * Application is pure: the input document is deep-copied and never mutated.
 * Any operation that cannot be applied fails the whole patch with a
 * {@link JsonPatchException}.
 */
public final class JsonPatches {

    private static final String APPEND_TOKEN = "-";

    private static final Comparator<JsonNode> NUMERIC_AWARE = (left, right) -> {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue());
        }
        return left.equals(right) ? 0 : 1;
    };

    private JsonPatches() {
    }

    /**
     * Applies the operations in order to a copy of {@code document}.
     *
     * @return the patched copy
     * @throws JsonPatchException if any operation fails
     */
    public static JsonNode apply(JsonNode document, List<JsonPatchOperation> patch) {
        JsonNode result = document == null ? NullNode.getInstance() : document.deepCopy();
        if (patch == null) {
            return result;
        }
        for (JsonPatchOperation operation : patch) {
            result = applyOperation(result, operation);
        }
        return result;
    }

    /**
     * Applies a sequence of patches in order.
     */
    public static JsonNode applyAll(JsonNode document, List<List<JsonPatchOperation>> patches) {
        JsonNode result = document == null ? NullNode.getInstance() : document.deepCopy();
        for (List<JsonPatchOperation> patch : patches) {
            result = apply(result, patch);
        }
        return result;
    }

    /**
     * Produces a patch that transforms {@code source} into {@code target}.
     */
    public static List<JsonPatchOperation> diff(JsonNode source, JsonNode target) {
        List<JsonPatchOperation> operations = new ArrayList<>();
        diff("", nullToNode(source), nullToNode(target), operations);
        return operations;
    }

    // ==================== Application ====================

    private static JsonNode applyOperation(JsonNode document, JsonPatchOperation operation) {
        if (operation == null) {
            throw new JsonPatchException("Patch operation must not be null");
        }
        PatchOp op = operation.operation();
        JsonPointer path = compile(operation.path(), "path");

        return switch (op) {
            case ADD -> add(document, path, requireValue(operation));
            case REMOVE -> remove(document, path);
            case REPLACE -> replace(document, path, requireValue(operation));
            case MOVE -> move(document, compile(operation.from(), "from"), path);
            case COPY -> add(document, path, get(document, compile(operation.from(), "from")).deepCopy());
            case TEST -> test(document, path, requireValue(operation));
        };
    }

    private static JsonNode add(JsonNode document, JsonPointer path, JsonNode value) {
        if (path.matches()) {
            return value.deepCopy();
        }
        JsonNode parent = document.at(path.head());
        String token = path.last().getMatchingProperty();

        if (parent instanceof ObjectNode object) {
            object.set(token, value.deepCopy());
        } else if (parent instanceof ArrayNode array) {
            if (APPEND_TOKEN.equals(token)) {
                array.add(value.deepCopy());
            } else {
                int index = arrayIndex(path, token);
                if (index > array.size()) {
                    throw new JsonPatchException("Array index out of bounds: " + path);
                }
                array.insert(index, value.deepCopy());
            }
        } else {
            throw new JsonPatchException("Path not found: " + path);
        }
        return document;
    }

    private static JsonNode remove(JsonNode document, JsonPointer path) {
        if (path.matches()) {
            throw new JsonPatchException("Cannot remove the document root");
        }
        JsonNode parent = document.at(path.head());
        String token = path.last().getMatchingProperty();

        if (parent instanceof ObjectNode object) {
            if (!object.has(token)) {
                throw new JsonPatchException("Path not found: " + path);
            }
            object.remove(token);
        } else if (parent instanceof ArrayNode array) {
            int index = arrayIndex(path, token);
            if (index >= array.size()) {
                throw new JsonPatchException("Array index out of bounds: " + path);
            }
            array.remove(index);
        } else {
            throw new JsonPatchException("Path not found: " + path);
        }
        return document;
    }

    private static JsonNode replace(JsonNode document, JsonPointer path, JsonNode value) {
        if (path.matches()) {
            return value.deepCopy();
        }
        get(document, path);
        return add(remove(document, path), path, value);
    }

    private static JsonNode move(JsonNode document, JsonPointer from, JsonPointer path) {
        String fromText = from.toString();
        String pathText = path.toString();
        if (fromText.equals(pathText)) {
            get(document, from);
            return document;
        }
        if (pathText.startsWith(fromText + "/")) {
            throw new JsonPatchException("Cannot move " + from + " into its own child " + path);
        }
        JsonNode value = get(document, from);
        return add(remove(document, from), path, value);
    }

    private static JsonNode test(JsonNode document, JsonPointer path, JsonNode expected) {
        JsonNode actual = get(document, path);
        if (!actual.equals(NUMERIC_AWARE, expected)) {
            throw new JsonPatchException("Test failed at " + path + ": expected " + expected + " but was " + actual);
        }
        return document;
    }

    private static JsonNode get(JsonNode document, JsonPointer path) {
        JsonNode node = document.at(path);
        if (node.isMissingNode()) {
            throw new JsonPatchException("Path not found: " + path);
        }
        return node;
    }

    private static int arrayIndex(JsonPointer path, String token) {
        int index = path.last().getMatchingIndex();
        if (index < 0) {
            throw new JsonPatchException("Invalid array index '" + token + "' in " + path);
        }
        return index;
    }

    private static JsonPointer compile(String pointer, String field) {
        if (pointer == null) {
            throw new JsonPatchException("Missing '" + field + "' in patch operation");
        }
        try {
            return JsonPointer.compile(pointer);
        } catch (IllegalArgumentException e) {
            throw new JsonPatchException("Malformed JSON pointer '" + pointer + "': " + e.getMessage());
        }
    }

    private static JsonNode requireValue(JsonPatchOperation operation) {
        if (operation.value() == null) {
            throw new JsonPatchException("Missing 'value' in '" + operation.op() + "' operation");
        }
        return operation.value();
    }

    // ==================== Diff ====================

    private static void diff(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> operations) {
        if (source.equals(target)) {
            return;
        }
        if (source.isObject() && target.isObject()) {
            diffObjects(path, source, target, operations);
        } else if (source.isArray() && target.isArray()) {
            diffArrays(path, source, target, operations);
        } else {
            operations.add(JsonPatchOperation.replace(path, target.deepCopy()));
        }
    }

    private static void diffObjects(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> operations) {
        Iterator<String> sourceNames = source.fieldNames();
        while (sourceNames.hasNext()) {
            String name = sourceNames.next();
            String child = path + "/" + escape(name);
            if (!target.has(name)) {
                operations.add(JsonPatchOperation.remove(child));
            } else {
                diff(child, source.get(name), target.get(name), operations);
            }
        }
        Iterator<Map.Entry<String, JsonNode>> targetFields = target.fields();
        while (targetFields.hasNext()) {
            Map.Entry<String, JsonNode> field = targetFields.next();
            if (!source.has(field.getKey())) {
                operations.add(JsonPatchOperation.add(path + "/" + escape(field.getKey()), field.getValue().deepCopy()));
            }
        }
    }

    private static void diffArrays(String path, JsonNode source, JsonNode target, List<JsonPatchOperation> operations) {
        int common = Math.min(source.size(), target.size());
        for (int i = 0; i < common; i++) {
            diff(path + "/" + i, source.get(i), target.get(i), operations);
        }
        for (int i = source.size() - 1; i >= target.size(); i--) {
            operations.add(JsonPatchOperation.remove(path + "/" + i));
        }
        for (int i = source.size(); i < target.size(); i++) {
            operations.add(JsonPatchOperation.add(path + "/" + i, target.get(i).deepCopy()));
        }
    }

    private static String escape(String token) {
        return token.replace("~", "~0").replace("/", "~1");
    }

    private static JsonNode nullToNode(JsonNode node) {
        return node == null ? NullNode.getInstance() : node;
    }
}

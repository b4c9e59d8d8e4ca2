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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Parses {@code application/x-www-form-urlencoded} submissions into JSON.
 * <p>
 * A key seen once becomes a string; a repeated key becomes an array; a key ending in
 * {@code []} always becomes an array under the name without the brackets, merged with
 * the values of the plain key of that name in order of first appearance. The
 * {@value #TOKEN_FIELD} field is taken out and returned separately.
 */
public final class FormDataParser {

    public static final String TOKEN_FIELD = "__positronic_token";

    private static final String ARRAY_SUFFIX = "[]";

    private FormDataParser() {
    }

    public static FormData parse(String body) {
        MultiValueMap<String, String> fields = new LinkedMultiValueMap<>();
        if (body != null && !body.isBlank()) {
            for (String pair : body.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int separator = pair.indexOf('=');
                String name = decode(separator >= 0 ? pair.substring(0, separator) : pair);
                String value = separator >= 0 ? decode(pair.substring(separator + 1)) : "";
                fields.add(name, value);
            }
        }
        return parse(fields);
    }

    public static FormData parse(MultiValueMap<String, String> fields) {
        ObjectNode data = JsonNodeFactory.instance.objectNode();
        String token = null;

        for (Map.Entry<String, List<String>> field : fields.entrySet()) {
            String name = field.getKey();
            List<String> values = field.getValue();

            if (TOKEN_FIELD.equals(name)) {
                token = values.isEmpty() ? null : values.get(0);
            } else if (name.endsWith(ARRAY_SUFFIX)) {
                merge(data, name.substring(0, name.length() - ARRAY_SUFFIX.length()), values, true);
            } else {
                merge(data, name, values, false);
            }
        }
        return new FormData(data, token);
    }

    private static void merge(ObjectNode data, String name, List<String> values, boolean asArray) {
        JsonNode existing = data.get(name);
        if (existing == null && !asArray && values.size() == 1) {
            data.put(name, values.get(0));
            return;
        }
        ArrayNode array;
        if (existing != null && existing.isArray()) {
            array = (ArrayNode) existing;
        } else {
            array = JsonNodeFactory.instance.arrayNode();
            if (existing != null) {
                array.add(existing);
            }
            data.set(name, array);
        }
        values.forEach(array::add);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }
}

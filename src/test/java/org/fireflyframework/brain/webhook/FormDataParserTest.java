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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FormDataParser}.
 */
class FormDataParserTest {

    @Test
    @DisplayName("should map single keys to strings and repeated keys to arrays")
    void parse_shouldMapSingleAndRepeatedKeys() {
        FormData form = FormDataParser.parse("name=Ada+Lovelace&tag=a&tag=b&note=x%26y");

        assertThat(form.data().get("name").asText()).isEqualTo("Ada Lovelace");
        assertThat(form.data().get("note").asText()).isEqualTo("x&y");
        assertThat(form.data().get("tag").isArray()).isTrue();
        assertThat(form.data().get("tag")).hasSize(2);
        assertThat(form.token()).isNull();
    }

    @Test
    @DisplayName("should always build an array for keys ending in brackets")
    void parse_shouldBuildArrayForBracketKeys() {
        FormData form = FormDataParser.parse("items%5B%5D=one");

        assertThat(form.data().get("items").isArray()).isTrue();
        assertThat(form.data().get("items").get(0).asText()).isEqualTo("one");
        assertThat(form.data().has("items[]")).isFalse();
    }

    @Test
    @DisplayName("should merge plain and bracketed values of the same name in either order")
    void parse_shouldMergePlainAndBracketKeys() {
        FormData plainFirst = FormDataParser.parse("tags=a&tags%5B%5D=b&tags%5B%5D=c");
        FormData bracketFirst = FormDataParser.parse("tags%5B%5D=b&tags=a");

        assertThat(texts(plainFirst.data().get("tags"))).containsExactly("a", "b", "c");
        assertThat(texts(bracketFirst.data().get("tags"))).containsExactly("b", "a");
    }

    @Test
    @DisplayName("should take the token field out of the data")
    void parse_shouldExtractToken() {
        FormData form = FormDataParser.parse("answer=yes&__positronic_token=abc123");

        assertThat(form.token()).isEqualTo("abc123");
        assertThat(form.data().has(FormDataParser.TOKEN_FIELD)).isFalse();
        assertThat(form.data().get("answer").asText()).isEqualTo("yes");
    }

    @Test
    @DisplayName("should return empty data for an empty body")
    void parse_shouldHandleEmptyBody() {
        FormData form = FormDataParser.parse("");

        assertThat(form.data().isEmpty()).isTrue();
        assertThat(form.token()).isNull();
    }

    private static List<String> texts(JsonNode array) {
        List<String> texts = new ArrayList<>();
        array.forEach(node -> texts.add(node.asText()));
        return texts;
    }
}

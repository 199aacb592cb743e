/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.teams.adapter.outbound.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.model.LlmToolCall;

import java.util.Collections;
import java.util.Map;

/**
 * Shared conversion of provider tool calls whose arguments arrive as raw JSON
 * text. Unparseable arguments are flagged instead of silently replaced with an
 * empty map, so the agent runtime can treat them as malformed output.
 */
final class LlmToolCalls {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private LlmToolCalls() {
    }

    static LlmToolCall fromRaw(ObjectMapper objectMapper, String id, String name, String rawArguments) {
        LlmToolCall.LlmToolCallBuilder builder = LlmToolCall.builder()
                .id(id)
                .name(name)
                .rawArguments(rawArguments);
        if (rawArguments == null || rawArguments.isBlank()) {
            return builder.arguments(Collections.emptyMap()).build();
        }
        try {
            Map<String, Object> arguments = objectMapper.readValue(rawArguments, MAP_TYPE_REF);
            return builder.arguments(arguments != null ? arguments : Collections.emptyMap()).build();
        } catch (JsonProcessingException e) {
            return builder.arguments(Collections.emptyMap()).argumentsParsed(false).build();
        }
    }

    static String toJson(ObjectMapper objectMapper, Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool arguments are not serializable: " + e.getOriginalMessage(), e);
        }
    }
}

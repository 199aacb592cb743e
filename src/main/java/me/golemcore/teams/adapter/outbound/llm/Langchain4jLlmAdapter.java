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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.model.LlmMessage;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter using the langchain4j OpenAI client against any OpenAI-compatible
 * endpoint.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Client-side retries are disabled: retry decisions belong to the coordinator,
 * which receives a {@link LlmBackendException} flagged retryable for rate
 * limits, timeouts and server errors.
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jLlmAdapter implements LlmProviderAdapter {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final Set<String> RETRYABLE_EXCEPTIONS = Set.of(
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "InternalServerException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "RetriableException");
    private static final Set<String> NON_RETRYABLE_EXCEPTIONS = Set.of(
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "AuthenticationException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "InvalidRequestException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "ModelNotFoundException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "ContentFilteredException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "UnsupportedFeatureException",
            LANGCHAIN4J_EXCEPTIONS_PREFIX + "NonRetriableException");

    private final TeamsProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, ChatModel> modelsByName = new ConcurrentHashMap<>();

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new LlmBackendException("Langchain4j adapter has no base URL configured", false);
            }
            String modelName = request.getModel() != null ? request.getModel() : getCurrentModel();
            ChatModel model = modelsByName.computeIfAbsent(modelName, this::createModel);
            List<ChatMessage> messages = convertMessages(request);
            List<ToolSpecification> tools = convertTools(request);
            try {
                ChatRequest.Builder chatRequest = ChatRequest.builder().messages(messages);
                if (!tools.isEmpty()) {
                    log.trace("Calling LLM with {} tools", tools.size());
                    chatRequest.toolSpecifications(tools);
                }
                return convertResponse(model.chat(chatRequest.build()), modelName);
            } catch (RuntimeException e) {
                boolean retryable = isRetryable(e);
                log.warn("[LLM] Chat failed (retryable: {}): {}", retryable, e.getMessage());
                throw new LlmBackendException("LLM chat failed: " + e.getMessage(), retryable, e);
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        String baseUrl = properties.getLlm().getBaseUrl();
        return baseUrl != null && !baseUrl.isBlank();
    }

    /**
     * Walks the cause chain looking for a langchain4j exception type or an I/O
     * failure. Unknown failures are not retried.
     */
    static boolean isRetryable(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            String className = current.getClass().getName();
            if (RETRYABLE_EXCEPTIONS.contains(className)) {
                return true;
            }
            if (NON_RETRYABLE_EXCEPTIONS.contains(className)) {
                return false;
            }
            if (current instanceof IOException || current instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private ChatModel createModel(String modelName) {
        TeamsProperties.LlmProperties llm = properties.getLlm();
        var builder = OpenAiChatModel.builder()
                .baseUrl(llm.getBaseUrl())
                .apiKey(llm.getApiKey() != null ? llm.getApiKey() : "none")
                .modelName(modelName)
                .temperature(llm.getTemperature())
                .maxRetries(0)
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()));
        if (llm.getMaxTokens() != null) {
            builder.maxTokens(llm.getMaxTokens());
        }
        log.info("Langchain4j model created: {} at {}", modelName, llm.getBaseUrl());
        return builder.build();
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (LlmMessage msg : request.getMessages()) {
            switch (msg.getRole()) {
            case LlmMessage.USER -> messages.add(msg.getName() != null
                    ? UserMessage.from(msg.getName().replaceAll("[^a-zA-Z0-9_-]", "_"), msg.getContent())
                    : UserMessage.from(msg.getContent()));
            case LlmMessage.ASSISTANT -> {
                if (msg.hasToolCalls()) {
                    List<ToolExecutionRequest> toolRequests = msg.getToolCalls().stream()
                            .map(tc -> ToolExecutionRequest.builder()
                                    .id(tc.getId())
                                    .name(tc.getName())
                                    .arguments(LlmToolCalls.toJson(objectMapper, tc.getArguments()))
                                    .build())
                            .toList();
                    messages.add(AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(msg.getContent()));
                }
            }
            case LlmMessage.TOOL -> messages.add(ToolExecutionResultMessage.from(
                    msg.getToolCallId(),
                    msg.getToolName(),
                    msg.getContent()));
            case LlmMessage.SYSTEM -> messages.add(SystemMessage.from(msg.getContent()));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.getRole());
                messages.add(UserMessage.from(msg.getContent()));
            }
            }
        }
        return messages;
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (request.getTools() == null || request.getTools().isEmpty()) {
            return List.of();
        }
        return request.getTools().stream()
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        if (tool.getInputSchema() != null) {
            Map<String, Object> schema = tool.getInputSchema();
            Map<String, Object> props = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");
            if (props != null) {
                JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
                for (Map.Entry<String, Object> entry : props.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
                if (required != null && !required.isEmpty()) {
                    schemaBuilder.required(required);
                }
                builder.parameters(schemaBuilder.build());
            }
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            Object items = paramSchema.get("items");
            if (items instanceof Map<?, ?> itemSchema) {
                builder.items(toJsonSchemaElement((Map<String, Object>) itemSchema));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            Object nested = paramSchema.get(SCHEMA_KEY_PROPERTIES);
            if (nested instanceof Map<?, ?> nestedProps) {
                for (Map.Entry<?, ?> entry : nestedProps.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    private LlmResponse convertResponse(ChatResponse response, String modelName) {
        AiMessage aiMessage = response.aiMessage();

        List<LlmToolCall> toolCalls = null;
        if (aiMessage.hasToolExecutionRequests()) {
            toolCalls = aiMessage.toolExecutionRequests().stream()
                    .map(ter -> LlmToolCalls.fromRaw(objectMapper, ter.id(), ter.name(), ter.arguments()))
                    .toList();
            log.trace("Parsed {} tool calls from response", toolCalls.size());
        }

        return LlmResponse.builder()
                .content(aiMessage.text())
                .toolCalls(toolCalls)
                .model(modelName)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}

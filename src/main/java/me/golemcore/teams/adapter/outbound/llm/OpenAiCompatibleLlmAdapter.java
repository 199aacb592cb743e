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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import feign.RetryableException;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.model.LlmMessage;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter for OpenAI-compatible chat completion APIs (Groq, OpenAI, local
 * inference servers) using Feign + OkHttp.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code teams.llm.base-url} - Base URL of the API
 * <li>{@code teams.llm.api-key} - API key sent as a bearer token
 * <li>{@code teams.llm.model} - Default model name
 * </ul>
 *
 * <p>
 * Provider ID: {@code "openai"}
 *
 * <p>
 * HTTP failures are translated into {@link LlmBackendException}: rate limits,
 * server errors and I/O failures are retryable, other client errors are not.
 *
 * @see LlmProviderAdapter
 * @see FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmProviderAdapter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TeamsProperties properties;
    private final FeignClientFactory feignClientFactory;
    private final ObjectMapper objectMapper;

    private ChatCompletionApi client;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        String baseUrl = properties.getLlm().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.warn("OpenAI-compatible adapter has no base URL configured");
            return;
        }
        this.client = feignClientFactory.create(ChatCompletionApi.class, stripTrailingSlash(baseUrl));
        initialized = true;
        log.info("OpenAI-compatible LLM adapter initialized with URL: {}", baseUrl);
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (client == null) {
                throw new LlmBackendException("OpenAI-compatible adapter is not configured", false);
            }
            ChatCompletionRequest apiRequest = buildRequest(request);
            try {
                ChatCompletionResponse apiResponse = client.chatCompletion(authorization(), apiRequest);
                return convertResponse(apiResponse);
            } catch (FeignException e) {
                throw translate(e);
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

    static LlmBackendException translate(FeignException e) {
        int status = e.status();
        boolean retryable = e instanceof RetryableException
                || status <= 0
                || status == 408
                || status == 429
                || status >= 500;
        String message = status > 0
                ? "LLM API returned HTTP " + status + ": " + abbreviate(e.contentUTF8())
                : "LLM API request failed: " + e.getMessage();
        log.warn("[LLM] {} (retryable: {})", message, retryable);
        return new LlmBackendException(message, retryable, e);
    }

    ChatCompletionRequest buildRequest(LlmRequest request) {
        ChatCompletionRequest apiRequest = new ChatCompletionRequest();
        apiRequest.setModel(request.getModel() != null ? request.getModel() : getCurrentModel());
        apiRequest.setTemperature(request.getTemperature());
        apiRequest.setMaxTokens(request.getMaxTokens() != null
                ? request.getMaxTokens()
                : properties.getLlm().getMaxTokens());

        List<ApiMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            ApiMessage sysMsg = new ApiMessage();
            sysMsg.setRole(LlmMessage.SYSTEM);
            sysMsg.setContent(request.getSystemPrompt());
            messages.add(sysMsg);
        }

        for (LlmMessage msg : request.getMessages()) {
            ApiMessage apiMsg = new ApiMessage();
            apiMsg.setRole(msg.getRole());
            apiMsg.setContent(msg.getContent());
            if (LlmMessage.USER.equals(msg.getRole())) {
                apiMsg.setName(sanitizeName(msg.getName()));
            }
            if (msg.hasToolCalls()) {
                apiMsg.setToolCalls(msg.getToolCalls().stream()
                        .map(this::toApiToolCall)
                        .toList());
            }
            if (msg.getToolCallId() != null) {
                apiMsg.setToolCallId(msg.getToolCallId());
            }
            messages.add(apiMsg);
        }
        apiRequest.setMessages(messages);

        if (request.getTools() != null && !request.getTools().isEmpty()) {
            apiRequest.setTools(request.getTools().stream()
                    .map(tool -> {
                        ApiToolFunction func = new ApiToolFunction();
                        func.setName(tool.getName());
                        func.setDescription(tool.getDescription());
                        func.setParameters(tool.getInputSchema());
                        ApiTool apiTool = new ApiTool();
                        apiTool.setType("function");
                        apiTool.setFunction(func);
                        return apiTool;
                    })
                    .toList());
        }
        return apiRequest;
    }

    LlmResponse convertResponse(ChatCompletionResponse apiResponse) {
        if (apiResponse == null || apiResponse.getChoices() == null || apiResponse.getChoices().isEmpty()) {
            return LlmResponse.builder()
                    .content("")
                    .finishReason("error")
                    .build();
        }

        ChatChoice choice = apiResponse.getChoices().get(0);
        ApiMessage message = choice.getMessage() != null ? choice.getMessage() : new ApiMessage();

        List<LlmToolCall> toolCalls = null;
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            toolCalls = message.getToolCalls().stream()
                    .filter(tc -> tc.getFunction() != null)
                    .map(tc -> LlmToolCalls.fromRaw(objectMapper, tc.getId(), tc.getFunction().getName(),
                            tc.getFunction().getArguments()))
                    .toList();
        }

        return LlmResponse.builder()
                .content(message.getContent())
                .toolCalls(toolCalls)
                .model(apiResponse.getModel())
                .finishReason(choice.getFinishReason())
                .build();
    }

    private ApiToolCall toApiToolCall(LlmToolCall toolCall) {
        ApiFunction func = new ApiFunction();
        func.setName(toolCall.getName());
        func.setArguments(LlmToolCalls.toJson(objectMapper, toolCall.getArguments()));
        ApiToolCall apiToolCall = new ApiToolCall();
        apiToolCall.setId(toolCall.getId());
        apiToolCall.setType("function");
        apiToolCall.setFunction(func);
        return apiToolCall;
    }

    private String authorization() {
        String apiKey = properties.getLlm().getApiKey();
        return BEARER_PREFIX + (apiKey != null ? apiKey : "");
    }

    // OpenAI only accepts [a-zA-Z0-9_-] in participant names
    private static String sanitizeName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        return name.replaceAll("[^a-zA-Z0-9_-]", "_");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }

    // Feign API interface
    public interface ChatCompletionApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Authorization: {authorization}"
        })
        ChatCompletionResponse chatCompletion(@Param("authorization") String authorization,
                ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private List<ApiTool> tools;
        private double temperature;
        @JsonProperty("max_tokens")
        private Integer maxTokens;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChatChoice {
        private int index;
        private ApiMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiMessage {
        private String role;
        private String content;
        private String name;
        @JsonProperty("tool_calls")
        private List<ApiToolCall> toolCalls;
        @JsonProperty("tool_call_id")
        private String toolCallId;
    }

    @Data
    public static class ApiTool {
        private String type;
        private ApiToolFunction function;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiToolFunction {
        private String name;
        private String description;
        private Map<String, Object> parameters;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiToolCall {
        private String id;
        private String type;
        private ApiFunction function;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiFunction {
        private String name;
        private String arguments;
    }
}

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

package me.golemcore.teams.adapter.outbound.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.model.McpServerConfig;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 side of the MCP protocol shared by all transports: the
 * initialize handshake, tool listing, tool calls and the mapping of MCP
 * failures onto {@link ToolFailureKind}.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean. Created per configured server by {@link McpClientManager}.
 */
public abstract class AbstractMcpClient implements McpSession {

    protected static final String JSONRPC_VERSION = "2.0";
    protected static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final McpServerConfig config;
    protected final ObjectMapper objectMapper;
    protected final long requestTimeoutSeconds;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private volatile List<ToolDefinition> cachedTools = List.of();

    protected AbstractMcpClient(McpServerConfig config, ObjectMapper objectMapper, long requestTimeoutSeconds) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    /**
     * Opens the transport (spawns the process, prepares the HTTP client).
     */
    protected abstract void open() throws IOException;

    /**
     * Sends a serialized request and returns a future for its {@code result}
     * node. JSON-RPC errors complete the future with {@link McpException}.
     */
    protected abstract CompletableFuture<JsonNode> send(int id, String json);

    protected abstract void sendNotificationJson(String json) throws IOException;

    @Override
    public List<ToolDefinition> start() {
        log.info("[MCP:{}] Starting {} server", getServerName(), config.getTransport());
        int timeoutSeconds = config.getStartupTimeoutSeconds();
        try {
            open();

            JsonNode initResult = sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-teams",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MCP:{}] Initialized: {}", getServerName(), initResult);

            sendNotification("notifications/initialized");

            JsonNode toolsResult = sendRequest("tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            cachedTools = parseToolDefinitions(toolsResult);
            log.info("[MCP:{}] Available tools: {}", getServerName(),
                    cachedTools.stream().map(ToolDefinition::getName).toList());
            return cachedTools;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new McpStartupException("Interrupted while starting MCP server " + getServerName(), e);
        } catch (IOException | ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", getServerName(), e.getMessage());
            close();
            throw new McpStartupException("MCP server " + getServerName() + " failed to start: " + e.getMessage(), e);
        }
    }

    @Override
    public CompletableFuture<ToolOutput> callTool(String name, Map<String, Object> arguments) {
        return sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(result -> parseToolCallResult(name, result))
                .exceptionally(this::toFailure);
    }

    @Override
    public String getServerName() {
        return config.getName();
    }

    public List<ToolDefinition> getCachedTools() {
        return cachedTools;
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);
        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] → {}", getServerName(), json);
            return send(id, json).orTimeout(requestTimeoutSeconds, TimeUnit.SECONDS);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    void sendNotification(String method) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", getServerName(), json);
            sendNotificationJson(json);
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", getServerName(), method, e.getMessage());
        }
    }

    /**
     * Completes {@code pending} from a JSON-RPC response message.
     */
    protected void completeFromMessage(JsonNode message, CompletableFuture<JsonNode> pending) {
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
        } else {
            pending.complete(message.get("result"));
        }
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null || name.isBlank()) {
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Failed to parse inputSchema for tool '{}': {}", getServerName(), name,
                            e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return List.copyOf(tools);
    }

    ToolOutput parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolOutput.failure("No result from MCP tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!output.isEmpty()) {
                        output.append("\n");
                    }
                    output.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolOutput.failure(ToolFailureKind.PROVIDER_ERROR,
                    output.isEmpty() ? "MCP tool error" : output.toString());
        }
        return ToolOutput.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    ToolOutput toFailure(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof McpException mcp) {
            ToolFailureKind kind = switch (mcp.getCode()) {
            case McpException.INVALID_PARAMS, McpException.INVALID_REQUEST -> ToolFailureKind.VALIDATION;
            case McpException.PARSE_ERROR -> ToolFailureKind.PROVIDER_ERROR;
            case McpException.METHOD_NOT_FOUND -> ToolFailureKind.UNKNOWN_TOOL;
            default -> ToolFailureKind.TRANSIENT;
            };
            return ToolOutput.failure(kind, "MCP error " + mcp.getCode() + ": " + mcp.getMessage());
        }
        if (cause instanceof TimeoutException) {
            return ToolOutput.failure(ToolFailureKind.TIMEOUT,
                    "MCP server " + getServerName() + " did not answer within " + requestTimeoutSeconds + "s");
        }
        if (cause instanceof McpHttpException http && !http.isRetryable()) {
            return ToolOutput.failure(ToolFailureKind.PROVIDER_ERROR, "MCP server " + getServerName()
                    + " rejected the call with HTTP " + http.getStatus());
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return ToolOutput.failure(ToolFailureKind.TRANSIENT, "MCP transport failure: " + cause.getMessage());
        }
        return ToolOutput.failure("MCP tool call failed: " + cause.getMessage());
    }
}

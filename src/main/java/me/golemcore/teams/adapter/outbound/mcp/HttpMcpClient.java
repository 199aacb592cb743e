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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.model.McpServerConfig;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * MCP client for a remote server reached with JSON-RPC over HTTP POST.
 *
 * <p>
 * Responses may come back as plain JSON or as a server-sent event stream; in
 * the latter case the {@code data:} line carrying the matching id is used. A
 * {@code Mcp-Session-Id} header returned by the handshake is echoed on every
 * later request.
 */
public class HttpMcpClient extends AbstractMcpClient {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String SESSION_HEADER = "Mcp-Session-Id";
    private static final String EVENT_STREAM = "text/event-stream";

    private final OkHttpClient baseClient;

    private OkHttpClient httpClient;
    private volatile String sessionId;
    private volatile boolean running;

    public HttpMcpClient(McpServerConfig config, ObjectMapper objectMapper, OkHttpClient baseClient,
            long requestTimeoutSeconds) {
        super(config, objectMapper, requestTimeoutSeconds);
        this.baseClient = baseClient;
    }

    @Override
    protected void open() throws IOException {
        if (config.getUrl() == null || config.getUrl().isBlank()) {
            throw new IOException("No URL configured for remote MCP server " + getServerName());
        }
        httpClient = baseClient.newBuilder()
                .callTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .build();
        running = true;
        log.info("[MCP:{}] Using remote endpoint {}", getServerName(), config.getUrl());
    }

    @Override
    protected CompletableFuture<JsonNode> send(int id, String json) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        if (!running) {
            future.completeExceptionally(new IOException("MCP client is closed"));
            return future;
        }
        Call call = httpClient.newCall(buildRequest(json));
        future.whenComplete((result, ex) -> {
            if (future.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failedCall, IOException e) {
                future.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completedCall, Response response) {
                try (response) {
                    handleResponse(id, response, future);
                } catch (IOException | RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }
        });
        return future;
    }

    @Override
    protected void sendNotificationJson(String json) throws IOException {
        try (Response response = httpClient.newCall(buildRequest(json)).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " for notification");
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", getServerName());
        running = false;
    }

    private Request buildRequest(String json) {
        Request.Builder builder = new Request.Builder()
                .url(config.getUrl())
                .header("Accept", "application/json, " + EVENT_STREAM)
                .post(RequestBody.create(json, JSON));
        String session = sessionId;
        if (session != null) {
            builder.header(SESSION_HEADER, session);
        }
        return builder.build();
    }

    private void handleResponse(int id, Response response, CompletableFuture<JsonNode> future) throws IOException {
        String session = response.header(SESSION_HEADER);
        if (session != null && !session.isBlank()) {
            sessionId = session;
        }
        if (!response.isSuccessful()) {
            throw new McpHttpException(response.code());
        }
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        log.debug("[MCP:{}] ← {}", getServerName(), text);

        String contentType = response.header("Content-Type", "");
        JsonNode message = contentType.startsWith(EVENT_STREAM)
                ? findEventMessage(id, text)
                : objectMapper.readTree(text);
        if (message == null || message.isMissingNode()) {
            throw new IOException("MCP server sent no response for request " + id);
        }
        completeFromMessage(message, future);
    }

    private JsonNode findEventMessage(int id, String stream) throws IOException {
        for (String line : stream.split("\\r?\\n")) {
            if (!line.startsWith("data:")) {
                continue;
            }
            JsonNode candidate = objectMapper.readTree(line.substring(5).trim());
            JsonNode idNode = candidate.get("id");
            if (idNode != null && idNode.canConvertToInt() && idNode.asInt() == id) {
                return candidate;
            }
        }
        return null;
    }
}

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.model.McpServerConfig;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * MCP client for a locally spawned server process speaking JSON-RPC over
 * stdin/stdout.
 *
 * <ul>
 * <li>Writes one JSON-RPC request per line to the process stdin
 * <li>Reads responses from stdout in a reader thread and matches them by id
 * <li>Drains stderr to the DEBUG log
 * </ul>
 */
public class StdioMcpClient extends AbstractMcpClient {

    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private Process process;
    private BufferedWriter writer;
    private volatile boolean running;

    public StdioMcpClient(McpServerConfig config, ObjectMapper objectMapper, long requestTimeoutSeconds) {
        super(config, objectMapper, requestTimeoutSeconds);
    }

    @Override
    protected void open() throws IOException {
        log.info("[MCP:{}] Spawning: {}", getServerName(), config.getCommand());
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        process = pb.start();
        running = true;
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        Thread readerThread = new Thread(this::readLoop, "mcp-reader-" + getServerName());
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + getServerName());
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    @Override
    protected CompletableFuture<JsonNode> send(int id, String json) {
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);
        if (!isRunning()) {
            future.completeExceptionally(new IOException("MCP process is not running"));
            return future;
        }
        try {
            writeLine(json);
        } catch (IOException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    @Override
    protected void sendNotificationJson(String json) throws IOException {
        writeLine(json);
    }

    @Override
    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    private void writeLine(String json) throws IOException {
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (!line.isEmpty()) {
                    handleLine(line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", getServerName(), e.getMessage());
            }
        } finally {
            running = false;
            failPending("MCP process closed");
        }
    }

    void handleLine(String line) {
        log.debug("[MCP:{}] ← {}", getServerName(), line);
        try {
            JsonNode message = objectMapper.readTree(line);
            JsonNode idNode = message.get("id");
            if (idNode != null && idNode.canConvertToInt()) {
                CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
                if (pending != null) {
                    completeFromMessage(message, pending);
                } else {
                    log.warn("[MCP:{}] Received response for unknown id: {}", getServerName(), idNode);
                }
            } else {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", getServerName(), method);
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", getServerName(), e.getMessage());
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", getServerName(), line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", getServerName(), e.getMessage());
        }
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", getServerName());
        running = false;
        failPending("MCP client closing");

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", getServerName(), e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.model.McpServerConfig;
import me.golemcore.teams.domain.model.McpTransport;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.port.outbound.McpPort;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the MCP sessions configured under {@code teams.mcp.servers}.
 *
 * <p>
 * Servers are connected once, when the tool registry is built at startup. Each
 * advertised tool that passes the server's {@code capabilities} filter becomes
 * a {@link McpToolAdapter}. A server that fails to start is logged and
 * skipped; its tools are simply absent from the registry.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code teams.mcp.enabled} - Enable/disable MCP providers
 * <li>{@code teams.mcp.request-timeout-seconds} - Per-request timeout
 * <li>{@code teams.mcp.servers[*]} - Server definitions
 * </ul>
 *
 * @see AbstractMcpClient
 * @see McpToolAdapter
 */
@Component
@Slf4j
public class McpClientManager implements McpPort {

    private final TeamsProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient okHttpClient;

    private final Map<String, McpSession> sessions = new ConcurrentHashMap<>();

    public McpClientManager(TeamsProperties properties, ObjectMapper objectMapper, OkHttpClient okHttpClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.okHttpClient = okHttpClient;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public synchronized List<ToolComponent> connectAll() {
        TeamsProperties.McpProperties mcp = properties.getMcp();
        if (!mcp.isEnabled()) {
            log.info("[MCP] Disabled, no servers connected");
            return List.of();
        }

        List<ToolComponent> tools = new ArrayList<>();
        for (TeamsProperties.McpServerProperties serverProps : mcp.getServers()) {
            if (!serverProps.isEnabled()) {
                log.debug("[MCP] Server '{}' disabled, skipping", serverProps.getName());
                continue;
            }
            McpServerConfig config = toConfig(serverProps);
            McpSession session = createSession(config);
            try {
                List<ToolDefinition> definitions = session.start();
                McpSession previous = sessions.put(config.getName(), session);
                if (previous != null) {
                    previous.close();
                }
                int exposed = 0;
                for (ToolDefinition definition : definitions) {
                    if (config.exposes(definition.getName())) {
                        tools.add(new McpToolAdapter(definition, session));
                        exposed++;
                    } else {
                        log.debug("[MCP:{}] Tool '{}' not in capabilities, hidden", config.getName(),
                                definition.getName());
                    }
                }
                log.info("[MCP:{}] Connected, {} of {} tools exposed", config.getName(), exposed,
                        definitions.size());
            } catch (McpStartupException e) {
                log.error("[MCP:{}] Failed to connect: {}", config.getName(), e.getMessage());
                session.close();
            }
        }
        return List.copyOf(tools);
    }

    protected McpSession createSession(McpServerConfig config) {
        long timeout = properties.getMcp().getRequestTimeoutSeconds();
        if (config.getTransport() == McpTransport.REMOTE) {
            return new HttpMcpClient(config, objectMapper, okHttpClient, timeout);
        }
        return new StdioMcpClient(config, objectMapper, timeout);
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("[MCP] Shutting down {} MCP clients", sessions.size());
        for (Map.Entry<String, McpSession> entry : sessions.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                log.warn("[MCP] Error closing client '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        sessions.clear();
    }

    private static McpServerConfig toConfig(TeamsProperties.McpServerProperties props) {
        return McpServerConfig.builder()
                .name(props.getName())
                .transport(props.getTransport())
                .command(props.getCommand())
                .url(props.getUrl())
                .env(props.getEnv())
                .capabilities(new LinkedHashSet<>(props.getCapabilities()))
                .startupTimeoutSeconds(props.getStartupTimeoutSeconds())
                .build();
    }
}

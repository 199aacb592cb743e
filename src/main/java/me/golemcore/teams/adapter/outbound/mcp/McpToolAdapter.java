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

import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps a single MCP tool as a {@link ToolComponent} so the registry can treat
 * it like a local tool. Created by {@link McpClientManager}, not a Spring bean.
 */
public class McpToolAdapter implements ToolComponent {

    private final ToolDefinition definition;
    private final McpSession session;

    public McpToolAdapter(ToolDefinition definition, McpSession session) {
        this.definition = definition;
        this.session = session;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        if (!session.isRunning()) {
            return CompletableFuture.completedFuture(ToolOutput.failure(ToolFailureKind.TRANSIENT,
                    "MCP server not running: " + session.getServerName()));
        }
        return session.callTool(definition.getName(), parameters);
    }

    @Override
    public String getProviderName() {
        return "mcp:" + session.getServerName();
    }
}

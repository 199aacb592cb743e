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

import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Connection to one MCP server, independent of the transport.
 *
 * @see StdioMcpClient
 * @see HttpMcpClient
 */
public interface McpSession extends Closeable {

    /**
     * Performs the initialize handshake and fetches the advertised tools.
     *
     * @throws McpStartupException
     *             if the server cannot be reached or does not answer in time
     */
    List<ToolDefinition> start();

    CompletableFuture<ToolOutput> callTool(String name, Map<String, Object> arguments);

    boolean isRunning();

    String getServerName();

    @Override
    void close();
}

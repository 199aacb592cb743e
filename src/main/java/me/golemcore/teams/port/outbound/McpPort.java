package me.golemcore.teams.port.outbound;

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

import me.golemcore.teams.domain.component.ToolComponent;

import java.util.List;

/**
 * Port for the configured MCP tool servers. Abstracts server processes and
 * remote endpoints from the domain layer.
 */
public interface McpPort {

    /**
     * Connects to every enabled server and returns one tool handle per exposed
     * tool. Servers that fail to start are logged and skipped.
     */
    List<ToolComponent> connectAll();

    /**
     * Closes all server connections and child processes.
     */
    void shutdown();
}

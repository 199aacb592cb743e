package me.golemcore.teams.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Static description of one MCP tool server. Loaded once at startup and never
 * mutated while tasks run.
 */
@Data
@Builder
public class McpServerConfig {

    private String name;

    @Builder.Default
    private McpTransport transport = McpTransport.LOCAL_PROCESS;

    private String command;
    private String url;

    @Builder.Default
    private Map<String, String> env = new LinkedHashMap<>();

    /**
     * Tools exposed from this server. Empty means everything it advertises.
     */
    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    @Builder.Default
    private int startupTimeoutSeconds = 30;

    public boolean exposes(String toolName) {
        return capabilities == null || capabilities.isEmpty() || capabilities.contains(toolName);
    }
}

package me.golemcore.teams.infrastructure.config;

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

import lombok.Data;
import me.golemcore.teams.domain.model.AfterToolResultPolicy;
import me.golemcore.teams.domain.model.McpTransport;
import me.golemcore.teams.domain.model.RoutingPolicyType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.yml under the
 * {@code teams.*} prefix.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link LlmProperties} - chat-completion backend</li>
 * <li>{@link StorageProperties} - conversation log location</li>
 * <li>{@link CoordinatorProperties} - turn-taking limits and task pool</li>
 * <li>{@link GatewayProperties} - tool timeout and retry policy</li>
 * <li>{@link ToolsProperties} - local tool enablement and credentials</li>
 * <li>{@link McpProperties} - MCP tool servers</li>
 * <li>agent and team definitions</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "teams")
@Data
public class TeamsProperties {

    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private StorageProperties storage = new StorageProperties();
    private CoordinatorProperties coordinator = new CoordinatorProperties();
    private GatewayProperties gateway = new GatewayProperties();
    private ToolsProperties tools = new ToolsProperties();
    private McpProperties mcp = new McpProperties();
    private List<AgentProperties> agents = new ArrayList<>();
    private List<TeamProperties> definitions = new ArrayList<>();
    private String defaultTeam = "research";

    @Data
    public static class LlmProperties {
        private String provider = "openai";
        private String baseUrl = "https://api.groq.com/openai/v1";
        private String apiKey;
        private String model = "llama3-8b-8192";
        private double temperature = 0.7;
        private Integer maxTokens;
        private int timeoutSeconds = 60;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/teams";
        private String tasksDirectory = "tasks";
    }

    @Data
    public static class CoordinatorProperties {
        private int maxTurns = 20;
        private String completionToken = "TERMINATE";
        private AfterToolResultPolicy afterToolResult = AfterToolResultPolicy.SAME_SPEAKER;
        private int maxStepRetries = 2;
        private long stepRetryBackoffMs = 1000;
        private int maxConcurrentTasks = 4;
        private boolean resumeOnStartup = false;
    }

    @Data
    public static class GatewayProperties {
        private long timeoutMs = 30000;
        private int maxRetries = 2;
        private long retryBackoffMs = 500;
        private int maxResultChars = 50000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private WorkspaceToolProperties workspace = new WorkspaceToolProperties();
        private BraveSearchToolProperties braveSearch = new BraveSearchToolProperties();
        private GitHubToolProperties github = new GitHubToolProperties();
    }

    @Data
    public static class WorkspaceToolProperties {
        private boolean enabled = true;
        private String path = "${user.home}/.golemcore/teams/workspace";
        private long maxFileSize = 1024 * 1024;
    }

    @Data
    public static class BraveSearchToolProperties {
        private boolean enabled = true;
        private String apiKey;
        private int defaultCount = 5;
    }

    @Data
    public static class GitHubToolProperties {
        private boolean enabled = true;
        private String token;
        private String apiUrl = "https://api.github.com";
    }

    // ==================== MCP ====================

    @Data
    public static class McpProperties {
        private boolean enabled = true;
        private long requestTimeoutSeconds = 30;
        private List<McpServerProperties> servers = new ArrayList<>();
    }

    @Data
    public static class McpServerProperties {
        private String name;
        private boolean enabled = false;
        private McpTransport transport = McpTransport.LOCAL_PROCESS;
        private String command;
        private String url;
        private Map<String, String> env = new LinkedHashMap<>();
        private List<String> capabilities = new ArrayList<>();
        private int startupTimeoutSeconds = 30;
    }

    // ==================== AGENTS & TEAMS ====================

    @Data
    public static class AgentProperties {
        private String name;
        private String role;
        private String persona;
        private List<String> allowedTools = new ArrayList<>();
    }

    @Data
    public static class TeamProperties {
        private String name;
        private List<String> members = new ArrayList<>();
        private RoutingPolicyType routing = RoutingPolicyType.ROUND_ROBIN;
        private String lead;
        private Integer maxTurns;
    }
}

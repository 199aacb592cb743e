package me.golemcore.teams;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for golemcore-teams.
 *
 * <p>
 * Runs teams of LLM agents on user tasks. A coordinator picks who speaks next,
 * agents reply or request tools, and every step is appended to a durable
 * per-task conversation log so runs can be audited and resumed.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (/api/tasks, /api/teams, /api/tools)
 * Domain Layer       → TeamCoordinator, AgentRuntime, ToolGateway, ConversationStore
 * Infrastructure     → LLM/Storage/MCP adapters, local tools
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.yml} under the {@code teams.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TeamsApplication {

    public static void main(String[] args) {
        SpringApplication.run(TeamsApplication.class, args);
    }

}

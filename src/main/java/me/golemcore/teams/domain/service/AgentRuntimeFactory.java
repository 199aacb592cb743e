package me.golemcore.teams.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.teams.domain.model.AgentDefinition;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.domain.runtime.AgentRuntime;
import me.golemcore.teams.domain.runtime.AgentRuntimeProvider;
import me.golemcore.teams.domain.runtime.AgentSettings;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds fresh agent runtimes for a task: each agent sees only the registered
 * tools on its allow-list.
 */
@Component
@RequiredArgsConstructor
public class AgentRuntimeFactory implements AgentRuntimeProvider {

    private final TeamCatalog teamCatalog;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;
    private final TeamsProperties properties;

    @Override
    public Map<String, AgentRuntime> runtimesFor(Team team) {
        TeamsProperties.LlmProperties llm = properties.getLlm();
        AgentSettings settings = new AgentSettings(llm.getModel(), llm.getTemperature(), llm.getMaxTokens(),
                properties.getCoordinator().getCompletionToken(), llm.getTimeoutSeconds());
        Map<String, AgentRuntime> runtimes = new LinkedHashMap<>();
        for (String member : team.members()) {
            AgentDefinition definition = teamCatalog.requireAgent(member);
            runtimes.put(member, new AgentRuntime(definition, team, llmPort,
                    toolRegistry.definitionsFor(definition.getAllowedTools()), settings));
        }
        return runtimes;
    }
}

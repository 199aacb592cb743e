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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.model.AgentDefinition;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent and team definitions loaded from configuration at startup. A team
 * referencing an undefined agent fails startup.
 */
@Component
@Slf4j
public class TeamCatalog {

    private final Map<String, AgentDefinition> agents;
    private final Map<String, Team> teams;
    private final String defaultTeam;

    public TeamCatalog(TeamsProperties properties) {
        Map<String, AgentDefinition> agentMap = new LinkedHashMap<>();
        for (TeamsProperties.AgentProperties agent : properties.getAgents()) {
            if (agent.getName() == null || agent.getName().isBlank()) {
                throw new IllegalStateException("Agent definition without a name");
            }
            agentMap.put(agent.getName(), AgentDefinition.builder()
                    .name(agent.getName())
                    .role(agent.getRole())
                    .persona(agent.getPersona())
                    .allowedTools(new LinkedHashSet<>(agent.getAllowedTools()))
                    .build());
        }

        Map<String, Team> teamMap = new LinkedHashMap<>();
        int defaultMaxTurns = properties.getCoordinator().getMaxTurns();
        for (TeamsProperties.TeamProperties definition : properties.getDefinitions()) {
            for (String member : definition.getMembers()) {
                if (!agentMap.containsKey(member)) {
                    throw new IllegalStateException("Team '" + definition.getName() + "' references unknown agent '"
                            + member + "'");
                }
            }
            int maxTurns = definition.getMaxTurns() != null ? definition.getMaxTurns() : defaultMaxTurns;
            teamMap.put(definition.getName(), new Team(definition.getName(), definition.getMembers(),
                    definition.getRouting(), definition.getLead(), maxTurns));
        }

        this.agents = Collections.unmodifiableMap(agentMap);
        this.teams = Collections.unmodifiableMap(teamMap);
        this.defaultTeam = properties.getDefaultTeam();
        log.info("[Teams] Loaded {} agents and teams {}", agents.size(), teams.keySet());
    }

    public Optional<Team> findTeam(String name) {
        return Optional.ofNullable(teams.get(name));
    }

    /**
     * Resolves a team by name, using the default team for a blank name.
     *
     * @throws IllegalArgumentException
     *             if no such team is defined
     */
    public Team requireTeam(String name) {
        String teamName = name == null || name.isBlank() ? defaultTeam : name;
        return findTeam(teamName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown team: " + teamName));
    }

    public AgentDefinition requireAgent(String name) {
        AgentDefinition agent = agents.get(name);
        if (agent == null) {
            throw new IllegalArgumentException("Unknown agent: " + name);
        }
        return agent;
    }

    public List<Team> getTeams() {
        return new ArrayList<>(teams.values());
    }

    public Map<String, AgentDefinition> getAgents() {
        return agents;
    }
}

package me.golemcore.teams.adapter.inbound.web.controller;

import me.golemcore.teams.adapter.inbound.web.dto.TeamDto;
import me.golemcore.teams.domain.model.RoutingPolicyType;
import me.golemcore.teams.domain.service.TeamCatalog;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class TeamsControllerTest {

    @Test
    void shouldListTeamsWithMembers() {
        TeamsProperties properties = new TeamsProperties();
        properties.getAgents().add(agent("Coordinator", "Coordinator"));
        properties.getAgents().add(agent("Researcher", "Researcher", "web_search"));
        TeamsProperties.TeamProperties research = new TeamsProperties.TeamProperties();
        research.setName("research");
        research.setMembers(List.of("Researcher", "Coordinator"));
        research.setRouting(RoutingPolicyType.COORDINATOR_DIRECTED);
        research.setLead("Coordinator");
        properties.getDefinitions().add(research);
        TeamsController controller = new TeamsController(new TeamCatalog(properties));

        StepVerifier.create(controller.listTeams())
                .assertNext(response -> {
                    List<TeamDto> body = response.getBody();
                    assertNotNull(body);
                    TeamDto team = body.get(0);
                    assertEquals("research", team.getName());
                    assertEquals("COORDINATOR_DIRECTED", team.getRouting());
                    assertEquals("Coordinator", team.getLead());
                    assertEquals(20, team.getMaxTurns());
                    assertEquals("Researcher", team.getMembers().get(0).getName());
                    assertEquals(List.of("web_search"), team.getMembers().get(0).getAllowedTools());
                })
                .verifyComplete();
    }

    private static TeamsProperties.AgentProperties agent(String name, String role, String... tools) {
        TeamsProperties.AgentProperties agent = new TeamsProperties.AgentProperties();
        agent.setName(name);
        agent.setRole(role);
        agent.setAllowedTools(List.of(tools));
        return agent;
    }
}

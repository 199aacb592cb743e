package me.golemcore.teams.domain.service;

import me.golemcore.teams.domain.model.RoutingPolicyType;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TeamCatalogTest {

    private TeamsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getAgents().add(agent("Researcher", "web_search"));
        properties.getAgents().add(agent("Analyst"));
        properties.getDefinitions().add(team("research", 12, "Researcher", "Analyst"));
        properties.getDefinitions().add(team("solo", null, "Analyst"));
    }

    @Test
    void shouldResolveDefaultTeamForBlankName() {
        TeamCatalog catalog = new TeamCatalog(properties);

        Team team = catalog.requireTeam(" ");

        assertEquals("research", team.name());
        assertEquals(List.of("Researcher", "Analyst"), team.members());
        assertEquals("Researcher", team.lead());
        assertEquals(RoutingPolicyType.ROUND_ROBIN, team.routing());
        assertEquals(12, team.maxTurns());
    }

    @Test
    void shouldFallBackToCoordinatorTurnLimit() {
        properties.getCoordinator().setMaxTurns(7);

        Team solo = new TeamCatalog(properties).requireTeam("solo");

        assertEquals(7, solo.maxTurns());
    }

    @Test
    void shouldRejectUnknownTeamAndAgent() {
        TeamCatalog catalog = new TeamCatalog(properties);

        assertThrows(IllegalArgumentException.class, () -> catalog.requireTeam("nope"));
        assertThrows(IllegalArgumentException.class, () -> catalog.requireAgent("Ghost"));
        assertTrue(catalog.requireAgent("Researcher").isToolAllowed("web_search"));
    }

    @Test
    void shouldFailStartupOnTeamWithUnknownMember() {
        properties.getDefinitions().add(team("broken", null, "Ghost"));

        assertThrows(IllegalStateException.class, () -> new TeamCatalog(properties));
    }

    @Test
    void shouldFailStartupOnLeadOutsideTeam() {
        TeamsProperties.TeamProperties directed = team("directed", null, "Researcher");
        directed.setRouting(RoutingPolicyType.COORDINATOR_DIRECTED);
        directed.setLead("Analyst");
        properties.getDefinitions().add(directed);

        assertThrows(IllegalArgumentException.class, () -> new TeamCatalog(properties));
    }

    private static TeamsProperties.AgentProperties agent(String name, String... tools) {
        TeamsProperties.AgentProperties agent = new TeamsProperties.AgentProperties();
        agent.setName(name);
        agent.setRole(name);
        agent.setAllowedTools(List.of(tools));
        return agent;
    }

    private static TeamsProperties.TeamProperties team(String name, Integer maxTurns, String... members) {
        TeamsProperties.TeamProperties team = new TeamsProperties.TeamProperties();
        team.setName(name);
        team.setMaxTurns(maxTurns);
        team.setMembers(List.of(members));
        return team;
    }
}

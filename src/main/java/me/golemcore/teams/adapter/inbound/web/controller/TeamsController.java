package me.golemcore.teams.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.teams.adapter.inbound.web.dto.AgentDto;
import me.golemcore.teams.adapter.inbound.web.dto.TeamDto;
import me.golemcore.teams.domain.model.AgentDefinition;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.domain.service.TeamCatalog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only view of the configured teams and their agents.
 */
@RestController
@RequestMapping("/api/teams")
@RequiredArgsConstructor
public class TeamsController {

    private final TeamCatalog teamCatalog;

    @GetMapping
    public Mono<ResponseEntity<List<TeamDto>>> listTeams() {
        List<TeamDto> dtos = teamCatalog.getTeams().stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    private TeamDto toDto(Team team) {
        List<AgentDto> members = team.members().stream()
                .map(teamCatalog::requireAgent)
                .map(TeamsController::toDto)
                .toList();
        return TeamDto.builder()
                .name(team.name())
                .routing(team.routing().name())
                .lead(team.lead())
                .maxTurns(team.maxTurns())
                .members(members)
                .build();
    }

    private static AgentDto toDto(AgentDefinition agent) {
        return AgentDto.builder()
                .name(agent.getName())
                .role(agent.getRole())
                .allowedTools(List.copyOf(agent.getAllowedTools()))
                .build();
    }
}

package me.golemcore.teams.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.teams.adapter.inbound.web.dto.ToolCatalogResponse;
import me.golemcore.teams.adapter.inbound.web.dto.ToolDto;
import me.golemcore.teams.domain.service.ToolRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Tool catalog with its version hash.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public Mono<ResponseEntity<ToolCatalogResponse>> listTools() {
        List<ToolDto> tools = toolRegistry.getTools().stream()
                .map(tool -> ToolDto.builder()
                        .name(tool.getToolName())
                        .description(tool.getDefinition().getDescription())
                        .provider(tool.getProviderName())
                        .inputSchema(tool.getDefinition().getInputSchema())
                        .build())
                .sorted(Comparator.comparing(ToolDto::getName))
                .toList();
        return Mono.just(ResponseEntity.ok(ToolCatalogResponse.builder()
                .version(toolRegistry.getVersion())
                .tools(tools)
                .build()));
    }
}

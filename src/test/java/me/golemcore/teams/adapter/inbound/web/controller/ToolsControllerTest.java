package me.golemcore.teams.adapter.inbound.web.controller;

import me.golemcore.teams.adapter.inbound.web.dto.ToolCatalogResponse;
import me.golemcore.teams.domain.service.ToolRegistry;
import me.golemcore.teams.testsupport.ScriptedTool;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ToolsControllerTest {

    @Test
    void shouldListToolsSortedWithCatalogVersion() {
        ToolRegistry registry = new ToolRegistry(List.of(ScriptedTool.writeFile(), ScriptedTool.noArgs("list_files")));
        ToolsController controller = new ToolsController(registry);

        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    ToolCatalogResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(registry.getVersion(), body.getVersion());
                    assertEquals(List.of("list_files", "write_file"),
                            body.getTools().stream().map(tool -> tool.getName()).toList());
                })
                .verifyComplete();
    }
}

package me.golemcore.teams.testsupport;

import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Tool double that replays scripted futures and records every invocation.
 * Once the script runs out, every call succeeds with "ok".
 */
public class ScriptedTool implements ToolComponent {

    private final ToolDefinition definition;
    private final String provider;
    private final Deque<Supplier<CompletableFuture<ToolOutput>>> script = new ArrayDeque<>();
    private final List<Map<String, Object>> invocations = Collections.synchronizedList(new ArrayList<>());
    private boolean enabled = true;

    public ScriptedTool(String name, Map<String, Object> inputSchema) {
        this(name, inputSchema, "local");
    }

    public ScriptedTool(String name, Map<String, Object> inputSchema, String provider) {
        this.definition = ToolDefinition.builder()
                .name(name)
                .description("Scripted " + name)
                .inputSchema(inputSchema)
                .build();
        this.provider = provider;
    }

    public static ScriptedTool writeFile() {
        return new ScriptedTool("write_file", Map.of(
                "type", "object",
                "properties", Map.of(
                        "file_path", Map.of("type", "string"),
                        "content", Map.of("type", "string")),
                "required", List.of("file_path", "content"),
                "additionalProperties", false));
    }

    public static ScriptedTool noArgs(String name) {
        return new ScriptedTool(name, Map.of("type", "object", "properties", Map.of()));
    }

    public ScriptedTool thenReturn(ToolOutput output) {
        script.add(() -> CompletableFuture.completedFuture(output));
        return this;
    }

    public ScriptedTool thenFail(Throwable error) {
        script.add(() -> CompletableFuture.failedFuture(error));
        return this;
    }

    /**
     * Next invocation returns a future that never completes.
     */
    public ScriptedTool thenHang() {
        script.add(CompletableFuture::new);
        return this;
    }

    public ScriptedTool thenThrow(RuntimeException error) {
        script.add(() -> {
            throw error;
        });
        return this;
    }

    public ScriptedTool disabled() {
        this.enabled = false;
        return this;
    }

    public int invocationCount() {
        return invocations.size();
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        invocations.add(parameters);
        Supplier<CompletableFuture<ToolOutput>> next;
        synchronized (script) {
            next = script.poll();
        }
        return next != null ? next.get() : CompletableFuture.completedFuture(ToolOutput.success("ok"));
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getProviderName() {
        return provider;
    }
}

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

package me.golemcore.teams.tools;

import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Lists the entries of a workspace directory, directories first, then files,
 * each group sorted by name.
 */
@Component
public class ListFilesTool extends AbstractWorkspaceTool {

    private static final String PARAM_DIRECTORY = "directory";
    private static final int MAX_ENTRIES = 100;

    public ListFilesTool(TeamsProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("list_files")
                .description("List files and directories in a workspace directory.")
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_DIRECTORY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "Directory relative to the workspace root (default: \".\")")),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object requested = parameters.get(PARAM_DIRECTORY);
            Path dir = resolveSafePath(requested != null ? requested.toString() : ".");
            if (!Files.isDirectory(dir)) {
                return ToolOutput.failure("Directory not found: " + relativePath(dir));
            }
            try (Stream<Path> stream = Files.list(dir)) {
                List<Path> entries = stream
                        .sorted((a, b) -> {
                            int byType = Boolean.compare(!Files.isDirectory(a), !Files.isDirectory(b));
                            return byType != 0 ? byType : a.getFileName().compareTo(b.getFileName());
                        })
                        .limit(MAX_ENTRIES)
                        .toList();
                if (entries.isEmpty()) {
                    return ToolOutput.success("Directory " + relativePath(dir) + " is empty");
                }
                StringBuilder sb = new StringBuilder();
                sb.append("Files in ").append(relativePath(dir)).append(":\n");
                for (Path entry : entries) {
                    String name = entry.getFileName().toString();
                    sb.append(Files.isDirectory(entry) ? "[DIR]  " + name + "/" : "[FILE] " + name).append("\n");
                }
                return ToolOutput.success(sb.toString().stripTrailing());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + relativePath(dir), e);
            }
        });
    }
}

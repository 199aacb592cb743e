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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Creates or overwrites a UTF-8 text file in the workspace, creating parent
 * directories as needed.
 */
@Component
@Slf4j
public class WriteFileTool extends AbstractWorkspaceTool {

    private static final String PARAM_FILE_PATH = "file_path";
    private static final String PARAM_CONTENT = "content";

    public WriteFileTool(TeamsProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_file")
                .description("Write text content to a file in the shared workspace, replacing any existing file.")
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_FILE_PATH, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "File path relative to the workspace root"),
                                PARAM_CONTENT, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "Text to write")),
                        "required", List.of(PARAM_FILE_PATH, PARAM_CONTENT),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Path path = resolveSafePath((String) parameters.get(PARAM_FILE_PATH));
            String content = (String) parameters.get(PARAM_CONTENT);
            if (Files.isDirectory(path)) {
                return ToolOutput.failure("Path is a directory: " + relativePath(path));
            }
            if (content.getBytes(StandardCharsets.UTF_8).length > maxFileSize) {
                return ToolOutput.failure("Content too large (max " + maxFileSize + " bytes)");
            }
            try {
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, content, StandardCharsets.UTF_8);
                log.info("[Tools] write_file {} ({} chars)", relativePath(path), content.length());
                return ToolOutput.success("File written successfully: " + relativePath(path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + relativePath(path), e);
            }
        });
    }
}

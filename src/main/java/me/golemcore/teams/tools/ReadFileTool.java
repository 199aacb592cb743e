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
 * Reads a UTF-8 text file from the workspace.
 */
@Component
@Slf4j
public class ReadFileTool extends AbstractWorkspaceTool {

    private static final String PARAM_FILE_PATH = "file_path";

    public ReadFileTool(TeamsProperties properties) {
        super(properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_file")
                .description("Read the contents of a text file in the shared workspace.")
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_FILE_PATH, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "File path relative to the workspace root")),
                        "required", List.of(PARAM_FILE_PATH),
                        "additionalProperties", false))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Path path = resolveSafePath((String) parameters.get(PARAM_FILE_PATH));
            if (!Files.exists(path)) {
                return ToolOutput.failure("File not found: " + relativePath(path));
            }
            if (!Files.isRegularFile(path)) {
                return ToolOutput.failure("Not a file: " + relativePath(path));
            }
            try {
                long size = Files.size(path);
                if (size > maxFileSize) {
                    return ToolOutput.failure("File too large: " + size + " bytes (max " + maxFileSize + ")");
                }
                String content = Files.readString(path, StandardCharsets.UTF_8);
                log.debug("[Tools] read_file {} ({} bytes)", relativePath(path), size);
                return ToolOutput.success(content);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + relativePath(path), e);
            }
        });
    }
}

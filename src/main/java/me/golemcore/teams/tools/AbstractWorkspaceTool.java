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
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.infrastructure.config.TeamsProperties;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Base for tools working on files inside the sandboxed workspace directory.
 *
 * <p>
 * All paths are resolved relative to the workspace root. Absolute paths,
 * {@code ..} segments leaving the root and symlinks pointing outside it are
 * rejected with {@link ToolValidationException}.
 *
 * <p>
 * Configuration: {@code teams.tools.workspace.*}
 */
@Slf4j
public abstract class AbstractWorkspaceTool implements ToolComponent {

    protected static final String TYPE_OBJECT = "object";
    protected static final String TYPE_STRING = "string";

    protected final Path workspaceRoot;
    protected final long maxFileSize;
    private final boolean enabled;

    protected AbstractWorkspaceTool(TeamsProperties properties) {
        TeamsProperties.WorkspaceToolProperties config = properties.getTools().getWorkspace();
        this.enabled = config.isEnabled();
        this.maxFileSize = config.getMaxFileSize();
        String path = config.getPath().replace("${user.home}", System.getProperty("user.home"));
        this.workspaceRoot = Paths.get(path).toAbsolutePath().normalize();
        if (enabled) {
            try {
                Files.createDirectories(workspaceRoot);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create workspace directory: " + workspaceRoot, e);
            }
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Resolves {@code pathStr} inside the workspace.
     *
     * @throws ToolValidationException
     *             if the path is malformed or escapes the workspace
     */
    protected Path resolveSafePath(String pathStr) {
        if (pathStr == null || pathStr.isBlank()) {
            throw new ToolValidationException("Path must not be empty");
        }
        Path resolved;
        try {
            Path requested = Paths.get(pathStr);
            if (requested.isAbsolute()) {
                throw new ToolValidationException("Absolute paths are not allowed: " + pathStr);
            }
            resolved = workspaceRoot.resolve(requested).normalize();
        } catch (InvalidPathException e) {
            throw new ToolValidationException("Invalid path: " + pathStr);
        }

        if (!resolved.startsWith(workspaceRoot)) {
            log.warn("[Tools] Path traversal blocked: {}", pathStr);
            throw new ToolValidationException("Path must stay within the workspace: " + pathStr);
        }

        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing != null) {
            try {
                Path realPath = existing.toRealPath();
                if (!realPath.startsWith(workspaceRoot.toRealPath())) {
                    log.warn("[Tools] Symlink escape blocked: {} -> {}", resolved, realPath);
                    throw new ToolValidationException("Path must stay within the workspace: " + pathStr);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to resolve real path of " + pathStr, e);
            }
        }
        return resolved;
    }

    protected String relativePath(Path path) {
        String relative = workspaceRoot.relativize(path).toString();
        return relative.isEmpty() ? "." : relative;
    }
}

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

import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Fetches a file from a GitHub repository branch.
 */
@Component
public class GitHubGetFileTool extends AbstractGitHubTool {

    private static final String PARAM_REPO = "repo";
    private static final String PARAM_FILE_PATH = "file_path";
    private static final String PARAM_BRANCH = "branch";
    private static final String DEFAULT_BRANCH = "main";

    public GitHubGetFileTool(FeignClientFactory feignClientFactory, TeamsProperties properties) {
        super(feignClientFactory, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("github_get_file")
                .description("Get the contents of a file from a GitHub repository.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_REPO, Map.of(
                                        "type", "string",
                                        "description", "Repository as owner/name"),
                                PARAM_FILE_PATH, Map.of(
                                        "type", "string",
                                        "description", "Path of the file inside the repository"),
                                PARAM_BRANCH, Map.of(
                                        "type", "string",
                                        "description", "Branch, tag or commit (default: main)")),
                        "required", List.of(PARAM_REPO, PARAM_FILE_PATH)))
                .build();
    }

    @Override
    protected ToolOutput call(Map<String, Object> parameters) {
        String repo = optionalString(parameters, PARAM_REPO);
        String[] parts = repo != null ? repo.split("/") : new String[0];
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new ToolValidationException("repo must have the form owner/name, got: " + repo);
        }
        String filePath = optionalString(parameters, PARAM_FILE_PATH);
        if (filePath == null) {
            throw new ToolValidationException("file_path must not be empty");
        }
        filePath = filePath.replaceFirst("^/+", "");
        String branch = optionalString(parameters, PARAM_BRANCH);
        branch = branch != null ? branch : DEFAULT_BRANCH;

        GitHubApi.FileContent file = api.getContent(token, parts[0], parts[1], filePath, branch);
        if (file == null || !"file".equals(file.getType())) {
            return ToolOutput.failure(filePath + " in " + repo + " is not a file");
        }
        if (!"base64".equals(file.getEncoding()) || file.getContent() == null) {
            return ToolOutput.failure("File " + filePath + " is too large to fetch through the contents API");
        }
        String content = new String(Base64.getMimeDecoder().decode(file.getContent()), StandardCharsets.UTF_8);
        return ToolOutput.success("File " + repo + "/" + filePath + " (branch " + branch + "):\n" + content);
    }
}

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
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists repositories of a user, or of the token owner when no user is given.
 */
@Component
public class GitHubListReposTool extends AbstractGitHubTool {

    private static final String PARAM_USERNAME = "username";
    private static final int PAGE_SIZE = 30;

    public GitHubListReposTool(FeignClientFactory feignClientFactory, TeamsProperties properties) {
        super(feignClientFactory, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("github_list_repos")
                .description("List GitHub repositories of a user or organization, or your own when omitted.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_USERNAME, Map.of(
                                        "type", "string",
                                        "description", "GitHub user or organization name"))))
                .build();
    }

    @Override
    protected ToolOutput call(Map<String, Object> parameters) {
        String username = optionalString(parameters, PARAM_USERNAME);
        List<GitHubApi.Repository> repos = username != null
                ? api.listUserRepositories(token, username, PAGE_SIZE)
                : api.listOwnRepositories(token, PAGE_SIZE);
        String owner = username != null ? username : "the authenticated user";
        if (repos == null || repos.isEmpty()) {
            return ToolOutput.success("No repositories found for " + owner);
        }
        return ToolOutput.success("Repositories of " + owner + ":\n" + repos.stream()
                .map(AbstractGitHubTool::describe)
                .collect(Collectors.joining("\n")));
    }
}

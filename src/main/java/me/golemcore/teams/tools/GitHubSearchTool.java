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
 * Searches GitHub repositories.
 */
@Component
public class GitHubSearchTool extends AbstractGitHubTool {

    private static final String PARAM_QUERY = "query";
    private static final int RESULT_LIMIT = 10;

    public GitHubSearchTool(FeignClientFactory feignClientFactory, TeamsProperties properties) {
        super(feignClientFactory, properties);
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("github_search")
                .description("Search GitHub repositories by keywords or GitHub search qualifiers.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "Search query, e.g. 'vector database language:java'")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    protected ToolOutput call(Map<String, Object> parameters) {
        String query = optionalString(parameters, PARAM_QUERY);
        if (query == null) {
            return ToolOutput.failure("Search query is required");
        }
        GitHubApi.RepositorySearchResponse response = api.searchRepositories(token, query, RESULT_LIMIT);
        if (response == null || response.getItems() == null || response.getItems().isEmpty()) {
            return ToolOutput.success("No repositories found for: " + query);
        }
        String items = response.getItems().stream()
                .map(AbstractGitHubTool::describe)
                .collect(Collectors.joining("\n"));
        return ToolOutput.success("GitHub repositories for \"" + query + "\" (" + response.getTotalCount()
                + " total, showing " + response.getItems().size() + "):\n" + items);
    }
}

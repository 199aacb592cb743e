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

import feign.FeignException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Base for tools backed by the GitHub REST API with a personal access token.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code teams.tools.github.enabled} - Enable/disable
 * <li>{@code teams.tools.github.token} - Personal access token (required)
 * <li>{@code teams.tools.github.api-url} - API base URL
 * </ul>
 */
@Slf4j
public abstract class AbstractGitHubTool implements ToolComponent {

    protected static final String SERVICE_NAME = "GitHub";

    private final FeignClientFactory feignClientFactory;
    private final TeamsProperties properties;

    protected GitHubApi api;
    protected String token;
    private boolean enabled;

    protected AbstractGitHubTool(FeignClientFactory feignClientFactory, TeamsProperties properties) {
        this.feignClientFactory = feignClientFactory;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        TeamsProperties.GitHubToolProperties config = properties.getTools().getGithub();
        this.enabled = config.isEnabled();
        this.token = config.getToken();
        if (enabled && (token == null || token.isBlank())) {
            log.warn("GitHub tool '{}' is enabled but no token is configured. Disabling.", getToolName());
            this.enabled = false;
        }
        if (enabled) {
            this.api = feignClientFactory.create(GitHubApi.class, config.getApiUrl());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call(parameters);
            } catch (FeignException e) {
                log.warn("[Tools] {} failed with status {}", getToolName(), e.status());
                return HttpToolFailures.fromFeign(SERVICE_NAME, e);
            }
        });
    }

    /**
     * Performs the API call. Feign failures are mapped by the caller.
     */
    protected abstract ToolOutput call(Map<String, Object> parameters);

    protected static String optionalString(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    protected static String describe(GitHubApi.Repository repo) {
        StringBuilder sb = new StringBuilder();
        sb.append("- ").append(repo.getFullName());
        if (repo.getLanguage() != null) {
            sb.append(" [").append(repo.getLanguage()).append("]");
        }
        sb.append(" (").append(repo.getStars()).append(" stars)");
        if (repo.getDescription() != null && !repo.getDescription().isBlank()) {
            sb.append(": ").append(repo.getDescription());
        }
        if (repo.getHtmlUrl() != null) {
            sb.append("\n  ").append(repo.getHtmlUrl());
        }
        return sb.toString();
    }
}

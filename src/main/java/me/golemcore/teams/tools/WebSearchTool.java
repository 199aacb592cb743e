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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Web search through the Brave Search API.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code teams.tools.brave-search.enabled} - Enable/disable
 * <li>{@code teams.tools.brave-search.api-key} - Brave API key (required)
 * <li>{@code teams.tools.brave-search.default-count} - Number of results
 * (default 5)
 * </ul>
 *
 * <p>
 * Rate limits are reported as TRANSIENT failures and retried by the gateway
 * rather than inside the tool.
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COUNT = "count";
    private static final String BRAVE_API_URL = "https://api.search.brave.com";
    private static final int MAX_COUNT = 20;

    private final FeignClientFactory feignClientFactory;
    private final TeamsProperties properties;

    private BraveSearchApi searchApi;
    private boolean enabled;
    private String apiKey;
    private int defaultCount;

    @PostConstruct
    public void init() {
        TeamsProperties.BraveSearchToolProperties config = properties.getTools().getBraveSearch();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();
        this.defaultCount = config.getDefaultCount();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("Web search tool is enabled but the Brave API key is not configured. Disabling.");
            this.enabled = false;
        }
        if (enabled) {
            this.searchApi = feignClientFactory.create(BraveSearchApi.class, BRAVE_API_URL);
            log.info("Web search tool initialized (default results: {})", defaultCount);
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("web_search")
                .description("Search the web. Returns titles, URLs and descriptions of the top results.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", "string",
                                        "description", "The search query"),
                                PARAM_COUNT, Map.of(
                                        "type", "integer",
                                        "description", "Number of results to return (1-20, default: 5)")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            String query = ((String) parameters.get(PARAM_QUERY)).strip();
            if (query.isEmpty()) {
                return ToolOutput.failure("Search query is required");
            }
            int count = defaultCount;
            if (parameters.get(PARAM_COUNT) instanceof Number n) {
                count = Math.max(1, Math.min(MAX_COUNT, n.intValue()));
            }

            try {
                log.debug("[Tools] web_search query='{}', count={}", query, count);
                return buildResult(query, searchApi.search(apiKey, query, count));
            } catch (FeignException e) {
                log.warn("[Tools] web_search failed with status {} for query: {}", e.status(), query);
                return HttpToolFailures.fromFeign("Brave Search", e);
            }
        });
    }

    private ToolOutput buildResult(String query, BraveSearchResponse response) {
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null
                || response.getWeb().getResults().isEmpty()) {
            return ToolOutput.success("No results found for: " + query);
        }
        List<WebResult> results = response.getWeb().getResults();
        String output = results.stream()
                .map(r -> String.format("**%s**%n%s%n%s",
                        r.getTitle(),
                        r.getUrl(),
                        r.getDescription() != null ? r.getDescription() : ""))
                .collect(Collectors.joining("\n\n"));
        return ToolOutput.success(String.format("Search results for \"%s\" (%d results):%n%n", query,
                results.size()) + output);
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        BraveSearchResponse search(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BraveSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }
}

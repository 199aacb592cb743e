package me.golemcore.teams.tools;

import feign.FeignException;
import feign.Request;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSearchToolTest {

    private static final String API_KEY = "brave-key";
    private static final String BRAVE_URL = "https://api.search.brave.com";

    private TeamsProperties properties;
    private FeignClientFactory feignClientFactory;
    private WebSearchTool.BraveSearchApi api;
    private WebSearchTool tool;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getTools().getBraveSearch().setApiKey(API_KEY);
        feignClientFactory = mock(FeignClientFactory.class);
        api = mock(WebSearchTool.BraveSearchApi.class);
        when(feignClientFactory.create(WebSearchTool.BraveSearchApi.class, BRAVE_URL)).thenReturn(api);
        tool = new WebSearchTool(feignClientFactory, properties);
    }

    @Test
    void shouldDisableWithoutApiKey() {
        properties.getTools().getBraveSearch().setApiKey(null);

        tool.init();

        assertFalse(tool.isEnabled());
        verify(feignClientFactory, never()).create(WebSearchTool.BraveSearchApi.class, BRAVE_URL);
    }

    @Test
    void shouldFormatResults() {
        tool.init();
        when(api.search(API_KEY, "agent teams", 5)).thenReturn(response(
                result("AutoGen", "https://github.com/microsoft/autogen", "Multi-agent framework")));

        ToolOutput output = tool.execute(Map.of("query", " agent teams ")).join();

        assertTrue(output.isSuccess());
        assertTrue(output.getOutput().startsWith("Search results for \"agent teams\" (1 results):"));
        assertTrue(output.getOutput().contains("**AutoGen**"));
        assertTrue(output.getOutput().contains("https://github.com/microsoft/autogen"));
    }

    @Test
    void shouldClampResultCount() {
        tool.init();
        when(api.search(API_KEY, "java", 20)).thenReturn(response());

        ToolOutput output = tool.execute(Map.of("query", "java", "count", 500)).join();

        assertEquals("No results found for: java", output.getOutput());
        verify(api).search(API_KEY, "java", 20);
    }

    @Test
    void shouldReportRateLimitAsTransient() {
        tool.init();
        when(api.search(anyString(), anyString(), anyInt())).thenThrow(new FeignException.TooManyRequests(
                "rate limited", request(), null, Map.of()));

        ToolOutput output = tool.execute(Map.of("query", "java")).join();

        assertFalse(output.isSuccess());
        assertEquals(ToolFailureKind.TRANSIENT, output.getFailureKind());
    }

    @Test
    void shouldReportUnauthorizedAsProviderError() {
        tool.init();
        when(api.search(anyString(), anyString(), anyInt())).thenThrow(new FeignException.Unauthorized(
                "bad key", request(), null, Map.of()));

        ToolOutput output = tool.execute(Map.of("query", "java")).join();

        assertEquals(ToolFailureKind.PROVIDER_ERROR, output.getFailureKind());
        assertTrue(output.getError().contains("401"));
    }

    private static Request request() {
        return Request.create(Request.HttpMethod.GET, BRAVE_URL + "/res/v1/web/search", Map.of(), null,
                StandardCharsets.UTF_8, null);
    }

    private static WebSearchTool.BraveSearchResponse response(WebSearchTool.WebResult... results) {
        WebSearchTool.WebResults web = new WebSearchTool.WebResults();
        web.setResults(List.of(results));
        WebSearchTool.BraveSearchResponse response = new WebSearchTool.BraveSearchResponse();
        response.setWeb(web);
        return response;
    }

    private static WebSearchTool.WebResult result(String title, String url, String description) {
        WebSearchTool.WebResult result = new WebSearchTool.WebResult();
        result.setTitle(title);
        result.setUrl(url);
        result.setDescription(description);
        return result;
    }
}

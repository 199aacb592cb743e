package me.golemcore.teams.tools;

import feign.FeignException;
import feign.Request;
import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitHubToolsTest {

    private static final String TOKEN = "ghp_test";
    private static final String API_URL = "https://api.github.com";

    private TeamsProperties properties;
    private FeignClientFactory feignClientFactory;
    private GitHubApi api;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getTools().getGithub().setToken(TOKEN);
        feignClientFactory = mock(FeignClientFactory.class);
        api = mock(GitHubApi.class);
        when(feignClientFactory.create(GitHubApi.class, API_URL)).thenReturn(api);
    }

    @Test
    void shouldDisableWithoutToken() {
        properties.getTools().getGithub().setToken(" ");
        GitHubSearchTool tool = new GitHubSearchTool(feignClientFactory, properties);

        tool.init();

        assertFalse(tool.isEnabled());
        verify(feignClientFactory, never()).create(GitHubApi.class, API_URL);
    }

    @Test
    void shouldFormatSearchResults() {
        GitHubSearchTool tool = new GitHubSearchTool(feignClientFactory, properties);
        tool.init();
        GitHubApi.RepositorySearchResponse response = new GitHubApi.RepositorySearchResponse();
        response.setTotalCount(42);
        response.setItems(List.of(repository("microsoft/autogen", "Java", 100)));
        when(api.searchRepositories(TOKEN, "autogen", 10)).thenReturn(response);

        ToolOutput output = tool.execute(Map.of("query", "autogen")).join();

        assertTrue(output.isSuccess());
        assertTrue(output.getOutput().startsWith("GitHub repositories for \"autogen\" (42 total, showing 1)"));
        assertTrue(output.getOutput().contains("- microsoft/autogen [Java] (100 stars): Agents"));
    }

    @Test
    void shouldMapServerErrorToTransientFailure() {
        GitHubSearchTool tool = new GitHubSearchTool(feignClientFactory, properties);
        tool.init();
        when(api.searchRepositories(anyString(), anyString(), anyInt()))
                .thenThrow(new FeignException.ServiceUnavailable("unavailable", request(), null, Map.of()));

        ToolOutput output = tool.execute(Map.of("query", "autogen")).join();

        assertFalse(output.isSuccess());
        assertEquals(ToolFailureKind.TRANSIENT, output.getFailureKind());
        assertEquals("GitHub returned HTTP 503", output.getError());
    }

    @Test
    void shouldMapNotFoundToProviderError() {
        GitHubGetFileTool tool = new GitHubGetFileTool(feignClientFactory, properties);
        tool.init();
        when(api.getContent(TOKEN, "octo", "demo", "README.md", "main"))
                .thenThrow(new FeignException.NotFound("missing", request(), null, Map.of()));

        ToolOutput output = tool.execute(Map.of("repo", "octo/demo", "file_path", "README.md")).join();

        assertEquals(ToolFailureKind.PROVIDER_ERROR, output.getFailureKind());
    }

    @Test
    void shouldDecodeFileContent() {
        GitHubGetFileTool tool = new GitHubGetFileTool(feignClientFactory, properties);
        tool.init();
        GitHubApi.FileContent file = new GitHubApi.FileContent();
        file.setType("file");
        file.setEncoding("base64");
        file.setContent(Base64.getMimeEncoder().encodeToString("# Demo\n".getBytes(StandardCharsets.UTF_8)));
        when(api.getContent(TOKEN, "octo", "demo", "README.md", "dev")).thenReturn(file);

        ToolOutput output = tool.execute(Map.of("repo", "octo/demo", "file_path", "/README.md", "branch", "dev"))
                .join();

        assertTrue(output.isSuccess());
        assertEquals("File octo/demo/README.md (branch dev):\n# Demo\n", output.getOutput());
    }

    @Test
    void shouldRejectMalformedRepository() {
        GitHubGetFileTool tool = new GitHubGetFileTool(feignClientFactory, properties);
        tool.init();

        CompletionException error = assertThrows(CompletionException.class,
                () -> tool.execute(Map.of("repo", "just-a-name", "file_path", "README.md")).join());

        assertInstanceOf(ToolValidationException.class, error.getCause());
    }

    @Test
    void shouldListOwnRepositoriesWithoutUsername() {
        GitHubListReposTool tool = new GitHubListReposTool(feignClientFactory, properties);
        tool.init();
        when(api.listOwnRepositories(TOKEN, 30)).thenReturn(List.of(repository("me/private-repo", null, 0)));

        ToolOutput output = tool.execute(Map.of()).join();

        assertTrue(output.getOutput().startsWith("Repositories of the authenticated user:"));
        assertTrue(output.getOutput().contains("- me/private-repo (0 stars)"));
    }

    private static GitHubApi.Repository repository(String fullName, String language, int stars) {
        GitHubApi.Repository repo = new GitHubApi.Repository();
        repo.setFullName(fullName);
        repo.setLanguage(language);
        repo.setStars(stars);
        repo.setDescription(language != null ? "Agents" : null);
        return repo;
    }

    private static Request request() {
        return Request.create(Request.HttpMethod.GET, API_URL + "/search/repositories", Map.of(), null,
                StandardCharsets.UTF_8, null);
    }
}

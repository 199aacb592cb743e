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
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;

import java.util.List;

/**
 * Subset of the GitHub REST API used by the GitHub tools.
 *
 * @see <a href="https://docs.github.com/en/rest">GitHub REST API</a>
 */
@Headers({
        "Accept: application/vnd.github+json",
        "X-GitHub-Api-Version: 2022-11-28",
        "User-Agent: golemcore-teams",
        "Authorization: Bearer {token}"
})
public interface GitHubApi {

    @RequestLine("GET /search/repositories?q={query}&per_page={perPage}")
    RepositorySearchResponse searchRepositories(@Param("token") String token, @Param("query") String query,
            @Param("perPage") int perPage);

    @RequestLine("GET /users/{username}/repos?per_page={perPage}&sort=updated")
    List<Repository> listUserRepositories(@Param("token") String token, @Param("username") String username,
            @Param("perPage") int perPage);

    @RequestLine("GET /user/repos?per_page={perPage}&sort=updated")
    List<Repository> listOwnRepositories(@Param("token") String token, @Param("perPage") int perPage);

    @RequestLine("GET /repos/{owner}/{repo}/contents/{path}?ref={ref}")
    FileContent getContent(@Param("token") String token, @Param("owner") String owner,
            @Param("repo") String repo, @Param("path") String path, @Param("ref") String ref);

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class RepositorySearchResponse {
        @JsonProperty("total_count")
        private long totalCount;
        private List<Repository> items;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class Repository {
        @JsonProperty("full_name")
        private String fullName;
        private String description;
        @JsonProperty("html_url")
        private String htmlUrl;
        @JsonProperty("stargazers_count")
        private int stars;
        private String language;
        @JsonProperty("private")
        private boolean privateRepository;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    class FileContent {
        private String type;
        private String path;
        private long size;
        private String encoding;
        private String content;
    }
}

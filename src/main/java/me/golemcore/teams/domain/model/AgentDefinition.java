package me.golemcore.teams.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Stateless role definition of an agent: who it is and which tools it may
 * call. Runtime state lives in {@link me.golemcore.teams.domain.runtime.AgentRuntime}.
 */
@Data
@Builder
public class AgentDefinition {

    private String name;
    private String role;
    private String persona;

    @Builder.Default
    private Set<String> allowedTools = new LinkedHashSet<>();

    public boolean isToolAllowed(String toolName) {
        return toolName != null && allowedTools != null && allowedTools.contains(toolName);
    }
}

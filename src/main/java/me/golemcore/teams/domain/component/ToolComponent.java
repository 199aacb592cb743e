package me.golemcore.teams.domain.component;

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

import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool provider handle: a local handler or a proxy for a tool served by an MCP
 * server. The gateway validates arguments against {@link #getDefinition()}
 * before calling {@link #execute(Map)}.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool name, description and JSON Schema of its parameters.
     */
    ToolDefinition getDefinition();

    /**
     * Starts one invocation. The future completes with the provider's output;
     * it may also complete exceptionally, which the gateway classifies.
     *
     * @param parameters
     *            arguments already validated against the schema
     * @return a future containing the tool output
     */
    CompletableFuture<ToolOutput> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Where the tool is served from, for catalog listings.
     */
    default String getProviderName() {
        return "local";
    }
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed result of one agent step: either a chat reply or a request to call a
 * tool.
 */
public sealed interface AgentOutput permits AgentOutput.Reply, AgentOutput.ToolRequest {

    /**
     * Plain reply. {@code complete} is set when the reply carries the completion
     * signal.
     */
    record Reply(String text, boolean complete) implements AgentOutput {
    }

    record ToolRequest(String toolName, Map<String, Object> arguments) implements AgentOutput {

        public ToolRequest {
            arguments = arguments != null
                    ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                    : Map.of();
        }
    }
}

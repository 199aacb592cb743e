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

import java.util.List;

/**
 * Provider-neutral chat message exchanged with an LLM backend.
 */
@Data
@Builder
public class LlmMessage {

    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    private String role; // system, user, assistant, tool
    private String content;
    private String name;

    private List<LlmToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static LlmMessage system(String content) {
        return LlmMessage.builder().role(SYSTEM).content(content).build();
    }

    public static LlmMessage user(String content) {
        return LlmMessage.builder().role(USER).content(content).build();
    }

    public static LlmMessage user(String name, String content) {
        return LlmMessage.builder().role(USER).name(name).content(content).build();
    }

    public static LlmMessage assistant(String content) {
        return LlmMessage.builder().role(ASSISTANT).content(content).build();
    }
}

package me.golemcore.teams.domain.runtime;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.LlmMessage;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.ToolCall;
import me.golemcore.teams.domain.model.ToolResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a task history into chat messages from one agent's point of view.
 *
 * <p>
 * The agent's own replies become assistant turns and its own tool exchanges
 * become native tool-call/tool-result pairs. Everything said or done by peers
 * arrives as user turns prefixed with the peer's name, so every agent reads the
 * same sequence in the same order. Coordinator bookkeeping is not rendered.
 */
public final class ConversationViewBuilder {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final int MAX_PEER_RESULT_CHARS = 4000;

    private ConversationViewBuilder() {
    }

    public static List<LlmMessage> build(String agentName, List<ConversationEntry> history) {
        List<LlmMessage> messages = new ArrayList<>();
        Map<String, ToolCall> callsById = new HashMap<>();
        for (ConversationEntry entry : history) {
            if (entry instanceof Message message) {
                messages.add(render(agentName, message));
            } else if (entry instanceof ToolCall call) {
                callsById.put(call.callId(), call);
                messages.add(render(agentName, call));
            } else if (entry instanceof ToolResult result) {
                ToolCall call = callsById.get(result.callId());
                messages.add(render(agentName, result, call));
            }
        }
        return messages;
    }

    private static LlmMessage render(String agentName, Message message) {
        MessageRole role = message.role();
        if (role == MessageRole.USER) {
            return LlmMessage.user(message.content());
        }
        if (role == MessageRole.SYSTEM) {
            return LlmMessage.system(message.content());
        }
        if (agentName.equals(message.sender())) {
            return LlmMessage.assistant(message.content());
        }
        return LlmMessage.user(message.sender(), "[" + message.sender() + "]: " + message.content());
    }

    private static LlmMessage render(String agentName, ToolCall call) {
        if (agentName.equals(call.requesterAgent())) {
            return LlmMessage.builder()
                    .role(LlmMessage.ASSISTANT)
                    .toolCalls(List.of(LlmToolCall.builder()
                            .id(call.callId())
                            .name(call.toolName())
                            .arguments(call.arguments())
                            .build()))
                    .build();
        }
        return LlmMessage.user(call.requesterAgent(), "[" + call.requesterAgent() + " called tool "
                + call.toolName() + " with " + toJson(call.arguments()) + "]");
    }

    private static LlmMessage render(String agentName, ToolResult result, ToolCall call) {
        String content = describe(result);
        if (call != null && agentName.equals(call.requesterAgent())) {
            return LlmMessage.builder()
                    .role(LlmMessage.TOOL)
                    .toolCallId(result.callId())
                    .toolName(result.toolName())
                    .content(content)
                    .build();
        }
        String requester = call != null ? call.requesterAgent() : "unknown";
        if (content != null && content.length() > MAX_PEER_RESULT_CHARS) {
            content = content.substring(0, MAX_PEER_RESULT_CHARS) + "...";
        }
        return LlmMessage.user(requester, "[Result of " + result.toolName() + " for " + requester + "]: "
                + content);
    }

    static String describe(ToolResult result) {
        if (result.isOk()) {
            return result.payload() != null ? result.payload() : "";
        }
        return "Error (" + result.errorKind() + "): " + result.errorDetail();
    }

    private static String toJson(Map<String, Object> arguments) {
        try {
            return JSON.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments);
        }
    }
}

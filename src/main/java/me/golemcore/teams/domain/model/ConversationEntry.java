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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * One line of a task's durable conversation log. The family is closed: every
 * consumer switches over the permitted subtypes explicitly.
 *
 * <p>
 * {@code seq} starts at 1 and is gapless per task; it alone defines the order
 * every agent observes.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Message.class, name = "message"),
        @JsonSubTypes.Type(value = ToolCall.class, name = "tool_call"),
        @JsonSubTypes.Type(value = ToolResult.class, name = "tool_result"),
        @JsonSubTypes.Type(value = RoutingDecision.class, name = "routing"),
        @JsonSubTypes.Type(value = TaskEvent.class, name = "task_event")
})
public sealed interface ConversationEntry permits Message, ToolCall, ToolResult, RoutingDecision, TaskEvent {

    String taskId();

    long seq();

    Instant timestamp();

    /**
     * Whether the entry belongs to the history shown to {@code agentName}.
     * Coordinator bookkeeping is visible to nobody.
     */
    default boolean visibleTo(String agentName) {
        return false;
    }
}

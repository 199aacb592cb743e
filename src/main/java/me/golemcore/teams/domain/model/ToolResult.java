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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;

/**
 * Terminal outcome of a {@link ToolCall}: a payload when {@code OK}, an error
 * kind plus detail when {@code ERROR}.
 *
 * @param attempts
 *            provider invocations made; 0 when the call was rejected before
 *            reaching a provider
 */
@Builder(toBuilder = true)
public record ToolResult(String taskId, long seq, Instant timestamp, String callId, String toolName,
        ToolStatus status, String payload, ToolFailureKind errorKind, String errorDetail, int attempts)
        implements ConversationEntry {

    @JsonIgnore
    public boolean isOk() {
        return status == ToolStatus.OK;
    }

    @Override
    public boolean visibleTo(String agentName) {
        return true;
    }

    public static ToolResult ok(ToolCall call, String payload, int attempts) {
        return ToolResult.builder()
                .taskId(call.taskId())
                .callId(call.callId())
                .toolName(call.toolName())
                .status(ToolStatus.OK)
                .payload(payload)
                .attempts(attempts)
                .build();
    }

    public static ToolResult error(ToolCall call, ToolFailureKind kind, String detail, int attempts) {
        return ToolResult.builder()
                .taskId(call.taskId())
                .callId(call.callId())
                .toolName(call.toolName())
                .status(ToolStatus.ERROR)
                .errorKind(kind)
                .errorDetail(detail)
                .attempts(attempts)
                .build();
    }
}

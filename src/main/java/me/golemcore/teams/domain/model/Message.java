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

import java.time.Instant;

/**
 * Chat line in a task conversation. A {@code null} recipient means the message
 * is broadcast to the whole team; otherwise it is a private coordinator notice
 * for that agent only.
 *
 * @param turn
 *            agent step that produced the message, 0 for the task prompt
 */
@Builder(toBuilder = true)
public record Message(String taskId, long seq, Instant timestamp, String sender, MessageRole role,
        String content, String recipient, int turn) implements ConversationEntry {

    @Override
    public boolean visibleTo(String agentName) {
        return recipient == null || recipient.equals(agentName);
    }
}

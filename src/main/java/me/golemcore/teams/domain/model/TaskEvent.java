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
 * Task lifecycle entry. The first event of every log is {@code PENDING} and
 * carries the description and team; later events record status transitions.
 */
@Builder(toBuilder = true)
public record TaskEvent(String taskId, long seq, Instant timestamp, TaskStatus status, String description,
        String teamName, FailureReason failureReason, String summary) implements ConversationEntry {
}

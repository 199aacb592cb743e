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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One user-submitted unit of work processed by a team. The status is a
 * projection of the task's {@link TaskEvent} entries; only the coordinator
 * moves it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String description;
    private String teamName;
    private Instant createdAt;

    @Builder.Default
    private TaskStatus status = TaskStatus.PENDING;

    private FailureReason failureReason;
    private String summary;

    /**
     * Moves the task to {@code next}, rejecting transitions that would break
     * status monotonicity.
     */
    public void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}

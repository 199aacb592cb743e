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

/**
 * Lifecycle of a task. Transitions only move forward: PENDING -> RUNNING ->
 * COMPLETED | FAILED. A pending task may also fail directly (cancelled before
 * it started).
 */
public enum TaskStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Checks whether moving from this status to {@code next} keeps the status
     * monotonic. Re-entering RUNNING from RUNNING is allowed so a resumed task can
     * record that it was picked up again.
     */
    public boolean canTransitionTo(TaskStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return switch (this) {
        case PENDING -> true;
        case RUNNING -> next != PENDING;
        default -> false;
        };
    }
}

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

/**
 * Backend call settings shared by every agent of a task.
 *
 * @param model
 *            model id passed to the backend, {@code null} for the provider
 *            default
 * @param completionToken
 *            marker an agent puts in a reply to finish the task
 * @param timeoutSeconds
 *            upper bound for one backend call
 */
public record AgentSettings(String model, double temperature, Integer maxTokens, String completionToken,
        int timeoutSeconds) {
}

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
 * Normalized failure classes of a tool invocation. Every provider-specific
 * error shape ends up as one of these.
 */
public enum ToolFailureKind {

    /**
     * The requesting agent is not allowed to use the tool. Decided by the
     * coordinator; the provider is never contacted.
     */
    NOT_PERMITTED(false),

    /**
     * No provider is registered under the requested name.
     */
    UNKNOWN_TOOL(false),

    /**
     * Arguments do not satisfy the tool's parameter schema.
     */
    VALIDATION(false),

    /**
     * The provider did not answer within the per-attempt timeout.
     */
    TIMEOUT(true),

    /**
     * Network or process level failure that may succeed on retry.
     */
    TRANSIENT(true),

    /**
     * The provider handled the call and reported an error.
     */
    PROVIDER_ERROR(false),

    /**
     * The invocation was aborted because its task was cancelled.
     */
    CANCELLED(false);

    private final boolean retryable;

    ToolFailureKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

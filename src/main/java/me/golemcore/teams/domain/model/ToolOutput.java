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

/**
 * What a tool provider hands back for one invocation, before the gateway
 * normalizes it into a {@link ToolResult}. A failed output may name its
 * {@link ToolFailureKind}; without one it counts as a provider error.
 */
@Data
@Builder
public class ToolOutput {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ToolFailureKind failureKind;

    public static ToolOutput success(String output) {
        return ToolOutput.builder()
                .success(true)
                .output(output)
                .build();
    }

    public static ToolOutput success(String output, Object data) {
        return ToolOutput.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    public static ToolOutput failure(String error) {
        return ToolOutput.builder()
                .success(false)
                .error(error)
                .failureKind(ToolFailureKind.PROVIDER_ERROR)
                .build();
    }

    public static ToolOutput failure(ToolFailureKind kind, String error) {
        return ToolOutput.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }
}

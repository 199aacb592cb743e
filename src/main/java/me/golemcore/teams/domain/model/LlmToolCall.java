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

import java.util.Map;

/**
 * Function call requested by the model. Adapters keep the raw argument text so
 * the runtime can tell an empty argument object from an unparseable one.
 */
@Data
@Builder
public class LlmToolCall {

    private String id;
    private String name;
    private Map<String, Object> arguments;
    private String rawArguments;

    @Builder.Default
    private boolean argumentsParsed = true;
}

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
 * Who acts after a tool result has been recorded.
 */
public enum AfterToolResultPolicy {

    /**
     * The requesting agent keeps the floor so it can react to the result.
     */
    SAME_SPEAKER,

    /**
     * The routing policy picks the next speaker as after a plain reply.
     */
    NEXT_SPEAKER
}

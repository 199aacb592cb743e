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

import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.RoutingPolicyType;
import me.golemcore.teams.domain.model.Team;

import java.util.Map;

/**
 * Picks who speaks next. Implementations must be deterministic given the same
 * record, or report their decision so the coordinator can persist it.
 */
public interface SpeakerSelector {

    /**
     * @param record
     *            task history so far
     * @param previousSpeaker
     *            agent that took the last turn, {@code null} before the first
     *            turn
     */
    SpeakerChoice select(ConversationRecord record, String previousSpeaker);

    /**
     * Selected speaker. A non-null {@code decidedBy} marks a decision that cannot
     * be recomputed from the record and must be stored as a routing decision.
     */
    record SpeakerChoice(String speaker, String decidedBy) {

        public static SpeakerChoice derived(String speaker) {
            return new SpeakerChoice(speaker, null);
        }

        public boolean mustPersist() {
            return decidedBy != null;
        }
    }

    static SpeakerSelector forTeam(Team team, Map<String, AgentRuntime> runtimes) {
        RoutingPolicyType policy = team.routing();
        return switch (policy) {
        case ROUND_ROBIN -> new RoundRobinSelector(team);
        case CRITERIA_HANDOFF -> new CriteriaHandoffSelector(team);
        case COORDINATOR_DIRECTED -> new CoordinatorDirectedSelector(team, runtimes.get(team.lead()));
        };
    }
}

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
import me.golemcore.teams.domain.model.Team;

/**
 * Cycles through the team in member order, starting with the first member.
 */
public class RoundRobinSelector implements SpeakerSelector {

    private final Team team;

    public RoundRobinSelector(Team team) {
        this.team = team;
    }

    @Override
    public SpeakerChoice select(ConversationRecord record, String previousSpeaker) {
        return SpeakerChoice.derived(team.memberAfter(previousSpeaker));
    }
}

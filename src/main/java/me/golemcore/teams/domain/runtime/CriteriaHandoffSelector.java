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

import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.Team;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Follows a {@code HANDOFF: <agent>} line in the previous speaker's latest
 * reply. Without a directive naming a member, falls back to round-robin.
 */
public class CriteriaHandoffSelector implements SpeakerSelector {

    private static final Pattern HANDOFF = Pattern.compile("(?im)^\\s*HANDOFF:\\s*([\\w.-]+)\\s*$");

    private final Team team;

    public CriteriaHandoffSelector(Team team) {
        this.team = team;
    }

    @Override
    public SpeakerChoice select(ConversationRecord record, String previousSpeaker) {
        if (previousSpeaker != null) {
            Optional<String> target = lastReplyOf(record, previousSpeaker).flatMap(this::handoffTarget);
            if (target.isPresent()) {
                return SpeakerChoice.derived(target.get());
            }
        }
        return SpeakerChoice.derived(team.memberAfter(previousSpeaker));
    }

    Optional<String> handoffTarget(String text) {
        Matcher matcher = HANDOFF.matcher(text);
        String named = null;
        while (matcher.find()) {
            named = matcher.group(1);
        }
        if (named == null) {
            return Optional.empty();
        }
        for (String member : team.members()) {
            if (member.equalsIgnoreCase(named)) {
                return Optional.of(member);
            }
        }
        return Optional.empty();
    }

    private static Optional<String> lastReplyOf(ConversationRecord record, String agentName) {
        List<ConversationEntry> entries = record.entries();
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i) instanceof Message message && message.role() == MessageRole.AGENT
                    && agentName.equals(message.sender())) {
                return Optional.ofNullable(message.content());
            }
        }
        return Optional.empty();
    }
}

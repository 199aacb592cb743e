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

import me.golemcore.teams.domain.model.AfterToolResultPolicy;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.RoutingDecision;
import me.golemcore.teams.domain.model.ToolCall;

import java.util.List;

/**
 * Turn-taking state derived from a conversation record alone. The coordinator
 * recomputes it before every turn, so a resumed run and an uninterrupted one
 * take identical decisions from the same history.
 *
 * @param turns
 *            agent steps taken so far
 * @param previousSpeaker
 *            agent of the last step, {@code null} before the first one
 * @param pendingSpeaker
 *            agent that already holds the floor (tool follow-up, correction
 *            after malformed output, or a stored routing decision);
 *            {@code null} when the routing policy must choose
 */
public record TurnState(int turns, String previousSpeaker, String pendingSpeaker) {

    public static TurnState from(ConversationRecord record, AfterToolResultPolicy afterToolResult) {
        List<ConversationEntry> entries = record.entries();
        int turns = record.turnCount();
        String previous = null;
        String pending = null;
        int stepIndex = -1;

        if (turns > 0) {
            for (int i = 0; i < entries.size(); i++) {
                ConversationEntry entry = entries.get(i);
                if (entry instanceof ToolCall call && call.turn() == turns) {
                    previous = call.requesterAgent();
                    pending = afterToolResult == AfterToolResultPolicy.SAME_SPEAKER ? previous : null;
                    stepIndex = i;
                    break;
                }
                if (entry instanceof Message message && message.turn() == turns) {
                    if (message.role() == MessageRole.SYSTEM) {
                        previous = message.recipient();
                        pending = previous;
                    } else {
                        previous = message.sender();
                    }
                    stepIndex = i;
                    break;
                }
            }
        }

        for (int i = stepIndex + 1; i < entries.size(); i++) {
            if (entries.get(i) instanceof RoutingDecision decision) {
                pending = decision.speaker();
            }
        }
        return new TurnState(turns, previous, pending);
    }
}

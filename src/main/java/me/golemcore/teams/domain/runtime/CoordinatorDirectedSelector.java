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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.BackendUnavailableException;
import me.golemcore.teams.domain.exception.MalformedAgentOutputException;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.Team;

import java.util.Objects;
import java.util.Optional;

/**
 * Asks the team lead who acts next. An answer that does not name a member
 * exactly, or a lead whose backend fails, falls back to round-robin; an
 * interrupted lead query is rethrown so cancellation still wins. Every choice is reported for persistence,
 * fallbacks included, because asking the model again could answer differently.
 */
@Slf4j
public class CoordinatorDirectedSelector implements SpeakerSelector {

    static final String FALLBACK = "round-robin";

    private final Team team;
    private final AgentRuntime lead;

    public CoordinatorDirectedSelector(Team team, AgentRuntime lead) {
        this.team = team;
        this.lead = Objects.requireNonNull(lead, "lead runtime");
    }

    @Override
    public SpeakerChoice select(ConversationRecord record, String previousSpeaker) {
        Optional<String> chosen;
        try {
            chosen = lead.chooseNextSpeaker(record.visibleTo(lead.getName()), team.members());
        } catch (MalformedAgentOutputException e) {
            chosen = Optional.empty();
        } catch (BackendUnavailableException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw e;
            }
            log.warn("[Coordinator] Lead {} could not be asked for routing: {}", lead.getName(), e.getMessage());
            chosen = Optional.empty();
        }
        if (chosen.isPresent()) {
            return new SpeakerChoice(chosen.get(), lead.getName());
        }
        String fallback = team.memberAfter(previousSpeaker);
        log.info("[Coordinator] Lead {} gave no usable routing answer, falling back to {}", lead.getName(),
                fallback);
        return new SpeakerChoice(fallback, FALLBACK);
    }
}

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

import java.util.List;
import java.util.Objects;

/**
 * Ordered set of agents plus the routing policy they follow. Immutable: a task
 * keeps the team it started with.
 *
 * @param name
 *            team identifier referenced by tasks
 * @param members
 *            agent names in speaking order
 * @param routing
 *            speaker selection policy
 * @param lead
 *            agent asked for routing decisions in coordinator-directed mode;
 *            defaults to the first member
 * @param maxTurns
 *            turn budget before the task fails with TURN_LIMIT_EXCEEDED
 */
public record Team(String name, List<String> members, RoutingPolicyType routing, String lead, int maxTurns) {

    public Team {
        Objects.requireNonNull(name, "name");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Team '" + name + "' has no members");
        }
        members = List.copyOf(members);
        routing = routing != null ? routing : RoutingPolicyType.ROUND_ROBIN;
        lead = lead != null && !lead.isBlank() ? lead : members.get(0);
        if (!members.contains(lead)) {
            throw new IllegalArgumentException("Lead '" + lead + "' is not a member of team '" + name + "'");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("Team '" + name + "' needs a positive turn limit");
        }
    }

    public int indexOf(String agentName) {
        return members.indexOf(agentName);
    }

    public boolean hasMember(String agentName) {
        return members.contains(agentName);
    }

    /**
     * Member following {@code agentName} in speaking order, wrapping around. An
     * unknown or null name starts from the first member.
     */
    public String memberAfter(String agentName) {
        int index = agentName != null ? members.indexOf(agentName) : -1;
        return members.get((index + 1) % members.size());
    }
}

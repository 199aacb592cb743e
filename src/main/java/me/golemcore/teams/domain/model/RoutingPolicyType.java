package me.golemcore.teams.domain.model;

/**
 * How a team picks its next speaker.
 */
public enum RoutingPolicyType {

    /**
     * Cycle through the members in declaration order.
     */
    ROUND_ROBIN,

    /**
     * Ask the team lead which member should act next.
     */
    COORDINATOR_DIRECTED,

    /**
     * Follow a {@code HANDOFF: <agent>} directive from the last speaker, falling
     * back to round-robin.
     */
    CRITERIA_HANDOFF
}

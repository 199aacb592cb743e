package me.golemcore.teams.domain.model;

/**
 * Why a task ended in {@link TaskStatus#FAILED}.
 */
public enum FailureReason {

    /**
     * The team used up its turn budget without an agent signalling completion.
     */
    TURN_LIMIT_EXCEEDED,

    /**
     * The LLM backend stayed unreachable or rate-limited after the step retries,
     * or rejected the request outright.
     */
    BACKEND_UNAVAILABLE,

    /**
     * The task was cancelled from outside.
     */
    CANCELLED,

    /**
     * Anything else the coordinator could not recover from (storage failure,
     * programming error).
     */
    INTERNAL_ERROR
}

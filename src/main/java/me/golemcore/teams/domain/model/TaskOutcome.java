package me.golemcore.teams.domain.model;

/**
 * Final answer of a task run: terminal status plus either the completing
 * agent's summary or the human-readable failure reason.
 */
public record TaskOutcome(String taskId, TaskStatus status, FailureReason failureReason, String summary,
        int turns) {

    public boolean isCompleted() {
        return status == TaskStatus.COMPLETED;
    }

    public static TaskOutcome completed(String taskId, String summary, int turns) {
        return new TaskOutcome(taskId, TaskStatus.COMPLETED, null, summary, turns);
    }

    public static TaskOutcome failed(String taskId, FailureReason reason, String summary, int turns) {
        return new TaskOutcome(taskId, TaskStatus.FAILED, reason, summary, turns);
    }
}

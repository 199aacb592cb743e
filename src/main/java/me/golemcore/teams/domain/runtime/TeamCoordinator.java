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
import me.golemcore.teams.domain.exception.ConversationStoreException;
import me.golemcore.teams.domain.exception.MalformedAgentOutputException;
import me.golemcore.teams.domain.model.AgentOutput;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.FailureReason;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.RoutingDecision;
import me.golemcore.teams.domain.model.Task;
import me.golemcore.teams.domain.model.TaskEvent;
import me.golemcore.teams.domain.model.TaskOutcome;
import me.golemcore.teams.domain.model.TaskStatus;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.domain.model.ToolCall;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolResult;
import me.golemcore.teams.domain.service.ConversationStore;
import me.golemcore.teams.domain.service.ToolGateway;
import me.golemcore.teams.infrastructure.config.TeamsProperties;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.function.LongFunction;
import java.util.function.Supplier;

/**
 * Runs the turn-taking loop of one task.
 *
 * <p>
 * Each iteration derives the {@link TurnState} from the record, lets the routing
 * policy pick a speaker unless one already holds the floor, runs one agent step
 * and records what came out:
 * <ul>
 * <li>a reply is broadcast; a reply carrying the completion token completes the
 * task</li>
 * <li>a tool request outside the agent's allow-list is answered with a
 * NOT_PERMITTED result and a private notice, without calling the gateway</li>
 * <li>any other tool request goes through the {@link ToolGateway}</li>
 * <li>malformed output earns the agent one private correction and the floor for
 * its next turn</li>
 * </ul>
 *
 * <p>
 * Every entry is appended to the in-memory record and to the
 * {@link ConversationStore} before the loop moves on. One instance serves one
 * task; {@link #cancel()} may be called from any thread.
 */
@Slf4j
public class TeamCoordinator {

    static final String COORDINATOR = "coordinator";

    private final AgentRuntimeProvider runtimeProvider;
    private final ToolGateway toolGateway;
    private final ConversationStore store;
    private final TeamsProperties.CoordinatorProperties settings;
    private final Clock clock;
    private final Supplier<String> callIds;

    private volatile boolean cancelRequested;

    public TeamCoordinator(AgentRuntimeProvider runtimeProvider, ToolGateway toolGateway, ConversationStore store,
            TeamsProperties.CoordinatorProperties settings, Clock clock) {
        this(runtimeProvider, toolGateway, store, settings, clock, () -> UUID.randomUUID().toString());
    }

    TeamCoordinator(AgentRuntimeProvider runtimeProvider, ToolGateway toolGateway, ConversationStore store,
            TeamsProperties.CoordinatorProperties settings, Clock clock, Supplier<String> callIds) {
        this.runtimeProvider = runtimeProvider;
        this.toolGateway = toolGateway;
        this.store = store;
        this.settings = settings;
        this.clock = clock;
        this.callIds = callIds;
    }

    /**
     * Records the task and runs it to a terminal state.
     */
    public TaskOutcome runTask(Task task, Team team) {
        Run run = new Run(task, team, new ConversationRecord(task.getId()));
        try {
            run.append(seq -> TaskEvent.builder()
                    .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                    .status(TaskStatus.PENDING)
                    .description(task.getDescription())
                    .teamName(team.name())
                    .build());
            run.append(seq -> Message.builder()
                    .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                    .sender("user")
                    .role(MessageRole.USER)
                    .content(task.getDescription())
                    .turn(0)
                    .build());
        } catch (ConversationStoreException e) {
            log.error("[Coordinator] Cannot record task {}", task.getId(), e);
            return run.unpersisted(FailureReason.INTERNAL_ERROR, "Cannot record task: " + e.getMessage());
        }
        return run.execute();
    }

    /**
     * Continues a task from its stored record. A tool call left without result by
     * a crash is closed with a TRANSIENT error first. Terminal records are
     * returned as they are.
     */
    public TaskOutcome resume(ConversationRecord record, Team team) {
        if (record.isTerminal()) {
            return record.outcome().orElseThrow();
        }
        Run run = new Run(record.toTask(), team, record);
        log.info("[Coordinator] Resuming task {} at seq {} ({} turns taken)", record.getTaskId(),
                record.lastSeq(), record.turnCount());
        try {
            for (ToolCall dangling : record.danglingCalls()) {
                log.warn("[Coordinator] Closing interrupted tool call {} ({})", dangling.callId(),
                        dangling.toolName());
                ToolResult closed = ToolResult.error(dangling, ToolFailureKind.TRANSIENT,
                        "interrupted by restart", 0);
                run.append(seq -> closed.toBuilder().seq(seq).timestamp(clock.instant()).build());
            }
        } catch (ConversationStoreException e) {
            log.error("[Coordinator] Cannot repair task {}", record.getTaskId(), e);
            return run.unpersisted(FailureReason.INTERNAL_ERROR, "Cannot repair task: " + e.getMessage());
        }
        return run.execute();
    }

    /**
     * Requests cancellation. The loop stops at its next check; an in-flight tool
     * call is aborted when the run thread is interrupted as well.
     */
    public void cancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    private final class Run {

        private final Task task;
        private final Team team;
        private final ConversationRecord record;
        private Map<String, AgentRuntime> runtimes;
        private SpeakerSelector selector;

        private Run(Task task, Team team, ConversationRecord record) {
            this.task = task;
            this.team = team;
            this.record = record;
        }

        TaskOutcome execute() {
            try {
                runtimes = runtimeProvider.runtimesFor(team);
                selector = SpeakerSelector.forTeam(team, runtimes);
                if (record.status() == TaskStatus.PENDING) {
                    append(seq -> event(seq, TaskStatus.RUNNING, null, null));
                }
                return loop();
            } catch (TaskCancelledException e) {
                return finish(TaskStatus.FAILED, FailureReason.CANCELLED, "Task cancelled");
            } catch (BackendUnavailableException e) {
                if (isCancelled()) {
                    return finish(TaskStatus.FAILED, FailureReason.CANCELLED, "Task cancelled");
                }
                log.warn("[Coordinator] Backend unavailable for task {}: {}", task.getId(), e.getMessage());
                return finish(TaskStatus.FAILED, FailureReason.BACKEND_UNAVAILABLE,
                        "LLM backend unavailable: " + e.getMessage());
            } catch (ConversationStoreException e) {
                log.error("[Coordinator] Conversation store failed for task {}", task.getId(), e);
                return unpersisted(FailureReason.INTERNAL_ERROR, "Conversation store failed: " + e.getMessage());
            } catch (RuntimeException e) {
                if (isCancelled()) {
                    return finish(TaskStatus.FAILED, FailureReason.CANCELLED, "Task cancelled");
                }
                log.error("[Coordinator] Task {} failed unexpectedly", task.getId(), e);
                return finish(TaskStatus.FAILED, FailureReason.INTERNAL_ERROR, "Internal error: " + e.getMessage());
            }
        }

        private TaskOutcome loop() {
            while (true) {
                checkCancelled();
                TurnState state = TurnState.from(record, settings.getAfterToolResult());
                if (state.turns() >= team.maxTurns()) {
                    log.info("[Coordinator] Task {} reached the turn limit of {}", task.getId(), team.maxTurns());
                    return finish(TaskStatus.FAILED, FailureReason.TURN_LIMIT_EXCEEDED,
                            "Turn limit of " + team.maxTurns() + " reached without completion");
                }

                String speaker = state.pendingSpeaker();
                if (speaker == null) {
                    SpeakerSelector.SpeakerChoice choice = withStepRetry(
                            () -> selector.select(record, state.previousSpeaker()));
                    speaker = choice.speaker();
                    if (choice.mustPersist()) {
                        String chosen = speaker;
                        append(seq -> RoutingDecision.builder()
                                .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                                .speaker(chosen)
                                .decidedBy(choice.decidedBy())
                                .build());
                    }
                }

                int turn = state.turns() + 1;
                AgentRuntime runtime = runtimes.get(speaker);
                if (runtime == null) {
                    throw new IllegalStateException("No runtime for team member " + speaker);
                }
                log.debug("[Coordinator] Turn {}/{}: {}", turn, team.maxTurns(), speaker);

                String current = speaker;
                AgentOutput output;
                try {
                    output = withStepRetry(() -> runtime.step(record.visibleTo(current)));
                } catch (MalformedAgentOutputException e) {
                    log.info("[Coordinator] Malformed output from {}: {}", speaker, e.getMessage());
                    notice(speaker, turn, "Your last response could not be used (" + e.getMessage()
                            + "). Reply with a message or exactly one valid tool call.");
                    continue;
                }
                checkCancelled();

                if (output instanceof AgentOutput.Reply reply) {
                    append(seq -> Message.builder()
                            .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                            .sender(current)
                            .role(MessageRole.AGENT)
                            .content(reply.text())
                            .turn(turn)
                            .build());
                    if (reply.complete()) {
                        log.info("[Coordinator] Task {} completed by {} after {} turns", task.getId(), speaker,
                                turn);
                        return finish(TaskStatus.COMPLETED, null, summaryOf(reply.text()));
                    }
                } else if (output instanceof AgentOutput.ToolRequest request) {
                    handleToolRequest(runtime, request, turn);
                }
            }
        }

        private void handleToolRequest(AgentRuntime runtime, AgentOutput.ToolRequest request, int turn) {
            String callId = callIds.get();
            ToolCall call = append(seq -> ToolCall.builder()
                    .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                    .callId(callId)
                    .requesterAgent(runtime.getName())
                    .toolName(request.toolName())
                    .arguments(request.arguments())
                    .turn(turn)
                    .build());

            if (!runtime.getDefinition().isToolAllowed(request.toolName())) {
                log.info("[Coordinator] {} is not permitted to use '{}'", runtime.getName(), request.toolName());
                ToolResult denied = ToolResult.error(call, ToolFailureKind.NOT_PERMITTED,
                        "Agent " + runtime.getName() + " is not permitted to use tool '" + request.toolName() + "'",
                        0);
                append(seq -> denied.toBuilder().seq(seq).timestamp(clock.instant()).build());
                notice(runtime.getName(), turn, "Tool '" + request.toolName()
                        + "' is not available to you. Your tools: " + runtime.getDefinition().getAllowedTools()
                        + ". Continue without it.");
                return;
            }

            ToolResult result = toolGateway.invoke(call);
            boolean interrupted = Thread.interrupted();
            append(seq -> result.toBuilder().seq(seq).timestamp(clock.instant()).build());
            if (interrupted || result.errorKind() == ToolFailureKind.CANCELLED) {
                throw new TaskCancelledException();
            }
        }

        private void notice(String recipient, int turn, String content) {
            append(seq -> Message.builder()
                    .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                    .sender(COORDINATOR)
                    .role(MessageRole.SYSTEM)
                    .content(content)
                    .recipient(recipient)
                    .turn(turn)
                    .build());
        }

        private <T> T withStepRetry(Supplier<T> step) {
            int failures = 0;
            while (true) {
                try {
                    return step.get();
                } catch (BackendUnavailableException e) {
                    if (isCancelled()) {
                        throw new TaskCancelledException();
                    }
                    failures++;
                    if (!e.isRetryable() || failures > settings.getMaxStepRetries()) {
                        throw e;
                    }
                    long backoffMs = settings.getStepRetryBackoffMs() * (1L << (failures - 1));
                    log.warn("[Coordinator] Backend failure {}/{} for task {}, retrying in {}ms: {}", failures,
                            settings.getMaxStepRetries(), task.getId(), backoffMs, e.getMessage());
                    sleep(backoffMs);
                }
            }
        }

        private TaskOutcome finish(TaskStatus status, FailureReason reason, String summary) {
            // clear a pending interrupt so the final event still gets written
            Thread.interrupted();
            try {
                append(seq -> event(seq, status, reason, summary));
            } catch (RuntimeException e) {
                log.error("[Coordinator] Cannot record final status {} of task {}", status, task.getId(), e);
            }
            return outcome(status, reason, summary);
        }

        private TaskOutcome unpersisted(FailureReason reason, String summary) {
            Thread.interrupted();
            return outcome(TaskStatus.FAILED, reason, summary);
        }

        private TaskOutcome outcome(TaskStatus status, FailureReason reason, String summary) {
            if (task.getStatus().canTransitionTo(status)) {
                task.transitionTo(status);
            }
            task.setFailureReason(reason);
            task.setSummary(summary);
            int turns = record.turnCount();
            return status == TaskStatus.COMPLETED
                    ? TaskOutcome.completed(task.getId(), summary, turns)
                    : TaskOutcome.failed(task.getId(), reason, summary, turns);
        }

        private TaskEvent event(long seq, TaskStatus status, FailureReason reason, String summary) {
            return TaskEvent.builder()
                    .taskId(task.getId()).seq(seq).timestamp(clock.instant())
                    .status(status)
                    .failureReason(reason)
                    .summary(summary)
                    .build();
        }

        private <T extends ConversationEntry> T append(LongFunction<T> factory) {
            T entry = factory.apply(record.nextSeq());
            record.append(entry);
            store.append(entry);
            return entry;
        }

        private String summaryOf(String text) {
            String token = settings.getCompletionToken();
            if (token == null || token.isBlank()) {
                return text;
            }
            String stripped = text.replace(token, "").strip();
            return stripped.isEmpty() ? text : stripped;
        }

        private void checkCancelled() {
            if (isCancelled()) {
                throw new TaskCancelledException();
            }
        }

        private boolean isCancelled() {
            return cancelRequested || Thread.currentThread().isInterrupted();
        }

        private void sleep(long millis) {
            if (millis <= 0) {
                return;
            }
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskCancelledException();
            }
        }
    }

    private static final class TaskCancelledException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        private TaskCancelledException() {
            super("Task cancelled", null, false, false);
        }
    }
}

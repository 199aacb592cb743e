package me.golemcore.teams.domain.service;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.ConversationStoreException;
import me.golemcore.teams.domain.exception.TaskNotFoundException;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.FailureReason;
import me.golemcore.teams.domain.model.Task;
import me.golemcore.teams.domain.model.TaskEvent;
import me.golemcore.teams.domain.model.TaskOutcome;
import me.golemcore.teams.domain.model.TaskStatus;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.domain.runtime.TeamCoordinator;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Command surface for tasks: submit, cancel, resume and inspect.
 *
 * <p>
 * Every run gets its own {@link TeamCoordinator} and executes on one thread of
 * the {@code taskRunExecutor} pool. Cancelling sets the coordinator's flag and
 * interrupts the run thread, which aborts an in-flight tool call. Tasks left
 * unfinished by a previous process can be resumed on request, or at startup
 * with {@code teams.coordinator.resume-on-startup}.
 *
 * <p>
 * Resume and idle cancel read the stored log and act on it; both hold the
 * task's lock for that, so they never write the same sequence number.
 */
@Service
@Slf4j
public class TaskService {

    private final TeamCatalog teamCatalog;
    private final AgentRuntimeFactory runtimeFactory;
    private final ToolGateway toolGateway;
    private final ConversationStore store;
    private final TeamsProperties properties;
    private final Clock clock;
    private final ExecutorService taskRunExecutor;

    private static final int LOCK_STRIPES = 64;

    private final Map<String, ActiveRun> active = new ConcurrentHashMap<>();
    private final Object[] taskLocks = new Object[LOCK_STRIPES];

    public TaskService(TeamCatalog teamCatalog, AgentRuntimeFactory runtimeFactory, ToolGateway toolGateway,
            ConversationStore store, TeamsProperties properties, Clock clock,
            @Qualifier("taskRunExecutor") ExecutorService taskRunExecutor) {
        this.teamCatalog = teamCatalog;
        this.runtimeFactory = runtimeFactory;
        this.toolGateway = toolGateway;
        this.store = store;
        this.properties = properties;
        this.clock = clock;
        this.taskRunExecutor = taskRunExecutor;
        for (int i = 0; i < taskLocks.length; i++) {
            taskLocks[i] = new Object();
        }
    }

    /**
     * Creates a task for {@code teamName} (default team when blank) and starts
     * it in the background.
     *
     * @throws IllegalArgumentException
     *             for a blank description or an unknown team
     */
    public TaskSubmission submit(String description, String teamName) {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Task description must not be blank");
        }
        Team team = teamCatalog.requireTeam(teamName);
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .description(description.strip())
                .teamName(team.name())
                .createdAt(clock.instant())
                .build();
        log.info("[Tasks] Submitting task {} to team {}", task.getId(), team.name());
        return start(task, coordinator -> coordinator.runTask(task, team));
    }

    /**
     * Continues an unfinished task from its stored record.
     *
     * @throws IllegalStateException
     *             if the task is running or already finished
     */
    public TaskSubmission resume(String taskId) {
        synchronized (lockFor(taskId)) {
            if (active.containsKey(taskId)) {
                throw new IllegalStateException("Task " + taskId + " is already running");
            }
            ConversationRecord record = store.load(taskId);
            if (record.isTerminal()) {
                throw new IllegalStateException("Task " + taskId + " already finished with status "
                        + record.status());
            }
            String teamName = record.creationEvent().map(TaskEvent::teamName).orElse(null);
            Team team = teamCatalog.requireTeam(teamName);
            return start(record.toTask(), coordinator -> coordinator.resume(record, team));
        }
    }

    /**
     * Cancels a task. A running task stops at its next check; a task left
     * unfinished by an earlier process is marked FAILED/CANCELLED directly.
     *
     * @throws IllegalStateException
     *             if the task already finished
     */
    public void cancel(String taskId) {
        synchronized (lockFor(taskId)) {
            ActiveRun run = active.get(taskId);
            if (run != null) {
                log.info("[Tasks] Cancelling running task {}", taskId);
                run.cancel();
                return;
            }
            ConversationRecord record = store.load(taskId);
            if (record.isTerminal()) {
                throw new IllegalStateException("Task " + taskId + " already finished with status "
                        + record.status());
            }
            log.info("[Tasks] Cancelling idle task {}", taskId);
            TaskEvent cancelled = TaskEvent.builder()
                    .taskId(taskId).seq(record.nextSeq()).timestamp(clock.instant())
                    .status(TaskStatus.FAILED)
                    .failureReason(FailureReason.CANCELLED)
                    .summary("Task cancelled")
                    .build();
            record.append(cancelled);
            store.append(cancelled);
        }
    }

    public TaskDetails getTask(String taskId) {
        ConversationRecord record = store.load(taskId);
        Task task = record.toTask();
        return new TaskDetails(task, record.outcome().orElse(null), record.entries(), active.containsKey(taskId));
    }

    /**
     * Summaries of every stored task. Logs that cannot be read are skipped.
     */
    public List<Task> listTasks() {
        List<Task> tasks = new ArrayList<>();
        for (String taskId : store.listTaskIds()) {
            try {
                tasks.add(store.load(taskId).toTask());
            } catch (ConversationStoreException | TaskNotFoundException e) {
                log.warn("[Tasks] Skipping unreadable task {}: {}", taskId, e.getMessage());
            }
        }
        return tasks;
    }

    public boolean isRunning(String taskId) {
        return active.containsKey(taskId);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeInterruptedTasks() {
        if (!properties.getCoordinator().isResumeOnStartup()) {
            return;
        }
        for (Task task : listTasks()) {
            if (task.getStatus().isTerminal() || active.containsKey(task.getId())) {
                continue;
            }
            try {
                resume(task.getId());
                log.info("[Tasks] Resumed interrupted task {}", task.getId());
            } catch (RuntimeException e) {
                log.warn("[Tasks] Cannot resume task {}: {}", task.getId(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        for (ActiveRun run : active.values()) {
            run.cancel();
        }
        taskRunExecutor.shutdownNow();
    }

    private Object lockFor(String taskId) {
        return taskLocks[Math.floorMod(taskId.hashCode(), taskLocks.length)];
    }

    private TaskSubmission start(Task task, Function<TeamCoordinator, TaskOutcome> body) {
        TeamCoordinator coordinator = new TeamCoordinator(runtimeFactory, toolGateway, store,
                properties.getCoordinator(), clock);
        ActiveRun run = new ActiveRun(coordinator);
        if (active.putIfAbsent(task.getId(), run) != null) {
            throw new IllegalStateException("Task " + task.getId() + " is already running");
        }
        try {
            taskRunExecutor.execute(() -> execute(task.getId(), run, body));
        } catch (RuntimeException e) {
            active.remove(task.getId(), run);
            throw e;
        }
        return new TaskSubmission(task, run.outcome);
    }

    private void execute(String taskId, ActiveRun run, Function<TeamCoordinator, TaskOutcome> body) {
        MDC.put("taskId", taskId);
        run.attach(Thread.currentThread());
        try {
            TaskOutcome outcome = body.apply(run.coordinator);
            log.info("[Tasks] Task {} finished: {} {}", taskId, outcome.status(),
                    outcome.failureReason() != null ? outcome.failureReason() : "");
            run.outcome.complete(outcome);
        } catch (Exception e) { // NOSONAR - must not kill executor thread
            log.error("[Tasks] Task {} crashed", taskId, e);
            run.outcome.completeExceptionally(e);
        } finally {
            run.detach();
            active.remove(taskId, run);
            MDC.remove("taskId");
        }
    }

    /**
     * A started task and the future of its outcome.
     */
    public record TaskSubmission(Task task, CompletableFuture<TaskOutcome> outcome) {
    }

    /**
     * Stored view of a task: projection, outcome when finished, and the full log.
     */
    public record TaskDetails(Task task, TaskOutcome outcome, List<ConversationEntry> entries, boolean running) {

        public Optional<TaskOutcome> findOutcome() {
            return Optional.ofNullable(outcome);
        }
    }

    private static final class ActiveRun {

        private final TeamCoordinator coordinator;
        private final CompletableFuture<TaskOutcome> outcome = new CompletableFuture<>();
        private Thread runner;

        private ActiveRun(TeamCoordinator coordinator) {
            this.coordinator = coordinator;
        }

        synchronized void attach(Thread thread) {
            this.runner = thread;
            if (coordinator.isCancelRequested()) {
                thread.interrupt();
            }
        }

        synchronized void detach() {
            this.runner = null;
            // do not leak an interrupt into the next pooled task
            Thread.interrupted();
        }

        synchronized void cancel() {
            coordinator.cancel();
            if (runner != null) {
                runner.interrupt();
            }
        }
    }
}

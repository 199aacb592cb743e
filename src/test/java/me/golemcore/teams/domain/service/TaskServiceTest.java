package me.golemcore.teams.domain.service;

import me.golemcore.teams.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.teams.domain.exception.TaskNotFoundException;
import me.golemcore.teams.domain.model.FailureReason;
import me.golemcore.teams.domain.model.ConversationRecord;
import me.golemcore.teams.domain.model.Message;
import me.golemcore.teams.domain.model.MessageRole;
import me.golemcore.teams.domain.model.Task;
import me.golemcore.teams.domain.model.TaskEvent;
import me.golemcore.teams.domain.model.TaskOutcome;
import me.golemcore.teams.domain.model.TaskStatus;
import me.golemcore.teams.infrastructure.config.AutoConfiguration;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.testsupport.ScriptedLlm;
import me.golemcore.teams.testsupport.ScriptedTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private TeamsProperties properties;
    private ConversationStore store;
    private ScriptedLlm llm;
    private ScriptedTool writeFile;
    private TaskService taskService;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        properties.getCoordinator().setStepRetryBackoffMs(0);
        properties.getGateway().setRetryBackoffMs(0);
        properties.getGateway().setTimeoutMs(10_000);
        properties.setDefaultTeam("solo");

        TeamsProperties.AgentProperties alice = new TeamsProperties.AgentProperties();
        alice.setName("Alice");
        alice.setRole("Developer");
        alice.setAllowedTools(List.of("write_file"));
        properties.getAgents().add(alice);
        TeamsProperties.TeamProperties solo = new TeamsProperties.TeamProperties();
        solo.setName("solo");
        solo.setMembers(List.of("Alice"));
        solo.setMaxTurns(10);
        properties.getDefinitions().add(solo);

        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new ConversationStore(storage, AutoConfiguration.objectMapper(), properties);
        llm = new ScriptedLlm();
        writeFile = ScriptedTool.writeFile();
        ToolRegistry registry = new ToolRegistry(List.of(writeFile));
        TeamCatalog catalog = new TeamCatalog(properties);
        AgentRuntimeFactory factory = new AgentRuntimeFactory(catalog, registry, llm, properties);
        ToolGateway gateway = new ToolGateway(registry, properties, AutoConfiguration.objectMapper());
        taskService = new TaskService(catalog, factory, gateway, store, properties, Clock.fixed(NOW, ZoneOffset.UTC),
                Executors.newSingleThreadExecutor());
    }

    @AfterEach
    void tearDown() {
        taskService.shutdown();
    }

    @Test
    void shouldRunSubmittedTaskToCompletion() throws Exception {
        llm.reply("All done. TERMINATE");

        TaskService.TaskSubmission submission = taskService.submit("  say hello  ", null);
        TaskOutcome outcome = submission.outcome().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.COMPLETED, outcome.status());
        assertEquals("All done.", outcome.summary());
        assertEquals("solo", submission.task().getTeamName());
        assertEquals("say hello", submission.task().getDescription());

        TaskService.TaskDetails details = taskService.getTask(submission.task().getId());
        assertEquals(TaskStatus.COMPLETED, details.task().getStatus());
        assertTrue(details.findOutcome().isPresent());
        assertEquals(1, taskService.listTasks().size());
    }

    @Test
    void shouldRejectBlankDescriptionAndUnknownTeam() {
        assertThrows(IllegalArgumentException.class, () -> taskService.submit(" ", null));
        assertThrows(IllegalArgumentException.class, () -> taskService.submit("work", "missing"));
        assertTrue(taskService.listTasks().isEmpty());
    }

    @Test
    void shouldCancelRunningTaskAndAbortToolCall() throws Exception {
        writeFile.thenHang();
        llm.callTool("write_file", Map.of("file_path", "a.txt", "content", "x"));

        TaskService.TaskSubmission submission = taskService.submit("slow write", "solo");
        long deadline = System.currentTimeMillis() + 5000;
        while (writeFile.invocationCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(taskService.isRunning(submission.task().getId()));

        taskService.cancel(submission.task().getId());
        TaskOutcome outcome = submission.outcome().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.FAILED, outcome.status());
        assertEquals(FailureReason.CANCELLED, outcome.failureReason());
    }

    @Test
    void shouldCancelIdleUnfinishedTask() {
        storeUnfinished("t-idle");

        taskService.cancel("t-idle");

        Task task = taskService.getTask("t-idle").task();
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals(FailureReason.CANCELLED, task.getFailureReason());
        assertThrows(IllegalStateException.class, () -> taskService.cancel("t-idle"));
    }

    @Test
    void shouldAcceptOnlyOneOfConcurrentIdleCancels() throws Exception {
        storeUnfinished("t-twice");

        List<Object> results = race(
                () -> {
                    taskService.cancel("t-twice");
                    return "cancelled";
                },
                () -> {
                    taskService.cancel("t-twice");
                    return "cancelled";
                });

        assertEquals(1, results.stream().filter("cancelled"::equals).count());
        assertEquals(1, results.stream().filter(IllegalStateException.class::isInstance).count());
        ConversationRecord record = store.load("t-twice");
        assertEquals(4, record.lastSeq());
        assertEquals(TaskStatus.FAILED, record.status());
    }

    @Test
    void shouldSerializeIdleCancelWithResume() throws Exception {
        storeUnfinished("t-contended");
        writeFile.thenHang();
        llm.callTool("write_file", Map.of("file_path", "a.txt", "content", "x"));

        List<Object> results = race(
                () -> taskService.resume("t-contended"),
                () -> {
                    taskService.cancel("t-contended");
                    return "cancelled";
                });

        Object resumed = results.get(0);
        assertEquals("cancelled", results.get(1));
        if (resumed instanceof TaskService.TaskSubmission submission) {
            TaskOutcome outcome = submission.outcome().get(5, TimeUnit.SECONDS);
            assertEquals(FailureReason.CANCELLED, outcome.failureReason());
        } else {
            assertInstanceOf(IllegalStateException.class, resumed);
        }
        ConversationRecord record = store.load("t-contended");
        assertEquals(TaskStatus.FAILED, record.status());
        assertEquals(FailureReason.CANCELLED, record.outcome().orElseThrow().failureReason());
    }

    @Test
    void shouldResumeUnfinishedTask() throws Exception {
        storeUnfinished("t-resume");
        llm.reply("Picked it up. TERMINATE");

        TaskOutcome outcome = taskService.resume("t-resume").outcome().get(5, TimeUnit.SECONDS);

        assertEquals(TaskStatus.COMPLETED, outcome.status());
        assertThrows(IllegalStateException.class, () -> taskService.resume("t-resume"));
    }

    @Test
    void shouldResumeInterruptedTasksOnStartupWhenEnabled() throws Exception {
        storeUnfinished("t-startup");
        llm.reply("Recovered. TERMINATE");
        properties.getCoordinator().setResumeOnStartup(true);

        taskService.resumeInterruptedTasks();

        long deadline = System.currentTimeMillis() + 5000;
        while (!store.load("t-startup").isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(TaskStatus.COMPLETED, store.load("t-startup").status());
    }

    @Test
    void shouldLeaveInterruptedTasksAloneByDefault() {
        storeUnfinished("t-idle");

        taskService.resumeInterruptedTasks();

        assertFalse(taskService.isRunning("t-idle"));
        assertEquals(0, llm.callCount());
    }

    @Test
    void shouldReportUnknownTask() {
        assertThrows(TaskNotFoundException.class, () -> taskService.getTask("nope"));
        assertThrows(TaskNotFoundException.class, () -> taskService.cancel("nope"));
    }

    /**
     * Runs both actions at once and returns each one's value or thrown exception,
     * in argument order.
     */
    private static List<Object> race(Callable<Object> first, Callable<Object> second) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Object> a = pool.submit(() -> {
                start.await();
                return first.call();
            });
            Future<Object> b = pool.submit(() -> {
                start.await();
                return second.call();
            });
            start.countDown();
            return List.of(outcomeOf(a), outcomeOf(b));
        } finally {
            pool.shutdownNow();
        }
    }

    private static Object outcomeOf(Future<Object> future) throws Exception {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private void storeUnfinished(String taskId) {
        store.append(TaskEvent.builder().taskId(taskId).seq(1).timestamp(NOW).status(TaskStatus.PENDING)
                .description("unfinished work").teamName("solo").build());
        store.append(Message.builder().taskId(taskId).seq(2).timestamp(NOW).sender("user").role(MessageRole.USER)
                .content("unfinished work").turn(0).build());
        store.append(TaskEvent.builder().taskId(taskId).seq(3).timestamp(NOW).status(TaskStatus.RUNNING).build());
    }
}

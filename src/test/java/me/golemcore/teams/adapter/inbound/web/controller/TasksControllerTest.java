package me.golemcore.teams.adapter.inbound.web.controller;

import me.golemcore.teams.adapter.inbound.web.dto.SubmitTaskRequest;
import me.golemcore.teams.adapter.inbound.web.dto.TaskAcceptedResponse;
import me.golemcore.teams.adapter.inbound.web.dto.TaskDetailDto;
import me.golemcore.teams.adapter.inbound.web.dto.TaskOutcomeDto;
import me.golemcore.teams.adapter.inbound.web.dto.TaskSummaryDto;
import me.golemcore.teams.domain.model.FailureReason;
import me.golemcore.teams.domain.model.Task;
import me.golemcore.teams.domain.model.TaskOutcome;
import me.golemcore.teams.domain.model.TaskStatus;
import me.golemcore.teams.domain.service.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TasksControllerTest {

    private TaskService taskService;
    private TasksController controller;

    @BeforeEach
    void setUp() {
        taskService = mock(TaskService.class);
        controller = new TasksController(taskService);
    }

    @Test
    void shouldAcceptSubmittedTask() {
        Task task = task("t1", Instant.parse("2026-01-01T00:00:00Z"));
        when(taskService.submit("write hello.txt", "research"))
                .thenReturn(new TaskService.TaskSubmission(task, new CompletableFuture<>()));

        StepVerifier.create(controller.submitTask(new SubmitTaskRequest("write hello.txt", "research"), false))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    TaskAcceptedResponse body = assertInstanceOf(TaskAcceptedResponse.class, response.getBody());
                    assertEquals("t1", body.getTaskId());
                    assertEquals("research", body.getTeam());
                    assertEquals("PENDING", body.getStatus());
                })
                .verifyComplete();
    }

    @Test
    void shouldWaitForOutcomeWhenRequested() {
        Task task = task("t1", Instant.now());
        TaskOutcome outcome = TaskOutcome.failed("t1", FailureReason.TURN_LIMIT_EXCEEDED, "Turn limit reached", 20);
        when(taskService.submit("long job", null))
                .thenReturn(new TaskService.TaskSubmission(task, CompletableFuture.completedFuture(outcome)));

        StepVerifier.create(controller.submitTask(new SubmitTaskRequest("long job", null), true))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    TaskOutcomeDto body = assertInstanceOf(TaskOutcomeDto.class, response.getBody());
                    assertEquals("FAILED", body.getStatus());
                    assertEquals("TURN_LIMIT_EXCEEDED", body.getFailureReason());
                    assertEquals(20, body.getTurns());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectBlankDescription() {
        SubmitTaskRequest request = new SubmitTaskRequest("  ", null);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.submitTask(request, false));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(taskService, never()).submit(any(), any());
    }

    @Test
    void shouldListNewestTasksFirst() {
        Task older = task("old", Instant.parse("2026-01-01T00:00:00Z"));
        Task newer = task("new", Instant.parse("2026-01-02T00:00:00Z"));
        when(taskService.listTasks()).thenReturn(List.of(older, newer));
        when(taskService.isRunning("new")).thenReturn(true);

        StepVerifier.create(controller.listTasks())
                .assertNext(response -> {
                    List<TaskSummaryDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(List.of("new", "old"), body.stream().map(TaskSummaryDto::getId).toList());
                    assertTrue(body.get(0).isRunning());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnTaskDetailsWithOutcome() {
        Task task = task("t1", Instant.now());
        task.setStatus(TaskStatus.COMPLETED);
        TaskOutcome outcome = TaskOutcome.completed("t1", "Done", 3);
        when(taskService.getTask("t1")).thenReturn(new TaskService.TaskDetails(task, outcome, List.of(), false));

        StepVerifier.create(controller.getTask("t1"))
                .assertNext(response -> {
                    TaskDetailDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("COMPLETED", body.getTask().getStatus());
                    assertEquals("Done", body.getOutcome().getSummary());
                    assertNull(body.getOutcome().getFailureReason());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequestCancellation() {
        StepVerifier.create(controller.cancelTask("t1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertEquals("CANCEL_REQUESTED", response.getBody().getStatus());
                })
                .verifyComplete();

        verify(taskService).cancel("t1");
    }

    @Test
    void shouldResumeTask() {
        Task task = task("t1", Instant.now());
        task.setStatus(TaskStatus.RUNNING);
        when(taskService.resume("t1")).thenReturn(new TaskService.TaskSubmission(task, new CompletableFuture<>()));

        StepVerifier.create(controller.resumeTask("t1"))
                .assertNext(response -> assertEquals("RUNNING", response.getBody().getStatus()))
                .verifyComplete();
    }

    private static Task task(String id, Instant createdAt) {
        return Task.builder()
                .id(id)
                .description("work")
                .teamName("research")
                .createdAt(createdAt)
                .build();
    }
}

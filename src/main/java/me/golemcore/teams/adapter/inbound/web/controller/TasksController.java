package me.golemcore.teams.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.adapter.inbound.web.dto.SubmitTaskRequest;
import me.golemcore.teams.adapter.inbound.web.dto.TaskAcceptedResponse;
import me.golemcore.teams.adapter.inbound.web.dto.TaskDetailDto;
import me.golemcore.teams.adapter.inbound.web.dto.TaskOutcomeDto;
import me.golemcore.teams.adapter.inbound.web.dto.TaskSummaryDto;
import me.golemcore.teams.domain.model.Task;
import me.golemcore.teams.domain.model.TaskOutcome;
import me.golemcore.teams.domain.service.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Task submission, inspection, cancellation and resume endpoints.
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
@Slf4j
public class TasksController {

    private final TaskService taskService;

    /**
     * Starts a task. Returns 202 immediately, or with {@code wait=true} holds
     * the request until the task finishes and returns its outcome.
     */
    @PostMapping
    public Mono<ResponseEntity<Object>> submitTask(@RequestBody SubmitTaskRequest request,
            @RequestParam(defaultValue = "false") boolean wait) {
        if (request == null || request.getDescription() == null || request.getDescription().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "description is required");
        }
        TaskService.TaskSubmission submission = taskService.submit(request.getDescription(), request.getTeam());
        Task task = submission.task();
        if (wait) {
            return Mono.fromFuture(submission.outcome())
                    .map(outcome -> ResponseEntity.<Object>ok(toOutcomeDto(outcome)));
        }
        TaskAcceptedResponse accepted = TaskAcceptedResponse.builder()
                .taskId(task.getId())
                .team(task.getTeamName())
                .status(task.getStatus().name())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).<Object>body(accepted));
    }

    @GetMapping
    public Mono<ResponseEntity<List<TaskSummaryDto>>> listTasks() {
        List<TaskSummaryDto> dtos = taskService.listTasks().stream()
                .sorted(Comparator.comparing(Task::getCreatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .map(task -> toSummary(task, taskService.isRunning(task.getId())))
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<TaskDetailDto>> getTask(@PathVariable String id) {
        TaskService.TaskDetails details = taskService.getTask(id);
        TaskDetailDto dto = TaskDetailDto.builder()
                .task(toSummary(details.task(), details.running()))
                .outcome(details.findOutcome().map(TasksController::toOutcomeDto).orElse(null))
                .entries(details.entries())
                .build();
        return Mono.just(ResponseEntity.ok(dto));
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<TaskAcceptedResponse>> cancelTask(@PathVariable String id) {
        taskService.cancel(id);
        log.info("[API] Cancel requested for task {}", id);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskAcceptedResponse.builder()
                .taskId(id)
                .status("CANCEL_REQUESTED")
                .build()));
    }

    @PostMapping("/{id}/resume")
    public Mono<ResponseEntity<TaskAcceptedResponse>> resumeTask(@PathVariable String id) {
        TaskService.TaskSubmission submission = taskService.resume(id);
        Task task = submission.task();
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(TaskAcceptedResponse.builder()
                .taskId(task.getId())
                .team(task.getTeamName())
                .status(task.getStatus().name())
                .build()));
    }

    private static TaskSummaryDto toSummary(Task task, boolean running) {
        return TaskSummaryDto.builder()
                .id(task.getId())
                .description(task.getDescription())
                .team(task.getTeamName())
                .status(task.getStatus().name())
                .failureReason(task.getFailureReason() != null ? task.getFailureReason().name() : null)
                .summary(task.getSummary())
                .createdAt(task.getCreatedAt() != null ? task.getCreatedAt().toString() : null)
                .running(running)
                .build();
    }

    private static TaskOutcomeDto toOutcomeDto(TaskOutcome outcome) {
        return TaskOutcomeDto.builder()
                .taskId(outcome.taskId())
                .status(outcome.status().name())
                .failureReason(outcome.failureReason() != null ? outcome.failureReason().name() : null)
                .summary(outcome.summary())
                .turns(outcome.turns())
                .build();
    }
}

package dev.newsroom.controller;

import dev.newsroom.dto.CompleteTaskRequest;
import dev.newsroom.dto.CreateTaskRequest;
import dev.newsroom.dto.ReassignTaskRequest;
import dev.newsroom.dto.TaskResponse;
import dev.newsroom.entity.StaffUser;
import dev.newsroom.service.TaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
@Tag(name = "Tasks", description = "Task inbox, completion and reassignment")
@SecurityRequirement(name = "staffId")
@Slf4j
public class TaskController {

    private final TaskService taskService;

    /**
     * The caller's task inbox, optionally filtered by status.
     */
    @GetMapping
    @Operation(summary = "List my tasks")
    public Mono<List<TaskResponse>> getMyTasks(@AuthenticationPrincipal StaffUser staff,
                                               @RequestParam(required = false) String status,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        log.debug("Fetching tasks for staff={}, status={}", staff.getId(), status);
        return taskService.tasksForAssignee(staff.getId(), status, page, size).collectList();
    }

    @GetMapping("/unassigned")
    @PreAuthorize("hasAnyRole('SUB_EDITOR', 'EDITOR', 'ADMIN', 'SUPERADMIN')")
    @Operation(summary = "Tasks awaiting an assignee")
    public Mono<List<TaskResponse>> getUnassignedTasks() {
        return taskService.unassignedTasks().collectList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get task")
    public Mono<TaskResponse> getTask(@PathVariable Long id) {
        return taskService.getTask(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create task", description = "Manual task creation, SUB_EDITOR and above")
    public Mono<TaskResponse> createTask(@AuthenticationPrincipal StaffUser staff,
                                         @Valid @RequestBody CreateTaskRequest request) {
        log.info("Creating {} task for {} by staff={}", request.getType(), request.getContentId(), staff.getId());
        return taskService.createTask(request, staff.getId());
    }

    @PostMapping("/{id}/start")
    @Operation(summary = "Start task")
    public Mono<TaskResponse> startTask(@AuthenticationPrincipal StaffUser staff, @PathVariable Long id) {
        log.info("Starting task: id={}, staff={}", id, staff.getId());
        return taskService.startTask(id, staff.getId());
    }

    /**
     * Completes the task and performs the workflow step it stands for, as one unit.
     */
    @PostMapping("/{id}/complete")
    @Operation(summary = "Complete task",
            description = "Stage steps need an outcome; a rejecting outcome needs a reason")
    public Mono<TaskResponse> completeTask(@AuthenticationPrincipal StaffUser staff,
                                           @PathVariable Long id,
                                           @Valid @RequestBody CompleteTaskRequest request) {
        log.info("Completing task: id={}, outcome={}, staff={}", id, request.getOutcome(), staff.getId());
        return taskService.completeTask(id, staff.getId(), request);
    }

    @PutMapping("/{id}/assignee")
    @Operation(summary = "Reassign task",
            description = "Creator, current assignee or SUB_EDITOR and above; the new assignee must fit the task type")
    public Mono<TaskResponse> reassignTask(@AuthenticationPrincipal StaffUser staff,
                                           @PathVariable Long id,
                                           @Valid @RequestBody ReassignTaskRequest request) {
        log.info("Reassigning task: id={}, to={}, staff={}", id, request.getAssigneeId(), staff.getId());
        return taskService.reassignTask(id, request.getAssigneeId(), staff.getId(), request.getNote());
    }
}

package com.appraisehub.backend.controller;

import com.appraisehub.backend.dto.ScheduledTaskDTO;
import com.appraisehub.backend.dto.TaskFailureRequest;
import com.appraisehub.backend.service.ScheduledTaskPlanner;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Polling surface for the external task runner.
 */
@RestController
@RequestMapping("/api/scheduled-tasks")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
public class ScheduledTaskController {

    private final ScheduledTaskPlanner taskPlanner;

    /**
     * Get pending tasks scheduled for today or earlier
     */
    @GetMapping("/due")
    public ResponseEntity<List<ScheduledTaskDTO>> dueTasks() {
        return ResponseEntity.ok(taskPlanner.findDueTasks().stream()
                .map(ScheduledTaskDTO::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/{id}/executed")
    public ResponseEntity<ScheduledTaskDTO> markExecuted(@PathVariable Long id) {
        return ResponseEntity.ok(ScheduledTaskDTO.from(taskPlanner.markExecuted(id)));
    }

    @PostMapping("/{id}/failed")
    public ResponseEntity<ScheduledTaskDTO> markFailed(@PathVariable Long id,
                                                       @Valid @RequestBody TaskFailureRequest request) {
        return ResponseEntity.ok(ScheduledTaskDTO.from(taskPlanner.markFailed(id, request.getReason())));
    }
}

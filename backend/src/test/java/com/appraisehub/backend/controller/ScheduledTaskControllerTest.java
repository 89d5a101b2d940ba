package com.appraisehub.backend.controller;

import com.appraisehub.backend.dto.ScheduledTaskDTO;
import com.appraisehub.backend.dto.TaskFailureRequest;
import com.appraisehub.backend.entity.ScheduledAppraisalTask;
import com.appraisehub.backend.service.ScheduledTaskPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ScheduledTaskControllerTest {

    private ScheduledTaskPlanner taskPlanner;
    private ScheduledTaskController controller;

    @BeforeEach
    void setUp() {
        taskPlanner = mock(ScheduledTaskPlanner.class);
        controller = new ScheduledTaskController(taskPlanner);
    }

    private static ScheduledAppraisalTask task(long id, ScheduledAppraisalTask.TaskStatus status) {
        ScheduledAppraisalTask task = new ScheduledAppraisalTask();
        task.setId(id);
        task.setInitiatedAppraisalId(42L);
        task.setPeriodKey("default");
        task.setTaskType(ScheduledAppraisalTask.TaskType.CLOSE);
        task.setScheduledDate(LocalDate.of(2026, 4, 14));
        task.setStatus(status);
        return task;
    }

    @Test
    @DisplayName("due tasks are returned as DTOs")
    void due() {
        when(taskPlanner.findDueTasks()).thenReturn(List.of(task(1, ScheduledAppraisalTask.TaskStatus.PENDING)));

        ResponseEntity<List<ScheduledTaskDTO>> response = controller.dueTasks();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).singleElement()
                .satisfies(dto -> {
                    assertThat(dto.getId()).isEqualTo(1L);
                    assertThat(dto.getTaskType()).isEqualTo(ScheduledAppraisalTask.TaskType.CLOSE);
                });
    }

    @Test
    @DisplayName("failure reports pass the reason through")
    void failed() {
        ScheduledAppraisalTask failed = task(2, ScheduledAppraisalTask.TaskStatus.ERROR);
        failed.setError("smtp timeout");
        when(taskPlanner.markFailed(2L, "smtp timeout")).thenReturn(failed);

        ResponseEntity<ScheduledTaskDTO> response = controller.markFailed(2L, new TaskFailureRequest("smtp timeout"));

        assertThat(response.getBody().getStatus()).isEqualTo(ScheduledAppraisalTask.TaskStatus.ERROR);
        assertThat(response.getBody().getError()).isEqualTo("smtp timeout");
    }
}

package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.ScheduledAppraisalTask;
import com.appraisehub.backend.entity.ScheduledAppraisalTask.TaskStatus;
import com.appraisehub.backend.entity.ScheduledAppraisalTask.TaskType;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class ScheduledTaskDTO {

    private Long id;
    private Long initiatedAppraisalId;
    private Long frequencyCalendarDetailId;
    private String periodKey;
    private TaskType taskType;
    private Integer sequenceNo;
    private LocalDate scheduledDate;
    private TaskStatus status;
    private LocalDateTime executedAt;
    private String error;

    public static ScheduledTaskDTO from(ScheduledAppraisalTask task) {
        ScheduledTaskDTO dto = new ScheduledTaskDTO();
        dto.setId(task.getId());
        dto.setInitiatedAppraisalId(task.getInitiatedAppraisalId());
        dto.setFrequencyCalendarDetailId(task.getFrequencyCalendarDetailId());
        dto.setPeriodKey(task.getPeriodKey());
        dto.setTaskType(task.getTaskType());
        dto.setSequenceNo(task.getSequenceNo());
        dto.setScheduledDate(task.getScheduledDate());
        dto.setStatus(task.getStatus());
        dto.setExecutedAt(task.getExecutedAt());
        dto.setError(task.getError());
        return dto;
    }
}

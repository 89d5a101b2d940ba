package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A follow-up action waiting for the external task runner.
 */
@Entity
@Table(name = "scheduled_appraisal_tasks",
        uniqueConstraints = @UniqueConstraint(name = "uk_task_slot",
                columnNames = {"initiated_appraisal_id", "period_key", "task_type", "sequence_no"}),
        indexes = @Index(name = "idx_task_due", columnList = "status, scheduled_date"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class ScheduledAppraisalTask extends BaseEntity {

    public static final String DEFAULT_PERIOD_KEY = "default";

    @Column(name = "initiated_appraisal_id", nullable = false)
    private Long initiatedAppraisalId;

    @Column(name = "frequency_calendar_detail_id")
    private Long frequencyCalendarDetailId; // null for the synthetic period

    @Column(name = "period_key", nullable = false, length = 40)
    private String periodKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "task_type", nullable = false, length = 20)
    private TaskType taskType;

    @Column(name = "sequence_no", nullable = false)
    private Integer sequenceNo = 0;

    @Column(name = "scheduled_date", nullable = false)
    private LocalDate scheduledDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;

    @Column(columnDefinition = "TEXT")
    private String error;

    public enum TaskType {
        INITIATE, REMINDER, CLOSE
    }

    public enum TaskStatus {
        PENDING, EXECUTED, ERROR
    }
}

package com.appraisehub.backend.entity;

import lombok.*;
import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "evaluations",
        uniqueConstraints = @UniqueConstraint(name = "uk_evaluation_employee_campaign",
                columnNames = {"employee_id", "initiated_appraisal_id"}),
        indexes = {
                @Index(name = "idx_evaluation_manager", columnList = "manager_id"),
                @Index(name = "idx_evaluation_campaign", columnList = "initiated_appraisal_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class Evaluation extends BaseEntity {

    @Column(name = "employee_id", nullable = false)
    private Long employeeId;

    @Column(name = "manager_id", nullable = false)
    private Long managerId;

    @Column(name = "initiated_appraisal_id")
    private Long initiatedAppraisalId;

    // Kept for rows created before campaigns existed
    @Column(name = "review_cycle_id", length = 100)
    private String reviewCycleId;

    // Self evaluation
    @Convert(converter = ResponseSetConverter.class)
    @Column(name = "self_evaluation_data", columnDefinition = "TEXT")
    private ResponseSet selfEvaluationData;

    @Column(name = "self_evaluation_submitted_at")
    private LocalDateTime selfEvaluationSubmittedAt;

    // Manager evaluation
    @Convert(converter = ResponseSetConverter.class)
    @Column(name = "manager_evaluation_data", columnDefinition = "TEXT")
    private ResponseSet managerEvaluationData;

    @Column(name = "manager_evaluation_submitted_at")
    private LocalDateTime managerEvaluationSubmittedAt;

    @Column(name = "overall_rating")
    private Integer overallRating;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EvaluationStatus status = EvaluationStatus.NOT_STARTED;

    // One-on-one meeting
    @Column(name = "meeting_scheduled_at")
    private LocalDateTime meetingScheduledAt;

    @Column(name = "meeting_notes", columnDefinition = "TEXT")
    private String meetingNotes;

    @Column(name = "meeting_completed_at")
    private LocalDateTime meetingCompletedAt;

    @Column(name = "show_notes_to_employee")
    private Boolean showNotesToEmployee = false;

    @Column(name = "finalized_at")
    private LocalDateTime finalizedAt;

    // Calibration (HR, after completion)
    @Column(name = "calibrated_rating")
    private Integer calibratedRating;

    @Column(name = "calibration_remarks", columnDefinition = "TEXT")
    private String calibrationRemarks;

    @Column(name = "calibrated_by")
    private Long calibratedBy;

    @Column(name = "calibrated_at")
    private LocalDateTime calibratedAt;

    @Version
    private Long version;

    public boolean isSelfSubmitted() {
        return selfEvaluationSubmittedAt != null;
    }

    public boolean isManagerSubmitted() {
        return managerEvaluationSubmittedAt != null;
    }

    public boolean isFinalized() {
        return finalizedAt != null;
    }

    public MeetingState getMeetingState() {
        if (meetingCompletedAt != null) {
            return MeetingState.COMPLETED;
        }
        return meetingScheduledAt != null ? MeetingState.SCHEDULED : MeetingState.UNSCHEDULED;
    }

    public enum EvaluationStatus {
        NOT_STARTED, DRAFT, SELF_SUBMITTED, REVIEWED, COMPLETED
    }

    public enum MeetingState {
        UNSCHEDULED, SCHEDULED, COMPLETED
    }
}

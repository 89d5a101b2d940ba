package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.Evaluation.EvaluationStatus;
import com.appraisehub.backend.entity.Evaluation.MeetingState;
import com.appraisehub.backend.entity.ResponseSet;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class EvaluationDTO {

    private Long id;
    private Long employeeId;
    private Long managerId;
    private Long initiatedAppraisalId;
    private String reviewCycleId;

    private ResponseSet selfEvaluationData;
    private LocalDateTime selfEvaluationSubmittedAt;
    private ResponseSet managerEvaluationData;
    private LocalDateTime managerEvaluationSubmittedAt;
    private Integer overallRating;
    private EvaluationStatus status;

    private MeetingState meetingState;
    private LocalDateTime meetingScheduledAt;
    private String meetingNotes;
    private LocalDateTime meetingCompletedAt;
    private Boolean showNotesToEmployee;
    private LocalDateTime finalizedAt;

    private Integer calibratedRating;
    private String calibrationRemarks;
    private Long calibratedBy;
    private LocalDateTime calibratedAt;

    private Long version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

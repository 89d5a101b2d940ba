package com.appraisehub.backend.dto;

import com.appraisehub.backend.entity.Evaluation.EvaluationStatus;
import com.appraisehub.backend.entity.ResponseSet;
import com.appraisehub.backend.workflow.EvaluationField;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Partial update of an evaluation. A non-null field means "write this field".
 * Submission, completion and finalization timestamps are stamped by the
 * server; the value sent only marks the intent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationPatchRequest {

    private ResponseSet selfEvaluationData;
    private LocalDateTime selfEvaluationSubmittedAt;
    private ResponseSet managerEvaluationData;
    private LocalDateTime managerEvaluationSubmittedAt;
    private Integer overallRating;
    private EvaluationStatus status;
    private LocalDateTime meetingScheduledAt;
    private String meetingNotes;
    private LocalDateTime meetingCompletedAt;
    private Boolean showNotesToEmployee;
    private LocalDateTime finalizedAt;
    private Integer calibratedRating;
    private String calibrationRemarks;

    public Set<EvaluationField> presentFields() {
        Set<EvaluationField> fields = EnumSet.noneOf(EvaluationField.class);
        if (selfEvaluationData != null) fields.add(EvaluationField.SELF_EVALUATION_DATA);
        if (selfEvaluationSubmittedAt != null) fields.add(EvaluationField.SELF_EVALUATION_SUBMITTED_AT);
        if (managerEvaluationData != null) fields.add(EvaluationField.MANAGER_EVALUATION_DATA);
        if (managerEvaluationSubmittedAt != null) fields.add(EvaluationField.MANAGER_EVALUATION_SUBMITTED_AT);
        if (overallRating != null) fields.add(EvaluationField.OVERALL_RATING);
        if (status != null) fields.add(EvaluationField.STATUS);
        if (meetingScheduledAt != null) fields.add(EvaluationField.MEETING_SCHEDULED_AT);
        if (meetingNotes != null) fields.add(EvaluationField.MEETING_NOTES);
        if (meetingCompletedAt != null) fields.add(EvaluationField.MEETING_COMPLETED_AT);
        if (showNotesToEmployee != null) fields.add(EvaluationField.SHOW_NOTES_TO_EMPLOYEE);
        if (finalizedAt != null) fields.add(EvaluationField.FINALIZED_AT);
        if (calibratedRating != null) fields.add(EvaluationField.CALIBRATED_RATING);
        if (calibrationRemarks != null) fields.add(EvaluationField.CALIBRATION_REMARKS);
        return fields;
    }
}

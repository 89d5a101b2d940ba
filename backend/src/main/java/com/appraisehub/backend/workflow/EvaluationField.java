package com.appraisehub.backend.workflow;

/**
 * Writable evaluation fields, named as they appear in request bodies.
 */
public enum EvaluationField {
    SELF_EVALUATION_DATA("selfEvaluationData"),
    SELF_EVALUATION_SUBMITTED_AT("selfEvaluationSubmittedAt"),
    MANAGER_EVALUATION_DATA("managerEvaluationData"),
    MANAGER_EVALUATION_SUBMITTED_AT("managerEvaluationSubmittedAt"),
    OVERALL_RATING("overallRating"),
    STATUS("status"),
    MEETING_SCHEDULED_AT("meetingScheduledAt"),
    MEETING_NOTES("meetingNotes"),
    MEETING_COMPLETED_AT("meetingCompletedAt"),
    SHOW_NOTES_TO_EMPLOYEE("showNotesToEmployee"),
    FINALIZED_AT("finalizedAt"),
    CALIBRATED_RATING("calibratedRating"),
    CALIBRATION_REMARKS("calibrationRemarks");

    private final String jsonName;

    EvaluationField(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }
}

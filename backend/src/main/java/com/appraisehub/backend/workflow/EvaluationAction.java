package com.appraisehub.backend.workflow;

public enum EvaluationAction {
    SAVE_SELF_DRAFT,
    SUBMIT_SELF_EVALUATION,
    SUBMIT_MANAGER_REVIEW,
    SCHEDULE_MEETING,
    RECORD_MEETING_NOTES,
    FINALIZE,
    CALIBRATE
}

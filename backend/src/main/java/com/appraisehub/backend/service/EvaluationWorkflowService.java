package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.*;
import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.Evaluation.EvaluationStatus;
import com.appraisehub.backend.entity.ResponseSet;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.repository.EvaluationRepository;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.util.CacheKeyBuilder;
import com.appraisehub.backend.workflow.ActorRelation;
import com.appraisehub.backend.workflow.EvaluationAction;
import com.appraisehub.backend.workflow.EvaluationField;
import com.appraisehub.backend.workflow.EvaluationFieldMask;
import com.appraisehub.backend.workflow.TransitionGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluation state machine. Every write goes through the transition guard,
 * and generic patches go through the field mask first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationWorkflowService {

    private final EvaluationRepository evaluationRepository;
    private final EvaluationFieldMask fieldMask;
    private final TransitionGuard transitionGuard;
    private final NotificationDispatcher notificationDispatcher;
    private final CacheService cacheService;
    private final Clock clock;

    @Value("${appraisal.rating.min:1}")
    private int minRating = 1;

    @Value("${appraisal.rating.max:5}")
    private int maxRating = 5;

    // ===================== READS =====================

    @Transactional(readOnly = true)
    public EvaluationDTO getEvaluation(Long evaluationId, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        if (!actor.isUnrestricted() && ActorRelation.of(actor, evaluation).isEmpty()) {
            throw new ForbiddenException("Not permitted to view evaluation " + evaluationId);
        }
        return toDTO(evaluation, actor);
    }

    /**
     * Evaluations the actor owns or manages. HR and admins may instead list a
     * whole campaign.
     */
    @Transactional(readOnly = true)
    public List<EvaluationDTO> listEvaluations(AppraisalActor actor, Long campaignId) {
        List<Evaluation> evaluations;
        if (campaignId != null && actor.isUnrestricted()) {
            evaluations = evaluationRepository.findByInitiatedAppraisalId(campaignId);
        } else {
            evaluations = evaluationRepository.findVisibleTo(actor.getId());
            if (campaignId != null) {
                evaluations = evaluations.stream()
                        .filter(e -> campaignId.equals(e.getInitiatedAppraisalId()))
                        .collect(Collectors.toList());
            }
        }
        return evaluations.stream().map(e -> toDTO(e, actor)).collect(Collectors.toList());
    }

    /**
     * Evaluations waiting on the actor's manager review.
     */
    @Transactional(readOnly = true)
    public List<EvaluationDTO> getPendingManagerReviews(AppraisalActor actor) {
        return evaluationRepository
                .findByManagerIdAndSelfEvaluationSubmittedAtIsNotNullAndManagerEvaluationSubmittedAtIsNull(actor.getId())
                .stream()
                .map(e -> toDTO(e, actor))
                .collect(Collectors.toList());
    }

    // ===================== TRANSITIONS =====================

    @Transactional
    public EvaluationDTO saveSelfEvaluation(Long evaluationId, SelfEvaluationRequest request, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applySelfEvaluation(evaluation, request.getSelfEvaluationData(), request.isSubmit(), actor, relations);
        return persist(evaluation, actor);
    }

    @Transactional
    public EvaluationDTO submitManagerReview(Long evaluationId, ManagerReviewRequest request, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applyManagerReview(evaluation, request.getManagerEvaluationData(), request.getOverallRating(),
                actor, relations);
        return persist(evaluation, actor);
    }

    @Transactional
    public EvaluationDTO scheduleMeeting(Long evaluationId, ScheduleMeetingRequest request, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applyMeetingSchedule(evaluation, request.getMeetingScheduledAt(), actor, relations);
        EvaluationDTO saved = persist(evaluation, actor);
        notificationDispatcher.meetingInvite(evaluation, request);
        return saved;
    }

    @Transactional
    public EvaluationDTO recordMeetingNotes(Long evaluationId, MeetingNotesRequest request, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applyMeetingNotes(evaluation, request.getMeetingNotes(), request.getFinalRating(),
                request.getShowNotesToEmployee(), actor, relations);
        return persist(evaluation, actor);
    }

    @Transactional
    public EvaluationDTO finalizeEvaluation(Long evaluationId, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applyFinalize(evaluation, actor, relations);
        EvaluationDTO saved = persist(evaluation, actor);
        notificationDispatcher.completion(evaluation);
        return saved;
    }

    @Transactional
    public EvaluationDTO calibrate(Long evaluationId, CalibrationRequest request, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);

        applyCalibration(evaluation, request.getCalibratedRating(), request.getCalibrationRemarks(),
                actor, relations);
        return persist(evaluation, actor);
    }

    /**
     * Generic gated update. The field mask is checked first; then each
     * transition the patch implies is guarded and applied in lifecycle order,
     * so a manager can submit a review and finalize in one request.
     */
    @Transactional
    public EvaluationDTO transitionEvaluation(Long evaluationId, EvaluationPatchRequest patch, AppraisalActor actor) {
        Evaluation evaluation = load(evaluationId);
        Set<ActorRelation> relations = ActorRelation.of(actor, evaluation);
        Set<EvaluationField> fields = patch.presentFields();

        if (fields.isEmpty()) {
            throw new ValidationException("No fields to update");
        }
        fieldMask.check(actor, relations, fields);

        boolean completing = fields.contains(EvaluationField.FINALIZED_AT)
                || patch.getStatus() == EvaluationStatus.COMPLETED;
        boolean completedBefore = evaluation.getStatus() == EvaluationStatus.COMPLETED;

        if (fields.contains(EvaluationField.SELF_EVALUATION_DATA)
                || fields.contains(EvaluationField.SELF_EVALUATION_SUBMITTED_AT)) {
            ResponseSet data = patch.getSelfEvaluationData() != null
                    ? patch.getSelfEvaluationData() : evaluation.getSelfEvaluationData();
            applySelfEvaluation(evaluation, data,
                    fields.contains(EvaluationField.SELF_EVALUATION_SUBMITTED_AT), actor, relations);
        }

        if (fields.contains(EvaluationField.MANAGER_EVALUATION_DATA)
                || fields.contains(EvaluationField.MANAGER_EVALUATION_SUBMITTED_AT)) {
            ResponseSet data = patch.getManagerEvaluationData() != null
                    ? patch.getManagerEvaluationData() : evaluation.getManagerEvaluationData();
            Integer rating = patch.getOverallRating() != null ? patch.getOverallRating() : evaluation.getOverallRating();
            applyManagerReview(evaluation, data, rating, actor, relations);
        } else if (fields.contains(EvaluationField.OVERALL_RATING)
                && !fields.contains(EvaluationField.MEETING_NOTES)) {
            transitionGuard.check(EvaluationAction.SUBMIT_MANAGER_REVIEW, actor, relations, evaluation);
            evaluation.setOverallRating(checkRating(patch.getOverallRating(), "overallRating"));
        }

        if (fields.contains(EvaluationField.MEETING_SCHEDULED_AT)) {
            applyMeetingSchedule(evaluation, patch.getMeetingScheduledAt(), actor, relations);
        }

        if (fields.contains(EvaluationField.MEETING_NOTES)
                || fields.contains(EvaluationField.MEETING_COMPLETED_AT)
                || fields.contains(EvaluationField.SHOW_NOTES_TO_EMPLOYEE)) {
            String notes = patch.getMeetingNotes() != null ? patch.getMeetingNotes() : evaluation.getMeetingNotes();
            applyMeetingNotes(evaluation, notes, patch.getOverallRating(), patch.getShowNotesToEmployee(),
                    actor, relations);
        }

        if (completing) {
            applyFinalize(evaluation, actor, relations);
        } else if (patch.getStatus() != null) {
            applyStatus(evaluation, patch.getStatus());
        }

        if (fields.contains(EvaluationField.CALIBRATED_RATING)
                || fields.contains(EvaluationField.CALIBRATION_REMARKS)) {
            Integer rating = patch.getCalibratedRating() != null
                    ? patch.getCalibratedRating() : evaluation.getCalibratedRating();
            String remarks = patch.getCalibrationRemarks() != null
                    ? patch.getCalibrationRemarks() : evaluation.getCalibrationRemarks();
            applyCalibration(evaluation, rating, remarks, actor, relations);
        }

        assertCompletionInvariant(evaluation);
        EvaluationDTO saved = persist(evaluation, actor);
        if (completing && !completedBefore) {
            notificationDispatcher.completion(evaluation);
        }
        if (fields.contains(EvaluationField.MEETING_SCHEDULED_AT)) {
            notificationDispatcher.meetingInvite(evaluation, new ScheduleMeetingRequest(
                    evaluation.getMeetingScheduledAt(), null, null, null, null));
        }
        return saved;
    }

    // ===================== APPLY STEPS =====================

    private void applySelfEvaluation(Evaluation evaluation, ResponseSet data,
                                     boolean submit, AppraisalActor actor, Set<ActorRelation> relations) {
        EvaluationAction action = submit ? EvaluationAction.SUBMIT_SELF_EVALUATION : EvaluationAction.SAVE_SELF_DRAFT;
        transitionGuard.check(action, actor, relations, evaluation);

        if (submit && data == null) {
            throw new ValidationException("self evaluation responses are required");
        }
        evaluation.setSelfEvaluationData(data);
        if (submit) {
            evaluation.setSelfEvaluationSubmittedAt(now());
            evaluation.setStatus(EvaluationStatus.SELF_SUBMITTED);
        } else if (evaluation.getStatus() == EvaluationStatus.NOT_STARTED) {
            evaluation.setStatus(EvaluationStatus.DRAFT);
        }
    }

    private void applyManagerReview(Evaluation evaluation, ResponseSet data,
                                    Integer overallRating, AppraisalActor actor, Set<ActorRelation> relations) {
        transitionGuard.check(EvaluationAction.SUBMIT_MANAGER_REVIEW, actor, relations, evaluation);

        if (data == null) {
            throw new ValidationException("manager evaluation responses are required");
        }
        if (overallRating == null) {
            throw new ValidationException("overallRating is required");
        }
        evaluation.setManagerEvaluationData(data);
        evaluation.setOverallRating(checkRating(overallRating, "overallRating"));
        evaluation.setManagerEvaluationSubmittedAt(now());
        evaluation.setStatus(EvaluationStatus.REVIEWED);
    }

    private void applyMeetingSchedule(Evaluation evaluation, LocalDateTime meetingAt,
                                      AppraisalActor actor, Set<ActorRelation> relations) {
        transitionGuard.check(EvaluationAction.SCHEDULE_MEETING, actor, relations, evaluation);

        if (meetingAt == null) {
            throw new ValidationException("meeting date is required");
        }
        if (meetingAt.isBefore(now())) {
            throw new ValidationException("meeting date must be in the future");
        }
        evaluation.setMeetingScheduledAt(meetingAt);
        evaluation.setMeetingCompletedAt(null);
    }

    private void applyMeetingNotes(Evaluation evaluation, String notes, Integer finalRating, Boolean showToEmployee,
                                   AppraisalActor actor, Set<ActorRelation> relations) {
        transitionGuard.check(EvaluationAction.RECORD_MEETING_NOTES, actor, relations, evaluation);

        if (notes == null || notes.isBlank()) {
            throw new ValidationException("meeting notes are required");
        }
        evaluation.setMeetingNotes(notes);
        evaluation.setMeetingCompletedAt(now());
        if (finalRating != null) {
            evaluation.setOverallRating(checkRating(finalRating, "overallRating"));
        }
        if (showToEmployee != null) {
            evaluation.setShowNotesToEmployee(showToEmployee);
        }
    }

    private void applyFinalize(Evaluation evaluation, AppraisalActor actor, Set<ActorRelation> relations) {
        transitionGuard.check(EvaluationAction.FINALIZE, actor, relations, evaluation);

        evaluation.setStatus(EvaluationStatus.COMPLETED);
        evaluation.setFinalizedAt(now());
    }

    private void applyCalibration(Evaluation evaluation, Integer rating, String remarks,
                                  AppraisalActor actor, Set<ActorRelation> relations) {
        transitionGuard.check(EvaluationAction.CALIBRATE, actor, relations, evaluation);

        if (rating == null) {
            throw new ValidationException("calibratedRating is required");
        }
        evaluation.setCalibratedRating(checkRating(rating, "calibratedRating"));
        evaluation.setCalibrationRemarks(remarks);
        evaluation.setCalibratedBy(actor.getId());
        evaluation.setCalibratedAt(now());
    }

    // Direct status writes may neither skip ahead of nor fall behind the recorded submissions
    private void applyStatus(Evaluation evaluation, EvaluationStatus target) {
        if (evaluation.isFinalized() && target != EvaluationStatus.COMPLETED) {
            throw new ValidationException("evaluation already finalized");
        }
        EvaluationStatus recorded = recordedStatus(evaluation);
        if (target.compareTo(recorded) < 0) {
            throw new ValidationException("status cannot move back from " + recorded + " to " + target);
        }
        if ((target == EvaluationStatus.SELF_SUBMITTED || target == EvaluationStatus.REVIEWED)
                && !evaluation.isSelfSubmitted()) {
            throw new ValidationException("self evaluation not submitted");
        }
        if (target == EvaluationStatus.REVIEWED && !evaluation.isManagerSubmitted()) {
            throw new ValidationException("manager evaluation not submitted");
        }
        evaluation.setStatus(target);
    }

    /**
     * The furthest status the evaluation's timestamps and saved data account for.
     */
    private static EvaluationStatus recordedStatus(Evaluation evaluation) {
        if (evaluation.isFinalized()) {
            return EvaluationStatus.COMPLETED;
        }
        if (evaluation.isManagerSubmitted()) {
            return EvaluationStatus.REVIEWED;
        }
        if (evaluation.isSelfSubmitted()) {
            return EvaluationStatus.SELF_SUBMITTED;
        }
        if (evaluation.getSelfEvaluationData() != null || evaluation.getStatus() == EvaluationStatus.DRAFT) {
            return EvaluationStatus.DRAFT;
        }
        return EvaluationStatus.NOT_STARTED;
    }

    private void assertCompletionInvariant(Evaluation evaluation) {
        if (evaluation.getStatus() == EvaluationStatus.COMPLETED) {
            if (!evaluation.isSelfSubmitted()) {
                throw new ValidationException("self evaluation not submitted");
            }
            if (!evaluation.isManagerSubmitted()) {
                throw new ValidationException("manager evaluation not submitted");
            }
        }
    }

    private Integer checkRating(Integer rating, String field) {
        if (rating == null) {
            return null;
        }
        if (rating < minRating || rating > maxRating) {
            throw new ValidationException(field + " must be between " + minRating + " and " + maxRating);
        }
        return rating;
    }

    // ===================== HELPERS =====================

    private Evaluation load(Long evaluationId) {
        return evaluationRepository.findById(evaluationId)
                .orElseThrow(() -> NotFoundException.of("Evaluation", evaluationId));
    }

    private EvaluationDTO persist(Evaluation evaluation, AppraisalActor actor) {
        Evaluation saved = evaluationRepository.save(evaluation);
        if (saved.getInitiatedAppraisalId() != null) {
            cacheService.invalidate(CacheKeyBuilder.progressKey(saved.getInitiatedAppraisalId()));
        }
        log.info("Evaluation {} updated by user {} ({}), status {}",
                saved.getId(), actor.getId(), actor.getRole(), saved.getStatus());
        return toDTO(saved, actor);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private EvaluationDTO toDTO(Evaluation evaluation, AppraisalActor actor) {
        EvaluationDTO dto = new EvaluationDTO();
        dto.setId(evaluation.getId());
        dto.setEmployeeId(evaluation.getEmployeeId());
        dto.setManagerId(evaluation.getManagerId());
        dto.setInitiatedAppraisalId(evaluation.getInitiatedAppraisalId());
        dto.setReviewCycleId(evaluation.getReviewCycleId());
        dto.setSelfEvaluationData(evaluation.getSelfEvaluationData());
        dto.setSelfEvaluationSubmittedAt(evaluation.getSelfEvaluationSubmittedAt());
        dto.setManagerEvaluationData(evaluation.getManagerEvaluationData());
        dto.setManagerEvaluationSubmittedAt(evaluation.getManagerEvaluationSubmittedAt());
        dto.setOverallRating(evaluation.getOverallRating());
        dto.setStatus(evaluation.getStatus());
        dto.setMeetingState(evaluation.getMeetingState());
        dto.setMeetingScheduledAt(evaluation.getMeetingScheduledAt());
        dto.setMeetingCompletedAt(evaluation.getMeetingCompletedAt());
        dto.setShowNotesToEmployee(evaluation.getShowNotesToEmployee());
        dto.setFinalizedAt(evaluation.getFinalizedAt());
        dto.setCalibratedRating(evaluation.getCalibratedRating());
        dto.setCalibrationRemarks(evaluation.getCalibrationRemarks());
        dto.setCalibratedBy(evaluation.getCalibratedBy());
        dto.setCalibratedAt(evaluation.getCalibratedAt());
        dto.setVersion(evaluation.getVersion());
        dto.setCreatedAt(evaluation.getCreatedAt());
        dto.setUpdatedAt(evaluation.getUpdatedAt());

        if (canSeeMeetingNotes(evaluation, actor)) {
            dto.setMeetingNotes(evaluation.getMeetingNotes());
        }
        return dto;
    }

    // The reviewed employee sees notes only when the manager shares them
    private boolean canSeeMeetingNotes(Evaluation evaluation, AppraisalActor actor) {
        if (actor.isUnrestricted() || actor.is(evaluation.getManagerId())) {
            return true;
        }
        return Boolean.TRUE.equals(evaluation.getShowNotesToEmployee());
    }
}

package com.appraisehub.backend.controller;

import com.appraisehub.backend.dto.*;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.service.EvaluationWorkflowService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Evaluation endpoints. Role-level checks are coarse here; who may touch a
 * given evaluation is decided by the workflow service.
 */
@RestController
@RequestMapping("/api/evaluations")
@RequiredArgsConstructor
public class EvaluationController {

    private final EvaluationWorkflowService workflowService;

    /**
     * Get the caller's own and managed evaluations
     */
    @GetMapping
    public ResponseEntity<List<EvaluationDTO>> listEvaluations(
            @RequestParam(required = false) Long initiatedAppraisalId,
            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.listEvaluations(actor, initiatedAppraisalId));
    }

    /**
     * Get evaluations awaiting the caller's manager review
     */
    @GetMapping("/pending-reviews")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<List<EvaluationDTO>> pendingReviews(@AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.getPendingManagerReviews(actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<EvaluationDTO> getEvaluation(@PathVariable Long id,
                                                       @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.getEvaluation(id, actor));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<EvaluationDTO> patchEvaluation(@PathVariable Long id,
                                                         @RequestBody EvaluationPatchRequest patch,
                                                         @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.transitionEvaluation(id, patch, actor));
    }

    @PutMapping("/{id}/self-evaluation")
    public ResponseEntity<EvaluationDTO> saveSelfEvaluation(@PathVariable Long id,
                                                            @Valid @RequestBody SelfEvaluationRequest request,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.saveSelfEvaluation(id, request, actor));
    }

    @PutMapping("/{id}/manager-review")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<EvaluationDTO> submitManagerReview(@PathVariable Long id,
                                                             @Valid @RequestBody ManagerReviewRequest request,
                                                             @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.submitManagerReview(id, request, actor));
    }

    /**
     * Schedule the one-on-one; employees may request one for their own evaluation
     */
    @PostMapping("/{id}/schedule-meeting")
    public ResponseEntity<EvaluationDTO> scheduleMeeting(@PathVariable Long id,
                                                         @Valid @RequestBody ScheduleMeetingRequest request,
                                                         @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.scheduleMeeting(id, request, actor));
    }

    @PutMapping("/{id}/meeting-notes")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<EvaluationDTO> recordMeetingNotes(@PathVariable Long id,
                                                            @Valid @RequestBody MeetingNotesRequest request,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.recordMeetingNotes(id, request, actor));
    }

    @PostMapping("/{id}/finalize")
    @PreAuthorize("hasAnyRole('MANAGER', 'HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<EvaluationDTO> finalizeEvaluation(@PathVariable Long id,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.finalizeEvaluation(id, actor));
    }

    @PutMapping("/{id}/calibration")
    @PreAuthorize("hasAnyRole('HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
    public ResponseEntity<EvaluationDTO> calibrate(@PathVariable Long id,
                                                   @Valid @RequestBody CalibrationRequest request,
                                                   @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(workflowService.calibrate(id, request, actor));
    }
}

package com.appraisehub.backend.controller;

import com.appraisehub.backend.dto.*;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.service.AppraisalCampaignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/initiated-appraisals")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('HR_MANAGER', 'ADMIN', 'SUPER_ADMIN')")
public class AppraisalCampaignController {

    private final AppraisalCampaignService campaignService;

    /**
     * Initiate a campaign; publishing now also generates evaluations
     */
    @PostMapping
    public ResponseEntity<InitiationResult> initiate(@Valid @RequestBody InitiateAppraisalRequest request,
                                                     @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(campaignService.initiate(request, actor));
    }

    /**
     * Get the caller's campaigns with progress
     */
    @GetMapping
    public ResponseEntity<List<CampaignDTO>> listCampaigns(@AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.listWithProgress(actor));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CampaignDTO> getCampaign(@PathVariable Long id,
                                                   @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.getCampaign(id, actor));
    }

    @PostMapping("/{id}/generate-evaluations")
    public ResponseEntity<GenerationResult> generateEvaluations(@PathVariable Long id,
                                                                @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.generateEvaluations(id, actor));
    }

    @PostMapping("/{id}/plan-tasks")
    public ResponseEntity<List<ScheduledTaskDTO>> planTasks(@PathVariable Long id,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.planScheduledTasks(id, actor));
    }

    @GetMapping("/{id}/tasks")
    public ResponseEntity<List<ScheduledTaskDTO>> getTasks(@PathVariable Long id,
                                                           @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.getScheduledTasks(id, actor));
    }

    /**
     * Get completion progress per employee
     */
    @GetMapping("/{id}/progress")
    public ResponseEntity<ProgressReport> getProgress(@PathVariable Long id,
                                                      @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.getProgress(id, actor));
    }

    @PostMapping("/{id}/close")
    public ResponseEntity<CampaignDTO> close(@PathVariable Long id,
                                             @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.close(id, actor));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<CampaignDTO> cancel(@PathVariable Long id,
                                              @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.cancel(id, actor));
    }

    @PutMapping("/{id}/group")
    public ResponseEntity<CampaignDTO> changeGroup(@PathVariable Long id,
                                                   @Valid @RequestBody ChangeGroupRequest request,
                                                   @AuthenticationPrincipal AppraisalActor actor) {
        return ResponseEntity.ok(campaignService.changeGroup(id, request.getAppraisalGroupId(), actor));
    }

    /**
     * Remind one employee who has not completed yet
     */
    @PostMapping("/{id}/reminders")
    public ResponseEntity<Map<String, Object>> sendReminder(@PathVariable Long id,
                                                            @Valid @RequestBody ReminderRequest request,
                                                            @AuthenticationPrincipal AppraisalActor actor) {
        campaignService.sendReminder(id, request.getEmployeeId(), actor);
        return ResponseEntity.accepted().body(Map.of(
                "message", "Reminder sent",
                "employeeId", request.getEmployeeId()));
    }
}

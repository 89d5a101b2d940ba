package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.*;
import com.appraisehub.backend.entity.*;
import com.appraisehub.backend.entity.InitiatedAppraisal.AppraisalType;
import com.appraisehub.backend.entity.InitiatedAppraisal.CampaignStatus;
import com.appraisehub.backend.entity.InitiatedAppraisal.PublishType;
import com.appraisehub.backend.exception.ConflictException;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.repository.*;
import com.appraisehub.backend.security.AppraisalActor;
import com.appraisehub.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Campaign lifecycle: initiation, generation and planning on behalf of the
 * owner, closing, regrouping and ad-hoc reminders.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AppraisalCampaignService {

    private final InitiatedAppraisalRepository campaignRepository;
    private final FrequencyCalendarRepository calendarRepository;
    private final FrequencyCalendarDetailRepository calendarDetailRepository;
    private final EvaluationRepository evaluationRepository;
    private final AppraisalGroupService groupService;
    private final EvaluationGenerator evaluationGenerator;
    private final ScheduledTaskPlanner taskPlanner;
    private final ProgressAggregator progressAggregator;
    private final NotificationDispatcher notificationDispatcher;
    private final CacheService cacheService;

    @Value("${appraisal.defaults.days-to-initiate:0}")
    private int defaultDaysToInitiate = 0;

    @Value("${appraisal.defaults.days-to-close:30}")
    private int defaultDaysToClose = 30;

    @Value("${appraisal.defaults.number-of-reminders:3}")
    private int defaultReminders = 3;

    @Value("${appraisal.max-reminders:10}")
    private int maxReminders = 10;

    // ===================== INITIATION =====================

    /**
     * Validates and stores the campaign, then generates and plans against the
     * stored row. Not one transaction: evaluations commit row by row, so the
     * campaign they point at is committed before generation starts. A planning
     * failure leaves a valid campaign that can be re-planned.
     */
    public InitiationResult initiate(InitiateAppraisalRequest request, AppraisalActor actor) {
        if (request.getAppraisalGroupId() == null) {
            throw new ValidationException("Appraisal group ID is required");
        }
        if (request.getAppraisalType() == null) {
            throw new ValidationException("Appraisal type is required");
        }
        validateContent(request);

        AppraisalGroup group = groupService.loadActive(request.getAppraisalGroupId(), actor);
        PublishType publishType = request.getPublishType() == null ? PublishType.NOW : request.getPublishType();

        FrequencyCalendar calendar = null;
        if (request.getFrequencyCalendarId() != null) {
            calendar = calendarRepository.findById(request.getFrequencyCalendarId())
                    .orElseThrow(() -> NotFoundException.of("Frequency calendar", request.getFrequencyCalendarId()));
            if (!Boolean.TRUE.equals(calendar.getIsActive())) {
                throw new ValidationException("Frequency calendar " + calendar.getId() + " is inactive");
            }
        } else if (publishType == PublishType.AS_PER_CALENDAR) {
            throw new ValidationException("A frequency calendar is required when publishing as per calendar");
        }

        InitiatedAppraisal campaign = new InitiatedAppraisal();
        campaign.setAppraisalGroup(group);
        campaign.setAppraisalType(request.getAppraisalType());
        campaign.setQuestionnaireTemplateIds(request.getQuestionnaireTemplateIds() == null
                ? new ArrayList<>() : new ArrayList<>(request.getQuestionnaireTemplateIds()));
        campaign.setDocumentUrl(request.getDocumentUrl());
        campaign.setFrequencyCalendar(calendar);
        campaign.setDaysToInitiate(offset(request.getDaysToInitiate(), defaultDaysToInitiate, "daysToInitiate"));
        campaign.setDaysToClose(offset(request.getDaysToClose(), defaultDaysToClose, "daysToClose"));
        campaign.setNumberOfReminders(reminders(request.getNumberOfReminders(), defaultReminders));
        campaign.setExcludeTenureLessThanYear(Boolean.TRUE.equals(request.getExcludeTenureLessThanYear()));
        campaign.setExcludedEmployeeIds(request.getExcludedEmployeeIds() == null
                ? new LinkedHashSet<>() : new LinkedHashSet<>(request.getExcludedEmployeeIds()));
        campaign.setMakePublic(Boolean.TRUE.equals(request.getMakePublic()));
        campaign.setPublishType(publishType);
        campaign.setStatus(CampaignStatus.DRAFT);
        campaign.setCreatedById(actor.getId());

        addDetailTimings(campaign, calendar, request.getDetailTimings());
        campaign = campaignRepository.save(campaign);
        log.info("Initiated appraisal {} ({}, {}) for group {} by user {}", campaign.getId(),
                campaign.getAppraisalType(), publishType, group.getId(), actor.getId());

        GenerationResult generation = null;
        if (publishType == PublishType.NOW) {
            generation = evaluationGenerator.generateEvaluations(campaign.getId());
            // the generator activated the stored row
            campaign.setStatus(CampaignStatus.ACTIVE);
        }

        List<ScheduledAppraisalTask> planned;
        try {
            planned = taskPlanner.planScheduledTasks(campaign.getId());
        } catch (RuntimeException e) {
            log.error("Initiated appraisal {} was stored but task planning failed, re-plan it", campaign.getId(), e);
            throw e;
        }
        List<ScheduledTaskDTO> tasks = planned.stream()
                .map(ScheduledTaskDTO::from)
                .collect(Collectors.toList());

        return new InitiationResult(CampaignDTO.from(campaign), generation, tasks);
    }

    private void validateContent(InitiateAppraisalRequest request) {
        AppraisalType type = request.getAppraisalType();
        if (type == AppraisalType.QUESTIONNAIRE_BASED
                && (request.getQuestionnaireTemplateIds() == null || request.getQuestionnaireTemplateIds().isEmpty())) {
            throw new ValidationException(
                    "At least one questionnaire template is required for questionnaire-based appraisals");
        }
        if ((type == AppraisalType.KPI_BASED || type == AppraisalType.MBO_BASED)
                && (request.getDocumentUrl() == null || request.getDocumentUrl().isBlank())) {
            throw new ValidationException("Document is required for KPI/MBO-based appraisals");
        }
    }

    private void addDetailTimings(InitiatedAppraisal campaign, FrequencyCalendar calendar,
                                  List<InitiateAppraisalRequest.CalendarDetailTiming> timings) {
        if (timings == null || timings.isEmpty()) {
            return;
        }
        if (calendar == null) {
            throw new ValidationException("Period timings require a frequency calendar");
        }

        Set<Long> seen = new HashSet<>();
        for (InitiateAppraisalRequest.CalendarDetailTiming timing : timings) {
            Long detailId = timing.getFrequencyCalendarDetailId();
            if (detailId == null) {
                throw new ValidationException("frequencyCalendarDetailId is required for each period timing");
            }
            if (!seen.add(detailId)) {
                throw new ValidationException("Period " + detailId + " is listed more than once");
            }

            FrequencyCalendarDetail detail = calendarDetailRepository.findById(detailId)
                    .orElseThrow(() -> new ValidationException("Calendar period not found: " + detailId));
            if (detail.getFrequencyCalendar() == null || !calendar.getId().equals(detail.getFrequencyCalendar().getId())) {
                throw new ValidationException("Period " + detailId + " does not belong to calendar " + calendar.getId());
            }

            InitiatedAppraisalDetailTiming entity = new InitiatedAppraisalDetailTiming();
            entity.setFrequencyCalendarDetail(detail);
            entity.setDaysToInitiate(offset(timing.getDaysToInitiate(), campaign.getDaysToInitiate(), "daysToInitiate"));
            entity.setDaysToClose(offset(timing.getDaysToClose(), campaign.getDaysToClose(), "daysToClose"));
            entity.setNumberOfReminders(reminders(timing.getNumberOfReminders(), campaign.getNumberOfReminders()));
            campaign.addDetailTiming(entity);
        }
    }

    private int offset(Integer value, int fallback, String field) {
        int resolved = value == null ? fallback : value;
        if (resolved < 0) {
            throw new ValidationException(field + " must not be negative");
        }
        return resolved;
    }

    private int reminders(Integer value, int fallback) {
        int resolved = value == null ? fallback : value;
        if (resolved < 0 || resolved > maxReminders) {
            throw new ValidationException("numberOfReminders must be between 0 and " + maxReminders);
        }
        return resolved;
    }

    // ===================== OWNER OPERATIONS =====================

    @Transactional(readOnly = true)
    public CampaignDTO getCampaign(Long campaignId, AppraisalActor actor) {
        return CampaignDTO.from(loadOwned(campaignId, actor));
    }

    /**
     * The actor's campaigns, newest first, each with its progress report.
     * Admins see every campaign.
     */
    @Transactional(readOnly = true)
    public List<CampaignDTO> listWithProgress(AppraisalActor actor) {
        List<InitiatedAppraisal> campaigns = actor.getRole() == User.UserRole.HR_MANAGER
                ? campaignRepository.findByCreatedByIdOrderByCreatedAtDesc(actor.getId())
                : campaignRepository.findAllByOrderByCreatedAtDesc();

        return campaigns.stream()
                .map(campaign -> {
                    CampaignDTO dto = CampaignDTO.from(campaign);
                    dto.setProgress(progressAggregator.getProgress(campaign.getId()));
                    return dto;
                })
                .collect(Collectors.toList());
    }

    @Transactional
    public GenerationResult generateEvaluations(Long campaignId, AppraisalActor actor) {
        return evaluationGenerator.generateEvaluations(loadOwned(campaignId, actor));
    }

    @Transactional
    public List<ScheduledTaskDTO> planScheduledTasks(Long campaignId, AppraisalActor actor) {
        return taskPlanner.planScheduledTasks(loadOwned(campaignId, actor)).stream()
                .map(ScheduledTaskDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<ScheduledTaskDTO> getScheduledTasks(Long campaignId, AppraisalActor actor) {
        loadOwned(campaignId, actor);
        return taskPlanner.findTasks(campaignId).stream()
                .map(ScheduledTaskDTO::from)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public ProgressReport getProgress(Long campaignId, AppraisalActor actor) {
        loadOwned(campaignId, actor);
        return progressAggregator.getProgress(campaignId);
    }

    /**
     * Closes the campaign. Its evaluations are left as they are.
     */
    @Transactional
    public CampaignDTO close(Long campaignId, AppraisalActor actor) {
        return changeStatus(loadOwned(campaignId, actor), CampaignStatus.CLOSED);
    }

    @Transactional
    public CampaignDTO cancel(Long campaignId, AppraisalActor actor) {
        return changeStatus(loadOwned(campaignId, actor), CampaignStatus.CANCELLED);
    }

    private CampaignDTO changeStatus(InitiatedAppraisal campaign, CampaignStatus target) {
        if (campaign.getStatus() == CampaignStatus.CLOSED || campaign.getStatus() == CampaignStatus.CANCELLED) {
            throw new ConflictException("Campaign " + campaign.getId() + " is already " + campaign.getStatus());
        }
        campaign.setStatus(target);
        campaign = campaignRepository.save(campaign);
        log.info("Campaign {} is now {}", campaign.getId(), target);
        return CampaignDTO.from(campaign);
    }

    /**
     * Points the campaign at another group. Not allowed once any evaluation
     * has been generated.
     */
    @Transactional
    public CampaignDTO changeGroup(Long campaignId, Long groupId, AppraisalActor actor) {
        InitiatedAppraisal campaign = loadOwned(campaignId, actor);
        if (evaluationRepository.existsByInitiatedAppraisalId(campaignId)) {
            throw new ConflictException("Cannot change the group of campaign " + campaignId
                    + " after evaluations have been generated");
        }

        AppraisalGroup group = groupService.loadActive(groupId, actor);
        campaign.setAppraisalGroup(group);
        campaign = campaignRepository.save(campaign);
        cacheService.invalidate(CacheKeyBuilder.progressKey(campaignId));

        log.info("Campaign {} moved to group {}", campaignId, groupId);
        return CampaignDTO.from(campaign);
    }

    @Transactional(readOnly = true)
    public void sendReminder(Long campaignId, Long employeeId, AppraisalActor actor) {
        InitiatedAppraisal campaign = loadOwned(campaignId, actor);
        if (campaign.getStatus() != CampaignStatus.ACTIVE) {
            throw new ValidationException("Reminders can only be sent for active campaigns");
        }

        ProgressReport progress = progressAggregator.computeProgress(campaignId);
        ProgressReport.EmployeeProgress entry = progress.getEmployeeProgress().stream()
                .filter(p -> employeeId.equals(p.getEmployeeId()))
                .findFirst()
                .orElseThrow(() -> new ForbiddenException("Employee " + employeeId + " is not part of this appraisal"));

        if (Boolean.TRUE.equals(entry.getIsCompleted())) {
            throw new ValidationException("Employee has already completed their evaluation");
        }

        Evaluation evaluation = evaluationRepository
                .findByEmployeeIdAndInitiatedAppraisalId(employeeId, campaignId)
                .orElse(null);
        notificationDispatcher.reminder(campaignId, evaluation, employeeId);
        log.info("Reminder queued for employee {} in campaign {}", employeeId, campaignId);
    }

    InitiatedAppraisal loadOwned(Long campaignId, AppraisalActor actor) {
        InitiatedAppraisal campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> NotFoundException.of("Initiated appraisal", campaignId));
        if (actor.getRole() == User.UserRole.HR_MANAGER && !actor.is(campaign.getCreatedById())) {
            throw new ForbiddenException("Access denied to initiated appraisal " + campaignId);
        }
        return campaign;
    }
}

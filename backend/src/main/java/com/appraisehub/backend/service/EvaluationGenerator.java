package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.GenerationResult;
import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.repository.EvaluationRepository;
import com.appraisehub.backend.repository.InitiatedAppraisalRepository;
import com.appraisehub.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Creates one evaluation per eligible group member of a campaign. Safe to run
 * again: existing evaluations are skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EvaluationGenerator {

    private final InitiatedAppraisalRepository campaignRepository;
    private final EvaluationRepository evaluationRepository;
    private final MembershipResolver membershipResolver;
    private final EvaluationWriter evaluationWriter;
    private final NotificationDispatcher notificationDispatcher;
    private final CacheService cacheService;

    @Transactional
    public GenerationResult generateEvaluations(Long campaignId) {
        InitiatedAppraisal campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> NotFoundException.of("Initiated appraisal", campaignId));
        return generateEvaluations(campaign);
    }

    @Transactional
    public GenerationResult generateEvaluations(InitiatedAppraisal campaign) {
        if (campaign.getStatus() == InitiatedAppraisal.CampaignStatus.CLOSED
                || campaign.getStatus() == InitiatedAppraisal.CampaignStatus.CANCELLED) {
            throw new ValidationException("Cannot generate evaluations for a " + campaign.getStatus() + " campaign");
        }

        MembershipResolver.MembershipResolution members = membershipResolver.resolve(campaign);
        List<User> eligible = members.getEligible();

        GenerationResult result = new GenerationResult();
        result.setTotalEligible(eligible.size());
        result.setSkipped(members.getExcluded().size());

        for (User employee : eligible) {
            if (evaluationRepository.existsByEmployeeIdAndInitiatedAppraisalId(employee.getId(), campaign.getId())) {
                result.setSkipped(result.getSkipped() + 1);
                continue;
            }

            Evaluation evaluation = newEvaluation(campaign, employee);
            StorageResult<Evaluation> stored = StorageResult.capture(() -> evaluationWriter.insertIfAbsent(evaluation));

            if (stored.isSuccess()) {
                result.setCreated(result.getCreated() + 1);
                notificationDispatcher.invitation(stored.getValue());
            } else if (stored.isConflict()) {
                log.warn("Evaluation for employee {} in campaign {} already exists, skipping",
                        employee.getId(), campaign.getId());
                result.setSkipped(result.getSkipped() + 1);
            } else {
                log.error("Failed to create evaluation for employee {} in campaign {}: {}",
                        employee.getId(), campaign.getId(), stored.getError());
                result.getFailures().add(new GenerationResult.GenerationFailure(employee.getId(), stored.getError()));
            }
        }

        // A calendar-driven campaign goes live on its first generation run
        if (campaign.getStatus() == InitiatedAppraisal.CampaignStatus.DRAFT) {
            campaign.setStatus(InitiatedAppraisal.CampaignStatus.ACTIVE);
            campaignRepository.save(campaign);
        }

        if (result.getCreated() > 0) {
            cacheService.invalidate(CacheKeyBuilder.progressKey(campaign.getId()));
        }

        log.info("Campaign {}: created {}, skipped {}, failed {} of {} eligible",
                campaign.getId(), result.getCreated(), result.getSkipped(),
                result.getFailures().size(), result.getTotalEligible());
        return result;
    }

    private Evaluation newEvaluation(InitiatedAppraisal campaign, User employee) {
        Long managerId = employee.getReportingManagerId();
        if (managerId == null) {
            log.warn("Employee {} has no reporting manager, assigning campaign owner {}",
                    employee.getId(), campaign.getCreatedById());
            managerId = campaign.getCreatedById();
        }

        Evaluation evaluation = new Evaluation();
        evaluation.setEmployeeId(employee.getId());
        evaluation.setManagerId(managerId);
        evaluation.setInitiatedAppraisalId(campaign.getId());
        evaluation.setReviewCycleId("initiated-appraisal-" + campaign.getId());
        evaluation.setStatus(Evaluation.EvaluationStatus.NOT_STARTED);
        return evaluation;
    }
}

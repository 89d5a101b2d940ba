package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.ProgressReport;
import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.repository.AppraisalGroupMemberRepository;
import com.appraisehub.backend.repository.EvaluationRepository;
import com.appraisehub.backend.repository.InitiatedAppraisalRepository;
import com.appraisehub.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class ProgressAggregator {

    private static final Comparator<Evaluation> NEWEST_FIRST = Comparator
            .comparing(Evaluation::getCreatedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(Evaluation::getId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()))
            .reversed();

    private final InitiatedAppraisalRepository campaignRepository;
    private final AppraisalGroupMemberRepository memberRepository;
    private final EvaluationRepository evaluationRepository;
    private final CacheService cacheService;

    @Value("${appraisal.progress-cache-ttl:PT2M}")
    private Duration cacheTtl = Duration.ofMinutes(2);

    /**
     * Completion progress of a campaign over its group's active members
     * (cached briefly; evaluation writes evict the entry).
     */
    @Transactional(readOnly = true)
    public ProgressReport getProgress(Long campaignId) {
        return cacheService.getOrCompute(
                CacheKeyBuilder.progressKey(campaignId),
                ProgressReport.class,
                () -> computeProgress(campaignId),
                cacheTtl
        );
    }

    @Transactional(readOnly = true)
    public ProgressReport computeProgress(Long campaignId) {
        InitiatedAppraisal campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> NotFoundException.of("Initiated appraisal", campaignId));
        log.info("Computing progress for campaign: {}", campaignId);

        List<User> employees = memberRepository.findMembersWithUsers(campaign.getAppraisalGroup().getId())
                .stream()
                .map(m -> m.getUser())
                .filter(User::isActiveUser)
                .collect(Collectors.toList());

        ProgressReport report = new ProgressReport();
        report.setCampaignId(campaignId);
        report.setTotalEmployees(employees.size());
        if (employees.isEmpty()) {
            return report;
        }

        Set<Long> employeeIds = employees.stream().map(User::getId).collect(Collectors.toCollection(LinkedHashSet::new));
        Map<Long, Evaluation> latest = latestByEmployee(
                evaluationRepository.findByInitiatedAppraisalIdAndEmployeeIdIn(campaignId, employeeIds));

        int completed = 0;
        for (User employee : employees) {
            Evaluation evaluation = latest.get(employee.getId());
            ProgressReport.EmployeeProgress progress = toEmployeeProgress(employee, evaluation);
            if (Boolean.TRUE.equals(progress.getIsCompleted())) {
                completed++;
            }
            report.getEmployeeProgress().add(progress);
        }

        report.setCompletedEvaluations(completed);
        report.setPercentage((int) Math.round(completed * 100.0 / employees.size()));
        return report;
    }

    // Duplicates should not exist; if they do, the newest row wins
    private Map<Long, Evaluation> latestByEmployee(List<Evaluation> evaluations) {
        Map<Long, Evaluation> latest = new HashMap<>();
        evaluations.stream()
                .sorted(NEWEST_FIRST)
                .forEach(e -> latest.putIfAbsent(e.getEmployeeId(), e));
        return latest;
    }

    private ProgressReport.EmployeeProgress toEmployeeProgress(User employee, Evaluation evaluation) {
        ProgressReport.EmployeeProgress progress = new ProgressReport.EmployeeProgress();
        progress.setEmployeeId(employee.getId());
        progress.setFullName(employee.getFullName());
        progress.setEmail(employee.getEmail());
        progress.setCode(employee.getCode());
        progress.setDepartment(employee.getDepartment());
        progress.setDesignation(employee.getDesignation());

        if (evaluation == null) {
            progress.setStatus(Evaluation.EvaluationStatus.NOT_STARTED);
            progress.setIsCompleted(false);
            return progress;
        }

        progress.setEvaluationId(evaluation.getId());
        progress.setStatus(evaluation.getStatus());
        progress.setIsCompleted(evaluation.getStatus() == Evaluation.EvaluationStatus.COMPLETED);
        progress.setLastUpdated(evaluation.getUpdatedAt() != null ? evaluation.getUpdatedAt() : evaluation.getCreatedAt());
        return progress;
    }
}

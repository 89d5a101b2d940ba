package com.appraisehub.backend.service;

import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.ScheduledAppraisalTask;
import com.appraisehub.backend.entity.ScheduledAppraisalTask.TaskStatus;
import com.appraisehub.backend.entity.ScheduledAppraisalTask.TaskType;
import com.appraisehub.backend.exception.ConflictException;
import com.appraisehub.backend.exception.NotFoundException;
import com.appraisehub.backend.repository.InitiatedAppraisalRepository;
import com.appraisehub.backend.repository.ScheduledAppraisalTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Persists the follow-up tasks a campaign's calendar implies. Tasks are only
 * recorded here; an external runner polls for due ones and reports back.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskPlanner {

    private final InitiatedAppraisalRepository campaignRepository;
    private final ScheduledAppraisalTaskRepository taskRepository;
    private final CalendarTimingResolver timingResolver;
    private final Clock clock;

    @Transactional
    public List<ScheduledAppraisalTask> planScheduledTasks(Long campaignId) {
        InitiatedAppraisal campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> NotFoundException.of("Initiated appraisal", campaignId));
        return planScheduledTasks(campaign);
    }

    /**
     * Creates any task slot that does not exist yet and returns every task of
     * the campaign. Re-planning never duplicates a slot.
     */
    @Transactional
    public List<ScheduledAppraisalTask> planScheduledTasks(InitiatedAppraisal campaign) {
        boolean planInitiate = campaign.getPublishType() == InitiatedAppraisal.PublishType.AS_PER_CALENDAR;
        int created = 0;

        for (CalendarTimingResolver.PeriodTiming period : timingResolver.resolve(campaign)) {
            if (planInitiate) {
                created += plan(campaign, period, TaskType.INITIATE, 0, period.getInitiateDate());
            }
            List<LocalDate> reminders = period.getReminderDates();
            for (int i = 0; i < reminders.size(); i++) {
                created += plan(campaign, period, TaskType.REMINDER, i + 1, reminders.get(i));
            }
            created += plan(campaign, period, TaskType.CLOSE, 0, period.getCloseDate());
        }

        log.info("Planned {} new tasks for campaign {}", created, campaign.getId());
        return taskRepository.findByInitiatedAppraisalIdOrderByScheduledDateAscIdAsc(campaign.getId());
    }

    private int plan(InitiatedAppraisal campaign, CalendarTimingResolver.PeriodTiming period,
                     TaskType type, int sequenceNo, LocalDate date) {
        if (taskRepository.existsByInitiatedAppraisalIdAndPeriodKeyAndTaskTypeAndSequenceNo(
                campaign.getId(), period.getPeriodKey(), type, sequenceNo)) {
            return 0;
        }

        ScheduledAppraisalTask task = new ScheduledAppraisalTask();
        task.setInitiatedAppraisalId(campaign.getId());
        task.setFrequencyCalendarDetailId(period.getFrequencyCalendarDetailId());
        task.setPeriodKey(period.getPeriodKey());
        task.setTaskType(type);
        task.setSequenceNo(sequenceNo);
        task.setScheduledDate(date);
        task.setStatus(TaskStatus.PENDING);

        try {
            taskRepository.save(task);
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException("Tasks for campaign " + campaign.getId() + " are being planned concurrently", e);
        }
        log.debug("Planned {} #{} for campaign {} period {} on {}",
                type, sequenceNo, campaign.getId(), period.getPeriodKey(), date);
        return 1;
    }

    @Transactional(readOnly = true)
    public List<ScheduledAppraisalTask> findDueTasks() {
        return taskRepository.findDue(TaskStatus.PENDING, LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public List<ScheduledAppraisalTask> findTasks(Long campaignId) {
        if (!campaignRepository.existsById(campaignId)) {
            throw NotFoundException.of("Initiated appraisal", campaignId);
        }
        return taskRepository.findByInitiatedAppraisalIdOrderByScheduledDateAscIdAsc(campaignId);
    }

    @Transactional
    public ScheduledAppraisalTask markExecuted(Long taskId) {
        ScheduledAppraisalTask task = loadPending(taskId);
        task.setStatus(TaskStatus.EXECUTED);
        task.setExecutedAt(LocalDateTime.now(clock));
        task.setError(null);
        log.info("Task {} ({}) for campaign {} executed", taskId, task.getTaskType(), task.getInitiatedAppraisalId());
        return taskRepository.save(task);
    }

    @Transactional
    public ScheduledAppraisalTask markFailed(Long taskId, String reason) {
        ScheduledAppraisalTask task = loadPending(taskId);
        task.setStatus(TaskStatus.ERROR);
        task.setExecutedAt(LocalDateTime.now(clock));
        task.setError(reason);
        log.warn("Task {} ({}) for campaign {} failed: {}", taskId, task.getTaskType(),
                task.getInitiatedAppraisalId(), reason);
        return taskRepository.save(task);
    }

    private ScheduledAppraisalTask loadPending(Long taskId) {
        ScheduledAppraisalTask task = taskRepository.findById(taskId)
                .orElseThrow(() -> NotFoundException.of("Scheduled task", taskId));
        if (task.getStatus() != TaskStatus.PENDING) {
            throw new ConflictException("Task " + taskId + " is already " + task.getStatus());
        }
        return task;
    }
}

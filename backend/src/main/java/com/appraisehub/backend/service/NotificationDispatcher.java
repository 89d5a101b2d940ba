package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.ScheduleMeetingRequest;
import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.User;
import com.appraisehub.backend.event.AppraisalNotificationEvent;
import com.appraisehub.backend.event.AppraisalNotificationEvent.NotificationType;
import com.appraisehub.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Publishes fire-and-forget notification events. Nothing here waits for, or
 * depends on, delivery.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationDispatcher {

    private static final String DEFAULT_MEETING_TITLE = "Performance Review One-on-One Meeting";

    private final ApplicationEventPublisher eventPublisher;
    private final UserRepository userRepository;
    private final Clock clock;

    public void invitation(Evaluation evaluation) {
        publish(NotificationType.INVITATION, evaluation.getInitiatedAppraisalId(), evaluation.getId(),
                List.of(evaluation.getEmployeeId()), List.of(), null,
                "Your performance appraisal has started", null);
    }

    public void reminder(Long campaignId, Evaluation evaluation, Long employeeId) {
        publish(NotificationType.REMINDER, campaignId, evaluation == null ? null : evaluation.getId(),
                List.of(employeeId), List.of(), null,
                "Reminder: your performance appraisal is pending", null);
    }

    public void meetingInvite(Evaluation evaluation, ScheduleMeetingRequest request) {
        String title = request.getTitle() == null || request.getTitle().isBlank()
                ? DEFAULT_MEETING_TITLE : request.getTitle();
        int duration = request.getDurationMinutes() == null ? 60 : request.getDurationMinutes();
        String location = request.getLocation() == null ? "office" : request.getLocation();
        String details = String.format("duration=%d min, location=%s%s", duration, location,
                request.getDescription() == null ? "" : ", " + request.getDescription());

        publish(NotificationType.MEETING_INVITE, evaluation.getInitiatedAppraisalId(), evaluation.getId(),
                List.of(evaluation.getEmployeeId(), evaluation.getManagerId()), List.of(),
                evaluation.getMeetingScheduledAt(), title, details);
    }

    /**
     * Tells the employee and manager, and copies every active HR manager.
     */
    public void completion(Evaluation evaluation) {
        List<Long> hrManagers = userRepository.findByRoleAndIsActiveTrue(User.UserRole.HR_MANAGER).stream()
                .map(User::getId)
                .filter(id -> !id.equals(evaluation.getEmployeeId()) && !id.equals(evaluation.getManagerId()))
                .collect(Collectors.toList());

        publish(NotificationType.COMPLETION, evaluation.getInitiatedAppraisalId(), evaluation.getId(),
                List.of(evaluation.getEmployeeId(), evaluation.getManagerId()), hrManagers, null,
                "Performance appraisal completed", null);
    }

    private void publish(NotificationType type, Long campaignId, Long evaluationId, List<Long> recipients,
                         List<Long> ccRecipients, LocalDateTime meetingAt, String subject, String details) {
        log.debug("Publishing {} notification for evaluation {}", type, evaluationId);
        eventPublisher.publishEvent(new AppraisalNotificationEvent(type, campaignId, evaluationId,
                recipients, ccRecipients, meetingAt, subject, details, clock.instant()));
    }
}

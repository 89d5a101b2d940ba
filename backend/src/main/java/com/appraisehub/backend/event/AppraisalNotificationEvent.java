package com.appraisehub.backend.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Something a person should be told about. Delivery (email, calendar) is up
 * to whoever listens.
 */
@Getter
@ToString
@AllArgsConstructor
public class AppraisalNotificationEvent {

    private final NotificationType type;
    private final Long campaignId;
    private final Long evaluationId; // null for campaign-wide reminders without an evaluation
    private final List<Long> recipientIds;
    private final List<Long> ccRecipientIds;
    private final LocalDateTime meetingAt;
    private final String subject;
    private final String details;
    private final Instant occurredAt;

    public enum NotificationType {
        INVITATION,
        REMINDER,
        MEETING_INVITE,
        COMPLETION
    }
}

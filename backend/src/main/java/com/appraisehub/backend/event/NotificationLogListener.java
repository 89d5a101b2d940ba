package com.appraisehub.backend.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Default notifier: records each notification in the log once the
 * originating transaction has committed. Mail or calendar integrations
 * subscribe to the same event.
 */
@Component
@Slf4j
public class NotificationLogListener {

    @Async
    @TransactionalEventListener(fallbackExecution = true)
    public void onNotification(AppraisalNotificationEvent event) {
        log.info("Notification {} for campaign {} evaluation {} to {} cc {}: {}",
                event.getType(), event.getCampaignId(), event.getEvaluationId(),
                event.getRecipientIds(), event.getCcRecipientIds(), event.getSubject());
    }
}

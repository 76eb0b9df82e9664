package com.travelbooking.backend.modules.notification.application;

import java.util.Map;

import com.travelbooking.backend.modules.notification.domain.NotificationTemplate;

/**
 * A notification raised inside an authentication transaction. Delivered only once that transaction
 * commits, so a mailed token or code always exists in storage.
 */
public record NotificationRequestedEvent(
        Long accountId,
        String recipientEmail,
        NotificationTemplate template,
        Map<String, String> params
) {
}

package com.travelbooking.backend.modules.notification.application;

import java.util.Map;

/**
 * Outbound message channel. Implementations deliver asynchronously and never report delivery
 * failures back to the caller.
 */
public interface NotificationGateway {

    void send(String recipientEmail, String subjectTemplate, String bodyTemplate, Map<String, String> templateParams);
}

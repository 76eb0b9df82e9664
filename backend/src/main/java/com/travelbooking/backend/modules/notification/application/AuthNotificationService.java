package com.travelbooking.backend.modules.notification.application;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.notification.domain.NotificationTemplate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Builds the out-of-band messages of the authentication flows. Messages are queued as
 * {@link NotificationRequestedEvent}s and reach the gateway after the surrounding transaction
 * commits; a rolled-back flow sends nothing. Without a transaction they go out immediately.
 * Dispatch problems are logged here and never reach the authentication caller.
 */
@Service
public class AuthNotificationService {

    private static final Logger log = LoggerFactory.getLogger(AuthNotificationService.class);
    private static final DateTimeFormatter LOCK_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final NotificationGateway notificationGateway;
    private final ApplicationEventPublisher eventPublisher;
    private final String frontendUrl;

    public AuthNotificationService(
            NotificationGateway notificationGateway,
            ApplicationEventPublisher eventPublisher,
            @Value("${app.frontend-url:http://localhost:3000}") String frontendUrl
    ) {
        this.notificationGateway = notificationGateway;
        this.eventPublisher = eventPublisher;
        this.frontendUrl = frontendUrl;
    }

    public void sendEmailVerification(Account account, String token, Duration validFor) {
        dispatch(account, NotificationTemplate.EMAIL_VERIFICATION, Map.of(
                "firstName", account.getFirstName(),
                "token", token,
                "link", link("/verify-email", token),
                "validHours", String.valueOf(validFor.toHours())
        ));
    }

    public void sendPasswordReset(Account account, String token, Duration validFor) {
        dispatch(account, NotificationTemplate.PASSWORD_RESET, Map.of(
                "firstName", account.getFirstName(),
                "link", link("/reset-password", token),
                "validMinutes", String.valueOf(validFor.toMinutes())
        ));
    }

    public void sendMfaCode(Account account, String code, Duration validFor) {
        dispatch(account, NotificationTemplate.MFA_CODE, Map.of(
                "firstName", account.getFirstName(),
                "code", code,
                "validMinutes", String.valueOf(validFor.toMinutes())
        ));
    }

    public void sendPasswordChangeCode(Account account, String code, Duration validFor) {
        dispatch(account, NotificationTemplate.PASSWORD_CHANGE_CODE, Map.of(
                "firstName", account.getFirstName(),
                "code", code,
                "validMinutes", String.valueOf(validFor.toMinutes())
        ));
    }

    public void sendLockoutAlert(Account account, int attempts, OffsetDateTime lockedUntil, String clientIp) {
        dispatch(account, NotificationTemplate.ACCOUNT_LOCKED, Map.of(
                "firstName", account.getFirstName(),
                "attempts", String.valueOf(attempts),
                "lockedUntil", LOCK_TIME_FORMAT.format(lockedUntil),
                "clientIp", clientIp != null ? clientIp : "an unknown address"
        ));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void deliver(NotificationRequestedEvent event) {
        NotificationTemplate template = event.template();
        try {
            notificationGateway.send(event.recipientEmail(), template.subject(), template.body(), event.params());
        } catch (RuntimeException ex) {
            log.warn("Could not dispatch {} notification for account {}: {}", template, event.accountId(), ex.getMessage());
        }
    }

    private void dispatch(Account account, NotificationTemplate template, Map<String, String> params) {
        eventPublisher.publishEvent(new NotificationRequestedEvent(account.getId(), account.getEmail(), template, params));
    }

    private String link(String path, String token) {
        return UriComponentsBuilder.fromHttpUrl(frontendUrl)
                .path(path)
                .queryParam("token", token)
                .build()
                .toUriString();
    }
}

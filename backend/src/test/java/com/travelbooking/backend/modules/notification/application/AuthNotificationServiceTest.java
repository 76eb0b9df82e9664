package com.travelbooking.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.notification.domain.NotificationTemplate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

@ExtendWith(MockitoExtension.class)
class AuthNotificationServiceTest {

    @Mock
    private NotificationGateway gateway;

    private AuthNotificationService service;
    private Account account;

    @BeforeEach
    void setUp() {
        service = new AuthNotificationService(gateway,
                event -> service.deliver((NotificationRequestedEvent) event),
                "https://app.travel-booking.test");
        account = Account.register("alice@example.com", "Alice", "Traveller", "hash", false);
    }

    @Test
    @DisplayName("verification mail links to the frontend with the raw token")
    void verificationMailCarriesLink() {
        service.sendEmailVerification(account, "tok_123", Duration.ofHours(24));

        Map<String, String> params = captureParams(NotificationTemplate.EMAIL_VERIFICATION);
        assertThat(params)
                .containsEntry("firstName", "Alice")
                .containsEntry("token", "tok_123")
                .containsEntry("validHours", "24")
                .containsEntry("link", "https://app.travel-booking.test/verify-email?token=tok_123");
    }

    @Test
    @DisplayName("reset mail states the validity in minutes")
    void resetMailCarriesValidity() {
        service.sendPasswordReset(account, "reset_9", Duration.ofMinutes(60));

        Map<String, String> params = captureParams(NotificationTemplate.PASSWORD_RESET);
        assertThat(params)
                .containsEntry("validMinutes", "60")
                .containsEntry("link", "https://app.travel-booking.test/reset-password?token=reset_9");
    }

    @Test
    @DisplayName("lockout alert falls back to a neutral origin when the client address is unknown")
    void lockoutAlertWithoutAddress() {
        service.sendLockoutAlert(account, 5, OffsetDateTime.parse("2026-03-01T09:30:00Z"), null);

        Map<String, String> params = captureParams(NotificationTemplate.ACCOUNT_LOCKED);
        assertThat(params)
                .containsEntry("attempts", "5")
                .containsEntry("lockedUntil", "2026-03-01 09:30")
                .containsEntry("clientIp", "an unknown address");
    }

    @Test
    @DisplayName("a rejected dispatch is logged and never reaches the caller")
    void dispatchFailureIsSwallowed() {
        doThrow(new TaskRejectedException("queue full"))
                .when(gateway).send(anyString(), anyString(), anyString(), anyMap());

        assertThatCode(() -> service.sendMfaCode(account, "123456", Duration.ofMinutes(10)))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("messages are queued as events and reach the gateway only when delivered")
    void messagesWaitForDelivery() {
        List<Object> published = new ArrayList<>();
        AuthNotificationService queued = new AuthNotificationService(gateway, published::add, "https://app.travel-booking.test");

        queued.sendMfaCode(account, "123456", Duration.ofMinutes(10));

        verifyNoInteractions(gateway);
        assertThat(published).singleElement()
                .isInstanceOfSatisfying(NotificationRequestedEvent.class, event -> {
                    assertThat(event.recipientEmail()).isEqualTo("alice@example.com");
                    assertThat(event.template()).isEqualTo(NotificationTemplate.MFA_CODE);
                    assertThat(event.params()).containsEntry("code", "123456");
                });

        queued.deliver((NotificationRequestedEvent) published.get(0));

        assertThat(captureParams(NotificationTemplate.MFA_CODE)).containsEntry("firstName", "Alice");
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> captureParams(NotificationTemplate template) {
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(gateway).send(eq("alice@example.com"), eq(template.subject()), eq(template.body()), captor.capture());
        return captor.getValue();
    }
}

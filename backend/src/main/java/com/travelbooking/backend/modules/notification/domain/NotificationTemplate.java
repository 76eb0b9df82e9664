package com.travelbooking.backend.modules.notification.domain;

/**
 * Plain-text mail templates. Placeholders use the {@code ${name}} form.
 */
public enum NotificationTemplate {

    EMAIL_VERIFICATION(
            "Verify Your Email Address",
            """
            Welcome to Travel Booking, ${firstName}!

            Please verify your email address to activate your account:
            ${link}

            Or enter this code: ${token}

            This link will expire in ${validHours} hours.
            If you did not create this account, please ignore this email.
            """
    ),
    PASSWORD_RESET(
            "Password Reset Request",
            """
            Hi ${firstName},

            We received a request to reset your password. Use the link below to reset it:
            ${link}

            This link will expire in ${validMinutes} minutes.
            If you did not request this, ignore this email and your password will remain unchanged.
            Never share this link with anyone.
            """
    ),
    MFA_CODE(
            "Your Authentication Code",
            """
            Hi ${firstName},

            Your authentication code is: ${code}

            This code will expire in ${validMinutes} minutes.
            If you did not request this code, your account may be compromised. Please contact support immediately.
            """
    ),
    PASSWORD_CHANGE_CODE(
            "Confirm Your Password Change",
            """
            Hi ${firstName},

            Enter this code to confirm your password change: ${code}

            This code will expire in ${validMinutes} minutes.
            If you did not ask to change your password, change it now and contact support.
            """
    ),
    ACCOUNT_LOCKED(
            "Unusual Login Activity Detected",
            """
            Hi ${firstName},

            Your account was locked after ${attempts} failed login attempts from ${clientIp}.
            It will unlock automatically at ${lockedUntil} (UTC).

            If this was not you, reset your password and contact our support team.
            """
    );

    private final String subject;
    private final String body;

    NotificationTemplate(String subject, String body) {
        this.subject = subject;
        this.body = body;
    }

    public String subject() {
        return subject;
    }

    public String body() {
        return body;
    }
}

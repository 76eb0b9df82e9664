package com.travelbooking.backend.modules.auth.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Identity, credential and security state of a booking application user.
 *
 * <p>Lock state is never stored as a flag: an account is locked while {@code lockedUntil} lies in
 * the future. The three one-time secrets each hold at most one live value; issuing a new one
 * replaces the previous one. {@code createdAt} and {@code updatedAt} are stamped by JPA auditing
 * from the application clock.
 */
@Entity
@Table(name = "account")
@EntityListeners(AuditingEntityListener.class)
public class Account {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "is_organiser", nullable = false, updatable = false)
    private boolean organiser;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "valueHash", column = @Column(name = "email_verification_token_hash", length = 128)),
            @AttributeOverride(name = "expiresAt", column = @Column(name = "email_verification_token_expires_at"))
    })
    private ExpiringSecret emailVerification;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "valueHash", column = @Column(name = "password_reset_token_hash", length = 128)),
            @AttributeOverride(name = "expiresAt", column = @Column(name = "password_reset_token_expires_at"))
    })
    private ExpiringSecret passwordReset;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "valueHash", column = @Column(name = "mfa_code_hash", length = 128)),
            @AttributeOverride(name = "expiresAt", column = @Column(name = "mfa_code_expires_at"))
    })
    private ExpiringSecret mfaCode;

    @Enumerated(EnumType.STRING)
    @Column(name = "mfa_purpose", length = 32)
    private MfaPurpose mfaPurpose;

    @Column(name = "pending_password_hash", length = 255)
    private String pendingPasswordHash;

    @Column(name = "failed_login_attempts", nullable = false)
    private int failedLoginAttempts;

    @Column(name = "locked_until")
    private OffsetDateTime lockedUntil;

    @Column(name = "mfa_enabled", nullable = false)
    private boolean mfaEnabled;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    protected Account() {
    }

    public static Account register(String email, String firstName, String lastName, String passwordHash, boolean organiser) {
        requireText(email, "Email is required");
        requireText(firstName, "First name is required");
        requireText(lastName, "Last name is required");
        requireText(passwordHash, "Password is required");
        Account account = new Account();
        account.email = email.trim();
        account.firstName = firstName.trim();
        account.lastName = lastName.trim();
        account.passwordHash = passwordHash;
        account.organiser = organiser;
        account.emailVerified = false;
        account.failedLoginAttempts = 0;
        account.mfaEnabled = false;
        return account;
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public boolean isOrganiser() {
        return organiser;
    }

    public String getRole() {
        return organiser ? "ORGANISER" : "CLIENT";
    }

    public boolean isEmailVerified() {
        return emailVerified;
    }

    public Optional<ExpiringSecret> getEmailVerification() {
        return Optional.ofNullable(emailVerification);
    }

    public Optional<ExpiringSecret> getPasswordReset() {
        return Optional.ofNullable(passwordReset);
    }

    public Optional<ExpiringSecret> getMfaCode() {
        return Optional.ofNullable(mfaCode);
    }

    public Optional<MfaPurpose> getMfaPurpose() {
        return Optional.ofNullable(mfaPurpose);
    }

    public Optional<String> getPendingPasswordHash() {
        return Optional.ofNullable(pendingPasswordHash);
    }

    public int getFailedLoginAttempts() {
        return failedLoginAttempts;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public Optional<OffsetDateTime> getLockedUntil() {
        return Optional.ofNullable(lockedUntil);
    }

    public boolean isMfaEnabled() {
        return mfaEnabled;
    }

    public boolean isLocked(OffsetDateTime now) {
        return lockedUntil != null && lockedUntil.isAfter(now);
    }

    /** True when a lock was set and has since run out; the counter still holds the old failures. */
    public boolean hasLapsedLock(OffsetDateTime now) {
        return lockedUntil != null && !lockedUntil.isAfter(now);
    }

    public long minutesUntilUnlock(OffsetDateTime now) {
        if (!isLocked(now)) {
            return 0;
        }
        long seconds = Duration.between(now, lockedUntil).getSeconds();
        return Math.max(1, (seconds + 59) / 60);
    }

    public void issueEmailVerification(ExpiringSecret secret) {
        this.emailVerification = secret;
    }

    public void markEmailVerified() {
        this.emailVerified = true;
        this.emailVerification = null;
    }

    public void issuePasswordReset(ExpiringSecret secret) {
        this.passwordReset = secret;
    }

    public void issueMfaCode(ExpiringSecret secret, MfaPurpose purpose, String pendingPasswordHash) {
        this.mfaCode = secret;
        this.mfaPurpose = purpose;
        this.pendingPasswordHash = purpose == MfaPurpose.PASSWORD_CHANGE ? pendingPasswordHash : null;
    }

    public void clearMfaCode() {
        this.mfaCode = null;
        this.mfaPurpose = null;
        this.pendingPasswordHash = null;
    }

    public void changeMfaEnabled(boolean enabled) {
        this.mfaEnabled = enabled;
    }

    /**
     * Replaces the password hash. Any outstanding reset token, pending change and lockout go with it.
     */
    public void applyPasswordHash(String newPasswordHash) {
        requireText(newPasswordHash, "Password is required");
        this.passwordHash = newPasswordHash;
        this.passwordReset = null;
        if (mfaPurpose == MfaPurpose.PASSWORD_CHANGE) {
            clearMfaCode();
        }
        clearLockout();
    }

    public void clearLockout() {
        this.failedLoginAttempts = 0;
        this.lockedUntil = null;
    }

    /**
     * In-memory form of the failed-login increment. Returns the new attempt count and locks the
     * account once it reaches {@code threshold}.
     */
    public int registerFailedLogin(int threshold, OffsetDateTime lockUntil) {
        this.failedLoginAttempts++;
        if (failedLoginAttempts >= threshold) {
            this.lockedUntil = lockUntil;
        }
        return failedLoginAttempts;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}

package com.travelbooking.backend.modules.auth.application;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.domain.RememberMeToken;

/**
 * Persistence port for accounts and remember-me tokens.
 *
 * <p>Lookups return {@link Optional#empty()} for absent rows. Each mutating call is one atomic
 * write; infrastructure failures surface as
 * {@link com.travelbooking.backend.global.error.StorageException}.
 */
public interface AccountStore {

    Optional<Account> findByEmail(String email);

    Optional<Account> findById(Long accountId);

    Optional<Account> findByVerificationTokenHash(String tokenHash);

    Optional<Account> findByResetTokenHash(String tokenHash);

    boolean existsByEmail(String email);

    Account create(Account account);

    /** Writes the whole aggregate in one UPDATE. */
    Account save(Account account);

    /**
     * Adds one failed attempt and, when the new count reaches {@code lockThreshold}, sets the lock,
     * all in one statement. Returns the count after the increment.
     */
    int recordFailedLogin(Long accountId, int lockThreshold, OffsetDateTime lockUntil);

    RememberMeToken saveRememberMeToken(RememberMeToken token);

    Optional<RememberMeToken> findRememberMeToken(String tokenHash);

    void deleteRememberMeToken(RememberMeToken token);

    int deleteRememberMeTokens(Long accountId);

    int deleteExpiredRememberMeTokens(OffsetDateTime now);
}

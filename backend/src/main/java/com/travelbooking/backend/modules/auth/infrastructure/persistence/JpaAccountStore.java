package com.travelbooking.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Supplier;

import com.travelbooking.backend.global.error.StorageException;
import com.travelbooking.backend.modules.auth.application.AccountStore;
import com.travelbooking.backend.modules.auth.application.AuthException;
import com.travelbooking.backend.modules.auth.domain.Account;
import com.travelbooking.backend.modules.auth.domain.RememberMeToken;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * {@link AccountStore} on Spring Data JPA. Writes are flushed inside the call so a failed write
 * shows up here as a {@link StorageException} rather than at commit time.
 */
@Repository
@Transactional(noRollbackFor = ResponseStatusException.class)
public class JpaAccountStore implements AccountStore {

    private final AccountRepository accountRepository;
    private final RememberMeTokenRepository rememberMeTokenRepository;

    public JpaAccountStore(AccountRepository accountRepository, RememberMeTokenRepository rememberMeTokenRepository) {
        this.accountRepository = accountRepository;
        this.rememberMeTokenRepository = rememberMeTokenRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByEmail(String email) {
        return execute("find account by email", () -> accountRepository.findByEmail(email));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findById(Long accountId) {
        return execute("find account by id", () -> accountRepository.findById(accountId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByVerificationTokenHash(String tokenHash) {
        return execute("find account by verification token", () -> accountRepository.findByVerificationTokenHash(tokenHash));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Account> findByResetTokenHash(String tokenHash) {
        return execute("find account by reset token", () -> accountRepository.findByResetTokenHash(tokenHash));
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        return execute("check email", () -> accountRepository.existsByEmail(email));
    }

    @Override
    public Account create(Account account) {
        try {
            return accountRepository.saveAndFlush(account);
        } catch (DataIntegrityViolationException ex) {
            throw AuthException.conflict("EMAIL_ALREADY_REGISTERED", "An account with this email already exists");
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to create account", ex);
        }
    }

    @Override
    public Account save(Account account) {
        return execute("update account", () -> accountRepository.saveAndFlush(account));
    }

    @Override
    public int recordFailedLogin(Long accountId, int lockThreshold, OffsetDateTime lockUntil) {
        return execute("record failed login", () -> {
            accountRepository.incrementFailedLoginAttempts(accountId, lockThreshold, lockUntil);
            return accountRepository.findFailedLoginAttempts(accountId).orElse(0);
        });
    }

    @Override
    public RememberMeToken saveRememberMeToken(RememberMeToken token) {
        return execute("save remember-me token", () -> rememberMeTokenRepository.saveAndFlush(token));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RememberMeToken> findRememberMeToken(String tokenHash) {
        return execute("find remember-me token", () -> rememberMeTokenRepository.findByTokenHash(tokenHash));
    }

    @Override
    public void deleteRememberMeToken(RememberMeToken token) {
        execute("delete remember-me token", () -> {
            rememberMeTokenRepository.delete(token);
            rememberMeTokenRepository.flush();
            return null;
        });
    }

    @Override
    public int deleteRememberMeTokens(Long accountId) {
        return execute("delete remember-me tokens", () -> rememberMeTokenRepository.deleteByAccountId(accountId));
    }

    @Override
    public int deleteExpiredRememberMeTokens(OffsetDateTime now) {
        return execute("purge remember-me tokens", () -> rememberMeTokenRepository.deleteExpired(now));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to " + operation, ex);
        }
    }
}

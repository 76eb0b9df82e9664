package com.travelbooking.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.travelbooking.backend.modules.auth.domain.Account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccountRepository extends JpaRepository<Account, Long> {

    Optional<Account> findByEmail(String email);

    boolean existsByEmail(String email);

    @Query("select a from Account a where a.emailVerification.valueHash = :tokenHash")
    Optional<Account> findByVerificationTokenHash(@Param("tokenHash") String tokenHash);

    @Query("select a from Account a where a.passwordReset.valueHash = :tokenHash")
    Optional<Account> findByResetTokenHash(@Param("tokenHash") String tokenHash);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update Account a
               set a.failedLoginAttempts = a.failedLoginAttempts + 1,
                   a.lockedUntil = case
                       when a.failedLoginAttempts + 1 >= :threshold then :lockUntil
                       else a.lockedUntil
                   end
             where a.id = :accountId
            """)
    int incrementFailedLoginAttempts(@Param("accountId") Long accountId,
                                     @Param("threshold") int threshold,
                                     @Param("lockUntil") OffsetDateTime lockUntil);

    @Query("select a.failedLoginAttempts from Account a where a.id = :accountId")
    Optional<Integer> findFailedLoginAttempts(@Param("accountId") Long accountId);
}

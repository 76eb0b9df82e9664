package com.travelbooking.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;

import com.travelbooking.backend.modules.auth.domain.RememberMeToken;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RememberMeTokenRepository extends JpaRepository<RememberMeToken, Long> {

    @EntityGraph(attributePaths = "account")
    Optional<RememberMeToken> findByTokenHash(String tokenHash);

    @Modifying
    @Query("delete from RememberMeToken t where t.account.id = :accountId")
    int deleteByAccountId(@Param("accountId") Long accountId);

    @Modifying
    @Query("delete from RememberMeToken t where t.expiresAt <= :now")
    int deleteExpired(@Param("now") OffsetDateTime now);
}

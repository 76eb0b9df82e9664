package com.travelbooking.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class AuthMaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(AuthMaintenanceScheduler.class);

    private final AccountStore accountStore;
    private final RevocationRegistry revocationRegistry;
    private final Clock clock;

    public AuthMaintenanceScheduler(AccountStore accountStore, RevocationRegistry revocationRegistry, Clock clock) {
        this.accountStore = accountStore;
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.auth.cleanup-interval:PT1H}")
    @Transactional
    public void purgeExpiredCredentials() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int tokens = accountStore.deleteExpiredRememberMeTokens(now);
        int revocations = revocationRegistry.purgeExpired(now.toInstant());
        if (tokens > 0 || revocations > 0) {
            log.info("Purged {} expired remember-me tokens and {} revocation entries", tokens, revocations);
        }
    }
}

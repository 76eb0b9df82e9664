package com.travelbooking.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment completeEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/travel_booking")
                .withProperty("jwt.secret", "validator-test-secret-with-more-than-32-bytes")
                .withProperty("jwt.expiration", "28800000")
                .withProperty("app.frontend-url", "http://localhost:5173")
                .withProperty("app.mail.from", "no-reply@travel-booking.test");
    }

    @Test
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(completeEnvironment());

        assertThat(validator.validate()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    void reportsMissingAndInvalidValues() {
        MockEnvironment environment = completeEnvironment()
                .withProperty("jwt.secret", "short")
                .withProperty("jwt.expiration", "60000")
                .withProperty("app.auth.revocation.store", "memcached")
                .withProperty("app.mail.from", " ");

        assertThat(new EnvironmentValidator(environment).validate()).containsExactlyInAnyOrder(
                "app.mail.from is missing",
                "jwt.secret must be at least 32 bytes",
                "jwt.expiration must be between 300000 and 86400000 ms",
                "app.auth.revocation.store must be 'memory' or 'redis'"
        );
    }

    @Test
    void failsStartupOnProblems() {
        MockEnvironment environment = completeEnvironment().withProperty("jwt.expiration", "eight hours");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be a number");
    }
}

package com.travelbooking.backend.global.config;

import com.travelbooking.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.travelbooking.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_DATE_TIME_PROVIDER)
public class JpaConfig {
}

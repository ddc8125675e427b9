package com.openforge.lexguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate / @LastModifiedDate
 * on BaseEntity are automatically populated by the framework.
 *
 * Audit timestamps are read from the shared {@link Clock} bean, so the dedup
 * window and the "violations today" stats agree with the moderation clock.
 */
@Configuration
@EnableJpaAuditing(dateTimeProviderRef = "auditingDateTimeProvider")
public class JpaConfig {

    @Bean
    public DateTimeProvider auditingDateTimeProvider(Clock clock) {
        return () -> Optional.of(LocalDateTime.now(clock));
    }
}

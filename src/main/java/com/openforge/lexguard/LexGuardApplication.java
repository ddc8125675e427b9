package com.openforge.lexguard;

import com.openforge.lexguard.moderation.ModerationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// The background expiry sweep is the only scheduled job; everything else is request-driven.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ModerationProperties.class)
public class LexGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(LexGuardApplication.class, args);
    }
}

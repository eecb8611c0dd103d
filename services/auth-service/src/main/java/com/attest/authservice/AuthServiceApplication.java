package com.attest.authservice;

import com.attest.authservice.config.AuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Attest Auth Service: hosts the authentication and authorization core.
 *
 * <p>Provides:
 *
 * <ul>
 *   <li>Token, credential and permission services wired from {@code attest.auth.*}
 *   <li>Bearer authentication for {@code /api/**} with a per-request {@link
 *       com.attest.security.SecurityContext}
 *   <li>Uniform RFC 7807 error responses for authentication and authorization failures
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>First-administrator seeding and periodic purging of stale revocation records
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthProperties.class)
@EnableScheduling
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Attest Auth Service started");
    }
}

package com.attest.authservice.config;

import com.attest.security.AuthMetrics;
import com.attest.security.AuthenticationService;
import com.attest.security.CredentialVerifier;
import com.attest.security.PasswordPolicy;
import com.attest.security.PermissionResolver;
import com.attest.security.SigningKeyRing;
import com.attest.security.TokenService;
import com.attest.security.store.InMemoryDirectory;
import com.attest.security.store.InMemoryRevocationStore;
import com.attest.security.store.RevocationStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.ZoneOffset;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the framework-free security core from {@link AuthProperties}.
 *
 * <p>The in-memory directory and revocation store stand in for persistent adapters; a deployment
 * with a database replaces these two beans and keeps everything else.
 */
@Configuration
public class SecurityCoreConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public SigningKeyRing signingKeyRing(AuthProperties properties) {
        return new SigningKeyRing(properties.signingKeys().stream()
                .map(key -> SigningKeyRing.key(key.id(), key.secret()))
                .toList());
    }

    @Bean
    public InMemoryDirectory directory() {
        return new InMemoryDirectory();
    }

    @Bean
    public RevocationStore revocationStore() {
        return new InMemoryRevocationStore();
    }

    @Bean
    public AuthMetrics authMetrics(
            MeterRegistry registry, @Value("${spring.application.name:auth-service}") String serviceName) {
        return new AuthMetrics(registry, serviceName);
    }

    @Bean
    public CredentialVerifier credentialVerifier(AuthProperties properties) {
        return new CredentialVerifier(
                properties.bcryptStrength(), new PasswordPolicy(properties.passwordMinLength()));
    }

    @Bean
    public TokenService tokenService(
            SigningKeyRing keyRing,
            AuthProperties properties,
            RevocationStore revocationStore,
            Clock clock,
            AuthMetrics metrics) {
        return new TokenService(keyRing, properties.tokenSettings(), revocationStore, clock, metrics);
    }

    @Bean
    public PermissionResolver permissionResolver(InMemoryDirectory directory) {
        return new PermissionResolver(directory, directory);
    }

    @Bean
    public AuthenticationService authenticationService(
            InMemoryDirectory directory,
            CredentialVerifier credentialVerifier,
            TokenService tokenService,
            PermissionResolver permissionResolver,
            AuthMetrics metrics,
            Clock clock) {
        return new AuthenticationService(
                directory, directory, credentialVerifier, tokenService, permissionResolver, metrics, clock);
    }
}

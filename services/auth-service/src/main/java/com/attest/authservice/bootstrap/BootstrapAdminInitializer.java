package com.attest.authservice.bootstrap;

import com.attest.authservice.config.AuthProperties;
import com.attest.security.CredentialVerifier;
import com.attest.security.PermissionCode;
import com.attest.security.store.InMemoryDirectory;
import com.attest.security.store.Organization;
import com.attest.security.store.Permission;
import com.attest.security.store.Role;
import com.attest.security.store.User;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the first administrator on startup.
 *
 * <p>Creates the configured organization, the global {@value #ADMIN_ROLE_NAME} role holding
 * {@code *}, and the administrator user. Does nothing when seeding is not configured or the
 * administrator email is already registered, so restarts are harmless.
 */
@Component
public class BootstrapAdminInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminInitializer.class);

    public static final String ADMIN_ROLE_NAME = "admin";

    private final AuthProperties properties;
    private final InMemoryDirectory directory;
    private final CredentialVerifier credentialVerifier;

    public BootstrapAdminInitializer(
            AuthProperties properties, InMemoryDirectory directory, CredentialVerifier credentialVerifier) {
        this.properties = properties;
        this.directory = directory;
        this.credentialVerifier = credentialVerifier;
    }

    @Override
    public void run(ApplicationArguments args) {
        seed();
    }

    /**
     * @return the administrator, or {@code null} when seeding is disabled
     */
    public User seed() {
        AuthProperties.Bootstrap bootstrap = properties.bootstrap();
        if (!bootstrap.enabled()) {
            log.debug("No bootstrap administrator configured");
            return null;
        }
        var existing = directory.findUserByEmail(bootstrap.adminEmail());
        if (existing.isPresent()) {
            log.info("Bootstrap administrator {} already exists", bootstrap.adminEmail());
            return existing.get();
        }

        Organization organization = directory.saveOrganization(
                Organization.active(UUID.randomUUID().toString(), bootstrap.organizationName()));
        directory.savePermission(new Permission(PermissionCode.all(), "Every permission"));
        Role adminRole = directory.findRoleByName(ADMIN_ROLE_NAME, null)
                .orElseGet(() -> directory.saveRole(Role.global(
                        UUID.randomUUID().toString(), ADMIN_ROLE_NAME, Set.of(PermissionCode.WILDCARD))));

        User admin = directory.save(User.active(
                UUID.randomUUID().toString(),
                bootstrap.adminEmail(),
                credentialVerifier.hash(bootstrap.adminPassword()),
                organization.id(),
                Set.of(adminRole.id())));
        log.info("Created bootstrap administrator {} in organization {}", admin.id(), organization.id());
        return admin;
    }
}

package com.attest.security;

import com.attest.security.store.Organization;
import com.attest.security.store.OrganizationStore;
import com.attest.security.store.User;
import com.attest.security.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Entry point of the authentication and authorization core.
 *
 * <p>Ties the credential verifier, token service, permission resolver and tenant guard together
 * into the operations a host application calls: login, token refresh, request authentication,
 * authorization, logout and password change.
 *
 * <p>Failures are reported as {@link AuthException} subclasses. Store outages ({@link
 * com.attest.security.store.StoreUnavailableException}) are passed through untouched.
 */
public class AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(AuthenticationService.class);

    private final UserStore users;
    private final OrganizationStore organizations;
    private final CredentialVerifier credentials;
    private final TokenService tokens;
    private final PermissionResolver permissions;
    private final AuthMetrics metrics;
    private final Clock clock;

    public AuthenticationService(
            UserStore users,
            OrganizationStore organizations,
            CredentialVerifier credentials,
            TokenService tokens,
            PermissionResolver permissions,
            AuthMetrics metrics,
            Clock clock) {
        this.users = Objects.requireNonNull(users, "users");
        this.organizations = Objects.requireNonNull(organizations, "organizations");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.permissions = Objects.requireNonNull(permissions, "permissions");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ── Authentication ──

    /**
     * Verifies an email and secret and issues an access and refresh token pair.
     *
     * <p>An unknown email and a wrong secret produce the same failure in the same time. A disabled
     * account is only reported once the secret has verified. The login time (and an upgraded hash)
     * is written as an atomic update of the stored user, and the tokens carry the roles stored at
     * that moment.
     *
     * @throws InvalidCredentialsException with {@link AuthFailure#INVALID_CREDENTIALS} or {@link
     *                                     AuthFailure#ACCOUNT_DISABLED}
     */
    public TokenPair authenticate(String email, String secret) {
        User user = users.findUserByEmail(email).orElse(null);
        boolean verified = credentials.verify(secret, user == null ? null : user.passwordHash());
        if (!verified) {
            metrics.authenticationFailed(AuthFailure.INVALID_CREDENTIALS);
            log.info("Authentication failed: invalid credentials");
            throw new InvalidCredentialsException();
        }
        if (!isEnabled(user)) {
            metrics.authenticationFailed(AuthFailure.ACCOUNT_DISABLED);
            log.info("Authentication failed: account {} is disabled", user.id());
            throw new InvalidCredentialsException(AuthFailure.ACCOUNT_DISABLED);
        }

        String verifiedHash = user.passwordHash();
        String upgradedHash = credentials.needsRehash(verifiedHash) ? credentials.rehash(secret) : null;
        Instant now = clock.instant();
        User current = users.update(user.id(), stored -> {
            if (!stored.active()) {
                return stored;
            }
            User next = stored.withLastLoginAt(now);
            return upgradedHash != null && verifiedHash.equals(stored.passwordHash())
                    ? next.withPasswordHash(upgradedHash)
                    : next;
        }).orElse(null);
        if (current == null || !isEnabled(current)) {
            metrics.authenticationFailed(AuthFailure.ACCOUNT_DISABLED);
            log.info("Authentication failed: account {} was disabled during login", user.id());
            throw new InvalidCredentialsException(AuthFailure.ACCOUNT_DISABLED);
        }
        if (upgradedHash != null && upgradedHash.equals(current.passwordHash())) {
            log.debug("Upgraded password hash of user {}", current.id());
        }

        IssuedToken access = tokens.issueAccessToken(current.id(), current.organizationId(), current.roleIds());
        IssuedToken refresh = tokens.issueRefreshToken(current.id(), current.organizationId(), current.roleIds());
        metrics.authenticationSucceeded();
        log.info("Authenticated user {} in organization {}", current.id(), current.organizationId());
        return new TokenPair(access, refresh);
    }

    /**
     * Exchanges a refresh token for a new access token carrying the user's current role ids.
     *
     * @throws TokenException              if the token is not a valid refresh token
     * @throws InvalidCredentialsException if the account was disabled or moved since login
     */
    public IssuedToken refresh(String refreshToken) {
        TokenClaims claims = tokens.validate(refreshToken, TokenKind.REFRESH);
        User user = users.findUserById(claims.subjectId())
                .filter(u -> u.organizationId().equals(claims.organizationId()))
                .filter(this::isEnabled)
                .orElse(null);
        if (user == null) {
            metrics.authenticationFailed(AuthFailure.ACCOUNT_DISABLED);
            log.info("Refresh refused: account {} is no longer enabled", claims.subjectId());
            throw new InvalidCredentialsException(AuthFailure.ACCOUNT_DISABLED);
        }
        return tokens.issueAccessToken(user.id(), user.organizationId(), user.roleIds());
    }

    /**
     * Validates an access token and returns the identity it carries.
     *
     * @throws TokenException if the token is not a valid access token
     */
    public SecurityContext contextFromToken(String rawToken) {
        return tokens.contextFromToken(rawToken);
    }

    // ── Authorization ──

    /**
     * Decides whether the caller may perform {@code required} on a resource of the given
     * organization.
     *
     * <p>Two independent checks must both pass: the resource must belong to the caller's
     * organization (unless a cross-tenant global role applies), and the caller's resolved
     * permissions must imply {@code required}.
     */
    public AccessDecision authorize(
            SecurityContext context, PermissionCode required, String resourceOrganizationId) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(required, "required");
        ResolvedAccess access = permissions.resolveAccess(context.subjectId(), context.organizationId());

        AccessDecision decision = TenantIsolationEnforcer.check(
                context, resourceOrganizationId, access.crossTenant());
        if (decision.allowed() && !access.grants(required)) {
            decision = AccessDecision.deny(AuthFailure.PERMISSION_DENIED);
        }

        if (decision.allowed()) {
            metrics.authorizationGranted();
            log.debug("Granted {} to subject {} on organization {}",
                    required, context.subjectId(), resourceOrganizationId);
        } else {
            metrics.authorizationDenied(decision.reason());
            log.info("Denied {} to subject {} of organization {} on organization {}: {}",
                    required, context.subjectId(), context.organizationId(),
                    resourceOrganizationId, decision.reason().tagValue());
        }
        return decision;
    }

    public AccessDecision authorize(
            SecurityContext context, String permissionCode, String resourceOrganizationId) {
        return authorize(context, PermissionCode.of(permissionCode), resourceOrganizationId);
    }

    /**
     * Throwing form of {@link #authorize(SecurityContext, PermissionCode, String)}.
     *
     * @throws CrossTenantAccessException if the resource belongs to another organization
     * @throws PermissionDeniedException  if the caller lacks the permission
     */
    public void requirePermission(
            SecurityContext context, PermissionCode required, String resourceOrganizationId) {
        AccessDecision decision = authorize(context, required, resourceOrganizationId);
        if (decision.allowed()) {
            return;
        }
        if (decision.reason() == AuthFailure.CROSS_TENANT) {
            throw new CrossTenantAccessException(context.organizationId(), resourceOrganizationId);
        }
        throw new PermissionDeniedException(context.subjectId(), required);
    }

    public void requirePermission(
            SecurityContext context, String permissionCode, String resourceOrganizationId) {
        requirePermission(context, PermissionCode.of(permissionCode), resourceOrganizationId);
    }

    /**
     * Whether one of the caller's effective roles owned by the caller's organization has the given
     * name. Global roles of the same name do not count; see {@link #hasGlobalRole}.
     */
    public boolean hasRole(SecurityContext context, String roleName) {
        return permissions.resolveAccess(context.subjectId(), context.organizationId())
                .organizationRoleNames()
                .contains(roleName);
    }

    /** Whether one of the caller's effective global roles has the given name. */
    public boolean hasGlobalRole(SecurityContext context, String roleName) {
        return permissions.resolveAccess(context.subjectId(), context.organizationId())
                .globalRoleNames()
                .contains(roleName);
    }

    // ── Session management ──

    /**
     * Revokes the presented token, access or refresh.
     *
     * @throws TokenException if the token is already invalid
     */
    public void logout(String rawToken) {
        TokenClaims claims = tokens.validate(rawToken);
        tokens.revoke(claims);
        log.info("Logged out {} token of subject {}", claims.kind().claimValue(), claims.subjectId());
    }

    /** Revokes every token issued to the caller up to now. */
    public void logoutEverywhere(SecurityContext context) {
        tokens.revokeAllSessions(context.subjectId());
    }

    /**
     * Replaces the caller's password and revokes all of the caller's tokens.
     *
     * @throws InvalidCredentialsException if the current password does not verify
     * @throws IllegalArgumentException    if the new password violates the password policy
     */
    public void changePassword(SecurityContext context, String currentSecret, String newSecret) {
        User user = users.findUserById(context.subjectId()).orElse(null);
        if (!credentials.verify(currentSecret, user == null ? null : user.passwordHash())) {
            log.info("Password change refused for subject {}: current password mismatch", context.subjectId());
            throw new InvalidCredentialsException();
        }
        String verifiedHash = user.passwordHash();
        String newHash = credentials.hash(newSecret);
        users.update(user.id(), stored -> {
            if (!verifiedHash.equals(stored.passwordHash())) {
                throw new InvalidCredentialsException();
            }
            return stored.withPasswordHash(newHash);
        }).orElseThrow(InvalidCredentialsException::new);
        tokens.revokeAllSessions(user.id());
        log.info("Changed password of user {}", user.id());
    }

    // ── Private Helpers ──

    private boolean isEnabled(User user) {
        if (!user.active()) {
            return false;
        }
        return organizations.findOrganizationById(user.organizationId())
                .map(Organization::active)
                .orElse(false);
    }
}

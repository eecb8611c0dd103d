package com.attest.security;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

/**
 * Micrometer counters for authentication, token validation and authorization outcomes.
 *
 * <p>Every counter carries a {@code service} tag and an {@code outcome} tag: {@value
 * #OUTCOME_SUCCESS} or the lower-case {@link AuthFailure} name.
 */
public final class AuthMetrics {

    public static final String AUTHENTICATIONS = "attest.auth.authentications";
    public static final String TOKEN_VALIDATIONS = "attest.auth.token.validations";
    public static final String AUTHORIZATIONS = "attest.auth.authorizations";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the meter registry to publish to
     * @param serviceName logical service name used as the {@code service} tag
     */
    public AuthMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Metrics that record nothing (an empty composite registry). */
    public static AuthMetrics noop() {
        return new AuthMetrics(new CompositeMeterRegistry(), "noop");
    }

    public void authenticationSucceeded() {
        increment(AUTHENTICATIONS, "Login attempts", OUTCOME_SUCCESS);
    }

    public void authenticationFailed(AuthFailure failure) {
        increment(AUTHENTICATIONS, "Login attempts", failure.tagValue());
    }

    public void tokenValidated() {
        increment(TOKEN_VALIDATIONS, "Bearer token validations", OUTCOME_SUCCESS);
    }

    public void tokenRejected(AuthFailure failure) {
        increment(TOKEN_VALIDATIONS, "Bearer token validations", failure.tagValue());
    }

    public void authorizationGranted() {
        increment(AUTHORIZATIONS, "Authorization decisions", OUTCOME_SUCCESS);
    }

    public void authorizationDenied(AuthFailure failure) {
        increment(AUTHORIZATIONS, "Authorization decisions", failure.tagValue());
    }

    public MeterRegistry registry() {
        return registry;
    }

    private void increment(String name, String description, String outcome) {
        Counter.builder(name)
                .description(description)
                .tags(TAG_SERVICE, serviceName, TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }
}

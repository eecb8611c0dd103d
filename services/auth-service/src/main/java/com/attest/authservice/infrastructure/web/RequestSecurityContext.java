package com.attest.authservice.infrastructure.web;

import com.attest.security.AuthFailure;
import com.attest.security.SecurityContext;
import com.attest.security.TokenException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Carries the authenticated {@link SecurityContext} as a request attribute.
 *
 * <p>The context lives exactly as long as the request; nothing is kept in a thread-local or
 * across requests.
 */
public final class RequestSecurityContext {

    public static final String ATTRIBUTE = RequestSecurityContext.class.getName() + ".CONTEXT";

    private RequestSecurityContext() {
        // utility class
    }

    static void set(HttpServletRequest request, SecurityContext context) {
        request.setAttribute(ATTRIBUTE, context);
    }

    public static Optional<SecurityContext> get(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof SecurityContext context ? Optional.of(context) : Optional.empty();
    }

    /**
     * @throws TokenException if the request was not authenticated by the bearer filter
     */
    public static SecurityContext require(HttpServletRequest request) {
        return get(request).orElseThrow(
                () -> new TokenException(AuthFailure.TOKEN_MALFORMED, "Request is not authenticated"));
    }
}

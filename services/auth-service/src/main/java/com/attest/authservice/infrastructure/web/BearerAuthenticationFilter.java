package com.attest.authservice.infrastructure.web;

import com.attest.security.AuthenticationService;
import com.attest.security.BearerTokenExtractor;
import com.attest.security.SecurityContext;
import com.attest.security.TokenException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.URI;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

/**
 * Authenticates every {@code /api/**} request from its bearer access token.
 *
 * <p>On success the validated {@link SecurityContext} is attached to the request ({@link
 * RequestSecurityContext}) and the caller's organization and user id are put in the SLF4J MDC. On
 * failure the request is answered with the uniform 401 problem body; the reason is only logged.
 * Paths outside {@code /api} (actuator, error page) are not filtered. The path is compared after
 * percent-decoding and removal of {@code ;} parameters, so {@code /api;x=1/...} and {@code
 * /%61pi/...} are guarded like {@code /api/...}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BearerAuthenticationFilter.class);

    public static final String PROTECTED_PREFIX = "/api";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";

    private final AuthenticationService authenticationService;
    private final ObjectMapper objectMapper;

    public BearerAuthenticationFilter(AuthenticationService authenticationService, ObjectMapper objectMapper) {
        this.authenticationService = authenticationService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            log.debug("Missing or malformed Authorization header on {}", request.getRequestURI());
            writeUnauthorized(request, response);
            return;
        }

        SecurityContext context;
        try {
            context = authenticationService.contextFromToken(token.get());
        } catch (TokenException e) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), e.failure().tagValue());
            writeUnauthorized(request, response);
            return;
        }

        RequestSecurityContext.set(request, context);
        MDC.put(MDC_TENANT_ID, context.organizationId());
        MDC.put(MDC_USER_ID, context.subjectId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TENANT_ID);
            MDC.remove(MDC_USER_ID);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        // decoded, without ";" path parameters and duplicate slashes, as request mapping sees it
        String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
        return !(path.equals(PROTECTED_PREFIX) || path.startsWith(PROTECTED_PREFIX + "/"));
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ProblemDetail problem = AuthProblemDetails.unauthorized();
        problem.setInstance(URI.create(request.getRequestURI()));
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BearerTokenExtractor.SCHEME);
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}

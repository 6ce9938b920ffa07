package com.lernify.road.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lernify.road.api.ApiExceptionHandler.ApiError;
import com.lernify.road.error.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Set;

/**
 * Authenticates {@code /api/**} requests from their bearer token and stores the resolved
 * {@link AuthModels.AuthenticatedUser} under {@link #USER_ATTRIBUTE}.
 */
@Component
public class BearerTokenFilter extends OncePerRequestFilter {
    public static final String USER_ATTRIBUTE = "lernify.user";

    private static final Logger log = LoggerFactory.getLogger(BearerTokenFilter.class);
    private static final Set<String> PUBLIC_PATHS = Set.of(
            "/api/auth/register",
            "/api/auth/login",
            "/api/domains",
            "/api/health"
    );

    private final AuthService authService;
    private final ObjectMapper objectMapper;

    public BearerTokenFilter(AuthService authService, ObjectMapper objectMapper) {
        this.authService = authService;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return HttpMethod.OPTIONS.matches(request.getMethod())
                || !path.startsWith("/api/")
                || PUBLIC_PATHS.contains(path);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        AuthModels.AuthenticatedUser user;
        try {
            user = authService.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        } catch (UnauthorizedException e) {
            log.warn("Rejected {} {} from {}: {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr(), e.getMessage());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getWriter(), new ApiError(e.kind().name(), e.getMessage()));
            return;
        }
        request.setAttribute(USER_ATTRIBUTE, user);
        filterChain.doFilter(request, response);
    }
}

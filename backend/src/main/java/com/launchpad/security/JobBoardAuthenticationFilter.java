package com.launchpad.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.www.BasicAuthenticationConverter;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates requests to the job-queue dashboard.
 *
 * Filter Execution Flow:
 * 1. If a valid {@code job_board_session} cookie is present, trust it
 * 2. Otherwise, read HTTP Basic credentials and compare them with the configured operator account
 * 3. On a Basic match, issue a fresh session cookie so later requests skip the password check
 * 4. Pass the request on; authorization rules in SecurityConfig reject anything still anonymous
 *
 * Only paths under the dashboard prefix are filtered. Credentials are compared
 * in constant time.
 *
 * @see SessionTokenProvider
 * @see AuthCookieService
 */
@Component
@Slf4j
public class JobBoardAuthenticationFilter extends OncePerRequestFilter {

    private final SessionTokenProvider sessionTokenProvider;
    private final AuthCookieService authCookieService;
    private final BasicAuthenticationConverter basicAuthenticationConverter = new BasicAuthenticationConverter();

    @Value("${app.job-board.path:/api/queues}")
    private String jobBoardPath;

    @Value("${app.job-board.username}")
    private String username;

    @Value("${app.job-board.password}")
    private String password;

    public JobBoardAuthenticationFilter(SessionTokenProvider sessionTokenProvider, AuthCookieService authCookieService) {
        this.sessionTokenProvider = sessionTokenProvider;
        this.authCookieService = authCookieService;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            Authentication authentication = authenticateWithCookie(request);
            if (authentication == null) {
                authentication = authenticateWithBasic(request, response);
            }

            if (authentication != null) {
                SecurityContextHolder.getContext().setAuthentication(authentication);
                log.debug("Job board access granted to {} on path: {}",
                        authentication.getPrincipal(), request.getRequestURI());
            }
        } catch (AuthenticationException ex) {
            log.warn("Malformed job board credentials on path {}: {}", request.getRequestURI(), ex.getMessage());
            SecurityContextHolder.clearContext();
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !(path.equals(jobBoardPath) || path.startsWith(jobBoardPath + "/"));
    }

    private Authentication authenticateWithCookie(HttpServletRequest request) {
        return authCookieService.read(request, AuthCookieService.JOB_BOARD_COOKIE)
                .filter(token -> sessionTokenProvider.validateToken(token, SessionTokenProvider.JOB_BOARD_SCOPE))
                .map(sessionTokenProvider::getAuthentication)
                .orElse(null);
    }

    private Authentication authenticateWithBasic(HttpServletRequest request, HttpServletResponse response) {
        UsernamePasswordAuthenticationToken basic = basicAuthenticationConverter.convert(request);
        if (basic == null) {
            return null;
        }

        String presentedUser = basic.getName();
        String presentedPassword = String.valueOf(basic.getCredentials());
        if (!constantTimeEquals(presentedUser, username) || !constantTimeEquals(presentedPassword, password)) {
            log.warn("Rejected job board credentials for user '{}' from {}", presentedUser, request.getRemoteAddr());
            return null;
        }

        String token = sessionTokenProvider.generateToken(presentedUser, SessionTokenProvider.JOB_BOARD_SCOPE);
        authCookieService.write(response, AuthCookieService.JOB_BOARD_COOKIE, token, sessionTokenProvider.getSessionTtl());
        log.info("Job board session opened for user '{}'", presentedUser);
        return sessionTokenProvider.getAuthentication(token);
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8)
        );
    }
}

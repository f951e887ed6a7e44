package com.launchpad.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Date;
import java.util.List;

/**
 * Issues and verifies the signed tokens carried in auth cookies.
 *
 * Tokens are HS256 JWTs signed with {@code auth.secret}. Each token carries a
 * {@code scope} claim so a cookie issued for one surface cannot be replayed
 * against another.
 *
 * Security Features:
 * - Secret must be at least 256 bits, checked at startup
 * - Configurable lifetime ({@code app.job-board.session-ttl})
 * - Signature, expiration and scope are all verified before a token is trusted
 *
 * @see io.jsonwebtoken.Jwts
 */
@Component
@Slf4j
public class SessionTokenProvider {

    public static final String JOB_BOARD_SCOPE = "job-board";

    public static final String JOB_BOARD_ROLE = "ROLE_JOB_BOARD";

    private static final String SCOPE_CLAIM = "scope";

    private static final int MIN_SECRET_BYTES = 32;

    private final Clock clock;

    @Value("${auth.secret}")
    private String authSecret;

    @Value("${app.job-board.session-ttl:8h}")
    private Duration sessionTtl;

    private SecretKey secretKey;

    public SessionTokenProvider(Clock clock) {
        this.clock = clock;
    }

    /**
     * Derive the signing key once properties are injected.
     *
     * @throws IllegalStateException if the secret is missing or too short for HS256
     */
    @PostConstruct
    public void init() {
        if (authSecret == null || authSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("auth.secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.secretKey = Keys.hmacShaKeyFor(authSecret.getBytes(StandardCharsets.UTF_8));
        log.info("Session token provider initialized with ttl: {}", sessionTtl);
    }

    /**
     * Generate a signed token.
     *
     * @param subject who the token was issued to
     * @param scope surface the token is valid for
     * @return compact JWT
     */
    public String generateToken(String subject, String scope) {
        Date now = Date.from(clock.instant());
        Date expiryDate = Date.from(clock.instant().plus(sessionTtl));

        String token = Jwts.builder()
                .subject(subject)
                .claim(SCOPE_CLAIM, scope)
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated {} session token for: {}", scope, subject);
        return token;
    }

    /**
     * Validate signature, expiration and scope.
     *
     * @param token the token to check
     * @param expectedScope scope the caller requires
     * @return true if the token may be trusted for the scope
     */
    public boolean validateToken(String token, String expectedScope) {
        try {
            Claims claims = parseClaims(token);
            if (!expectedScope.equals(claims.get(SCOPE_CLAIM, String.class))) {
                log.warn("Session token scope mismatch: expected {}", expectedScope);
                return false;
            }
            return true;
        } catch (ExpiredJwtException ex) {
            log.debug("Expired session token: {}", ex.getMessage());
        } catch (JwtException ex) {
            log.warn("Invalid session token: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.warn("Session token is empty: {}", ex.getMessage());
        }
        return false;
    }

    public String getSubject(String token) {
        return parseClaims(token).getSubject();
    }

    /**
     * Build the Spring Security authentication for a valid job board token.
     *
     * @param token a token already checked with {@link #validateToken}
     * @return authentication carrying {@value #JOB_BOARD_ROLE}
     */
    public Authentication getAuthentication(String token) {
        return new UsernamePasswordAuthenticationToken(
                getSubject(token),
                null,
                List.of(new SimpleGrantedAuthority(JOB_BOARD_ROLE))
        );
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    private Claims parseClaims(String token) {
        return Jwts.parser()
                .verifyWith(secretKey)
                .clock(() -> Date.from(clock.instant()))
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}

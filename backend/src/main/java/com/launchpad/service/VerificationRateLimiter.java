package com.launchpad.service;

import com.launchpad.exception.VerificationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Limits how often verification codes can be issued and guessed per identifier.
 *
 * Two Redis counters are kept per identifier:
 * - {@code verification:issued:{identifier}}: codes issued in the current issue window
 * - {@code verification:failed:{identifier}}: failed confirmations in the current confirm window
 *
 * Each counter gets its TTL on the first increment, so a window starts with the
 * first hit and the limit resets when the key expires. Counters are shared by
 * every instance of the service.
 *
 * Configuration:
 * - app.verification.max-issues: codes allowed per window (default: 5)
 * - app.verification.issue-window: window length (default: 1h)
 * - app.verification.max-confirm-attempts: failed confirmations allowed per window (default: 5)
 * - app.verification.confirm-window: failed-confirmation window length (default: 10m)
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VerificationRateLimiter {

    private static final String ISSUE_COUNT_KEY_PREFIX = "verification:issued:";
    private static final String FAILED_CONFIRM_KEY_PREFIX = "verification:failed:";

    private final StringRedisTemplate redisStringTemplate;

    @Value("${app.verification.max-issues:5}")
    private int maxIssues;

    @Value("${app.verification.issue-window:1h}")
    private Duration issueWindow;

    @Value("${app.verification.max-confirm-attempts:5}")
    private int maxConfirmAttempts;

    @Value("${app.verification.confirm-window:10m}")
    private Duration confirmWindow;

    /**
     * Count one issue for the identifier.
     *
     * @param identifier normalized identifier
     * @throws VerificationException if the identifier is over its limit for the current window
     */
    public void acquire(String identifier) {
        long issued = increment(ISSUE_COUNT_KEY_PREFIX + identifier, issueWindow);

        if (issued > maxIssues) {
            log.warn("Verification issue limit exceeded for identifier: {} (attempts: {}/{})",
                    identifier, issued, maxIssues);
            throw VerificationException.rateLimited(identifier, issueWindow);
        }

        log.debug("Verification issue count for {}: {}/{}", identifier, issued, maxIssues);
    }

    /**
     * Refuse a confirmation once the identifier has used up its failed attempts.
     *
     * @param identifier normalized identifier
     * @throws VerificationException if the failed-attempt limit has been reached
     */
    public void checkConfirmAllowed(String identifier) {
        String failed = redisStringTemplate.opsForValue().get(FAILED_CONFIRM_KEY_PREFIX + identifier);
        if (failed != null && Long.parseLong(failed) >= maxConfirmAttempts) {
            log.warn("Verification confirmation blocked for identifier: {} ({} failed attempts)",
                    identifier, failed);
            throw VerificationException.attemptsExceeded(identifier, confirmWindow);
        }
    }

    /**
     * Count one failed confirmation for the identifier.
     *
     * @param identifier normalized identifier
     * @return failed attempts in the current window
     */
    public long recordFailedConfirm(String identifier) {
        long failed = increment(FAILED_CONFIRM_KEY_PREFIX + identifier, confirmWindow);
        if (failed == maxConfirmAttempts) {
            log.warn("Verification confirmation locked for identifier: {} for up to {}", identifier, confirmWindow);
        }
        return failed;
    }

    /**
     * Clear the failed-confirmation counter, called when a new code replaces the old one.
     *
     * @param identifier normalized identifier
     */
    public void clearFailedConfirms(String identifier) {
        redisStringTemplate.delete(FAILED_CONFIRM_KEY_PREFIX + identifier);
    }

    /**
     * Clear both counters, called once a code has been confirmed.
     *
     * @param identifier normalized identifier
     */
    public void reset(String identifier) {
        redisStringTemplate.delete(List.of(ISSUE_COUNT_KEY_PREFIX + identifier, FAILED_CONFIRM_KEY_PREFIX + identifier));
        log.debug("Cleared verification counters for {}", identifier);
    }

    private long increment(String key, Duration window) {
        Long count = redisStringTemplate.opsForValue().increment(key);
        if (count != null && count == 1L) {
            redisStringTemplate.expire(key, window);
        }
        return count != null ? count : 0L;
    }
}

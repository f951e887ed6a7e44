package com.launchpad.service;

import com.launchpad.entity.VerificationEntity;
import com.launchpad.exception.VerificationException;
import com.launchpad.messaging.VerificationDispatchProducer;
import com.launchpad.repository.VerificationRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Service managing the lifecycle of verification challenges.
 *
 * Lifecycle:
 * 1. issue: a numeric code is generated, stored with {@code expiresAt = now + ttl}
 *    (replacing any earlier code for the identifier) and a dispatch job is queued
 * 2. confirm: the presented code must match a stored, unexpired record; the record
 *    is consumed (deleted) on success
 * 3. purgeExpired: a scheduled sweep removes records whose expiry has passed
 *
 * Identifiers are normalized (trimmed, lower-cased) before every lookup, so
 * {@code " User@Example.com"} and {@code "user@example.com"} are the same holder.
 *
 * Configuration:
 * - app.verification.code-length: digits per code, 4 to 9 (default: 6)
 * - app.verification.ttl: lifetime of a code (default: 10m)
 *
 * @see VerificationRateLimiter
 * @see com.launchpad.messaging.VerificationDispatchConsumer
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VerificationService {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final int MIN_CODE_LENGTH = 4;
    private static final int MAX_CODE_LENGTH = 9;

    private final VerificationRepository verificationRepository;
    private final VerificationRateLimiter rateLimiter;
    private final VerificationDispatchProducer dispatchProducer;
    private final Clock clock;

    @Value("${app.verification.code-length:6}")
    private int codeLength;

    @Value("${app.verification.ttl:10m}")
    private Duration ttl;

    @PostConstruct
    void validateCodeLength() {
        if (codeLength < MIN_CODE_LENGTH || codeLength > MAX_CODE_LENGTH) {
            throw new IllegalStateException(String.format(
                    "app.verification.code-length must be between %d and %d, got %d",
                    MIN_CODE_LENGTH, MAX_CODE_LENGTH, codeLength));
        }
    }

    /**
     * Issue a new code for the identifier.
     *
     * The dispatch job is published after the transaction commits so the worker
     * never looks up a record that is not yet visible.
     *
     * @param identifier who the code is for
     * @return the persisted record
     * @throws VerificationException if the identifier is over its issue limit
     */
    @Transactional
    public VerificationEntity issue(String identifier) {
        String normalized = normalize(identifier);
        rateLimiter.acquire(normalized);
        rateLimiter.clearFailedConfirms(normalized);

        int replaced = verificationRepository.deleteByIdentifier(normalized);
        if (replaced > 0) {
            log.debug("Replaced {} earlier verification(s) for {}", replaced, normalized);
        }

        LocalDateTime expiresAt = LocalDateTime.now(clock).plus(ttl);
        VerificationEntity verification = verificationRepository.save(
                new VerificationEntity(normalized, generateCode(), expiresAt));

        dispatchAfterCommit(verification.getId(), normalized);

        log.info("Issued verification for {} (expires at {})", normalized, expiresAt);
        return verification;
    }

    /**
     * Confirm a presented code.
     *
     * An expired match is deleted before the failure is reported, so it cannot be
     * tried again. The delete is kept even though the method ends exceptionally.
     * Every wrong code counts against the identifier; once the limit is reached
     * no code is accepted until the window passes or a new code is issued.
     *
     * @param identifier who presents the code
     * @param value the presented code
     * @return the consumed record
     * @throws VerificationException with MISMATCH if no record matches, EXPIRED if the match has expired,
     *         ATTEMPTS_EXCEEDED if the identifier has too many failed attempts
     */
    @Transactional(noRollbackFor = VerificationException.class)
    public VerificationEntity confirm(String identifier, String value) {
        String normalized = normalize(identifier);
        LocalDateTime now = LocalDateTime.now(clock);
        rateLimiter.checkConfirmAllowed(normalized);

        VerificationEntity verification = verificationRepository
                .findFirstByIdentifierAndValue(normalized, value.trim())
                .orElseThrow(() -> {
                    long failed = rateLimiter.recordFailedConfirm(normalized);
                    log.warn("Invalid verification attempt for {} (failed attempts: {})", normalized, failed);
                    return VerificationException.invalid(normalized);
                });

        verificationRepository.delete(verification);

        if (verification.isExpired(now)) {
            log.warn("Expired verification presented for {} (expired at {})", normalized, verification.getExpiresAt());
            throw VerificationException.expired(normalized);
        }

        rateLimiter.reset(normalized);
        log.info("Verification confirmed for {}", normalized);
        return verification;
    }

    /**
     * Delete every record whose expiry has passed.
     *
     * @return number of records removed
     */
    @Transactional
    public int purgeExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        int purged = verificationRepository.deleteExpired(now);
        log.info("Purged {} expired verification(s) older than {}, {} still pending",
                purged, now, verificationRepository.countByExpiresAtAfter(now));
        return purged;
    }

    /**
     * Normalize an identifier for storage and lookup.
     *
     * @param identifier raw identifier
     * @return trimmed, lower-cased identifier
     * @throws IllegalArgumentException if the identifier is blank
     */
    public static String normalize(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        return identifier.trim().toLowerCase(Locale.ROOT);
    }

    private String generateCode() {
        int max = (int) Math.pow(10, codeLength);
        int code = SECURE_RANDOM.nextInt(max);
        return String.format("%0" + codeLength + "d", code);
    }

    private void dispatchAfterCommit(UUID verificationId, String identifier) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            dispatchProducer.sendDispatchTask(verificationId, identifier);
            return;
        }

        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                dispatchProducer.sendDispatchTask(verificationId, identifier);
            }
        });
    }
}

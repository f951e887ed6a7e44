package com.launchpad.exception;

import org.springframework.http.HttpStatus;

import java.time.Duration;

/**
 * Exception thrown when a verification challenge cannot be issued or confirmed.
 *
 * Each instance carries a {@link Reason} that decides the HTTP status:
 * - MISMATCH: 400, the presented identifier and value do not match a record
 * - EXPIRED: 410, the record existed but its expiry has passed
 * - RATE_LIMITED: 429, too many challenges issued for the identifier in the current window
 * - ATTEMPTS_EXCEEDED: 429, too many failed confirmations for the identifier in the current window
 *
 * A MISMATCH reads the same whether the identifier has no challenge or a
 * different one, so a caller cannot tell whether an identifier has a pending challenge.
 *
 * @see com.launchpad.service.VerificationService
 * @see com.launchpad.exception.GlobalExceptionHandler
 */
public class VerificationException extends RuntimeException {

    public enum Reason {
        MISMATCH(HttpStatus.BAD_REQUEST, "invalid-verification"),
        EXPIRED(HttpStatus.GONE, "verification-expired"),
        RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "verification-rate-limited"),
        ATTEMPTS_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "verification-attempts-exceeded");

        private final HttpStatus status;
        private final String errorType;

        Reason(HttpStatus status, String errorType) {
            this.status = status;
            this.errorType = errorType;
        }

        public HttpStatus getStatus() {
            return status;
        }

        public String getErrorType() {
            return errorType;
        }
    }

    private final Reason reason;
    private final String identifier;

    public VerificationException(Reason reason, String identifier, String message) {
        super(message);
        this.reason = reason;
        this.identifier = identifier;
    }

    public Reason getReason() {
        return reason;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * No record matches the presented identifier and value.
     *
     * @param identifier normalized identifier
     * @return exception mapped to 400
     */
    public static VerificationException invalid(String identifier) {
        return new VerificationException(
                Reason.MISMATCH,
                identifier,
                "The verification code is invalid. Request a new code and try again."
        );
    }

    /**
     * The matching record has expired.
     *
     * @param identifier normalized identifier
     * @return exception mapped to 410
     */
    public static VerificationException expired(String identifier) {
        return new VerificationException(
                Reason.EXPIRED,
                identifier,
                "The verification code has expired. Request a new code."
        );
    }

    /**
     * Too many challenges were issued for the identifier.
     *
     * @param identifier normalized identifier
     * @param window the limit window
     * @return exception mapped to 429
     */
    public static VerificationException rateLimited(String identifier, Duration window) {
        return new VerificationException(
                Reason.RATE_LIMITED,
                identifier,
                String.format("Too many verification codes requested. Please wait up to %d minutes before trying again.",
                        window.toMinutes())
        );
    }

    /**
     * Too many wrong codes were presented for the identifier.
     *
     * @param identifier normalized identifier
     * @param window the failed-attempt window
     * @return exception mapped to 429
     */
    public static VerificationException attemptsExceeded(String identifier, Duration window) {
        return new VerificationException(
                Reason.ATTEMPTS_EXCEEDED,
                identifier,
                String.format("Too many incorrect verification codes. Request a new code or wait up to %d minutes.",
                        window.toMinutes())
        );
    }
}

package com.launchpad.monitoring;

import io.sentry.Sentry;
import io.sentry.protocol.SentryId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Forwards unhandled failures to Sentry.
 */
@Component
@Slf4j
public class ErrorMonitor {

    /**
     * Report an exception.
     *
     * @param throwable the failure to report
     * @return the Sentry event id, or empty when Sentry is not enabled
     */
    public Optional<String> capture(Throwable throwable) {
        if (!Sentry.isEnabled()) {
            return Optional.empty();
        }
        SentryId eventId = Sentry.captureException(throwable);
        log.debug("Reported {} to Sentry as {}", throwable.getClass().getSimpleName(), eventId);
        return Optional.of(eventId.toString());
    }
}

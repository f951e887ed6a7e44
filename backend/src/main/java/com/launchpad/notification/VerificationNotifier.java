package com.launchpad.notification;

import java.time.LocalDateTime;

/**
 * Delivers a verification code to its holder.
 */
public interface VerificationNotifier {

    /**
     * @param identifier where to deliver
     * @param value the code
     * @param expiresAt when the code stops being accepted
     * @throws com.launchpad.exception.NotificationException if delivery fails
     */
    void deliver(String identifier, String value, LocalDateTime expiresAt);
}

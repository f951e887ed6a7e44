package com.launchpad.exception;

/**
 * Exception thrown when a verification code cannot be delivered to its holder.
 *
 * Raised inside the worker only; the dispatch consumer turns it into a
 * rejected message so the job lands in the dead letter queue.
 *
 * @see com.launchpad.messaging.VerificationDispatchConsumer
 */
public class NotificationException extends RuntimeException {

    private final String channel;

    public NotificationException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }

    public static NotificationException unsupportedIdentifier(String identifier) {
        return new NotificationException(
                "mail",
                String.format("Identifier '%s' is not a deliverable email address.", identifier),
                null
        );
    }

    public static NotificationException deliveryFailed(String channel, String identifier, Throwable cause) {
        return new NotificationException(
                channel,
                String.format("Failed to deliver verification code to '%s' via %s.", identifier, channel),
                cause
        );
    }
}

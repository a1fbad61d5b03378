package com.city.services.bus.codec;

/**
 * Raised when an inbound bus message cannot be decoded or fails validation.
 *
 * <p>Consumers treat it as a poison message: acked, dropped and logged. Redelivery would
 * fail the same way.</p>
 */
public class MalformedMessageException extends RuntimeException {

    private final String subject;

    public MalformedMessageException(String subject, String message) {
        super(message);
        this.subject = subject;
    }

    public MalformedMessageException(String subject, String message, Throwable cause) {
        super(message, cause);
        this.subject = subject;
    }

    public String subject() {
        return subject;
    }
}

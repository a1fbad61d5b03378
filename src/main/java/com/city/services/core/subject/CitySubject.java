package com.city.services.core.subject;

import java.util.Objects;
import java.util.regex.Pattern;

import com.city.services.core.message.MessageType;

/**
 * =====================================================================
 * CitySubject
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Canonical JetStream subject for every message on the city bus.
 *
 * A subject identifies:
 *  - the message kind (which handler consumes it)
 *  - the logical recipient (which service pulls it)
 *
 * CANONICAL FORMAT (LOCKED)
 * -------------------------
 *
 *   city.<message_type>.<recipient>
 *
 * Token Count: EXACTLY 3
 *
 * Examples:
 *   city.health_check.fire_department
 *   city.health_status.city_council
 *   city.department_change.emergency_dispatch_center
 *
 * The root token is fixed. Recipients are validated with the same token
 * rule used for durable names so a department name can never inject a
 * wildcard into a filter subject.
 *
 * IMMUTABILITY
 * ------------
 * Once created, a CitySubject cannot be modified.
 */
public final class CitySubject {

    public static final String ROOT = "city";

    /**
     * Must start with alphanumeric, may contain alphanumeric, underscore
     * and hyphen, max 64 chars.
     */
    private static final Pattern TOKEN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]{0,63}$");

    private final MessageType type;
    private final String recipient;

    private CitySubject(Builder b) {
        this.type = Objects.requireNonNull(b.type, "type");
        this.recipient = requireToken(b.recipient, "recipient");
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for {@code builder().type(type).recipient(recipient).build()}.
     */
    public static CitySubject of(MessageType type, String recipient) {
        return builder().type(type).recipient(recipient).build();
    }

    /**
     * @return the JetStream subject string, always exactly 3 tokens
     */
    public String toSubject() {
        return ROOT + "." + type.tag() + "." + recipient;
    }

    /**
     * Filter subject matching every message type addressed to one recipient.
     */
    public static String inboxFilter(String recipient) {
        return ROOT + ".*." + requireToken(recipient, "recipient");
    }

    /**
     * Filter subject matching one message type for every recipient.
     */
    public static String broadcastFilter(MessageType type) {
        return ROOT + "." + type.tag() + ".*";
    }

    /**
     * Parses a subject string.
     *
     * NOTE
     * ----
     * Non-throwing so consumers can fast-path filter. Returns null when the
     * subject is null, has the wrong token count or root, or names an
     * unknown message type.
     */
    public static CitySubject tryParse(String subject) {
        if (subject == null)
            return null;

        String[] t = subject.split("\\.");
        if (t.length != 3 || !ROOT.equals(t[0]))
            return null;

        try {
            return of(MessageType.fromTag(t[1]), t[2]);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Validates a single subject token.
     */
    public static String requireToken(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (!TOKEN.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must match " + TOKEN.pattern() + " but was: " + value);
        }
        return value;
    }

    public static boolean isValidToken(String value) {
        return value != null && TOKEN.matcher(value).matches();
    }

    public MessageType type() {
        return type;
    }

    public String recipient() {
        return recipient;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CitySubject other))
            return false;
        return type == other.type && recipient.equals(other.recipient);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, recipient);
    }

    @Override
    public String toString() {
        return toSubject();
    }

    public static final class Builder {

        private MessageType type;
        private String recipient;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipient = recipient;
            return this;
        }

        /**
         * Finalizes and validates the subject.
         */
        public CitySubject build() {
            return new CitySubject(this);
        }
    }
}

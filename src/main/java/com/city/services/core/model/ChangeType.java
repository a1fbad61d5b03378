package com.city.services.core.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of structural change carried by a {@link ChangeNotification}.
 */
public enum ChangeType {

    /** Several departments merged into one successor. */
    CONSOLIDATED,

    /** A department retired; work goes to a fallback. */
    TERMINATED,

    /** A department became available; stale overrides for its name are cleared. */
    CREATED,

    /** A department changed its logical name. */
    RENAMED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChangeType fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("change type is required");
        }
        return ChangeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

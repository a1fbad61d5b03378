package com.city.services.core.message;

import com.city.services.core.model.ChangeNotification;
import com.city.services.core.model.ConsolidationRecommendation;
import com.city.services.core.model.TerminationRecommendation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * =====================================================================
 * MessageType
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Closed catalogue of every message kind on the city bus, each bound to
 * the single payload class it carries.
 *
 * The tag is embedded in the subject ({@code city.<tag>.<recipient>}) and
 * in the envelope. Handlers are looked up by this enum, never by class
 * name, so an unknown tag is a malformed message rather than a lookup.
 *
 * LOCKED SEMANTICS
 * ----------------
 * Tags are part of the subject contract shared with non-Java services.
 * They MUST NOT be renamed.
 */
public enum MessageType {

    HEALTH_CHECK("health_check", HealthCheckRequest.class),
    HEALTH_STATUS("health_status", HealthStatusReply.class),
    SERVICE_REQUEST("service_request", ServiceRequest.class),
    CONSOLIDATION_RECOMMENDATION("consolidation_recommendation", ConsolidationRecommendation.class),
    TERMINATION_RECOMMENDATION("termination_recommendation", TerminationRecommendation.class),
    COUNCIL_DECISION("council_decision", CouncilDecisionMessage.class),
    DEPARTMENT_CHANGE("department_change", ChangeNotification.class),
    DEPARTMENT_ANNOUNCEMENT("department_announcement", DepartmentAnnouncement.class),
    EMERGENCY_CALL("emergency_call", EmergencyCall.class),
    ANALYSIS_REQUEST("analysis_request", AnalysisRequest.class);

    private final String tag;
    private final Class<?> payloadType;

    MessageType(String tag, Class<?> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public Class<?> payloadType() {
        return payloadType;
    }

    /**
     * Looks up a type by its wire tag.
     *
     * @throws IllegalArgumentException for an unknown tag
     */
    @JsonCreator
    public static MessageType fromTag(String tag) {
        for (MessageType t : values()) {
            if (t.tag.equals(tag)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown message type tag: " + tag);
    }
}

package com.city.services.core.message;

import jakarta.validation.constraints.NotBlank;

/**
 * Inbound unit of work for the dispatch center, forwarded unchanged (plus call id) to each
 * department the call is routed to.
 */
public record EmergencyCall(
        String callId,
        @NotBlank String emergencyType,
        String description,
        String callerLocation,
        String callerName,
        String callerPhone,
        String severity,
        String requestedDepartment,
        boolean injuriesReported,
        boolean fireInvolved,
        boolean weaponsInvolved,
        boolean hazardousMaterials,
        boolean suspectsOnScene,
        Integer vehiclesInvolved
) {

    public EmergencyCall withCallId(String id) {
        return new EmergencyCall(id, emergencyType, description, callerLocation, callerName, callerPhone,
                severity, requestedDepartment, injuriesReported, fireInvolved, weaponsInvolved,
                hazardousMaterials, suspectsOnScene, vehiclesInvolved);
    }
}

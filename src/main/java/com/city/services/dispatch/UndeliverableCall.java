package com.city.services.dispatch;

import java.time.Instant;

import com.city.services.core.message.EmergencyCall;

/**
 * A parked call whose department never became available.
 */
public record UndeliverableCall(String callId, String department, EmergencyCall call, Instant parkedAt) {
}

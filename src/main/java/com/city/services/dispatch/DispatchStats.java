package com.city.services.dispatch;

import java.util.Map;

/**
 * Counters of the dispatch center.
 */
public record DispatchStats(long callsReceived,
                            int pendingCalls,
                            long undeliverableCalls,
                            Map<String, Long> dispatchesByDepartment) {
}

package com.city.services.dispatch;

import java.util.List;

/**
 * Outcome of routing one call.
 *
 * @param callId     id assigned to the call
 * @param dispatched departments the call was forwarded to
 * @param awaiting   departments the council was asked for; the call is parked for each
 */
public record DispatchResult(String callId, List<String> dispatched, List<String> awaiting) {

    public DispatchResult {
        dispatched = List.copyOf(dispatched);
        awaiting = List.copyOf(awaiting);
    }

    public boolean isDelivered() {
        return !dispatched.isEmpty();
    }
}

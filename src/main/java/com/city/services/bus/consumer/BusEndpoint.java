package com.city.services.bus.consumer;

import java.util.List;
import java.util.Map;

import com.city.services.core.message.MessageType;

/**
 * A service that receives messages from the city bus.
 *
 * <p>Every endpoint bean gets one durable pull consumer per {@link Subscription}. Inbound
 * messages are routed through a {@link MessageDispatchTable} built from {@link #handlers()}.</p>
 */
public interface BusEndpoint {

    /**
     * @return recipient token of this service, also the role part of its durable names
     */
    String role();

    List<Subscription> subscriptions();

    Map<MessageType, MessageHandler> handlers();

    /**
     * @param channel       short label used in the durable consumer name
     * @param filterSubject JetStream filter subject, may contain wildcards
     */
    record Subscription(String channel, String filterSubject) {
    }
}

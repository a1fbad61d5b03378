package com.city.services.bus.bootstrap;

/**
 * Published once the bus stream exists and matches its configuration.
 */
public record BusBootstrapCompleteEvent(String stream) {
}

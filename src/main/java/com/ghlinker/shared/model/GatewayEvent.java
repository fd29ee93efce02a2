package com.ghlinker.shared.model;

/**
 * Marker for events delivered by the platform gateway to the event bus.
 */
public interface GatewayEvent {
}

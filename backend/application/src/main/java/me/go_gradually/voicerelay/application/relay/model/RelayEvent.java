package me.go_gradually.voicerelay.application.relay.model;

/**
 * Server to client message.
 */
public interface RelayEvent {
    String type();
}

package me.go_gradually.voicerelay.application.relay.model;

/**
 * Client to server message.
 */
public interface RelayCommand {
    String type();
}

package me.go_gradually.voicerelay.application.relay.model;

@FunctionalInterface
public interface RelayEventSink {
    /**
     * @return false when the transport is closed or the write failed
     */
    boolean send(RelayEvent event);
}

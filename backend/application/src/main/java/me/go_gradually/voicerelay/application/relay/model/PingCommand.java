package me.go_gradually.voicerelay.application.relay.model;

public record PingCommand() implements RelayCommand {
    public static final String TYPE = "ping";

    @Override
    public String type() {
        return TYPE;
    }
}

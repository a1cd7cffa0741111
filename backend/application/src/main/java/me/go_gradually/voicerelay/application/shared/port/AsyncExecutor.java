package me.go_gradually.voicerelay.application.shared.port;

public interface AsyncExecutor {
    void execute(Runnable task);
}

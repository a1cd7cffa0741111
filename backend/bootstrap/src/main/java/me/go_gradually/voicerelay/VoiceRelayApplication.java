package me.go_gradually.voicerelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VoiceRelayApplication {
    public static void main(String[] args) {
        SpringApplication.run(VoiceRelayApplication.class, args);
    }
}

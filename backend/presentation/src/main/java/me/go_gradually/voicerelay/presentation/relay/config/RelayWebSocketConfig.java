package me.go_gradually.voicerelay.presentation.relay.config;

import me.go_gradually.voicerelay.presentation.relay.websocket.RelayWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
public class RelayWebSocketConfig implements WebSocketConfigurer {
    public static final String RELAY_PATH = "/ws";

    private final RelayWebSocketHandler relayWebSocketHandler;

    public RelayWebSocketConfig(RelayWebSocketHandler relayWebSocketHandler) {
        this.relayWebSocketHandler = relayWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(relayWebSocketHandler, RELAY_PATH)
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(1_048_576);
        container.setMaxBinaryMessageBufferSize(1_048_576);
        return container;
    }
}

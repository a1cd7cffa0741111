package me.go_gradually.voicerelay.infrastructure.shared.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class WebClientConfig {
    @Bean("fishAudioWebClient")
    public WebClient fishAudioWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getFishaudio().getBaseUrl(), properties);
    }

    @Bean("elevenLabsWebClient")
    public WebClient elevenLabsWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getElevenlabs().getBaseUrl(), properties);
    }

    @Bean("openAiWebClient")
    public WebClient openAiWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getOpenai().getBaseUrl(), properties);
    }

    @Bean("geminiWebClient")
    public WebClient geminiWebClient(AppProperties properties) {
        return createWebClient(properties.getIntegrations().getGemini().getBaseUrl(), properties);
    }

    WebClient createWebClient(String baseUrl, AppProperties properties) {
        ConnectionProvider provider = createConnectionProvider();
        HttpClient httpClient = createHttpClient(provider, properties.getSynthesis().getConnectTimeoutMs());
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(createExchangeStrategies())
                .build();
    }

    private ConnectionProvider createConnectionProvider() {
        return ConnectionProvider.builder("voice-relay-http")
                .maxConnections(50)
                .pendingAcquireTimeout(Duration.ofSeconds(30))
                .build();
    }

    private HttpClient createHttpClient(ConnectionProvider provider, long connectTimeoutMs) {
        return HttpClient.create(provider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(connectTimeoutMs, Integer.MAX_VALUE))
                .responseTimeout(Duration.ofSeconds(60));
    }

    private ExchangeStrategies createExchangeStrategies() {
        return ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(20 * 1024 * 1024))
                .build();
    }
}

package me.go_gradually.voicerelay.bootstrap;

import me.go_gradually.voicerelay.application.generation.policy.GenerationPolicy;
import me.go_gradually.voicerelay.application.generation.port.GenerationProvider;
import me.go_gradually.voicerelay.application.generation.usecase.GenerationFallbackUseCase;
import me.go_gradually.voicerelay.application.relay.port.MessageStorePort;
import me.go_gradually.voicerelay.application.relay.usecase.RelayConnectionUseCase;
import me.go_gradually.voicerelay.application.shared.port.AsyncExecutor;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import me.go_gradually.voicerelay.application.synthesis.policy.SynthesisPolicy;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.application.synthesis.usecase.SynthesisFallbackUseCase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class UseCaseConfig {
    @Bean(destroyMethod = "shutdown")
    public ExecutorService speakExecutorService() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public AsyncExecutor asyncExecutor(ExecutorService speakExecutorService) {
        return speakExecutorService::execute;
    }

    @Bean
    public SynthesisFallbackUseCase synthesisFallbackUseCase(List<SynthesisProvider> synthesisProviders,
                                                             SynthesisPolicy synthesisPolicy,
                                                             MetricsPort metricsPort) {
        return new SynthesisFallbackUseCase(synthesisProviders, synthesisPolicy, metricsPort);
    }

    @Bean
    public GenerationFallbackUseCase generationFallbackUseCase(List<GenerationProvider> generationProviders,
                                                               GenerationPolicy generationPolicy,
                                                               MetricsPort metricsPort) {
        return new GenerationFallbackUseCase(generationProviders, generationPolicy, metricsPort);
    }

    @Bean
    public RelayConnectionUseCase relayConnectionUseCase(SynthesisFallbackUseCase synthesisFallbackUseCase,
                                                         MessageStorePort messageStorePort,
                                                         AsyncExecutor asyncExecutor,
                                                         MetricsPort metricsPort) {
        return new RelayConnectionUseCase(synthesisFallbackUseCase, messageStorePort, asyncExecutor, metricsPort);
    }
}

package me.go_gradually.voicerelay.infrastructure.shared.config;

import me.go_gradually.voicerelay.application.generation.policy.GenerationPolicy;
import me.go_gradually.voicerelay.application.synthesis.policy.SynthesisPolicy;
import me.go_gradually.voicerelay.domain.provider.ProviderChain;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "relay")
public class AppProperties implements SynthesisPolicy, GenerationPolicy {
    public static final String TEST_PROVIDER = "test";

    private Synthesis synthesis = new Synthesis();
    private Generation generation = new Generation();
    private Integrations integrations = new Integrations();
    private Persistence persistence = new Persistence();

    public Synthesis getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Synthesis synthesis) {
        this.synthesis = synthesis;
    }

    public Generation getGeneration() {
        return generation;
    }

    public void setGeneration(Generation generation) {
        this.generation = generation;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public void setPersistence(Persistence persistence) {
        this.persistence = persistence;
    }

    @Override
    public ProviderChain synthesisChain() {
        ProviderChain chain = new ProviderChain(synthesis.getOrder(), synthesis.getPrimary());
        if (synthesis.getTest().isEnabled()) {
            return chain.appending(TEST_PROVIDER);
        }
        return chain;
    }

    @Override
    public ProviderChain generationChain() {
        if (generation.isTestMode()) {
            return ProviderChain.of(TEST_PROVIDER);
        }
        return new ProviderChain(generation.getOrder(), null);
    }

    public static class Synthesis {
        private String primary = "fishaudio";
        private List<String> order = new ArrayList<>(List.of("fishaudio", "cartesia", "elevenlabs"));
        private long connectTimeoutMs = 10_000;
        private TestSynthesizer test = new TestSynthesizer();

        public String getPrimary() {
            return primary;
        }

        public void setPrimary(String primary) {
            this.primary = primary;
        }

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public TestSynthesizer getTest() {
            return test;
        }

        public void setTest(TestSynthesizer test) {
            this.test = test;
        }
    }

    public static class TestSynthesizer {
        private boolean enabled;
        private long frameDelayMs = 50;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFrameDelayMs() {
            return frameDelayMs;
        }

        public void setFrameDelayMs(long frameDelayMs) {
            this.frameDelayMs = frameDelayMs;
        }
    }

    public static class Generation {
        private List<String> order = new ArrayList<>(List.of("openai", "gemini"));
        private boolean testMode;

        public List<String> getOrder() {
            return order;
        }

        public void setOrder(List<String> order) {
            this.order = order;
        }

        public boolean isTestMode() {
            return testMode;
        }

        public void setTestMode(boolean testMode) {
            this.testMode = testMode;
        }
    }

    public static class Integrations {
        private SpeechProvider fishaudio = new SpeechProvider("https://api.fish.audio", null);
        private SpeechProvider cartesia = new SpeechProvider("wss://api.cartesia.ai", "sonic-english");
        private SpeechProvider elevenlabs = new SpeechProvider("https://api.elevenlabs.io", "eleven_turbo_v2_5");
        private LanguageProvider openai = new LanguageProvider("https://api.openai.com", "gpt-4o");
        private LanguageProvider gemini = new LanguageProvider("https://generativelanguage.googleapis.com", "gemini-1.5-flash");
        private String cartesiaVersion = "2024-06-10";

        public SpeechProvider getFishaudio() {
            return fishaudio;
        }

        public void setFishaudio(SpeechProvider fishaudio) {
            this.fishaudio = fishaudio;
        }

        public SpeechProvider getCartesia() {
            return cartesia;
        }

        public void setCartesia(SpeechProvider cartesia) {
            this.cartesia = cartesia;
        }

        public SpeechProvider getElevenlabs() {
            return elevenlabs;
        }

        public void setElevenlabs(SpeechProvider elevenlabs) {
            this.elevenlabs = elevenlabs;
        }

        public LanguageProvider getOpenai() {
            return openai;
        }

        public void setOpenai(LanguageProvider openai) {
            this.openai = openai;
        }

        public LanguageProvider getGemini() {
            return gemini;
        }

        public void setGemini(LanguageProvider gemini) {
            this.gemini = gemini;
        }

        public String getCartesiaVersion() {
            return cartesiaVersion;
        }

        public void setCartesiaVersion(String cartesiaVersion) {
            this.cartesiaVersion = cartesiaVersion;
        }
    }

    public static class SpeechProvider {
        private String baseUrl;
        private String apiKey;
        private String voiceId;
        private String model;

        public SpeechProvider() {
        }

        public SpeechProvider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isConfigured() {
            return hasText(apiKey) && hasText(voiceId);
        }
    }

    public static class LanguageProvider {
        private String baseUrl;
        private String apiKey;
        private String model;
        private int maxTokens = 1024;
        private double temperature = 0.7;

        public LanguageProvider() {
        }

        public LanguageProvider(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public boolean isConfigured() {
            return hasText(apiKey);
        }
    }

    public static class Persistence {
        private String store = "memory";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

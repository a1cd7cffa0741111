package me.go_gradually.voicerelay.application.synthesis.policy;

import me.go_gradually.voicerelay.domain.provider.ProviderChain;

public interface SynthesisPolicy {
    ProviderChain synthesisChain();
}

package me.go_gradually.voicerelay.application.generation.policy;

import me.go_gradually.voicerelay.domain.provider.ProviderChain;

public interface GenerationPolicy {
    ProviderChain generationChain();
}

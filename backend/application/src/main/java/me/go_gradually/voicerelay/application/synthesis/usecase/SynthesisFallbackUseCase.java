package me.go_gradually.voicerelay.application.synthesis.usecase;

import me.go_gradually.voicerelay.application.shared.log.ProviderLogRedactor;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import me.go_gradually.voicerelay.application.synthesis.model.CancellationSignal;
import me.go_gradually.voicerelay.application.synthesis.model.FallbackOutcome;
import me.go_gradually.voicerelay.application.synthesis.model.FallbackStatus;
import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.ProviderFailure;
import me.go_gradually.voicerelay.application.synthesis.model.SpeakRequest;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisCommand;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisEventListener;
import me.go_gradually.voicerelay.application.synthesis.policy.SynthesisPolicy;
import me.go_gradually.voicerelay.application.synthesis.port.SynthesisProvider;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.domain.provider.ProviderChain;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class SynthesisFallbackUseCase {
    private static final Logger log = Logger.getLogger(SynthesisFallbackUseCase.class.getName());

    private final Map<String, SynthesisProvider> providers;
    private final ProviderChain chain;
    private final MetricsPort metrics;

    public SynthesisFallbackUseCase(List<SynthesisProvider> providers, SynthesisPolicy policy, MetricsPort metrics) {
        this.providers = providers.stream()
                .collect(Collectors.toMap(SynthesisProvider::name, Function.identity(), (first, second) -> first));
        this.chain = policy.synthesisChain();
        this.metrics = metrics;
    }

    public ProviderChain chain() {
        return chain;
    }

    public FallbackOutcome synthesize(SpeakRequest request, CancellationSignal cancellation, SynthesisEventListener listener) {
        StreamCursor cursor = new StreamCursor();
        List<ProviderFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<SynthesisProvider> candidates = resolveCandidates(request, failures, skipped);

        if (candidates.isEmpty()) {
            log.warning("synthesis.exhausted correlationId=" + request.correlationId()
                    + " reason=no_viable_provider skipped=" + skipped);
            return cursor.outcome(FallbackStatus.EXHAUSTED, null, failures, skipped);
        }

        for (int index = 0; index < candidates.size(); index++) {
            if (cancellation.isCancelled()) {
                return cursor.outcome(FallbackStatus.CANCELLED, null, failures, skipped);
            }
            SynthesisProvider provider = candidates.get(index);
            Instant attemptStart = Instant.now();
            try {
                FallbackStatus status = streamFrom(provider, request, cancellation, listener, cursor);
                Duration elapsed = Duration.between(attemptStart, Instant.now());
                metrics.recordSynthesisLatency(provider.name(), elapsed);
                metrics.recordSynthesisFrames(provider.name(), cursor.framesFrom(provider.name()));
                if (status == FallbackStatus.CANCELLED) {
                    log.fine(() -> "synthesis.cancelled correlationId=" + request.correlationId()
                            + " provider=" + provider.name()
                            + " frames=" + cursor.totalFrames);
                    return cursor.outcome(FallbackStatus.CANCELLED, provider.name(), failures, skipped);
                }
                return cursor.outcome(FallbackStatus.COMPLETED, provider.name(), failures, skipped);
            } catch (RuntimeException e) {
                Duration elapsed = Duration.between(attemptStart, Instant.now());
                if (cancellation.isCancelled()) {
                    return cursor.outcome(FallbackStatus.CANCELLED, provider.name(), failures, skipped);
                }
                String message = ProviderLogRedactor.describe(e);
                failures.add(new ProviderFailure(provider.name(), message, elapsed));
                metrics.incrementSynthesisError(provider.name());
                log.warning("synthesis.provider failure correlationId=" + request.correlationId()
                        + " provider=" + provider.name()
                        + " elapsedMs=" + elapsed.toMillis()
                        + " deliveredFrames=" + cursor.totalFrames
                        + " reason=" + message);
                if (index + 1 < candidates.size()) {
                    String next = candidates.get(index + 1).name();
                    metrics.incrementSynthesisFallback();
                    log.info(() -> "synthesis.provider switched correlationId=" + request.correlationId()
                            + " from=" + provider.name()
                            + " to=" + next);
                    listener.onProviderSwitched(provider.name(), next);
                }
            }
        }

        log.warning("synthesis.exhausted correlationId=" + request.correlationId()
                + " attempted=" + failures.stream().map(ProviderFailure::provider).collect(Collectors.toList()));
        return cursor.outcome(FallbackStatus.EXHAUSTED, null, failures, skipped);
    }

    private List<SynthesisProvider> resolveCandidates(SpeakRequest request,
                                                      List<ProviderFailure> failures,
                                                      List<String> skipped) {
        List<SynthesisProvider> candidates = new ArrayList<>();
        if (request.hasExplicitProvider()) {
            SynthesisProvider explicit = providers.get(request.voiceProvider());
            if (explicit == null) {
                failures.add(new ProviderFailure(request.voiceProvider(), "Unknown synthesis provider", Duration.ZERO));
            } else if (!explicit.isAvailable()) {
                skipped.add(explicit.name());
            } else {
                candidates.add(explicit);
            }
            return candidates;
        }

        for (String name : chain.fromPrimary()) {
            SynthesisProvider provider = providers.get(name);
            if (provider == null || request.isDisabled(name) || !provider.isAvailable()) {
                skipped.add(name);
                continue;
            }
            candidates.add(provider);
        }
        return candidates;
    }

    private FallbackStatus streamFrom(SynthesisProvider provider,
                                      SpeakRequest request,
                                      CancellationSignal cancellation,
                                      SynthesisEventListener listener,
                                      StreamCursor cursor) {
        try (FrameStream stream = provider.stream(new SynthesisCommand(request.text(), request.correlationId()))) {
            Runnable unregister = cancellation.onCancel(stream::close);
            try {
                while (!cancellation.isCancelled() && stream.hasNext()) {
                    AudioFrame frame = stream.next();
                    if (cancellation.isCancelled()) {
                        return FallbackStatus.CANCELLED;
                    }
                    AudioFrame stamped = frame.withSeq(cursor.totalFrames);
                    if (!listener.onFrame(stamped, provider.name())) {
                        log.fine(() -> "synthesis.transport closed correlationId=" + request.correlationId()
                                + " provider=" + provider.name());
                        cancellation.cancel();
                        return FallbackStatus.CANCELLED;
                    }
                    cursor.delivered(stamped, provider.name());
                }
                return cancellation.isCancelled() ? FallbackStatus.CANCELLED : FallbackStatus.COMPLETED;
            } finally {
                unregister.run();
            }
        }
    }

    private static final class StreamCursor {
        private final Map<String, Long> framesByProvider = new HashMap<>();
        private long totalFrames;
        private String codec;
        private int sampleRateHz;
        private int channels;

        private void delivered(AudioFrame frame, String provider) {
            totalFrames++;
            codec = frame.codec();
            sampleRateHz = frame.sampleRateHz();
            channels = frame.channels();
            framesByProvider.merge(provider, 1L, Long::sum);
        }

        private long framesFrom(String provider) {
            return framesByProvider.getOrDefault(provider, 0L);
        }

        private FallbackOutcome outcome(FallbackStatus status,
                                        String servedBy,
                                        List<ProviderFailure> failures,
                                        List<String> skipped) {
            return new FallbackOutcome(status, servedBy, failures, skipped, totalFrames, codec, sampleRateHz, channels);
        }
    }
}

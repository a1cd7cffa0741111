package me.go_gradually.voicerelay.application.relay.usecase;

import me.go_gradually.voicerelay.application.relay.model.AudioEndEvent;
import me.go_gradually.voicerelay.application.relay.model.AudioFrameEvent;
import me.go_gradually.voicerelay.application.relay.model.ConnectedEvent;
import me.go_gradually.voicerelay.application.relay.model.ErrorEvent;
import me.go_gradually.voicerelay.application.relay.model.PongEvent;
import me.go_gradually.voicerelay.application.relay.model.ProviderSwitchedEvent;
import me.go_gradually.voicerelay.application.relay.model.RelayEvent;
import me.go_gradually.voicerelay.application.relay.model.RelayEventSink;
import me.go_gradually.voicerelay.application.relay.model.RelaySession;
import me.go_gradually.voicerelay.application.relay.model.SessionBindCommand;
import me.go_gradually.voicerelay.application.relay.model.SessionBoundEvent;
import me.go_gradually.voicerelay.application.relay.model.SpeakCommand;
import me.go_gradually.voicerelay.application.relay.model.TranscriptDeltaEvent;
import me.go_gradually.voicerelay.application.relay.port.MessageStorePort;
import me.go_gradually.voicerelay.application.shared.port.AsyncExecutor;
import me.go_gradually.voicerelay.application.shared.port.MetricsPort;
import me.go_gradually.voicerelay.application.synthesis.model.CancellationSignal;
import me.go_gradually.voicerelay.application.synthesis.model.FallbackOutcome;
import me.go_gradually.voicerelay.application.synthesis.model.SpeakRequest;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisEventListener;
import me.go_gradually.voicerelay.application.synthesis.usecase.SynthesisFallbackUseCase;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.domain.generation.MessageRole;
import me.go_gradually.voicerelay.domain.relay.BoundIdentity;
import me.go_gradually.voicerelay.domain.relay.ConnectionState;
import me.go_gradually.voicerelay.domain.relay.RelayConnection;
import me.go_gradually.voicerelay.domain.relay.RelayErrorCode;
import me.go_gradually.voicerelay.domain.relay.RelayStateException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

public class RelayConnectionUseCase {
    public static final String PROTOCOL_VERSION = "1.0.0";
    static final String TTS_FAILED_MESSAGE = "Voice synthesis failed";
    static final String INTERNAL_ERROR_MESSAGE = "An error occurred processing your request";

    private static final Logger log = Logger.getLogger(RelayConnectionUseCase.class.getName());

    private final SynthesisFallbackUseCase synthesisFallbackUseCase;
    private final MessageStorePort messageStore;
    private final AsyncExecutor asyncExecutor;
    private final MetricsPort metrics;

    public RelayConnectionUseCase(SynthesisFallbackUseCase synthesisFallbackUseCase,
                                  MessageStorePort messageStore,
                                  AsyncExecutor asyncExecutor,
                                  MetricsPort metrics) {
        this.synthesisFallbackUseCase = synthesisFallbackUseCase;
        this.messageStore = messageStore;
        this.asyncExecutor = asyncExecutor;
        this.metrics = metrics;
    }

    public RelaySession open(RelayEventSink sink) {
        return open(UUID.randomUUID().toString(), sink);
    }

    public RelaySession open(String connectionId, RelayEventSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink is required");
        }
        RuntimeContext context = new RuntimeContext(new RelayConnection(connectionId), sink);
        metrics.incrementRelayConnection();
        log.fine(() -> "relay.connection open connectionId=" + connectionId);
        context.send(new ConnectedEvent(PROTOCOL_VERSION));
        return context;
    }

    private void runSpeak(RuntimeContext context,
                          BoundIdentity identity,
                          SpeakRequest request,
                          CancellationSignal cancellation) {
        StreamSummary summary = new StreamSummary(request.correlationId(), identity.sessionId());
        try {
            if (!context.send(new TranscriptDeltaEvent(request.text(), true))) {
                return;
            }
            log.info(() -> "relay.speak start correlationId=" + request.correlationId()
                    + " sessionId=" + identity.sessionId()
                    + " chars=" + request.text().length());

            FallbackOutcome outcome = synthesisFallbackUseCase.synthesize(request, cancellation, new SynthesisEventListener() {
                @Override
                public boolean onFrame(AudioFrame frame, String provider) {
                    if (!context.send(new AudioFrameEvent(frame))) {
                        return false;
                    }
                    summary.track(frame);
                    return true;
                }

                @Override
                public void onProviderSwitched(String from, String to) {
                    context.send(new ProviderSwitchedEvent(from, to, request.correlationId()));
                }
            });
            summary.finish(outcome);

            switch (outcome.status()) {
                case COMPLETED -> {
                    context.send(new AudioEndEvent(
                            outcome.totalFrames(),
                            outcome.servedBy(),
                            outcome.codec(),
                            outcome.codec() == null ? null : outcome.sampleRateHz(),
                            outcome.codec() == null ? null : outcome.channels(),
                            request.correlationId()
                    ));
                    persistSpokenText(identity, request);
                }
                case EXHAUSTED -> context.send(new ErrorEvent(RelayErrorCode.TTS_ERROR, TTS_FAILED_MESSAGE));
                case CANCELLED -> log.fine(() -> "relay.speak cancelled correlationId=" + request.correlationId());
            }
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "relay.speak failure correlationId=" + request.correlationId(), e);
            context.send(new ErrorEvent(RelayErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE));
        } finally {
            context.finishSpeaking(cancellation);
            log.info(summary::describe);
        }
    }

    private void persistSpokenText(BoundIdentity identity, SpeakRequest request) {
        try {
            messageStore.appendMessage(identity.sessionId(), MessageRole.ASSISTANT, request.text());
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "relay.persist failure correlationId=" + request.correlationId()
                    + " sessionId=" + identity.sessionId(), e);
        }
    }

    private final class RuntimeContext implements RelaySession {
        private final RelayConnection connection;
        private final RelayEventSink sink;
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicReference<CancellationSignal> activeSpeak = new AtomicReference<>();

        private RuntimeContext(RelayConnection connection, RelayEventSink sink) {
            this.connection = connection;
            this.sink = sink;
        }

        @Override
        public String connectionId() {
            return connection.getId();
        }

        @Override
        public ConnectionState state() {
            return connection.getState();
        }

        @Override
        public void bind(SessionBindCommand command) {
            if (closed.get()) {
                return;
            }
            BoundIdentity identity = BoundIdentity.of(command.userId(), command.sessionId());
            connection.bind(identity);
            log.fine(() -> "relay.session bound connectionId=" + connection.getId()
                    + " sessionId=" + identity.sessionId());
            send(new SessionBoundEvent(identity.callerId(), identity.sessionId()));
        }

        @Override
        public void speak(SpeakCommand command) {
            if (closed.get()) {
                return;
            }
            String correlationId = CorrelationIds.resolve(command.correlationId());
            SpeakRequest request;
            try {
                request = new SpeakRequest(
                        command.text(),
                        command.voiceProvider(),
                        new HashSet<>(command.ttsDisable()),
                        correlationId
                );
            } catch (IllegalArgumentException e) {
                reject(RelayErrorCode.INVALID_MESSAGE, e.getMessage());
                return;
            }

            BoundIdentity identity;
            try {
                identity = connection.beginSpeaking();
            } catch (RelayStateException e) {
                reject(e.getCode(), e.getMessage());
                return;
            }
            CancellationSignal cancellation = new CancellationSignal();
            activeSpeak.set(cancellation);
            try {
                asyncExecutor.execute(() -> runSpeak(this, identity, request, cancellation));
            } catch (RuntimeException e) {
                log.log(Level.SEVERE, "relay.speak schedule failure correlationId=" + correlationId, e);
                finishSpeaking(cancellation);
                reject(RelayErrorCode.INTERNAL_ERROR, INTERNAL_ERROR_MESSAGE);
            }
        }

        @Override
        public void ping() {
            send(new PongEvent());
        }

        @Override
        public void reject(RelayErrorCode code, String message) {
            send(new ErrorEvent(code, message));
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            connection.close();
            CancellationSignal cancellation = activeSpeak.getAndSet(null);
            if (cancellation != null) {
                cancellation.cancel();
            }
            log.fine(() -> "relay.connection closed connectionId=" + connection.getId());
        }

        // Only the speak that owns the slot may release it.
        private void finishSpeaking(CancellationSignal cancellation) {
            if (activeSpeak.compareAndSet(cancellation, null)) {
                connection.finishSpeaking();
            }
        }

        private boolean send(RelayEvent event) {
            if (closed.get()) {
                return false;
            }
            boolean sent = sink.send(event);
            if (!sent) {
                log.fine(() -> "relay.send dropped connectionId=" + connection.getId() + " type=" + event.type());
            }
            return sent;
        }
    }

    private static final class StreamSummary {
        private final String correlationId;
        private final String sessionId;
        private final Instant start = Instant.now();
        private long firstSeq = -1;
        private long lastSeq = -1;
        private long frames;
        private long missingSeq;
        private String provider;
        private String codec;
        private String status = "INCOMPLETE";

        private StreamSummary(String correlationId, String sessionId) {
            this.correlationId = correlationId;
            this.sessionId = sessionId;
        }

        private void track(AudioFrame frame) {
            if (firstSeq < 0) {
                firstSeq = frame.seq();
            } else if (frame.seq() > lastSeq + 1) {
                missingSeq += frame.seq() - lastSeq - 1;
            }
            lastSeq = frame.seq();
            frames++;
        }

        private void finish(FallbackOutcome outcome) {
            provider = outcome.servedBy();
            codec = outcome.codec();
            status = outcome.status().name();
        }

        private String describe() {
            return "relay.speak summary correlationId=" + correlationId
                    + " sessionId=" + sessionId
                    + " status=" + status
                    + " provider=" + provider
                    + " codec=" + codec
                    + " seqStart=" + firstSeq
                    + " seqEnd=" + lastSeq
                    + " totalFrames=" + frames
                    + " missingSeqCount=" + missingSeq
                    + " elapsedMs=" + Duration.between(start, Instant.now()).toMillis();
        }
    }
}

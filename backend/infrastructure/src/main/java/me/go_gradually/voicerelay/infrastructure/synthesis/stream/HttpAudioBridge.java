package me.go_gradually.voicerelay.infrastructure.synthesis.stream;

import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;
import me.go_gradually.voicerelay.domain.util.TextUtils;
import org.reactivestreams.Subscription;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.BaseSubscriber;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Subscribes to a streamed HTTP audio body and feeds its bytes into a {@link QueueFrameStream}.
 * One body chunk is requested up front; the next is requested only once the reader has drained the
 * frames of the previous one.
 */
public final class HttpAudioBridge {
    static final int ERROR_BODY_MAX_CHARS = 200;

    private HttpAudioBridge() {
    }

    /**
     * @param rechunker fixed-size regrouping, or {@code null} to forward chunks as received
     */
    public static QueueFrameStream open(String provider,
                                        Flux<DataBuffer> body,
                                        ByteRechunker rechunker,
                                        String codec,
                                        int sampleRateHz,
                                        int channels) {
        QueueFrameStream stream = new QueueFrameStream(provider);
        BaseSubscriber<DataBuffer> subscriber = new BaseSubscriber<>() {
            @Override
            protected void hookOnSubscribe(Subscription subscription) {
                request(1);
            }

            @Override
            protected void hookOnNext(DataBuffer buffer) {
                byte[] bytes = read(buffer);
                List<byte[]> chunks = rechunker == null ? List.of(bytes) : rechunker.accept(bytes);
                if (pushAll(stream, chunks, codec, sampleRateHz, channels) == 0 && !stream.isFinished()) {
                    request(1);
                }
            }

            @Override
            protected void hookOnError(Throwable error) {
                stream.fail(error);
            }

            @Override
            protected void hookOnComplete() {
                if (rechunker != null) {
                    pushAll(stream, rechunker.flush(), codec, sampleRateHz, channels);
                }
                stream.complete();
            }
        };
        stream.onDemand(() -> subscriber.request(1));
        stream.onClose(subscriber::dispose);
        body.subscribe(subscriber);
        return stream;
    }

    /**
     * Maps a non-2xx upstream response to a provider failure carrying a truncated body.
     */
    public static Mono<? extends Throwable> toFailure(String provider, String label, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new SynthesisProviderException(provider,
                        label + " API error: HTTP " + status + " - " + TextUtils.trimToLength(body, ERROR_BODY_MAX_CHARS)));
    }

    private static int pushAll(QueueFrameStream stream, List<byte[]> chunks, String codec, int sampleRateHz, int channels) {
        int pushed = 0;
        for (byte[] chunk : chunks) {
            if (chunk.length > 0 && stream.push(AudioFrame.of(chunk, codec, sampleRateHz, channels))) {
                pushed++;
            }
        }
        return pushed;
    }

    private static byte[] read(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}

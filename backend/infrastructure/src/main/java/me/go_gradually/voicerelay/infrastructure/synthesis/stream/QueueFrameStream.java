package me.go_gradually.voicerelay.infrastructure.synthesis.stream;

import me.go_gradually.voicerelay.application.synthesis.model.FrameStream;
import me.go_gradually.voicerelay.application.synthesis.model.SynthesisProviderException;
import me.go_gradually.voicerelay.domain.audio.AudioFrame;

import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges a push-style upstream (reactive body, websocket listener) into a blocking {@link FrameStream}.
 * Producers call {@link #push}, {@link #complete} or {@link #fail}; the reader blocks in {@link #hasNext()}.
 * <p>
 * Producers pull one upstream element at a time: the {@link #onDemand} action runs whenever the reader
 * has taken every buffered frame. A producer that ignores demand and exceeds the frame cap fails the stream.
 */
public final class QueueFrameStream implements FrameStream {
    public static final int DEFAULT_MAX_BUFFERED_FRAMES = 64;

    private static final Logger log = Logger.getLogger(QueueFrameStream.class.getName());
    private static final Signal END = new Signal(null, null);

    private final String provider;
    private final int maxBufferedFrames;
    private final BlockingQueue<Signal> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger buffered = new AtomicInteger();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicReference<Runnable> onClose = new AtomicReference<>();
    private volatile Runnable onDemand = () -> {
    };
    private Signal head;
    private boolean drained;

    public QueueFrameStream(String provider) {
        this(provider, DEFAULT_MAX_BUFFERED_FRAMES);
    }

    public QueueFrameStream(String provider, int maxBufferedFrames) {
        if (maxBufferedFrames <= 0) {
            throw new IllegalArgumentException("maxBufferedFrames must be positive");
        }
        this.provider = provider;
        this.maxBufferedFrames = maxBufferedFrames;
    }

    public void onDemand(Runnable action) {
        this.onDemand = action;
    }

    public void onClose(Runnable action) {
        onClose.set(action);
        if (closed.get()) {
            runCloseAction();
        }
    }

    /**
     * @return false when the frame was not buffered (stream finished, or the cap was hit and the stream failed)
     */
    public boolean push(AudioFrame frame) {
        if (frame == null || finished.get()) {
            return false;
        }
        if (buffered.incrementAndGet() > maxBufferedFrames) {
            buffered.decrementAndGet();
            fail(new SynthesisProviderException(provider,
                    "Audio buffer overflow: more than " + maxBufferedFrames + " frames pending"));
            return false;
        }
        queue.offer(new Signal(frame, null));
        return true;
    }

    public int bufferedFrames() {
        return buffered.get();
    }

    public void complete() {
        if (finished.compareAndSet(false, true)) {
            queue.offer(END);
        }
    }

    public void fail(Throwable error) {
        if (finished.compareAndSet(false, true)) {
            queue.offer(new Signal(null, error == null ? new IllegalStateException("upstream failed") : error));
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @return true once the producer side is done (completed, failed or closed)
     */
    public boolean isFinished() {
        return finished.get();
    }

    @Override
    public boolean hasNext() {
        if (drained) {
            return false;
        }
        if (closed.get()) {
            drained = true;
            head = null;
            return false;
        }
        if (head == null) {
            head = take();
        }
        if (head == END) {
            drained = true;
            return false;
        }
        if (head.error() != null) {
            Throwable error = head.error();
            drained = true;
            throw toProviderException(error);
        }
        return true;
    }

    @Override
    public AudioFrame next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        AudioFrame frame = head.frame();
        head = null;
        if (buffered.decrementAndGet() == 0 && !finished.get()) {
            signalDemand();
        }
        return frame;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        finished.set(true);
        queue.offer(END);
        runCloseAction();
    }

    private Signal take() {
        if (closed.get()) {
            return END;
        }
        try {
            return queue.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisProviderException(provider, "Interrupted while waiting for audio", e);
        }
    }

    private void signalDemand() {
        try {
            onDemand.run();
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private void runCloseAction() {
        Runnable action = onClose.getAndSet(null);
        if (action == null) {
            return;
        }
        try {
            action.run();
        } catch (RuntimeException e) {
            log.log(Level.FINE, "synthesis.stream close_action failure provider=" + provider, e);
        }
    }

    private SynthesisProviderException toProviderException(Throwable error) {
        if (error instanceof SynthesisProviderException providerException) {
            return providerException;
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return new SynthesisProviderException(provider, message, error);
    }

    private record Signal(AudioFrame frame, Throwable error) {
    }
}

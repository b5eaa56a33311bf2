package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.service.recognition.FragmentStream;
import com.phillippitts.livescribe.service.recognition.RecognitionHandle;
import org.springframework.web.socket.WebSocketSession;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Upstream stream state for one session: the provider WebSocket, the fragment stream it feeds
 * and the per-stream sequence counter.
 */
final class DeepgramHandle implements RecognitionHandle {

    private final DeepgramRecognitionClient owner;
    private final String sessionId;
    private final FragmentStream stream;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile WebSocketSession session;
    private volatile long lastSendNanos = System.nanoTime();
    private volatile String transcriptionId;

    DeepgramHandle(DeepgramRecognitionClient owner, String sessionId) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.stream = new FragmentStream(sessionId);
    }

    @Override
    public String sessionId() {
        return sessionId;
    }

    @Override
    public boolean isOpen() {
        WebSocketSession s = session;
        return !closed.get() && !stream.isEnded() && s != null && s.isOpen();
    }

    @Override
    public Optional<String> transcriptionId() {
        return Optional.ofNullable(transcriptionId);
    }

    DeepgramRecognitionClient owner() {
        return owner;
    }

    FragmentStream stream() {
        return stream;
    }

    WebSocketSession session() {
        return session;
    }

    void attach(WebSocketSession session) {
        this.session = session;
    }

    long nextSequence() {
        return sequence.incrementAndGet();
    }

    void transcriptionId(String requestId) {
        if (requestId != null && !requestId.isBlank()) {
            this.transcriptionId = requestId;
        }
    }

    /**
     * @return {@code true} on the first call only
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    boolean isClosed() {
        return closed.get();
    }

    void touch() {
        lastSendNanos = System.nanoTime();
    }

    long idleNanos() {
        return System.nanoTime() - lastSendNanos;
    }
}

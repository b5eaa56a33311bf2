package com.phillippitts.livescribe.testutil;

import com.phillippitts.livescribe.domain.RecognitionConfig;
import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.StreamClosedException;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.service.recognition.FragmentStream;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.recognition.RecognitionHandle;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Test double for RecognitionClient driven by the test.
 *
 * <p>Tests push fragments with {@link #emitFinal}/{@link #emitInterim}, end streams with
 * {@link #dropStream}, and configure failures through the public fields:
 * <ul>
 *   <li>{@code openFailure} - thrown by {@code open}</li>
 *   <li>{@code sendFailure} - thrown by {@code send}</li>
 *   <li>{@code completeOnClose} - whether {@code close} ends the stream (false simulates a
 *       provider that never flushes)</li>
 *   <li>{@code openGate} - when set, {@code open} blocks until it is counted down</li>
 * </ul>
 */
public class FakeRecognitionClient implements RecognitionClient {
    public volatile UpstreamException openFailure;
    public volatile UpstreamException sendFailure;
    public volatile boolean completeOnClose = true;
    public volatile CountDownLatch openGate;
    public volatile boolean healthy = true;

    private final Map<String, FakeHandle> handles = new ConcurrentHashMap<>();
    private final List<RecognitionConfig> openedConfigs = new CopyOnWriteArrayList<>();
    private final List<byte[]> sentChunks = new CopyOnWriteArrayList<>();
    private final AtomicInteger openCount = new AtomicInteger();
    private final AtomicInteger abortCount = new AtomicInteger();

    @Override
    public RecognitionHandle open(String sessionId, RecognitionConfig config) {
        openCount.incrementAndGet();
        CountDownLatch gate = openGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (openFailure != null) {
            throw openFailure;
        }
        openedConfigs.add(config);
        FakeHandle handle = new FakeHandle(sessionId);
        handles.put(sessionId, handle);
        return handle;
    }

    @Override
    public void send(RecognitionHandle handle, byte[] chunk) {
        FakeHandle h = require(handle);
        if (!h.open) {
            throw new StreamClosedException(h.sessionId);
        }
        if (sendFailure != null) {
            throw sendFailure;
        }
        sentChunks.add(chunk);
    }

    @Override
    public void close(RecognitionHandle handle) {
        FakeHandle h = require(handle);
        h.open = false;
        if (completeOnClose) {
            h.stream.complete();
        }
    }

    @Override
    public void abort(RecognitionHandle handle) {
        FakeHandle h = require(handle);
        abortCount.incrementAndGet();
        h.open = false;
        h.stream.complete();
    }

    @Override
    public FragmentStream events(RecognitionHandle handle) {
        return require(handle).stream;
    }

    @Override
    public String getProviderName() {
        return "fake";
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    public TranscriptFragment emitFinal(String sessionId, String text) {
        FakeHandle h = handles.get(sessionId);
        TranscriptFragment f = TranscriptFragment.finalFragment(sessionId, text, 0.9, h.sequence.incrementAndGet());
        h.stream.emit(f);
        return f;
    }

    public TranscriptFragment emitInterim(String sessionId, String text) {
        FakeHandle h = handles.get(sessionId);
        TranscriptFragment f = TranscriptFragment.interim(sessionId, text, 0.5, h.sequence.incrementAndGet());
        h.stream.emit(f);
        return f;
    }

    /**
     * Ends the stream of {@code sessionId} as if the provider went away.
     */
    public void dropStream(String sessionId, UpstreamException error) {
        FakeHandle h = handles.get(sessionId);
        if (error != null) {
            h.stream.fail(error);
        } else {
            h.stream.complete();
        }
    }

    public boolean isOpen(String sessionId) {
        FakeHandle h = handles.get(sessionId);
        return h != null && h.open;
    }

    public List<RecognitionConfig> openedConfigs() {
        return List.copyOf(openedConfigs);
    }

    public List<byte[]> sentChunks() {
        return List.copyOf(sentChunks);
    }

    public int openCount() {
        return openCount.get();
    }

    public int abortCount() {
        return abortCount.get();
    }

    private static FakeHandle require(RecognitionHandle handle) {
        if (handle instanceof FakeHandle h) {
            return h;
        }
        throw new IllegalStateException("Handle not issued by this client: " + handle);
    }

    static final class FakeHandle implements RecognitionHandle {
        final String sessionId;
        final FragmentStream stream;
        final AtomicLong sequence = new AtomicLong();
        volatile boolean open = true;

        FakeHandle(String sessionId) {
            this.sessionId = sessionId;
            this.stream = new FragmentStream(sessionId);
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public Optional<String> transcriptionId() {
            return Optional.of("tx-" + sessionId);
        }
    }
}

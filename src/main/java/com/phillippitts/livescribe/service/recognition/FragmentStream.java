package com.phillippitts.livescribe.service.recognition;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lazy, ordered, finite sequence of fragments from one upstream stream.
 *
 * <p>The recognition client is the producer ({@link #emit}, {@link #complete}, {@link #fail});
 * the session's fragment pump is the only consumer. Iteration blocks until the next fragment
 * arrives and ends normally once the stream is completed or failed, after every fragment
 * emitted before that point has been returned. Whether the upstream failed is available from
 * {@link #terminalError()} after iteration ends.
 *
 * <p>The stream is single-use: a second call to {@link #iterator()} throws
 * {@link IllegalStateException}.
 *
 * @since 1.0
 */
public final class FragmentStream implements Iterable<TranscriptFragment> {

    private static final Object END = new Object();

    private final String sessionId;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean();
    private final AtomicBoolean consumed = new AtomicBoolean();
    private volatile UpstreamException terminalError;

    public FragmentStream(String sessionId) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Queues a fragment. Ignored once the stream has ended.
     *
     * @return {@code true} if the fragment was queued
     */
    public boolean emit(TranscriptFragment fragment) {
        Objects.requireNonNull(fragment, "fragment");
        if (ended.get()) {
            return false;
        }
        queue.add(fragment);
        return true;
    }

    /**
     * Ends the stream normally. No-op if it already ended.
     */
    public void complete() {
        if (ended.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    /**
     * Ends the stream with an upstream failure. No-op if it already ended.
     */
    public void fail(UpstreamException error) {
        Objects.requireNonNull(error, "error");
        if (ended.compareAndSet(false, true)) {
            terminalError = error;
            queue.add(END);
        }
    }

    public boolean isEnded() {
        return ended.get();
    }

    /**
     * @return the upstream failure that ended the stream, empty on normal completion or while
     *         the stream is still running
     */
    public Optional<UpstreamException> terminalError() {
        return Optional.ofNullable(terminalError);
    }

    @Override
    public Iterator<TranscriptFragment> iterator() {
        if (!consumed.compareAndSet(false, true)) {
            throw new IllegalStateException("Fragment stream already consumed (session=" + sessionId + ")");
        }
        return new Iterator<>() {
            private TranscriptFragment next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (done) {
                    return false;
                }
                Object item;
                try {
                    item = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    done = true;
                    return false;
                }
                if (item == END) {
                    done = true;
                    return false;
                }
                next = (TranscriptFragment) item;
                return true;
            }

            @Override
            public TranscriptFragment next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                TranscriptFragment result = next;
                next = null;
                return result;
            }
        };
    }
}

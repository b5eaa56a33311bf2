package com.phillippitts.livescribe.service.session;

import com.phillippitts.livescribe.domain.Identity;
import com.phillippitts.livescribe.domain.SessionState;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.service.recognition.RecognitionHandle;
import com.phillippitts.livescribe.service.transcript.TranscriptBuffer;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One live transcription session.
 *
 * <p>The session exclusively owns its recognition handle, transcript buffer and fragment pump.
 * Every mutation goes through {@link #lock()}: state transitions, buffer appends, handle and
 * pump assignment. Mutators verify that the calling thread holds the lock and fail fast with
 * {@link IllegalStateException} otherwise. {@link #state()} may be read without the lock for
 * status reporting.
 *
 * <p><b>Usage:</b>
 * <pre>
 * session.lock().lock();
 * try {
 *     session.transitionTo(SessionState.ACTIVE);
 * } finally {
 *     session.lock().unlock();
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class Session {

    private final String id;
    private final Identity owner;
    private final String ownerConnectionId;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final TranscriptBuffer transcript = new TranscriptBuffer();

    private volatile SessionState state = SessionState.IDLE;
    private RecognitionHandle handle;
    private CompletableFuture<Void> pump;
    private UpstreamException failure;

    Session(String id, Identity owner, String ownerConnectionId, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.ownerConnectionId = Objects.requireNonNull(ownerConnectionId, "ownerConnectionId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String id() {
        return id;
    }

    public Identity owner() {
        return owner;
    }

    public String ownerConnectionId() {
        return ownerConnectionId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public SessionState state() {
        return state;
    }

    /**
     * @param identity caller identity (may be null)
     * @return {@code true} if the caller owns this session
     */
    public boolean isOwnedBy(Identity identity) {
        return owner.equals(identity);
    }

    /**
     * Moves the session to {@code next}.
     *
     * @param next target state
     * @throws IllegalStateException if the lock is not held or the transition is illegal
     */
    public void transitionTo(SessionState next) {
        requireLocked();
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal session transition " + state + " -> " + next + " (session=" + id + ")");
        }
        state = next;
    }

    public TranscriptBuffer transcript() {
        requireLocked();
        return transcript;
    }

    public RecognitionHandle handle() {
        requireLocked();
        return handle;
    }

    public void attachHandle(RecognitionHandle handle) {
        requireLocked();
        if (this.handle != null) {
            throw new IllegalStateException("Session " + id + " already has a recognition handle");
        }
        this.handle = Objects.requireNonNull(handle, "handle");
    }

    public CompletableFuture<Void> pump() {
        requireLocked();
        return pump;
    }

    public void attachPump(CompletableFuture<Void> pump) {
        requireLocked();
        this.pump = Objects.requireNonNull(pump, "pump");
    }

    public UpstreamException failure() {
        requireLocked();
        return failure;
    }

    /**
     * Records the upstream failure that ended this session. The first failure wins.
     */
    public void recordFailure(UpstreamException failure) {
        requireLocked();
        if (this.failure == null) {
            this.failure = failure;
        }
    }

    /**
     * Number of buffered final fragments, read under the lock.
     */
    public int finalFragmentCount() {
        lock.lock();
        try {
            return transcript.size();
        } finally {
            lock.unlock();
        }
    }

    private void requireLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock not held (session=" + id + ")");
        }
    }

    @Override
    public String toString() {
        return "Session{id=" + id + ", owner=" + owner.userId() + ", state=" + state + "}";
    }
}

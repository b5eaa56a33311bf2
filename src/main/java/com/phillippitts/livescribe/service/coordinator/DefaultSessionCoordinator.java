package com.phillippitts.livescribe.service.coordinator;

import com.phillippitts.livescribe.config.logging.LogContext;
import com.phillippitts.livescribe.domain.RecognitionConfig;
import com.phillippitts.livescribe.domain.SessionState;
import com.phillippitts.livescribe.domain.SessionStatus;
import com.phillippitts.livescribe.domain.StreamOptions;
import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.DuplicateSessionException;
import com.phillippitts.livescribe.exception.StreamClosedException;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.exception.UpstreamExceptionBuilder;
import com.phillippitts.livescribe.service.coordinator.event.SessionClosedEvent;
import com.phillippitts.livescribe.service.coordinator.event.SessionEventPublisher;
import com.phillippitts.livescribe.service.coordinator.event.SessionFailedEvent;
import com.phillippitts.livescribe.service.coordinator.event.SessionStartedEvent;
import com.phillippitts.livescribe.service.collaborator.TranscriptPersistence;
import com.phillippitts.livescribe.service.gateway.Broadcaster;
import com.phillippitts.livescribe.service.gateway.ClientConnection;
import com.phillippitts.livescribe.service.gateway.OutboundEvent;
import com.phillippitts.livescribe.service.gateway.StreamErrorReason;
import com.phillippitts.livescribe.service.recognition.FragmentStream;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.recognition.RecognitionHandle;
import com.phillippitts.livescribe.service.session.Session;
import com.phillippitts.livescribe.service.session.SessionRegistry;
import com.phillippitts.livescribe.util.LogSanitizer;
import com.phillippitts.livescribe.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link SessionCoordinator}.
 *
 * <p><b>Locking:</b> each session is serialized through its own lock. State transitions, buffer
 * appends and room broadcasts for a session happen under it, so listeners see fragments in
 * adapter order and never after {@code stream:stopped}. Blocking network calls (upstream connect,
 * drain wait, transcript persistence) run without it.
 *
 * <p><b>Threads:</b>
 * <ul>
 *   <li>Connection threads call {@code start}, {@code audio} and {@code stop}</li>
 *   <li>One fragment pump per session runs on the session executor</li>
 *   <li>Disconnect teardown and shutdown run on the lifecycle executor</li>
 * </ul>
 *
 * <p><b>Teardown</b> ({@link #stopSession}) runs in phases:
 * <ol>
 *   <li>locked: ACTIVE/STARTING → STOPPING, ask the provider to flush</li>
 *   <li>unlocked: wait for the pump up to the drain timeout, then release the handle</li>
 *   <li>locked: snapshot the transcript, → CLOSED</li>
 *   <li>unlocked: persist the transcript</li>
 *   <li>locked: notify the room, dissolve it, remove the registry entry</li>
 * </ol>
 *
 * @since 1.0
 */
public final class DefaultSessionCoordinator implements SessionCoordinator {

    private static final Logger LOG = LogManager.getLogger(DefaultSessionCoordinator.class);

    static final String MDC_SESSION_ID = LogContext.SESSION_ID;

    private final SessionRegistry registry;
    private final RecognitionClient recognitionClient;
    private final Broadcaster broadcaster;
    private final TranscriptPersistence persistence;
    private final Executor sessionExecutor;
    private final Executor lifecycleExecutor;
    private final RecognitionConfig defaultConfig;
    private final Duration drainTimeout;
    private final Duration shutdownTimeout;
    private final SessionMetricsPublisher metrics;
    private final ApplicationEventPublisher publisher;
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    /**
     * Prefer {@link DefaultSessionCoordinatorBuilder}.
     */
    DefaultSessionCoordinator(SessionRegistry registry,
                              RecognitionClient recognitionClient,
                              Broadcaster broadcaster,
                              TranscriptPersistence persistence,
                              Executor sessionExecutor,
                              Executor lifecycleExecutor,
                              RecognitionConfig defaultConfig,
                              Duration drainTimeout,
                              Duration shutdownTimeout,
                              SessionMetricsPublisher metrics,
                              ApplicationEventPublisher publisher) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.recognitionClient = Objects.requireNonNull(recognitionClient, "recognitionClient");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.persistence = Objects.requireNonNull(persistence, "persistence");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.lifecycleExecutor = Objects.requireNonNull(lifecycleExecutor, "lifecycleExecutor");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        this.metrics = metrics != null ? metrics : SessionMetricsPublisher.NOOP;
        this.publisher = publisher;
    }

    @Override
    public void start(ClientConnection requester, String sessionId, StreamOptions options) {
        Objects.requireNonNull(requester, "requester");
        Objects.requireNonNull(sessionId, "sessionId");
        if (shuttingDown.get()) {
            LOG.info("Rejected start during shutdown (session={})", sessionId);
            metrics.recordStartRejected("shutting_down");
            requester.send(OutboundEvent.error(StreamErrorReason.START_FAILED, sessionId));
            return;
        }

        Session session;
        try {
            session = registry.create(sessionId, requester.identity(), requester.id());
        } catch (DuplicateSessionException e) {
            LOG.info("Rejected start: session already active (session={}, connection={})",
                    sessionId, requester.id());
            metrics.recordStartRejected("already_active");
            requester.send(OutboundEvent.error(StreamErrorReason.ALREADY_ACTIVE, sessionId));
            return;
        }

        session.lock().lock();
        try {
            session.transitionTo(SessionState.STARTING);
        } finally {
            session.lock().unlock();
        }
        LOG.info("Starting session (session={}, user={}, connection={})",
                sessionId, requester.identity().userId(), requester.id());

        long connectStart = System.nanoTime();
        RecognitionHandle handle;
        try {
            handle = recognitionClient.open(sessionId, defaultConfig.applying(options));
        } catch (UpstreamException e) {
            abandonStart(session, requester, e);
            return;
        } catch (RuntimeException e) {
            abandonStart(session, requester, UpstreamExceptionBuilder.create("Unexpected failure opening stream")
                    .provider(recognitionClient.getProviderName())
                    .kind(UpstreamErrorKind.UNKNOWN)
                    .cause(e)
                    .build());
            return;
        }
        long connectNanos = TimeUtils.elapsedNanos(connectStart);

        session.lock().lock();
        try {
            if (session.state() != SessionState.STARTING) {
                LOG.info("Session stopped while connecting; releasing upstream stream (session={})", sessionId);
                recognitionClient.abort(handle);
                return;
            }
            session.attachHandle(handle);
            FragmentStream stream = recognitionClient.events(handle);
            try {
                session.attachPump(CompletableFuture.runAsync(() -> pump(session, stream), sessionExecutor));
            } catch (RejectedExecutionException e) {
                LOG.warn("No capacity for a new fragment pump; rejecting start (session={})", sessionId);
                recognitionClient.abort(handle);
                session.transitionTo(SessionState.CLOSED);
                registry.remove(sessionId, session);
                metrics.recordStartRejected("capacity");
                SessionEventPublisher.publishFailure(publisher, sessionId, SessionFailedEvent.Phase.START,
                        null, "Session executor saturated", Map.of());
                requester.send(OutboundEvent.error(StreamErrorReason.START_FAILED, sessionId));
                return;
            }
            session.transitionTo(SessionState.ACTIVE);
            broadcaster.join(sessionId, requester);
            requester.send(OutboundEvent.started(sessionId));
        } finally {
            session.lock().unlock();
        }

        metrics.recordStarted(recognitionClient.getProviderName(), connectNanos);
        SessionEventPublisher.publish(publisher, new SessionStartedEvent(
                sessionId, requester.identity().userId(), recognitionClient.getProviderName(), Instant.now()));
        LOG.info("Session active (session={})", sessionId);

        // A disconnect handled before the session was registered never saw it.
        if (!requester.isOpen()) {
            LOG.info("Owner disconnected while starting; stopping session (session={}, connection={})",
                    sessionId, requester.id());
            stopSession(session, SessionClosedEvent.Outcome.DISCONNECTED, null, null, true);
        }
    }

    private void abandonStart(Session session, ClientConnection requester, UpstreamException error) {
        String sessionId = session.id();
        session.lock().lock();
        try {
            session.recordFailure(error);
            if (session.state() == SessionState.STARTING) {
                session.transitionTo(SessionState.CLOSED);
                registry.remove(sessionId, session);
            }
        } finally {
            session.lock().unlock();
        }
        LOG.warn("Failed to start session (session={}, kind={}): {}", sessionId, error.getKind(), error.getMessage());
        metrics.recordStartRejected("upstream_" + error.getKind().name().toLowerCase());
        SessionEventPublisher.publishFailure(publisher, sessionId, SessionFailedEvent.Phase.START,
                error.getKind(), error.getMessage(), Map.of("provider", String.valueOf(error.getProviderName())));
        requester.send(OutboundEvent.upstreamError(StreamErrorReason.START_FAILED, sessionId, error));
    }

    @Override
    public void audio(ClientConnection requester, String sessionId, byte[] chunk) {
        Optional<Session> found = registry.get(sessionId);
        if (found.isEmpty()) {
            requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
            return;
        }
        Session session = found.get();
        if (!session.isOwnedBy(requester.identity())) {
            LOG.warn("Rejected audio from non-owner (session={}, user={})",
                    sessionId, requester.identity().userId());
            requester.send(OutboundEvent.error(StreamErrorReason.UNAUTHORIZED, sessionId));
            return;
        }

        UpstreamException failure = null;
        session.lock().lock();
        try {
            if (session.state() != SessionState.ACTIVE) {
                requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
                return;
            }
            try {
                recognitionClient.send(session.handle(), chunk);
            } catch (StreamClosedException e) {
                requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
            } catch (UpstreamException e) {
                failure = e;
            } catch (IllegalStateException e) {
                failure = UpstreamExceptionBuilder.create("Audio rejected by recognition client")
                        .provider(recognitionClient.getProviderName())
                        .kind(UpstreamErrorKind.UNKNOWN)
                        .cause(e)
                        .build();
            }
        } finally {
            session.lock().unlock();
        }

        if (failure != null) {
            LOG.warn("Failed to forward audio (session={}): {}", sessionId, failure.getMessage());
            requester.send(OutboundEvent.error(StreamErrorReason.AUDIO_FAILED, sessionId));
            stopSession(session, SessionClosedEvent.Outcome.FAILED, requester, failure, false);
        }
    }

    @Override
    public void stop(ClientConnection requester, String sessionId) {
        Optional<Session> found = registry.get(sessionId);
        if (found.isEmpty()) {
            requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
            return;
        }
        Session session = found.get();
        if (!session.isOwnedBy(requester.identity())) {
            LOG.warn("Rejected stop from non-owner (session={}, user={})",
                    sessionId, requester.identity().userId());
            requester.send(OutboundEvent.error(StreamErrorReason.UNAUTHORIZED, sessionId));
            return;
        }
        LOG.info("Stopping session (session={}, connection={})", sessionId, requester.id());
        stopSession(session, SessionClosedEvent.Outcome.STOPPED, requester, null, true);
    }

    @Override
    public void join(ClientConnection requester, String sessionId) {
        Optional<Session> found = registry.get(sessionId);
        if (found.isEmpty()) {
            requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
            return;
        }
        Session session = found.get();
        session.lock().lock();
        try {
            if (session.state() != SessionState.ACTIVE) {
                requester.send(OutboundEvent.error(StreamErrorReason.NOT_ACTIVE, sessionId));
                return;
            }
            broadcaster.join(sessionId, requester);
            requester.send(OutboundEvent.joined(sessionId));
        } finally {
            session.lock().unlock();
        }
        LOG.info("Observer joined (session={}, connection={})", sessionId, requester.id());
    }

    @Override
    public void leave(ClientConnection connection) {
        broadcaster.leave(connection);
    }

    @Override
    public void connectionClosed(ClientConnection connection) {
        boolean owner = false;
        for (Session session : registry.snapshot()) {
            if (session.ownerConnectionId().equals(connection.id())) {
                owner = true;
                LOG.info("Owner disconnected; stopping session (session={}, connection={})",
                        session.id(), connection.id());
                try {
                    lifecycleExecutor.execute(() ->
                            stopSession(session, SessionClosedEvent.Outcome.DISCONNECTED, null, null, true));
                } catch (RejectedExecutionException e) {
                    LOG.warn("Lifecycle executor rejected teardown; stopping inline (session={})", session.id());
                    stopSession(session, SessionClosedEvent.Outcome.DISCONNECTED, null, null, true);
                }
            }
        }
        broadcaster.leave(connection);
        if (!owner) {
            LOG.debug("Listener disconnected (connection={})", connection.id());
        }
    }

    @Override
    public Optional<SessionStatus> status(String sessionId) {
        return registry.get(sessionId).map(s ->
                new SessionStatus(s.id(), s.state(), s.createdAt(), s.finalFragmentCount()));
    }

    @Override
    public int activeSessionCount() {
        return registry.size();
    }

    /**
     * Drains the fragment stream of one session. Fragments are delivered only while the session
     * is ACTIVE or STOPPING. If the stream ends while the session is still ACTIVE the upstream
     * was lost and the session is torn down without waiting for a drain.
     */
    private void pump(Session session, FragmentStream stream) {
        ThreadContext.put(MDC_SESSION_ID, session.id());
        try {
            UpstreamException lost = null;
            try {
                for (TranscriptFragment fragment : stream) {
                    deliver(session, fragment);
                }
            } catch (RuntimeException e) {
                LOG.error("Fragment pump failed (session={})", session.id(), e);
                lost = UpstreamExceptionBuilder.create("Fragment delivery failed")
                        .provider(recognitionClient.getProviderName())
                        .kind(UpstreamErrorKind.UNKNOWN)
                        .cause(e)
                        .build();
            }
            session.lock().lock();
            try {
                if (session.state() != SessionState.ACTIVE) {
                    lost = null;
                } else if (lost == null) {
                    lost = stream.terminalError().orElseGet(() ->
                            UpstreamExceptionBuilder.create("Recognition stream ended unexpectedly")
                                    .provider(recognitionClient.getProviderName())
                                    .kind(UpstreamErrorKind.TRANSIENT)
                                    .build());
                }
            } finally {
                session.lock().unlock();
            }
            if (lost != null) {
                LOG.warn("Upstream lost (session={}, kind={}): {}", session.id(), lost.getKind(), lost.getMessage());
                stopSession(session, SessionClosedEvent.Outcome.FAILED, null, lost, false);
            }
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private void deliver(Session session, TranscriptFragment fragment) {
        session.lock().lock();
        try {
            SessionState state = session.state();
            if (state != SessionState.ACTIVE && state != SessionState.STOPPING) {
                LOG.debug("Dropping fragment #{} after close (session={})", fragment.sequence(), session.id());
                return;
            }
            if (fragment.isFinal()) {
                session.transcript().append(fragment);
            }
            broadcaster.publish(session.id(), OutboundEvent.update(fragment));
        } finally {
            session.lock().unlock();
        }
        metrics.recordFragment(fragment.isFinal());
        if (LOG.isTraceEnabled()) {
            LOG.trace("Delivered fragment #{} final={} (session={}): '{}'", fragment.sequence(),
                    fragment.isFinal(), session.id(), LogSanitizer.preview(fragment.text()));
        }
    }

    /**
     * Tears a session down. Idempotent: only the caller that moves the session to STOPPING
     * performs the teardown.
     *
     * @param session    session to stop
     * @param outcome    reason for metrics and events
     * @param requester  connection to notify even if it is not in the room (may be null)
     * @param failure    upstream failure that ended the session (may be null)
     * @param awaitDrain whether to wait for in-flight fragments; false when the upstream is gone
     *                   or when called from the session's own pump
     */
    void stopSession(Session session,
                     SessionClosedEvent.Outcome outcome,
                     ClientConnection requester,
                     UpstreamException failure,
                     boolean awaitDrain) {
        RecognitionHandle handle;
        CompletableFuture<Void> pump;

        // Phase 1: claim the teardown and ask the provider to flush.
        session.lock().lock();
        try {
            SessionState state = session.state();
            if (!state.isLive()) {
                LOG.debug("Stop ignored; session is {} (session={})", state, session.id());
                return;
            }
            if (failure != null) {
                session.recordFailure(failure);
            }
            session.transitionTo(SessionState.STOPPING);
            handle = session.handle();
            pump = session.pump();
            if (handle != null) {
                closeUpstream(handle);
            }
        } finally {
            session.lock().unlock();
        }

        // Phase 2: bounded drain, then release the upstream for good.
        if (pump != null && awaitDrain) {
            awaitPump(session.id(), pump);
        }
        if (handle != null) {
            recognitionClient.abort(handle);
        }

        // Phase 3: freeze the transcript.
        String transcript;
        int finalFragments;
        UpstreamException sessionFailure;
        session.lock().lock();
        try {
            transcript = session.transcript().joined();
            finalFragments = session.transcript().size();
            sessionFailure = session.failure();
            session.transitionTo(SessionState.CLOSED);
        } finally {
            session.lock().unlock();
        }

        // Phase 4: persist outside the lock; failures never block teardown.
        boolean persisted = persist(session.id(), transcript,
                handle != null ? handle.transcriptionId().orElse(null) : null);

        // Phase 5: notify, dissolve, deregister.
        session.lock().lock();
        try {
            OutboundEvent notice = sessionFailure != null
                    ? OutboundEvent.upstreamError(StreamErrorReason.UPSTREAM_FAILED, session.id(), sessionFailure)
                    : OutboundEvent.stopped(session.id(), transcript);
            broadcaster.publish(session.id(), notice);
            if (requester != null && !broadcaster.isMember(session.id(), requester.id())) {
                requester.send(notice);
            }
            broadcaster.dissolve(session.id());
            registry.remove(session.id(), session);
        } finally {
            session.lock().unlock();
        }

        SessionClosedEvent.Outcome effective = sessionFailure != null ? SessionClosedEvent.Outcome.FAILED : outcome;
        long lifetimeNanos = TimeUtils.lifetimeNanos(session.createdAt(), Instant.now());
        metrics.recordClosed(effective.tag(), lifetimeNanos);
        if (sessionFailure != null) {
            SessionEventPublisher.publishFailure(publisher, session.id(), SessionFailedEvent.Phase.STREAM,
                    sessionFailure.getKind(), sessionFailure.getMessage(), Map.of());
        }
        SessionEventPublisher.publish(publisher, new SessionClosedEvent(session.id(), effective,
                finalFragments, transcript.length(), persisted, Instant.now()));
        LOG.info("Session closed (session={}, outcome={}, finalFragments={}, persisted={})",
                session.id(), effective.tag(), finalFragments, persisted);
    }

    private void closeUpstream(RecognitionHandle handle) {
        try {
            recognitionClient.close(handle);
        } catch (RuntimeException e) {
            LOG.warn("Graceful upstream close failed (session={}); stream will be aborted",
                    handle.sessionId(), e);
        }
    }

    private void awaitPump(String sessionId, CompletableFuture<Void> pump) {
        try {
            pump.get(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Drain timed out after {} ms; aborting upstream (session={})", drainTimeout.toMillis(), sessionId);
        } catch (ExecutionException e) {
            LOG.error("Fragment pump failed (session={})", sessionId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while draining (session={})", sessionId);
        }
    }

    private boolean persist(String sessionId, String transcript, String transcriptionId) {
        if (transcript.isEmpty()) {
            LOG.debug("Nothing to persist (session={})", sessionId);
            return false;
        }
        try {
            persistence.persist(sessionId, transcript, transcriptionId);
            return true;
        } catch (RuntimeException e) {
            LOG.error("Failed to persist transcript (session={}, chars={})", sessionId, transcript.length(), e);
            metrics.recordPersistenceFailure();
            SessionEventPublisher.publishFailure(publisher, sessionId, SessionFailedEvent.Phase.PERSIST,
                    null, e.getMessage(), Map.of());
            return false;
        }
    }

    @Override
    @PreDestroy
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        List<Session> live = registry.snapshot();
        if (live.isEmpty()) {
            LOG.info("Shutdown: no live sessions");
            return;
        }
        LOG.info("Shutdown: stopping {} live session(s)", live.size());
        List<CompletableFuture<Void>> stops = new ArrayList<>(live.size());
        for (Session session : live) {
            stops.add(CompletableFuture.runAsync(
                    () -> stopSession(session, SessionClosedEvent.Outcome.SHUTDOWN, null, null, true),
                    lifecycleExecutor));
        }
        try {
            CompletableFuture.allOf(stops.toArray(new CompletableFuture[0]))
                    .get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.info("Shutdown: all sessions stopped");
        } catch (TimeoutException e) {
            long pending = stops.stream().filter(f -> !f.isDone()).count();
            LOG.warn("Shutdown: {} session(s) did not stop within {} ms", pending, shutdownTimeout.toMillis());
        } catch (ExecutionException e) {
            LOG.error("Shutdown: session teardown failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Shutdown interrupted");
        } finally {
            registry.clear();
        }
    }
}

package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.config.recognition.DeepgramProperties;
import com.phillippitts.livescribe.domain.RecognitionConfig;
import com.phillippitts.livescribe.exception.StreamClosedException;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.exception.UpstreamExceptionBuilder;
import com.phillippitts.livescribe.exception.UpstreamUnavailableException;
import com.phillippitts.livescribe.service.recognition.FragmentStream;
import com.phillippitts.livescribe.service.recognition.RecognitionClient;
import com.phillippitts.livescribe.service.recognition.RecognitionHandle;
import com.phillippitts.livescribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link RecognitionClient} for the Deepgram live endpoint.
 *
 * <p>Each handle is one outbound WebSocket authenticated with {@code Authorization: Token <key>}.
 * Audio is sent as binary frames; {@code {"type":"CloseStream"}} asks the provider to flush and
 * close. The provider drops streams that stay silent for about ten seconds, so idle handles get a
 * {@code {"type":"KeepAlive"}} message every {@code recognition.deepgram.keep-alive-interval}.
 *
 * <p>Handshake failures are classified from the HTTP status reported by the WebSocket container
 * (401/403 auth, 429 rate limit, 400 malformed request).
 *
 * @since 1.0
 */
public class DeepgramRecognitionClient implements RecognitionClient {

    private static final Logger LOG = LogManager.getLogger(DeepgramRecognitionClient.class);

    static final String PROVIDER_NAME = "deepgram";
    static final String CLOSE_STREAM = "{\"type\":\"CloseStream\"}";
    static final String KEEP_ALIVE = "{\"type\":\"KeepAlive\"}";

    private static final long KEEP_ALIVE_SWEEP_MS = 1_000;

    /** Tomcat reports a refused upgrade as "The HTTP response from the server [401] did not permit ...". */
    private static final Pattern HANDSHAKE_STATUS = Pattern.compile("\\[(\\d{3})]");

    private final DeepgramProperties properties;
    private final WebSocketClient webSocketClient;
    private final Set<DeepgramHandle> openHandles = ConcurrentHashMap.newKeySet();
    private volatile boolean credentialsRejected;

    public DeepgramRecognitionClient(DeepgramProperties properties, WebSocketClient webSocketClient) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.webSocketClient = Objects.requireNonNull(webSocketClient, "webSocketClient");
    }

    @Override
    public RecognitionHandle open(String sessionId, RecognitionConfig config) {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(config, "config");
        if (!properties.hasApiKey()) {
            throw UpstreamExceptionBuilder.create("Recognition provider API key not configured")
                    .provider(PROVIDER_NAME)
                    .kind(UpstreamErrorKind.AUTH_FAILURE)
                    .metadata("sessionId", sessionId)
                    .buildUnavailable();
        }

        URI uri = buildUri(config);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + properties.apiKey());

        DeepgramHandle handle = new DeepgramHandle(this, sessionId);
        long startTime = System.nanoTime();
        CompletableFuture<WebSocketSession> future =
                webSocketClient.execute(new DeepgramStreamHandler(handle), headers, uri);
        try {
            WebSocketSession session = future.get(properties.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
            handle.attach(new ConcurrentWebSocketSessionDecorator(session,
                    (int) properties.sendTimeLimit().toMillis(), properties.sendBufferLimit()));
            openHandles.add(handle);
            credentialsRejected = false;
            LOG.info("Upstream stream connected in {} ms (session={}, model={}, language={})",
                    TimeUtils.elapsedMillis(startTime), sessionId, config.model(), config.language());
            return handle;
        } catch (ExecutionException e) {
            throw handshakeFailure(sessionId, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            future.cancel(true);
            future.thenAccept(late -> closeQuietly(late, CloseStatus.GOING_AWAY, sessionId));
            throw UpstreamExceptionBuilder.create("Timed out connecting to recognition provider")
                    .provider(PROVIDER_NAME)
                    .kind(UpstreamErrorKind.TRANSIENT)
                    .metadata("sessionId", sessionId)
                    .metadata("timeoutMs", properties.connectTimeout().toMillis())
                    .cause(e)
                    .buildUnavailable();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw UpstreamExceptionBuilder.create("Interrupted while connecting to recognition provider")
                    .provider(PROVIDER_NAME)
                    .kind(UpstreamErrorKind.TRANSIENT)
                    .metadata("sessionId", sessionId)
                    .cause(e)
                    .buildUnavailable();
        }
    }

    @Override
    public void send(RecognitionHandle handle, byte[] chunk) {
        DeepgramHandle h = require(handle);
        Objects.requireNonNull(chunk, "chunk");
        if (!h.isOpen()) {
            throw new StreamClosedException(h.sessionId());
        }
        try {
            h.session().sendMessage(new BinaryMessage(chunk));
            h.touch();
        } catch (IOException | SessionLimitExceededException e) {
            UpstreamException failure = UpstreamExceptionBuilder.create("Failed to forward audio")
                    .provider(PROVIDER_NAME)
                    .kind(UpstreamErrorKind.TRANSIENT)
                    .metadata("sessionId", h.sessionId())
                    .metadata("bytes", chunk.length)
                    .cause(e)
                    .build();
            h.stream().fail(failure);
            throw failure;
        }
    }

    @Override
    public void close(RecognitionHandle handle) {
        DeepgramHandle h = require(handle);
        if (!h.markClosed()) {
            return;
        }
        WebSocketSession session = h.session();
        if (session == null || !session.isOpen()) {
            h.stream().complete();
            openHandles.remove(h);
            return;
        }
        try {
            session.sendMessage(new TextMessage(CLOSE_STREAM));
            LOG.debug("Requested upstream flush (session={})", h.sessionId());
        } catch (IOException | SessionLimitExceededException e) {
            LOG.warn("Failed to send CloseStream (session={}); aborting stream", h.sessionId(), e);
            abort(h);
        }
    }

    @Override
    public void abort(RecognitionHandle handle) {
        DeepgramHandle h = require(handle);
        h.markClosed();
        h.stream().complete();
        openHandles.remove(h);
        WebSocketSession session = h.session();
        if (session != null && session.isOpen()) {
            closeQuietly(session, CloseStatus.NORMAL, h.sessionId());
        }
    }

    @Override
    public FragmentStream events(RecognitionHandle handle) {
        return require(handle).stream();
    }

    @Override
    public String getProviderName() {
        return PROVIDER_NAME;
    }

    @Override
    public boolean isHealthy() {
        return properties.hasApiKey() && !credentialsRejected;
    }

    int openStreamCount() {
        return openHandles.size();
    }

    /**
     * Sends KeepAlive on every open stream that has not carried audio for the keep-alive interval.
     */
    @Scheduled(fixedDelay = KEEP_ALIVE_SWEEP_MS)
    public void sendKeepAlives() {
        openHandles.removeIf(h -> !h.isOpen());
        long intervalNanos = properties.keepAliveInterval().toNanos();
        for (DeepgramHandle h : openHandles) {
            if (h.idleNanos() < intervalNanos) {
                continue;
            }
            try {
                h.session().sendMessage(new TextMessage(KEEP_ALIVE));
                h.touch();
            } catch (IOException | SessionLimitExceededException e) {
                LOG.warn("KeepAlive failed (session={}): {}", h.sessionId(), e.getMessage());
            }
        }
    }

    URI buildUri(RecognitionConfig config) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.url())
                .queryParam("model", config.model())
                .queryParam("language", config.language())
                .queryParam("punctuate", config.punctuate())
                .queryParam("diarize", config.diarize())
                .queryParam("smart_format", config.smartFormat())
                .queryParam("interim_results", config.interimResults())
                .queryParam("endpointing", config.endpointingMs());
        if (config.encoding() != null) {
            builder.queryParam("encoding", config.encoding());
        }
        if (config.sampleRate() != null) {
            builder.queryParam("sample_rate", config.sampleRate());
        }
        if (config.channels() != null) {
            builder.queryParam("channels", config.channels());
        }
        return builder.encode().build().toUri();
    }

    private UpstreamUnavailableException handshakeFailure(String sessionId, Throwable cause) {
        UpstreamExceptionBuilder builder = UpstreamExceptionBuilder.create("Recognition provider refused connection")
                .provider(PROVIDER_NAME)
                .metadata("sessionId", sessionId)
                .cause(cause);
        Integer status = extractHandshakeStatus(cause);
        if (status != null) {
            builder.httpStatus(status);
        } else {
            builder.kind(UpstreamErrorKind.TRANSIENT);
        }
        UpstreamUnavailableException ex = builder.buildUnavailable();
        if (ex.getKind() == UpstreamErrorKind.AUTH_FAILURE) {
            credentialsRejected = true;
        }
        LOG.warn("Upstream connect failed (session={}, kind={}): {}", sessionId, ex.getKind(), cause.getMessage());
        return ex;
    }

    static Integer extractHandshakeStatus(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            Matcher m = HANDSHAKE_STATUS.matcher(message);
            if (m.find()) {
                return Integer.parseInt(m.group(1));
            }
        }
        return null;
    }

    private DeepgramHandle require(RecognitionHandle handle) {
        if (handle instanceof DeepgramHandle h && h.owner() == this) {
            return h;
        }
        throw new IllegalStateException("No recognition stream opened by this client for handle " + handle);
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status, String sessionId) {
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Failed to close upstream socket (session={})", sessionId, e);
        }
    }
}

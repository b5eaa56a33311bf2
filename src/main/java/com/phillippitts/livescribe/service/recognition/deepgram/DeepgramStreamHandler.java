package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.exception.UpstreamExceptionBuilder;
import com.phillippitts.livescribe.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Receives provider frames for one upstream stream and feeds its {@code FragmentStream}.
 *
 * <p>Empty transcripts are dropped. A normal close (1000) completes the stream; any other close
 * code, transport error, provider error message or unparseable frame fails it.
 */
final class DeepgramStreamHandler extends TextWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(DeepgramStreamHandler.class);

    private final DeepgramHandle handle;

    DeepgramStreamHandler(DeepgramHandle handle) {
        this.handle = handle;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        LOG.debug("Upstream stream opened (session={})", handle.sessionId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        DeepgramMessage parsed;
        try {
            parsed = DeepgramJsonParser.parse(message.getPayload());
        } catch (UpstreamException e) {
            LOG.warn("Rejecting upstream message (session={}): {}", handle.sessionId(), e.getMessage());
            handle.stream().fail(e);
            closeSession(session, CloseStatus.BAD_DATA);
            return;
        }

        switch (parsed.type()) {
            case RESULTS -> onResults(parsed);
            case METADATA -> handle.transcriptionId(parsed.requestId());
            case ERROR -> {
                LOG.warn("Provider reported error (session={}, kind={}): {}",
                        handle.sessionId(), parsed.errorKind(), parsed.error());
                handle.stream().fail(UpstreamExceptionBuilder.create("Provider error: " + parsed.error())
                        .provider(DeepgramRecognitionClient.PROVIDER_NAME)
                        .kind(parsed.errorKind())
                        .metadata("sessionId", handle.sessionId())
                        .build());
            }
            default -> LOG.trace("Ignoring upstream message (session={})", handle.sessionId());
        }
    }

    private void onResults(DeepgramMessage results) {
        if (results.text().isEmpty()) {
            return;
        }
        TranscriptFragment fragment = new TranscriptFragment(
                handle.sessionId(),
                results.text(),
                results.isFinal(),
                results.confidence(),
                handle.nextSequence(),
                results.words());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Fragment #{} final={} (session={}): '{}'", fragment.sequence(), fragment.isFinal(),
                    handle.sessionId(), LogSanitizer.preview(fragment.text()));
        }
        handle.stream().emit(fragment);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("Upstream transport error (session={}): {}", handle.sessionId(), exception.getMessage());
        handle.stream().fail(UpstreamExceptionBuilder.create("Upstream transport error")
                .provider(DeepgramRecognitionClient.PROVIDER_NAME)
                .kind(UpstreamErrorKind.TRANSIENT)
                .metadata("sessionId", handle.sessionId())
                .cause(exception)
                .build());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        if (status.getCode() == CloseStatus.NORMAL.getCode() || handle.isClosed()) {
            LOG.debug("Upstream stream closed (session={}, status={})", handle.sessionId(), status);
            handle.stream().complete();
            return;
        }
        LOG.warn("Upstream closed stream unexpectedly (session={}, status={})", handle.sessionId(), status);
        handle.stream().fail(UpstreamExceptionBuilder.create("Upstream closed stream")
                .provider(DeepgramRecognitionClient.PROVIDER_NAME)
                .closeCode(status.getCode())
                .metadata("reason", status.getReason())
                .metadata("sessionId", handle.sessionId())
                .build());
    }

    private void closeSession(WebSocketSession session, CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Failed to close upstream socket (session={})", handle.sessionId(), e);
        }
    }
}

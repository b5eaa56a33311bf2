package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class DeepgramStreamHandlerTest {

    private DeepgramHandle handle;
    private DeepgramStreamHandler handler;
    private WebSocketSession upstream;

    @BeforeEach
    void setUp() {
        DeepgramRecognitionClient client =
                new DeepgramRecognitionClient(DeepgramTestSupport.properties("dg-key"), mock(WebSocketClient.class));
        handle = new DeepgramHandle(client, "m1");
        handler = new DeepgramStreamHandler(handle);
        upstream = mock(WebSocketSession.class);
    }

    @Test
    void shouldEmitNonEmptyResultsWithIncreasingSequence() throws Exception {
        handler.handleMessage(upstream, results("hel", false));
        handler.handleMessage(upstream, results("", false));
        handler.handleMessage(upstream, results("hello", true));
        handler.afterConnectionClosed(upstream, CloseStatus.NORMAL);

        List<TranscriptFragment> fragments = drain();

        assertThat(fragments).extracting(TranscriptFragment::text).containsExactly("hel", "hello");
        assertThat(fragments).extracting(TranscriptFragment::sequence).containsExactly(1L, 2L);
        assertThat(fragments).extracting(TranscriptFragment::isFinal).containsExactly(false, true);
        assertThat(handle.stream().terminalError()).isEmpty();
    }

    @Test
    void shouldRecordTranscriptionIdFromMetadata() throws Exception {
        handler.handleMessage(upstream, new TextMessage("{\"type\":\"Metadata\",\"request_id\":\"req-9\"}"));

        assertThat(handle.transcriptionId()).contains("req-9");
    }

    @Test
    void shouldFailStreamAndCloseSocketOnMalformedFrame() throws Exception {
        handler.handleMessage(upstream, new TextMessage("{oops"));

        assertThat(handle.stream().terminalError()).hasValueSatisfying(e ->
                assertThat(e.getKind()).isEqualTo(UpstreamErrorKind.MALFORMED_PAYLOAD));
        verify(upstream).close(CloseStatus.BAD_DATA);
    }

    @Test
    void shouldFailStreamOnProviderError() throws Exception {
        handler.handleMessage(upstream, new TextMessage("{\"type\":\"Error\",\"message\":\"bad audio\"}"));

        assertThat(handle.stream().terminalError()).hasValueSatisfying(e ->
                assertThat(e.getMessage()).contains("bad audio"));
    }

    @Test
    void shouldCarryProviderErrorKindOntoStreamFailure() throws Exception {
        handler.handleMessage(upstream, new TextMessage(
                "{\"type\":\"Error\",\"err_code\":\"INVALID_AUTH\",\"description\":\"Invalid credentials\"}"));

        assertThat(handle.stream().terminalError()).hasValueSatisfying(e -> {
            assertThat(e.getKind()).isEqualTo(UpstreamErrorKind.AUTH_FAILURE);
            assertThat(e.getKind().isRetryable()).isFalse();
        });
    }

    @Test
    void shouldMapAbnormalCloseCodeToFailureKind() {
        handler.afterConnectionClosed(upstream, new CloseStatus(4029, "too many requests"));

        assertThat(handle.stream().terminalError()).hasValueSatisfying(e ->
                assertThat(e.getKind()).isEqualTo(UpstreamErrorKind.RATE_LIMITED));
    }

    @Test
    void shouldCompleteNormallyWhenClosedLocally() {
        handle.markClosed();

        handler.afterConnectionClosed(upstream, CloseStatus.SERVER_ERROR);

        assertThat(handle.stream().isEnded()).isTrue();
        assertThat(handle.stream().terminalError()).isEmpty();
    }

    @Test
    void shouldFailStreamOnTransportError() {
        handler.handleTransportError(upstream, new java.io.IOException("reset"));

        assertThat(handle.stream().terminalError()).hasValueSatisfying(e ->
                assertThat(e.getKind()).isEqualTo(UpstreamErrorKind.TRANSIENT));
    }

    private List<TranscriptFragment> drain() {
        List<TranscriptFragment> out = new ArrayList<>();
        handle.stream().forEach(out::add);
        return out;
    }

    private static TextMessage results(String transcript, boolean isFinal) {
        return new TextMessage("{\"type\":\"Results\",\"is_final\":" + isFinal
                + ",\"channel\":{\"alternatives\":[{\"transcript\":\"" + transcript + "\",\"confidence\":0.9}]}}");
    }
}

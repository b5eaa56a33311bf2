package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeepgramJsonParserTest {

    private static final String FINAL_RESULT = """
            {
              "type": "Results",
              "is_final": true,
              "channel": {
                "alternatives": [{
                  "transcript": " Hello, world. ",
                  "confidence": 0.98,
                  "words": [
                    {"word": "hello", "punctuated_word": "Hello,", "start": 0.1, "end": 0.4,
                     "confidence": 0.99, "speaker": 0},
                    {"word": "world", "start": 0.5, "end": 0.9, "confidence": 0.97, "speaker": 1}
                  ]
                }]
              }
            }
            """;

    @Test
    void shouldParseFinalResultWithWords() {
        DeepgramMessage msg = DeepgramJsonParser.parse(FINAL_RESULT);

        assertThat(msg.type()).isEqualTo(DeepgramMessage.Type.RESULTS);
        assertThat(msg.isFinal()).isTrue();
        assertThat(msg.text()).isEqualTo("Hello, world.");
        assertThat(msg.confidence()).isEqualTo(0.98);
        assertThat(msg.words()).extracting(w -> w.word()).containsExactly("Hello,", "world");
        assertThat(msg.words()).extracting(w -> w.speaker()).containsExactly(0, 1);
    }

    @Test
    void shouldTreatMissingAlternativesAsEmptyResult() {
        DeepgramMessage msg = DeepgramJsonParser.parse("{\"type\":\"Results\",\"is_final\":false,\"channel\":{}}");

        assertThat(msg.type()).isEqualTo(DeepgramMessage.Type.RESULTS);
        assertThat(msg.text()).isEmpty();
        assertThat(msg.isFinal()).isFalse();
    }

    @Test
    void shouldClampConfidenceIntoUnitRange() {
        DeepgramMessage msg = DeepgramJsonParser.parse(
                "{\"type\":\"Results\",\"channel\":{\"alternatives\":[{\"transcript\":\"x\",\"confidence\":1.7}]}}");

        assertThat(msg.confidence()).isEqualTo(1.0);
    }

    @Test
    void shouldParseMetadataRequestId() {
        DeepgramMessage msg = DeepgramJsonParser.parse("{\"type\":\"Metadata\",\"request_id\":\"req-77\"}");

        assertThat(msg.type()).isEqualTo(DeepgramMessage.Type.METADATA);
        assertThat(msg.requestId()).isEqualTo("req-77");
    }

    @Test
    void shouldParseErrorDescription() {
        DeepgramMessage msg = DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"description\":\"Insufficient credits\"}");

        assertThat(msg.type()).isEqualTo(DeepgramMessage.Type.ERROR);
        assertThat(msg.error()).isEqualTo("Insufficient credits");
    }

    @Test
    void shouldClassifyErrorFromProviderCode() {
        assertThat(DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"err_code\":\"INVALID_AUTH\",\"description\":\"Invalid credentials\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.AUTH_FAILURE);
        assertThat(DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"err_code\":\"TOO_MANY_REQUESTS\",\"description\":\"Slow down\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.RATE_LIMITED);
        assertThat(DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"variant\":\"DATA-0000\",\"description\":\"Payload not audio\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.MALFORMED_PAYLOAD);
        assertThat(DeepgramJsonParser.parse(
                "{\"type\":\"Error\",\"variant\":\"NET-0001\",\"description\":\"No audio received\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.TRANSIENT);
    }

    @Test
    void shouldClassifyErrorFromDescriptionWhenCodeIsMissing() {
        assertThat(DeepgramJsonParser.parse("{\"type\":\"Error\",\"description\":\"Rate limit exceeded\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.RATE_LIMITED);
        assertThat(DeepgramJsonParser.parse("{\"type\":\"Error\",\"description\":\"Insufficient credits\"}")
                .errorKind()).isEqualTo(UpstreamErrorKind.UNKNOWN);
    }

    @Test
    void shouldIgnoreUnknownMessageTypes() {
        assertThat(DeepgramJsonParser.parse("{\"type\":\"UtteranceEnd\"}").type())
                .isEqualTo(DeepgramMessage.Type.OTHER);
        assertThat(DeepgramJsonParser.parse("{\"type\":\"SpeechStarted\"}").type())
                .isEqualTo(DeepgramMessage.Type.OTHER);
    }

    @Test
    void shouldRejectInvalidJsonAsMalformedPayload() {
        assertThatThrownBy(() -> DeepgramJsonParser.parse("{not json"))
                .isInstanceOf(UpstreamException.class)
                .satisfies(e -> assertThat(((UpstreamException) e).getKind())
                        .isEqualTo(UpstreamErrorKind.MALFORMED_PAYLOAD));
    }

    @Test
    void shouldRejectEmptyFrame() {
        assertThatThrownBy(() -> DeepgramJsonParser.parse("  "))
                .isInstanceOf(UpstreamException.class);
    }

    @Test
    void shouldRejectOversizedFrame() {
        String huge = "{\"type\":\"Results\",\"pad\":\"" + "x".repeat(DeepgramJsonParser.MAX_JSON_SIZE) + "\"}";

        assertThatThrownBy(() -> DeepgramJsonParser.parse(huge))
                .isInstanceOf(UpstreamException.class)
                .hasMessageContaining("size cap");
    }
}

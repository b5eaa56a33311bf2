package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.domain.TranscriptWord;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OutboundEventTest {

    @Test
    void shouldSerializeEnvelope() {
        JSONObject json = new JSONObject(OutboundEvent.started("m1").toJson());

        assertThat(json.getString("event")).isEqualTo("stream:started");
        assertThat(json.getJSONObject("data").getString("sessionId")).isEqualTo("m1");
    }

    @Test
    void updateCarriesFragmentFieldsAndSpeaker() {
        TranscriptFragment fragment = new TranscriptFragment("m1", "hello", true, 0.8, 3,
                List.of(new TranscriptWord("hello", 0.0, 0.4, 0.8, 2)));

        JSONObject data = new JSONObject(OutboundEvent.update(fragment).toJson()).getJSONObject("data");

        assertThat(data.getString("text")).isEqualTo("hello");
        assertThat(data.getBoolean("isFinal")).isTrue();
        assertThat(data.getDouble("confidence")).isEqualTo(0.8);
        assertThat(data.getLong("sequence")).isEqualTo(3L);
        assertThat(data.getInt("speaker")).isEqualTo(2);
    }

    @Test
    void updateOmitsSpeakerWithoutDiarization() {
        OutboundEvent event = OutboundEvent.update(TranscriptFragment.interim("m1", "hel", 0.4, 1));

        assertThat(event.data()).doesNotContainKey("speaker");
    }

    @Test
    void stoppedDefaultsNullTranscriptToEmpty() {
        assertThat(OutboundEvent.stopped("m1", null).data()).containsEntry("transcript", "");
    }

    @Test
    void errorCarriesStableCodeWithoutSessionWhenAbsent() {
        OutboundEvent event = OutboundEvent.error(StreamErrorReason.MALFORMED_EVENT, null);

        assertThat(event.isError()).isTrue();
        assertThat(event.data())
                .containsEntry("code", "MALFORMED_EVENT")
                .containsEntry("message", "malformed event")
                .doesNotContainKey("sessionId");
    }

    @Test
    void upstreamErrorNamesKindAndRetryability() {
        UpstreamException cause = new UpstreamException(UpstreamErrorKind.RATE_LIMITED, "slow down");

        OutboundEvent event = OutboundEvent.upstreamError(StreamErrorReason.START_FAILED, "m1", cause);

        assertThat(event.data())
                .containsEntry("code", "UPSTREAM_RATE_LIMITED")
                .containsEntry("retryable", true)
                .containsEntry("sessionId", "m1");
        assertThat(event.data().get("message").toString()).doesNotContain("slow down");
    }
}

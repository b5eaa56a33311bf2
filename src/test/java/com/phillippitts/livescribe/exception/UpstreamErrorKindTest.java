package com.phillippitts.livescribe.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UpstreamErrorKindTest {

    @Test
    void shouldMapHandshakeStatuses() {
        assertThat(UpstreamErrorKind.fromHttpStatus(401)).isEqualTo(UpstreamErrorKind.AUTH_FAILURE);
        assertThat(UpstreamErrorKind.fromHttpStatus(403)).isEqualTo(UpstreamErrorKind.AUTH_FAILURE);
        assertThat(UpstreamErrorKind.fromHttpStatus(429)).isEqualTo(UpstreamErrorKind.RATE_LIMITED);
        assertThat(UpstreamErrorKind.fromHttpStatus(400)).isEqualTo(UpstreamErrorKind.MALFORMED_PAYLOAD);
        assertThat(UpstreamErrorKind.fromHttpStatus(502)).isEqualTo(UpstreamErrorKind.TRANSIENT);
        assertThat(UpstreamErrorKind.fromHttpStatus(302)).isEqualTo(UpstreamErrorKind.UNKNOWN);
    }

    @Test
    void shouldMapCloseCodes() {
        assertThat(UpstreamErrorKind.fromCloseCode(1008)).isEqualTo(UpstreamErrorKind.MALFORMED_PAYLOAD);
        assertThat(UpstreamErrorKind.fromCloseCode(4001)).isEqualTo(UpstreamErrorKind.AUTH_FAILURE);
        assertThat(UpstreamErrorKind.fromCloseCode(1011)).isEqualTo(UpstreamErrorKind.TRANSIENT);
        assertThat(UpstreamErrorKind.fromCloseCode(1006)).isEqualTo(UpstreamErrorKind.TRANSIENT);
    }

    @Test
    void shouldOnlyRetryTransientAndRateLimited() {
        assertThat(UpstreamErrorKind.TRANSIENT.isRetryable()).isTrue();
        assertThat(UpstreamErrorKind.RATE_LIMITED.isRetryable()).isTrue();
        assertThat(UpstreamErrorKind.AUTH_FAILURE.isRetryable()).isFalse();
        assertThat(UpstreamErrorKind.MALFORMED_PAYLOAD.isRetryable()).isFalse();
        assertThat(UpstreamErrorKind.UNKNOWN.isRetryable()).isFalse();
    }
}

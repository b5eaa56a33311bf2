package com.phillippitts.livescribe.service.recognition;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FragmentStreamTest {

    @Test
    void shouldYieldFragmentsInEmitOrderThenEnd() {
        FragmentStream stream = new FragmentStream("m1");
        stream.emit(TranscriptFragment.interim("m1", "a", 0.5, 1));
        stream.emit(TranscriptFragment.finalFragment("m1", "ab", 0.9, 2));
        stream.complete();

        List<String> texts = new ArrayList<>();
        for (TranscriptFragment f : stream) {
            texts.add(f.text());
        }

        assertThat(texts).containsExactly("a", "ab");
        assertThat(stream.terminalError()).isEmpty();
    }

    @Test
    void shouldIgnoreEmitsAfterEnd() {
        FragmentStream stream = new FragmentStream("m1");
        stream.complete();

        boolean queued = stream.emit(TranscriptFragment.interim("m1", "late", 0.5, 1));

        assertThat(queued).isFalse();
        assertThat(stream.iterator().hasNext()).isFalse();
    }

    @Test
    void shouldExposeTerminalErrorAfterFailure() {
        FragmentStream stream = new FragmentStream("m1");
        UpstreamException error = new UpstreamException(UpstreamErrorKind.RATE_LIMITED, "slow down");

        stream.fail(error);
        stream.complete();

        assertThat(stream.isEnded()).isTrue();
        assertThat(stream.terminalError()).containsSame(error);
    }

    @Test
    void shouldBeConsumableOnlyOnce() {
        FragmentStream stream = new FragmentStream("m1");
        stream.iterator();

        assertThatThrownBy(stream::iterator)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already consumed");
    }

    @Test
    void shouldBlockConsumerUntilFragmentArrives() throws Exception {
        FragmentStream stream = new FragmentStream("m1");
        CompletableFuture<List<String>> consumer = CompletableFuture.supplyAsync(() -> {
            List<String> seen = new ArrayList<>();
            stream.forEach(f -> seen.add(f.text()));
            return seen;
        });

        stream.emit(TranscriptFragment.finalFragment("m1", "later", 0.9, 1));
        stream.complete();

        assertThat(consumer.get(2, TimeUnit.SECONDS)).containsExactly("later");
    }
}

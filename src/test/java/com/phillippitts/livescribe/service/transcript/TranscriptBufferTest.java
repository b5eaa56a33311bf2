package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptBufferTest {

    @Test
    void shouldJoinFinalsWithSingleSpaceInAppendOrder() {
        TranscriptBuffer buffer = new TranscriptBuffer();

        buffer.append(TranscriptFragment.finalFragment("m1", "Hello there.", 0.9, 1));
        buffer.append(TranscriptFragment.finalFragment("m1", "How are you?", 0.9, 3));

        assertThat(buffer.joined()).isEqualTo("Hello there. How are you?");
        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    void shouldBeEmptyInitially() {
        TranscriptBuffer buffer = new TranscriptBuffer();

        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.joined()).isEmpty();
    }

    @Test
    void shouldRejectInterimFragments() {
        TranscriptBuffer buffer = new TranscriptBuffer();

        assertThatThrownBy(() -> buffer.append(TranscriptFragment.interim("m1", "hel", 0.3, 1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(buffer.isEmpty()).isTrue();
    }

    @Test
    void shouldExposeReadOnlyView() {
        TranscriptBuffer buffer = new TranscriptBuffer();
        buffer.append(TranscriptFragment.finalFragment("m1", "a", 0.9, 1));

        assertThatThrownBy(() -> buffer.fragments().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}

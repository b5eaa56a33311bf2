package com.phillippitts.livescribe.service.transcript;

import com.phillippitts.livescribe.domain.TranscriptFragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered accumulation of the final fragments of one session.
 *
 * <p>Only final fragments are accepted; interim fragments are broadcast but never buffered.
 * The buffer is exclusively owned by its session and is only touched while the session lock is
 * held, so it carries no synchronization of its own.
 *
 * @since 1.0
 */
public final class TranscriptBuffer {

    private final List<TranscriptFragment> fragments = new ArrayList<>();

    /**
     * Appends a final fragment.
     *
     * @param fragment final fragment (must not be null)
     * @throws IllegalArgumentException if the fragment is interim
     */
    public void append(TranscriptFragment fragment) {
        Objects.requireNonNull(fragment, "fragment must not be null");
        if (!fragment.isFinal()) {
            throw new IllegalArgumentException(
                    "Only final fragments are buffered (sequence=" + fragment.sequence() + ")");
        }
        fragments.add(fragment);
    }

    /**
     * @return read-only view of the buffered fragments in append order
     */
    List<TranscriptFragment> fragments() {
        return Collections.unmodifiableList(fragments);
    }

    /**
     * Joins the text of all final fragments with single spaces, in append order.
     *
     * @return joined transcript, empty when nothing was buffered
     */
    public String joined() {
        List<String> texts = new ArrayList<>(fragments.size());
        for (TranscriptFragment f : fragments) {
            texts.add(f.text());
        }
        return String.join(" ", texts);
    }

    public int size() {
        return fragments.size();
    }

    boolean isEmpty() {
        return fragments.isEmpty();
    }
}

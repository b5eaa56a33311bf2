package com.phillippitts.livescribe.service.recognition;

import com.phillippitts.livescribe.domain.RecognitionConfig;
import com.phillippitts.livescribe.exception.StreamClosedException;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.exception.UpstreamUnavailableException;

/**
 * Streaming speech-recognition backend.
 *
 * <p>One {@link RecognitionHandle} per session. Audio goes in through {@link #send}; fragments
 * come out through the {@link FragmentStream} returned by {@link #events}, in provider order.
 *
 * <p><b>Lifecycle:</b>
 * <pre>
 * open → send* → close → (stream drains and ends) → abort (only if drain timed out)
 * </pre>
 *
 * <p>Implementations must be thread-safe: {@code send} runs on connection threads while the
 * stream is consumed on a pump thread.
 *
 * @since 1.0
 */
public interface RecognitionClient {

    /**
     * Opens an upstream stream. Blocks until the provider accepted it or the connect timeout
     * elapsed.
     *
     * @param sessionId owning session
     * @param config    recognition settings
     * @return open handle
     * @throws UpstreamUnavailableException if the provider could not be reached or refused
     */
    RecognitionHandle open(String sessionId, RecognitionConfig config);

    /**
     * Forwards one audio chunk.
     *
     * @throws StreamClosedException if the handle has been closed
     * @throws IllegalStateException if the handle is null or was not issued by this client
     * @throws UpstreamException     if the chunk could not be written to the provider
     */
    void send(RecognitionHandle handle, byte[] chunk);

    /**
     * Asks the provider to flush pending results and finish. Idempotent. The fragment stream
     * ends once the provider has delivered its last result.
     */
    void close(RecognitionHandle handle);

    /**
     * Releases the handle immediately, ending the fragment stream without waiting for the
     * provider. Idempotent.
     */
    void abort(RecognitionHandle handle);

    /**
     * @return the single-use fragment stream of {@code handle}
     * @throws IllegalStateException if the handle is null or was not issued by this client
     */
    FragmentStream events(RecognitionHandle handle);

    String getProviderName();

    /**
     * @return {@code true} if the client is configured and its last connection attempt was not
     *         rejected for credentials
     */
    boolean isHealthy();
}

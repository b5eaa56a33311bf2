package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.TranscriptFragment;
import com.phillippitts.livescribe.exception.UpstreamException;
import org.json.JSONObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Server-to-client event. Serialized as {@code {"event": name, "data": {...}}}.
 *
 * @param name event name ({@code stream:started}, {@code transcription:update}, ...)
 * @param data payload fields
 */
public record OutboundEvent(String name, Map<String, Object> data) {

    public static final String STARTED = "stream:started";
    public static final String JOINED = "stream:joined";
    public static final String UPDATE = "transcription:update";
    public static final String STOPPED = "stream:stopped";
    public static final String ERROR = "stream:error";

    public OutboundEvent {
        Objects.requireNonNull(name, "name");
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static OutboundEvent started(String sessionId) {
        return new OutboundEvent(STARTED, Map.of("sessionId", sessionId));
    }

    public static OutboundEvent joined(String sessionId) {
        return new OutboundEvent(JOINED, Map.of("sessionId", sessionId));
    }

    public static OutboundEvent update(TranscriptFragment fragment) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", fragment.sessionId());
        data.put("text", fragment.text());
        data.put("isFinal", fragment.isFinal());
        data.put("confidence", fragment.confidence());
        data.put("sequence", fragment.sequence());
        Integer speaker = fragment.speaker();
        if (speaker != null) {
            data.put("speaker", speaker);
        }
        return new OutboundEvent(UPDATE, data);
    }

    public static OutboundEvent stopped(String sessionId, String transcript) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessionId", sessionId);
        data.put("transcript", transcript == null ? "" : transcript);
        return new OutboundEvent(STOPPED, data);
    }

    /**
     * @param reason    stable reason
     * @param sessionId affected session (may be null)
     */
    public static OutboundEvent error(StreamErrorReason reason, String sessionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", reason.message());
        data.put("code", reason.code());
        if (sessionId != null) {
            data.put("sessionId", sessionId);
        }
        return new OutboundEvent(ERROR, data);
    }

    /**
     * Error caused by the recognition provider. The code names the failure kind
     * ({@code UPSTREAM_RATE_LIMITED}) and {@code retryable} tells the client whether a fresh
     * {@code stream:start} may succeed.
     */
    public static OutboundEvent upstreamError(StreamErrorReason reason, String sessionId, UpstreamException cause) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("message", reason.message());
        data.put("code", "UPSTREAM_" + cause.getKind().name());
        data.put("retryable", cause.isRetryable());
        if (sessionId != null) {
            data.put("sessionId", sessionId);
        }
        return new OutboundEvent(ERROR, data);
    }

    public boolean isError() {
        return ERROR.equals(name);
    }

    public String toJson() {
        return new JSONObject()
                .put("event", name)
                .put("data", new JSONObject(data))
                .toString();
    }
}

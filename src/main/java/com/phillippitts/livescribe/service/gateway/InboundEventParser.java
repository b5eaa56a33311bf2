package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.StreamOptions;
import com.phillippitts.livescribe.exception.ProtocolMisuseException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Base64;

/**
 * Decodes inbound JSON text frames of the form {@code {"event": "...", "data": {...}}}.
 *
 * <p>Structural problems (invalid JSON, missing {@code sessionId}, bad base64, non-positive
 * sample rate) raise {@link ProtocolMisuseException}. An event name this server does not know is
 * not an error here: it decodes to {@link InboundEvent.Type#UNKNOWN} so the caller can answer it
 * with its own reason.
 */
public final class InboundEventParser {

    private InboundEventParser() {
    }

    public static InboundEvent parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ProtocolMisuseException("Empty frame");
        }
        try {
            JSONObject root = new JSONObject(text);
            String name = root.optString("event", "");
            if (name.isEmpty()) {
                throw new ProtocolMisuseException("Missing event name");
            }
            InboundEvent.Type type = InboundEvent.Type.fromEventName(name);
            JSONObject data = root.optJSONObject("data");
            if (data == null) {
                data = new JSONObject();
            }
            return switch (type) {
                case START -> new InboundEvent(type, name, requireSessionId(data), parseOptions(data), null);
                case AUDIO -> new InboundEvent(type, name, requireSessionId(data), null, decodeAudio(data));
                case STOP, JOIN -> new InboundEvent(type, name, requireSessionId(data), null, null);
                case LEAVE -> new InboundEvent(type, name, null, null, null);
                case UNKNOWN -> InboundEvent.unknown(name);
            };
        } catch (JSONException e) {
            throw new ProtocolMisuseException("Invalid JSON frame", e);
        }
    }

    private static String requireSessionId(JSONObject data) {
        Object raw = data.opt("sessionId");
        if (raw == null || raw == JSONObject.NULL) {
            throw new ProtocolMisuseException("Missing sessionId");
        }
        String id = String.valueOf(raw).trim();
        if (id.isEmpty()) {
            throw new ProtocolMisuseException("Missing sessionId");
        }
        return id;
    }

    private static StreamOptions parseOptions(JSONObject data) {
        try {
            return new StreamOptions(
                    optInt(data, "sampleRate"),
                    optString(data, "encoding"),
                    optInt(data, "channels"),
                    optString(data, "language"),
                    optString(data, "model"));
        } catch (IllegalArgumentException e) {
            throw new ProtocolMisuseException("Invalid stream options: " + e.getMessage(), e);
        }
    }

    private static byte[] decodeAudio(JSONObject data) {
        String encoded = data.optString("audio", "");
        if (encoded.isEmpty()) {
            throw new ProtocolMisuseException("Missing audio");
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new ProtocolMisuseException("Audio is not valid base64", e);
        }
    }

    private static Integer optInt(JSONObject data, String key) {
        if (!data.has(key) || data.isNull(key)) {
            return null;
        }
        return data.getInt(key);
    }

    private static String optString(JSONObject data, String key) {
        if (!data.has(key) || data.isNull(key)) {
            return null;
        }
        String v = data.getString(key).trim();
        return v.isEmpty() ? null : v;
    }
}

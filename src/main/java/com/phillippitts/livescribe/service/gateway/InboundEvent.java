package com.phillippitts.livescribe.service.gateway;

import com.phillippitts.livescribe.domain.StreamOptions;

import java.util.Objects;

/**
 * Client-to-server event decoded from a JSON text frame.
 *
 * @param type      event type
 * @param name      event name as sent by the client
 * @param sessionId target session (null for {@code stream:leave} and unknown events)
 * @param options   stream options for {@code stream:start}, {@link StreamOptions#none()} otherwise
 * @param audio     decoded audio for {@code stream:audio}, empty otherwise
 */
public record InboundEvent(Type type, String name, String sessionId, StreamOptions options, byte[] audio) {

    private static final byte[] NO_AUDIO = new byte[0];

    public enum Type {
        START("stream:start"),
        AUDIO("stream:audio"),
        STOP("stream:stop"),
        JOIN("stream:join"),
        LEAVE("stream:leave"),
        UNKNOWN(null);

        private final String eventName;

        Type(String eventName) {
            this.eventName = eventName;
        }

        public String eventName() {
            return eventName;
        }

        static Type fromEventName(String name) {
            for (Type t : values()) {
                if (t.eventName != null && t.eventName.equals(name)) {
                    return t;
                }
            }
            return UNKNOWN;
        }
    }

    public InboundEvent {
        Objects.requireNonNull(type, "type");
        options = options == null ? StreamOptions.none() : options;
        audio = audio == null ? NO_AUDIO : audio;
    }

    static InboundEvent unknown(String name) {
        return new InboundEvent(Type.UNKNOWN, name, null, null, null);
    }
}

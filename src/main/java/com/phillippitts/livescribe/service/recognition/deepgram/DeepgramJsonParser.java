package com.phillippitts.livescribe.service.recognition.deepgram;

import com.phillippitts.livescribe.domain.TranscriptWord;
import com.phillippitts.livescribe.exception.UpstreamErrorKind;
import com.phillippitts.livescribe.exception.UpstreamException;
import com.phillippitts.livescribe.exception.UpstreamExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses Deepgram live JSON messages.
 *
 * <p>Handled message types:
 * <ul>
 *   <li><b>Results:</b> {@code {"type":"Results","is_final":true,"channel":{"alternatives":[{"transcript":"...",
 *       "confidence":0.98,"words":[...]}]}}}</li>
 *   <li><b>Metadata:</b> {@code {"type":"Metadata","request_id":"..."}}</li>
 *   <li><b>Error:</b> {@code {"type":"Error","err_code":"...","description":"..."}}</li>
 * </ul>
 *
 * <p>Thread-safe: all methods are static and stateless.
 *
 * <p><b>Security:</b> messages larger than {@link #MAX_JSON_SIZE} (1MB) are rejected as
 * {@link UpstreamErrorKind#MALFORMED_PAYLOAD} without being parsed.
 *
 * @since 1.0
 */
final class DeepgramJsonParser {

    static final int MAX_JSON_SIZE = 1_048_576; // 1MB

    private DeepgramJsonParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses one text frame.
     *
     * @param json frame payload
     * @return parsed message
     * @throws UpstreamException with kind MALFORMED_PAYLOAD for oversized or invalid JSON
     */
    static DeepgramMessage parse(String json) {
        if (json == null || json.isBlank()) {
            throw malformed("Empty message from provider", null);
        }
        if (json.length() > MAX_JSON_SIZE) {
            throw UpstreamExceptionBuilder.create("Provider message exceeds size cap")
                    .provider(DeepgramRecognitionClient.PROVIDER_NAME)
                    .kind(UpstreamErrorKind.MALFORMED_PAYLOAD)
                    .metadata("bytes", json.length())
                    .metadata("cap", MAX_JSON_SIZE)
                    .build();
        }
        try {
            JSONObject obj = new JSONObject(json);
            String type = obj.optString("type", "");
            return switch (type) {
                case "Results" -> parseResults(obj);
                case "Metadata" -> DeepgramMessage.metadata(obj.optString("request_id", null));
                case "Error" -> DeepgramMessage.error(describeError(obj), classifyError(obj));
                default -> DeepgramMessage.other();
            };
        } catch (JSONException e) {
            throw malformed("Unparseable message from provider", e);
        }
    }

    private static DeepgramMessage parseResults(JSONObject obj) {
        boolean isFinal = obj.optBoolean("is_final", false);
        JSONObject channel = obj.optJSONObject("channel");
        JSONArray alternatives = channel != null ? channel.optJSONArray("alternatives") : null;
        if (alternatives == null || alternatives.isEmpty()) {
            return DeepgramMessage.results("", isFinal, 0.0, List.of());
        }
        JSONObject first = alternatives.getJSONObject(0);
        String text = first.optString("transcript", "").trim();
        double confidence = clamp(first.optDouble("confidence", 0.0));
        return DeepgramMessage.results(text, isFinal, confidence, parseWords(first.optJSONArray("words")));
    }

    private static List<TranscriptWord> parseWords(JSONArray words) {
        if (words == null || words.isEmpty()) {
            return List.of();
        }
        List<TranscriptWord> result = new ArrayList<>(words.length());
        for (int i = 0; i < words.length(); i++) {
            JSONObject w = words.getJSONObject(i);
            String word = w.optString("punctuated_word", w.optString("word", ""));
            Integer speaker = w.has("speaker") ? w.getInt("speaker") : null;
            result.add(new TranscriptWord(word,
                    w.optDouble("start", 0.0),
                    w.optDouble("end", 0.0),
                    clamp(w.optDouble("confidence", 0.0)),
                    speaker));
        }
        return result;
    }

    private static String describeError(JSONObject obj) {
        String description = obj.optString("description", "");
        if (description.isEmpty()) {
            description = obj.optString("message", "provider error");
        }
        return description;
    }

    /**
     * Classifies a provider error from its {@code err_code} (or {@code variant}), falling back to
     * the description text. Deepgram reports decode failures as {@code DATA-*} and network
     * problems as {@code NET-*}.
     */
    static UpstreamErrorKind classifyError(JSONObject obj) {
        String code = obj.optString("err_code", obj.optString("variant", "")).toUpperCase(Locale.ROOT);
        UpstreamErrorKind kind = classifyErrorText(code);
        if (kind != UpstreamErrorKind.UNKNOWN) {
            return kind;
        }
        return classifyErrorText(describeError(obj).toUpperCase(Locale.ROOT));
    }

    private static UpstreamErrorKind classifyErrorText(String text) {
        if (text.isEmpty()) {
            return UpstreamErrorKind.UNKNOWN;
        }
        if (text.contains("AUTH") || text.contains("PERMISSION") || text.contains("CREDENTIAL")
                || text.contains("API KEY")) {
            return UpstreamErrorKind.AUTH_FAILURE;
        }
        if (text.contains("RATE_LIMIT") || text.contains("RATE LIMIT") || text.contains("TOO_MANY")
                || text.contains("TOO MANY") || text.contains("429")) {
            return UpstreamErrorKind.RATE_LIMITED;
        }
        if (text.startsWith("DATA-") || text.contains("DECODE") || text.contains("UNSUPPORTED")
                || text.contains("BAD_REQUEST") || text.contains("MALFORMED") || text.contains("INVALID")) {
            return UpstreamErrorKind.MALFORMED_PAYLOAD;
        }
        if (text.startsWith("NET-") || text.contains("TIMEOUT") || text.contains("UNAVAILABLE")) {
            return UpstreamErrorKind.TRANSIENT;
        }
        return UpstreamErrorKind.UNKNOWN;
    }

    private static double clamp(double raw) {
        if (Double.isNaN(raw)) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, raw));
    }

    private static UpstreamException malformed(String message, Throwable cause) {
        return UpstreamExceptionBuilder.create(message)
                .provider(DeepgramRecognitionClient.PROVIDER_NAME)
                .kind(UpstreamErrorKind.MALFORMED_PAYLOAD)
                .cause(cause)
                .build();
    }
}

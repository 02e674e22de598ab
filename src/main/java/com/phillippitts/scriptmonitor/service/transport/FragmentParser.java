package com.phillippitts.scriptmonitor.service.transport;

import com.phillippitts.scriptmonitor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Extracts the transcript fragment from a frame payload of the form {@code {"text": "..."}}.
 *
 * <p>Malformed payloads are logged and yield no fragment; they never end the connection.
 */
public final class FragmentParser {

    private static final Logger LOG = LogManager.getLogger(FragmentParser.class);

    static final String TEXT_FIELD = "text";

    private FragmentParser() {
    }

    /**
     * @param payload raw payload text
     * @return trimmed {@code text} value, or empty if the payload is not JSON or the text is blank
     */
    public static Optional<String> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(payload);
            String text = obj.optString(TEXT_FIELD, "").trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (JSONException e) {
            LOG.warn("Failed to parse fragment payload: {} ({})", LogSanitizer.preview(payload, 80), e.getMessage());
            return Optional.empty();
        }
    }
}

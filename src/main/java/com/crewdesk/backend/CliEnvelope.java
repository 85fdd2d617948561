package com.crewdesk.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unwraps the JSON envelope an agent CLI prints with {@code --output-format json}.
 */
public final class CliEnvelope {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CliEnvelope() {}

    /**
     * @return the envelope's {@code result} or {@code text} field, or the raw
     *         output when it is not such an envelope
     */
    public static String extractText(String raw) {
        if (raw == null) return "";
        String trimmed = raw.trim();
        if (!trimmed.startsWith("{")) return trimmed;
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            if (node.hasNonNull("result") && node.get("result").isTextual()) {
                return node.get("result").asText();
            }
            if (node.hasNonNull("text") && node.get("text").isTextual()) {
                return node.get("text").asText();
            }
        } catch (Exception e) {
            // not an envelope
        }
        return trimmed;
    }
}

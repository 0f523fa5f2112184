package io.planbridge.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.planbridge.core.response.JsonDecoder;
import io.planbridge.core.response.JsonDecodingException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Jackson-backed {@link JsonDecoder}.
///
/// Models often wrap JSON in Markdown code fences; the decoder strips a ````json` or
/// plain ````` fence before reading. Only JSON objects are accepted: arrays, scalars and
/// invalid text fail with {@link JsonDecodingException}. Field order is preserved.
///
/// Thread-safe as long as the supplied {@link ObjectMapper} is not reconfigured.
public class JacksonJsonDecoder implements JsonDecoder {

    private final ObjectMapper mapper;

    public JacksonJsonDecoder() {
        this(PlanbridgeMapper.createMapper());
    }

    public JacksonJsonDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public Map<String, Object> decode(String text) throws JsonDecodingException {
        Objects.requireNonNull(text, "text must not be null");
        String json = extractJson(text);
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JsonDecodingException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new JsonDecodingException(
                    "Expected a JSON object but got "
                            + (node == null || node.isMissingNode()
                                    ? "no content"
                                    : node.getNodeType().name().toLowerCase(Locale.ROOT)));
        }
        return mapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    static String extractJson(String content) {
        String trimmed = content.strip();

        if (trimmed.contains("```json")) {
            int start = trimmed.indexOf("```json") + 7;
            int end = trimmed.indexOf("```", start);
            if (end > start) {
                return trimmed.substring(start, end).trim();
            }
        }

        if (trimmed.startsWith("```")) {
            int start = trimmed.indexOf('\n');
            int end = trimmed.lastIndexOf("```");
            if (start >= 0 && end > start) {
                return trimmed.substring(start + 1, end).trim();
            }
        }

        return trimmed;
    }
}

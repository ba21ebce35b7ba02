package com.agentflow.core.invoker;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw model text into a task's structured output.
 * <p>
 * A JSON object (optionally inside a markdown code fence) becomes the output
 * map. Anything else is wrapped as {@code {"result": ...}}: other JSON values
 * keep their parsed form, unparsable text is kept verbatim. Never throws.
 */
public final class TaskOutputParser {

    private static final Logger log = LoggerFactory.getLogger(TaskOutputParser.class);

    static final String RESULT_KEY = "result";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private TaskOutputParser() {}

    public static Map<String, Object> parse(String raw) {
        if (raw == null) {
            return wrap(null);
        }
        String cleaned = stripCodeFence(raw.trim());
        try {
            JsonNode node = MAPPER.readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                return wrap(raw);
            }
            if (node.isObject()) {
                return MAPPER.convertValue(node, MAP_TYPE);
            }
            return wrap(MAPPER.convertValue(node, Object.class));
        } catch (Exception e) {
            log.debug("Output is not JSON, wrapping as text: {}", e.getMessage());
            return wrap(raw);
        }
    }

    private static Map<String, Object> wrap(Object value) {
        var wrapped = new LinkedHashMap<String, Object>();
        wrapped.put(RESULT_KEY, value);
        return wrapped;
    }

    private static String stripCodeFence(String text) {
        String cleaned = text;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        } else {
            return text;
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}

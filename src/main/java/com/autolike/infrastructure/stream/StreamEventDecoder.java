package com.autolike.infrastructure.stream;

import com.autolike.domain.exception.StreamEventValidationException;
import com.autolike.domain.model.StreamEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Typed decode of one stream line.
 *
 * Blank lines are keep-alives and lines carrying only {@code errors} are
 * operational notices; both yield no event. Anything else must be a post with
 * textual {@code id}, {@code text} and {@code source}, or it is rejected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StreamEventDecoder {

    private final ObjectMapper objectMapper;

    public Optional<StreamEvent> decode(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new StreamEventValidationException("Stream line is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new StreamEventValidationException("Stream line is not a JSON object");
        }

        JsonNode data = root.get("data");
        if (data == null && root.has("errors")) {
            log.warn("Stream notice: {}", root.get("errors"));
            return Optional.empty();
        }
        if (data == null || !data.isObject()) {
            throw new StreamEventValidationException("Stream line has no 'data' object");
        }

        return Optional.of(StreamEvent.builder()
                .id(requireText(data, "id"))
                .text(requireText(data, "text"))
                .source(requireText(data, "source"))
                .build());
    }

    private static String requireText(JsonNode data, String field) {
        JsonNode value = data.get(field);
        if (value == null || !value.isTextual()) {
            throw new StreamEventValidationException("Post field '" + field + "' is missing or not a string");
        }
        if ("id".equals(field) && value.asText().isBlank()) {
            throw new StreamEventValidationException("Post field 'id' is blank");
        }
        return value.asText();
    }
}

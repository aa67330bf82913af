package com.github.feedflow.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.feedflow.exception.ExtractionException;
import com.github.feedflow.model.CandidateFormat;
import com.github.feedflow.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Reads the single JSON document printed by {@code --dump-single-json}.
 */
@Component
@RequiredArgsConstructor
public class YtDlpOutputParser {

    private final ObjectMapper objectMapper;

    public ExtractionResult parse(String videoId, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionException("Extraction tool returned malformed JSON", e, videoId,
                    ExtractionException.Reason.TOOL_ERROR);
        }

        if (root == null || !root.isObject()) {
            throw new ExtractionException("Extraction tool returned no metadata", videoId,
                    ExtractionException.Reason.TOOL_ERROR);
        }

        ExtractionResult.ExtractionResultBuilder builder = ExtractionResult.builder()
                .videoId(text(root, "id", videoId))
                .title(text(root, "title", ""))
                .thumbnailUrl(text(root, "thumbnail", ""))
                .durationSeconds(root.path("duration").asLong(0));

        JsonNode formats = root.path("formats");
        if (formats.isArray()) {
            for (JsonNode format : formats) {
                builder.format(toFormat(format));
            }
        }

        return builder.build();
    }

    private CandidateFormat toFormat(JsonNode node) {
        Long filesize = longOrNull(node, "filesize");
        if (filesize == null) {
            filesize = longOrNull(node, "filesize_approx");
        }

        return CandidateFormat.builder()
                .formatId(text(node, "format_id", null))
                .ext(text(node, "ext", null))
                .vcodec(text(node, "vcodec", null))
                .acodec(text(node, "acodec", null))
                .width(intOrNull(node, "width"))
                .height(intOrNull(node, "height"))
                .fps(doubleOrNull(node, "fps"))
                .abr(doubleOrNull(node, "abr"))
                .url(text(node, "url", null))
                .filesize(filesize)
                .formatNote(text(node, "format_note", null))
                .build();
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : fallback;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asInt() : null;
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}

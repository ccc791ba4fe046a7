package dev.interviewresearch.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads JSON objects out of completion text. Models sometimes wrap the object in markdown
 * fences or a sentence of prose; those wrappers are stripped and the parse is tried once more.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonResponseParser {

    private final ObjectMapper objectMapper;

    public Optional<JsonNode> parse(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }

        Optional<JsonNode> direct = readObject(content);
        if (direct.isPresent()) {
            return direct;
        }

        String normalized = stripWrapping(content);
        if (!normalized.equals(content.trim())) {
            Optional<JsonNode> retried = readObject(normalized);
            if (retried.isPresent()) {
                log.debug("Parsed completion JSON after stripping wrapper");
                return retried;
            }
        }

        log.warn("Failed to parse completion JSON. Sample: {}", TextLimits.truncate(content, 200));
        return Optional.empty();
    }

    /**
     * Remove ```json / ``` fences and any prose outside the outermost braces.
     */
    static String stripWrapping(String content) {
        String cleaned = content.trim();

        if (cleaned.regionMatches(true, 0, "```json", 0, 7)) {
            cleaned = cleaned.substring(7).trim();
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3).trim();
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3).trim();
        }

        if (!cleaned.startsWith("{")) {
            int first = cleaned.indexOf('{');
            int last = cleaned.lastIndexOf('}');
            if (first >= 0 && last > first) {
                cleaned = cleaned.substring(first, last + 1);
            }
        } else if (!cleaned.endsWith("}")) {
            int last = cleaned.lastIndexOf('}');
            if (last > 0) {
                cleaned = cleaned.substring(0, last + 1);
            }
        }
        return cleaned;
    }

    private Optional<JsonNode> readObject(String text) {
        try {
            JsonNode node = objectMapper.readTree(text.trim());
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}

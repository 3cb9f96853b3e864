package dev.sitesage.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns free-form model output into a {@link SummaryResponse}.
 * Prefers the JSON object the prompt asks for and falls back to reading plain text line by line.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmResponseParser {

    private static final Pattern LIST_MARKER = Pattern.compile("^(\\d+[.)]|[-*•])\\s*");

    private final ObjectMapper objectMapper;

    /**
     * @throws SummarizationException with reason INVALID_RESPONSE when no summary can be recovered
     */
    public SummaryResponse parse(String text) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                    "Model returned an empty response");
        }

        SummaryResponse fromJson = parseJson(text);
        if (fromJson != null && !isBlank(fromJson.summary())) {
            return fromJson;
        }

        SummaryResponse fromLines = parseLines(text);
        if (!isBlank(fromLines.summary())) {
            return fromLines;
        }

        throw new SummarizationException(SummarizationException.Reason.INVALID_RESPONSE,
                "Model response contained no summary");
    }

    private SummaryResponse parseJson(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            String summary = node.path("summary").asText("").trim();
            List<String> suggestions = new ArrayList<>();
            JsonNode suggestionsNode = node.path("suggestions");
            if (suggestionsNode.isArray()) {
                for (JsonNode item : suggestionsNode) {
                    if (item.isValueNode()) {
                        suggestions.add(item.asText());
                    }
                }
            }
            return new SummaryResponse(summary, suggestions);
        } catch (JsonProcessingException e) {
            log.debug("Model response is not valid JSON, falling back to line parsing: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Leading prose is the summary; list items, or anything after a "suggestions" heading, are suggestions.
     */
    private SummaryResponse parseLines(String text) {
        StringBuilder summary = new StringBuilder();
        List<String> suggestions = new ArrayList<>();
        boolean inSuggestions = false;

        for (String rawLine : text.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("```")) {
                continue;
            }

            String lower = line.toLowerCase(Locale.ROOT);
            if (lower.contains("suggestion") && line.endsWith(":")) {
                inSuggestions = true;
                continue;
            }

            boolean listItem = LIST_MARKER.matcher(line).find();
            if (listItem || inSuggestions) {
                inSuggestions = true;
                String cleaned = LIST_MARKER.matcher(line).replaceFirst("").trim();
                if (!cleaned.isEmpty()) {
                    suggestions.add(cleaned);
                }
            } else {
                String cleaned = line.replaceFirst("(?i)^summary\\s*:\\s*", "");
                if (summary.length() > 0) {
                    summary.append(' ');
                }
                summary.append(cleaned);
            }
        }

        return new SummaryResponse(summary.toString().trim(), suggestions);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import io.github.hide212131.langchain4j.incident.runtime.adapter.TextExtractor;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.ExtractionResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts host names, resource keywords, severity words and percentages from operator text.
 * Text with none of them yields {@link ExtractionResult#nothing()}.
 */
public final class KeywordTextExtractor implements TextExtractor {

    private static final Pattern HOST = Pattern.compile("\\b([a-z][a-z0-9]*(?:-[a-z0-9]+)*-\\d+)\\b");
    private static final Pattern PERCENT = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*%");
    private static final List<String> RESOURCES =
            List.of("cpu", "memory", "disk", "network", "latency", "error", "timeout", "down");
    private static final Map<String, List<String>> SEVERITY_WORDS = new LinkedHashMap<>();

    static {
        SEVERITY_WORDS.put("critical", List.of("critical", "urgent", "down", "outage"));
        SEVERITY_WORDS.put("high", List.of("high", "important", "exceed", "spike"));
        SEVERITY_WORDS.put("medium", List.of("medium", "moderate", "minor"));
        SEVERITY_WORDS.put("low", List.of("low", "notice", "warning"));
    }

    @Override
    public ExtractionResult extract(String text) {
        if (text == null || text.isBlank()) {
            return ExtractionResult.nothing();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        Set<String> words = new LinkedHashSet<>(List.of(lower.split("[^a-z0-9_%-]+")));

        List<String> tags = new ArrayList<>();
        for (String resource : RESOURCES) {
            if (words.contains(resource)) {
                tags.add(resource);
            }
        }
        String host = null;
        Matcher hostMatcher = HOST.matcher(lower);
        if (hostMatcher.find()) {
            host = hostMatcher.group(1);
        }
        if (tags.isEmpty() && host == null) {
            return ExtractionResult.nothing();
        }

        String severity = null;
        for (Map.Entry<String, List<String>> entry : SEVERITY_WORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(words::contains)) {
                severity = entry.getKey();
                break;
            }
        }
        Map<String, Object> metrics = new LinkedHashMap<>();
        Matcher percent = PERCENT.matcher(lower);
        if (percent.find()) {
            metrics.put("percentage", Double.parseDouble(percent.group(1)));
        }
        Map<String, Object> context = new LinkedHashMap<>();
        if (host != null) {
            context.put("host", host);
        }

        AlertInfo alert = null;
        List<String> symptoms = List.of();
        if (!tags.isEmpty()) {
            alert = new AlertInfo(
                    "nl-" + UUID.randomUUID().toString().substring(0, 8),
                    Instant.now(),
                    severity,
                    host != null ? host : "natural_language_input",
                    text.trim(),
                    metrics,
                    tags);
            symptoms = List.of(text.trim());
        }
        int signals = tags.size() + (host != null ? 1 : 0) + (severity != null ? 1 : 0);
        double confidence = Math.min(0.9, 0.3 + 0.2 * signals);
        return new ExtractionResult(alert, symptoms, context, confidence);
    }
}

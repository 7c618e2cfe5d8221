package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Keyword vocabulary shared by the rule-based adapters.
 */
enum IncidentCategory {
    CPU("cpu", List.of("cpu", "load", "processor", "throttl")),
    MEMORY("memory", List.of("memory", "oom", "heap", "swap", "leak")),
    DISK("disk", List.of("disk", "volume", "inode", "storage", "filesystem")),
    NETWORK("network", List.of("network", "latency", "packet", "dns", "connection", "timeout")),
    APPLICATION("application", List.of("error", "exception", "5xx", "crash", "down", "unavailable"));

    private final String label;
    private final List<String> keywords;

    IncidentCategory(String label, List<String> keywords) {
        this.label = label;
        this.keywords = keywords;
    }

    String label() {
        return label;
    }

    boolean matches(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(lower::contains);
    }

    long count(Collection<String> texts) {
        return texts.stream().filter(this::matches).count();
    }

    static IncidentCategory fromLabel(String label) {
        for (IncidentCategory category : values()) {
            if (category.label.equalsIgnoreCase(label)) {
                return category;
            }
        }
        return null;
    }

    /** Category with the most matching texts; ties go to declaration order. Null if nothing matches. */
    static IncidentCategory best(Collection<String> texts) {
        IncidentCategory best = null;
        long bestCount = 0;
        for (IncidentCategory category : values()) {
            long count = category.count(texts);
            if (count > bestCount) {
                best = category;
                bestCount = count;
            }
        }
        return best;
    }
}

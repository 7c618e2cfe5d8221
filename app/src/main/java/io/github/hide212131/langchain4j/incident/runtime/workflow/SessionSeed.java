package io.github.hide212131.langchain4j.incident.runtime.workflow;

import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.state.StateJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;

/**
 * Initial input of a session: free text, structured fields, or both. Problems found while
 * parsing a seed are kept and surface as invalid-input errors in the session instead of being
 * thrown at the caller.
 */
public record SessionSeed(String sessionId, String text, SeedFields fields, List<String> problems) {

    private static final ObjectMapper OBJECT_MAPPER = StateJson.objectMapper();

    public SessionSeed {
        fields = fields == null ? SeedFields.empty() : fields;
        problems = problems == null ? List.of() : List.copyOf(problems);
    }

    public static SessionSeed empty() {
        return new SessionSeed(null, null, SeedFields.empty(), List.of());
    }

    public static SessionSeed ofText(String text) {
        Objects.requireNonNull(text, "text");
        return new SessionSeed(null, text, SeedFields.empty(), List.of());
    }

    public static SessionSeed of(SeedFields fields) {
        return new SessionSeed(null, null, Objects.requireNonNull(fields, "fields"), List.of());
    }

    public static SessionSeed ofAlert(AlertInfo alert) {
        Objects.requireNonNull(alert, "alert");
        return of(new SeedFields(alert, null, null, null, null, null));
    }

    /**
     * Parses a JSON object with any of the {@link SeedFields} properties. Unknown properties and
     * malformed JSON are recorded as problems.
     */
    public static SessionSeed fromJson(String json) {
        if (json == null || json.isBlank()) {
            return empty();
        }
        try {
            SeedFields fields = OBJECT_MAPPER.readValue(json, SeedFields.class);
            return of(fields == null ? SeedFields.empty() : fields);
        } catch (JsonProcessingException e) {
            return new SessionSeed(null, null, SeedFields.empty(), List.of("invalid seed: " + e.getOriginalMessage()));
        }
    }

    public SessionSeed withSessionId(String value) {
        return new SessionSeed(value, text, fields, problems);
    }

    public SessionSeed withText(String value) {
        return new SessionSeed(sessionId, value, fields, problems);
    }
}

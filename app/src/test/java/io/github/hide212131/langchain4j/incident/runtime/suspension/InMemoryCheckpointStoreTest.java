package io.github.hide212131.langchain4j.incident.runtime.suspension;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.StepName;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryCheckpointStoreTest {

    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore();

    @Test
    void newCheckpointReplacesThePreviousOneOfTheSession() {
        Checkpoint first = checkpoint("s-1");
        Checkpoint second = checkpoint("s-1");

        store.save(first);
        store.save(second);

        assertThat(store.findBySession("s-1")).contains(second);
        assertThat(store.remove(first.token())).isEmpty();
        assertThat(store.all()).containsExactly(second);
    }

    @Test
    void removeByTokenClearsSessionIndex() {
        Checkpoint checkpoint = checkpoint("s-1");
        store.save(checkpoint);

        assertThat(store.remove(checkpoint.token())).contains(checkpoint);
        assertThat(store.findBySession("s-1")).isEmpty();
        assertThat(store.remove(checkpoint.token())).isEmpty();
    }

    @Test
    void removeBySession() {
        Checkpoint checkpoint = checkpoint("s-1");
        store.save(checkpoint);
        store.save(checkpoint("s-2"));

        assertThat(store.removeBySession("s-1")).contains(checkpoint);
        assertThat(store.all()).extracting(Checkpoint::sessionId).containsExactly("s-2");
    }

    private static Checkpoint checkpoint(String sessionId) {
        InformationRequest request = InformationRequest.missing(StepName.COLLECT_INFO, "incident-details", 0);
        return new Checkpoint(sessionId, ResumptionToken.random(), IncidentState.initial(sessionId),
                new CollectionPrompt("?", List.of(request)), Instant.parse("2024-05-01T10:00:00Z"));
    }
}

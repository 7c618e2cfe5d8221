package io.github.hide212131.langchain4j.incident.runtime.step;

import io.github.hide212131.langchain4j.incident.runtime.state.CollectionPrompt;
import io.github.hide212131.langchain4j.incident.runtime.state.StateUpdate;
import java.util.Objects;

/**
 * Result of running a step: either continue with the routing loop, or pause the session until
 * the operator answers.
 */
public sealed interface StepOutcome permits StepOutcome.Proceed, StepOutcome.Suspend {

    StateUpdate update();

    static StepOutcome proceed(StateUpdate update) {
        return new Proceed(update);
    }

    static StepOutcome suspend(StateUpdate update, CollectionPrompt prompt) {
        return new Suspend(update, prompt);
    }

    record Proceed(StateUpdate update) implements StepOutcome {
        public Proceed {
            Objects.requireNonNull(update, "update");
        }
    }

    record Suspend(StateUpdate update, CollectionPrompt prompt) implements StepOutcome {
        public Suspend {
            Objects.requireNonNull(update, "update");
            Objects.requireNonNull(prompt, "prompt");
        }
    }
}

package io.github.hide212131.langchain4j.incident.runtime.adapter.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.github.hide212131.langchain4j.incident.runtime.model.ExtractionResult;
import org.junit.jupiter.api.Test;

class KeywordTextExtractorTest {

    private final KeywordTextExtractor extractor = new KeywordTextExtractor();

    @Test
    void extractsAlertFromResourceHostAndSeverity() {
        ExtractionResult result = extractor.extract("CPU high on web-1");

        assertThat(result.alertInfo()).isNotNull();
        assertThat(result.alertInfo().id()).startsWith("nl-");
        assertThat(result.alertInfo().source()).isEqualTo("web-1");
        assertThat(result.alertInfo().severity()).isEqualTo("high");
        assertThat(result.alertInfo().tags()).containsExactly("cpu");
        assertThat(result.symptoms()).containsExactly("CPU high on web-1");
        assertThat(result.context()).containsEntry("host", "web-1");
        assertThat(result.confidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void recordsPercentageAsMetric() {
        ExtractionResult result = extractor.extract("disk at 93% somewhere");

        assertThat(result.alertInfo().metrics()).containsEntry("percentage", 93.0);
        assertThat(result.alertInfo().source()).isEqualTo("natural_language_input");
        assertThat(result.alertInfo().severity()).isEqualTo("unknown");
    }

    @Test
    void hostWithoutResourceOnlyAddsContext() {
        ExtractionResult result = extractor.extract("web-3 is acting weird");

        assertThat(result.alertInfo()).isNull();
        assertThat(result.symptoms()).isEmpty();
        assertThat(result.context()).containsEntry("host", "web-3");
    }

    @Test
    void textWithoutSignalsYieldsNothing() {
        assertThat(extractor.extract("hello").hasFindings()).isFalse();
        assertThat(extractor.extract("  ").hasFindings()).isFalse();
        assertThat(extractor.extract(null).hasFindings()).isFalse();
    }
}

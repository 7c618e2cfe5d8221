package io.github.hide212131.langchain4j.incident.runtime.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigurationLoaderTest {

    @Test
    @DisplayName("Without any source the built-in defaults apply")
    void defaultsWhenNothingConfigured() {
        EngineSettings settings = new EngineConfigurationLoader(Map.of(), emptyDotenv()).load();

        assertThat(settings).isEqualTo(EngineSettings.defaults());
        assertThat(settings.maxCycles()).isEqualTo(50);
        assertThat(settings.collectionCap()).isEqualTo(5);
        assertThat(settings.confidenceThreshold()).isEqualTo(0.6);
        assertThat(settings.checkpointTtl()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("The YAML file overrides defaults for the keys it names")
    void yamlOverridesDefaults() throws URISyntaxException {
        EngineSettings settings = new EngineConfigurationLoader(Map.of(), emptyDotenv()).load(fixture());

        assertThat(settings.maxCycles()).isEqualTo(20);
        assertThat(settings.collectionCap()).isEqualTo(3);
        assertThat(settings.confidenceThreshold()).isEqualTo(0.7);
        assertThat(settings.adapterTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.autoExecution()).isFalse();
        assertThat(settings.maxStepAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("Environment variables win over .env, which wins over YAML")
    void environmentWinsOverDotenvAndYaml(@TempDir Path tempDir) throws IOException, URISyntaxException {
        Files.writeString(
                tempDir.resolve(".env"),
                """
                INCIDENT_MAX_CYCLES=30
                INCIDENT_COLLECTION_CAP=4
                """,
                StandardCharsets.UTF_8);
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMalformed()
                .ignoreIfMissing()
                .directory(tempDir.toString())
                .load();

        EngineSettings settings = new EngineConfigurationLoader(
                        Map.of(EngineConfigurationLoader.ENV_MAX_CYCLES, "12",
                                EngineConfigurationLoader.ENV_AUTO_EXECUTION, "yes"),
                        dotenv)
                .load(fixture());

        assertThat(settings.maxCycles()).isEqualTo(12);
        assertThat(settings.collectionCap()).isEqualTo(4);
        assertThat(settings.confidenceThreshold()).isEqualTo(0.7);
        assertThat(settings.autoExecution()).isTrue();
    }

    @Test
    @DisplayName("A malformed value names the offending key")
    void malformedValueNamesKey() {
        EngineConfigurationLoader loader = new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_CONFIDENCE_THRESHOLD, "high"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("INCIDENT_CONFIDENCE_THRESHOLD");
    }

    @Test
    @DisplayName("Out-of-range values are reported as invalid configuration")
    void outOfRangeValueRejected() {
        EngineConfigurationLoader loader = new EngineConfigurationLoader(
                Map.of(EngineConfigurationLoader.ENV_CONFIDENCE_THRESHOLD, "1.5"), emptyDotenv());

        assertThatThrownBy(loader::load)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("confidenceThreshold");
    }

    @Test
    @DisplayName("A YAML file that is not a mapping is rejected")
    void yamlMustBeMapping(@TempDir Path tempDir) throws IOException {
        Path yaml = tempDir.resolve("engine.yaml");
        Files.writeString(yaml, "- just\n- a list\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new EngineConfigurationLoader(Map.of(), emptyDotenv()).load(yaml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mapping");
    }

    @Test
    @DisplayName("A missing YAML file is reported")
    void missingYamlFile(@TempDir Path tempDir) {
        Path missing = tempDir.resolve("absent.yaml");

        assertThatThrownBy(() -> new EngineConfigurationLoader(Map.of(), emptyDotenv()).load(missing))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }

    private static Path fixture() throws URISyntaxException {
        return Path.of(EngineConfigurationLoaderTest.class.getResource("/fixtures/engine-settings.yaml").toURI());
    }

    private static Dotenv emptyDotenv() {
        return Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();
    }
}

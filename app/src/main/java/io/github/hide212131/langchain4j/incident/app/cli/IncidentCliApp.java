package io.github.hide212131.langchain4j.incident.app.cli;

import io.github.hide212131.langchain4j.incident.runtime.adapter.ReasoningAdapters;
import io.github.hide212131.langchain4j.incident.runtime.adapter.llm.LlmAdapters;
import io.github.hide212131.langchain4j.incident.runtime.adapter.rules.SimulatedExecutionBackend;
import io.github.hide212131.langchain4j.incident.runtime.config.EngineConfigurationLoader;
import io.github.hide212131.langchain4j.incident.runtime.config.EngineSettings;
import io.github.hide212131.langchain4j.incident.runtime.config.LlmConfiguration;
import io.github.hide212131.langchain4j.incident.runtime.config.LlmConfigurationLoader;
import io.github.hide212131.langchain4j.incident.runtime.config.LlmProvider;
import io.github.hide212131.langchain4j.incident.runtime.model.AlertInfo;
import io.github.hide212131.langchain4j.incident.runtime.model.IncidentReport;
import io.github.hide212131.langchain4j.incident.runtime.provider.LlmReasoningClient;
import io.github.hide212131.langchain4j.incident.runtime.state.IncidentState;
import io.github.hide212131.langchain4j.incident.runtime.state.InformationRequest;
import io.github.hide212131.langchain4j.incident.runtime.state.SessionStatus;
import io.github.hide212131.langchain4j.incident.runtime.state.WorkflowError;
import io.github.hide212131.langchain4j.incident.runtime.workflow.IncidentWorkflowEngine;
import io.github.hide212131.langchain4j.incident.runtime.workflow.RunResult;
import io.github.hide212131.langchain4j.incident.runtime.workflow.SessionSeed;
import io.github.hide212131.langchain4j.incident.runtime.workflow.StageVisit;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Entry point that wires PicoCLI with the incident workflow engine.
 */
@Command(name = "incident", mixinStandardHelpOptions = true, exitCodeOnInvalidInput = 1,
        description = "Run the incident response workflow")
public final class IncidentCliApp implements Runnable {

    static final int EXIT_COMPLETED = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_NOT_COMPLETED = 2;

    public static void main(String[] args) {
        int exitCode = commandLineInstance().execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static CommandLine commandLineInstance() {
        return commandLineInstance(IncidentCliApp::createEngine, stdinAnswers());
    }

    static CommandLine commandLineInstance(EngineFactory engineFactory, AnswerSource answerSource) {
        CommandLine cmd = new CommandLine(new IncidentCliApp());
        cmd.addSubcommand("run", new RunCommand(engineFactory, answerSource));
        return cmd;
    }

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    static IncidentWorkflowEngine createEngine(boolean dryRun, EngineSettings settings) {
        ReasoningAdapters adapters = ReasoningAdapters.ruleBased();
        if (!dryRun) {
            LlmConfiguration configuration = new LlmConfigurationLoader().load();
            if (configuration.provider() == LlmProvider.OPENAI) {
                adapters = LlmAdapters.create(LlmReasoningClient.forOpenAi(configuration),
                        new SimulatedExecutionBackend());
            }
        }
        return IncidentWorkflowEngine.builder()
                .settings(settings)
                .adapters(adapters)
                .tracingFromEnvironment()
                .build();
    }

    private static AnswerSource stdinAnswers() {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return () -> {
            try {
                return reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("failed to read operator answer", e);
            }
        };
    }

    @Command(name = "run", exitCodeOnInvalidInput = 1, description = "Handle one incident from an alert or a description")
    static final class RunCommand implements Callable<Integer> {

        @Option(names = "--text", description = "Free-text incident description")
        String text;

        @Option(names = "--seed-file", description = "JSON file with initial session fields")
        Path seedFile;

        @Option(names = "--alert-id", description = "Alert identifier")
        String alertId;

        @Option(names = "--severity", description = "Alert severity (critical, high, medium, low)")
        String severity;

        @Option(names = "--message", description = "Alert message")
        String message;

        @Option(names = "--source", description = "Alerting system or host")
        String source;

        @Option(names = "--dry-run", description = "Use rule-based adapters without external API calls")
        boolean dryRun;

        @Option(names = "--config", description = "YAML file with engine settings")
        Path configFile;

        @Option(names = "--answer", description = "Scripted operator answer, used in order (repeatable)")
        List<String> answers;

        private final EngineFactory engineFactory;
        private final AnswerSource answerSource;

        @Spec
        CommandSpec commandSpec;

        RunCommand(EngineFactory engineFactory, AnswerSource answerSource) {
            this.engineFactory = engineFactory;
            this.answerSource = answerSource;
        }

        @Override
        public Integer call() {
            PrintWriter out = commandSpec.commandLine().getOut();
            PrintWriter err = commandSpec.commandLine().getErr();

            SessionSeed seed;
            EngineSettings settings;
            try {
                seed = buildSeed();
                settings = configFile != null
                        ? new EngineConfigurationLoader().load(configFile)
                        : new EngineConfigurationLoader().load();
            } catch (IllegalArgumentException | IllegalStateException e) {
                err.println("Error: " + e.getMessage());
                err.flush();
                return EXIT_USAGE;
            }
            if (seed == null) {
                err.println("Error: one of --text, --seed-file or --alert-id must be provided");
                err.flush();
                return EXIT_USAGE;
            }

            Deque<String> scripted = new ArrayDeque<>(answers == null ? List.of() : answers);
            try (IncidentWorkflowEngine engine = engineFactory.create(dryRun, settings)) {
                RunResult result = engine.start(seed);
                out.println("Session: " + result.sessionId());
                while (result instanceof RunResult.Waiting waiting) {
                    printPrompt(out, waiting);
                    String answer = scripted.isEmpty() ? answerSource.next() : scripted.poll();
                    if (answer == null) {
                        out.println("No operator input available; cancelling session");
                        engine.cancel(waiting.sessionId());
                        out.flush();
                        return EXIT_NOT_COMPLETED;
                    }
                    out.println("> " + answer);
                    result = engine.resume(waiting.token(), answer);
                }
                printStages(out, result.visitedStages());
                if (result instanceof RunResult.Completed completed) {
                    printOutcome(out, completed.state());
                    out.flush();
                    return completed.status() == SessionStatus.COMPLETED ? EXIT_COMPLETED : EXIT_NOT_COMPLETED;
                }
                out.println("Status: cancelled");
                out.flush();
                return EXIT_NOT_COMPLETED;
            }
        }

        private SessionSeed buildSeed() {
            SessionSeed seed = null;
            if (seedFile != null) {
                if (!Files.exists(seedFile)) {
                    throw new IllegalArgumentException("seed file not found: " + seedFile);
                }
                try {
                    seed = SessionSeed.fromJson(Files.readString(seedFile, StandardCharsets.UTF_8));
                } catch (IOException e) {
                    throw new IllegalStateException("failed to read seed file " + seedFile, e);
                }
            }
            if (alertId != null) {
                if (seed != null) {
                    throw new IllegalArgumentException("--seed-file and --alert-id cannot be combined");
                }
                seed = SessionSeed.ofAlert(new AlertInfo(alertId, Instant.now(), severity, source, message, null, null));
            }
            if (text != null && !text.isBlank()) {
                seed = seed == null ? SessionSeed.ofText(text) : seed.withText(text);
            }
            return seed;
        }

        private void printPrompt(PrintWriter out, RunResult.Waiting waiting) {
            out.println("Question: " + waiting.prompt().message());
            for (InformationRequest request : waiting.prompt().requests()) {
                out.println("  - [" + request.kind() + "] " + request.question());
            }
            out.flush();
        }

        private void printStages(PrintWriter out, List<StageVisit> visits) {
            if (visits.isEmpty()) {
                return;
            }
            out.println("Stages: " + visits.stream().map(StageVisit::stage).collect(Collectors.joining(" -> ")));
        }

        private void printOutcome(PrintWriter out, IncidentState state) {
            out.println("Status: " + state.status());
            out.println("Cycles: " + state.cycles());
            IncidentReport report = state.report();
            if (report != null) {
                out.println("Report: " + report.title() + " (" + report.status() + ")");
                out.println("Summary: " + report.summary());
                report.keyFindings().forEach(finding -> out.println("  * " + finding));
                if (!report.recommendations().isEmpty()) {
                    out.println("Recommendations:");
                    report.recommendations().forEach(item -> out.println("  - " + item));
                }
            }
            if (!state.errors().isEmpty()) {
                out.println("Errors:");
                for (WorkflowError error : state.errors()) {
                    out.println("  - " + error.kind() + " [" + error.source() + "] " + error.message());
                }
            }
        }
    }

    @FunctionalInterface
    interface EngineFactory {
        IncidentWorkflowEngine create(boolean dryRun, EngineSettings settings);
    }

    /** Supplies the next operator answer; {@code null} when no more input is available. */
    @FunctionalInterface
    interface AnswerSource {
        String next();
    }
}

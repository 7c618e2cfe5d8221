package io.github.hide212131.langchain4j.incident.infra.observability;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.http.trace.OtlpHttpSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configures OpenTelemetry span export over OTLP/HTTP with Basic authentication.
 *
 * <p>Supported environment variables:</p>
 * <ul>
 *   <li>INCIDENT_OTLP_ENDPOINT (required): OTLP HTTP traces endpoint.</li>
 *   <li>INCIDENT_OTLP_USERNAME / INCIDENT_OTLP_PASSWORD (required): Basic auth credentials.</li>
 *   <li>INCIDENT_SERVICE_NAME: service name resource attribute (defaults to incident-workflow-agent).</li>
 *   <li>INCIDENT_ENVIRONMENT: deployment environment label (defaults to "default").</li>
 * </ul>
 * Export stays disabled unless the endpoint and both credentials are present.
 */
public final class ObservabilityConfig {

    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityConfig.class);
    private static final String DEFAULT_SERVICE_NAME = "incident-workflow-agent";

    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;
    private final boolean enabled;

    private ObservabilityConfig(OpenTelemetry openTelemetry, Tracer tracer, boolean enabled) {
        this.openTelemetry = openTelemetry;
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static ObservabilityConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ObservabilityConfig fromEnvironment(EnvironmentVariables environment) {
        String endpoint = environment.get("INCIDENT_OTLP_ENDPOINT");
        if (endpoint == null || endpoint.isBlank()) {
            LOG.debug("OTLP endpoint is not configured; tracing disabled");
            return disabled();
        }

        String username = environment.get("INCIDENT_OTLP_USERNAME");
        String password = environment.get("INCIDENT_OTLP_PASSWORD");
        if (username == null || username.isBlank() || password == null || password.isBlank()) {
            LOG.warn("OTLP credentials are not fully configured; tracing disabled");
            return disabled();
        }

        String serviceName = environment.get("INCIDENT_SERVICE_NAME");
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = DEFAULT_SERVICE_NAME;
        }
        String environmentName = environment.get("INCIDENT_ENVIRONMENT");
        if (environmentName == null || environmentName.isBlank()) {
            environmentName = "default";
        }

        AttributesBuilder resourceAttributes = Attributes.builder()
                .put(AttributeKey.stringKey("service.name"), serviceName)
                .put(AttributeKey.stringKey("deployment.environment"), environmentName);
        Resource resource = Resource.getDefault().merge(Resource.create(resourceAttributes.build()));

        String encodedCredentials = Base64.getEncoder()
                .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        Map<String, String> headers = Map.of("Authorization", "Basic " + encodedCredentials);

        OtlpHttpSpanExporter spanExporter = OtlpHttpSpanExporter.builder()
                .setEndpoint(endpoint)
                .setTimeout(30, TimeUnit.SECONDS)
                .setHeaders(() -> headers)
                .build();

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
                .setResource(resource)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(openTelemetry::close, "opentelemetry-shutdown"));

        Tracer tracer = openTelemetry.getTracer(serviceName);
        return new ObservabilityConfig(openTelemetry, tracer, true);
    }

    public WorkflowTracer workflowTracer() {
        return new WorkflowTracer(tracer, enabled);
    }

    public OpenTelemetry openTelemetry() {
        return openTelemetry;
    }

    public Tracer tracer() {
        return tracer;
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static ObservabilityConfig disabled() {
        OpenTelemetry noop = OpenTelemetry.noop();
        return new ObservabilityConfig(noop, noop.getTracer("noop"), false);
    }

    @FunctionalInterface
    interface EnvironmentVariables {
        String get(String key);
    }
}

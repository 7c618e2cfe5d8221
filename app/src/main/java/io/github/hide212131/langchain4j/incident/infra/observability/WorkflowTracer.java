package io.github.hide212131.langchain4j.incident.infra.observability;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Creates spans around a session drive and around each routed step.
 */
public final class WorkflowTracer {

    private final Tracer tracer;
    private final boolean enabled;

    public WorkflowTracer(Tracer tracer, boolean enabled) {
        this.tracer = tracer;
        this.enabled = enabled;
    }

    public static WorkflowTracer disabled() {
        return new WorkflowTracer(io.opentelemetry.api.OpenTelemetry.noop().getTracer("noop"), false);
    }

    /**
     * Executes an operation inside a span. Exceptions are recorded on the span and rethrown.
     */
    public <T> T trace(String operationName, Map<String, Object> attributes, Supplier<T> operation) {
        if (!enabled) {
            return operation.get();
        }

        SpanBuilder builder = tracer.spanBuilder(operationName).setSpanKind(SpanKind.INTERNAL);
        Span span = builder.startSpan();
        applyAttributes(span, attributes);

        try (Scope scope = span.makeCurrent()) {
            T result = operation.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Adds an event to the current span, e.g. a suspension or a forced termination.
     */
    public void addEvent(String eventName, Map<String, String> attributes) {
        if (!enabled) {
            return;
        }
        Span currentSpan = Span.current();
        if (!currentSpan.isRecording()) {
            return;
        }
        if (attributes == null || attributes.isEmpty()) {
            currentSpan.addEvent(eventName);
            return;
        }
        AttributesBuilder builder = Attributes.builder();
        attributes.forEach(builder::put);
        currentSpan.addEvent(eventName, builder.build());
    }

    public boolean isEnabled() {
        return enabled;
    }

    private static void applyAttributes(Span span, Map<String, Object> attributes) {
        if (attributes == null) {
            return;
        }
        attributes.forEach((key, value) -> {
            if (value instanceof String str) {
                span.setAttribute(key, str);
            } else if (value instanceof Long l) {
                span.setAttribute(key, l);
            } else if (value instanceof Integer i) {
                span.setAttribute(key, i.longValue());
            } else if (value instanceof Double d) {
                span.setAttribute(key, d);
            } else if (value instanceof Boolean b) {
                span.setAttribute(key, b);
            } else if (value != null) {
                span.setAttribute(key, value.toString());
            }
        });
    }
}

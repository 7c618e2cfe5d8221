package io.github.hide212131.langchain4j.incident.infra.logging;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around SLF4J shared by the engine, the steps and the adapter invoker so that all
 * workflow output lands under one logger category per component.
 */
public final class WorkflowLogger {

    private final Logger logger;

    public WorkflowLogger() {
        this(WorkflowLogger.class);
    }

    public WorkflowLogger(Class<?> component) {
        this.logger = LoggerFactory.getLogger(Objects.requireNonNull(component, "component"));
    }

    public WorkflowLogger forComponent(Class<?> component) {
        return new WorkflowLogger(component);
    }

    public void info(String message, Object... args) {
        logger.info(message, args);
    }

    public void debug(String message, Object... args) {
        logger.debug(message, args);
    }

    public void warn(String message, Object... args) {
        logger.warn(message, args);
    }

    public void error(String message, Object... args) {
        logger.error(message, args);
    }

    public boolean isDebugEnabled() {
        return logger.isDebugEnabled();
    }
}

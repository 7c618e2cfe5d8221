package io.github.hide212131.langchain4j.incident.runtime.adapter;

/**
 * Checked failure reported by a reasoning adapter implementation.
 */
public class AdapterException extends Exception {

    private static final long serialVersionUID = 1L;

    public AdapterException(String message) {
        super(message);
    }

    public AdapterException(String message, Throwable cause) {
        super(message, cause);
    }
}

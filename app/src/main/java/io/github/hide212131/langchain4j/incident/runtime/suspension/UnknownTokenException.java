package io.github.hide212131.langchain4j.incident.runtime.suspension;

/**
 * Raised when a resumption token does not belong to a waiting session: it was already used, the
 * session was cancelled, or the checkpoint expired.
 */
public class UnknownTokenException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UnknownTokenException(ResumptionToken token) {
        super("No suspended session for token " + token);
    }
}

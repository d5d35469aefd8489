package com.jreinhal.askdocs.retrieval;

/**
 * A retrieval backend errored, timed out or returned a reference the catalog does not hold.
 */
public class RetrievalUnavailableException extends RuntimeException {
    private final RetrievalMethod method;

    public RetrievalUnavailableException(RetrievalMethod method, String message) {
        super(message);
        this.method = method;
    }

    public RetrievalUnavailableException(RetrievalMethod method, String message, Throwable cause) {
        super(message, cause);
        this.method = method;
    }

    /**
     * @return the failing backend, or {@code null} when every backend failed
     */
    public RetrievalMethod getMethod() {
        return this.method;
    }
}

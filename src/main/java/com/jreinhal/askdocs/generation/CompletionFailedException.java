package com.jreinhal.askdocs.generation;

public class CompletionFailedException extends RuntimeException {
    private final boolean timedOut;

    public CompletionFailedException(String message, Throwable cause, boolean timedOut) {
        super(message, cause);
        this.timedOut = timedOut;
    }

    public boolean isTimedOut() {
        return this.timedOut;
    }
}

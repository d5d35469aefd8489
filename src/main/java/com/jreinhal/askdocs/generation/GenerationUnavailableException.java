package com.jreinhal.askdocs.generation;

/**
 * The completion backend could not produce an answer within the retry bound.
 */
public class GenerationUnavailableException extends RuntimeException {
    private final int attempts;

    public GenerationUnavailableException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return this.attempts;
    }
}

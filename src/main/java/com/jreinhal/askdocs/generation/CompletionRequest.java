package com.jreinhal.askdocs.generation;

import java.time.Duration;

/**
 * One call to the completion backend.
 *
 * @param timeout upper bound for the call; the call is abandoned when it elapses
 */
public record CompletionRequest(String system, String user, int maxTokens, double temperature, Duration timeout) {
}

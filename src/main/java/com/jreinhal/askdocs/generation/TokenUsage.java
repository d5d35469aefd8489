package com.jreinhal.askdocs.generation;

public record TokenUsage(int promptTokens, int completionTokens) {
    public static final TokenUsage NONE = new TokenUsage(0, 0);

    public int totalTokens() {
        return this.promptTokens + this.completionTokens;
    }
}

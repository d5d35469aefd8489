package com.jreinhal.askdocs.generation;

public record GeneratedAnswer(String text, TokenUsage usage, int attempts) {
}

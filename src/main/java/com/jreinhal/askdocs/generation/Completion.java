package com.jreinhal.askdocs.generation;

public record Completion(String text, TokenUsage usage) {
}

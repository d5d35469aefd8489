package com.jreinhal.askdocs.rerank;

public class RerankUnavailableException extends RuntimeException {

    public RerankUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

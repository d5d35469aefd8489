package com.jreinhal.askdocs.pipeline;

/**
 * The request deadline elapsed before the named stage could complete.
 */
public class DeadlineExceededException extends RuntimeException {
    private final String stage;

    public DeadlineExceededException(String stage) {
        super("Request deadline exceeded during " + stage);
        this.stage = stage;
    }

    public String getStage() {
        return this.stage;
    }
}

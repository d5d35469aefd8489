package com.jreinhal.askdocs.pipeline;

public enum StageStatus {
    SUCCESS,
    DEGRADED,
    FAILED
}

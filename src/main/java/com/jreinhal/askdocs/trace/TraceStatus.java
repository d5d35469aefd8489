package com.jreinhal.askdocs.trace;

public enum TraceStatus {
    RUNNING,
    SUCCEEDED,
    DEGRADED,
    FAILED
}

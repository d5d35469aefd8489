package com.jreinhal.askdocs.trace;

public interface TraceExporter {

    void export(TraceSnapshot trace);
}

package com.jreinhal.askdocs.util;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SimpleCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(SimpleCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final int halfOpenMaxCalls;
    private final Duration openDuration;
    private final Clock clock;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger halfOpenCalls = new AtomicInteger(0);
    private volatile long openUntilEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls) {
        this(name, failureThreshold, openDuration, halfOpenMaxCalls, Clock.systemUTC());
    }

    public SimpleCircuitBreaker(String name, int failureThreshold, Duration openDuration, int halfOpenMaxCalls, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null ? Duration.ofSeconds(30) : openDuration;
        this.halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
        this.clock = clock;
    }

    public boolean allowRequest() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = this.clock.millis();
        if (this.state == State.OPEN) {
            if (now < this.openUntilEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.openUntilEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.halfOpenCalls.set(0);
                    log.info("Circuit '{}' half-open, probing backend", this.name);
                }
            }
        }
        return this.halfOpenCalls.incrementAndGet() <= this.halfOpenMaxCalls;
    }

    public void recordSuccess() {
        if (this.state == State.CLOSED) {
            this.failureCount.set(0);
            return;
        }
        synchronized (this) {
            this.state = State.CLOSED;
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
            this.openUntilEpochMs = 0L;
        }
        log.info("Circuit '{}' closed", this.name);
    }

    public void recordFailure(Throwable error) {
        if (this.state == State.HALF_OPEN) {
            this.openCircuit(error);
            return;
        }
        int failures = this.failureCount.incrementAndGet();
        if (failures >= this.failureThreshold) {
            this.openCircuit(error);
        }
    }

    public State getState() {
        return this.state;
    }

    public String getName() {
        return this.name;
    }

    private void openCircuit(Throwable error) {
        synchronized (this) {
            this.state = State.OPEN;
            this.openUntilEpochMs = this.clock.millis() + this.openDuration.toMillis();
            this.failureCount.set(0);
            this.halfOpenCalls.set(0);
        }
        log.warn("Circuit '{}' opened for {}ms after failure: {}", this.name, this.openDuration.toMillis(),
                error != null ? error.getClass().getSimpleName() : "unknown");
    }
}

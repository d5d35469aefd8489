package com.jreinhal.askdocs.pipeline;

/**
 * Outcome of a pipeline stage that may degrade instead of failing. A failed result carries no
 * value; callers decide whether the query can go on without it.
 */
public record StageResult<T>(StageStatus status, T value, String message) {

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(StageStatus.SUCCESS, value, null);
    }

    public static <T> StageResult<T> degraded(T value, String message) {
        return new StageResult<>(StageStatus.DEGRADED, value, message);
    }

    public static <T> StageResult<T> failed(String message) {
        return new StageResult<>(StageStatus.FAILED, null, message);
    }

    public boolean isFailed() {
        return this.status == StageStatus.FAILED;
    }

    public boolean isDegraded() {
        return this.status == StageStatus.DEGRADED;
    }
}

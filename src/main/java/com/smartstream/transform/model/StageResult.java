package com.smartstream.transform.model;

import java.util.Objects;

/**
 * Outcome of one pipeline stage for one value: the value it produced, a skip with a reason
 * (the value is dropped and processing continues), or a fatal failure for the whole object.
 *
 * @param <T> the type of value produced on success
 */
public final class StageResult<T> {

    private enum Kind { OK, SKIP, FATAL }

    private final Kind kind;
    private final T value;
    private final String reason;
    private final Throwable cause;

    private StageResult(Kind kind, T value, String reason, Throwable cause) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
        this.cause = cause;
    }

    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(Kind.OK, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StageResult<T> skip(String reason) {
        return new StageResult<>(Kind.SKIP, null, reason, null);
    }

    public static <T> StageResult<T> fatal(String reason, Throwable cause) {
        return new StageResult<>(Kind.FATAL, null, reason, cause);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    public boolean isSkip() {
        return kind == Kind.SKIP;
    }

    public boolean isFatal() {
        return kind == Kind.FATAL;
    }

    /**
     * Returns the value, or throws if this result is not OK.
     */
    public T orElseThrow() {
        if (kind != Kind.OK) {
            throw new IllegalStateException("No value for " + this);
        }
        return value;
    }

    /**
     * Returns why the value was skipped or failed; null when OK.
     */
    public String getReason() { return reason; }

    public Throwable getCause() { return cause; }

    @Override
    public String toString() {
        switch (kind) {
            case OK:
                return "StageResult.ok(" + value + ")";
            case SKIP:
                return "StageResult.skip(" + reason + ")";
            default:
                return "StageResult.fatal(" + reason + ")";
        }
    }
}

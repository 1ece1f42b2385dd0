package com.usdtgate.chain;

import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Outcome of a chain read: the value, a genuine absence, or a read failure.
 * Callers branch on the kind; an unavailable read must never be treated as "not found".
 */
public final class ChainResult<T> {

    public enum Kind {
        FOUND,
        NOT_FOUND,
        UNAVAILABLE
    }

    private static final ChainResult<?> NOT_FOUND = new ChainResult<>(Kind.NOT_FOUND, null, null);

    private final Kind kind;
    private final T value;
    private final String failureReason;

    private ChainResult(Kind kind, T value, String failureReason) {
        this.kind = kind;
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> ChainResult<T> found(T value) {
        if (value == null) {
            throw new IllegalArgumentException("found value must not be null");
        }
        return new ChainResult<>(Kind.FOUND, value, null);
    }

    @SuppressWarnings("unchecked")
    public static <T> ChainResult<T> notFound() {
        return (ChainResult<T>) NOT_FOUND;
    }

    public static <T> ChainResult<T> unavailable(String reason) {
        return new ChainResult<>(Kind.UNAVAILABLE, null, reason != null ? reason : "unknown");
    }

    public Kind kind() {
        return kind;
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }

    public boolean isUnavailable() {
        return kind == Kind.UNAVAILABLE;
    }

    public T value() {
        if (kind != Kind.FOUND) {
            throw new NoSuchElementException("No value for " + kind);
        }
        return value;
    }

    public String failureReason() {
        return failureReason;
    }

    /** Maps a found value; NOT_FOUND and UNAVAILABLE pass through with their reason. */
    public <R> ChainResult<R> map(Function<? super T, ? extends R> mapper) {
        if (kind == Kind.FOUND) {
            return found(mapper.apply(value));
        }
        if (kind == Kind.NOT_FOUND) {
            return notFound();
        }
        return unavailable(failureReason);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case FOUND -> "FOUND(" + value + ")";
            case NOT_FOUND -> "NOT_FOUND";
            case UNAVAILABLE -> "UNAVAILABLE(" + failureReason + ")";
        };
    }
}

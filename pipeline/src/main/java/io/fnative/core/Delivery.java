package io.fnative.core;

import io.fnative.error.ComputationException;

import java.util.Objects;

/**
 * Outcome of one pull from a scheduler: a value, a failure, or the end of the sequence.
 */
public final class Delivery<T> {
    public enum Kind { VALUE, FAILURE, DONE }

    private static final Delivery<?> DONE = new Delivery<>(Kind.DONE, -1, null, null);

    private final Kind kind;
    private final long index;
    private final T value;
    private final ComputationException error;

    private Delivery(Kind kind, long index, T value, ComputationException error) {
        this.kind = kind;
        this.index = index;
        this.value = value;
        this.error = error;
    }

    public static <T> Delivery<T> value(long index, T value) { return new Delivery<>(Kind.VALUE, index, value, null); }

    public static <T> Delivery<T> failure(ComputationException error) {
        Objects.requireNonNull(error, "error");
        return new Delivery<>(Kind.FAILURE, error.index(), null, error);
    }

    @SuppressWarnings("unchecked")
    public static <T> Delivery<T> done() { return (Delivery<T>) DONE; }

    public Kind kind() { return kind; }
    public boolean isValue() { return kind == Kind.VALUE; }
    public boolean isFailure() { return kind == Kind.FAILURE; }
    public boolean isDone() { return kind == Kind.DONE; }

    /** Index of the delivered value or of the failing unit; -1 for {@link Kind#DONE}. */
    public long index() { return index; }

    public T value() {
        if (kind != Kind.VALUE) throw new IllegalStateException("no value in " + kind + " delivery");
        return value;
    }

    public ComputationException error() {
        if (kind != Kind.FAILURE) throw new IllegalStateException("no error in " + kind + " delivery");
        return error;
    }

    @Override
    public String toString() {
        switch (kind) {
            case VALUE: return "Delivery{index=" + index + ", value=" + value + '}';
            case FAILURE: return "Delivery{index=" + index + ", error=" + error.getCause() + '}';
            default: return "Delivery{done}";
        }
    }
}

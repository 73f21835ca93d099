package io.fnative.error;

/**
 * A work source reported a failure for one index. Raised to the consumer when the delivery
 * cursor reaches that index.
 */
public class ComputationException extends RuntimeException {
    private final long index;

    public ComputationException(long index, Throwable cause) {
        super("computation failed at index " + index + ": " + cause, cause);
        this.index = index;
    }

    public long index() { return index; }
}

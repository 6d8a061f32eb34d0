package com.dataflow.sdg.api;

/**
 * Upper bound on simultaneous invocations of one node across all scope
 * instances in flight.
 *
 * @param value maximum number of concurrent invocations
 */
public record Concurrency(int value) {
    /** At most one invocation at a time. */
    public static final Concurrency SERIAL = new Concurrency(1);

    /** No bound beyond the size of the worker pool. */
    public static final Concurrency UNLIMITED = new Concurrency(Integer.MAX_VALUE);

    public Concurrency {
        if (value < 1)
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + value);
    }

    public static Concurrency of(int value) {
        return new Concurrency(value);
    }

    public boolean isSerial() {
        return value == 1;
    }

    public boolean isUnlimited() {
        return value == Integer.MAX_VALUE;
    }

    @Override
    public String toString() {
        if (isUnlimited())
            return "unlimited";
        return isSerial() ? "serial" : Integer.toString(value);
    }
}

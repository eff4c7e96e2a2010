package com.dkr.optimizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * AF improvement per centisecond of time investment.
 * {@link #INFINITE} marks free improvements (N/A tracks) and orders above every finite value.
 */
public final class Efficiency implements Comparable<Efficiency> {

    public static final Efficiency INFINITE = new Efficiency(0.0, true);
    public static final Efficiency ZERO = new Efficiency(0.0, false);

    private final double value;
    private final boolean infinite;

    private Efficiency(double value, boolean infinite) {
        this.value = value;
        this.infinite = infinite;
    }

    public static Efficiency of(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Finite efficiency expected, got " + value);
        }
        return new Efficiency(value, false);
    }

    public boolean isInfinite() { return infinite; }

    /** Finite value; throws for {@link #INFINITE}. */
    public double getValue() {
        if (infinite) throw new IllegalStateException("Infinite efficiency has no finite value");
        return value;
    }

    @Override
    public int compareTo(Efficiency other) {
        if (infinite || other.infinite) {
            return Boolean.compare(infinite, other.infinite);
        }
        return Double.compare(value, other.value);
    }

    public boolean isGreaterThan(Efficiency other) {
        return compareTo(other) > 0;
    }

    // "inf" or the raw number
    @JsonValue
    public Object toJson() {
        return infinite ? "inf" : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Efficiency e)) return false;
        return infinite == e.infinite && (infinite || Double.compare(value, e.value) == 0);
    }

    @Override
    public int hashCode() {
        return infinite ? Boolean.hashCode(true) : Double.hashCode(value);
    }

    @Override
    public String toString() {
        return infinite ? "inf" : Double.toString(value);
    }
}

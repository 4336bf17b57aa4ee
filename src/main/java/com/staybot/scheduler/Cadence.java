package com.staybot.scheduler;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * How often a task should run: an amount of a time unit.
 */
public final class Cadence {
    private final long amount;
    private final TimeUnit unit;

    private Cadence(long amount, TimeUnit unit) {
        if (amount <= 0) {
            throw new IllegalArgumentException("cadence amount must be positive, got " + amount);
        }
        if (unit == null) {
            throw new IllegalArgumentException("cadence unit must not be null");
        }
        this.amount = amount;
        this.unit = unit;
    }

    public static Cadence seconds(long amount) {
        return new Cadence(amount, TimeUnit.SECONDS);
    }

    public static Cadence minutes(long amount) {
        return new Cadence(amount, TimeUnit.MINUTES);
    }

    public static Cadence hours(long amount) {
        return new Cadence(amount, TimeUnit.HOURS);
    }

    public static Cadence days(long amount) {
        return new Cadence(amount, TimeUnit.DAYS);
    }

    public Duration toDuration() {
        return Duration.ofMillis(unit.toMillis(amount));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cadence)) {
            return false;
        }
        Cadence other = (Cadence) o;
        return amount == other.amount && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(amount) * 31 + unit.hashCode();
    }

    @Override
    public String toString() {
        return amount + " " + unit.name().toLowerCase(Locale.ROOT);
    }
}

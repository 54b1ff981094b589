package com.gillianbc.wealth.model.event;

import lombok.Getter;

import java.util.Objects;

/**
 * A discrete intervention applied at the end of a given simulation year, on top of that year's
 * organic growth. Year 0 is the starting position: the stochastic engine first applies events in year 1,
 * while the cash-flow table shows year 0 events in its first row.
 */
@Getter
public abstract class FinancialEvent {

    private final String name;
    private final int year;

    protected FinancialEvent(String name, int year) {
        Objects.requireNonNull(name, "name must not be null");
        if (year < 0) {
            throw new IllegalArgumentException("year must be >= 0");
        }
        this.name = name;
        this.year = year;
    }

    public abstract EventType getType();

    public abstract <R> R accept(FinancialEventVisitor<R> visitor);

    /**
     * Label shown in the cash-flow table; falls back to the type key when the name is blank.
     */
    public String displayName() {
        return name.isBlank() ? getType().key() : name;
    }

    static double requireNonNegative(double value, String field) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(field + " must be a finite amount >= 0");
        }
        return value;
    }

    static double requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be finite");
        }
        return value;
    }

    @Override
    public String toString() {
        return getType().key() + "[" + name + ", year " + year + "]";
    }
}
